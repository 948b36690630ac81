package com.siy.style.service;

import com.siy.style.catalog.StyleTaxonomy;
import com.siy.style.catalog.StyleTaxonomy.SubCategory;
import com.siy.style.domain.CategoryL1;
import com.siy.style.dto.CategoryTaxonomyResponse;
import com.siy.style.dto.TaxonomyResponse;
import java.util.Arrays;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class TaxonomyService {

    public TaxonomyResponse getTaxonomy() {
        List<CategoryTaxonomyResponse> categories = Arrays.stream(CategoryL1.values())
            .map(category -> new CategoryTaxonomyResponse(
                category.label(),
                StyleTaxonomy.subCategories(category).stream().map(SubCategory::name).toList()
            ))
            .toList();

        return new TaxonomyResponse(categories, StyleTaxonomy.formalityLevels(), StyleTaxonomy.aestheticTags());
    }
}

package com.siy.style.controller;

import com.siy.style.dto.TaxonomyResponse;
import com.siy.style.service.TaxonomyService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/taxonomy")
public class TaxonomyController {

    private final TaxonomyService taxonomyService;

    public TaxonomyController(TaxonomyService taxonomyService) {
        this.taxonomyService = taxonomyService;
    }

    @GetMapping
    public TaxonomyResponse getTaxonomy() {
        return taxonomyService.getTaxonomy();
    }
}

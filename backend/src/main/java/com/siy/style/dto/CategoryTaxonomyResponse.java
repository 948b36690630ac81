package com.siy.style.dto;

import java.util.List;

public record CategoryTaxonomyResponse(String l1, List<String> l2) {
}

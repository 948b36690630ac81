package com.siy.style.domain;

import java.util.List;

public record InventoryMatchResult(List<RankedItem> items, int totalInCategory) {

    public InventoryMatchResult {
        items = List.copyOf(items);
    }
}

package com.siy.style.dto;

import java.util.List;

public record MatchingItemsResponse(
    List<ClosetItemResponse> items,
    int totalInCategory
) {
}

package com.siy.style.dto;

import com.siy.style.domain.Category;
import com.siy.style.domain.GarmentColor;
import java.time.Instant;
import java.util.Set;

public record ClosetItemResponse(
    String id,
    String imageUrl,
    GarmentColor color,
    Category category,
    double formality,
    Set<String> aesthetics,
    int matchScore,
    Instant createdAt
) {
}

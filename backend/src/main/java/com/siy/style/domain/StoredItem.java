package com.siy.style.domain;

import java.time.Instant;

/**
 * An item from the user's closet as seen by inventory matching.
 */
public record StoredItem(
    String id,
    ClothingAttributes attributes,
    String imageUrl,
    Instant createdAt
) {
}

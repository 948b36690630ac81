package com.siy.style.domain;

public record RankedItem(StoredItem item, int score) {
}

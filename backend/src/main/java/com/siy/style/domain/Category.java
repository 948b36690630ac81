package com.siy.style.domain;

public record Category(CategoryL1 l1, String l2) {

    public Category {
        if (l1 == null) {
            throw new StyleEngineException(StyleErrorCode.UNKNOWN_CATEGORY, "l1 is missing");
        }
        l2 = l2 == null ? "" : l2.trim();
    }
}

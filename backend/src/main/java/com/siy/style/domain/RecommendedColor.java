package com.siy.style.domain;

public record RecommendedColor(String hex, String name, HarmonyType harmonyType) {
}

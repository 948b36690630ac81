package com.siy.style.catalog;

import com.siy.style.domain.HarmonyType;
import com.siy.style.domain.RecommendedColor;
import java.util.List;

public final class HarmonyPalettes {

    // black, white, gray, beige, then navy as the quasi-neutral
    private static final List<RecommendedColor> NEUTRALS = List.of(
        new RecommendedColor("#000000", "Black", HarmonyType.NEUTRAL),
        new RecommendedColor("#FFFFFF", "White", HarmonyType.NEUTRAL),
        new RecommendedColor("#808080", "Gray", HarmonyType.NEUTRAL),
        new RecommendedColor("#F5F5DC", "Beige", HarmonyType.NEUTRAL),
        new RecommendedColor("#0B1C2D", "Navy", HarmonyType.NEUTRAL)
    );

    // Offered instead of hue rotations when the base color is neutral. A hue-less base has no
    // rotation to compute, so these are contrast pieces against it and carry the complementary tag.
    private static final List<RecommendedColor> NEUTRAL_BASE_ACCENTS = List.of(
        new RecommendedColor("#800020", "Burgundy", HarmonyType.COMPLEMENTARY),
        new RecommendedColor("#708238", "Olive", HarmonyType.COMPLEMENTARY),
        new RecommendedColor("#E1AD01", "Mustard", HarmonyType.COMPLEMENTARY),
        new RecommendedColor("#008080", "Teal", HarmonyType.COMPLEMENTARY),
        new RecommendedColor("#0047AB", "Cobalt", HarmonyType.COMPLEMENTARY),
        new RecommendedColor("#C08081", "Dusty Rose", HarmonyType.COMPLEMENTARY)
    );

    private HarmonyPalettes() {
    }

    public static List<RecommendedColor> neutrals() {
        return NEUTRALS;
    }

    public static List<RecommendedColor> neutralBaseAccents() {
        return NEUTRAL_BASE_ACCENTS;
    }
}

package com.siy.style.catalog;

import com.siy.style.domain.Hsl;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fashion color names keyed by hue family and lightness band. Combinations without an
 * entry resolve to {@link #FALLBACK_NAME}; naming never fails.
 */
public final class ColorNameTable {

    public static final String FALLBACK_NAME = "Custom Color";

    private static final double ACHROMATIC_SATURATION_MAX = 10;
    private static final Map<HueFamily, Map<LightnessBand, String>> NAMES = buildNames();

    private ColorNameTable() {
    }

    public static String nameFor(Hsl hsl) {
        if (hsl.lightness() < 8) {
            return "Black";
        }
        if (hsl.lightness() > 95) {
            return "White";
        }
        if (hsl.saturation() < ACHROMATIC_SATURATION_MAX) {
            return achromaticName(hsl.lightness());
        }

        Map<LightnessBand, String> byBand = NAMES.get(HueFamily.of(hsl.hue()));
        if (byBand == null) {
            return FALLBACK_NAME;
        }
        return byBand.getOrDefault(LightnessBand.of(hsl.lightness()), FALLBACK_NAME);
    }

    private static String achromaticName(double lightness) {
        if (lightness < 15) {
            return "Black";
        }
        if (lightness < 35) {
            return "Charcoal";
        }
        if (lightness < 65) {
            return "Gray";
        }
        if (lightness < 90) {
            return "Light Gray";
        }
        return "White";
    }

    enum HueFamily {
        RED, ORANGE, YELLOW, LIME, GREEN, TEAL, CYAN, BLUE, INDIGO, PURPLE, MAGENTA, PINK;

        static HueFamily of(double hue) {
            if (hue < 15 || hue >= 345) {
                return RED;
            }
            if (hue < 45) {
                return ORANGE;
            }
            if (hue < 65) {
                return YELLOW;
            }
            if (hue < 80) {
                return LIME;
            }
            if (hue < 160) {
                return GREEN;
            }
            if (hue < 190) {
                return TEAL;
            }
            if (hue < 210) {
                return CYAN;
            }
            if (hue < 250) {
                return BLUE;
            }
            if (hue < 270) {
                return INDIGO;
            }
            if (hue < 290) {
                return PURPLE;
            }
            if (hue < 320) {
                return MAGENTA;
            }
            return PINK;
        }
    }

    enum LightnessBand {
        DARK, MID, LIGHT;

        static LightnessBand of(double lightness) {
            if (lightness < 35) {
                return DARK;
            }
            return lightness <= 65 ? MID : LIGHT;
        }
    }

    private static Map<HueFamily, Map<LightnessBand, String>> buildNames() {
        Map<HueFamily, Map<LightnessBand, String>> names = new EnumMap<>(HueFamily.class);
        names.put(HueFamily.RED, bands("Burgundy", "Red", "Rose"));
        names.put(HueFamily.ORANGE, bands("Brown", "Orange", "Peach"));
        names.put(HueFamily.YELLOW, bands("Olive", "Mustard", "Butter"));
        names.put(HueFamily.LIME, bands(null, "Lime", "Pistachio"));
        names.put(HueFamily.GREEN, bands("Forest Green", "Green", "Mint"));
        names.put(HueFamily.TEAL, bands("Dark Teal", "Teal", "Seafoam"));
        names.put(HueFamily.CYAN, bands(null, "Cyan", "Aqua"));
        names.put(HueFamily.BLUE, bands("Navy", "Blue", "Light Blue"));
        names.put(HueFamily.INDIGO, bands("Midnight", "Indigo", "Periwinkle"));
        names.put(HueFamily.PURPLE, bands("Plum", "Purple", "Lavender"));
        names.put(HueFamily.MAGENTA, bands("Aubergine", "Magenta", "Orchid"));
        names.put(HueFamily.PINK, bands("Berry", "Pink", "Blush"));
        return Collections.unmodifiableMap(names);
    }

    private static Map<LightnessBand, String> bands(String dark, String mid, String light) {
        Map<LightnessBand, String> byBand = new EnumMap<>(LightnessBand.class);
        if (dark != null) {
            byBand.put(LightnessBand.DARK, dark);
        }
        byBand.put(LightnessBand.MID, mid);
        byBand.put(LightnessBand.LIGHT, light);
        return Collections.unmodifiableMap(byBand);
    }
}

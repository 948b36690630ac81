package com.siy.style.engine;

import com.siy.style.catalog.ColorNameTable;
import com.siy.style.catalog.HarmonyPalettes;
import com.siy.style.domain.GarmentColor;
import com.siy.style.domain.HarmonyType;
import com.siy.style.domain.Hsl;
import com.siy.style.domain.RecommendedColor;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Produces colors that harmonize with a base color and measures how far a color strays
 * from that harmony set.
 *
 * <p>Candidates are always returned in the order complementary, analogous (+, -),
 * triadic (+, -), neutrals. A neutral base has no meaningful hue, so it gets the curated
 * accent palette followed by the neutrals instead of hue rotations.
 */
@Component
public class ColorHarmonyEngine {

    private final ColorModel colorModel;
    private final StyleEngineProperties properties;

    public ColorHarmonyEngine(ColorModel colorModel, StyleEngineProperties properties) {
        this.colorModel = colorModel;
        this.properties = properties;
    }

    public List<RecommendedColor> harmonize(GarmentColor base) {
        List<RecommendedColor> colors = new ArrayList<>();
        if (base.neutral()) {
            colors.addAll(HarmonyPalettes.neutralBaseAccents());
            colors.addAll(HarmonyPalettes.neutrals());
            return List.copyOf(colors);
        }

        StyleEngineProperties.Color config = properties.getColor();
        double hue = base.hsl().hue();
        double analogous = config.getAnalogousOffsetDegrees();
        double triadic = config.getTriadicOffsetDegrees();

        colors.add(rotated(base.hsl(), hue + 180, HarmonyType.COMPLEMENTARY));
        colors.add(rotated(base.hsl(), hue + analogous, HarmonyType.ANALOGOUS));
        colors.add(rotated(base.hsl(), hue - analogous, HarmonyType.ANALOGOUS));
        colors.add(rotated(base.hsl(), hue + triadic, HarmonyType.TRIADIC));
        colors.add(rotated(base.hsl(), hue - triadic, HarmonyType.TRIADIC));
        colors.addAll(HarmonyPalettes.neutrals());
        return List.copyOf(colors);
    }

    /**
     * The base hue itself plus every hue the harmony rules derive from it.
     */
    public List<Double> harmoniousHues(Hsl base) {
        StyleEngineProperties.Color config = properties.getColor();
        double hue = base.hue();
        return List.of(
            hue,
            wrapHue(hue + 180),
            wrapHue(hue + config.getAnalogousOffsetDegrees()),
            wrapHue(hue - config.getAnalogousOffsetDegrees()),
            wrapHue(hue + config.getTriadicOffsetDegrees()),
            wrapHue(hue - config.getTriadicOffsetDegrees())
        );
    }

    /**
     * Angular distance from {@code candidate}'s hue to the nearest harmonious hue of {@code base}.
     */
    public double distanceToHarmony(Hsl base, Hsl candidate) {
        double nearest = 180;
        for (double hue : harmoniousHues(base)) {
            nearest = Math.min(nearest, hueDistance(hue, candidate.hue()));
        }
        return nearest;
    }

    /**
     * Share of the color penalty, in [0, 1]. Neutrals on either side never clash.
     */
    public double colorPenalty(GarmentColor base, GarmentColor candidate) {
        if (base.neutral() || candidate.neutral()) {
            return 0;
        }
        StyleEngineProperties.Scoring scoring = properties.getScoring();
        double excess = distanceToHarmony(base.hsl(), candidate.hsl()) - scoring.getHarmonyToleranceDegrees();
        if (excess <= 0) {
            return 0;
        }
        return Math.min(1, excess / scoring.getColorPenaltySpanDegrees());
    }

    public boolean isCompatible(GarmentColor base, GarmentColor candidate) {
        return colorPenalty(base, candidate) == 0;
    }

    public static double hueDistance(double first, double second) {
        double diff = Math.abs(first - second) % 360;
        return diff > 180 ? 360 - diff : diff;
    }

    private RecommendedColor rotated(Hsl base, double hue, HarmonyType harmonyType) {
        StyleEngineProperties.Color config = properties.getColor();
        Hsl candidate = new Hsl(
            wrapHue(hue),
            clamp(base.saturation(), config.getWearableSaturationMin(), config.getWearableSaturationMax()),
            clamp(base.lightness(), config.getWearableLightnessMin(), config.getWearableLightnessMax())
        );
        String hex = colorModel.hslToHex(candidate);
        return new RecommendedColor(hex, ColorNameTable.nameFor(colorModel.hexToHsl(hex)), harmonyType);
    }

    private static double wrapHue(double hue) {
        double wrapped = hue % 360;
        if (wrapped < 0) {
            wrapped += 360;
        }
        return wrapped >= 360 ? 0 : wrapped;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}

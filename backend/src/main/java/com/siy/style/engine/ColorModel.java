package com.siy.style.engine;

import com.siy.style.catalog.ColorNameTable;
import com.siy.style.domain.GarmentColor;
import com.siy.style.domain.Hsl;
import com.siy.style.domain.StyleEngineException;
import com.siy.style.domain.StyleErrorCode;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Hex/HSL conversion and neutral classification. Hex is the source of truth; HSL components
 * are kept to one decimal place, which is fine enough for hex to HSL to hex to be lossless.
 */
@Component
public class ColorModel {

    private static final Pattern HEX_PATTERN = Pattern.compile("^#?([0-9A-Fa-f]{3}|[0-9A-Fa-f]{6})$");

    private final StyleEngineProperties properties;

    public ColorModel(StyleEngineProperties properties) {
        this.properties = properties;
    }

    /**
     * Builds a color from a hex string, deriving HSL and neutrality. A blank name is replaced
     * by the color-name table's label. The name is a label only and never affects neutrality.
     */
    public GarmentColor fromHex(String hex, String name) {
        String canonical = normalizeHex(hex);
        Hsl hsl = hexToHsl(canonical);
        String resolvedName = name == null || name.isBlank() ? ColorNameTable.nameFor(hsl) : name.trim();
        return new GarmentColor(canonical, hsl, resolvedName, classifyNeutral(hsl));
    }

    public String normalizeHex(String hex) {
        if (hex == null || !HEX_PATTERN.matcher(hex.trim()).matches()) {
            throw new StyleEngineException(StyleErrorCode.INVALID_COLOR_FORMAT, String.valueOf(hex));
        }
        String digits = hex.trim();
        if (digits.startsWith("#")) {
            digits = digits.substring(1);
        }
        if (digits.length() == 3) {
            StringBuilder expanded = new StringBuilder(6);
            for (char digit : digits.toCharArray()) {
                expanded.append(digit).append(digit);
            }
            digits = expanded.toString();
        }
        return "#" + digits.toUpperCase(Locale.ROOT);
    }

    public Hsl hexToHsl(String hex) {
        String canonical = normalizeHex(hex);
        double r = Integer.parseInt(canonical.substring(1, 3), 16) / 255.0;
        double g = Integer.parseInt(canonical.substring(3, 5), 16) / 255.0;
        double b = Integer.parseInt(canonical.substring(5, 7), 16) / 255.0;

        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        double lightness = (max + min) / 2;
        double hue = 0;
        double saturation = 0;

        if (max != min) {
            double delta = max - min;
            saturation = lightness > 0.5 ? delta / (2 - max - min) : delta / (max + min);
            if (max == r) {
                hue = (g - b) / delta + (g < b ? 6 : 0);
            } else if (max == g) {
                hue = (b - r) / delta + 2;
            } else {
                hue = (r - g) / delta + 4;
            }
            hue *= 60;
        }

        double roundedHue = roundTenth(hue);
        return new Hsl(roundedHue >= 360 ? 0 : roundedHue, roundTenth(saturation * 100), roundTenth(lightness * 100));
    }

    public String hslToHex(Hsl hsl) {
        double h = hsl.hue() / 360;
        double s = hsl.saturation() / 100;
        double l = hsl.lightness() / 100;

        double r;
        double g;
        double b;
        if (s == 0) {
            r = l;
            g = l;
            b = l;
        } else {
            double q = l < 0.5 ? l * (1 + s) : l + s - l * s;
            double p = 2 * l - q;
            r = hueToChannel(p, q, h + 1.0 / 3);
            g = hueToChannel(p, q, h);
            b = hueToChannel(p, q, h - 1.0 / 3);
        }
        return String.format("#%02X%02X%02X", toByte(r), toByte(g), toByte(b));
    }

    /**
     * True for near-gray, near-black and near-white colors regardless of hue.
     */
    public boolean classifyNeutral(Hsl hsl) {
        StyleEngineProperties.Color color = properties.getColor();
        return hsl.saturation() <= color.getNeutralSaturationMax()
            || hsl.lightness() <= color.getNeutralDarkLightnessMax()
            || hsl.lightness() >= color.getNeutralLightLightnessMin();
    }

    private static double hueToChannel(double p, double q, double t) {
        if (t < 0) {
            t += 1;
        }
        if (t > 1) {
            t -= 1;
        }
        if (t < 1.0 / 6) {
            return p + (q - p) * 6 * t;
        }
        if (t < 1.0 / 2) {
            return q;
        }
        if (t < 2.0 / 3) {
            return p + (q - p) * (2.0 / 3 - t) * 6;
        }
        return p;
    }

    private static int toByte(double channel) {
        return (int) Math.max(0, Math.min(255, Math.round(channel * 255)));
    }

    private static double roundTenth(double value) {
        return Math.round(value * 10) / 10.0;
    }
}

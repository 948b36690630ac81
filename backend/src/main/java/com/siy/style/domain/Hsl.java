package com.siy.style.domain;

/**
 * Hue in degrees [0, 360), saturation and lightness in percent [0, 100].
 */
public record Hsl(double hue, double saturation, double lightness) {

    public Hsl {
        if (!(hue >= 0 && hue < 360)) {
            throw new StyleEngineException(StyleErrorCode.OUT_OF_RANGE_VALUE, "hue " + hue);
        }
        if (!(saturation >= 0 && saturation <= 100)) {
            throw new StyleEngineException(StyleErrorCode.OUT_OF_RANGE_VALUE, "saturation " + saturation);
        }
        if (!(lightness >= 0 && lightness <= 100)) {
            throw new StyleEngineException(StyleErrorCode.OUT_OF_RANGE_VALUE, "lightness " + lightness);
        }
    }
}

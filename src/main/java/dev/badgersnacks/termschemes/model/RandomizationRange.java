package dev.badgersnacks.termschemes.model;

/**
 * How far a palette slot may drift in HSV space when a scheme is randomized.
 */
public record RandomizationRange(int hue, int saturation, int value) {

    /** Largest hue jitter accepted for a slot. */
    public static final int MAX_HUE = 340;

    public static final RandomizationRange NONE = new RandomizationRange(0, 0, 0);

    public RandomizationRange {
        if (hue < 0 || hue > MAX_HUE) {
            throw new IllegalArgumentException("hue range must be within 0.." + MAX_HUE + ": " + hue);
        }
        if (saturation < 0 || saturation > RgbColor.MAX_CHANNEL) {
            throw new IllegalArgumentException("saturation range must be within 0..255: " + saturation);
        }
        if (value < 0 || value > RgbColor.MAX_CHANNEL) {
            throw new IllegalArgumentException("value range must be within 0..255: " + value);
        }
    }

    public boolean isNull() {
        return hue == 0 && saturation == 0 && value == 0;
    }
}

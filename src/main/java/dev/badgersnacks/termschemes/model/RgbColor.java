package dev.badgersnacks.termschemes.model;

/**
 * 8-bit per channel RGB color used by palette entries.
 */
public record RgbColor(int red, int green, int blue) {

    public static final int MAX_CHANNEL = 255;

    public RgbColor {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
    }

    public static RgbColor of(int red, int green, int blue) {
        return new RgbColor(red, green, blue);
    }

    /**
     * Converts to HSV with hue in degrees (0..359) and saturation/value scaled to 0..255. Grays
     * report a hue of 0.
     */
    public HsvColor toHsv() {
        int max = Math.max(red, Math.max(green, blue));
        int min = Math.min(red, Math.min(green, blue));
        int delta = max - min;
        int saturation = max == 0 ? 0 : (int) Math.round(delta * (double) MAX_CHANNEL / max);
        if (delta == 0) {
            return new HsvColor(0, saturation, max);
        }
        double hue;
        if (max == red) {
            hue = 60.0d * (green - blue) / delta;
        } else if (max == green) {
            hue = 60.0d * (blue - red) / delta + 120.0d;
        } else {
            hue = 60.0d * (red - green) / delta + 240.0d;
        }
        return new HsvColor(Math.floorMod((int) Math.round(hue), HsvColor.HUE_DEGREES), saturation, max);
    }

    public String asString() {
        return red + "," + green + "," + blue;
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > MAX_CHANNEL) {
            throw new IllegalArgumentException(name + " must be within 0.." + MAX_CHANNEL + ": " + value);
        }
    }
}

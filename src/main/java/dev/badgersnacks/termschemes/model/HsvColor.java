package dev.badgersnacks.termschemes.model;

/**
 * HSV triple with hue in degrees and saturation/value on the 0..255 channel scale.
 */
public record HsvColor(int hue, int saturation, int value) {

    public static final int HUE_DEGREES = 360;

    public HsvColor {
        if (hue < 0 || hue >= HUE_DEGREES) {
            throw new IllegalArgumentException("hue must be within 0.." + (HUE_DEGREES - 1) + ": " + hue);
        }
        if (saturation < 0 || saturation > RgbColor.MAX_CHANNEL) {
            throw new IllegalArgumentException("saturation must be within 0..255: " + saturation);
        }
        if (value < 0 || value > RgbColor.MAX_CHANNEL) {
            throw new IllegalArgumentException("value must be within 0..255: " + value);
        }
    }

    public RgbColor toRgb() {
        double v = value / (double) RgbColor.MAX_CHANNEL;
        double s = saturation / (double) RgbColor.MAX_CHANNEL;
        double chroma = v * s;
        double sector = hue / 60.0d;
        double x = chroma * (1 - Math.abs(sector % 2 - 1));
        double r;
        double g;
        double b;
        switch ((int) sector) {
            case 0 -> { r = chroma; g = x; b = 0; }
            case 1 -> { r = x; g = chroma; b = 0; }
            case 2 -> { r = 0; g = chroma; b = x; }
            case 3 -> { r = 0; g = x; b = chroma; }
            case 4 -> { r = x; g = 0; b = chroma; }
            default -> { r = chroma; g = 0; b = x; }
        }
        double m = v - chroma;
        return new RgbColor(toChannel(r + m), toChannel(g + m), toChannel(b + m));
    }

    private static int toChannel(double fraction) {
        long scaled = Math.round(fraction * RgbColor.MAX_CHANNEL);
        return (int) Math.max(0, Math.min(RgbColor.MAX_CHANNEL, scaled));
    }
}

package dev.badgersnacks.termschemes.model;

import java.util.Objects;

/**
 * One palette slot: a color plus the transparency and bold hints the renderer applies with it.
 */
public record ColorEntry(RgbColor color, boolean transparent, boolean bold) {

    public ColorEntry {
        Objects.requireNonNull(color, "color");
    }

    public static ColorEntry of(int red, int green, int blue) {
        return new ColorEntry(new RgbColor(red, green, blue), false, false);
    }

    public ColorEntry withColor(RgbColor updated) {
        return new ColorEntry(updated, transparent, bold);
    }
}

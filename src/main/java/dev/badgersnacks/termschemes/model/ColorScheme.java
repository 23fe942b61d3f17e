package dev.badgersnacks.termschemes.model;

import dev.badgersnacks.termschemes.util.FileNames;
import dev.badgersnacks.termschemes.util.SchemeSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SplittableRandom;
import java.util.function.Consumer;

/**
 * Palette used to draw a terminal display: the colors for text and character backgrounds, the
 * opacity of the display background and optional per-slot randomization.
 *
 * <p>A scheme starts out reading from the shared built-in table. The first call to
 * {@link #setColorTableEntry(int, ColorEntry)} gives it a private copy, so the built-in table
 * and other schemes never see the change.
 */
public class ColorScheme {

    private static final Logger LOGGER = LoggerFactory.getLogger(ColorScheme.class);

    public static final int TABLE_COLORS = 20;
    public static final int BACKGROUND_INDEX = 0;
    public static final int FOREGROUND_INDEX = 1;

    /** Backgrounds with an HSV value below this are considered dark. */
    public static final int DARK_BACKGROUND_THRESHOLD = 127;

    public static final String DEFAULT_DESCRIPTION = "Un-named Color Scheme";

    private static final String GENERAL_SECTION = "General";

    private static final List<String> COLOR_NAMES = List.of(
            "Background", "Foreground",
            "Color0", "Color1", "Color2", "Color3", "Color4", "Color5", "Color6", "Color7",
            "BackgroundIntense", "ForegroundIntense",
            "Color0Intense", "Color1Intense", "Color2Intense", "Color3Intense",
            "Color4Intense", "Color5Intense", "Color6Intense", "Color7Intense");

    private static final List<String> TRANSLATED_COLOR_NAMES = List.of(
            "Background", "Foreground",
            "Color 1", "Color 2", "Color 3", "Color 4", "Color 5", "Color 6", "Color 7", "Color 8",
            "Background (Intense)", "Foreground (Intense)",
            "Color 1 (Intense)", "Color 2 (Intense)", "Color 3 (Intense)", "Color 4 (Intense)",
            "Color 5 (Intense)", "Color 6 (Intense)", "Color 7 (Intense)", "Color 8 (Intense)");

    private static final ColorEntry[] DEFAULT_TABLE = {
            new ColorEntry(RgbColor.of(0xFF, 0xFF, 0xFF), true, false),
            new ColorEntry(RgbColor.of(0x00, 0x00, 0x00), false, false),
            ColorEntry.of(0x00, 0x00, 0x00),
            ColorEntry.of(0xB2, 0x18, 0x18),
            ColorEntry.of(0x18, 0xB2, 0x18),
            ColorEntry.of(0xB2, 0x68, 0x18),
            ColorEntry.of(0x18, 0x18, 0xB2),
            ColorEntry.of(0xB2, 0x18, 0xB2),
            ColorEntry.of(0x18, 0xB2, 0xB2),
            ColorEntry.of(0xB2, 0xB2, 0xB2),
            new ColorEntry(RgbColor.of(0xFF, 0xFF, 0xFF), true, false),
            new ColorEntry(RgbColor.of(0x00, 0x00, 0x00), false, true),
            ColorEntry.of(0x68, 0x68, 0x68),
            ColorEntry.of(0xFF, 0x54, 0x54),
            ColorEntry.of(0x54, 0xFF, 0x54),
            ColorEntry.of(0xFF, 0xFF, 0x54),
            ColorEntry.of(0x54, 0x54, 0xFF),
            ColorEntry.of(0xFF, 0x54, 0xFF),
            ColorEntry.of(0x54, 0xFF, 0xFF),
            ColorEntry.of(0xFF, 0xFF, 0xFF)
    };

    private String name = "";
    private String description = "";
    private double opacity = 1.0d;
    private boolean randomizeBackground;
    // null while the built-in table is in use
    private ColorEntry[] table;
    // null until some slot gets a non-null range
    private RandomizationRange[] randomTable;
    private Consumer<ColorScheme> modificationListener;

    public ColorScheme() {
    }

    /**
     * Deep copy of {@code other}. The modification listener is not carried over.
     */
    public ColorScheme(ColorScheme other) {
        Objects.requireNonNull(other, "other");
        this.name = other.name;
        this.description = other.description;
        this.opacity = other.opacity;
        this.randomizeBackground = other.randomizeBackground;
        this.table = other.table == null ? null : other.table.clone();
        this.randomTable = other.randomTable == null ? null : other.randomTable.clone();
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String description() {
        return description;
    }

    public void setDescription(String description) {
        this.description = Objects.requireNonNull(description, "description");
        markModified();
    }

    public double opacity() {
        return opacity;
    }

    /**
     * Sets the background opacity, from 0 (fully transparent) to 1 (opaque).
     */
    public void setOpacity(double opacity) {
        if (!(opacity >= 0.0d && opacity <= 1.0d)) {
            throw new IllegalArgumentException("opacity must be within 0..1: " + opacity);
        }
        this.opacity = opacity;
        markModified();
    }

    public boolean randomizedBackgroundColor() {
        return randomizeBackground;
    }

    /**
     * Lets the background slot take part in randomization. Enabling it also gives the background
     * the widest hue and saturation range; disabling it clears the background range.
     */
    public void setRandomizedBackgroundColor(boolean randomize) {
        this.randomizeBackground = randomize;
        if (randomize) {
            storeRange(BACKGROUND_INDEX, new RandomizationRange(RandomizationRange.MAX_HUE, RgbColor.MAX_CHANNEL, 0));
        } else {
            storeRange(BACKGROUND_INDEX, RandomizationRange.NONE);
        }
        markModified();
    }

    public boolean hasCustomColorTable() {
        return table != null;
    }

    public void setColorTableEntry(int index, ColorEntry entry) {
        Objects.checkIndex(index, TABLE_COLORS);
        storeEntry(index, Objects.requireNonNull(entry, "entry"));
        markModified();
    }

    /**
     * Sets how far slot {@code index} may drift when randomized. An all-zero range clears the slot.
     */
    public void setRandomizationRange(int index, int hue, int saturation, int value) {
        Objects.checkIndex(index, TABLE_COLORS);
        storeRange(index, new RandomizationRange(hue, saturation, value));
        markModified();
    }

    public RandomizationRange randomizationRange(int index) {
        Objects.checkIndex(index, TABLE_COLORS);
        if (randomTable == null || randomTable[index] == null) {
            return RandomizationRange.NONE;
        }
        return randomTable[index];
    }

    public boolean hasRandomization() {
        if (randomTable == null) {
            return false;
        }
        for (RandomizationRange range : randomTable) {
            if (range != null && !range.isNull()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Copies the effective palette into {@code out}, which must hold at least
     * {@link #TABLE_COLORS} entries.
     *
     * <p>A seed of 0 yields the active table unchanged. Any other seed jitters every slot that has
     * a randomization range; the result depends only on this scheme and the seed.
     */
    public void getColorTable(ColorEntry[] out, int seed) {
        Objects.requireNonNull(out, "out");
        if (out.length < TABLE_COLORS) {
            throw new IllegalArgumentException("Color table needs " + TABLE_COLORS + " entries, got " + out.length);
        }
        ColorEntry[] active = activeTable();
        for (int i = 0; i < TABLE_COLORS; i++) {
            out[i] = effectiveEntry(active, i, seed);
        }
    }

    public ColorEntry[] getColorTable(int seed) {
        ColorEntry[] out = new ColorEntry[TABLE_COLORS];
        getColorTable(out, seed);
        return out;
    }

    public ColorEntry[] getColorTable() {
        return getColorTable(0);
    }

    public ColorEntry colorEntry(int index, int seed) {
        Objects.checkIndex(index, TABLE_COLORS);
        return effectiveEntry(activeTable(), index, seed);
    }

    public ColorEntry colorEntry(int index) {
        return colorEntry(index, 0);
    }

    public RgbColor foregroundColor() {
        return activeTable()[FOREGROUND_INDEX].color();
    }

    public RgbColor backgroundColor() {
        return activeTable()[BACKGROUND_INDEX].color();
    }

    public boolean hasDarkBackground() {
        return backgroundColor().toHsv().value() < DARK_BACKGROUND_THRESHOLD;
    }

    /**
     * Registers the callback notified after each change to the description, opacity, palette or
     * randomization. Pass {@code null} to detach.
     */
    public void setModificationListener(Consumer<ColorScheme> listener) {
        this.modificationListener = listener;
    }

    /**
     * Reads a {@code .colorscheme} file into this scheme, replacing its palette and randomization.
     * Missing or malformed values fall back to the built-in defaults. The scheme name is taken
     * from the file name when none has been set.
     */
    public void read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        SchemeSettings settings = SchemeSettings.load(file);
        if (name.isEmpty()) {
            name = FileNames.baseName(file);
        }
        description = settings.getString(GENERAL_SECTION, "Description")
                .filter(text -> !text.isBlank())
                .orElse(DEFAULT_DESCRIPTION);
        double storedOpacity = settings.getDouble(GENERAL_SECTION, "Opacity").orElse(1.0d);
        opacity = Math.max(0.0d, Math.min(1.0d, storedOpacity));
        table = null;
        randomTable = null;
        for (int i = 0; i < TABLE_COLORS; i++) {
            readColorEntry(settings, i);
        }
        randomizeBackground = settings.getBoolean(GENERAL_SECTION, "RandomizeBackground")
                .orElse(!randomizationRange(BACKGROUND_INDEX).isNull());
        markModified();
    }

    /**
     * Writes this scheme to {@code file} in the {@code .colorscheme} format.
     */
    public void write(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        SchemeSettings settings = new SchemeSettings();
        settings.put(GENERAL_SECTION, "Description", description);
        settings.put(GENERAL_SECTION, "Opacity", opacity);
        settings.put(GENERAL_SECTION, "RandomizeBackground", randomizeBackground);
        ColorEntry[] active = activeTable();
        for (int i = 0; i < TABLE_COLORS; i++) {
            String section = colorNameForIndex(i);
            settings.put(section, "Color", active[i].color().asString());
            settings.put(section, "Transparency", active[i].transparent());
            settings.put(section, "Bold", active[i].bold());
            RandomizationRange range = randomizationRange(i);
            if (!range.isNull()) {
                settings.put(section, "HueRange", range.hue());
                settings.put(section, "SaturationRange", range.saturation());
                settings.put(section, "ValueRange", range.value());
            }
        }
        settings.save(file);
    }

    public static String colorNameForIndex(int index) {
        Objects.checkIndex(index, TABLE_COLORS);
        return COLOR_NAMES.get(index);
    }

    public static String translatedColorNameForIndex(int index) {
        Objects.checkIndex(index, TABLE_COLORS);
        return TRANSLATED_COLOR_NAMES.get(index);
    }

    public static ColorEntry defaultColorEntry(int index) {
        Objects.checkIndex(index, TABLE_COLORS);
        return DEFAULT_TABLE[index];
    }

    private void readColorEntry(SchemeSettings settings, int index) {
        String section = colorNameForIndex(index);
        ColorEntry fallback = DEFAULT_TABLE[index];
        RgbColor color = settings.getString(section, "Color")
                .flatMap(raw -> parseColor(raw, section))
                .orElse(fallback.color());
        boolean transparent = settings.getBoolean(section, "Transparency")
                .or(() -> settings.getBoolean(section, "Transparent"))
                .orElse(fallback.transparent());
        boolean bold = settings.getBoolean(section, "Bold").orElse(fallback.bold());
        storeEntry(index, new ColorEntry(color, transparent, bold));

        int hue = clamp(settings.getInt(section, "HueRange").orElse(0), RandomizationRange.MAX_HUE);
        int saturation = clamp(settings.getInt(section, "SaturationRange").orElse(0), RgbColor.MAX_CHANNEL);
        int value = clamp(settings.getInt(section, "ValueRange").orElse(0), RgbColor.MAX_CHANNEL);
        storeRange(index, new RandomizationRange(hue, saturation, value));
    }

    private static Optional<RgbColor> parseColor(String raw, String section) {
        String[] parts = raw.split(",");
        if (parts.length != 3) {
            LOGGER.debug("Ignoring malformed color '{}' in section {}", raw, section);
            return Optional.empty();
        }
        try {
            return Optional.of(new RgbColor(
                    Integer.parseInt(parts[0].strip()),
                    Integer.parseInt(parts[1].strip()),
                    Integer.parseInt(parts[2].strip())));
        } catch (IllegalArgumentException e) {
            LOGGER.debug("Ignoring malformed color '{}' in section {}", raw, section, e);
            return Optional.empty();
        }
    }

    private ColorEntry effectiveEntry(ColorEntry[] active, int index, int seed) {
        ColorEntry base = active[index];
        if (seed == 0 || randomTable == null) {
            return base;
        }
        if (index == BACKGROUND_INDEX && !randomizeBackground) {
            return base;
        }
        RandomizationRange range = randomTable[index];
        if (range == null || range.isNull()) {
            return base;
        }
        return base.withColor(randomize(base.color(), range, seed, index));
    }

    private static RgbColor randomize(RgbColor color, RandomizationRange range, int seed, int index) {
        SplittableRandom random = new SplittableRandom(((long) seed << 32) | index);
        int hueDelta = random.nextInt(-range.hue(), range.hue() + 1);
        int saturationDelta = random.nextInt(-range.saturation(), range.saturation() + 1);
        int valueDelta = random.nextInt(-range.value(), range.value() + 1);

        HsvColor hsv = color.toHsv();
        HsvColor jittered = new HsvColor(
                Math.floorMod(hsv.hue() + hueDelta, HsvColor.HUE_DEGREES),
                clamp(hsv.saturation() + saturationDelta, RgbColor.MAX_CHANNEL),
                clamp(hsv.value() + valueDelta, RgbColor.MAX_CHANNEL));
        return jittered.toRgb();
    }

    private ColorEntry[] activeTable() {
        return table != null ? table : DEFAULT_TABLE;
    }

    private void storeEntry(int index, ColorEntry entry) {
        if (table == null) {
            table = DEFAULT_TABLE.clone();
        }
        table[index] = entry;
    }

    private void storeRange(int index, RandomizationRange range) {
        if (randomTable == null) {
            if (range.isNull()) {
                return;
            }
            randomTable = new RandomizationRange[TABLE_COLORS];
        }
        randomTable[index] = range.isNull() ? null : range;
    }

    private void markModified() {
        Consumer<ColorScheme> listener = modificationListener;
        if (listener != null) {
            listener.accept(this);
        }
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(max, value));
    }
}

package dev.badgersnacks.termschemes.persistence;

import dev.badgersnacks.termschemes.model.ColorEntry;
import dev.badgersnacks.termschemes.model.ColorScheme;
import dev.badgersnacks.termschemes.model.RgbColor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads the line-oriented {@code .schema} format used by older terminals.
 *
 * <p>Only the title and the palette lines are understood:
 * <pre>
 * title My Scheme
 * color &lt;index&gt; &lt;red&gt; &lt;green&gt; &lt;blue&gt; &lt;transparent:0|1&gt; &lt;bold:0|1&gt;
 * </pre>
 * Background images, blend colors and other directives are skipped. A bad line is logged and
 * skipped; it never invalidates the rest of the file. Without a title line the scheme keeps
 * {@link ColorScheme#DEFAULT_DESCRIPTION}.
 *
 * <p>The index of a {@code color} line is used as the slot number unchanged, so {@code color 0}
 * is the background and {@code color 1} the foreground (likewise 10 and 11 for the intense
 * block). Files written for KDE 3, which numbered foreground 0 and background 1, therefore load
 * with those two colors swapped.
 */
public final class LegacySchemeReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(LegacySchemeReader.class);
    private static final Pattern COMMENT = Pattern.compile("#.*$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int COLOR_LINE_TOKENS = 7;

    private final InputStream input;

    /**
     * The stream is read to the end by {@link #read()} but not closed; the caller owns it.
     */
    public LegacySchemeReader(InputStream input) {
        this.input = Objects.requireNonNull(input, "input");
    }

    /**
     * Parses the stream into a new scheme. Returns empty only if the stream itself cannot be read.
     */
    public Optional<ColorScheme> read() {
        ColorScheme scheme = new ColorScheme();
        scheme.setDescription(ColorScheme.DEFAULT_DESCRIPTION);
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        try {
            String rawLine;
            while ((rawLine = reader.readLine()) != null) {
                String line = WHITESPACE.matcher(COMMENT.matcher(rawLine).replaceFirst("")).replaceAll(" ").strip();
                if (line.isEmpty()) {
                    continue;
                }
                if (line.startsWith("color")) {
                    if (!readColorLine(line, scheme)) {
                        LOGGER.debug("Failed to read legacy color scheme line '{}'", line);
                    }
                } else if (line.startsWith("title")) {
                    if (!readTitleLine(line, scheme)) {
                        LOGGER.debug("Failed to read legacy color scheme title line '{}'", line);
                    }
                } else {
                    LOGGER.debug("Legacy color scheme contains an unsupported feature, '{}'", line);
                }
            }
        } catch (IOException e) {
            LOGGER.warn("Unable to read legacy color scheme", e);
            return Optional.empty();
        }
        return Optional.of(scheme);
    }

    private boolean readColorLine(String line, ColorScheme scheme) {
        String[] tokens = line.split(" ");
        if (tokens.length != COLOR_LINE_TOKENS || !tokens[0].equals("color")) {
            return false;
        }
        int index;
        int red;
        int green;
        int blue;
        int transparent;
        int bold;
        try {
            index = Integer.parseInt(tokens[1]);
            red = Integer.parseInt(tokens[2]);
            green = Integer.parseInt(tokens[3]);
            blue = Integer.parseInt(tokens[4]);
            transparent = Integer.parseInt(tokens[5]);
            bold = Integer.parseInt(tokens[6]);
        } catch (NumberFormatException e) {
            return false;
        }
        if (index < 0 || index >= ColorScheme.TABLE_COLORS
                || !isChannel(red) || !isChannel(green) || !isChannel(blue)
                || !isFlag(transparent) || !isFlag(bold)) {
            return false;
        }
        scheme.setColorTableEntry(index, new ColorEntry(new RgbColor(red, green, blue), transparent == 1, bold == 1));
        return true;
    }

    private boolean readTitleLine(String line, ColorScheme scheme) {
        int space = line.indexOf(' ');
        if (!line.startsWith("title ") || space == -1) {
            return false;
        }
        scheme.setDescription(line.substring(space + 1));
        return true;
    }

    private static boolean isChannel(int value) {
        return value >= 0 && value <= RgbColor.MAX_CHANNEL;
    }

    private static boolean isFlag(int value) {
        return value == 0 || value == 1;
    }
}

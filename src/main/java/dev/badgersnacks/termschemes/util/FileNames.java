package dev.badgersnacks.termschemes.util;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

public final class FileNames {

    private FileNames() {
    }

    /**
     * File name without its last extension, e.g. {@code Solarized} for {@code /a/Solarized.colorscheme}.
     */
    public static String baseName(Path file) {
        Objects.requireNonNull(file, "file");
        Path fileName = file.getFileName();
        if (fileName == null) {
            return "";
        }
        String text = fileName.toString();
        int dot = text.lastIndexOf('.');
        return dot > 0 ? text.substring(0, dot) : text;
    }

    public static boolean hasExtension(Path file, String extension) {
        Path fileName = file.getFileName();
        return fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith(extension);
    }
}

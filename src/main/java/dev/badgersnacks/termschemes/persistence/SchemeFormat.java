package dev.badgersnacks.termschemes.persistence;

import dev.badgersnacks.termschemes.util.FileNames;

import java.nio.file.Path;
import java.util.Optional;

/**
 * The two on-disk scheme formats, told apart by file extension.
 */
public enum SchemeFormat {
    MODERN(".colorscheme"),
    LEGACY(".schema");

    private final String extension;

    SchemeFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public String fileName(String schemeName) {
        return schemeName + extension;
    }

    public boolean matches(Path file) {
        return FileNames.hasExtension(file, extension);
    }

    public static Optional<SchemeFormat> fromPath(Path file) {
        for (SchemeFormat format : values()) {
            if (format.matches(file)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}

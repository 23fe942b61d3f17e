package dev.badgersnacks.termschemes.persistence;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralizes where scheme files are looked up: one user-writable directory searched first, then
 * the read-only system directories in order.
 */
public final class SchemePaths {
    private static final Logger LOGGER = LoggerFactory.getLogger(SchemePaths.class);

    private final Path userDir;
    private final List<Path> systemDirs;

    public SchemePaths(Path userDir, List<Path> systemDirs) {
        this.userDir = normalize(Objects.requireNonNull(userDir, "userDir"));
        List<Path> normalized = new ArrayList<>();
        for (Path dir : Objects.requireNonNull(systemDirs, "systemDirs")) {
            normalized.add(normalize(dir));
        }
        this.systemDirs = Collections.unmodifiableList(normalized);
    }

    public Path userDir() {
        return userDir;
    }

    public List<Path> systemDirs() {
        return systemDirs;
    }

    public List<Path> searchOrder() {
        List<Path> roots = new ArrayList<>(systemDirs.size() + 1);
        roots.add(userDir);
        roots.addAll(systemDirs);
        return roots;
    }

    /**
     * Location a modified scheme is written back to.
     */
    public Path userFile(String schemeName) {
        return userDir.resolve(SchemeFormat.MODERN.fileName(schemeName));
    }

    /**
     * First file named {@code schemeName} in {@code format} across the search order.
     */
    public Optional<Path> locate(String schemeName, SchemeFormat format) {
        String fileName = format.fileName(schemeName);
        for (Path root : searchOrder()) {
            Path candidate = root.resolve(fileName);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Every file in {@code format} under the search roots, user directory first. Unreadable roots
     * are skipped.
     */
    public List<Path> list(SchemeFormat format) {
        List<Path> files = new ArrayList<>();
        for (Path root : searchOrder()) {
            if (!Files.isDirectory(root)) {
                continue;
            }
            try (Stream<Path> entries = Files.list(root)) {
                entries.filter(Files::isRegularFile)
                        .filter(format::matches)
                        .sorted()
                        .forEach(files::add);
            } catch (IOException e) {
                LOGGER.warn("Unable to list color schemes in {}", root, e);
            }
        }
        return files;
    }

    /**
     * Whether {@code candidate} lives under the user directory, the only place scheme files may be
     * deleted from.
     */
    public boolean isUserPath(Path candidate) {
        return normalize(candidate).startsWith(userDir);
    }

    public boolean isSystemPath(Path candidate) {
        Path normalized = normalize(candidate);
        for (Path root : systemDirs) {
            if (normalized.startsWith(root)) {
                return true;
            }
        }
        return false;
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}

package dev.badgersnacks.termschemes.services;

import dev.badgersnacks.termschemes.model.ColorScheme;
import dev.badgersnacks.termschemes.persistence.LegacySchemeReader;
import dev.badgersnacks.termschemes.persistence.SchemeFormat;
import dev.badgersnacks.termschemes.persistence.SchemePaths;
import dev.badgersnacks.termschemes.util.FileNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Catalog of the color schemes available to terminal displays.
 *
 * <p>Create one registry per process and hand it to whoever needs schemes. Scheme files are only
 * parsed when a name is first requested, or all at once by {@link #allColorSchemes()}. Schemes
 * changed after loading are written to the user directory by {@link #close()}.
 *
 * <p>All public methods are synchronized, so a scheme is loaded at most once even when several
 * threads ask for it.
 */
public class ColorSchemeRegistry implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ColorSchemeRegistry.class);

    private final SchemePaths paths;
    private final ColorScheme defaultScheme;
    private final Map<String, ColorScheme> schemes = new LinkedHashMap<>();
    // backing file per cached name, absent for schemes added in memory
    private final Map<String, Path> sources = new LinkedHashMap<>();
    private final Set<ColorScheme> modified = Collections.newSetFromMap(new IdentityHashMap<>());
    private boolean haveLoadedAll;
    private boolean closed;

    public ColorSchemeRegistry(SchemePaths paths) {
        this.paths = Objects.requireNonNull(paths, "paths");
        this.defaultScheme = new ColorScheme();
        this.defaultScheme.setDescription("Default");
    }

    public SchemePaths paths() {
        return paths;
    }

    /**
     * Built-in scheme used when no other is selected. Never null and never deletable. Each call
     * returns a fresh copy, so changes made by one caller never reach the next.
     */
    public ColorScheme defaultColorScheme() {
        return new ColorScheme(defaultScheme);
    }

    /**
     * Returns the scheme called {@code name}, loading it from disk on first use. An empty name
     * yields the default scheme. Unknown or unreadable schemes yield an empty result.
     */
    public synchronized Optional<ColorScheme> findColorScheme(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            return Optional.of(defaultColorScheme());
        }
        ColorScheme cached = schemes.get(name);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<Path> modernPath = paths.locate(name, SchemeFormat.MODERN);
        if (modernPath.isPresent() && loadColorScheme(modernPath.get(), false)) {
            return Optional.of(schemes.get(name));
        }
        Optional<Path> legacyPath = paths.locate(name, SchemeFormat.LEGACY);
        if (legacyPath.isPresent() && loadLegacyColorScheme(legacyPath.get(), false)) {
            return Optional.of(schemes.get(name));
        }
        LOGGER.debug("Could not find color scheme - {}", name);
        return Optional.empty();
    }

    /**
     * Every scheme on disk plus any added in memory, excluding the default. The first call reads
     * and parses every scheme file; later calls only read the cache.
     */
    public synchronized List<ColorScheme> allColorSchemes() {
        if (!haveLoadedAll) {
            loadAllColorSchemes();
        }
        return List.copyOf(schemes.values());
    }

    public synchronized List<String> colorSchemeNames() {
        List<String> names = new ArrayList<>();
        for (ColorScheme scheme : allColorSchemes()) {
            names.add(scheme.name());
        }
        Collections.sort(names);
        return names;
    }

    /**
     * Loads a {@code .colorscheme} or {@code .schema} file from anywhere on disk. The scheme is
     * registered under the file's base name, replacing any scheme already cached with that name.
     */
    public synchronized boolean loadCustomColorScheme(Path path) {
        Objects.requireNonNull(path, "path");
        Optional<SchemeFormat> format = SchemeFormat.fromPath(path);
        if (format.isEmpty()) {
            LOGGER.warn("Unsupported color scheme file {}", path);
            return false;
        }
        if (!Files.isRegularFile(path)) {
            LOGGER.warn("Color scheme file {} does not exist", path);
            return false;
        }
        return switch (format.get()) {
            case MODERN -> loadColorScheme(path, true);
            case LEGACY -> loadLegacyColorScheme(path, true);
        };
    }

    /**
     * Installs a scheme built in memory under its name and queues it for saving.
     */
    public synchronized void addColorScheme(ColorScheme scheme) {
        Objects.requireNonNull(scheme, "scheme");
        if (scheme.name().isEmpty()) {
            throw new IllegalArgumentException("Color scheme name is required");
        }
        install(scheme, null);
        modified.add(scheme);
    }

    /**
     * Removes a scheme from the registry. Its backing file is deleted only when it lives in the
     * user directory; a scheme loaded from a custom path is forgotten but its file is left alone.
     * Returns false for the default scheme, unknown names, schemes shipped in a system directory,
     * and user files that cannot be removed.
     */
    public synchronized boolean deleteColorScheme(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            return false;
        }
        Path source = sources.get(name);
        if (source == null && !schemes.containsKey(name)) {
            source = findColorSchemePath(name).orElse(null);
            if (source == null) {
                return false;
            }
        }
        if (source != null) {
            if (paths.isSystemPath(source)) {
                LOGGER.warn("Refusing to delete system color scheme {} at {}", name, source);
                return false;
            }
            if (paths.isUserPath(source)) {
                try {
                    Files.deleteIfExists(source);
                } catch (IOException e) {
                    LOGGER.warn("Failed to remove color scheme - {}", source, e);
                    return false;
                }
            } else {
                LOGGER.info("Forgetting color scheme {}; leaving {} in place", name, source);
            }
        }
        ColorScheme removed = schemes.remove(name);
        sources.remove(name);
        if (removed != null) {
            removed.setModificationListener(null);
            modified.remove(removed);
        }
        return true;
    }

    public synchronized boolean isModified(ColorScheme scheme) {
        return modified.contains(scheme);
    }

    /**
     * Writes every modified scheme to the user directory in {@code .colorscheme} format, under the
     * name it is registered with even if {@link ColorScheme#setName} was called since. A failed
     * write is logged and the scheme stays queued; the others are still written.
     *
     * @return whether every pending scheme was written
     */
    public synchronized boolean saveModifiedSchemes() {
        boolean allSaved = true;
        for (Map.Entry<String, ColorScheme> entry : new ArrayList<>(schemes.entrySet())) {
            String name = entry.getKey();
            ColorScheme scheme = entry.getValue();
            if (!modified.contains(scheme)) {
                continue;
            }
            Path target = paths.userFile(name);
            try {
                scheme.write(target);
                modified.remove(scheme);
                sources.put(name, target);
                LOGGER.info("Saved color scheme {} to {}", name, target);
            } catch (IOException e) {
                allSaved = false;
                LOGGER.warn("Failed to save color scheme {} to {}", name, target, e);
            }
        }
        return allSaved;
    }

    /**
     * Saves modified schemes and releases the cache. Further calls are no-ops.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        saveModifiedSchemes();
        for (ColorScheme scheme : schemes.values()) {
            scheme.setModificationListener(null);
        }
        schemes.clear();
        sources.clear();
        modified.clear();
    }

    private void loadAllColorSchemes() {
        int loaded = 0;
        for (Path path : paths.list(SchemeFormat.MODERN)) {
            if (!schemes.containsKey(FileNames.baseName(path)) && loadColorScheme(path, false)) {
                loaded++;
            }
        }
        for (Path path : paths.list(SchemeFormat.LEGACY)) {
            if (!schemes.containsKey(FileNames.baseName(path)) && loadLegacyColorScheme(path, false)) {
                loaded++;
            }
        }
        haveLoadedAll = true;
        LOGGER.debug("Loaded {} color schemes from {}", loaded, paths.searchOrder());
    }

    private boolean loadColorScheme(Path path, boolean replace) {
        String name = FileNames.baseName(path);
        if (name.isEmpty() || (!replace && schemes.containsKey(name))) {
            return false;
        }
        ColorScheme scheme = new ColorScheme();
        scheme.setName(name);
        try {
            scheme.read(path);
        } catch (IOException e) {
            LOGGER.warn("Failed to read color scheme {}", path, e);
            return false;
        }
        install(scheme, path);
        return true;
    }

    private boolean loadLegacyColorScheme(Path path, boolean replace) {
        String name = FileNames.baseName(path);
        if (name.isEmpty() || (!replace && schemes.containsKey(name))) {
            return false;
        }
        Optional<ColorScheme> parsed;
        try (InputStream in = Files.newInputStream(path)) {
            parsed = new LegacySchemeReader(in).read();
        } catch (IOException e) {
            LOGGER.warn("Failed to open legacy color scheme {}", path, e);
            return false;
        }
        if (parsed.isEmpty()) {
            return false;
        }
        ColorScheme scheme = parsed.get();
        scheme.setName(name);
        install(scheme, path);
        return true;
    }

    private void install(ColorScheme scheme, Path source) {
        ColorScheme previous = schemes.put(scheme.name(), scheme);
        if (previous != null && previous != scheme) {
            previous.setModificationListener(null);
            modified.remove(previous);
        }
        if (source == null) {
            sources.remove(scheme.name());
        } else {
            sources.put(scheme.name(), source.toAbsolutePath().normalize());
        }
        scheme.setModificationListener(this::markModified);
    }

    // by identity: a cached scheme may have been renamed since it was installed
    private synchronized void markModified(ColorScheme scheme) {
        for (ColorScheme cached : schemes.values()) {
            if (cached == scheme) {
                modified.add(scheme);
                return;
            }
        }
    }

    private Optional<Path> findColorSchemePath(String name) {
        return paths.locate(name, SchemeFormat.MODERN)
                .or(() -> paths.locate(name, SchemeFormat.LEGACY));
    }
}

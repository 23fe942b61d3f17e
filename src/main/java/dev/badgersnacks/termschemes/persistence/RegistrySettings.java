package dev.badgersnacks.termschemes.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the optional JSON settings that tell the registry where scheme files live.
 *
 * <p>The file defaults to ~/.term-schemes/settings.json and may contain a string property
 * {@code userDir} and a string array {@code systemDirs}. Relative paths are resolved against the
 * directory holding the settings file. Missing properties keep their built-in default; missing or
 * malformed files fall back to the defaults entirely.
 */
public final class RegistrySettings {
    private static final Logger LOGGER = LoggerFactory.getLogger(RegistrySettings.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final Path DEFAULT_HOME = Path.of(System.getProperty("user.home"), ".term-schemes");
    public static final Path DEFAULT_CONFIG_FILE = DEFAULT_HOME.resolve("settings.json");
    public static final Path DEFAULT_USER_DIR = DEFAULT_HOME.resolve("schemes");
    public static final List<Path> DEFAULT_SYSTEM_DIRS = List.of(Path.of("/usr/share/term-schemes"));

    public SchemePaths resolve() {
        return resolve(DEFAULT_CONFIG_FILE);
    }

    public SchemePaths resolve(Path configFile) {
        if (!Files.isRegularFile(configFile)) {
            return defaults();
        }
        try {
            SettingsFile settings = MAPPER.readValue(configFile.toFile(), SettingsFile.class);
            Path baseDir = configFile.toAbsolutePath().getParent();
            Path userDir = isBlank(settings.userDir())
                    ? DEFAULT_USER_DIR
                    : resolvePath(baseDir, settings.userDir());
            List<Path> systemDirs = DEFAULT_SYSTEM_DIRS;
            if (settings.systemDirs() != null) {
                systemDirs = new ArrayList<>();
                for (String dir : settings.systemDirs()) {
                    if (!isBlank(dir)) {
                        systemDirs.add(resolvePath(baseDir, dir));
                    }
                }
            }
            LOGGER.info("Using color scheme directories user={} system={} from {}", userDir, systemDirs, configFile);
            return new SchemePaths(userDir, systemDirs);
        } catch (IOException e) {
            LOGGER.warn("Failed to load registry settings from {}", configFile, e);
            return defaults();
        }
    }

    public static SchemePaths defaults() {
        return new SchemePaths(DEFAULT_USER_DIR, DEFAULT_SYSTEM_DIRS);
    }

    private static Path resolvePath(Path baseDir, String text) {
        Path candidate = Paths.get(text.trim());
        if (!candidate.isAbsolute() && baseDir != null) {
            candidate = baseDir.resolve(candidate);
        }
        return candidate.toAbsolutePath().normalize();
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SettingsFile(@JsonProperty("userDir") String userDir,
                                @JsonProperty("systemDirs") List<String> systemDirs) {
    }
}

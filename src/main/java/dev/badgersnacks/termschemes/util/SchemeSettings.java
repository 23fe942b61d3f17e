package dev.badgersnacks.termschemes.util;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Sectioned key/value document backing the {@code .colorscheme} files.
 *
 * <p>The grammar is the usual desktop-entry style: {@code [Section]} headers, {@code key=value}
 * pairs and whole-line comments starting with {@code #} or {@code ;}. Section and key order is
 * preserved so files written back stay readable. Typed getters never throw on bad input; they
 * report an empty result and let the caller pick the fallback.
 */
public final class SchemeSettings {

    private final Map<String, Map<String, String>> sections = new LinkedHashMap<>();

    public static SchemeSettings load(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    public static SchemeSettings parse(Reader source) throws IOException {
        SchemeSettings settings = new SchemeSettings();
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        Map<String, String> current = null;
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith(";")) {
                continue;
            }
            if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
                String name = trimmed.substring(1, trimmed.length() - 1).strip();
                current = settings.sections.computeIfAbsent(name, ignore -> new LinkedHashMap<>());
                continue;
            }
            int separator = trimmed.indexOf('=');
            if (current == null || separator <= 0) {
                // keys outside any section and lines without '=' carry nothing we can use
                continue;
            }
            current.put(trimmed.substring(0, separator).strip(), trimmed.substring(separator + 1).strip());
        }
        return settings;
    }

    public void save(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeTo(writer);
        }
    }

    public void writeTo(Writer writer) throws IOException {
        boolean first = true;
        for (Map.Entry<String, Map<String, String>> section : sections.entrySet()) {
            if (!first) {
                writer.write(System.lineSeparator());
            }
            first = false;
            writer.write("[" + section.getKey() + "]");
            writer.write(System.lineSeparator());
            for (Map.Entry<String, String> entry : section.getValue().entrySet()) {
                writer.write(entry.getKey() + "=" + entry.getValue());
                writer.write(System.lineSeparator());
            }
        }
        writer.flush();
    }

    public Set<String> sectionNames() {
        return Collections.unmodifiableSet(sections.keySet());
    }

    public boolean hasSection(String section) {
        return sections.containsKey(section);
    }

    public boolean hasKey(String section, String key) {
        return getString(section, key).isPresent();
    }

    public Optional<String> getString(String section, String key) {
        Map<String, String> values = sections.get(section);
        if (values == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(key));
    }

    public OptionalInt getInt(String section, String key) {
        Optional<String> raw = getString(section, key);
        if (raw.isEmpty()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(raw.get()));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    public OptionalDouble getDouble(String section, String key) {
        Optional<String> raw = getString(section, key);
        if (raw.isEmpty()) {
            return OptionalDouble.empty();
        }
        try {
            double parsed = Double.parseDouble(raw.get());
            return Double.isFinite(parsed) ? OptionalDouble.of(parsed) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /**
     * Accepts {@code true/false}, {@code yes/no}, {@code on/off} and {@code 1/0}, case-insensitively.
     */
    public Optional<Boolean> getBoolean(String section, String key) {
        return getString(section, key).flatMap(SchemeSettings::parseBoolean);
    }

    private static Optional<Boolean> parseBoolean(String raw) {
        switch (raw.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on", "1":
                return Optional.of(Boolean.TRUE);
            case "false", "no", "off", "0":
                return Optional.of(Boolean.FALSE);
            default:
                return Optional.empty();
        }
    }

    public void put(String section, String key, String value) {
        Objects.requireNonNull(section, "section");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        sections.computeIfAbsent(section, ignore -> new LinkedHashMap<>()).put(key, value);
    }

    public void put(String section, String key, int value) {
        put(section, key, Integer.toString(value));
    }

    public void put(String section, String key, double value) {
        put(section, key, Double.toString(value));
    }

    public void put(String section, String key, boolean value) {
        put(section, key, Boolean.toString(value));
    }
}

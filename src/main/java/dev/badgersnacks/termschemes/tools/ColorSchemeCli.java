package dev.badgersnacks.termschemes.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.badgersnacks.termschemes.model.ColorEntry;
import dev.badgersnacks.termschemes.model.ColorScheme;
import dev.badgersnacks.termschemes.model.RandomizationRange;
import dev.badgersnacks.termschemes.persistence.RegistrySettings;
import dev.badgersnacks.termschemes.persistence.SchemePaths;
import dev.badgersnacks.termschemes.services.ColorSchemeRegistry;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Command line front end for the scheme registry: lists, inspects, installs, deletes and exports
 * color schemes without a terminal UI.
 */
public final class ColorSchemeCli {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String USAGE = """
            Usage: ColorSchemeCli [--config <settingsFile>] <command> [argument]

            Commands:
              list                 Print the names of all available color schemes.
              show <name>          Print one scheme as JSON (an empty name shows the default scheme).
              install <path>       Copy a .colorscheme or .schema file into the user scheme directory.
              delete <name>        Delete a user color scheme.
              export <outputFile>  Write every scheme to a JSON manifest (directories are created automatically).
            """;

    private ColorSchemeCli() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Path configFile = RegistrySettings.DEFAULT_CONFIG_FILE;
        List<String> positional = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            if (args[i].equals("--config")) {
                if (i + 1 >= args.length) {
                    err.println("--config requires a path argument");
                    return 1;
                }
                configFile = Paths.get(args[++i]).toAbsolutePath().normalize();
            } else {
                positional.add(args[i]);
            }
        }
        if (positional.isEmpty()) {
            err.println(USAGE);
            return 1;
        }

        SchemePaths paths = new RegistrySettings().resolve(configFile);
        try (ColorSchemeRegistry registry = new ColorSchemeRegistry(paths)) {
            String command = positional.get(0);
            String argument = positional.size() > 1 ? positional.get(1) : null;
            return switch (command) {
                case "list" -> list(registry, out);
                case "show" -> show(registry, argument == null ? "" : argument, out, err);
                case "install" -> install(registry, argument, out, err);
                case "delete" -> delete(registry, argument, out, err);
                case "export" -> export(registry, argument, out, err);
                default -> {
                    err.println("Unknown command: " + command);
                    err.println(USAGE);
                    yield 1;
                }
            };
        }
    }

    private static int list(ColorSchemeRegistry registry, PrintStream out) {
        for (String name : registry.colorSchemeNames()) {
            out.println(name);
        }
        return 0;
    }

    private static int show(ColorSchemeRegistry registry, String name, PrintStream out, PrintStream err) {
        Optional<ColorScheme> scheme = registry.findColorScheme(name);
        if (scheme.isEmpty()) {
            err.println("No color scheme named " + name);
            return 2;
        }
        try {
            out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(scheme.get())));
            return 0;
        } catch (IOException e) {
            err.println("Failed to render " + name + ": " + e.getMessage());
            return 1;
        }
    }

    private static int install(ColorSchemeRegistry registry, String argument, PrintStream out, PrintStream err) {
        if (argument == null) {
            err.println("install requires a path argument");
            return 1;
        }
        Path source = Paths.get(argument).toAbsolutePath().normalize();
        if (!registry.loadCustomColorScheme(source)) {
            err.println("Unable to load color scheme from " + source);
            return 2;
        }
        Path target = registry.paths().userDir().resolve(source.getFileName());
        try {
            if (!source.equals(target)) {
                Files.createDirectories(target.getParent());
                Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            err.println("Failed to copy " + source + " to " + target + ": " + e.getMessage());
            return 1;
        }
        out.printf("Installed %s%n", target);
        return 0;
    }

    private static int delete(ColorSchemeRegistry registry, String name, PrintStream out, PrintStream err) {
        if (name == null) {
            err.println("delete requires a scheme name");
            return 1;
        }
        if (!registry.deleteColorScheme(name)) {
            err.println("Unable to delete color scheme " + name);
            return 2;
        }
        out.printf("Deleted %s%n", name);
        return 0;
    }

    private static int export(ColorSchemeRegistry registry, String argument, PrintStream out, PrintStream err) {
        if (argument == null) {
            err.println("export requires an output file");
            return 1;
        }
        Path outputFile = Paths.get(argument).toAbsolutePath().normalize();
        List<ColorScheme> schemes = registry.allColorSchemes();

        ObjectNode root = MAPPER.createObjectNode();
        root.put("generated", Instant.now().toString());
        root.put("userDir", registry.paths().userDir().toString());
        ArrayNode systemDirs = root.putArray("systemDirs");
        registry.paths().systemDirs().forEach(dir -> systemDirs.add(dir.toString()));
        root.put("entries", schemes.size());
        ArrayNode schemesNode = root.putArray("schemes");
        for (ColorScheme scheme : schemes) {
            schemesNode.add(toJson(scheme));
        }

        try {
            Files.createDirectories(outputFile.getParent());
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(outputFile.toFile(), root);
        } catch (IOException e) {
            err.println("Failed to write " + outputFile + ": " + e.getMessage());
            return 1;
        }
        out.printf("Exported %d color schemes to %s%n", schemes.size(), outputFile);
        return 0;
    }

    static ObjectNode toJson(ColorScheme scheme) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("name", scheme.name());
        node.put("description", scheme.description());
        node.put("opacity", scheme.opacity());
        node.put("darkBackground", scheme.hasDarkBackground());
        node.put("randomizeBackground", scheme.randomizedBackgroundColor());
        ArrayNode colors = node.putArray("colors");
        ColorEntry[] table = scheme.getColorTable();
        for (int i = 0; i < ColorScheme.TABLE_COLORS; i++) {
            ObjectNode color = colors.addObject();
            color.put("slot", ColorScheme.colorNameForIndex(i));
            color.put("color", table[i].color().asString());
            color.put("transparent", table[i].transparent());
            color.put("bold", table[i].bold());
            RandomizationRange range = scheme.randomizationRange(i);
            if (!range.isNull()) {
                ObjectNode randomization = color.putObject("randomization");
                randomization.put("hue", range.hue());
                randomization.put("saturation", range.saturation());
                randomization.put("value", range.value());
            }
        }
        return node;
    }
}

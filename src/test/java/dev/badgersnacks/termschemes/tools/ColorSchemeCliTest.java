package dev.badgersnacks.termschemes.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ColorSchemeCliTest {

    @TempDir
    Path tempDir;

    private Path config;
    private Path userDir;
    private Path systemDir;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() throws IOException {
        userDir = Files.createDirectories(tempDir.resolve("user"));
        systemDir = Files.createDirectories(tempDir.resolve("system"));
        config = tempDir.resolve("settings.json");
        Files.writeString(config, """
                {"userDir": "user", "systemDirs": ["system"]}
                """);
        Files.writeString(systemDir.resolve("Solar.colorscheme"), """
                [General]
                Description=Solarized

                [Color0]
                Color=7,54,66
                HueRange=20
                """);
        Files.writeString(systemDir.resolve("Linux.schema"), "title Linux Colors\n");
    }

    @Test
    void listsSchemeNames() {
        assertEquals(0, run("--config", config.toString(), "list"));
        assertEquals("Linux\nSolar\n", stdout().replace("\r\n", "\n"));
    }

    @Test
    void showsSchemeAsJson() throws IOException {
        assertEquals(0, run("--config", config.toString(), "show", "Solar"));

        JsonNode node = new ObjectMapper().readTree(stdout());
        assertEquals("Solarized", node.path("description").asText());
        assertEquals("7,54,66", node.path("colors").get(2).path("color").asText());
        assertEquals(20, node.path("colors").get(2).path("randomization").path("hue").asInt());
        assertFalse(node.path("colors").get(3).has("randomization"));
    }

    @Test
    void showWithoutNameShowsDefault() throws IOException {
        assertEquals(0, run("--config", config.toString(), "show"));
        JsonNode node = new ObjectMapper().readTree(stdout());
        assertEquals("255,255,255", node.path("colors").get(0).path("color").asText());
    }

    @Test
    void exportWritesManifest() throws IOException {
        Path output = tempDir.resolve("out").resolve("schemes.json");

        assertEquals(0, run("--config", config.toString(), "export", output.toString()));

        JsonNode root = new ObjectMapper().readTree(output.toFile());
        assertEquals(2, root.path("entries").asInt());
        assertEquals(2, root.path("schemes").size());
    }

    @Test
    void installCopiesIntoUserDirectory() throws IOException {
        Path download = tempDir.resolve("Retro.schema");
        Files.writeString(download, "title Retro\ncolor 2 1 2 3 0 0\n");

        assertEquals(0, run("--config", config.toString(), "install", download.toString()));

        assertTrue(Files.isRegularFile(userDir.resolve("Retro.schema")));
    }

    @Test
    void refusesToDeleteSystemScheme() {
        assertEquals(2, run("--config", config.toString(), "delete", "Solar"));
        assertTrue(Files.exists(systemDir.resolve("Solar.colorscheme")));
    }

    @Test
    void unknownCommandFails() {
        assertEquals(1, run("--config", config.toString(), "paint"));
        assertTrue(stderr().contains("Unknown command"));
        assertEquals(1, run());
    }

    private int run(String... args) {
        return ColorSchemeCli.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}

package com.chordbook.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ChordbookCliTest {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @TempDir Path dir;

    @Test
    void noArgumentsPrintsUsage() {
        assertEquals(ChordbookCli.EXIT_USAGE, run());
        assertTrue(err().startsWith("Usage:"), err());
    }

    @Test
    void unknownOptionIsRejected() {
        assertEquals(ChordbookCli.EXIT_USAGE, run("--fast", "x.md"));
        assertTrue(err().contains("Unknown option: --fast"), err());
    }

    @Test
    void versionIsPrinted() {
        assertEquals(ChordbookCli.EXIT_OK, run("--version"));
        assertTrue(out().startsWith("chordbook 0.3.0-alpha"), out());
    }

    @Test
    void compilesFileToXml() throws IOException {
        Path song = write("songs.md", "# Morning\n\n1. `G`Hello `D`world\n");

        assertEquals(ChordbookCli.EXIT_OK, run(song.toString()));

        assertTrue(out().contains("<title>songs.md</title>"), out());
        assertTrue(out().contains("<title>Morning</title>"), out());
        assertTrue(out().contains("<i-chord chord=\"G\""), out());
        assertEquals("", err());
    }

    @Test
    void configFileSetsNotation() throws IOException {
        Path song = write("songs.md", "# Morning\n\n`H7`Hello\n");
        Path config = write("book.properties", "book.title=Hymns\nnotation=german\n");

        assertEquals(ChordbookCli.EXIT_OK, run("--config", config.toString(), song.toString()));

        assertTrue(out().contains("<title>Hymns</title>"), out());
        assertTrue(out().contains("<notation>german</notation>"), out());
        assertTrue(out().contains("<i-chord chord=\"H7\""), out());
    }

    @Test
    void strictModeFailsOnErrorsButStillPrintsTree() throws IOException {
        Path song = write("songs.md", "# Broken\n\n>>>\n");

        assertEquals(ChordbookCli.EXIT_ERRORS, run("--strict", song.toString()));
        assertTrue(err().contains("error: Unknown chorus reference: 3"), err());
        assertTrue(out().contains("<title>Broken</title>"), out());
    }

    @Test
    void errorsWithoutStrictStillSucceed() throws IOException {
        Path song = write("songs.md", "# Broken\n\n>>>\n");

        assertEquals(ChordbookCli.EXIT_OK, run(song.toString()));
    }

    @Test
    void missingInputIsReported() {
        assertEquals(ChordbookCli.EXIT_USAGE, run(dir.resolve("absent.md").toString()));
        assertTrue(err().startsWith("Cannot read input"), err());
    }

    @Test
    void invalidConfigIsReported() throws IOException {
        Path song = write("songs.md", "# A\n");
        Path config = write("book.properties", "book.title=X\nnotation=klingon\n");

        assertEquals(ChordbookCli.EXIT_USAGE, run("--config", config.toString(), song.toString()));
        assertTrue(err().startsWith("Invalid configuration"), err());
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content, StandardCharsets.UTF_8);
    }

    private int run(String... args) {
        return ChordbookCli.run(
                args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }
}

package com.yearlylikes.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlocklistLoaderTest {

    private final BlocklistLoader loader = new BlocklistLoader(new ObjectMapper());

    @TempDir
    Path tempDir;

    @Test
    void readsJsonArray() throws IOException {
        Path file = tempDir.resolve("blocked.json");
        Files.writeString(file, "  [\"Gamma\", \"Sigur Rós\"]\n");

        assertEquals(List.of("Gamma", "Sigur Rós"), loader.load(file));
    }

    @Test
    void readsTextLinesAndSkipsComments() throws IOException {
        Path file = tempDir.resolve("blocked.txt");
        Files.writeString(file, "# artists I am tired of\nGamma\n\n  Delta  \r\n#Beta\n");

        assertEquals(List.of("Gamma", "Delta"), loader.load(file));
    }

    @Test
    void invalidJsonIsAnIOException() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "[\"Gamma\", 42, {}]");

        IOException error = assertThrows(IOException.class, () -> loader.load(file));
        assertTrue(error.getMessage().contains("broken.json"));
    }

    @Test
    void missingFileIsAnIOException() {
        assertThrows(IOException.class, () -> loader.load(tempDir.resolve("nope.txt")));
    }
}

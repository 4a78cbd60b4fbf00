package com.raditha.codetwin.collector;

import com.raditha.codetwin.model.Side;
import com.raditha.codetwin.model.SourceFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SourceReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testReadsUtf8() throws IOException {
        Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(tempDir.resolve("src/a.js"), "const café = 1;");

        SourceFile file = new SourceReader(1024).read(tempDir, "src/a.js", Side.B);

        assertEquals("src/a.js", file.path());
        assertEquals(Side.B, file.side());
        assertEquals("const café = 1;", file.text());
    }

    @Test
    void testMalformedBytesReplaced() throws IOException {
        Files.write(tempDir.resolve("bin.c"), new byte[] { 'a', (byte) 0xFF, 'b' });

        SourceFile file = new SourceReader(1024).read(tempDir, "bin.c", Side.A);

        assertEquals("a\uFFFDb", file.text());
    }

    @Test
    void testTooLarge() throws IOException {
        Files.writeString(tempDir.resolve("big.py"), "x".repeat(100));

        SourceReader reader = new SourceReader(99);

        FileTooLargeException ex = assertThrows(FileTooLargeException.class,
                () -> reader.read(tempDir, "big.py", Side.A));
        assertTrue(ex.getMessage().contains("big.py"));
    }

    @Test
    void testMissingFile() {
        SourceReader reader = new SourceReader(10);
        assertThrows(NoSuchFileException.class, () -> reader.read(tempDir, "gone.js", Side.A));
    }

    @Test
    void testInvalidLimit() {
        assertThrows(IllegalArgumentException.class, () -> new SourceReader(0));
    }
}

package org.dxworks.codegraph.engine;

import org.dxworks.codegraph.model.SourceFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceReaderTest {

    @TempDir
    Path dir;

    private final SourceReader reader = new SourceReader();

    @Test
    void byteOrderMarkIsStripped() throws Exception {
        Path file = dir.resolve("Program.cs");
        Files.write(file, "\uFEFFclass Program {}\n".getBytes(StandardCharsets.UTF_8));

        SourceFile source = reader.read(file, "Program.cs");

        assertEquals("class Program {}\n", source.getText());
        assertEquals("Program.cs", source.getRelativePath());
        assertEquals(1, source.lineCount());
    }

    @Test
    void missingFileIsReportedWithItsPath() {
        Path file = dir.resolve("gone.ts");

        SourceReadException e = assertThrows(SourceReadException.class, () -> reader.read(file, "gone.ts"));

        assertEquals(file, e.getPath());
        assertTrue(e.getMessage().endsWith("file not found"));
    }

    @Test
    void malformedUtf8IsRejected() throws IOException {
        Path file = dir.resolve("latin1.py");
        Files.write(file, new byte[]{'x', ' ', '=', ' ', '"', (byte) 0xE9, '"', '\n'});

        SourceReadException e = assertThrows(SourceReadException.class, () -> reader.read(file, "latin1.py"));

        assertTrue(e.getMessage().endsWith("not valid UTF-8"));
    }
}

package org.dxworks.codegraph.engine;

import org.dxworks.codegraph.model.SourceFile;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/** Reads a whole file as UTF-8, rejecting malformed input instead of replacing it. */
public class SourceReader {

    public SourceFile read(Path file, String relativePath) throws SourceReadException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new SourceReadException(file, "file not found", e);
        } catch (AccessDeniedException e) {
            throw new SourceReadException(file, "permission denied", e);
        } catch (IOException e) {
            throw new SourceReadException(file, e.getMessage() == null ? e.toString() : e.getMessage(), e);
        }
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new SourceReadException(file, "not valid UTF-8", e);
        }
        // Remove BOM if present (common in C# files)
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        return new SourceFile(file, relativePath, text);
    }
}

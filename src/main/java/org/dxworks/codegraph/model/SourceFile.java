package org.dxworks.codegraph.model;

import java.nio.file.Path;

/** A file read completely into memory before any analysis starts. */
public class SourceFile {
    private final Path path;
    private final String relativePath;
    private final String text;

    public SourceFile(Path path, String relativePath, String text) {
        this.path = path;
        this.relativePath = relativePath.replace('\\', '/');
        this.text = text;
    }

    public Path getPath() {
        return path;
    }

    public String getRelativePath() {
        return relativePath;
    }

    public String getText() {
        return text;
    }

    public int lineCount() {
        if (text.isEmpty()) {
            return 0;
        }
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return text.endsWith("\n") ? count - 1 : count;
    }
}

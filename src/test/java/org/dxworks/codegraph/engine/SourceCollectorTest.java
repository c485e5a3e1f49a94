package org.dxworks.codegraph.engine;

import org.dxworks.codegraph.CodegraphConfig;
import org.dxworks.codegraph.TestUtils;
import org.dxworks.codegraph.model.DiagnosticKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileVisitor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceCollectorTest {

    @TempDir
    Path root;

    private final SourceCollector collector = new SourceCollector(CodegraphConfig.defaults(), TestUtils.REGISTRY);

    private void touch(String relative) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "\n");
    }

    private List<String> collect(Path target, List<String> extensions) {
        return collect(collector, target, extensions);
    }

    private List<String> collect(SourceCollector collector, Path target, List<String> extensions) {
        DiagnosticCollector diagnostics = new DiagnosticCollector();
        List<Path> files = collector.collect(target, extensions, diagnostics);
        assertTrue(diagnostics.isEmpty());
        return files.stream().map(file -> SourceCollector.relativePath(root, file)).collect(Collectors.toList());
    }

    @Test
    void walksKnownLanguagesAndSkipsExcludedDirectories() throws IOException {
        touch("src/b.ts");
        touch("src/a.py");
        touch("src/server.go");
        touch("README.md");
        touch("node_modules/pkg/index.js");
        touch(".git/hooks/pre-commit.py");

        assertEquals(List.of("src/a.py", "src/b.ts", "src/server.go"), collect(root, List.of()));
    }

    @Test
    void extensionFilterIgnoresCaseAndLeadingDots() throws IOException {
        touch("src/b.ts");
        touch("src/a.py");
        touch("src/server.go");

        assertEquals(List.of("src/b.ts", "src/server.go"), collect(root, List.of(".TS,go")));
    }

    @Test
    void singleFileTargetIsCollectedAlone() throws IOException {
        touch("src/b.ts");
        touch("src/c.ts");

        assertEquals(List.of("src/b.ts"), collect(root.resolve("src/b.ts"), List.of()));
        assertEquals("b.ts", SourceCollector.relativePath(SourceCollector.rootOf(root.resolve("src/b.ts")), root.resolve("src/b.ts")));
    }

    @Test
    void filesMatchedByTheIgnoreFileAreSkipped() throws IOException {
        touch("src/b.ts");
        touch("src/generated/g.ts");
        Path ignoreFile = root.resolve(".ignore");
        Files.writeString(ignoreFile, "**/generated/**\n");
        SourceCollector ignoring = new SourceCollector(CodegraphConfig.defaults().withIgnoreFile(ignoreFile), TestUtils.REGISTRY);

        assertEquals(List.of("src/b.ts"), collect(ignoring, root, List.of()));
        assertEquals(List.of("src/b.ts", "src/generated/g.ts"), collect(root, List.of()));
    }

    @Test
    void failedWalkIsReportedAsADiagnostic() throws IOException {
        touch("src/b.ts");
        SourceCollector failing = new SourceCollector(CodegraphConfig.defaults(), TestUtils.REGISTRY) {
            @Override
            void walk(Path target, FileVisitor<Path> visitor) throws IOException {
                throw new AccessDeniedException(target.toString());
            }
        };
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        assertTrue(failing.collect(root, List.of(), diagnostics).isEmpty());
        assertEquals(1, diagnostics.ofKind(DiagnosticKind.IO_FAILURE).size());
        assertEquals(root.toString(), diagnostics.list().get(0).getFilePath());
    }

    @Test
    void missingTargetIsAnInvalidRequest() {
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> collector.collect(root.resolve("nowhere"), List.of(), new DiagnosticCollector()));
        assertTrue(e.getMessage().contains("does not exist"));
    }
}

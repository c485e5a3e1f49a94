package org.dxworks.codegraph.extract;

import org.dxworks.codegraph.TestUtils;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ImportScannerTest {

    private final ImportScanner scanner = new ImportScanner();

    @Test
    void goImportBlockAndSingleImport() throws IOException {
        List<ImportScanner.ImportRef> imports = scanner.scan(TestUtils.readSample("go/server.go"), TestUtils.profile("server.go"));

        assertEquals(List.of("fmt", "example.com/app/store", "os"), targets(imports));
        assertEquals(List.of(4, 5, 8), imports.stream().map(i -> i.line).collect(Collectors.toList()));
    }

    @Test
    void pythonImportsSeveralModulesPerLine() {
        String source = "import os, sys as system\nfrom . import models, views\nfrom ..core.base import Thing\n";
        List<ImportScanner.ImportRef> imports = scanner.scan(source, TestUtils.profile("app.py"));

        assertEquals(List.of("os", "sys", ".models", ".views", "..core.base"), targets(imports));
    }

    @Test
    void importsInCommentsAreIgnored() {
        String source = "// import { x } from './commented';\nimport { y } from './real';\nconst z = require('./other');\n";
        List<ImportScanner.ImportRef> imports = scanner.scan(source, TestUtils.profile("index.ts"));

        assertEquals(List.of("./real", "./other"), targets(imports));
    }

    @Test
    void exportsAreTopLevelDeclarations() throws IOException {
        assertEquals(List.of("Scores", "average"),
                scanner.exports(TestUtils.readSample("python/scores.py"), TestUtils.profile("scores.py")));
        assertEquals(List.of("Start"),
                scanner.exports(TestUtils.readSample("go/server.go"), TestUtils.profile("server.go")));
    }

    private static List<String> targets(List<ImportScanner.ImportRef> imports) {
        return imports.stream().map(i -> i.target).collect(Collectors.toList());
    }
}

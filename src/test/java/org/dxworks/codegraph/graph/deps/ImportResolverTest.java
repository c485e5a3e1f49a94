package org.dxworks.codegraph.graph.deps;

import org.dxworks.codegraph.Language;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImportResolverTest {

    private static ImportResolver resolver(Language language, String... paths) {
        Map<String, Language> files = new LinkedHashMap<>();
        for (String path : paths) {
            files.put(path, language);
        }
        return new ImportResolver(files);
    }

    @Test
    void scriptSpecifiersTryExtensionsAndIndexFiles() {
        ImportResolver resolver = resolver(Language.TYPESCRIPT,
                "src/app.ts", "src/util.ts", "src/models/index.ts", "lib/shared.tsx");

        assertEquals(List.of("src/util.ts"), resolver.resolve("src/app.ts", Language.TYPESCRIPT, "./util"));
        assertEquals(List.of("src/util.ts"), resolver.resolve("src/app.ts", Language.TYPESCRIPT, "./util.js"));
        assertEquals(List.of("src/models/index.ts"), resolver.resolve("src/app.ts", Language.TYPESCRIPT, "./models"));
        assertEquals(List.of("lib/shared.tsx"), resolver.resolve("src/app.ts", Language.TYPESCRIPT, "../lib/shared"));
        assertTrue(resolver.resolve("src/app.ts", Language.TYPESCRIPT, "react").isEmpty());
        assertTrue(resolver.resolve("src/app.ts", Language.TYPESCRIPT, "../../outside").isEmpty());
    }

    @Test
    void pythonRelativeAndAbsoluteImports() {
        ImportResolver resolver = resolver(Language.PYTHON,
                "pkg/__init__.py", "pkg/core/__init__.py", "pkg/core/base.py", "pkg/views.py", "tests/pkg/views.py");

        assertEquals(List.of("pkg/views.py"), resolver.resolve("pkg/core/base.py", Language.PYTHON, "..views"));
        assertEquals(List.of("pkg/core/base.py"), resolver.resolve("pkg/views.py", Language.PYTHON, ".core.base"));
        assertEquals(List.of("pkg/core/__init__.py"), resolver.resolve("pkg/views.py", Language.PYTHON, "pkg.core"));
        assertEquals(List.of("pkg/__init__.py"), resolver.resolve("pkg/views.py", Language.PYTHON, "."));
        assertTrue(resolver.resolve("pkg/views.py", Language.PYTHON, "os").isEmpty());
    }

    @Test
    void pythonSuffixMatchPrefersTheShortestPath() {
        ImportResolver resolver = resolver(Language.PYTHON,
                "app/main.py", "src/lib/helpers.py", "vendor/src/lib/helpers.py");

        assertEquals(List.of("src/lib/helpers.py"), resolver.resolve("app/main.py", Language.PYTHON, "lib.helpers"));
    }

    @Test
    void qualifiedNamesMatchTheEndOfFilePaths() {
        ImportResolver resolver = resolver(Language.JAVA,
                "src/main/java/com/acme/Order.java",
                "src/main/java/com/acme/Customer.java",
                "src/main/java/com/acme/web/Controller.java");

        assertEquals(List.of("src/main/java/com/acme/Order.java"),
                resolver.resolve("src/main/java/com/acme/web/Controller.java", Language.JAVA, "com.acme.Order"));
        assertEquals(List.of("src/main/java/com/acme/Order.java"),
                resolver.resolve("src/main/java/com/acme/web/Controller.java", Language.JAVA, "com.acme.Order.create"));
        assertEquals(List.of("src/main/java/com/acme/Customer.java", "src/main/java/com/acme/Order.java"),
                resolver.resolve("src/main/java/com/acme/web/Controller.java", Language.JAVA, "com.acme.*"));
        assertTrue(resolver.resolve("src/main/java/com/acme/Order.java", Language.JAVA, "java.util.List").isEmpty());
    }

    @Test
    void goPackagesSkipTestFilesAndTheImportersOwnDirectory() {
        ImportResolver resolver = resolver(Language.GO,
                "cmd/main.go", "store/store.go", "store/store_test.go", "store/cache.go");

        assertEquals(List.of("store/cache.go", "store/store.go"),
                resolver.resolve("cmd/main.go", Language.GO, "example.com/app/store"));
        assertTrue(resolver.resolve("store/cache.go", Language.GO, "example.com/app/store").isEmpty());
        assertTrue(resolver.resolve("cmd/main.go", Language.GO, "fmt").isEmpty());
    }

    @Test
    void includesResolveRelativeToTheIncludingFile() {
        ImportResolver resolver = resolver(Language.C, "src/main.c", "src/util.h", "include/config.h");

        assertEquals(List.of("src/util.h"), resolver.resolve("src/main.c", Language.C, "util.h"));
        assertEquals(List.of("include/config.h"), resolver.resolve("src/main.c", Language.C, "config.h"));
        assertTrue(resolver.resolve("src/main.c", Language.C, "stdio.h").isEmpty());
    }

    @Test
    void rustPathsStartAtTheCrateRoot() {
        ImportResolver resolver = resolver(Language.RUST,
                "src/main.rs", "src/parser.rs", "src/parser/lexer.rs", "src/net/mod.rs");

        assertEquals(List.of("src/parser/lexer.rs"), resolver.resolve("src/main.rs", Language.RUST, "crate::parser::lexer::Token"));
        assertEquals(List.of("src/parser.rs"), resolver.resolve("src/main.rs", Language.RUST, "parser"));
        assertEquals(List.of("src/net/mod.rs"), resolver.resolve("src/main.rs", Language.RUST, "net"));
        assertEquals(List.of("src/parser/lexer.rs"), resolver.resolve("src/parser.rs", Language.RUST, "lexer"));
        assertTrue(resolver.resolve("src/main.rs", Language.RUST, "std::collections::HashMap").isEmpty());
    }

    @Test
    void languageFamiliesImportEachOther() {
        Map<String, Language> files = new LinkedHashMap<>();
        files.put("web/app.ts", Language.TYPESCRIPT);
        files.put("web/legacy.js", Language.JAVASCRIPT);
        files.put("src/com/acme/Order.java", Language.JAVA);
        files.put("src/com/acme/Main.kt", Language.KOTLIN);
        files.put("scripts/com/acme/Order.py", Language.PYTHON);
        ImportResolver resolver = new ImportResolver(files);

        assertEquals(List.of("web/legacy.js"), resolver.resolve("web/app.ts", Language.TYPESCRIPT, "./legacy"));
        assertEquals(List.of("src/com/acme/Order.java"), resolver.resolve("src/com/acme/Main.kt", Language.KOTLIN, "com.acme.Order"));
    }

    @Test
    void normalizeFoldsDotsAndRefusesToClimbAboveTheRoot() {
        assertEquals("a/c", ImportResolver.normalize("a/./b/../c"));
        assertEquals("", ImportResolver.normalize("a/.."));
        assertNull(ImportResolver.normalize("../a"));
    }
}

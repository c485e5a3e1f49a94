package org.dxworks.codegraph.graph.deps;

import org.dxworks.codegraph.Language;
import org.dxworks.codegraph.TestUtils;
import org.dxworks.codegraph.extract.ImportScanner;
import org.dxworks.codegraph.model.SourceFile;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DependencyGraphTest {

    private final DependencyGraphBuilder builder = new DependencyGraphBuilder(TestUtils.REGISTRY);

    @Test
    void importCycleIsReportedOnceFromItsSmallestModule() throws IOException {
        List<SourceFile> files = new ArrayList<>();
        for (String name : List.of("c.ts", "a.ts", "b.ts")) {
            files.add(new SourceFile(TestUtils.sample("deps/" + name), name, TestUtils.readSample("deps/" + name)));
        }
        DependencyGraph graph = builder.build(files);

        assertEquals(3, graph.moduleCount());
        assertEquals(3, graph.edgeCount());
        assertTrue(graph.hasCycles());
        assertEquals(List.of(List.of("a.ts", "b.ts", "c.ts", "a.ts")), graph.cyclePaths());
        assertTrue(graph.roots().isEmpty());
        assertTrue(graph.leaves().isEmpty());
        assertEquals(List.of("a", "b", "c"), graph.modules().stream().map(m -> m.modulePath).collect(Collectors.toList()));
        assertEquals(List.of("a"), graph.module(0).getExports());
        assertEquals(Map.of(0, 0, 1, 1, 2, 2), graph.depths());
        assertEquals(2, graph.maxDepth());
    }

    @Test
    void depthIsTheLongestImportChain() {
        DependencyGraph graph = builder.assemble(List.of(
                module("app.ts", "./service", "./util"),
                module("service.ts", "./util"),
                module("util.ts")));

        ModuleNode app = graph.find("app.ts").orElseThrow();
        ModuleNode util = graph.find("util").orElseThrow();
        assertFalse(graph.hasCycles());
        assertEquals(0, graph.depthOf(app.id));
        assertEquals(2, graph.depthOf(util.id));
        assertEquals(List.of(app), graph.roots());
        assertEquals(List.of(util), graph.leaves());
        assertEquals(2, graph.dependentsOf(util.id).size());
        assertEquals(2, graph.dependenciesOf(app.id).size());
    }

    @Test
    void selfImportKeepsItsEdgeAndFormsACycle() {
        DependencyGraph graph = builder.assemble(List.of(module("loop.ts", "./loop")));

        ModuleNode loop = graph.module(0);
        assertTrue(loop.isSelfImport());
        assertEquals(1, graph.edgeCount());
        assertEquals(List.of(List.of("loop.ts", "loop.ts")), graph.cyclePaths());
        assertEquals(List.of(loop), graph.roots());
        assertEquals(0, graph.maxDepth());
    }

    @Test
    void unresolvedImportsStayOnTheModule() {
        DependencyGraph graph = builder.assemble(List.of(module("main.ts", "react", "./missing", "./lib"), module("lib.ts")));

        ModuleNode main = graph.find("main.ts").orElseThrow();
        assertEquals(List.of("react", "./missing"), main.getUnresolvedImports());
        assertEquals(1, graph.edgeCount());
        assertEquals(3, graph.edges().get(0).getKind().getLine());
    }

    @Test
    void duplicateModulesAreSkipped() {
        DependencyGraph graph = builder.assemble(List.of(module("x.ts"), module("x.ts")));

        assertEquals(1, graph.moduleCount());
    }

    @Test
    void filesWithoutAProfileAreNotScanned() {
        SourceFile readme = new SourceFile(Paths.get("README.md"), "README.md", "# title\n");

        assertTrue(builder.scan(readme).isEmpty());
    }

    private static DependencyGraphBuilder.ModuleImports module(String path, String... imports) {
        List<ImportScanner.ImportRef> refs = new ArrayList<>();
        for (int i = 0; i < imports.length; i++) {
            refs.add(new ImportScanner.ImportRef(imports[i], i + 1));
        }
        return new DependencyGraphBuilder.ModuleImports(path, Language.TYPESCRIPT, refs, List.of());
    }
}

package org.dxworks.codegraph.engine;

import org.dxworks.codegraph.CodegraphConfig;
import org.dxworks.codegraph.LanguageProfile;
import org.dxworks.codegraph.TestUtils;
import org.dxworks.codegraph.Language;
import org.dxworks.codegraph.extract.GrammarExtractor;
import org.dxworks.codegraph.extract.ParseFailureException;
import org.dxworks.codegraph.extract.SyntaxExtractor;
import org.dxworks.codegraph.graph.callgraph.CallGraph;
import org.dxworks.codegraph.graph.callgraph.FunctionNode;
import org.dxworks.codegraph.graph.deps.DependencyGraph;
import org.dxworks.codegraph.model.Diagnostic;
import org.dxworks.codegraph.model.DiagnosticKind;
import org.dxworks.codegraph.model.SourceFile;
import org.dxworks.codegraph.model.SyntaxTree;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnalysisEngineTest {

    @TempDir
    Path project;

    private void writeProject() throws IOException {
        Files.writeString(project.resolve("app.ts"), "import { helper } from './util';\n"
                + "export function main() {\n"
                + "    helper();\n"
                + "}\n");
        Files.writeString(project.resolve("util.ts"), "export function helper() {\n"
                + "    return 1;\n"
                + "}\n");
        Files.write(project.resolve("broken.ts"), new byte[]{'l', 'e', 't', ' ', (byte) 0xC3, (byte) 0x28, ';', '\n'});
        Files.createDirectories(project.resolve("node_modules/lib"));
        Files.writeString(project.resolve("node_modules/lib/index.ts"), "export function vendored() {}\n");
    }

    @Test
    void unreadableFilesAreDroppedAndTheRestIsAnalyzed() throws IOException {
        writeProject();
        try (AnalysisEngine engine = new AnalysisEngine(CodegraphConfig.with(0, 2, true), TestUtils.REGISTRY)) {
            List<SourceFile> files = engine.read(project, List.of());

            assertEquals(List.of("app.ts", "util.ts"),
                    files.stream().map(SourceFile::getRelativePath).collect(Collectors.toList()));
            List<Diagnostic> failures = engine.getDiagnostics().ofKind(DiagnosticKind.IO_FAILURE);
            assertEquals(1, failures.size());
            assertEquals("broken.ts", failures.get(0).getFilePath());
            assertTrue(failures.get(0).isSkip());
        }
    }

    @Test
    void filesOverTheLineLimitAreSkipped() throws IOException {
        writeProject();
        try (AnalysisEngine engine = new AnalysisEngine(CodegraphConfig.with(3, 2, true), TestUtils.REGISTRY)) {
            List<SourceFile> files = engine.read(project, List.of("ts"));

            assertEquals(List.of("util.ts"),
                    files.stream().map(SourceFile::getRelativePath).collect(Collectors.toList()));
            List<Diagnostic> tooLarge = engine.getDiagnostics().ofKind(DiagnosticKind.FILE_TOO_LARGE);
            assertEquals(1, tooLarge.size());
            assertEquals("app.ts", tooLarge.get(0).getFilePath());
        }
    }

    @Test
    void unexpectedExtractionFailureDropsOnlyThatFile() throws IOException {
        writeProject();
        SyntaxExtractor failing = new SyntaxExtractor(true) {
            @Override
            public SyntaxTree extract(SourceFile file, LanguageProfile profile) throws ParseFailureException {
                if (file.getRelativePath().equals("util.ts")) {
                    throw new IllegalStateException("extractor bug");
                }
                return super.extract(file, profile);
            }
        };
        try (AnalysisEngine engine = new AnalysisEngine(CodegraphConfig.with(0, 2, true), TestUtils.REGISTRY, failing)) {
            List<SyntaxTree> trees = engine.extract(engine.read(project, List.of()));

            assertEquals(List.of("app.ts"),
                    trees.stream().map(SyntaxTree::getFilePath).collect(Collectors.toList()));
            List<Diagnostic> failures = engine.getDiagnostics().ofKind(DiagnosticKind.ANALYSIS_FAILURE);
            assertEquals(1, failures.size());
            assertEquals("util.ts", failures.get(0).getFilePath());
            assertTrue(failures.get(0).isSkip());
            assertTrue(failures.get(0).getMessage().contains("extractor bug"));

            CallGraph graph = engine.callGraph(trees);
            assertEquals(List.of("helper"), graph.find("main").orElseThrow().getUnresolvedCalls());
        }
    }

    @Test
    void malformedPythonFileIsSkippedAndTheRestIsAnalyzed() throws IOException {
        Files.writeString(project.resolve("bad.py"), "def f(:\n    pass\n");
        Files.writeString(project.resolve("good.py"), "def g():\n    return 1\n");
        try (AnalysisEngine engine = new AnalysisEngine(CodegraphConfig.with(0, 2, true), TestUtils.REGISTRY)) {
            List<SyntaxTree> trees = engine.extract(engine.read(project, List.of("py")));

            assertEquals(List.of("good.py"),
                    trees.stream().map(SyntaxTree::getFilePath).collect(Collectors.toList()));
            assertFalse(trees.get(0).isHeuristic());
            List<Diagnostic> failures = engine.getDiagnostics().ofKind(DiagnosticKind.PARSE_FAILURE);
            assertEquals(1, failures.size());
            assertEquals("bad.py", failures.get(0).getFilePath());
            assertEquals("syntax error near line 1", failures.get(0).getMessage());
            assertTrue(failures.get(0).isSkip());
        }
    }

    @Test
    void missingGrammarFallsBackToPatterns() throws IOException {
        Files.writeString(project.resolve("good.py"), "def g():\n    return 1\n");
        GrammarExtractor noPython = new GrammarExtractor(true) {
            @Override
            public boolean supports(Language language) {
                return language != Language.PYTHON && super.supports(language);
            }
        };
        try (AnalysisEngine engine = new AnalysisEngine(CodegraphConfig.with(0, 2, true), TestUtils.REGISTRY,
                new SyntaxExtractor(noPython))) {
            List<SyntaxTree> trees = engine.extract(engine.read(project, List.of("py")));

            assertEquals(1, trees.size());
            assertTrue(trees.get(0).isHeuristic());
            assertTrue(trees.get(0).function("g").isPresent());
            List<Diagnostic> fallbacks = engine.getDiagnostics().ofKind(DiagnosticKind.GRAMMAR_UNAVAILABLE);
            assertEquals(1, fallbacks.size());
            assertEquals("good.py", fallbacks.get(0).getFilePath());
            assertFalse(fallbacks.get(0).isSkip());
        }
    }

    @Test
    void callsResolveAcrossFiles() throws IOException {
        writeProject();
        try (AnalysisEngine engine = new AnalysisEngine(CodegraphConfig.with(0, 2, true), TestUtils.REGISTRY)) {
            List<SyntaxTree> trees = engine.extract(engine.read(project, List.of()));
            CallGraph graph = engine.callGraph(trees);

            FunctionNode main = graph.find("main").orElseThrow();
            FunctionNode helper = graph.find("helper").orElseThrow();
            assertEquals(1, graph.callDepth(main.id, helper.id));
            assertTrue(main.isEntryPoint());
            assertTrue(graph.deadFunctions().isEmpty());
        }
    }

    @Test
    void importsBecomeDependencyEdges() throws IOException {
        writeProject();
        try (AnalysisEngine engine = new AnalysisEngine(CodegraphConfig.with(0, 2, true), TestUtils.REGISTRY)) {
            DependencyGraph graph = engine.dependencyGraph(engine.read(project, List.of()));

            assertEquals(2, graph.moduleCount());
            assertEquals(1, graph.edgeCount());
            assertEquals("util.ts", graph.dependenciesOf(graph.find("app.ts").orElseThrow().id).get(0).filePath);
            assertEquals(1, graph.maxDepth());
        }
    }

    @Test
    void everyFunctionGetsItsOwnAnalysis() throws IOException {
        writeProject();
        try (AnalysisEngine engine = new AnalysisEngine(CodegraphConfig.with(0, 2, true), TestUtils.REGISTRY)) {
            SyntaxTree tree = engine.extract(engine.read(project.resolve("util.ts"), List.of())).get(0);
            List<FunctionAnalysis> analyses = engine.analyzeFunctions(tree);

            assertEquals(1, analyses.size());
            FunctionAnalysis helper = analyses.get(0);
            assertEquals("helper", helper.getFunction().name);
            assertEquals(1, helper.getControlFlow().cyclomaticComplexity());
            assertTrue(helper.getProgramDependency().nodeCount() >= 2);
        }
    }
}

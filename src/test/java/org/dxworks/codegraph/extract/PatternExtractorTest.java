package org.dxworks.codegraph.extract;

import org.dxworks.codegraph.TestUtils;
import org.dxworks.codegraph.model.DeclKind;
import org.dxworks.codegraph.model.DeclNode;
import org.dxworks.codegraph.model.FunctionUnit;
import org.dxworks.codegraph.model.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternExtractorTest {

    @Test
    void extractsFunctionsAndCallSites() throws IOException {
        SyntaxTree tree = TestUtils.extractSample("typescript/calls.ts");

        assertTrue(tree.isHeuristic());
        assertEquals("calls", tree.getModulePath());
        assertEquals(List.of("f", "g", "main", "unused"), names(tree.ofKind(DeclKind.FUNCTION)));
        assertEquals(4, tree.getFunctions().size());

        List<DeclNode> calls = tree.ofKind(DeclKind.CALL_SITE);
        assertEquals(List.of("g", "f", "f", "log"), names(calls));
        assertEquals("calls::f", calls.get(0).enclosingFunction);
        assertEquals(5, calls.get(0).startLine);
        assertEquals("console", calls.get(3).receiver);
        assertEquals("calls::main", calls.get(3).enclosingFunction);
    }

    @Test
    void keywordsOfOtherLanguagesAreValidFunctionNames() {
        String source = "function map(xs) {\n"
                + "    return xs;\n"
                + "}\n"
                + "function range(n) {\n"
                + "    return n;\n"
                + "}\n"
                + "function go() {\n"
                + "    map(1);\n"
                + "}\n";
        SyntaxTree tree = TestUtils.extract("util.ts", source);

        assertEquals(List.of("map", "range", "go"), names(tree.ofKind(DeclKind.FUNCTION)));
        List<DeclNode> calls = tree.ofKind(DeclKind.CALL_SITE);
        assertEquals(List.of("map"), names(calls));
        assertEquals("util::go", calls.get(0).enclosingFunction);
        assertEquals(8, calls.get(0).startLine);
    }

    @Test
    void functionBodyKeepsLineOffsets() throws IOException {
        SyntaxTree tree = TestUtils.extractSample("typescript/branches.ts");
        FunctionUnit classify = tree.function("classify").orElseThrow();

        assertEquals(1, classify.startLine);
        assertEquals(8, classify.endLine);
        assertEquals(1, classify.bodyStartLine);
        assertEquals(List.of("x"), classify.parameters);
        assertTrue(classify.bodyText.contains("log(\"unreachable\")"));
    }

    @Test
    void nestsMethodsUnderTheirClass() throws IOException {
        SyntaxTree tree = TestUtils.extractSample("python/scores.py");

        DeclNode scores = tree.ofKind(DeclKind.CLASS).get(0);
        assertEquals("Scores", scores.name);
        DeclNode best = tree.ofKind(DeclKind.FUNCTION).get(0);
        assertEquals("scores::Scores.best", best.qualifiedName);
        assertEquals(scores.id, best.parentId);
        assertEquals(List.of("self", "values"), best.parameters);
        assertEquals(List.of(best), tree.childrenOf(scores.id).stream()
                .filter(child -> child.kind == DeclKind.FUNCTION).collect(Collectors.toList()));

        DeclNode average = tree.ofKind(DeclKind.FUNCTION).get(1);
        assertEquals("scores::average", average.qualifiedName);
        assertTrue(average.isTopLevel());

        assertEquals(List.of("os", ".helpers"), names(tree.ofKind(DeclKind.IMPORT)));
    }

    @Test
    void recordsLocalVariables() throws IOException {
        SyntaxTree tree = TestUtils.extractSample("typescript/flow.ts");

        List<DeclNode> variables = tree.ofKind(DeclKind.VARIABLE);
        assertEquals(List.of("a", "b"), names(variables));
        assertEquals("flow::compute", variables.get(0).enclosingFunction);
    }

    private static List<String> names(List<DeclNode> nodes) {
        return nodes.stream().map(n -> n.name).collect(Collectors.toList());
    }
}

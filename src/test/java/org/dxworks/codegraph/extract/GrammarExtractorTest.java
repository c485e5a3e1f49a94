package org.dxworks.codegraph.extract;

import org.dxworks.codegraph.TestUtils;
import org.dxworks.codegraph.graph.cfg.ControlFlowBuilder;
import org.dxworks.codegraph.graph.cfg.ControlFlowGraph;
import org.dxworks.codegraph.graph.dfg.DataFlowBuilder;
import org.dxworks.codegraph.graph.dfg.DataFlowGraph;
import org.dxworks.codegraph.model.DeclKind;
import org.dxworks.codegraph.model.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GrammarExtractorTest {

    @Test
    void codeAfterReturnInBothBranchesIsUnreachable() throws ParseFailureException {
        String source = "function classify(x) {\n"
                + "    if (x > 0) {\n"
                + "        return 1;\n"
                + "    } else {\n"
                + "        return 2;\n"
                + "    }\n"
                + "    log(\"unreachable\");\n"
                + "}\n";
        SyntaxTree tree = TestUtils.extractWithGrammar("classify.js", source);
        ControlFlowGraph cfg = new ControlFlowBuilder().build(TestUtils.parse(tree, "classify"));

        assertFalse(tree.isHeuristic());
        assertEquals(2, cfg.cyclomaticComplexity());
        assertEquals(Set.of(4), cfg.unreachable());
        assertEquals(7, cfg.block(4).getStartLine());
    }

    @Test
    void pythonBodiesKeepTheirIndentation() throws ParseFailureException {
        String source = "def compute():\n"
                + "    a = 1\n"
                + "    b = a + 1\n"
                + "    return a\n";
        SyntaxTree tree = TestUtils.extractWithGrammar("compute.py", source);
        DataFlowGraph dfg = new DataFlowBuilder().build(TestUtils.parse(tree, "compute"));

        List<String> unused = dfg.unusedDefinitions().stream().map(v -> v.name).collect(Collectors.toList());
        assertEquals(List.of("b"), unused);
        assertEquals(2, dfg.usesOf(dfg.definitionsOf("a").get(0).id).size());
    }

    @Test
    void syntaxErrorFailsTheFile() {
        ParseFailureException failure = assertThrows(ParseFailureException.class,
                () -> TestUtils.extractWithGrammar("broken.py", "def f(:\n    pass\n"));

        assertEquals("syntax error near line 1", failure.getMessage());
    }

    @Test
    void syntaxErrorIsToleratedWhenNotFailing() throws ParseFailureException {
        String source = "def ok():\n"
                + "    return 1\n"
                + "\n"
                + "def f(:\n"
                + "    pass\n";
        SyntaxTree tree = new GrammarExtractor(false).extract("broken.py", source, TestUtils.profile("broken.py"));

        assertTrue(tree.ofKind(DeclKind.FUNCTION).stream().anyMatch(f -> f.name.equals("ok")));
    }

    @Test
    void requireCallsAreImports() throws ParseFailureException {
        String source = "const fs = require('fs');\n"
                + "function read(path) {\n"
                + "    return fs.readFileSync(path);\n"
                + "}\n";
        SyntaxTree tree = TestUtils.extractWithGrammar("read.js", source);

        assertEquals(List.of("fs"), tree.ofKind(DeclKind.IMPORT).stream().map(i -> i.target).collect(Collectors.toList()));
        assertEquals("fs", tree.ofKind(DeclKind.CALL_SITE).stream()
                .filter(c -> c.name.equals("readFileSync")).findFirst().orElseThrow().receiver);
    }
}

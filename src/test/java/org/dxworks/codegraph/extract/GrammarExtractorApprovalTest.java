package org.dxworks.codegraph.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.approvaltests.Approvals;
import org.dxworks.codegraph.TestUtils;
import org.dxworks.codegraph.model.DeclKind;
import org.dxworks.codegraph.model.DeclNode;
import org.dxworks.codegraph.model.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class GrammarExtractorApprovalTest {

    @Test
    void extract_Java_Account() throws IOException, ParseFailureException {
        Approvals.verify(summarize(TestUtils.extractSampleWithGrammar("java/Account.java")));
    }

    @Test
    void extract_Python_Inventory() throws IOException, ParseFailureException {
        Approvals.verify(summarize(TestUtils.extractSampleWithGrammar("python/inventory.py")));
    }

    @Test
    void extract_JavaScript_Cart() throws IOException, ParseFailureException {
        Approvals.verify(summarize(TestUtils.extractSampleWithGrammar("javascript/cart.js")));
    }

    private static String summarize(SyntaxTree tree) throws JsonProcessingException {
        List<Map<String, Object>> declarations = new ArrayList<>();
        for (DeclNode node : tree.getNodes()) {
            Map<String, Object> declaration = new LinkedHashMap<>();
            declaration.put("kind", node.kind.name());
            declaration.put("name", node.qualifiedName);
            declaration.put("lines", node.startLine + "-" + node.endLine);
            if (node.kind == DeclKind.FUNCTION) {
                declaration.put("parameters", node.parameters);
            }
            if (node.kind == DeclKind.FUNCTION || node.kind == DeclKind.CLASS) {
                declaration.put("visibility", node.visibility);
            }
            if (node.kind == DeclKind.CALL_SITE) {
                declaration.put("enclosing", node.enclosingFunction);
                if (node.receiver != null) {
                    declaration.put("receiver", node.receiver);
                }
            }
            declarations.add(declaration);
        }
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("file", tree.getFilePath());
        summary.put("language", tree.getLanguage());
        summary.put("heuristic", tree.isHeuristic());
        summary.put("declarations", declarations);
        return TestUtils.APPROVAL_MAPPER.writeValueAsString(summary) + "\n";
    }
}

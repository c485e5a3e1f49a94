package org.dxworks.codegraph.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextRendererTest {

    private static GraphDocument document(String title) {
        GraphDocument document = new GraphDocument(GraphExporter.CONTROL_FLOW, title).meta("complexity", 2);
        document.addNode(0, "entry");
        document.addNode(1, "exit");
        document.addEdge(0, 1, "sequential");
        return document;
    }

    @Test
    void summaryListsCountsKindsAndFindings() {
        String text = new TextRenderer().render(document("demo::check"));

        assertEquals("control-flow demo::check\n"
                + "  nodes: 2\n"
                + "  edges: 1\n"
                + "  kinds: {entry=1, exit=1}\n"
                + "  complexity: 2\n", text);
    }

    @Test
    void singleKindIsNotListed() {
        GraphDocument document = new GraphDocument(GraphExporter.CALL_GRAPH, "project");
        document.addNode(0, "function");

        assertEquals("call-graph project\n  nodes: 1\n  edges: 0\n", new TextRenderer().render(document));
    }

    @Test
    void jsonWritesOneDocumentAsAnObjectAndSeveralAsAnArray() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        JsonNode single = mapper.readTree(ExportFormat.JSON.render(List.of(document("a"))));
        JsonNode several = mapper.readTree(ExportFormat.JSON.render(List.of(document("a"), document("b"))));

        assertTrue(single.isObject());
        assertTrue(several.isArray());
        assertEquals("b", several.get(1).get("metadata").get("title").asText());
    }

    @Test
    void textAndDotRenderEveryDocument() throws Exception {
        String text = ExportFormat.TEXT.render(List.of(document("a"), document("b")));
        String dot = ExportFormat.DOT.render(List.of(document("a"), document("b")));

        assertTrue(text.contains("control-flow a\n"));
        assertTrue(text.contains("\n\ncontrol-flow b\n"));
        assertEquals(2, dot.split("digraph ").length - 1);
        assertEquals("dot", ExportFormat.DOT.getExtension());
    }
}

package org.dxworks.codegraph.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphDocumentTest {

    private static GraphDocument sample() {
        GraphDocument document = new GraphDocument(GraphExporter.CONTROL_FLOW, "demo::check")
                .meta("complexity", 2)
                .meta("missing", null);
        document.addNode(0, "entry").attr("reachable", true).attr("startLine", null);
        document.addNode(1, "exit").attr("statements", List.of("return x;"));
        document.addEdge(0, 1, "sequential").attr("line", 3);
        return document;
    }

    @Test
    void attributesAreWrittenInlineNextToIdAndKind() throws Exception {
        JsonNode json = new ObjectMapper().readTree(sample().toJson());

        JsonNode entry = json.get("nodes").get(0);
        assertEquals(0, entry.get("id").asInt());
        assertEquals("entry", entry.get("kind").asText());
        assertTrue(entry.get("reachable").asBoolean());
        assertFalse(entry.has("startLine"));
        assertEquals(3, json.get("edges").get(0).get("line").asInt());
        assertEquals("control-flow", json.get("metadata").get("graph").asText());
        assertFalse(json.get("metadata").has("missing"));
    }

    @Test
    void readsBackWhatItWrites() throws Exception {
        GraphDocument copy = GraphDocument.fromJson(sample().toJson());

        assertEquals("control-flow", copy.getGraph());
        assertEquals("demo::check", copy.getTitle());
        assertEquals(2, copy.metadata.get("complexity"));
        assertEquals(2, copy.nodes.size());
        assertTrue(copy.nodes.get(0).is("reachable"));
        assertEquals(List.of("return x;"), copy.nodes.get(1).get("statements"));
        assertEquals(0, copy.edges.get(0).from);
        assertEquals(1, copy.edges.get(0).to);
        assertEquals(Map.of("line", 3), copy.edges.get(0).getAttrs());
    }

    @Test
    void documentWithoutTitleHasNoTitle() {
        assertNull(new GraphDocument().getTitle());
        assertNull(new GraphDocument().getGraph());
    }
}

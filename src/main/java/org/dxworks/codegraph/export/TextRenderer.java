package org.dxworks.codegraph.export;

import java.util.Map;

/** Plain summary per graph: title, counts, then each metadata finding on its own line. */
public class TextRenderer {

    public String render(GraphDocument document) {
        StringBuilder sb = new StringBuilder();
        sb.append(document.getGraph());
        if (document.getTitle() != null) {
            sb.append(' ').append(document.getTitle());
        }
        sb.append('\n');
        sb.append("  nodes: ").append(document.nodes.size()).append('\n');
        sb.append("  edges: ").append(document.edges.size()).append('\n');
        Map<String, Integer> kinds = GraphExporter.kindCounts(document);
        if (kinds.size() > 1) {
            sb.append("  kinds: ").append(kinds).append('\n');
        }
        for (Map.Entry<String, Object> entry : document.metadata.entrySet()) {
            if (entry.getKey().equals(GraphDocument.GRAPH) || entry.getKey().equals(GraphDocument.TITLE)) {
                continue;
            }
            sb.append("  ").append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
        return sb.toString();
    }
}

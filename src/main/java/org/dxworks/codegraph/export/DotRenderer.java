package org.dxworks.codegraph.export;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes a {@link GraphDocument} as a Graphviz digraph: one statement per node with a quoted
 * label, one per edge. Shape and fill encode the node kind, so entry, exit and branch blocks
 * or recursive and root functions can be told apart at a glance.
 */
public class DotRenderer {
    private static final int MAX_LABEL = 60;

    public String render(GraphDocument document) {
        StringBuilder sb = new StringBuilder();
        String name = document.getGraph() + (document.getTitle() == null ? "" : " " + document.getTitle());
        sb.append("digraph \"").append(escape(name)).append("\" {\n");
        sb.append("  rankdir=").append(GraphExporter.CALL_GRAPH.equals(document.getGraph())
                || GraphExporter.DEPENDENCY_GRAPH.equals(document.getGraph()) ? "LR" : "TB").append(";\n");
        sb.append("  node [shape=box, fontsize=10];\n");
        for (GraphDocument.Node node : document.nodes) {
            sb.append("  n").append(node.id).append(" [label=\"").append(escape(label(document.getGraph(), node))).append("\"");
            for (String attribute : style(document.getGraph(), node)) {
                sb.append(", ").append(attribute);
            }
            sb.append("];\n");
        }
        for (GraphDocument.Link link : document.edges) {
            sb.append("  n").append(link.from).append(" -> n").append(link.to);
            List<String> attributes = edgeStyle(link);
            if (!attributes.isEmpty()) {
                sb.append(" [").append(String.join(", ", attributes)).append("]");
            }
            sb.append(";\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String label(String graph, GraphDocument.Node node) {
        if (GraphExporter.CONTROL_FLOW.equals(graph)) {
            Object statements = node.get("statements");
            StringBuilder label = new StringBuilder(node.id + ": " + node.kind);
            if (statements instanceof List) {
                for (Object statement : (List<?>) statements) {
                    label.append("\n").append(shorten(String.valueOf(statement)));
                }
            }
            return label.toString();
        }
        if (GraphExporter.DATA_FLOW.equals(graph)) {
            return node.kind + " " + node.get("name") + " @" + node.get("line");
        }
        if (GraphExporter.PROGRAM_DEPENDENCY.equals(graph)) {
            return node.get("line") + ": " + shorten(String.valueOf(node.get("text")));
        }
        if (GraphExporter.DEPENDENCY_GRAPH.equals(graph)) {
            return String.valueOf(node.get("path"));
        }
        Object qualified = node.get("qualifiedName");
        if (qualified != null) {
            return qualified.toString();
        }
        Object name = node.get("name");
        return name == null ? node.kind : node.kind + " " + name;
    }

    private static List<String> style(String graph, GraphDocument.Node node) {
        List<String> style = new ArrayList<>();
        if (GraphExporter.CONTROL_FLOW.equals(graph)) {
            switch (node.kind) {
                case "entry":
                    fill(style, "oval", "palegreen");
                    break;
                case "exit":
                    fill(style, "doubleoctagon", "lightcoral");
                    break;
                case "return":
                    fill(style, "box", "lightcoral");
                    break;
                case "branch":
                    fill(style, "diamond", "lightyellow");
                    break;
                case "loop":
                    fill(style, "hexagon", "lightblue");
                    break;
                default:
                    break;
            }
            if (Boolean.FALSE.equals(node.get("reachable"))) {
                style.add("color=gray");
                style.add("fontcolor=gray");
            }
        } else if (GraphExporter.DATA_FLOW.equals(graph)) {
            switch (node.kind) {
                case "parameter":
                    fill(style, "oval", "palegreen");
                    break;
                case "definition":
                    fill(style, "box", "lightblue");
                    break;
                case "constant":
                    fill(style, "plaintext", "white");
                    break;
                case "operation":
                    fill(style, "diamond", "lightyellow");
                    break;
                case "call":
                    fill(style, "box", "orange");
                    break;
                default:
                    style.add("shape=oval");
                    break;
            }
        } else if (GraphExporter.CALL_GRAPH.equals(graph)) {
            if (node.is("recursive")) {
                fill(style, "box", "orange");
            } else if (node.is("entryPoint") || node.is("root")) {
                fill(style, "box", "palegreen");
            }
            if (node.is("synthetic")) {
                style.add("shape=oval");
            }
        } else if (GraphExporter.DEPENDENCY_GRAPH.equals(graph)) {
            if (node.is("inCycle") || node.is("selfImport")) {
                fill(style, "box", "lightcoral");
            }
        } else if (GraphExporter.PROGRAM_DEPENDENCY.equals(graph)) {
            if (node.is("predicate")) {
                fill(style, "diamond", "lightyellow");
            }
        } else if (GraphExporter.SYNTAX_TREE.equals(graph)) {
            switch (node.kind) {
                case "class":
                    fill(style, "box", "lightblue");
                    break;
                case "function":
                    fill(style, "oval", "palegreen");
                    break;
                case "call_site":
                    style.add("shape=plaintext");
                    break;
                default:
                    break;
            }
        }
        return style;
    }

    private static List<String> edgeStyle(GraphDocument.Link link) {
        List<String> style = new ArrayList<>();
        switch (link.kind) {
            case "sequential":
            case "contains":
            case "imports":
                break;
            case "calls":
                if (link.is("ambiguous")) {
                    style.add("style=dashed");
                }
                break;
            case "control":
                style.add("style=dashed");
                break;
            case "loop_back":
                style.add("label=\"loop_back\"");
                style.add("color=blue");
                break;
            default:
                style.add("label=\"" + escape(link.kind) + "\"");
                break;
        }
        return style;
    }

    private static void fill(List<String> style, String shape, String color) {
        style.add("shape=" + shape);
        style.add("style=filled");
        style.add("fillcolor=" + color);
    }

    private static String shorten(String text) {
        String line = text.replace('\n', ' ').replace('\r', ' ').trim();
        return line.length() <= MAX_LABEL ? line : line.substring(0, MAX_LABEL - 3) + "...";
    }

    static String escape(String raw) {
        return raw.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}

package org.dxworks.codegraph.extract;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class TreeSitterHelper {

    private TreeSitterHelper() {
    }

    public static String getNodeText(byte[] sourceBytes, TSNode node) {
        if (node == null || node.isNull()) return null;
        return getRangeText(sourceBytes, node.getStartByte(), node.getEndByte());
    }

    /**
     * Tree-sitter reports UTF-8 byte offsets; Java strings are UTF-16, so ranges are cut
     * from the encoded source and decoded again.
     */
    public static String getRangeText(byte[] sourceBytes, int startByte, int endByte) {
        if (startByte < 0) startByte = 0;
        if (endByte > sourceBytes.length) endByte = sourceBytes.length;
        if (startByte >= endByte) return "";
        String text = new String(sourceBytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }

    public static byte[] bytesOf(String source) {
        return source.getBytes(StandardCharsets.UTF_8);
    }

    /** Collapse all whitespace to single spaces and trim. */
    public static String normalizeInline(String s) {
        if (s == null) return null;
        return s.replaceAll("\\s+", " ").trim();
    }

    public static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    public static int endLine(TSNode node) {
        return node.getEndPoint().getRow() + 1;
    }

    public static TSNode findFirstChild(TSNode parent, String nodeType) {
        if (parent == null || parent.isNull()) return null;
        int count = parent.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getNamedChild(i);
            if (child != null && !child.isNull() && nodeType.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    public static List<TSNode> namedChildren(TSNode parent) {
        List<TSNode> result = new ArrayList<>();
        if (parent == null || parent.isNull()) return result;
        for (int i = 0; i < parent.getNamedChildCount(); i++) {
            TSNode child = parent.getNamedChild(i);
            if (child != null && !child.isNull()) {
                result.add(child);
            }
        }
        return result;
    }

    public static TSNode getChildByFieldName(TSNode parent, String fieldName) {
        if (parent == null || parent.isNull()) return null;
        TSNode child = parent.getChildByFieldName(fieldName);
        return child == null || child.isNull() ? null : child;
    }

    public static String getFieldText(byte[] sourceBytes, TSNode parent, String fieldName) {
        return getNodeText(sourceBytes, getChildByFieldName(parent, fieldName));
    }

    public static boolean isTypeOneOf(String type, String... types) {
        if (type == null) return false;
        for (String t : types) if (type.equals(t)) return true;
        return false;
    }

    public static boolean isNodeTypeOneOf(TSNode node, String... types) {
        if (node == null || node.isNull()) return false;
        return isTypeOneOf(node.getType(), types);
    }

    public static TSNode findFirstDescendantOfTypes(TSNode root, String... types) {
        if (root == null || root.isNull()) return null;
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (node == null || node.isNull()) continue;
            if (isTypeOneOf(node.getType(), types)) return node;
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                TSNode child = node.getChild(i);
                if (child != null && !child.isNull()) stack.push(child);
            }
        }
        return null;
    }

}

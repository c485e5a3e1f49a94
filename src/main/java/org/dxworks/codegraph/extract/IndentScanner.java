package org.dxworks.codegraph.extract;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Cuts an indentation-delimited body into logical lines and nests them by indentation.
 * A compound header ending in ':' owns the deeper lines that follow it; a header with a
 * statement after its colon owns that statement instead.
 */
final class IndentScanner {

    private static final Set<String> COMPOUND = Set.of(
            "if", "elif", "else", "for", "while", "try", "except", "finally", "with", "def", "class",
            "match", "case");
    private static final int TAB_WIDTH = 4;

    private final String source;
    private final int firstLine;

    private static final class Line {
        final RawNode node;
        final boolean opensBlock;

        Line(RawNode node, boolean opensBlock) {
            this.node = node;
            this.opensBlock = opensBlock;
        }
    }

    private static final class Level {
        final int indent;
        final List<RawNode> nodes;

        Level(int indent, List<RawNode> nodes) {
            this.indent = indent;
            this.nodes = nodes;
        }
    }

    IndentScanner(String source, int firstLine) {
        this.source = source;
        this.firstLine = firstLine;
    }

    List<RawNode> scan() {
        List<Line> lines = new ArrayList<>();
        for (RawNode logical : logicalLines()) {
            expand(logical, lines);
        }
        return nest(lines);
    }

    private List<RawNode> logicalLines() {
        List<RawNode> result = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int currentLine = firstLine;
        int currentIndent = 0;
        int line = firstLine;
        int depth = 0;
        boolean atLineStart = true;
        int i = 0;
        int n = source.length();
        while (i < n) {
            if (atLineStart) {
                int indent = 0;
                while (i < n && (source.charAt(i) == ' ' || source.charAt(i) == '\t')) {
                    indent += source.charAt(i) == '\t' ? TAB_WIDTH : 1;
                    i++;
                }
                if (i >= n) {
                    break;
                }
                char first = source.charAt(i);
                if (first == '\n' || first == '\r') {
                    if (first == '\n') {
                        line++;
                    }
                    i++;
                    continue;
                }
                if (first == '#') {
                    while (i < n && source.charAt(i) != '\n') {
                        i++;
                    }
                    continue;
                }
                currentIndent = indent;
                currentLine = line;
                atLineStart = false;
            }
            char c = source.charAt(i);
            if (c == '#') {
                while (i < n && source.charAt(i) != '\n') {
                    i++;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                int end = literalEnd(i, c);
                for (int k = i; k < end; k++) {
                    if (source.charAt(k) == '\n') {
                        line++;
                    }
                }
                current.append(source, i, end);
                i = end;
                continue;
            }
            if (c == '\\' && i + 1 < n && source.charAt(i + 1) == '\n') {
                line++;
                i += 2;
                current.append(' ');
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
            }
            if (c == '\n') {
                line++;
                i++;
                if (depth == 0) {
                    addLogical(result, current, currentLine, currentIndent);
                    atLineStart = true;
                } else {
                    current.append(' ');
                }
                continue;
            }
            if (c != '\r') {
                current.append(c);
            }
            i++;
        }
        addLogical(result, current, currentLine, currentIndent);
        return result;
    }

    private static void addLogical(List<RawNode> result, StringBuilder current, int line, int indent) {
        String text = current.toString().trim();
        if (!text.isEmpty()) {
            result.add(new RawNode(text, line, indent, null));
        }
        current.setLength(0);
    }

    private int literalEnd(int start, char quote) {
        String triple = String.valueOf(quote).repeat(3);
        if (source.startsWith(triple, start)) {
            int end = source.indexOf(triple, start + 3);
            return end < 0 ? source.length() : end + 3;
        }
        int i = start + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            if (c == '\n') {
                return i;
            }
            i++;
        }
        return source.length();
    }

    private static void expand(RawNode logical, List<Line> lines) {
        String text = logical.text;
        String word = Keywords.firstWord(text);
        if (word.equals("async")) {
            word = Keywords.firstWord(Keywords.afterFirstWord(text));
        }
        int colon = COMPOUND.contains(word) ? headerColon(text) : -1;
        if (colon < 0) {
            for (String piece : splitSemicolons(text)) {
                lines.add(new Line(new RawNode(piece, logical.line, logical.indent, null), false));
            }
            return;
        }
        String header = text.substring(0, colon).trim();
        String rest = text.substring(colon + 1).trim();
        RawNode node = new RawNode(header, logical.line, logical.indent, new ArrayList<>());
        if (rest.isEmpty()) {
            lines.add(new Line(node, true));
            return;
        }
        for (String piece : splitSemicolons(rest)) {
            node.block.add(new RawNode(piece, logical.line, logical.indent + 1, null));
        }
        lines.add(new Line(node, false));
    }

    private static int headerColon(String text) {
        boolean[] mask = Keywords.topLevelMask(text);
        for (int i = 0; i < text.length(); i++) {
            if (mask[i] && text.charAt(i) == ':' && (i + 1 >= text.length() || text.charAt(i + 1) != '=')) {
                return i;
            }
        }
        return -1;
    }

    private static List<String> splitSemicolons(String text) {
        List<String> pieces = new ArrayList<>();
        boolean[] mask = Keywords.topLevelMask(text);
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (mask[i] && text.charAt(i) == ';') {
                addPiece(pieces, text.substring(start, i));
                start = i + 1;
            }
        }
        addPiece(pieces, text.substring(start));
        return pieces;
    }

    private static void addPiece(List<String> pieces, String piece) {
        String trimmed = piece.trim();
        if (!trimmed.isEmpty()) {
            pieces.add(trimmed);
        }
    }

    private static List<RawNode> nest(List<Line> lines) {
        List<RawNode> root = new ArrayList<>();
        Deque<Level> levels = new ArrayDeque<>();
        levels.push(new Level(-1, root));
        RawNode pending = null;
        int pendingIndent = 0;
        for (Line line : lines) {
            int indent = line.node.indent;
            if (pending != null) {
                if (indent > pendingIndent) {
                    levels.push(new Level(indent, pending.block));
                }
                pending = null;
            }
            while (levels.size() > 1 && indent < levels.peek().indent) {
                levels.pop();
            }
            levels.peek().nodes.add(line.node);
            if (line.opensBlock) {
                pending = line.node;
                pendingIndent = indent;
            }
        }
        return root;
    }
}

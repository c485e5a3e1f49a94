package org.dxworks.codegraph.extract;

import org.dxworks.codegraph.Language;
import org.dxworks.codegraph.LanguageProfile;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cuts the body of a brace-delimited function into statements and blocks. Statements end at
 * ';' or at a line break that completes them; a '{' opens a block only after a control
 * header or on its own, otherwise it belongs to the expression (object literals, lambdas,
 * anonymous classes).
 */
final class BraceScanner {

    private static final Pattern RUST_CHAR = Pattern.compile("'(?:\\\\u\\{[0-9a-fA-F]+\\}|\\\\.|[^\\\\'])'");
    private static final String CONTINUING_ENDINGS = "+-*/%&|^=<>,.?:!~\\(";

    private final String source;
    private final LanguageProfile profile;
    private final Deque<Frame> frames = new ArrayDeque<>();
    private final StringBuilder current = new StringBuilder();
    private int currentLine;
    private int pos;
    private int line;
    private int depth;

    private static final class Frame {
        final List<RawNode> nodes;
        final boolean match;
        final boolean commaArms;

        Frame(List<RawNode> nodes, boolean match, boolean commaArms) {
            this.nodes = nodes;
            this.match = match;
            this.commaArms = commaArms;
        }
    }

    BraceScanner(String source, int firstLine, LanguageProfile profile) {
        this.source = source;
        this.line = firstLine;
        this.profile = profile;
    }

    List<RawNode> scan() {
        Frame root = new Frame(new ArrayList<>(), false, false);
        frames.push(root);
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\n') {
                line++;
                pos++;
                if (current.length() > 0) {
                    if (depth == 0 && !continuesOnNextLine()) {
                        finish();
                    } else {
                        current.append(' ');
                    }
                }
                continue;
            }
            if (startsLineComment()) {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    pos++;
                }
                continue;
            }
            if (startsBlockComment()) {
                skipBlockComment();
                continue;
            }
            if (c == '"' || c == '`' || c == '\'') {
                copyLiteral(c);
                continue;
            }
            switch (c) {
                case '(':
                case '[':
                    depth++;
                    append(c);
                    break;
                case ')':
                case ']':
                    depth = Math.max(0, depth - 1);
                    append(c);
                    break;
                case '{':
                    if (depth == 0 && Keywords.opensBlock(current.toString().trim(), frames.peek().match)) {
                        openBlock();
                    } else {
                        depth++;
                        append(c);
                    }
                    break;
                case '}':
                    if (depth > 0) {
                        depth--;
                        append(c);
                    } else {
                        closeBlock();
                    }
                    break;
                case ';':
                    if (depth == 0) {
                        finish();
                    } else {
                        append(c);
                    }
                    break;
                case ',':
                    if (depth == 0 && frames.peek().commaArms) {
                        finish();
                    } else {
                        append(c);
                    }
                    break;
                default:
                    append(c);
            }
            pos++;
        }
        finish();
        return root.nodes;
    }

    private void append(char c) {
        if (current.length() == 0) {
            if (Character.isWhitespace(c)) {
                return;
            }
            currentLine = line;
        }
        current.append(c);
    }

    private void finish() {
        String text = current.toString().trim();
        if (!text.isEmpty()) {
            frames.peek().nodes.add(new RawNode(text, currentLine));
        }
        current.setLength(0);
    }

    private void openBlock() {
        String header = current.toString().trim();
        int headerLine = header.isEmpty() ? line : currentLine;
        RawNode node = new RawNode(header, headerLine, 0, new ArrayList<>());
        frames.peek().nodes.add(node);
        boolean match = Keywords.isMatchHeader(header);
        boolean commaArms = Keywords.firstWord(header).equals("match");
        frames.push(new Frame(node.block, match, commaArms));
        current.setLength(0);
    }

    private void closeBlock() {
        finish();
        if (frames.size() > 1) {
            frames.pop();
        }
    }

    private boolean continuesOnNextLine() {
        String text = current.toString().trim();
        if (text.isEmpty()) {
            return false;
        }
        int next = nextSignificant();
        if (next >= 0) {
            char c = source.charAt(next);
            if (c == '{' || c == '.' || c == '?' || c == ')' || c == ']' || c == ':') {
                return true;
            }
            if (source.startsWith("&&", next) || source.startsWith("||", next)) {
                return true;
            }
        }
        if (text.endsWith("++") || text.endsWith("--")) {
            return false;
        }
        char last = text.charAt(text.length() - 1);
        if (CONTINUING_ENDINGS.indexOf(last) >= 0) {
            return true;
        }
        return isOpenControlHeader(text);
    }

    /** {@code if (x)} or {@code else} waiting for a braceless body on the next line. */
    private static boolean isOpenControlHeader(String text) {
        String rest = text;
        if (Keywords.firstWord(rest).equals("else")) {
            rest = Keywords.afterFirstWord(rest);
            if (rest.isEmpty()) {
                return true;
            }
        }
        String word = Keywords.firstWord(rest);
        if (word.equals("do")) {
            return rest.equals("do");
        }
        if (!word.equals("if") && !word.equals("for") && !word.equals("while") && !word.equals("foreach")) {
            return false;
        }
        String afterKeyword = Keywords.afterFirstWord(rest);
        if (!afterKeyword.startsWith("(")) {
            return false;
        }
        int close = Keywords.matchingParen(afterKeyword, 0);
        return close == afterKeyword.length() - 1;
    }

    private int nextSignificant() {
        int i = pos;
        while (i < source.length() && Character.isWhitespace(source.charAt(i))) {
            i++;
        }
        return i < source.length() ? i : -1;
    }

    private boolean startsLineComment() {
        for (String prefix : profile.getLineCommentPrefixes()) {
            if (source.startsWith(prefix, pos)) {
                return true;
            }
        }
        return false;
    }

    private boolean startsBlockComment() {
        return profile.getBlockCommentStart() != null && source.startsWith(profile.getBlockCommentStart(), pos);
    }

    private void skipBlockComment() {
        int end = source.indexOf(profile.getBlockCommentEnd(), pos + profile.getBlockCommentStart().length());
        int stop = end < 0 ? source.length() : end + profile.getBlockCommentEnd().length();
        for (int i = pos; i < stop; i++) {
            if (source.charAt(i) == '\n') {
                line++;
            }
        }
        pos = stop;
        if (current.length() > 0) {
            current.append(' ');
        }
    }

    private void copyLiteral(char quote) {
        if (quote == '\'' && profile.getLanguage() == Language.RUST
                && !RUST_CHAR.matcher(source).region(pos, source.length()).lookingAt()) {
            // lifetime or loop label tick
            append(quote);
            pos++;
            return;
        }
        if (quote == '"' && source.startsWith("\"\"\"", pos)) {
            int end = source.indexOf("\"\"\"", pos + 3);
            copyRange(end < 0 ? source.length() : end + 3);
            return;
        }
        boolean multiline = quote == '`';
        int i = pos + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                i++;
                break;
            }
            if (c == '\n' && !multiline) {
                break;
            }
            i++;
        }
        copyRange(Math.min(i, source.length()));
    }

    private void copyRange(int end) {
        if (current.length() == 0) {
            currentLine = line;
        }
        for (int i = pos; i < end; i++) {
            char c = source.charAt(i);
            if (c == '\n') {
                line++;
            }
            current.append(c);
        }
        pos = end;
    }
}

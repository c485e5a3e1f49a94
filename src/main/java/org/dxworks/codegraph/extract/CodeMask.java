package org.dxworks.codegraph.extract;

import org.dxworks.codegraph.Language;
import org.dxworks.codegraph.LanguageProfile;

import java.util.regex.Pattern;

/**
 * Blanks comments (and optionally string contents) with spaces, keeping every offset and
 * line break of the original text so matches map straight back to source positions.
 */
final class CodeMask {

    private static final Pattern RUST_CHAR = Pattern.compile("'(?:\\\\u\\{[0-9a-fA-F]+\\}|\\\\.|[^\\\\'])'");

    private CodeMask() {
    }

    static String mask(String source, LanguageProfile profile, boolean keepStrings) {
        char[] out = source.toCharArray();
        int n = source.length();
        int i = 0;
        while (i < n) {
            char c = source.charAt(i);
            String lineComment = lineCommentAt(source, i, profile);
            if (lineComment != null) {
                while (i < n && source.charAt(i) != '\n') {
                    out[i++] = ' ';
                }
                continue;
            }
            String blockStart = profile.getBlockCommentStart();
            if (blockStart != null && source.startsWith(blockStart, i)) {
                int end = source.indexOf(profile.getBlockCommentEnd(), i + blockStart.length());
                int stop = end < 0 ? n : end + profile.getBlockCommentEnd().length();
                blank(source, out, i, stop);
                i = stop;
                continue;
            }
            if (c == '"' || c == '\'' || c == '`') {
                if (c == '\'' && profile.getLanguage() == Language.RUST
                        && !RUST_CHAR.matcher(source).region(i, n).lookingAt()) {
                    i++;
                    continue;
                }
                int end = literalEnd(source, i, c);
                if (!keepStrings) {
                    blank(source, out, i + 1, Math.max(i + 1, end - 1));
                }
                i = end;
                continue;
            }
            i++;
        }
        return new String(out);
    }

    private static String lineCommentAt(String source, int i, LanguageProfile profile) {
        for (String prefix : profile.getLineCommentPrefixes()) {
            if (source.startsWith(prefix, i)) {
                return prefix;
            }
        }
        return null;
    }

    private static void blank(String source, char[] out, int from, int to) {
        for (int k = from; k < to && k < out.length; k++) {
            if (source.charAt(k) != '\n') {
                out[k] = ' ';
            }
        }
    }

    /** Offset just past the closing quote; single-quoted and double-quoted literals stop at a line break. */
    static int literalEnd(String source, int start, char quote) {
        String triple = String.valueOf(quote).repeat(3);
        if (quote != '`' && source.startsWith(triple, start)) {
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
            if (c == '\n' && quote != '`') {
                return i;
            }
            i++;
        }
        return source.length();
    }
}

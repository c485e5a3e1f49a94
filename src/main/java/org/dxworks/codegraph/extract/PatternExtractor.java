package org.dxworks.codegraph.extract;

import org.dxworks.codegraph.Language;
import org.dxworks.codegraph.LanguageProfile;
import org.dxworks.codegraph.model.DeclKind;
import org.dxworks.codegraph.model.DeclNode;
import org.dxworks.codegraph.model.FunctionUnit;
import org.dxworks.codegraph.model.SyntaxTree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-by-line declaration extraction from a language profile's patterns. Nesting is not
 * visible to the patterns; containment is recovered from brace depth or indentation, so
 * the resulting tree is marked heuristic.
 */
public class PatternExtractor {

    private static final Pattern CALL = Pattern.compile(
            "(?:([A-Za-z_$][\\w$]*(?:\\(\\))?)\\s*(?:\\.|->|::|\\?\\.)\\s*)?([A-Za-z_$][\\w$]*)\\s*(?:<[\\w\\s,.<>?]*>)?\\s*\\(");
    private static final Pattern LET_VARIABLE = Pattern.compile("\\b(?:let|var|const|val|auto)\\s+(?:mut\\s+)?([A-Za-z_]\\w*)");
    private static final Pattern SHORT_VARIABLE = Pattern.compile("(?:^|[\\s,(])([A-Za-z_]\\w*)\\s*:=");
    private static final Pattern VISIBILITY = Pattern.compile("\\b(pub|public|private|protected|internal|fileprivate|open)\\b");
    /** Receivers and constructor delegation look like calls in every language. */
    private static final Set<String> NOT_CALLS = Set.of("super", "this", "self");

    private static final class OpenScope {
        final DeclNode decl;
        final int endOffset;
        final String prefix;
        final boolean function;

        OpenScope(DeclNode decl, int endOffset, String prefix, boolean function) {
            this.decl = decl;
            this.endOffset = endOffset;
            this.prefix = prefix;
            this.function = function;
        }
    }

    /** Where a declaration's body sits in the source; bodyOpen is -1 when there is none. */
    private static final class Body {
        int bodyOpen = -1;
        int bodyEnd = -1;
        boolean expression;
    }

    public SyntaxTree extract(String filePath, String source, LanguageProfile profile) {
        String code = CodeMask.mask(source, profile, false);
        String plain = CodeMask.mask(source, profile, true);
        int[] lineStarts = lineStarts(source);
        String[] codeLines = code.split("\n", -1);
        String[] plainLines = plain.split("\n", -1);

        SyntaxTree.Builder builder = SyntaxTree.builder(filePath, profile.getLanguage().getName(), true);
        String moduleFunction = builder.getModulePath() + "::" + GrammarExtractor.MODULE_FUNCTION;

        for (ImportScanner.ImportRef ref : new ImportScanner().scan(source, profile)) {
            DeclNode.Draft draft = new DeclNode.Draft(DeclKind.IMPORT, ref.target).lines(ref.line, ref.line);
            draft.qualifiedName = builder.getModulePath() + "::import " + ref.target;
            draft.target = ref.target;
            builder.add(draft);
        }

        Deque<OpenScope> open = new ArrayDeque<>();
        for (int i = 0; i < codeLines.length; i++) {
            int lineNumber = i + 1;
            int lineOffset = lineStarts[i];
            while (!open.isEmpty() && open.peek().endOffset <= lineOffset) {
                open.pop();
            }
            String prefix = open.isEmpty() ? "" : open.peek().prefix;
            int parentId = open.isEmpty() ? -1 : open.peek().decl.id;
            String declared = null;

            Matcher typeMatch = declarationMatch(profile.getClassPatterns(), plainLines[i], profile);
            Matcher functionMatch = typeMatch == null ? declarationMatch(profile.getFunctionPatterns(), plainLines[i], profile) : null;
            if (typeMatch != null || functionMatch != null) {
                boolean isFunction = functionMatch != null;
                Matcher match = isFunction ? functionMatch : typeMatch;
                declared = match.group("name");
                int nameEnd = lineOffset + match.end("name");
                Body body = profile.isBraceDelimited()
                        ? braceBody(code, headerScanStart(code, match, lineOffset, nameEnd), match.group().endsWith("=>"),
                                profile, i, codeLines)
                        : indentBody(code, lineStarts, codeLines, i, lineOffset + match.start());
                int endLine = body.bodyEnd >= 0 ? lineOf(lineStarts, Math.max(body.bodyEnd - 1, lineOffset)) : lineNumber;

                DeclNode.Draft draft = new DeclNode.Draft(isFunction ? DeclKind.FUNCTION : DeclKind.CLASS, declared)
                        .lines(lineNumber, endLine);
                draft.qualifiedName = builder.getModulePath() + "::" + prefix + declared;
                draft.visibility = visibility(plainLines[i], declared, profile.getLanguage());
                draft.parentId = parentId;
                if (isFunction) {
                    draft.parameters = parameters(code, nameEnd, profile);
                }
                DeclNode decl = builder.add(draft);

                if (body.bodyOpen >= 0) {
                    if (isFunction) {
                        builder.addFunction(functionUnit(decl, source, lineStarts, lineOffset, body, profile));
                    }
                    open.push(new OpenScope(decl, body.bodyEnd, prefix + declared + ".", isFunction));
                }
            }

            String enclosing = enclosingFunction(open, moduleFunction);
            int scopeId = open.isEmpty() ? -1 : open.peek().decl.id;
            addCalls(builder, codeLines[i], declared, lineNumber, enclosing, scopeId, profile.getReservedWords());
            addVariables(builder, codeLines[i], lineNumber, open.isEmpty() ? "" : open.peek().prefix, enclosing, scopeId,
                    profile.getReservedWords());
        }
        return builder.build();
    }

    /** First pattern match whose declared name is not a keyword ({@code else if (x) {} looks like a C function). */
    private static Matcher declarationMatch(Iterable<Pattern> patterns, String line, LanguageProfile profile) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(line);
            if (matcher.find() && !profile.getReservedWords().contains(matcher.group("name"))) {
                return matcher;
            }
        }
        return null;
    }

    /**
     * Finds the block after a declaration header. A ';' before any '{' means a prototype;
     * '=' or '=>' before it means an expression body; a following line that is itself a
     * declaration means a bodiless signature (interface or protocol member).
     */
    private static Body braceBody(String code, int from, boolean afterArrow, LanguageProfile profile, int lineIndex,
                                  String[] codeLines) {
        Body body = new Body();
        if (afterArrow) {
            int next = skipSpaces(code, from);
            if (next < code.length() && code.charAt(next) != '{') {
                return expressionBody(body, code, from);
            }
        }
        int depth = 0;
        int line = lineIndex;
        for (int i = from; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0) {
                if (c == '{') {
                    body.bodyOpen = i;
                    body.bodyEnd = matchingBrace(code, i);
                    return body;
                }
                if (c == ';') {
                    return body;
                }
                if (c == '=' && isExpressionArrow(code, i)) {
                    int start = i + (i + 1 < code.length() && code.charAt(i + 1) == '>' ? 2 : 1);
                    int next = skipSpaces(code, start);
                    if (next < code.length() && code.charAt(next) == '{') {
                        body.bodyOpen = next;
                        body.bodyEnd = matchingBrace(code, next);
                        return body;
                    }
                    return expressionBody(body, code, start);
                }
                if (c == '\n') {
                    line++;
                    if (line < codeLines.length && startsDeclaration(codeLines[line], profile)) {
                        return body;
                    }
                }
            } else if (c == '\n') {
                line++;
            }
        }
        return body;
    }

    private static Body expressionBody(Body body, String code, int start) {
        int end = code.indexOf('\n', start);
        int semicolon = code.indexOf(';', start);
        if (end < 0) end = code.length();
        if (semicolon >= 0 && semicolon < end) end = semicolon;
        body.bodyOpen = start - 1;
        body.bodyEnd = end;
        body.expression = true;
        return body;
    }

    /**
     * Header scanning starts at the parameter list so that the '=' of {@code const f = (x) => ...}
     * is not mistaken for an expression body; a pattern that already consumed the arrow starts after it.
     */
    private static int headerScanStart(String code, Matcher match, int lineOffset, int nameEnd) {
        if (match.group().endsWith("=>")) {
            return lineOffset + match.end();
        }
        int lineEnd = code.indexOf('\n', nameEnd);
        int paren = code.indexOf('(', nameEnd);
        if (paren >= 0 && (lineEnd < 0 || paren < lineEnd)) {
            return paren;
        }
        return nameEnd;
    }

    private static boolean isExpressionArrow(String code, int i) {
        char previous = i > 0 ? code.charAt(i - 1) : ' ';
        char next = i + 1 < code.length() ? code.charAt(i + 1) : ' ';
        if (previous == '=' || previous == '!' || previous == '<' || previous == '>' || next == '=') {
            return false;
        }
        return true;
    }

    private static boolean startsDeclaration(String line, LanguageProfile profile) {
        return declarationMatch(profile.getFunctionPatterns(), line, profile) != null
                || declarationMatch(profile.getClassPatterns(), line, profile) != null;
    }

    private static int skipSpaces(String code, int from) {
        int i = from;
        while (i < code.length() && (code.charAt(i) == ' ' || code.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    /** Offset just past the '}' closing the '{' at {@code open}; end of text when unbalanced. */
    private static int matchingBrace(String code, int open) {
        int depth = 0;
        for (int i = open; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return code.length();
    }

    /**
     * Indentation body: the header ends at the first ':' outside brackets; the body is the
     * rest of that line or, when empty, every following line indented deeper than the header.
     */
    private static Body indentBody(String code, int[] lineStarts, String[] codeLines, int lineIndex, int from) {
        Body body = new Body();
        int depth = 0;
        int colon = -1;
        for (int i = from; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == ':' && depth == 0) {
                colon = i;
                break;
            }
        }
        if (colon < 0) {
            return body;
        }
        int colonLine = lineOf(lineStarts, colon) - 1;
        int lineEnd = colonLine + 1 < lineStarts.length ? lineStarts[colonLine + 1] - 1 : code.length();
        body.bodyOpen = colon;
        if (!code.substring(colon + 1, lineEnd).trim().isEmpty()) {
            body.bodyEnd = lineEnd;
            return body;
        }
        int headerIndent = indentOf(codeLines[lineIndex]);
        int last = colonLine;
        for (int j = colonLine + 1; j < codeLines.length; j++) {
            if (codeLines[j].trim().isEmpty()) {
                continue;
            }
            if (indentOf(codeLines[j]) <= headerIndent) {
                break;
            }
            last = j;
        }
        body.bodyEnd = last + 1 < lineStarts.length ? lineStarts[last + 1] - 1 : code.length();
        return body;
    }

    private static int indentOf(String line) {
        int indent = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') {
                indent++;
            } else if (c == '\t') {
                indent += 4;
            } else {
                break;
            }
        }
        return indent;
    }

    private static FunctionUnit functionUnit(DeclNode decl, String source, int[] lineStarts, int lineOffset,
                                             Body body, LanguageProfile profile) {
        String signature = TreeSitterHelper.normalizeInline(source.substring(lineOffset, body.bodyOpen));
        if (signature.endsWith(":") || signature.endsWith("=")) {
            signature = signature.substring(0, signature.length() - 1).trim();
        }
        int bodyLine = lineOf(lineStarts, body.bodyOpen);
        if (body.expression) {
            return new FunctionUnit(decl, signature, source.substring(body.bodyOpen + 1, body.bodyEnd).trim(), bodyLine, true);
        }
        if (profile.isBraceDelimited()) {
            return new FunctionUnit(decl, signature, source.substring(body.bodyOpen + 1, Math.max(body.bodyOpen + 1, body.bodyEnd - 1)),
                    bodyLine, false);
        }
        String rest = source.substring(body.bodyOpen + 1, body.bodyEnd);
        int column = body.bodyOpen + 1 - lineStarts[bodyLine - 1];
        return new FunctionUnit(decl, signature, " ".repeat(column) + rest, bodyLine, false);
    }

    /** Parameter names from the parenthesised list opening at or after {@code from}. */
    private static List<String> parameters(String code, int from, LanguageProfile profile) {
        List<String> names = new ArrayList<>();
        int open = code.indexOf('(', Math.max(0, from));
        if (open < 0) {
            return names;
        }
        int close = Keywords.matchingParen(code, open);
        if (close < 0) {
            return names;
        }
        String list = code.substring(open + 1, close);
        if (list.isBlank()) {
            return names;
        }
        for (String part : splitTopLevel(list)) {
            String name = parameterName(part.trim(), profile.getLanguage());
            if (name != null) {
                names.add(name);
            }
        }
        return names;
    }

    private static List<String> splitTopLevel(String list) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < list.length(); i++) {
            char c = list.charAt(i);
            if (c == '(' || c == '[' || c == '{' || c == '<') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}' || c == '>') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0) {
                parts.add(list.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(list.substring(start));
        return parts;
    }

    /**
     * {@code name: Type} languages put the name first; C-family languages put it last,
     * before any default value.
     */
    private static String parameterName(String part, Language language) {
        String withoutDefault = part.split("=", 2)[0].trim();
        if (withoutDefault.isEmpty()) {
            return null;
        }
        String[] words = withoutDefault.replaceAll("[*&]", " ").split("[^\\w$]+");
        String[] nonEmpty = Arrays.stream(words).filter(w -> !w.isEmpty()).toArray(String[]::new);
        if (nonEmpty.length == 0) {
            return null;
        }
        switch (language) {
            case RUST:
            case KOTLIN:
            case SWIFT:
            case SCALA:
            case TYPESCRIPT:
            case PYTHON: {
                int colon = withoutDefault.indexOf(':');
                String head = colon >= 0 ? withoutDefault.substring(0, colon) : withoutDefault;
                String[] headWords = head.trim().split("\\s+");
                String name = headWords[headWords.length - 1].replaceAll("[^\\w$]", "");
                return name.isEmpty() ? null : name;
            }
            case GO:
                return nonEmpty[0];
            default:
                String last = nonEmpty[nonEmpty.length - 1];
                return nonEmpty.length == 1 && last.equals("void") ? null : last;
        }
    }

    private static String visibility(String line, String name, Language language) {
        Matcher matcher = VISIBILITY.matcher(line);
        if (matcher.find()) {
            String keyword = matcher.group(1);
            return keyword.equals("pub") || keyword.equals("open") ? "public" : keyword;
        }
        switch (language) {
            case GO:
                return Character.isUpperCase(name.charAt(0)) ? "public" : "package";
            case RUST:
                return "private";
            case PYTHON:
                return GrammarExtractor.pythonVisibility(name);
            default:
                return "default";
        }
    }

    private static String enclosingFunction(Deque<OpenScope> open, String moduleFunction) {
        Iterator<OpenScope> it = open.iterator();
        while (it.hasNext()) {
            OpenScope scope = it.next();
            if (scope.function) {
                return scope.decl.qualifiedName;
            }
        }
        return moduleFunction;
    }

    private static void addCalls(SyntaxTree.Builder builder, String codeLine, String declared, int lineNumber,
                                 String enclosing, int scopeId, Set<String> reserved) {
        Matcher matcher = CALL.matcher(codeLine);
        boolean skippedDeclaration = false;
        while (matcher.find()) {
            String name = matcher.group(2);
            if (NOT_CALLS.contains(name) || reserved.contains(name)) {
                continue;
            }
            if (!skippedDeclaration && name.equals(declared)) {
                skippedDeclaration = true;
                continue;
            }
            DeclNode.Draft draft = new DeclNode.Draft(DeclKind.CALL_SITE, name).lines(lineNumber, lineNumber);
            draft.qualifiedName = enclosing + "->" + name;
            draft.target = name;
            draft.receiver = matcher.group(1);
            draft.enclosingFunction = enclosing;
            draft.parentId = scopeId;
            builder.add(draft);
        }
    }

    private static void addVariables(SyntaxTree.Builder builder, String codeLine, int lineNumber, String prefix,
                                     String enclosing, int scopeId, Set<String> reserved) {
        for (Pattern pattern : new Pattern[]{LET_VARIABLE, SHORT_VARIABLE}) {
            Matcher matcher = pattern.matcher(codeLine);
            while (matcher.find()) {
                String name = matcher.group(1);
                if (reserved.contains(name)) {
                    continue;
                }
                DeclNode.Draft draft = new DeclNode.Draft(DeclKind.VARIABLE, name).lines(lineNumber, lineNumber);
                draft.qualifiedName = builder.getModulePath() + "::" + prefix + name;
                draft.visibility = "local";
                draft.enclosingFunction = enclosing;
                draft.parentId = scopeId;
                builder.add(draft);
            }
        }
    }

    private static int[] lineStarts(String source) {
        int count = 1;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') count++;
        }
        int[] starts = new int[count];
        int line = 1;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts[line++] = i + 1;
            }
        }
        return starts;
    }

    /** 1-based line containing {@code offset}. */
    private static int lineOf(int[] lineStarts, int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        if (index < 0) {
            index = -index - 2;
        }
        return index + 1;
    }
}

package org.dxworks.codegraph.extract;

import org.dxworks.codegraph.Language;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword tables and string-aware text helpers shared by the statement parser and the
 * data-flow expression scanner. Statement-shape tables span every supported language;
 * reserved words are kept per language, so a keyword of one language stays a valid name in another.
 */
public final class Keywords {

    static final Set<String> BLOCK_OPENERS = Set.of(
            "if", "else", "for", "foreach", "while", "do", "loop", "try", "catch", "finally",
            "switch", "match", "when", "select", "unsafe", "synchronized", "with", "using", "lock",
            "fixed", "checked", "unchecked", "case", "default", "guard", "repeat",
            "function", "fn", "fun", "func", "def", "class", "struct", "impl", "trait", "interface",
            "enum", "async", "static", "public", "private", "protected", "internal", "pub", "export");

    static final Set<String> DEFINITION_KEYWORDS = Set.of(
            "def", "class", "function", "fn", "fun", "func", "struct", "interface", "enum", "impl", "trait");

    static final Set<String> MODIFIERS = Set.of(
            "async", "static", "public", "private", "protected", "internal", "pub", "export", "default",
            "final", "abstract", "override", "inline", "suspend", "open", "unsafe", "const");

    static final Set<String> LOOP_KEYWORDS = Set.of("for", "foreach", "while", "loop");

    static final Set<String> SWITCH_KEYWORDS = Set.of("switch", "match", "when", "select");

    static final Set<String> HANDLER_KEYWORDS = Set.of("catch", "except", "rescue");

    private static final Map<Language, Set<String>> RESERVED = new EnumMap<>(Language.class);

    static {
        Set<String> javaScript = words(
                "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete", "do",
                "else", "export", "extends", "finally", "for", "function", "if", "import", "in", "instanceof",
                "new", "return", "super", "switch", "this", "throw", "try", "typeof", "var", "void", "while",
                "with", "yield", "let", "static", "await", "async", "of", "true", "false", "null", "undefined");
        Set<String> c = words(
                "auto", "break", "case", "char", "const", "continue", "default", "do", "double", "else", "enum",
                "extern", "float", "for", "goto", "if", "inline", "int", "long", "register", "restrict",
                "return", "short", "signed", "sizeof", "static", "struct", "switch", "typedef", "union",
                "unsigned", "void", "volatile", "while", "bool", "true", "false", "NULL");

        RESERVED.put(Language.JAVA, words(
                "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
                "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
                "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
                "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
                "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
                "volatile", "while", "var", "yield", "true", "false", "null"));
        RESERVED.put(Language.PYTHON, words(
                "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
                "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
                "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with",
                "yield"));
        RESERVED.put(Language.JAVASCRIPT, javaScript);
        RESERVED.put(Language.TYPESCRIPT, union(javaScript, words(
                "as", "is", "keyof", "readonly", "declare", "namespace", "abstract", "implements", "interface",
                "enum", "private", "protected", "public", "satisfies")));
        RESERVED.put(Language.RUST, words(
                "as", "async", "await", "break", "const", "continue", "crate", "dyn", "else", "enum", "extern",
                "false", "fn", "for", "if", "impl", "in", "let", "loop", "match", "mod", "move", "mut", "pub",
                "ref", "return", "Self", "static", "struct", "super", "trait", "true", "type", "unsafe", "use",
                "where", "while", "bool", "char", "str", "usize", "isize", "u8", "u16", "u32", "u64", "u128",
                "i8", "i16", "i32", "i64", "i128", "f32", "f64"));
        RESERVED.put(Language.GO, words(
                "break", "case", "chan", "const", "continue", "default", "defer", "else", "fallthrough", "for",
                "func", "go", "goto", "if", "import", "interface", "map", "package", "range", "return", "select",
                "struct", "switch", "type", "var", "true", "false", "nil", "iota", "bool", "byte", "rune",
                "string", "int", "int8", "int16", "int32", "int64", "uint", "uint8", "uint16", "uint32",
                "uint64", "uintptr", "float32", "float64", "complex64", "complex128", "error", "any"));
        RESERVED.put(Language.C, c);
        RESERVED.put(Language.CPP, union(c, words(
                "alignas", "alignof", "and", "asm", "catch", "class", "concept", "const_cast", "constexpr",
                "decltype", "delete", "dynamic_cast", "explicit", "export", "friend", "mutable", "namespace",
                "new", "noexcept", "not", "nullptr", "operator", "or", "private", "protected", "public",
                "reinterpret_cast", "requires", "static_assert", "static_cast", "template", "this", "throw",
                "try", "typeid", "typename", "using", "virtual", "wchar_t", "xor")));
        RESERVED.put(Language.CSHARP, words(
                "abstract", "as", "base", "bool", "break", "byte", "case", "catch", "char", "checked", "class",
                "const", "continue", "decimal", "default", "delegate", "do", "double", "else", "enum", "event",
                "explicit", "extern", "false", "finally", "fixed", "float", "for", "foreach", "goto", "if",
                "implicit", "in", "int", "interface", "internal", "is", "lock", "long", "namespace", "new",
                "null", "object", "operator", "out", "override", "params", "private", "protected", "public",
                "readonly", "ref", "return", "sbyte", "sealed", "short", "sizeof", "stackalloc", "static",
                "string", "struct", "switch", "this", "throw", "true", "try", "typeof", "uint", "ulong",
                "unchecked", "unsafe", "ushort", "using", "virtual", "void", "volatile", "while", "var",
                "async", "await"));
        RESERVED.put(Language.KOTLIN, words(
                "as", "break", "class", "continue", "do", "else", "false", "for", "fun", "if", "in", "interface",
                "is", "null", "object", "package", "return", "super", "this", "throw", "true", "try",
                "typealias", "typeof", "val", "var", "when", "while"));
        RESERVED.put(Language.SWIFT, words(
                "associatedtype", "class", "deinit", "enum", "extension", "fileprivate", "func", "import",
                "init", "inout", "internal", "let", "open", "operator", "private", "protocol", "public",
                "rethrows", "static", "struct", "subscript", "typealias", "var", "break", "case", "continue",
                "default", "defer", "do", "else", "fallthrough", "for", "guard", "if", "in", "repeat", "return",
                "switch", "where", "while", "as", "catch", "false", "is", "nil", "super", "throw", "throws",
                "true", "try", "Any", "Self"));
        RESERVED.put(Language.PHP, words(
                "abstract", "and", "array", "as", "break", "callable", "case", "catch", "class", "clone", "const",
                "continue", "declare", "default", "do", "echo", "else", "elseif", "empty", "extends", "final",
                "finally", "fn", "for", "foreach", "function", "global", "goto", "if", "implements", "include",
                "instanceof", "insteadof", "interface", "isset", "list", "match", "namespace", "new", "or",
                "print", "private", "protected", "public", "require", "return", "static", "switch", "throw",
                "trait", "try", "unset", "use", "var", "while", "xor", "yield", "true", "false", "null"));
        RESERVED.put(Language.SCALA, words(
                "abstract", "case", "catch", "class", "def", "do", "else", "enum", "extends", "false", "final",
                "finally", "for", "forSome", "given", "if", "implicit", "import", "lazy", "match", "new", "null",
                "object", "override", "package", "private", "protected", "return", "sealed", "super", "then",
                "this", "throw", "trait", "try", "true", "type", "val", "var", "while", "with", "yield"));
    }

    private static final Pattern FIRST_WORD = Pattern.compile("^[A-Za-z_$][\\w$]*");
    private static final Pattern LABEL = Pattern.compile("^('?[A-Za-z_]\\w*)\\s*:(?![:=])");
    private static final Pattern WORD = Pattern.compile("[A-Za-z_$][\\w$]*");

    private Keywords() {
    }

    /** Keywords, literals and built-in type names of {@code language}; these are never variable or function names. */
    public static Set<String> reservedFor(Language language) {
        return RESERVED.get(language);
    }

    private static Set<String> words(String... words) {
        return Set.of(words);
    }

    private static Set<String> union(Set<String> first, Set<String> second) {
        Set<String> all = new HashSet<>(first);
        all.addAll(second);
        return Collections.unmodifiableSet(all);
    }

    public static String firstWord(String text) {
        Matcher matcher = FIRST_WORD.matcher(text);
        return matcher.find() ? matcher.group() : "";
    }

    /** Text after the leading word, trimmed. */
    static String afterFirstWord(String text) {
        String word = firstWord(text);
        return text.substring(word.length()).trim();
    }

    /** The label of {@code outer: for (...)}, or null when the text has no leading label. */
    static String labelOf(String text) {
        Matcher matcher = LABEL.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String name = matcher.group(1);
        if (name.equals("case") || name.equals("default") || name.equals("else")) {
            return null;
        }
        return name;
    }

    static String stripLabel(String text) {
        String label = labelOf(text);
        if (label == null) {
            return text;
        }
        return text.substring(text.indexOf(':') + 1).trim();
    }

    static boolean opensBlock(String header, boolean inMatch) {
        if (header.isEmpty()) {
            return true;
        }
        if (inMatch && (header.endsWith("=>") || header.endsWith("->"))) {
            return true;
        }
        String unlabeled = stripLabel(header);
        return BLOCK_OPENERS.contains(firstWord(unlabeled)) || endsWithMatch(unlabeled);
    }

    /** Scala writes {@code x match {}}. */
    static boolean endsWithMatch(String header) {
        return header.equals("match") || header.endsWith(" match");
    }

    static boolean isMatchHeader(String header) {
        String word = firstWord(header);
        return word.equals("match") || word.equals("when") || endsWithMatch(header);
    }

    /** Header of a nested function or type definition, whose body does not run in place. */
    public static boolean isDefinitionHeader(String header) {
        String rest = header;
        String word = firstWord(rest);
        while (MODIFIERS.contains(word)) {
            rest = afterFirstWord(rest);
            word = firstWord(rest);
        }
        return DEFINITION_KEYWORDS.contains(word);
    }

    /** Name declared by a definition header ({@code inner} for {@code def inner(x)}), or null. */
    public static String definedName(String header) {
        Matcher matcher = WORD.matcher(header);
        boolean seenKeyword = false;
        while (matcher.find()) {
            String word = matcher.group();
            if (seenKeyword) {
                return word;
            }
            if (DEFINITION_KEYWORDS.contains(word)) {
                seenKeyword = true;
            }
        }
        return null;
    }

    static boolean isUnconditionalLoop(String header) {
        String compact = header.replaceAll("\\s+", "");
        return compact.equals("loop") || compact.equals("for") || compact.equals("for(;;)")
                || compact.equals("while(true)") || compact.equals("whiletrue") || compact.equals("whileTrue")
                || compact.equals("while(1)") || compact.equals("while1");
    }

    static boolean isDefaultLabel(String label) {
        String stripped = label.startsWith("case ") ? label.substring(5).trim() : label.trim();
        return stripped.equals("default") || stripped.equals("_") || stripped.equals("else")
                || label.trim().equals("default");
    }

    /**
     * Marks characters at nesting depth zero and outside string literals. Unterminated
     * literals end at the end of the text.
     */
    public static boolean[] topLevelMask(String text) {
        boolean[] mask = new boolean[text.length()];
        int depth = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'' || c == '`') {
                int end = i + 1;
                while (end < text.length() && text.charAt(end) != c) {
                    if (text.charAt(end) == '\\') {
                        end++;
                    }
                    end++;
                }
                i = Math.min(end + 1, text.length());
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
                i++;
                continue;
            }
            mask[i] = depth == 0 && c != '(' && c != '[' && c != '{';
            i++;
        }
        return mask;
    }

    /** Index of {@code token} at depth zero outside strings, or -1. */
    public static int indexOfTopLevel(String text, String token) {
        return indexOfTopLevel(text, token, 0);
    }

    static int indexOfTopLevel(String text, String token, int from) {
        boolean[] mask = topLevelMask(text);
        int at = text.indexOf(token, from);
        while (at >= 0) {
            if (mask[at]) {
                return at;
            }
            at = text.indexOf(token, at + 1);
        }
        return -1;
    }

    /** Index of the whole word {@code word} at depth zero outside strings, or -1. */
    public static int indexOfTopLevelWord(String text, String word) {
        boolean[] mask = topLevelMask(text);
        Matcher matcher = Pattern.compile("\\b" + Pattern.quote(word) + "\\b").matcher(text);
        while (matcher.find()) {
            if (mask[matcher.start()]) {
                return matcher.start();
            }
        }
        return -1;
    }

    /** Index of the ')' closing the '(' at {@code open}, or -1. */
    public static int matchingParen(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                int end = text.indexOf(c, i + 1);
                i = end < 0 ? text.length() : end;
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Splits a case label from the statement sharing its line. Arm arrows win over colons
     * when {@code preferArrows} is set, so {@code case x: Int => y} splits at the arrow.
     * Returns {label, rest}; rest is empty when nothing follows the label.
     */
    static String[] splitCaseLabel(String text, boolean preferArrows) {
        boolean[] mask = topLevelMask(text);
        int arrow = -1;
        int arrowLength = 2;
        int colon = -1;
        for (int i = 0; i < text.length() - 1; i++) {
            if (!mask[i]) {
                continue;
            }
            char c = text.charAt(i);
            char next = text.charAt(i + 1);
            if (arrow < 0 && (c == '=' || c == '-') && next == '>') {
                arrow = i;
            } else if (colon < 0 && c == ':' && next != ':' && (i == 0 || text.charAt(i - 1) != ':')) {
                colon = i;
            }
        }
        if (colon < 0 && text.endsWith(":") && !text.endsWith("::")) {
            colon = text.length() - 1;
        }
        int cut;
        int width;
        if (arrow >= 0 && (preferArrows || colon < 0 || arrow < colon)) {
            cut = arrow;
            width = arrowLength;
        } else if (colon >= 0) {
            cut = colon;
            width = 1;
        } else {
            return new String[]{text.trim(), ""};
        }
        return new String[]{text.substring(0, cut).trim(), text.substring(cut + width).trim()};
    }

    /** Ternary operator, or an if/match expression used as a value. */
    public static boolean hasInlineBranch(String text) {
        boolean[] mask = topLevelMask(text);
        for (int i = 0; i < text.length() - 1; i++) {
            if (!mask[i] || text.charAt(i) != '?') {
                continue;
            }
            char next = text.charAt(i + 1);
            boolean previousIsQuestion = i > 0 && text.charAt(i - 1) == '?';
            if (next == '.' || next == '?' || next == ':' || next == '[' || previousIsQuestion) {
                continue;
            }
            for (int j = i + 1; j < text.length(); j++) {
                if (mask[j] && text.charAt(j) == ':' && text.charAt(j - 1) != '?'
                        && (j + 1 >= text.length() || text.charAt(j + 1) != ':')
                        && text.charAt(j - 1) != ':') {
                    return true;
                }
            }
        }
        String stripped = stripStrings(text);
        if (stripped.matches("(?s).*\\bif\\b.*\\belse\\b.*")) {
            return true;
        }
        return stripped.matches("(?s).*[=(,]\\s*(?:match|when|switch)\\b.*") || stripped.matches("(?s).*\\w\\s+match\\s*\\{.*");
    }

    /** Replaces string literal contents with spaces, keeping offsets. */
    public static String stripStrings(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'' || c == '`') {
                out.append(' ');
                int end = i + 1;
                while (end < text.length() && text.charAt(end) != c) {
                    if (text.charAt(end) == '\\' && end + 1 < text.length()) {
                        out.append(' ');
                        end++;
                    }
                    out.append(' ');
                    end++;
                }
                if (end < text.length()) {
                    out.append(' ');
                }
                i = end + 1;
                continue;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }
}

package org.dxworks.codegraph.graph.dfg;

import org.dxworks.codegraph.extract.Keywords;
import org.dxworks.codegraph.model.Statement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the variables a statement defines and uses, the functions it calls and the
 * literals it mentions, from statement text alone. Works for every supported language
 * at once, so it recognises the common shapes (declarations, plain, compound and chained
 * assignments, destructuring, loop headers, handler bindings) rather than any one grammar.
 */
public class ExpressionScanner {

    /** What one statement (or one part of a loop header) reads and writes. */
    public static final class Facts {
        public final List<String> defs = new ArrayList<>();
        public final List<String> uses = new ArrayList<>();
        public final List<String> calls = new ArrayList<>();
        public final List<String> constants = new ArrayList<>();
        public final Set<String> exports = new LinkedHashSet<>();
        /** Expression text when the statement computes a value with an operator, else null. */
        public String operation;

        public boolean isEmpty() {
            return defs.isEmpty() && uses.isEmpty() && calls.isEmpty() && constants.isEmpty()
                    && exports.isEmpty() && operation == null;
        }
    }

    /**
     * Loop header split by when each part runs: {@code init} once before the loop,
     * {@code header} on every iteration before the body, {@code update} after the body.
     */
    public static final class LoopFacts {
        public final Facts init;
        public final Facts header;
        public final Facts update;

        LoopFacts(Facts init, Facts header, Facts update) {
            this.init = init;
            this.header = header;
            this.update = update;
        }
    }

    private static final Pattern IDENTIFIER = Pattern.compile("(?<![\\w$])[A-Za-z_$][\\w$]*");
    private static final Pattern NUMBER = Pattern.compile("(?<![\\w$.])\\d[\\w.]*");
    private static final Pattern STRING = Pattern.compile(
            "\"(?:\\\\.|[^\"\\\\])*\"|'(?:\\\\.|[^'\\\\])*'|`(?:\\\\.|[^`\\\\])*`");
    private static final Pattern STRING_PREFIX = Pattern.compile("[fFrRbBuU]{1,2}");
    private static final Pattern INCREMENT = Pattern.compile(
            "(?<![\\w$.])([A-Za-z_$][\\w$]*)\\s*(?:\\+\\+|--)|(?:\\+\\+|--)\\s*([A-Za-z_$][\\w$]*)");
    private static final Pattern WALRUS = Pattern.compile("(?<![\\w$.])([A-Za-z_][\\w]*)\\s*:=");
    private static final Pattern TYPE_ARGUMENTS = Pattern.compile("<\\s*[A-Z?][\\w<>,.?\\s\\[\\]]*>|<>");
    private static final Pattern ANY_TYPE_ARGUMENTS = Pattern.compile("<[\\w<>,.:?\\s\\[\\]*&]*>");
    private static final Pattern BINARY_OPERATOR = Pattern.compile(
            "[\\w)\\]]\\s*(?:\\*\\*|//|<<|>>|<=|>=|==|!=|&&|\\|\\||[-+*/%<>&|^])\\s*[\\w(\\[!~\"'-]");
    private static final Pattern WORD_OPERATOR = Pattern.compile("\\b(?:and|or|not)\\b");

    private static final Set<String> DECLARATION_WORDS = Set.of(
            "let", "var", "const", "val", "mut", "auto", "final", "static", "readonly", "export",
            "pub", "public", "private", "protected", "internal", "lateinit", "volatile", "register",
            "my", "local");
    private static final Set<String> CALLABLE_KEYWORDS = Set.of("print", "echo", "super", "this", "assert");
    private static final Set<String> CONTROL_WORDS = Set.of(
            "if", "elif", "while", "for", "foreach", "switch", "match", "when", "catch", "return",
            "throw", "raise", "with", "guard", "unless", "until", "repeat", "do", "try", "case",
            "yield", "await", "not", "and", "or", "in", "sizeof", "typeof", "synchronized");
    private static final Set<String> CONSTANT_WORDS = Set.of(
            "true", "false", "True", "False", "null", "None", "nil", "undefined");
    private static final Set<String> NON_DECLARING = Set.of(
            "await", "yield", "del", "delete", "print", "echo", "go", "defer", "assert", "not",
            "new", "typeof", "throw", "raise", "return", "import", "from", "using", "use");

    private final Set<String> reserved;

    /** @param reserved words of the analyzed language that never name a variable or function */
    public ExpressionScanner(Set<String> reserved) {
        this.reserved = reserved;
    }

    public Facts scan(Statement statement) {
        String text = trimStatement(statement.getText());
        Facts facts = new Facts();
        switch (statement.getKind()) {
            case SIMPLE:
                simple(text, facts);
                break;
            case RETURN:
            case THROW:
                value(afterKeyword(text), facts);
                break;
            case IF:
                condition(afterKeyword(text), facts);
                break;
            case SWITCH:
                String subject = text.endsWith(" match") ? text.substring(0, text.length() - 6) : afterKeyword(text);
                condition(subject, facts);
                break;
            case TRY:
                condition(afterKeyword(text), facts);
                break;
            case HANDLER:
                handler(afterKeyword(text), facts);
                break;
            case BLOCK:
                block(text, facts);
                break;
            case LOOP:
                LoopFacts loop = scanLoop(statement);
                return loop.header;
            default:
                break;
        }
        return facts;
    }

    /** Arm label of a switch: values it compares against, or the names a match pattern binds. */
    public Facts scanCase(Statement clause, Statement owner) {
        Facts facts = new Facts();
        if (clause.defaultCase) {
            return facts;
        }
        String label = trimStatement(clause.getText());
        if (label.startsWith("case ")) {
            label = label.substring(5).trim();
        }
        int guard = Keywords.indexOfTopLevelWord(label, "if");
        if (guard > 0) {
            String condition = label.substring(guard + 2);
            label = label.substring(0, guard).trim();
            pattern(label, facts);
            value(condition, facts);
            return facts;
        }
        String keyword = Keywords.firstWord(owner.getText());
        boolean binds = keyword.equals("match") || owner.getText().trim().endsWith("match");
        if (label.startsWith("let ") || label.startsWith("var ")) {
            pattern(afterKeyword(label), facts);
        } else if (binds) {
            pattern(label, facts);
        } else {
            value(label, facts);
        }
        return facts;
    }

    public LoopFacts scanLoop(Statement loop) {
        String text = trimStatement(loop.getText());
        String word = Keywords.firstWord(text);
        Facts header = new Facts();
        if (word.equals("loop") || word.equals("repeat") || word.equals("do")) {
            return new LoopFacts(null, header, null);
        }
        String rest = unwrap(afterKeyword(text));
        if (loop.postCondition || word.equals("while") || word.equals("until") || rest.isEmpty()) {
            condition(rest, header);
            return new LoopFacts(null, header, null);
        }

        List<String> clauses = splitTopLevel(rest, ';');
        if (clauses.size() >= 2) {
            Facts init = new Facts();
            expression(clauses.get(0), init);
            condition(clauses.get(1), header);
            Facts update = new Facts();
            if (clauses.size() > 2) {
                expression(clauses.get(2), update);
            }
            return new LoopFacts(init, header, update);
        }

        int split = Keywords.indexOfTopLevelWord(rest, "in");
        int width = 2;
        if (split < 0) {
            split = Keywords.indexOfTopLevelWord(rest, "of");
        }
        if (split < 0 && !rest.contains(":=")) {
            split = topLevelColon(rest);
            width = 1;
        }
        if (split > 0) {
            value(rest.substring(split + width), header);
            target(rest.substring(0, split), header, false);
        } else {
            condition(rest, header);
        }
        return new LoopFacts(null, header, null);
    }

    private void simple(String text, Facts facts) {
        String word = Keywords.firstWord(text);
        if (word.equals("global") || word.equals("nonlocal")) {
            for (String name : afterKeyword(text).split(",")) {
                if (!name.isBlank()) {
                    facts.exports.add(name.trim());
                }
            }
            return;
        }
        boolean exported = word.equals("export");
        String statement = exported ? afterKeyword(text) : text;
        if (Keywords.isDefinitionHeader(statement)) {
            String name = Keywords.definedName(statement);
            if (name != null) {
                facts.defs.add(name);
            }
        } else {
            expression(statement, facts);
        }
        if (exported) {
            facts.exports.addAll(facts.defs);
        }
    }

    private void block(String text, Facts facts) {
        String word = Keywords.firstWord(text);
        if (word.equals("else")) {
            return;
        }
        if (word.equals("with") || word.equals("async") && text.contains(" with ")) {
            String items = text.substring(text.indexOf("with") + 4).trim();
            for (String item : splitTopLevel(unwrap(items), ',')) {
                int as = Keywords.indexOfTopLevelWord(item, "as");
                if (as > 0) {
                    value(item.substring(0, as), facts);
                    target(item.substring(as + 2), facts, false);
                } else {
                    value(item, facts);
                }
            }
            return;
        }
        expression(text, facts);
    }

    /** catch (IOException e), catch (e: Exception), except ValueError as e, rescue Foo => e. */
    private void handler(String text, Facts facts) {
        int as = Keywords.indexOfTopLevelWord(text, "as");
        if (as > 0) {
            lastIdentifier(text.substring(as + 2), facts);
            return;
        }
        int arrow = text.indexOf("=>");
        if (arrow >= 0) {
            lastIdentifier(text.substring(arrow + 2), facts);
            return;
        }
        if (!text.startsWith("(")) {
            return;
        }
        String inner = unwrap(text);
        int colon = topLevelColon(inner);
        if (colon > 0) {
            lastIdentifier(inner.substring(0, colon), facts);
        } else {
            lastIdentifier(inner, facts);
        }
    }

    private void lastIdentifier(String text, Facts facts) {
        List<String> names = identifiers(text);
        if (!names.isEmpty()) {
            facts.defs.add(names.get(names.size() - 1));
        }
    }

    /** Conditions may declare: if let, Go's {@code if v, ok := m[k]; ok}, C's {@code if ((n = read()) > 0)}. */
    private void condition(String text, Facts facts) {
        for (String part : splitTopLevel(unwrap(text), ';')) {
            for (String piece : splitLetChain(part)) {
                expression(piece, facts);
            }
        }
    }

    /** Swift writes {@code if let a = x, let b = y}. */
    private static List<String> splitLetChain(String text) {
        List<String> parts = splitTopLevel(text, ',');
        if (parts.size() > 1 && parts.get(0).trim().startsWith("let ")) {
            return parts;
        }
        List<String> single = new ArrayList<>();
        single.add(text);
        return single;
    }

    /** A statement that may assign: declarations, plain, compound and chained assignments. */
    void expression(String text, Facts facts) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        List<String> declarators = splitTopLevel(trimmed, ',');
        if (declarators.size() > 1 && allAssign(declarators)) {
            for (String declarator : declarators) {
                expression(declarator, facts);
            }
            return;
        }

        List<int[]> operators = assignmentOperators(trimmed);
        if (operators.isEmpty()) {
            declarationOrValue(trimmed, facts);
            return;
        }
        int[] last = operators.get(operators.size() - 1);
        value(trimmed.substring(last[1]), facts);
        boolean compound = false;
        for (int[] operator : operators) {
            compound |= operator[2] == 1;
        }
        if (compound) {
            facts.operation = trimmed;
        }
        int from = 0;
        for (int[] operator : operators) {
            target(trimmed.substring(from, operator[0]), facts, operator[2] == 1);
            from = operator[1];
        }
    }

    private void declarationOrValue(String text, Facts facts) {
        String word = Keywords.firstWord(text);
        if (word.equals("let") || word.equals("var")) {
            target(text, facts, false);
            return;
        }
        String[] words = text.split("\\s+");
        if (words.length >= 2 && !NON_DECLARING.contains(word) && !CONTROL_WORDS.contains(word)
                && text.matches("[\\w$.<>\\[\\],?*&:\\s]+") && !text.contains("::")) {
            // typed declaration without initializer: int x, List<String> names
            return;
        }
        value(text, facts);
    }

    private static boolean allAssign(List<String> parts) {
        for (String part : parts) {
            if (assignmentOperators(part.trim()).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Top-level assignment operators as {start, end, compound} triples. Comparisons, arrows
     * and anything nested in brackets are not assignments.
     */
    static List<int[]> assignmentOperators(String text) {
        List<int[]> operators = new ArrayList<>();
        boolean[] mask = Keywords.topLevelMask(text);
        for (int i = 0; i < text.length(); i++) {
            if (!mask[i] || text.charAt(i) != '=') {
                continue;
            }
            char next = i + 1 < text.length() ? text.charAt(i + 1) : 0;
            char prev = i > 0 ? text.charAt(i - 1) : 0;
            char beforePrev = i > 1 ? text.charAt(i - 2) : 0;
            if (next == '=' || next == '>' || prev == '=' || prev == '!') {
                continue;
            }
            if (prev == '<' || prev == '>') {
                if (beforePrev == prev) {
                    operators.add(new int[]{i - 2, i + 1, 1});
                }
                continue;
            }
            if (prev == ':') {
                operators.add(new int[]{i - 1, i + 1, 0});
            } else if ("+-*/%&|^?".indexOf(prev) >= 0 && prev != 0) {
                boolean doubled = "*/&|?".indexOf(beforePrev) >= 0 && beforePrev == prev;
                operators.add(new int[]{doubled ? i - 2 : i - 1, i + 1, 1});
            } else {
                operators.add(new int[]{i, i + 1, 0});
            }
        }
        return operators;
    }

    /** Left-hand side of an assignment. */
    private void target(String text, Facts facts, boolean compound) {
        String target = text.trim();
        if (target.isEmpty()) {
            return;
        }
        if (target.startsWith("*")) {
            // write through a pointer: the pointer is read, not redefined
            value(target.substring(1), facts);
            return;
        }
        boolean goVar = false;
        String word = Keywords.firstWord(target);
        while (DECLARATION_WORDS.contains(word) && target.length() > word.length()) {
            goVar |= word.equals("var");
            target = target.substring(word.length()).trim();
            word = Keywords.firstWord(target);
        }
        int colon = topLevelColon(target);
        if (colon > 0) {
            target = target.substring(0, colon).trim();
        }
        target = ANY_TYPE_ARGUMENTS.matcher(target).replaceAll(" ").trim();

        if (target.startsWith("(") || target.startsWith("[") || target.startsWith("{")
                || splitTopLevel(target, ',').size() > 1) {
            pattern(target, facts);
            return;
        }
        if (isMemberOrIndex(target)) {
            value(target, facts);
            return;
        }
        if (target.contains("(") || target.contains("{")) {
            pattern(target, facts);
            return;
        }
        List<String> names = identifiers(target);
        if (names.isEmpty()) {
            return;
        }
        String name = goVar && names.size() > 1 ? names.get(0) : names.get(names.size() - 1);
        if (compound) {
            facts.uses.add(name);
        }
        facts.defs.add(name);
    }

    private static boolean isMemberOrIndex(String target) {
        boolean[] mask = Keywords.topLevelMask(target);
        for (int i = 0; i < target.length(); i++) {
            char c = target.charAt(i);
            boolean index = c == '[' && i > 0 && i + 1 < target.length() && target.charAt(i + 1) != ']';
            if (index || (mask[i] && c == '.') || (mask[i] && c == '-' && i + 1 < target.length()
                    && target.charAt(i + 1) == '>')) {
                return true;
            }
        }
        return false;
    }

    /** Destructuring or match pattern: every lowercase binding name is defined. */
    private void pattern(String text, Facts facts) {
        String code = Keywords.stripStrings(text);
        Matcher matcher = IDENTIFIER.matcher(code);
        while (matcher.find()) {
            String word = matcher.group();
            int after = skipSpaces(code, matcher.end());
            char next = charAt(code, after);
            if (reserved.contains(word) || isMember(code, matcher.start())
                    || next == '(' || next == '{' || code.startsWith("::", after)
                    || Character.isUpperCase(word.charAt(0))) {
                continue;
            }
            if (next == ':' && !code.startsWith("::", after)) {
                // {key: binding}
                continue;
            }
            facts.defs.add(word);
        }
        addConstants(text, code, facts);
    }

    /** A right-hand side or any other expression that only reads. */
    private void value(String text, Facts facts) {
        String expression = text.trim();
        if (expression.isEmpty()) {
            return;
        }
        String code = Keywords.stripStrings(expression);
        addConstants(expression, code, facts);

        Set<Integer> skip = new HashSet<>();
        Matcher walrus = WALRUS.matcher(code);
        while (walrus.find()) {
            facts.defs.add(walrus.group(1));
            skip.add(walrus.start(1));
        }
        Matcher increment = INCREMENT.matcher(code);
        boolean increments = false;
        while (increment.find()) {
            String name = increment.group(1) != null ? increment.group(1) : increment.group(2);
            if (!reserved.contains(name)) {
                facts.defs.add(name);
                increments = true;
            }
        }
        identifiers(code, expression, facts, skip);
        if (increments || hasOperator(expression)) {
            facts.operation = expression;
        }
    }

    private static void addConstants(String original, String code, Facts facts) {
        Matcher strings = STRING.matcher(original);
        while (strings.find()) {
            facts.constants.add(strings.group());
        }
        Matcher numbers = NUMBER.matcher(code);
        while (numbers.find()) {
            facts.constants.add(numbers.group());
        }
    }

    private void identifiers(String code, String original, Facts facts, Set<Integer> skip) {
        char[] enclosing = enclosingBrackets(code);
        Matcher matcher = IDENTIFIER.matcher(code);
        while (matcher.find()) {
            String word = matcher.group();
            int start = matcher.start();
            int end = matcher.end();
            if (skip.contains(start)) {
                continue;
            }
            if (end < original.length() && isQuote(original.charAt(end)) && STRING_PREFIX.matcher(word).matches()) {
                continue;
            }
            int after = skipSpaces(code, end);
            char next = charAt(code, after);
            boolean member = isMember(code, start);
            if (next == '!' && "([{".indexOf(charAt(code, after + 1)) >= 0) {
                facts.calls.add(word + "!");
                continue;
            }
            if (next == '(') {
                if (CONTROL_WORDS.contains(word)
                        || (!member && reserved.contains(word) && !CALLABLE_KEYWORDS.contains(word))) {
                    continue;
                }
                facts.calls.add(word);
                continue;
            }
            if (member || code.startsWith("::", after)) {
                continue;
            }
            if (reserved.contains(word)) {
                if (CONSTANT_WORDS.contains(word)) {
                    facts.constants.add(word);
                }
                continue;
            }
            char bracket = enclosing[start];
            if ((bracket == '(' || bracket == '{') && next == ':' && !code.startsWith("::", after)) {
                continue;
            }
            if (bracket == '(' && next == '=' && charAt(code, after + 1) != '=') {
                continue;
            }
            facts.uses.add(word);
        }
    }

    private static boolean hasOperator(String expression) {
        String code = STRING.matcher(expression).replaceAll("s");
        code = TYPE_ARGUMENTS.matcher(code).replaceAll(" ");
        code = code.replace("->", " ").replace("=>", " ").replace("::", " ").replace("...", " ");
        return BINARY_OPERATOR.matcher(code).find() || WORD_OPERATOR.matcher(code).find();
    }

    /** Innermost open bracket at every position, or 0 at top level. */
    private static char[] enclosingBrackets(String code) {
        char[] enclosing = new char[code.length()];
        Deque<Character> open = new ArrayDeque<>();
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            enclosing[i] = open.isEmpty() ? 0 : open.peek();
            if (c == '(' || c == '[' || c == '{') {
                open.push(c);
            } else if ((c == ')' || c == ']' || c == '}') && !open.isEmpty()) {
                open.pop();
            }
        }
        return enclosing;
    }

    /** Property or path segment: preceded by '.', '->' or '::', but not a '...' spread. */
    private static boolean isMember(String code, int start) {
        int i = start - 1;
        while (i >= 0 && Character.isWhitespace(code.charAt(i))) {
            i--;
        }
        if (i < 0) {
            return false;
        }
        char c = code.charAt(i);
        if (c == '.') {
            return !(i >= 2 && code.charAt(i - 1) == '.' && code.charAt(i - 2) == '.');
        }
        if (c == '>' && i > 0 && code.charAt(i - 1) == '-') {
            return true;
        }
        return c == ':' && i > 0 && code.charAt(i - 1) == ':';
    }

    List<String> identifiers(String text) {
        List<String> names = new ArrayList<>();
        Matcher matcher = IDENTIFIER.matcher(Keywords.stripStrings(text));
        while (matcher.find()) {
            if (!reserved.contains(matcher.group())) {
                names.add(matcher.group());
            }
        }
        return names;
    }

    static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        boolean[] mask = Keywords.topLevelMask(text);
        int from = 0;
        for (int i = 0; i < text.length(); i++) {
            if (mask[i] && text.charAt(i) == separator) {
                parts.add(text.substring(from, i));
                from = i + 1;
            }
        }
        parts.add(text.substring(from));
        return parts;
    }

    /** Top-level ':' that is neither part of '::' nor ':='. */
    private static int topLevelColon(String text) {
        boolean[] mask = Keywords.topLevelMask(text);
        for (int i = 0; i < text.length(); i++) {
            if (!mask[i] || text.charAt(i) != ':') {
                continue;
            }
            boolean doubled = (i + 1 < text.length() && text.charAt(i + 1) == ':') || (i > 0 && text.charAt(i - 1) == ':');
            boolean walrus = i + 1 < text.length() && text.charAt(i + 1) == '=';
            if (!doubled && !walrus) {
                return i;
            }
        }
        return -1;
    }

    /** Drops one pair of parentheses wrapping the whole text. */
    private static String unwrap(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("(") && Keywords.matchingParen(trimmed, 0) == trimmed.length() - 1) {
            return trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    private static String afterKeyword(String text) {
        String word = Keywords.firstWord(text);
        String rest = text.substring(word.length()).trim();
        if ((word.equals("else") || word.equals("do")) && Keywords.firstWord(rest).equals("if")) {
            rest = rest.substring(2).trim();
        }
        return rest;
    }

    private static String trimStatement(String text) {
        String trimmed = text.trim();
        while (trimmed.endsWith(";") || trimmed.endsWith(":") && !trimmed.endsWith("::")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    private static int skipSpaces(String code, int from) {
        int i = from;
        while (i < code.length() && Character.isWhitespace(code.charAt(i))) {
            i++;
        }
        return i;
    }

    private static char charAt(String code, int index) {
        return index < code.length() ? code.charAt(index) : 0;
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}

package org.dxworks.codegraph.extract;

import org.dxworks.codegraph.LanguageProfile;
import org.dxworks.codegraph.model.Statement;
import org.dxworks.codegraph.model.StatementKind;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Interprets scanned nodes as statements: attaches else/elif chains to their if, handlers
 * and finally blocks to their try, the trailing while to a do loop, and splits case labels
 * from the statements that follow them.
 */
final class StatementStructurer {
    private static final Pattern LOOP_LABEL = Pattern.compile("'?[A-Za-z_]\\w*");

    private final LanguageProfile profile;

    StatementStructurer(LanguageProfile profile) {
        this.profile = profile;
    }

    List<Statement> structure(List<RawNode> raws) {
        List<Statement> out = new ArrayList<>();
        int i = 0;
        while (i < raws.size()) {
            i = structureOne(raws.get(i), raws, i + 1, out);
        }
        return out;
    }

    private List<Statement> structureSingle(RawNode raw) {
        List<RawNode> single = new ArrayList<>();
        single.add(raw);
        return structure(single);
    }

    private int structureOne(RawNode raw, List<RawNode> raws, int next, List<Statement> out) {
        String label = profile.isBraceDelimited() ? Keywords.labelOf(raw.text) : null;
        if (label != null) {
            Statement labelStatement = new Statement(StatementKind.LABEL, label + ":", raw.line);
            labelStatement.label = label;
            out.add(labelStatement);
            String rest = Keywords.stripLabel(raw.text);
            if (rest.isEmpty() && !raw.hasBlock()) {
                return next;
            }
            raw = raw.withText(rest);
        }

        String text = raw.text;
        String word = Keywords.firstWord(text);
        if (word.equals("async") && !profile.isBraceDelimited()) {
            word = Keywords.firstWord(Keywords.afterFirstWord(text));
        }

        if (raw.hasBlock() && Keywords.isDefinitionHeader(text)) {
            out.add(new Statement(StatementKind.SIMPLE, text, raw.line));
            return next;
        }

        switch (word) {
            case "if":
            case "elif":
                return buildIf(raw, raws, next, out);
            case "guard":
                return buildGuard(raw, next, out);
            case "for":
            case "foreach":
            case "while":
            case "loop":
                return buildLoop(raw, raws, next, out);
            case "do":
            case "repeat":
                if (text.equals("do") || text.equals("repeat") || !raw.hasBlock()) {
                    return buildDo(raw, raws, next, out);
                }
                return buildLoop(raw, raws, next, out);
            case "switch":
            case "match":
            case "when":
            case "select":
                if (raw.hasBlock()) {
                    return buildSwitch(raw, word, next, out);
                }
                break;
            case "try":
                return buildTry(raw, raws, next, out);
            case "return":
                out.add(jump(StatementKind.RETURN, raw));
                return next;
            case "throw":
            case "raise":
                out.add(jump(StatementKind.THROW, raw));
                return next;
            case "break":
            case "continue":
                Statement loopJump = jump(word.equals("break") ? StatementKind.BREAK : StatementKind.CONTINUE, raw);
                String target = Keywords.afterFirstWord(text);
                if (LOOP_LABEL.matcher(target).matches()) {
                    loopJump.label = target;
                }
                out.add(loopJump);
                return next;
            case "goto":
                Statement jump = jump(StatementKind.GOTO, raw);
                jump.label = Keywords.firstWord(Keywords.afterFirstWord(text));
                out.add(jump);
                return next;
            default:
                break;
        }

        if (raw.hasBlock() && Keywords.endsWithMatch(text)) {
            return buildSwitch(raw, "match", next, out);
        }
        if (raw.hasBlock()) {
            Statement block = new Statement(StatementKind.BLOCK, text, raw.line);
            block.body.addAll(structure(raw.block));
            out.add(block);
            return next;
        }
        Statement simple = new Statement(StatementKind.SIMPLE, text, raw.line);
        simple.inlineBranch = Keywords.hasInlineBranch(text);
        out.add(simple);
        return next;
    }

    private static Statement jump(StatementKind kind, RawNode raw) {
        return new Statement(kind, raw.text, raw.line);
    }

    private int buildIf(RawNode raw, List<RawNode> raws, int next, List<Statement> out) {
        Statement statement;
        if (raw.hasBlock()) {
            statement = new Statement(StatementKind.IF, raw.text, raw.line);
            statement.body.addAll(structure(raw.block));
        } else {
            String[] split = splitInlineBody(raw.text);
            statement = new Statement(StatementKind.IF, split[0], raw.line);
            String body = split[1];
            int elseAt = Keywords.indexOfTopLevelWord(body, "else");
            if (elseAt >= 0) {
                String elsePart = body.substring(elseAt + 4).trim();
                body = body.substring(0, elseAt).trim();
                statement.elseBody = elsePart.isEmpty()
                        ? new ArrayList<>()
                        : structureSingle(new RawNode(elsePart, raw.line));
            }
            if (!body.isEmpty()) {
                statement.body.addAll(structureSingle(new RawNode(body, raw.line)));
            }
        }
        out.add(statement);

        if (statement.elseBody != null || next >= raws.size()) {
            return next;
        }
        RawNode following = raws.get(next);
        String word = Keywords.firstWord(following.text);
        if (word.equals("elif")) {
            statement.elseBody = new ArrayList<>();
            return buildIf(following, raws, next + 1, statement.elseBody);
        }
        if (!word.equals("else")) {
            return next;
        }
        String rest = Keywords.afterFirstWord(following.text);
        statement.elseBody = new ArrayList<>();
        if (Keywords.firstWord(rest).equals("if")) {
            return buildIf(following.withText(rest), raws, next + 1, statement.elseBody);
        }
        if (following.hasBlock()) {
            statement.elseBody.addAll(structure(following.block));
        } else if (!rest.isEmpty()) {
            statement.elseBody.addAll(structureSingle(new RawNode(rest, following.line)));
        }
        return next + 1;
    }

    /** {@code guard cond else { ... }}: the block runs when the condition fails. */
    private int buildGuard(RawNode raw, int next, List<Statement> out) {
        String header = raw.text.endsWith("else") ? raw.text.substring(0, raw.text.length() - 4).trim() : raw.text;
        Statement statement = new Statement(StatementKind.IF, header, raw.line);
        statement.elseBody = new ArrayList<>();
        if (raw.hasBlock()) {
            statement.elseBody.addAll(structure(raw.block));
        }
        out.add(statement);
        return next;
    }

    private int buildLoop(RawNode raw, List<RawNode> raws, int next, List<Statement> out) {
        Statement loop;
        if (raw.hasBlock()) {
            loop = new Statement(StatementKind.LOOP, raw.text, raw.line);
            loop.body.addAll(structure(raw.block));
        } else {
            String[] split = splitInlineBody(raw.text);
            loop = new Statement(StatementKind.LOOP, split[0], raw.line);
            if (!split[1].isEmpty()) {
                loop.body.addAll(structureSingle(new RawNode(split[1], raw.line)));
            }
        }
        loop.unconditional = Keywords.isUnconditionalLoop(loop.getText());
        out.add(loop);
        if (!profile.isBraceDelimited() && next < raws.size()
                && raws.get(next).text.equals("else") && raws.get(next).hasBlock()) {
            // for/while ... else: runs once the loop finishes without break
            RawNode elseNode = raws.get(next);
            Statement block = new Statement(StatementKind.BLOCK, "else", elseNode.line);
            block.body.addAll(structure(elseNode.block));
            out.add(block);
            return next + 1;
        }
        return next;
    }

    private int buildDo(RawNode raw, List<RawNode> raws, int next, List<Statement> out) {
        if (next < raws.size() && Keywords.firstWord(raws.get(next).text).equals("catch")) {
            return buildTry(raw, raws, next, out);
        }
        List<Statement> body = new ArrayList<>();
        if (raw.hasBlock()) {
            body.addAll(structure(raw.block));
        } else {
            String rest = Keywords.afterFirstWord(raw.text);
            if (!rest.isEmpty()) {
                body.addAll(structureSingle(new RawNode(rest, raw.line)));
            }
        }
        String header = raw.text;
        int line = raw.line;
        int consumed = next;
        if (next < raws.size()) {
            RawNode following = raws.get(next);
            if (Keywords.firstWord(following.text).equals("while") && !following.hasBlock()) {
                header = following.text;
                line = following.line;
                consumed = next + 1;
            }
        }
        if (consumed == next && !raw.text.equals("repeat")) {
            Statement block = new Statement(StatementKind.BLOCK, raw.text, raw.line);
            block.body.addAll(body);
            out.add(block);
            return next;
        }
        Statement loop = new Statement(StatementKind.LOOP, header, line);
        loop.postCondition = true;
        loop.unconditional = consumed == next;
        loop.body.addAll(body);
        out.add(loop);
        return consumed;
    }

    private int buildSwitch(RawNode raw, String word, int next, List<Statement> out) {
        Statement statement = new Statement(StatementKind.SWITCH, raw.text, raw.line);
        boolean armStyle = word.equals("match") || word.equals("when");
        statement.matchStyle = armStyle || !profile.isSwitchFallsThrough();

        Statement current = null;
        List<RawNode> pending = new ArrayList<>();
        for (RawNode child : raw.block) {
            String childWord = Keywords.firstWord(child.text);
            boolean labelled = isCaseWord(childWord)
                    || (armStyle && profile.isBraceDelimited() && startsArm(child));
            if (!labelled) {
                if (current == null) {
                    current = new Statement(StatementKind.CASE, "", child.line);
                }
                pending.add(child);
                continue;
            }
            flushCase(statement, current, pending);
            String[] split = profile.isBraceDelimited()
                    ? Keywords.splitCaseLabel(child.text, armStyle)
                    : new String[]{child.text, ""};
            String label = split[0];
            boolean defaultCase = Keywords.isDefaultLabel(label);
            while (profile.isBraceDelimited() && isCaseWord(Keywords.firstWord(split[1]))) {
                // stacked labels: case 1: case 2: body
                split = Keywords.splitCaseLabel(split[1], armStyle);
                label = label + " | " + split[0];
                defaultCase |= Keywords.isDefaultLabel(split[0]);
            }
            current = new Statement(StatementKind.CASE, label, child.line);
            current.defaultCase = defaultCase;
            pending = new ArrayList<>();
            if (!split[1].isEmpty()) {
                pending.add(new RawNode(split[1], child.line, child.indent, child.block));
            } else if (child.hasBlock()) {
                pending.addAll(child.block);
            }
        }
        flushCase(statement, current, pending);
        out.add(statement);
        return next;
    }

    private static boolean isCaseWord(String word) {
        return word.equals("case") || word.equals("default");
    }

    private static boolean startsArm(RawNode child) {
        return Keywords.indexOfTopLevel(child.text, "=>") >= 0 || Keywords.indexOfTopLevel(child.text, "->") >= 0
                || (child.hasBlock() && (child.text.endsWith("=>") || child.text.endsWith("->")));
    }

    private void flushCase(Statement statement, Statement current, List<RawNode> pending) {
        if (current == null) {
            return;
        }
        current.body.addAll(structure(pending));
        statement.clauses.add(current);
    }

    private int buildTry(RawNode raw, List<RawNode> raws, int next, List<Statement> out) {
        Statement statement = new Statement(StatementKind.TRY, raw.text, raw.line);
        if (raw.hasBlock()) {
            statement.body.addAll(structure(raw.block));
        }
        int i = next;
        while (i < raws.size()) {
            RawNode following = raws.get(i);
            String word = Keywords.firstWord(following.text);
            if (Keywords.HANDLER_KEYWORDS.contains(word)) {
                Statement handler = new Statement(StatementKind.HANDLER, following.text, following.line);
                if (following.hasBlock()) {
                    handler.body.addAll(structure(following.block));
                }
                statement.clauses.add(handler);
            } else if (word.equals("finally") && following.hasBlock()) {
                statement.finallyBody = structure(following.block);
            } else if (word.equals("else") && !profile.isBraceDelimited() && following.hasBlock()) {
                // try ... else: runs after the body when nothing was raised
                statement.body.addAll(structure(following.block));
            } else {
                break;
            }
            i++;
        }
        out.add(statement);
        return i;
    }

    /**
     * Splits {@code if (c) stmt} into {header, body}. Without a parenthesised condition
     * the whole text is the header.
     */
    private static String[] splitInlineBody(String text) {
        String word = Keywords.firstWord(text);
        String afterKeyword = text.substring(word.length());
        int offset = word.length() + (afterKeyword.length() - afterKeyword.stripLeading().length());
        if (offset < text.length() && text.charAt(offset) == '(') {
            int close = Keywords.matchingParen(text, offset);
            if (close > 0) {
                return new String[]{text.substring(0, close + 1).trim(), text.substring(close + 1).trim()};
            }
        }
        return new String[]{text, ""};
    }
}

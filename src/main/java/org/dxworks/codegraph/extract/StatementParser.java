package org.dxworks.codegraph.extract;

import org.dxworks.codegraph.LanguageProfile;
import org.dxworks.codegraph.model.FunctionUnit;
import org.dxworks.codegraph.model.ParsedBody;
import org.dxworks.codegraph.model.Statement;
import org.dxworks.codegraph.model.StatementKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a function body into a statement tree, using brace depth or indentation depending
 * on the language profile.
 */
public class StatementParser {

    private final LanguageProfile profile;

    public StatementParser(LanguageProfile profile) {
        this.profile = profile;
    }

    public ParsedBody parse(FunctionUnit unit) {
        Statement entry = new Statement(StatementKind.ENTRY, unit.signature, unit.startLine);
        List<Statement> statements;
        if (unit.expressionBody) {
            Statement result = new Statement(StatementKind.RETURN, "return " + unit.bodyText.trim(), unit.bodyStartLine);
            statements = new ArrayList<>();
            statements.add(result);
        } else {
            statements = parseStatements(unit.bodyText, unit.bodyStartLine);
        }
        return new ParsedBody(unit, entry, statements);
    }

    public List<Statement> parseStatements(String bodyText, int firstLine) {
        List<RawNode> raws = profile.isBraceDelimited()
                ? new BraceScanner(bodyText, firstLine, profile).scan()
                : new IndentScanner(bodyText, firstLine).scan();
        return new StatementStructurer(profile).structure(raws);
    }
}

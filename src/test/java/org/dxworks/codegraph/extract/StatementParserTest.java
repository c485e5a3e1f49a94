package org.dxworks.codegraph.extract;

import org.dxworks.codegraph.TestUtils;
import org.dxworks.codegraph.model.ParsedBody;
import org.dxworks.codegraph.model.Statement;
import org.dxworks.codegraph.model.StatementKind;
import org.dxworks.codegraph.model.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StatementParserTest {

    private final StatementParser typescript = new StatementParser(TestUtils.profile("sample.ts"));

    @Test
    void elseIfChainNestsInElseBody() {
        String body = "\n"
                + "    if (x > 0) {\n"
                + "        return 1;\n"
                + "    } else if (x < 0) {\n"
                + "        return -1;\n"
                + "    } else {\n"
                + "        return 0;\n"
                + "    }\n";
        List<Statement> statements = typescript.parseStatements(body, 1);

        assertEquals(1, statements.size());
        Statement first = statements.get(0);
        assertEquals(StatementKind.IF, first.getKind());
        assertEquals(2, first.getLine());
        assertEquals(StatementKind.RETURN, first.body.get(0).getKind());

        Statement second = first.elseBody.get(0);
        assertEquals(StatementKind.IF, second.getKind());
        assertTrue(second.getText().startsWith("if (x < 0)"));
        assertEquals(4, second.getLine());
        assertNotNull(second.elseBody);
        assertEquals(StatementKind.RETURN, second.elseBody.get(0).getKind());
        assertEquals(7, second.elseBody.get(0).getLine());
    }

    @Test
    void switchSplitsLabelsFromBodies() {
        String body = "\n"
                + "    switch (kind) {\n"
                + "        case 1:\n"
                + "        case 2:\n"
                + "            log(\"low\");\n"
                + "            break;\n"
                + "        default:\n"
                + "            log(\"other\");\n"
                + "    }\n";
        List<Statement> statements = typescript.parseStatements(body, 1);

        Statement switchStatement = statements.get(0);
        assertEquals(StatementKind.SWITCH, switchStatement.getKind());
        assertEquals(2, switchStatement.clauses.size());
        assertEquals(List.of(StatementKind.SIMPLE, StatementKind.BREAK), kinds(switchStatement.clauses.get(0).body));
        assertTrue(switchStatement.clauses.get(1).defaultCase);
    }

    @Test
    void tryCollectsHandlersAndFinally() {
        String body = "\n"
                + "    try {\n"
                + "        risky();\n"
                + "    } catch (e) {\n"
                + "        recover(e);\n"
                + "    } finally {\n"
                + "        cleanup();\n"
                + "    }\n";
        List<Statement> statements = typescript.parseStatements(body, 1);

        assertEquals(1, statements.size());
        Statement tryStatement = statements.get(0);
        assertEquals(StatementKind.TRY, tryStatement.getKind());
        assertEquals(1, tryStatement.body.size());
        assertEquals(1, tryStatement.clauses.size());
        assertEquals(StatementKind.HANDLER, tryStatement.clauses.get(0).getKind());
        assertEquals(1, tryStatement.finallyBody.size());
    }

    @Test
    void doWhileIsPostConditionLoop() {
        String body = "\n"
                + "    do {\n"
                + "        n--;\n"
                + "    } while (n > 0);\n"
                + "    return n;\n";
        List<Statement> statements = typescript.parseStatements(body, 1);

        assertEquals(List.of(StatementKind.LOOP, StatementKind.RETURN), kinds(statements));
        Statement loop = statements.get(0);
        assertTrue(loop.postCondition);
        assertTrue(loop.getText().startsWith("while"));
        assertEquals(1, loop.body.size());
    }

    @Test
    void pythonBodyFollowsIndentation() throws IOException {
        SyntaxTree tree = TestUtils.extractSample("python/scores.py");
        ParsedBody body = TestUtils.parse(tree, "best");

        assertEquals(List.of(StatementKind.SIMPLE, StatementKind.LOOP, StatementKind.RETURN), kinds(body.getStatements()));
        Statement loop = body.getStatements().get(1);
        assertEquals(StatementKind.IF, loop.body.get(0).getKind());
    }

    @Test
    void statementsAreNumberedInPreOrder() throws IOException {
        ParsedBody body = TestUtils.parse(TestUtils.extractSample("typescript/branches.ts"), "classify");

        assertEquals(StatementKind.ENTRY, body.statement(0).getKind());
        for (int id = 0; id < body.size(); id++) {
            assertEquals(id, body.statement(id).getId());
        }
        assertEquals(StatementKind.IF, body.statement(1).getKind());
    }

    private static List<StatementKind> kinds(List<Statement> statements) {
        return statements.stream().map(Statement::getKind).collect(Collectors.toList());
    }
}

package org.dxworks.codegraph.graph.dfg;

import org.dxworks.codegraph.Language;
import org.dxworks.codegraph.extract.Keywords;
import org.dxworks.codegraph.graph.Graph;
import org.dxworks.codegraph.model.ParsedBody;
import org.dxworks.codegraph.model.Statement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds def-use chains for one function.
 * <p>
 * A stack of scopes maps each name to its current definition. A definition replaces the
 * mapping in the innermost scope; a use links to the nearest mapping on the stack, or
 * stays unlinked when the name was never defined. Scopes of if branches, loop bodies,
 * switch arms and handlers are dropped when they close, so their definitions do not
 * reach code after them. Blocks, try bodies and do-while bodies always run and merge
 * into the enclosing scope.
 */
public class DataFlowBuilder {

    public DataFlowGraph build(ParsedBody body) {
        Set<String> reserved = Language.fromName(body.getFunction().language)
                .map(Keywords::reservedFor)
                .orElse(Set.of());
        Walk walk = new Walk(body, new ExpressionScanner(reserved));
        walk.run();
        return new DataFlowGraph(body, walk.graph, walk.exports, walk.operands);
    }

    private static final class Walk {
        private final ParsedBody body;
        private final ExpressionScanner scanner;
        private final Graph<VarNode, DataEdgeKind> graph = new Graph<>();
        private final Deque<Map<String, Integer>> scopes = new ArrayDeque<>();
        private final Map<Integer, Integer> resolved = new HashMap<>();
        private final Map<Integer, List<Integer>> operands = new HashMap<>();
        private final Set<String> exports = new LinkedHashSet<>();

        Walk(ParsedBody body, ExpressionScanner scanner) {
            this.body = body;
            this.scanner = scanner;
        }

        void run() {
            scopes.push(new HashMap<>());
            Statement entry = body.getEntry();
            for (String parameter : body.getFunction().parameters) {
                int id = add(VarKind.PARAMETER, parameter, entry, parameter);
                scopes.peek().put(parameter, id);
            }
            statements(body.getStatements());
        }

        private int add(VarKind kind, String name, Statement statement, String text) {
            int id = graph.nodeCount();
            graph.addNode(new VarNode(id, kind, name, statement.getLine(), statement.getId(), text));
            return id;
        }

        private Integer lookup(String name) {
            for (Map<String, Integer> scope : scopes) {
                Integer definition = scope.get(name);
                if (definition != null) {
                    return definition;
                }
            }
            return null;
        }

        private void push() {
            scopes.push(new HashMap<>());
        }

        private void discard() {
            scopes.pop();
        }

        private void merge() {
            Map<String, Integer> closed = scopes.pop();
            scopes.peek().putAll(closed);
        }

        private void statements(List<Statement> statements) {
            for (Statement statement : statements) {
                statement(statement);
            }
        }

        private void statement(Statement statement) {
            switch (statement.getKind()) {
                case IF:
                    push();
                    apply(scanner.scan(statement), statement);
                    statements(statement.body);
                    discard();
                    if (statement.hasElse()) {
                        push();
                        statements(statement.elseBody);
                        discard();
                    }
                    break;
                case LOOP:
                    loop(statement);
                    break;
                case SWITCH:
                    apply(scanner.scan(statement), statement);
                    for (Statement clause : statement.clauses) {
                        push();
                        apply(scanner.scanCase(clause, statement), clause);
                        statements(clause.body);
                        discard();
                    }
                    break;
                case TRY:
                    push();
                    apply(scanner.scan(statement), statement);
                    statements(statement.body);
                    merge();
                    for (Statement handler : statement.clauses) {
                        push();
                        apply(scanner.scan(handler), handler);
                        statements(handler.body);
                        discard();
                    }
                    if (statement.finallyBody != null) {
                        statements(statement.finallyBody);
                    }
                    break;
                case BLOCK:
                    apply(scanner.scan(statement), statement);
                    push();
                    statements(statement.body);
                    merge();
                    break;
                default:
                    apply(scanner.scan(statement), statement);
                    break;
            }
        }

        /**
         * C-style init runs once in the enclosing scope; condition, body and update repeat
         * in the loop scope. All header parts are attributed to the loop statement.
         */
        private void loop(Statement loop) {
            ExpressionScanner.LoopFacts facts = scanner.scanLoop(loop);
            if (loop.postCondition) {
                int regionStart = graph.nodeCount();
                push();
                statements(loop.body);
                apply(facts.header, loop);
                carryAround(regionStart);
                merge();
                return;
            }
            if (facts.init != null) {
                apply(facts.init, loop);
            }
            int regionStart = graph.nodeCount();
            push();
            apply(facts.header, loop);
            statements(loop.body);
            if (facts.update != null) {
                apply(facts.update, loop);
            }
            carryAround(regionStart);
            discard();
        }

        /**
         * Definitions still live at the end of an iteration reach the uses in the loop that
         * were linked to a definition from before the loop, or to none.
         */
        private void carryAround(int regionStart) {
            Map<String, Integer> loopScope = scopes.peek();
            int regionEnd = graph.nodeCount();
            for (int id = regionStart; id < regionEnd; id++) {
                VarNode node = graph.node(id);
                if (node.kind != VarKind.USE) {
                    continue;
                }
                int reaching = resolved.getOrDefault(id, -1);
                Integer carried = loopScope.get(node.name);
                if (carried != null && (reaching < regionStart) && carried != reaching) {
                    graph.addEdge(carried, id, DataEdgeKind.DEF_USE);
                }
            }
        }

        /**
         * Uses are linked before the statement's own definitions are recorded, so
         * {@code x = x + 1} reads the previous {@code x}.
         */
        private void apply(ExpressionScanner.Facts facts, Statement statement) {
            List<Integer> uses = new ArrayList<>();
            List<Integer> operandDefinitions = new ArrayList<>();
            for (String name : facts.uses) {
                int use = add(VarKind.USE, name, statement, name);
                Integer definition = lookup(name);
                resolved.put(use, definition == null ? -1 : definition);
                operandDefinitions.add(definition == null ? -1 : definition);
                if (definition != null) {
                    graph.addEdge(definition, use, DataEdgeKind.DEF_USE);
                }
                uses.add(use);
            }
            List<Integer> constants = new ArrayList<>();
            for (String literal : facts.constants) {
                constants.add(add(VarKind.CONSTANT, literal, statement, literal));
            }
            int operation = -1;
            if (facts.operation != null) {
                operation = add(VarKind.OPERATION, facts.operation, statement, facts.operation);
                Collections.sort(operandDefinitions);
                operands.put(operation, operandDefinitions);
            }
            List<Integer> calls = new ArrayList<>();
            for (String callee : facts.calls) {
                calls.add(add(VarKind.CALL, callee, statement, callee));
            }

            List<Integer> sources = new ArrayList<>();
            if (operation >= 0) {
                for (Integer operand : uses) {
                    graph.addEdge(operand, operation, DataEdgeKind.VALUE_FLOW);
                }
                for (Integer operand : constants) {
                    graph.addEdge(operand, operation, DataEdgeKind.VALUE_FLOW);
                }
                sources.add(operation);
            } else {
                sources.addAll(uses);
                sources.addAll(constants);
            }
            for (Integer call : calls) {
                for (Integer argument : uses) {
                    graph.addEdge(argument, call, DataEdgeKind.VALUE_FLOW);
                }
                sources.add(call);
            }

            for (String name : facts.defs) {
                int definition = add(VarKind.DEFINITION, name, statement, statement.getText());
                for (Integer source : sources) {
                    graph.addEdge(source, definition, DataEdgeKind.VALUE_FLOW);
                }
                scopes.peek().put(name, definition);
            }
            exports.addAll(facts.exports);
        }
    }
}

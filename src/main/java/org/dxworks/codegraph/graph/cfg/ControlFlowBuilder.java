package org.dxworks.codegraph.graph.cfg;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dxworks.codegraph.extract.Keywords;
import org.dxworks.codegraph.graph.Graph;
import org.dxworks.codegraph.model.ParsedBody;
import org.dxworks.codegraph.model.Statement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Partitions a parsed function body into basic blocks.
 * <p>
 * The walk keeps the block statements are currently appended to plus a list of pending
 * edges: exits of finished branches that must all flow into whatever block opens next.
 * A jump closes the current block without leaving a pending edge, so the next block
 * opened has no predecessor.
 */
public class ControlFlowBuilder {
    private static final Logger logger = LogManager.getLogger(ControlFlowBuilder.class);

    public ControlFlowGraph build(ParsedBody body) {
        Walk walk = new Walk(body);
        walk.run();
        return new ControlFlowGraph(body, walk.graph, walk.exits);
    }

    private static final class Pending {
        final int from;
        final ControlEdgeKind kind;

        Pending(int from, ControlEdgeKind kind) {
            this.from = from;
            this.kind = kind;
        }
    }

    /** An enclosing loop or switch that break and continue statements can target. */
    private static final class JumpTarget {
        final boolean loop;
        final boolean breakable;
        final String label;
        final List<Integer> breaks = new ArrayList<>();
        final List<Integer> continues = new ArrayList<>();

        JumpTarget(boolean loop, boolean breakable, String label) {
            this.loop = loop;
            this.breakable = breakable;
            this.label = label;
        }
    }

    private static final class Walk {
        private final ParsedBody body;
        private final Graph<BasicBlock, ControlEdgeKind> graph = new Graph<>();
        private final List<Integer> exits = new ArrayList<>();
        private final Deque<JumpTarget> targets = new ArrayDeque<>();
        private final Map<String, Integer> labels = new HashMap<>();
        private final List<Integer> gotoBlocks = new ArrayList<>();
        private final List<String> gotoLabels = new ArrayList<>();
        private List<Pending> pending = new ArrayList<>();
        private int current = -1;
        private String label;

        Walk(ParsedBody body) {
            this.body = body;
        }

        void run() {
            newBlock(BlockKind.ENTRY);
            append(body.getEntry());
            statements(body.getStatements());
            finish();
        }

        private int newBlock(BlockKind kind) {
            int id = graph.nodeCount();
            BasicBlock block = new BasicBlock(id, kind);
            graph.addNode(block);
            boolean connected = false;
            if (current >= 0) {
                graph.addEdge(current, id, ControlEdgeKind.SEQUENTIAL);
                connected = true;
            }
            for (Pending edge : pending) {
                graph.addEdge(edge.from, id, edge.kind);
                connected = true;
            }
            pending = new ArrayList<>();
            block.setFollowsJump(!connected && id != ControlFlowGraph.ENTRY);
            current = id;
            return id;
        }

        private void append(Statement statement) {
            if (current < 0 || !pending.isEmpty()) {
                newBlock(BlockKind.NORMAL);
            }
            graph.node(current).addStatement(statement.getId(), statement.getLine());
        }

        /** Opens a dedicated block for a decision statement and leaves no current block. */
        private int header(Statement statement, BlockKind kind) {
            newBlock(kind);
            int id = current;
            graph.node(id).addStatement(statement.getId(), statement.getLine());
            current = -1;
            return id;
        }

        /** Everything that leaves the code walked so far: the open block and pending edges. */
        private List<Pending> takeOuts() {
            List<Pending> outs = new ArrayList<>(pending);
            if (current >= 0) {
                outs.add(new Pending(current, ControlEdgeKind.SEQUENTIAL));
            }
            pending = new ArrayList<>();
            current = -1;
            return outs;
        }

        private void continueWith(List<Pending> outs) {
            current = -1;
            pending = outs;
        }

        private void statements(List<Statement> statements) {
            for (Statement statement : statements) {
                statement(statement);
            }
        }

        private void statement(Statement statement) {
            String ownLabel = label;
            label = null;
            switch (statement.getKind()) {
                case IF:
                    ifStatement(statement);
                    break;
                case LOOP:
                    if (statement.postCondition) {
                        postConditionLoop(statement, ownLabel);
                    } else {
                        loop(statement, ownLabel);
                    }
                    break;
                case SWITCH:
                    switchStatement(statement, ownLabel);
                    break;
                case TRY:
                    tryStatement(statement);
                    break;
                case BLOCK:
                    append(statement);
                    statements(statement.body);
                    break;
                case LABEL:
                    newBlock(BlockKind.NORMAL);
                    graph.node(current).addStatement(statement.getId(), statement.getLine());
                    if (statement.label != null) {
                        labels.put(statement.label, current);
                        label = statement.label;
                    }
                    break;
                case GOTO:
                    append(statement);
                    gotoBlocks.add(current);
                    gotoLabels.add(statement.label);
                    current = -1;
                    break;
                case RETURN:
                case THROW:
                    append(statement);
                    BasicBlock block = graph.node(current);
                    if (block.getKind() != BlockKind.ENTRY) {
                        block.setKind(BlockKind.RETURN);
                    }
                    exits.add(current);
                    current = -1;
                    break;
                case BREAK:
                    jump(statement, false);
                    break;
                case CONTINUE:
                    jump(statement, true);
                    break;
                case SIMPLE:
                    if (statement.inlineBranch) {
                        int branch = header(statement, BlockKind.BRANCH);
                        pending.add(new Pending(branch, ControlEdgeKind.TRUE_BRANCH));
                        pending.add(new Pending(branch, ControlEdgeKind.FALSE_BRANCH));
                    } else {
                        append(statement);
                    }
                    break;
                default:
                    append(statement);
                    break;
            }
        }

        private void ifStatement(Statement statement) {
            int branch = header(statement, BlockKind.BRANCH);
            pending.add(new Pending(branch, ControlEdgeKind.TRUE_BRANCH));
            statements(statement.body);
            List<Pending> outs = takeOuts();

            pending.add(new Pending(branch, ControlEdgeKind.FALSE_BRANCH));
            if (statement.hasElse()) {
                statements(statement.elseBody);
            }
            outs.addAll(takeOuts());
            continueWith(outs);
        }

        private void loop(Statement statement, String ownLabel) {
            int loopHeader = header(statement, BlockKind.LOOP);
            JumpTarget target = new JumpTarget(true, true, ownLabel);
            targets.push(target);
            pending.add(new Pending(loopHeader, ControlEdgeKind.TRUE_BRANCH));
            statements(statement.body);
            for (Pending out : takeOuts()) {
                graph.addEdge(out.from, loopHeader, ControlEdgeKind.LOOP_BACK);
            }
            targets.pop();
            for (Integer from : target.continues) {
                graph.addEdge(from, loopHeader, ControlEdgeKind.CONTINUE);
            }

            List<Pending> outs = new ArrayList<>();
            if (!statement.unconditional) {
                outs.add(new Pending(loopHeader, ControlEdgeKind.FALSE_BRANCH));
            }
            addBreaks(target, outs);
            continueWith(outs);
        }

        /** do/while and repeat/while: the body runs once before the condition is tested. */
        private void postConditionLoop(Statement statement, String ownLabel) {
            int bodyStart = newBlock(BlockKind.NORMAL);
            JumpTarget target = new JumpTarget(true, true, ownLabel);
            targets.push(target);
            statements(statement.body);
            targets.pop();

            int condition = header(statement, BlockKind.LOOP);
            for (Integer from : target.continues) {
                graph.addEdge(from, condition, ControlEdgeKind.CONTINUE);
            }
            graph.addEdge(condition, bodyStart, ControlEdgeKind.LOOP_BACK);

            List<Pending> outs = new ArrayList<>();
            if (!statement.unconditional) {
                outs.add(new Pending(condition, ControlEdgeKind.FALSE_BRANCH));
            }
            addBreaks(target, outs);
            continueWith(outs);
        }

        private void switchStatement(Statement statement, String ownLabel) {
            int branch = header(statement, BlockKind.BRANCH);
            String keyword = Keywords.firstWord(statement.getText());
            boolean breakable = keyword.equals("switch") || keyword.equals("select");
            JumpTarget target = new JumpTarget(false, breakable, ownLabel);
            targets.push(target);

            List<Pending> outs = new ArrayList<>();
            List<Pending> fallOut = new ArrayList<>();
            boolean hasDefault = false;
            for (Statement clause : statement.clauses) {
                pending.add(new Pending(branch, ControlEdgeKind.TRUE_BRANCH));
                if (!statement.matchStyle) {
                    pending.addAll(fallOut);
                }
                newBlock(BlockKind.NORMAL);
                graph.node(current).addStatement(clause.getId(), clause.getLine());
                statements(clause.body);
                List<Pending> caseOuts = takeOuts();
                if (statement.matchStyle) {
                    outs.addAll(caseOuts);
                } else {
                    fallOut = caseOuts;
                }
                hasDefault |= clause.defaultCase;
            }
            targets.pop();

            outs.addAll(fallOut);
            if (!hasDefault) {
                outs.add(new Pending(branch, ControlEdgeKind.FALSE_BRANCH));
            }
            addBreaks(target, outs);
            continueWith(outs);
        }

        /**
         * The try body is the true branch of the try header, each handler a false branch.
         * A finally block is also entered straight from the header, for exceptions no
         * handler catches.
         */
        private void tryStatement(Statement statement) {
            int branch = header(statement, BlockKind.BRANCH);
            pending.add(new Pending(branch, ControlEdgeKind.TRUE_BRANCH));
            statements(statement.body);
            List<Pending> outs = takeOuts();

            for (Statement handler : statement.clauses) {
                pending.add(new Pending(branch, ControlEdgeKind.FALSE_BRANCH));
                newBlock(BlockKind.NORMAL);
                graph.node(current).addStatement(handler.getId(), handler.getLine());
                statements(handler.body);
                outs.addAll(takeOuts());
            }

            if (statement.finallyBody != null) {
                outs.add(new Pending(branch, ControlEdgeKind.FALSE_BRANCH));
                continueWith(outs);
                statements(statement.finallyBody);
                outs = takeOuts();
            }
            continueWith(outs);
        }

        private void jump(Statement statement, boolean isContinue) {
            JumpTarget target = findTarget(statement.label, isContinue);
            append(statement);
            if (target == null) {
                logger.debug("{} at line {} has no enclosing target, treated as a plain statement",
                        statement.getKind(), statement.getLine());
                return;
            }
            if (isContinue) {
                target.continues.add(current);
            } else {
                target.breaks.add(current);
            }
            current = -1;
        }

        /** Labelled target when the label names one, else the innermost eligible one. */
        private JumpTarget findTarget(String wanted, boolean isContinue) {
            if (wanted != null) {
                for (JumpTarget target : targets) {
                    if (wanted.equals(target.label) && (target.loop || !isContinue)) {
                        return target;
                    }
                }
            }
            for (JumpTarget target : targets) {
                if (isContinue ? target.loop : target.breakable) {
                    return target;
                }
            }
            return null;
        }

        private static void addBreaks(JumpTarget target, List<Pending> outs) {
            for (Integer from : target.breaks) {
                outs.add(new Pending(from, ControlEdgeKind.BREAK));
            }
        }

        private void finish() {
            if (current >= 0 && graph.node(current).getKind() == BlockKind.NORMAL && pending.isEmpty()) {
                graph.node(current).setKind(BlockKind.EXIT);
                exits.add(current);
                current = -1;
            }
            if (!pending.isEmpty() || (current >= 0 && current != ControlFlowGraph.ENTRY)) {
                exits.add(newBlock(BlockKind.EXIT));
            } else if (current == ControlFlowGraph.ENTRY) {
                exits.add(current);
            }

            for (int i = 0; i < gotoBlocks.size(); i++) {
                Integer target = labels.get(gotoLabels.get(i));
                if (target != null) {
                    graph.addEdge(gotoBlocks.get(i), target, ControlEdgeKind.SEQUENTIAL);
                } else {
                    logger.debug("goto {} has no matching label in {}", gotoLabels.get(i),
                            body.getFunction().qualifiedName);
                    exits.add(gotoBlocks.get(i));
                }
            }
        }
    }
}

package org.dxworks.codegraph.engine;

import org.dxworks.codegraph.graph.cfg.ControlFlowGraph;
import org.dxworks.codegraph.graph.dfg.DataFlowGraph;
import org.dxworks.codegraph.graph.pdg.ProgramDependencyGraph;
import org.dxworks.codegraph.model.FunctionUnit;
import org.dxworks.codegraph.model.ParsedBody;

/** The per-function graphs, built from one parse of the body. */
public class FunctionAnalysis {
    private final ParsedBody body;
    private final ControlFlowGraph controlFlow;
    private final DataFlowGraph dataFlow;
    private final ProgramDependencyGraph programDependency;

    public FunctionAnalysis(ParsedBody body, ControlFlowGraph controlFlow, DataFlowGraph dataFlow,
                            ProgramDependencyGraph programDependency) {
        this.body = body;
        this.controlFlow = controlFlow;
        this.dataFlow = dataFlow;
        this.programDependency = programDependency;
    }

    public FunctionUnit getFunction() {
        return body.getFunction();
    }

    public ParsedBody getBody() {
        return body;
    }

    public ControlFlowGraph getControlFlow() {
        return controlFlow;
    }

    public DataFlowGraph getDataFlow() {
        return dataFlow;
    }

    public ProgramDependencyGraph getProgramDependency() {
        return programDependency;
    }
}

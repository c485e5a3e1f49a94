package org.dxworks.codegraph.graph.pdg;

import org.dxworks.codegraph.graph.dfg.VarNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Which sinks data from the sources reaches, each with one witness path. */
public class TaintReport {

    public static class Flow {
        public final VarNode source;
        public final VarNode sink;
        /** Data-flow nodes from source to sink, both included. */
        public final List<VarNode> path;

        Flow(List<VarNode> path) {
            this.source = path.get(0);
            this.sink = path.get(path.size() - 1);
            this.path = Collections.unmodifiableList(path);
        }
    }

    private final List<VarNode> sources;
    private final List<VarNode> sinks;
    private final List<Flow> flows = new ArrayList<>();

    TaintReport(List<VarNode> sources, List<VarNode> sinks) {
        this.sources = Collections.unmodifiableList(sources);
        this.sinks = Collections.unmodifiableList(sinks);
    }

    void addFlow(List<VarNode> path) {
        flows.add(new Flow(path));
    }

    public List<VarNode> getSources() {
        return sources;
    }

    public List<VarNode> getSinks() {
        return sinks;
    }

    public List<Flow> getFlows() {
        return Collections.unmodifiableList(flows);
    }

    public boolean isTainted(int sinkId) {
        for (Flow flow : flows) {
            if (flow.sink.id == sinkId) {
                return true;
            }
        }
        return false;
    }

    public List<VarNode> taintedSinks() {
        List<VarNode> result = new ArrayList<>();
        for (Flow flow : flows) {
            result.add(flow.sink);
        }
        return result;
    }

    public boolean hasFlows() {
        return !flows.isEmpty();
    }
}

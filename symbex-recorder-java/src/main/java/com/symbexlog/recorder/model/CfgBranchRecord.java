package com.symbexlog.recorder.model;

import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Branching out of a control-flow-graph node: one child list per explored
 * outgoing edge. Each list normally holds a single edge record.
 */
public class CfgBranchRecord extends SymbolicRecord {

    private final List<ProgramNode> edges;
    private final String environment;
    private final List<List<SymbolicRecord>> branches = new ArrayList<>();

    public CfgBranchRecord(List<ProgramNode> edges, SymbolicState state, Set<Term> pathConditions, String environment) {
        super(RecordKind.CFG_BRANCH, null, state, pathConditions);
        this.edges = edges != null ? List.copyOf(edges) : List.of();
        this.environment = environment;
    }

    public String environment() {
        return environment;
    }

    public List<ProgramNode> edges() {
        return edges;
    }

    public List<List<SymbolicRecord>> branches() {
        return Collections.unmodifiableList(branches);
    }

    /** Closes the successor explored last. A successor that logged nothing is not kept. */
    public void finishBranch() {
        List<SymbolicRecord> logged = takeChildren();
        if (!logged.isEmpty()) {
            branches.add(Collections.unmodifiableList(logged));
        }
    }

    @Override
    public String toSimpleString() {
        if (edges.isEmpty()) {
            return "CfgBranch<Null>";
        }
        return edges.stream().map(ProgramNode::text).collect(Collectors.joining(" | "));
    }

    @Override
    public String toString() {
        return environment + " " + toSimpleString();
    }

    @Override
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        if (!edges.isEmpty()) {
            json.addProperty("kind", toTypeString());
            json.addProperty("value", toSimpleString());
        }
        return json;
    }
}

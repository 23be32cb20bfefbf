package com.symbexlog.recorder.model;

import java.util.Set;

/** A control-flow edge without a guard; its children are the statements of the target block. */
public class UnconditionalEdgeRecord extends SymbolicRecord {

    private final String environment;

    public UnconditionalEdgeRecord(SymbolicState state, Set<Term> pathConditions, String environment) {
        super(RecordKind.UNCONDITIONAL_EDGE, null, state, pathConditions);
        this.environment = environment;
    }

    public String environment() {
        return environment;
    }

    @Override
    public String toSimpleString() {
        return "UnconditionalEdge<Null>";
    }

    @Override
    public String toString() {
        return environment + " " + toSimpleString();
    }
}

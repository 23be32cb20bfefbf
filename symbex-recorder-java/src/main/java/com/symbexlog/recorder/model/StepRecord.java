package com.symbexlog.recorder.model;

import com.google.gson.JsonObject;

import java.util.EnumSet;
import java.util.Set;

/**
 * One of the four symbolic primitives: execute a statement, evaluate an
 * expression, produce or consume an assertion.
 */
public class StepRecord extends SymbolicRecord {

    private static final Set<RecordKind> STEP_KINDS =
        EnumSet.of(RecordKind.EXECUTE, RecordKind.EVALUATE, RecordKind.PRODUCE, RecordKind.CONSUME);

    public StepRecord(RecordKind kind, ProgramNode node, SymbolicState state, Set<Term> pathConditions) {
        super(kind, node, state, pathConditions);
        if (!STEP_KINDS.contains(kind)) {
            throw new IllegalArgumentException("not a step kind: " + kind);
        }
    }

    public static StepRecord execute(ProgramNode stmt, SymbolicState state, Set<Term> pcs) {
        return new StepRecord(RecordKind.EXECUTE, stmt, state, pcs);
    }

    public static StepRecord evaluate(ProgramNode exp, SymbolicState state, Set<Term> pcs) {
        return new StepRecord(RecordKind.EVALUATE, exp, state, pcs);
    }

    public static StepRecord produce(ProgramNode exp, SymbolicState state, Set<Term> pcs) {
        return new StepRecord(RecordKind.PRODUCE, exp, state, pcs);
    }

    public static StepRecord consume(ProgramNode exp, SymbolicState state, Set<Term> pcs) {
        return new StepRecord(RecordKind.CONSUME, exp, state, pcs);
    }

    @Override
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        if (sourceNode() != null) {
            json.addProperty("type", toTypeString());
            if (sourceNode().position() != null) {
                json.addProperty("pos", sourceNode().position());
            }
            json.addProperty("value", sourceNode().text());
        }
        return json;
    }
}

package com.symbexlog.recorder.model;

import com.google.gson.JsonObject;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * A method call statement: evaluation of the arguments, consumption of the
 * callee's precondition and production of its postcondition.
 */
public class MethodCallRecord extends SymbolicRecord {

    private List<SymbolicRecord> parameters = List.of();
    private SymbolicRecord precondition = StepRecord.consume(null, null, null);
    private SymbolicRecord postcondition = StepRecord.produce(null, null, null);

    public MethodCallRecord(ProgramNode call, SymbolicState state, Set<Term> pathConditions) {
        super(RecordKind.METHOD_CALL, call, state, pathConditions);
    }

    public List<SymbolicRecord> parameters()  { return Collections.unmodifiableList(parameters); }
    public SymbolicRecord precondition()      { return precondition; }
    public SymbolicRecord postcondition()     { return postcondition; }

    /** An empty working list means the call has no arguments. */
    public void finishParameters() {
        parameters = takeChildren();
    }

    public void finishPrecondition() {
        List<SymbolicRecord> logged = takeChildren();
        if (!logged.isEmpty()) {
            precondition = logged.get(0);
        }
    }

    public void finishPostcondition() {
        List<SymbolicRecord> logged = takeChildren();
        if (!logged.isEmpty()) {
            postcondition = logged.get(0);
        }
    }

    @Override
    public String toSimpleString() {
        return sourceNode() != null ? sourceNode().text() : "MethodCall <null>";
    }

    @Override
    public String toString() {
        return sourceNode() != null ? "execute: " + sourceNode().text() : "execute: MethodCall <null>";
    }

    @Override
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        if (sourceNode() != null) {
            json.addProperty("kind", toTypeString());
            json.addProperty("value", sourceNode().text());
        }
        return json;
    }
}

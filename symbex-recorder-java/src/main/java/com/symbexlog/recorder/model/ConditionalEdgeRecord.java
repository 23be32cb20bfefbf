package com.symbexlog.recorder.model;

import com.google.gson.JsonObject;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/** A control-flow edge guarded by a condition, followed by the statements of its target block. */
public class ConditionalEdgeRecord extends SymbolicRecord {

    private final String environment;

    private SymbolicRecord condition = new CommentRecord(CommentRecord.MISSING_CONDITION);
    private List<SymbolicRecord> thenChildren = List.of(CommentRecord.unreachable());
    private long condEndTimeMs;
    private long thenEndTimeMs;

    public ConditionalEdgeRecord(ProgramNode condition, SymbolicState state, Set<Term> pathConditions, String environment) {
        super(RecordKind.CONDITIONAL_EDGE, condition, state, pathConditions);
        this.environment = environment;
    }

    public String environment()                 { return environment; }
    public SymbolicRecord condition()           { return condition; }
    public List<SymbolicRecord> thenChildren()  { return Collections.unmodifiableList(thenChildren); }
    public long condEndTimeMs()                 { return condEndTimeMs; }
    public long thenEndTimeMs()                 { return thenEndTimeMs; }

    public void finishCondition() {
        finishCondition(now());
    }

    public void finishCondition(long nowMs) {
        condEndTimeMs = nowMs;
        List<SymbolicRecord> logged = takeChildren();
        if (!logged.isEmpty()) {
            condition = logged.get(0);
        }
    }

    public void finishThen() {
        finishThen(now());
    }

    public void finishThen(long nowMs) {
        thenEndTimeMs = nowMs;
        List<SymbolicRecord> logged = takeChildren();
        if (!logged.isEmpty()) {
            thenChildren = logged;
        }
    }

    @Override
    public String toSimpleString() {
        return sourceNode() != null ? sourceNode().text() : "ConditionalEdge<Null>";
    }

    @Override
    public String toString() {
        return environment + " " + toSimpleString();
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

package com.symbexlog.recorder.model;

import com.google.gson.JsonObject;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * A case split with a condition and two continuations.
 *
 * Used for global branches (the whole remaining verification forks) and for
 * local branches (the two continuations join again afterwards). While the
 * record is open, nested steps accrue as its children; each {@code finish*}
 * call moves them into the slot of the phase that just ended. A slot whose
 * phase logged nothing keeps its placeholder.
 */
public class TwoBranchRecord extends SymbolicRecord {

    private final String environment;

    private SymbolicRecord condition = new CommentRecord(CommentRecord.MISSING_CONDITION);
    private List<SymbolicRecord> thenChildren = List.of(CommentRecord.unreachable());
    private List<SymbolicRecord> elseChildren = List.of(CommentRecord.unreachable());
    private boolean thenExplored;
    private boolean elseExplored;
    private long condEndTimeMs;
    private long thenEndTimeMs;
    private long elseEndTimeMs;

    public TwoBranchRecord(RecordKind kind, ProgramNode condition, SymbolicState state,
                           Set<Term> pathConditions, String environment) {
        super(kind, condition, state, pathConditions);
        if (kind != RecordKind.GLOBAL_BRANCH && kind != RecordKind.LOCAL_BRANCH) {
            throw new IllegalArgumentException("not a two-branch kind: " + kind);
        }
        this.environment = environment;
    }

    public static TwoBranchRecord global(ProgramNode condition, SymbolicState state, Set<Term> pcs, String environment) {
        return new TwoBranchRecord(RecordKind.GLOBAL_BRANCH, condition, state, pcs, environment);
    }

    public static TwoBranchRecord local(ProgramNode condition, SymbolicState state, Set<Term> pcs, String environment) {
        return new TwoBranchRecord(RecordKind.LOCAL_BRANCH, condition, state, pcs, environment);
    }

    public String environment()                  { return environment; }
    public SymbolicRecord condition()            { return condition; }
    public List<SymbolicRecord> thenChildren()   { return Collections.unmodifiableList(thenChildren); }
    public List<SymbolicRecord> elseChildren()   { return Collections.unmodifiableList(elseChildren); }
    public boolean thenExplored()                { return thenExplored; }
    public boolean elseExplored()                { return elseExplored; }
    public long condEndTimeMs()                  { return condEndTimeMs; }
    public long thenEndTimeMs()                  { return thenEndTimeMs; }
    public long elseEndTimeMs()                  { return elseEndTimeMs; }

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
        thenExplored = true;
        thenEndTimeMs = nowMs;
        List<SymbolicRecord> logged = takeChildren();
        if (!logged.isEmpty()) {
            thenChildren = logged;
        }
    }

    public void finishElse() {
        finishElse(now());
    }

    public void finishElse(long nowMs) {
        elseExplored = true;
        elseEndTimeMs = nowMs;
        List<SymbolicRecord> logged = takeChildren();
        if (!logged.isEmpty()) {
            elseChildren = logged;
        }
    }

    /**
     * Stamps the end time for a branch record whose id was reset by branch
     * bookkeeping, so its collapse never reaches the builder's pending table.
     */
    public void finishRecord() {
        markEnd(now());
    }

    public int exploredBranchesCount() {
        return (thenExplored ? 1 : 0) + (elseExplored ? 1 : 0);
    }

    @Override
    public String toSimpleString() {
        return sourceNode() != null ? sourceNode().text() : toTypeString() + "<Null>";
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

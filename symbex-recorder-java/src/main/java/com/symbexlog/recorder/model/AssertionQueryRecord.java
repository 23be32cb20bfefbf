package com.symbexlog.recorder.model;

import com.google.gson.JsonObject;

/**
 * An assertion checked by the decider, or handed on to the SMT prover.
 * Only the prover variant counts as an SMT query.
 */
public class AssertionQueryRecord extends SymbolicRecord {

    private final Term term;
    private final Integer timeoutMs;

    public AssertionQueryRecord(RecordKind kind, Term term, Integer timeoutMs) {
        super(kind, null, null, null);
        if (kind != RecordKind.DECIDER_ASSERT && kind != RecordKind.PROVER_ASSERT) {
            throw new IllegalArgumentException("not an assertion kind: " + kind);
        }
        this.term = term;
        this.timeoutMs = timeoutMs;
    }

    public static AssertionQueryRecord decider(Term term, Integer timeoutMs) {
        return new AssertionQueryRecord(RecordKind.DECIDER_ASSERT, term, timeoutMs);
    }

    public static AssertionQueryRecord prover(Term term, Integer timeoutMs) {
        return new AssertionQueryRecord(RecordKind.PROVER_ASSERT, term, timeoutMs);
    }

    public Term term()          { return term; }
    public Integer timeoutMs()  { return timeoutMs; }

    public boolean isSmtQuery() {
        return kind() == RecordKind.PROVER_ASSERT;
    }

    @Override
    public String toSimpleString() {
        return term != null ? term.render() : toTypeString() + " <null>";
    }

    @Override
    public String toString() {
        String prefix = isSmtQuery() ? "Prover assert: " : "Decider assert: ";
        return prefix + (term != null ? term.render() : "<null>");
    }

    @Override
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("kind", toTypeString());
        if (term != null) {
            json.addProperty("value", term.render());
        }
        if (timeoutMs != null) {
            json.addProperty("timeout", timeoutMs);
        }
        return json;
    }
}

package com.symbexlog.recorder.model;

import com.google.gson.JsonObject;

import java.util.Set;

/** Root record of a unit's trace: one verified method, predicate or function. */
public class MemberRecord extends SymbolicRecord {

    public MemberRecord(ProgramNode member, SymbolicState state, Set<Term> pathConditions) {
        super(kindOf(member), member, state, pathConditions);
    }

    private static RecordKind kindOf(ProgramNode member) {
        if (member == null) {
            throw new IllegalArgumentException("member node is required");
        }
        switch (member.kind()) {
            case METHOD:    return RecordKind.METHOD;
            case PREDICATE: return RecordKind.PREDICATE;
            case FUNCTION:  return RecordKind.FUNCTION;
            default:
                throw new IllegalArgumentException("not a verifiable unit: " + member.kind() + " " + member.text());
        }
    }

    @Override
    public String toSimpleString() {
        return sourceNode().name();
    }

    @Override
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        String tag = toTypeString();
        json.addProperty("kind", Character.toUpperCase(tag.charAt(0)) + tag.substring(1));
        json.addProperty("value", sourceNode().name());
        if (lastFailedProverQuery() != null) {
            json.addProperty("lastFailedProverQuery", lastFailedProverQuery().render());
        }
        return json;
    }
}

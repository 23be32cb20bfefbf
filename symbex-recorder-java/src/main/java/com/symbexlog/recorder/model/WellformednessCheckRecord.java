package com.symbexlog.recorder.model;

import com.google.gson.JsonObject;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/** Well-definedness check of a list of specification expressions. */
public class WellformednessCheckRecord extends SymbolicRecord {

    private final List<ProgramNode> conditions;

    public WellformednessCheckRecord(List<ProgramNode> conditions, SymbolicState state, Set<Term> pathConditions) {
        super(RecordKind.WELLFORMEDNESS_CHECK, null, state, pathConditions);
        this.conditions = List.copyOf(conditions);
    }

    public List<ProgramNode> conditions() {
        return conditions;
    }

    @Override
    public String toSimpleString() {
        return conditions.stream().map(ProgramNode::text).collect(Collectors.joining(", "));
    }

    @Override
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("kind", toTypeString());
        return json;
    }
}

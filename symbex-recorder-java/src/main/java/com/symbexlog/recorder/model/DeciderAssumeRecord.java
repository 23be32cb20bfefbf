package com.symbexlog.recorder.model;

import com.google.gson.JsonObject;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/** Terms added to the path conditions. */
public class DeciderAssumeRecord extends SymbolicRecord {

    private final Set<Term> terms;

    public DeciderAssumeRecord(Set<Term> terms) {
        super(RecordKind.DECIDER_ASSUME, null, null, null);
        this.terms = terms != null ? new LinkedHashSet<>(terms) : null;
    }

    public Set<Term> terms() {
        return terms;
    }

    @Override
    public String toSimpleString() {
        return terms != null ? render() : "DeciderAssume <null>";
    }

    @Override
    public String toString() {
        return "Decider assume: " + (terms != null ? render() : "<null>");
    }

    private String render() {
        return terms.stream().map(Term::render).collect(Collectors.joining(" "));
    }

    @Override
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("kind", toTypeString());
        if (terms != null) {
            json.addProperty("value", render());
        }
        return json;
    }
}

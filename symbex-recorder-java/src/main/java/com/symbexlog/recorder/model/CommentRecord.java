package com.symbexlog.recorder.model;

import com.google.gson.JsonObject;

import java.util.Set;

/** Free-text annotation. Also serves as the placeholder of unexplored branch slots. */
public class CommentRecord extends SymbolicRecord {

    public static final String UNREACHABLE = "Unreachable";
    public static final String MISSING_CONDITION = "<missing condition>";

    private final String comment;

    public CommentRecord(String comment, SymbolicState state, Set<Term> pathConditions) {
        super(RecordKind.COMMENT, null, state, pathConditions);
        this.comment = comment;
    }

    public CommentRecord(String comment) {
        this(comment, null, null);
    }

    public static CommentRecord unreachable() {
        return new CommentRecord(UNREACHABLE);
    }

    public String comment() {
        return comment;
    }

    public boolean isUnreachablePlaceholder() {
        return UNREACHABLE.equals(comment);
    }

    @Override
    public String toSimpleString() {
        return comment != null ? comment : "null";
    }

    @Override
    public String toString() {
        return "comment: " + toSimpleString();
    }

    @Override
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        if (comment != null) {
            json.addProperty("value", comment);
        }
        return json;
    }

    @Override
    public String dotLabel() {
        return quote(toSimpleString());
    }
}

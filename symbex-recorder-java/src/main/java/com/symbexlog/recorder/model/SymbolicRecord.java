package com.symbexlog.recorder.model;

import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * One node of a unit's execution trace.
 *
 * The {@link RecordKind} tag identifies the variant; renderers dispatch on it.
 * Children accrue in insertion order while the record is the innermost open
 * record of its {@code TraceBuilder}. Branch-shaped variants move those children
 * into named slots when a phase finishes.
 */
public abstract class SymbolicRecord {

    private static final AtomicLong NEXT_NODE_ID = new AtomicLong();

    private final RecordKind kind;
    private final ProgramNode sourceNode;
    private final SymbolicState state;
    private final Set<Term> pathConditions;
    private final long nodeId = NEXT_NODE_ID.incrementAndGet();

    private List<SymbolicRecord> children = new ArrayList<>();
    private Term lastFailedProverQuery;
    private LongSupplier clock = System::currentTimeMillis;
    private long startTimeMs;
    private long endTimeMs;

    protected SymbolicRecord(RecordKind kind, ProgramNode sourceNode, SymbolicState state, Set<Term> pathConditions) {
        this.kind = kind;
        this.sourceNode = sourceNode;
        this.state = state;
        this.pathConditions = pathConditions;
    }

    public RecordKind kind()                { return kind; }
    public ProgramNode sourceNode()         { return sourceNode; }
    public SymbolicState state()            { return state; }
    public Set<Term> pathConditions()       { return pathConditions; }
    public long startTimeMs()               { return startTimeMs; }
    public long endTimeMs()                 { return endTimeMs; }
    public Term lastFailedProverQuery()     { return lastFailedProverQuery; }

    /** Children in insertion order. Read-only view. */
    public List<SymbolicRecord> children() {
        return Collections.unmodifiableList(children);
    }

    public void addChild(SymbolicRecord child) {
        children.add(child);
    }

    /** Hands the accumulated children to a phase slot and starts a fresh working list. */
    protected List<SymbolicRecord> takeChildren() {
        List<SymbolicRecord> taken = children;
        children = new ArrayList<>();
        return taken;
    }

    /** Sets the start time unless one is already set. */
    public void markStart(long timeMs) {
        if (startTimeMs == 0) {
            startTimeMs = timeMs;
        }
    }

    /** Sets the end time unless one is already set. */
    public void markEnd(long timeMs) {
        if (endTimeMs == 0) {
            endTimeMs = timeMs;
        }
    }

    /**
     * Time source for the phase timestamps taken by the no-argument
     * {@code finish*} methods. The builder passes its own clock on insert.
     */
    public void setClock(LongSupplier clock) {
        this.clock = clock;
    }

    protected long now() {
        return clock.getAsLong();
    }

    public void setLastFailedProverQuery(Term query) {
        this.lastFailedProverQuery = query;
    }

    public String toTypeString() {
        return kind.typeString();
    }

    public String toSimpleString() {
        return sourceNode != null ? sourceNode.text() : "null";
    }

    /** One-line display form: type tag and node text. */
    @Override
    public String toString() {
        return toTypeString() + " " + toSimpleString();
    }

    /** Key/value export for machine-readable renderers. Empty when there is nothing to say. */
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        if (sourceNode != null) {
            json.addProperty("value", sourceNode.text());
        }
        return json;
    }

    /** Graph identity token, distinct per record instance. */
    public String nodeId() {
        return "r" + nodeId;
    }

    public String dotLabel() {
        return quote(toString());
    }

    protected static String quote(String s) {
        return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
    }
}

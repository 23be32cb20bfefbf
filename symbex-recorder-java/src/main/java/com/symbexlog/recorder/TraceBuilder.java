package com.symbexlog.recorder;

import com.symbexlog.recorder.model.MemberRecord;
import com.symbexlog.recorder.model.NodeKind;
import com.symbexlog.recorder.model.ProgramNode;
import com.symbexlog.recorder.model.RecordKind;
import com.symbexlog.recorder.model.SymbolicRecord;
import com.symbexlog.recorder.model.SymbolicState;
import com.symbexlog.recorder.model.Term;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * Records the execution trace of one verified unit.
 *
 * The executor brackets every step with {@link #insert} and {@link #collapse}.
 * The record inserted last and not yet collapsed is the innermost open record;
 * further inserts become its children. Each insert hands out an id that the
 * matching collapse must pass back, so a step is closed at most once.
 *
 * Branch exploration runs sibling continuations one after another on the same
 * call stack, and a continuation may close steps that were opened above the
 * fork. {@link #beginBranch}, {@link #prepareOtherBranch} and {@link #endBranch}
 * isolate each sibling's bookkeeping and merge the outcomes afterwards: a close
 * that no sibling could match stays deferred in the ignored set and is replayed
 * once its record is back on top of the stack.
 */
public class TraceBuilder {

    /** Id returned for steps that are not recorded. Collapsing it does nothing. */
    public static final int SENTINEL_ID = -1;

    private static final TraceBuilder NOOP = new NoopTraceBuilder();

    private final MemberRecord root;
    private final LongSupplier clock;
    private final AbortedBranchPolicy abortedBranchPolicy;
    private final Map<Term, Term> macros = new LinkedHashMap<>();

    // Innermost open record first; the root stays at the bottom.
    private Deque<SymbolicRecord> openStack = new ArrayDeque<>();
    private Map<Integer, SymbolicRecord> pending = new LinkedHashMap<>();
    private Set<Integer> ignored = new LinkedHashSet<>();
    private int lastId;
    private boolean currentBranchAborted;

    public TraceBuilder(ProgramNode member, SymbolicState state, Set<Term> pathConditions) {
        this(member, state, pathConditions, System::currentTimeMillis, AbortedBranchPolicy.STRICT);
    }

    public TraceBuilder(ProgramNode member, SymbolicState state, Set<Term> pathConditions,
                        LongSupplier clock, AbortedBranchPolicy abortedBranchPolicy) {
        this.root = new MemberRecord(member, state, pathConditions);
        this.clock = clock;
        this.abortedBranchPolicy = abortedBranchPolicy;
        root.setClock(clock);
        root.markStart(clock.getAsLong());
        openStack.push(root);
    }

    private TraceBuilder() {
        this.root = null;
        this.clock = () -> 0L;
        this.abortedBranchPolicy = AbortedBranchPolicy.STRICT;
    }

    /** Builder that accepts every call and records nothing; handed out while recording is disabled. */
    public static TraceBuilder noop() {
        return NOOP;
    }

    public boolean isRecording() {
        return true;
    }

    public MemberRecord root() {
        return root;
    }

    /** The innermost open record. */
    public SymbolicRecord currentRecord() {
        return openStack.peek();
    }

    // -----------------------------------------------------------------------
    // Insert / collapse
    // -----------------------------------------------------------------------

    /**
     * Opens a step. The record becomes the last child of the innermost open
     * record and then the innermost open record itself.
     *
     * @return the id to pass to {@link #collapse}, or {@link #SENTINEL_ID} if
     *         the step is not recorded
     */
    public int insert(SymbolicRecord record) {
        if (!isLogged(record.sourceNode()) || isRecordedDifferently(record)) {
            return SENTINEL_ID;
        }
        record.setClock(clock);
        record.markStart(clock.getAsLong());
        currentRecord().addChild(record);
        openStack.push(record);
        lastId++;
        pending.put(lastId, record);
        return lastId;
    }

    /**
     * Closes the step opened under {@code id}.
     *
     * @param node the node whose step ends; only consulted by the logging filter, may be null
     * @param id   the id returned by {@link #insert}
     * @throws ProtocolViolationException if the innermost open record is not the one issued under {@code id}
     */
    public void collapse(ProgramNode node, int id) {
        if (id == SENTINEL_ID) {
            return;
        }
        SymbolicRecord record = pending.remove(id);
        if (record == null) {
            // Issued before a fork, or already closed: defer instead of corrupting the stack.
            ignored.add(id);
            return;
        }
        if (isLogged(node)) {
            SymbolicRecord top = currentRecord();
            if (top != null) {
                top.markEnd(clock.getAsLong());
            }
            if (record != top) {
                throw new ProtocolViolationException("collapse of id " + id + " (" + record
                    + ") does not match the innermost open record (" + top + ")");
            }
            openStack.pop();
        }

        Integer deferred = deferredCloseOfCurrent();
        if (deferred != null) {
            collapse(null, deferred);
        }
    }

    /** A pending id whose record is on top again and whose close already arrived. */
    private Integer deferredCloseOfCurrent() {
        SymbolicRecord top = currentRecord();
        for (Map.Entry<Integer, SymbolicRecord> e : pending.entrySet()) {
            if (e.getValue() == top && ignored.contains(e.getKey())) {
                return e.getKey();
            }
        }
        return null;
    }

    // -----------------------------------------------------------------------
    // Branching
    // -----------------------------------------------------------------------

    /**
     * Saves the bookkeeping before a fork and clears pending and ignored ids, so
     * closes of steps opened above the fork are deferred inside the first sibling.
     *
     * @return the pre-fork state; pass it to {@link #prepareOtherBranch} and {@link #endBranch}
     */
    public BranchState beginBranch() {
        BranchState saved = snapshot(false);
        pending = new LinkedHashMap<>();
        ignored = new LinkedHashSet<>();
        return saved;
    }

    /**
     * Captures the outcome of the sibling explored so far and resets the
     * bookkeeping for the next one, which starts from the pre-fork stack.
     */
    public BranchState prepareOtherBranch(BranchState preFork) {
        BranchState outcome = snapshot(currentBranchAborted);
        currentBranchAborted = false;
        pending = new LinkedHashMap<>();
        ignored = new LinkedHashSet<>();
        openStack = new ArrayDeque<>(preFork.openStack());
        return outcome;
    }

    /**
     * Marks the sibling currently being explored as aborted before it finished,
     * e.g. after a prover timeout. Its outcome then takes part in the merge as
     * {@link AbortedBranchPolicy} prescribes.
     */
    public void markBranchAborted() {
        currentBranchAborted = true;
    }

    /**
     * Restores the pre-fork state after all siblings were explored.
     *
     * An id stays ignored if it was ignored before the fork, or if it was
     * ignored in the outcome of every sibling. The current sibling's outcome is
     * taken from the live state; siblings missing from the outcome list count
     * as aborted.
     *
     * @param preFork       state returned by {@link #beginBranch}
     * @param otherSiblings outcomes returned by {@link #prepareOtherBranch}
     * @param branchCount   number of siblings of this fork
     */
    public void endBranch(BranchState preFork, List<BranchState> otherSiblings, int branchCount) {
        List<BranchState> outcomes = new ArrayList<>(otherSiblings);
        outcomes.add(snapshot(currentBranchAborted));
        currentBranchAborted = false;

        pending = new LinkedHashMap<>(preFork.pending());
        openStack = new ArrayDeque<>(preFork.openStack());

        int completed = 0;
        Map<Integer, Integer> votes = new LinkedHashMap<>();
        for (BranchState outcome : outcomes) {
            if (outcome.aborted()) {
                continue;
            }
            completed++;
            for (Integer id : outcome.ignored()) {
                votes.merge(id, 1, Integer::sum);
            }
        }
        int quorum = abortedBranchPolicy == AbortedBranchPolicy.EXCLUDE ? completed : branchCount;

        Set<Integer> merged = new LinkedHashSet<>();
        if (quorum > 0) {
            votes.forEach((id, count) -> {
                if (count >= quorum) {
                    merged.add(id);
                }
            });
        }
        merged.addAll(preFork.ignored());
        ignored = merged;
    }

    private BranchState snapshot(boolean aborted) {
        return new BranchState(pending, new ArrayList<>(openStack), ignored, aborted);
    }

    // -----------------------------------------------------------------------
    // Unit-level annotations
    // -----------------------------------------------------------------------

    /** Records the last prover query that failed; a later successful query discards it. */
    public void setSmtQuery(Term query) {
        root.setLastFailedProverQuery(query);
    }

    public void discardSmtQuery() {
        root.setLastFailedProverQuery(null);
    }

    public void addMacro(Term macro, Term body) {
        macros.put(macro, body);
    }

    public Map<Term, Term> macros() {
        return Collections.unmodifiableMap(macros);
    }

    public void endMember() {
        root.markEnd(clock.getAsLong());
    }

    // -----------------------------------------------------------------------
    // Views for inspection
    // -----------------------------------------------------------------------

    Set<Integer> ignoredIds() {
        return Collections.unmodifiableSet(ignored);
    }

    Map<Integer, SymbolicRecord> pendingIds() {
        return Collections.unmodifiableMap(pending);
    }

    List<SymbolicRecord> openRecords() {
        return List.copyOf(openStack);
    }

    // -----------------------------------------------------------------------
    // Logging filter
    // -----------------------------------------------------------------------

    private static boolean isLogged(ProgramNode node) {
        return node == null || node.kind() != NodeKind.SEQUENCE;
    }

    /** Nodes with a dedicated record variant are not logged a second time through a plain step. */
    private static boolean isRecordedDifferently(SymbolicRecord record) {
        ProgramNode node = record.sourceNode();
        if (node == null) {
            return false;
        }
        RecordKind kind = record.kind();
        switch (node.kind()) {
            case METHOD_CALL:
                return kind != RecordKind.METHOD_CALL;
            case CONDITIONAL_EXPRESSION:
                return kind == RecordKind.EVALUATE || kind == RecordKind.CONSUME || kind == RecordKind.PRODUCE;
            case IMPLICATION:
                return kind == RecordKind.CONSUME || kind == RecordKind.PRODUCE;
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return "TraceBuilder[" + root + ", open=" + openStack.size() + ", pending=" + pending.size()
            + ", ignored=" + ignored.size() + "]";
    }

    /** Thrown when the insert/collapse calls of the executor do not nest. */
    public static class ProtocolViolationException extends IllegalStateException {
        public ProtocolViolationException(String message) { super(message); }
    }

    private static final class NoopTraceBuilder extends TraceBuilder {

        @Override public boolean isRecording()                                   { return false; }
        @Override public int insert(SymbolicRecord record)                       { return SENTINEL_ID; }
        @Override public void collapse(ProgramNode node, int id)                 { }
        @Override public BranchState beginBranch()                               { return BranchState.EMPTY; }
        @Override public BranchState prepareOtherBranch(BranchState preFork)     { return BranchState.EMPTY; }
        @Override public void markBranchAborted()                                { }
        @Override public void endBranch(BranchState preFork, List<BranchState> otherSiblings, int branchCount) { }
        @Override public void setSmtQuery(Term query)                            { }
        @Override public void discardSmtQuery()                                  { }
        @Override public void addMacro(Term macro, Term body)                    { }
        @Override public void endMember()                                        { }
        @Override public String toString()                                       { return "TraceBuilder[noop]"; }
    }
}

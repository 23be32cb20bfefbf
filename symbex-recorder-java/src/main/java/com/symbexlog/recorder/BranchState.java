package com.symbexlog.recorder;

import com.symbexlog.recorder.model.SymbolicRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Snapshot of a builder's branch bookkeeping: pending ids, open-record stack
 * (innermost first) and ignored ids. Taken before a fork and after each
 * explored sibling.
 */
public final class BranchState {

    static final BranchState EMPTY = new BranchState(Map.of(), List.of(), Set.of(), false);

    private final Map<Integer, SymbolicRecord> pending;
    private final List<SymbolicRecord> openStack;
    private final Set<Integer> ignored;
    private final boolean aborted;

    BranchState(Map<Integer, SymbolicRecord> pending, List<SymbolicRecord> openStack,
                Set<Integer> ignored, boolean aborted) {
        this.pending = Collections.unmodifiableMap(new LinkedHashMap<>(pending));
        this.openStack = Collections.unmodifiableList(new ArrayList<>(openStack));
        this.ignored = Collections.unmodifiableSet(new LinkedHashSet<>(ignored));
        this.aborted = aborted;
    }

    public Map<Integer, SymbolicRecord> pending() { return pending; }
    public List<SymbolicRecord> openStack()       { return openStack; }
    public Set<Integer> ignored()                 { return ignored; }

    /** True if the sibling this outcome belongs to was abandoned before it finished. */
    public boolean aborted()                      { return aborted; }
}

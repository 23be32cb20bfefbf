package com.symbexlog.recorder;

import java.util.Locale;

/**
 * How a sibling branch that aborted before its outcome was captured (e.g. a
 * prover timeout) takes part in the ignored-id merge after a fork.
 */
public enum AbortedBranchPolicy {

    /**
     * The quorum stays at the branch count and an aborted sibling contributes
     * no votes, so no id becomes permanently ignored across that fork.
     */
    STRICT,

    /** Aborted siblings are left out; the quorum is the number of completed siblings. */
    EXCLUDE;

    public static AbortedBranchPolicy parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

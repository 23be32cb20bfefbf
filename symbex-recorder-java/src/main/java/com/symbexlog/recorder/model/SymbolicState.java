package com.symbexlog.recorder.model;

import java.util.List;
import java.util.Map;

/**
 * Snapshot handle of the executor's symbolic state at the time a record was created.
 *
 * The executor keeps the snapshot valid while traces are formatted; the recorder
 * only reads it from the renderers.
 */
public interface SymbolicState {

    /** Local variable name to symbolic value, in declaration order. */
    Map<String, String> store();

    /** Heap chunks, each in display form. */
    List<String> heap();
}

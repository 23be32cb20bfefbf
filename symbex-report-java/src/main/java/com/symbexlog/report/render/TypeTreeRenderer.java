package com.symbexlog.report.render;

import com.symbexlog.recorder.model.SymbolicRecord;

/**
 * Indented dump with only the type tag of every record. Independent of state
 * formatting and timing, so it is what regression baselines store.
 */
public class TypeTreeRenderer extends IndentedTreeRenderer {

    @Override
    protected String label(SymbolicRecord record) {
        return record.toTypeString();
    }
}

package com.symbexlog.report.render;

import com.symbexlog.recorder.model.SymbolicRecord;

/** Indented dump with the display line of every record, for interactive debugging. */
public class SimpleTreeRenderer extends IndentedTreeRenderer {

    @Override
    protected String label(SymbolicRecord record) {
        return record.toString();
    }
}

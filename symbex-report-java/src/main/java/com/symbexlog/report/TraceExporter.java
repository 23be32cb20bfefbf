package com.symbexlog.report;

import com.symbexlog.recorder.TraceSession;
import com.symbexlog.report.graph.GenericNode;
import com.symbexlog.report.graph.GenericNodeRenderer;
import com.symbexlog.report.render.SimpleTreeRenderer;
import com.symbexlog.report.render.TypeTreeRenderer;

/**
 * Read side of a {@link TraceSession}: the text dumps and the generic-node
 * graph of all recorded units.
 */
public class TraceExporter {

    private final TraceSession session;

    public TraceExporter(TraceSession session) {
        this.session = session;
    }

    /** Indented trees of all units, or the empty string while recording is disabled. */
    public String toSimpleTreeString() {
        if (!session.isEnabled()) {
            return "";
        }
        return new SimpleTreeRenderer().render(session.units());
    }

    /** Structure-only trees of all units, or the empty string while recording is disabled. */
    public String toTypeTreeString() {
        if (!session.isEnabled()) {
            return "";
        }
        return new TypeTreeRenderer().render(session.units());
    }

    public GenericNode convertUnits() {
        return new GenericNodeRenderer().render(session.units());
    }
}

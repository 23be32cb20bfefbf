package com.symbexlog.report;

import com.symbexlog.recorder.TraceConfig;
import com.symbexlog.recorder.TraceSession;
import com.symbexlog.report.graph.GenericNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TraceExporterTest {

    private final TraceFixtures fixtures = new TraceFixtures();

    @Test
    void disabledSessionExportsNothing() {
        TraceSession session = TraceSession.newSession();
        session.recordUnit(fixtures.simpleUnit());

        TraceExporter exporter = new TraceExporter(session);
        assertEquals("", exporter.toSimpleTreeString());
        assertEquals("", exporter.toTypeTreeString());
    }

    @Test
    void enabledSessionExportsAllUnits() {
        TraceSession session = TraceSession.newSession(TraceConfig.defaults().withEnabled(true));
        session.recordUnit(fixtures.simpleUnit());

        TraceExporter exporter = new TraceExporter(session);
        assertEquals("method M\n  execute E1\n  execute E2\n    evaluate V1\n\n", exporter.toSimpleTreeString());
        assertEquals("method\n  execute\n  execute\n    evaluate\n\n", exporter.toTypeTreeString());
    }

    @Test
    void convertUnitsHangsEveryUnitBelowMembers() {
        TraceSession session = TraceSession.newSession(TraceConfig.defaults().withEnabled(true));
        session.recordUnit(fixtures.simpleUnit());
        session.recordUnit(fixtures.simpleUnit());

        GenericNode members = new TraceExporter(session).convertUnits();
        assertEquals("Members", members.label());
        assertEquals(2, members.children().size());
        assertEquals(1, members.startTimeMs());
        assertEquals(16, members.endTimeMs());
    }
}

package com.symbexlog.report.render;

import com.symbexlog.recorder.TraceBuilder;
import com.symbexlog.recorder.model.CfgBranchRecord;
import com.symbexlog.recorder.model.ConditionalEdgeRecord;
import com.symbexlog.recorder.model.DeciderAssumeRecord;
import com.symbexlog.recorder.model.MethodCallRecord;
import com.symbexlog.recorder.model.NodeKind;
import com.symbexlog.recorder.model.ProgramNode;
import com.symbexlog.recorder.model.StepRecord;
import com.symbexlog.recorder.model.TwoBranchRecord;
import com.symbexlog.recorder.model.UnconditionalEdgeRecord;
import com.symbexlog.report.TraceFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.symbexlog.report.TraceFixtures.exp;
import static com.symbexlog.report.TraceFixtures.step;
import static com.symbexlog.report.TraceFixtures.stmt;
import static org.junit.jupiter.api.Assertions.*;

class SimpleTreeRendererTest {

    private final TraceFixtures fixtures = new TraceFixtures();
    private final SimpleTreeRenderer renderer = new SimpleTreeRenderer();

    @Test
    void nestedSteps() {
        assertEquals("method M\n  execute E1\n  execute E2\n    evaluate V1\n\n",
            renderer.render(List.of(fixtures.simpleUnit())));
    }

    @Test
    void unitsAreSeparatedByABlankLine() {
        String out = renderer.render(List.of(fixtures.simpleUnit(), fixtures.simpleUnit()));
        assertEquals("method M\n  execute E1\n  execute E2\n    evaluate V1\n\n"
            + "method M\n  execute E1\n  execute E2\n    evaluate V1\n\n", out);
    }

    @Test
    void localBranchShowsConditionAndBothBranches() {
        String expected = """
            method M
              LocalBranch:
                evaluate x > 0
              Branch 1:
                execute y := 1
              Branch 2:
                execute y := 2
            """;
        assertEquals(expected, renderer.renderMember(fixtures.localBranchUnit()));
    }

    @Test
    void unexploredBranchShowsPlaceholder() {
        TraceBuilder builder = fixtures.newUnit("M", null);
        TwoBranchRecord branch = TwoBranchRecord.global(exp("b"), null, Set.of(), "Branch");
        int id = builder.insert(branch);
        step(builder, StepRecord.evaluate(exp("b"), null, Set.of()));
        branch.finishCondition(fixtures.tick());
        builder.collapse(exp("b"), id);

        String expected = """
            method M
              GlobalBranch:
                evaluate b
              Branch 1:
                comment: Unreachable
              Branch 2:
                comment: Unreachable
            """;
        assertEquals(expected, renderer.renderMember(builder));
    }

    @Test
    void deciderAssumptionsAreLeftOut() {
        TraceBuilder builder = fixtures.newUnit("M", null);
        step(builder, new DeciderAssumeRecord(Set.of(() -> "x > 0")));
        step(builder, StepRecord.execute(stmt("s"), null, Set.of()));

        assertEquals("method M\n  execute s\n", renderer.renderMember(builder));
    }

    @Test
    void edgesAndSingleSuccessorCfgBranchesAreFlattened() {
        TraceBuilder builder = fixtures.newUnit("M", null);
        CfgBranchRecord cfg = new CfgBranchRecord(List.of(exp("b")), null, Set.of(), "Branch");
        int cfgId = builder.insert(cfg);
        ConditionalEdgeRecord edge = new ConditionalEdgeRecord(exp("b"), null, Set.of(), "Edge");
        int edgeId = builder.insert(edge);
        step(builder, StepRecord.evaluate(exp("b"), null, Set.of()));
        edge.finishCondition(fixtures.tick());
        step(builder, StepRecord.execute(stmt("s1"), null, Set.of()));
        step(builder, StepRecord.execute(stmt("s2"), null, Set.of()));
        edge.finishThen(fixtures.tick());
        builder.collapse(exp("b"), edgeId);
        cfg.finishBranch();
        builder.collapse(null, cfgId);

        assertEquals("method M\n  evaluate b\n  execute s1\n  execute s2\n", renderer.renderMember(builder));
    }

    @Test
    void cfgBranchWithSeveralSuccessorsNumbersThem() {
        TraceBuilder builder = fixtures.newUnit("M", null);
        CfgBranchRecord cfg = new CfgBranchRecord(List.of(exp("b"), exp("!b")), null, Set.of(), "Branch");
        int cfgId = builder.insert(cfg);
        UnconditionalEdgeRecord first = new UnconditionalEdgeRecord(null, Set.of(), "Edge");
        int firstId = builder.insert(first);
        step(builder, StepRecord.execute(stmt("s1"), null, Set.of()));
        builder.collapse(null, firstId);
        cfg.finishBranch();
        UnconditionalEdgeRecord second = new UnconditionalEdgeRecord(null, Set.of(), "Edge");
        int secondId = builder.insert(second);
        step(builder, StepRecord.execute(stmt("s2"), null, Set.of()));
        builder.collapse(null, secondId);
        cfg.finishBranch();
        builder.collapse(null, cfgId);

        String expected = """
            method M
              Branch 1:
                execute s1
              Branch 2:
                execute s2
            """;
        assertEquals(expected, renderer.renderMember(builder));
    }

    @Test
    void emptyEdgeIsFiltered() {
        TraceBuilder builder = fixtures.newUnit("M", null);
        step(builder, new UnconditionalEdgeRecord(null, Set.of(), "Edge"));
        assertTrue(renderer.isFiltered(builder.root().children().get(0)));
        assertEquals("method M\n", renderer.renderMember(builder));
    }

    @Test
    void methodCallListsItsSlots() {
        TraceBuilder builder = fixtures.newUnit("M", null);
        MethodCallRecord call = new MethodCallRecord(ProgramNode.of(NodeKind.METHOD_CALL, "x := m(y)"), null, Set.of());
        int id = builder.insert(call);
        step(builder, StepRecord.evaluate(exp("y"), null, Set.of()));
        call.finishParameters();
        step(builder, StepRecord.consume(exp("y > 0"), null, Set.of()));
        call.finishPrecondition();
        step(builder, StepRecord.produce(exp("x > 0"), null, Set.of()));
        call.finishPostcondition();
        builder.collapse(call.sourceNode(), id);

        String expected = """
            method M
              execute: x := m(y)
                precondition: consume y > 0
                postcondition: produce x > 0
                parameter: evaluate y
            """;
        assertEquals(expected, renderer.renderMember(builder));
    }
}

package com.symbexlog.recorder;

import com.symbexlog.recorder.model.ConditionalEdgeRecord;
import com.symbexlog.recorder.model.MethodCallRecord;
import com.symbexlog.recorder.model.NodeKind;
import com.symbexlog.recorder.model.ProgramNode;
import com.symbexlog.recorder.model.StepRecord;
import com.symbexlog.recorder.model.SymbolicRecord;
import com.symbexlog.recorder.model.Term;
import com.symbexlog.recorder.model.TwoBranchRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TraceBuilderTest {

    private long now;
    private TraceBuilder builder;

    @BeforeEach
    void setUp() {
        now = 0;
        builder = newBuilder(AbortedBranchPolicy.STRICT);
    }

    private TraceBuilder newBuilder(AbortedBranchPolicy policy) {
        return new TraceBuilder(ProgramNode.member(NodeKind.METHOD, "M"), null, Set.of(), () -> ++now, policy);
    }

    private static ProgramNode stmt(String text) {
        return ProgramNode.of(NodeKind.STATEMENT, text);
    }

    private static ProgramNode exp(String text) {
        return ProgramNode.of(NodeKind.EXPRESSION, text);
    }

    // --- Insert / collapse ---

    @Test
    void nestedStepsBecomeChildrenOfTheOpenRecord() {
        ProgramNode e1 = stmt("E1");
        ProgramNode e2 = stmt("E2");
        ProgramNode v1 = exp("V1");

        int id1 = builder.insert(StepRecord.execute(e1, null, Set.of()));
        builder.collapse(e1, id1);
        int id2 = builder.insert(StepRecord.execute(e2, null, Set.of()));
        int id3 = builder.insert(StepRecord.evaluate(v1, null, Set.of()));
        builder.collapse(v1, id3);
        builder.collapse(e2, id2);

        List<SymbolicRecord> children = builder.root().children();
        assertEquals(2, children.size());
        assertEquals("execute E1", children.get(0).toString());
        assertEquals("execute E2", children.get(1).toString());
        assertEquals(1, children.get(1).children().size());
        assertEquals("evaluate V1", children.get(1).children().get(0).toString());

        assertEquals(List.of(builder.root()), builder.openRecords());
        assertTrue(builder.pendingIds().isEmpty());
        assertTrue(builder.ignoredIds().isEmpty());
    }

    @Test
    void idsAreIssuedInIncreasingOrder() {
        int first = builder.insert(StepRecord.execute(stmt("a"), null, Set.of()));
        int second = builder.insert(StepRecord.execute(stmt("b"), null, Set.of()));
        assertTrue(first >= 1);
        assertTrue(second > first);
    }

    @Test
    void collapsedRecordsHaveStartAndEndTimes() {
        ProgramNode e1 = stmt("E1");
        int id = builder.insert(StepRecord.execute(e1, null, Set.of()));
        builder.collapse(e1, id);

        SymbolicRecord record = builder.root().children().get(0);
        assertTrue(record.startTimeMs() > 0);
        assertTrue(record.endTimeMs() >= record.startTimeMs());
        assertTrue(builder.root().startTimeMs() > 0);
    }

    @Test
    void secondCollapseOfTheSameIdIsDeferredNotApplied() {
        ProgramNode e1 = stmt("E1");
        int id = builder.insert(StepRecord.execute(e1, null, Set.of()));
        builder.collapse(e1, id);
        long end = builder.root().children().get(0).endTimeMs();

        assertDoesNotThrow(() -> builder.collapse(e1, id));
        assertEquals(List.of(builder.root()), builder.openRecords());
        assertTrue(builder.ignoredIds().contains(id));
        assertEquals(end, builder.root().children().get(0).endTimeMs());
    }

    @Test
    void phaseFinishesWithoutTimestampUseTheBuilderClock() {
        TwoBranchRecord branch = TwoBranchRecord.local(exp("c"), null, Set.of(), "Branch");
        int id = builder.insert(branch);
        assertEquals(2, branch.startTimeMs());

        branch.finishCondition();
        branch.finishThen();
        branch.finishElse();
        assertEquals(3, branch.condEndTimeMs());
        assertEquals(4, branch.thenEndTimeMs());
        assertEquals(5, branch.elseEndTimeMs());

        builder.collapse(exp("c"), id);
        assertEquals(6, branch.endTimeMs());

        ConditionalEdgeRecord edge = new ConditionalEdgeRecord(exp("d"), null, Set.of(), "Branch");
        builder.insert(edge);
        edge.finishCondition();
        assertEquals(8, edge.condEndTimeMs());
    }

    @Test
    void collapseOfSentinelDoesNothing() {
        builder.collapse(null, TraceBuilder.SENTINEL_ID);
        assertTrue(builder.ignoredIds().isEmpty());
        assertEquals(List.of(builder.root()), builder.openRecords());
    }

    @Test
    void collapseOutOfOrderThrows() {
        ProgramNode e1 = stmt("E1");
        int id1 = builder.insert(StepRecord.execute(e1, null, Set.of()));
        builder.insert(StepRecord.execute(stmt("E2"), null, Set.of()));

        assertThrows(TraceBuilder.ProtocolViolationException.class, () -> builder.collapse(e1, id1));
    }

    // --- Logging filter ---

    @Test
    void sequenceStatementsAreNotLogged() {
        int id = builder.insert(StepRecord.execute(ProgramNode.of(NodeKind.SEQUENCE, "{ a; b }"), null, Set.of()));
        assertEquals(TraceBuilder.SENTINEL_ID, id);
        assertTrue(builder.root().children().isEmpty());
    }

    @Test
    void methodCallsAreOnlyLoggedThroughMethodCallRecords() {
        ProgramNode call = ProgramNode.of(NodeKind.METHOD_CALL, "x := m(y)");
        assertEquals(TraceBuilder.SENTINEL_ID, builder.insert(StepRecord.execute(call, null, Set.of())));

        int id = builder.insert(new MethodCallRecord(call, null, Set.of()));
        assertNotEquals(TraceBuilder.SENTINEL_ID, id);
        assertEquals(1, builder.root().children().size());
    }

    @Test
    void conditionalExpressionsAreNotLoggedAsEvaluateProduceOrConsume() {
        ProgramNode cond = ProgramNode.of(NodeKind.CONDITIONAL_EXPRESSION, "b ? x : y");
        assertEquals(TraceBuilder.SENTINEL_ID, builder.insert(StepRecord.evaluate(cond, null, Set.of())));
        assertEquals(TraceBuilder.SENTINEL_ID, builder.insert(StepRecord.produce(cond, null, Set.of())));
        assertEquals(TraceBuilder.SENTINEL_ID, builder.insert(StepRecord.consume(cond, null, Set.of())));
        assertTrue(builder.root().children().isEmpty());
    }

    @Test
    void implicationsAreOnlyFilteredForProduceAndConsume() {
        ProgramNode impl = ProgramNode.of(NodeKind.IMPLICATION, "b ==> acc(x.f)");
        assertEquals(TraceBuilder.SENTINEL_ID, builder.insert(StepRecord.produce(impl, null, Set.of())));
        assertEquals(TraceBuilder.SENTINEL_ID, builder.insert(StepRecord.consume(impl, null, Set.of())));
        assertNotEquals(TraceBuilder.SENTINEL_ID, builder.insert(StepRecord.evaluate(impl, null, Set.of())));
    }

    // --- Branching ---

    @Test
    void closeAgreedByAllSiblingsIsReplayedOnceTheRecordIsOnTopAgain() {
        ProgramNode outer = stmt("O");
        int outerId = builder.insert(StepRecord.execute(outer, null, Set.of()));

        BranchState preFork = builder.beginBranch();
        assertTrue(builder.pendingIds().isEmpty());
        builder.collapse(outer, outerId);
        BranchState first = builder.prepareOtherBranch(preFork);
        builder.collapse(outer, outerId);
        builder.endBranch(preFork, List.of(first), 2);

        assertTrue(builder.ignoredIds().contains(outerId));
        assertTrue(builder.pendingIds().containsKey(outerId));
        SymbolicRecord outerRecord = builder.root().children().get(0);
        assertEquals(outerRecord, builder.currentRecord());

        ProgramNode inner = stmt("X");
        int innerId = builder.insert(StepRecord.execute(inner, null, Set.of()));
        builder.collapse(inner, innerId);

        assertEquals(List.of(builder.root()), builder.openRecords());
        assertFalse(builder.pendingIds().containsKey(outerId));
        assertTrue(outerRecord.endTimeMs() > 0);
    }

    @Test
    void prepareOtherBranchRestoresThePreForkStack() {
        int outerId = builder.insert(StepRecord.execute(stmt("O"), null, Set.of()));
        BranchState preFork = builder.beginBranch();
        builder.insert(StepRecord.execute(stmt("inside first"), null, Set.of()));
        assertEquals(3, builder.openRecords().size());

        BranchState outcome = builder.prepareOtherBranch(preFork);

        assertEquals(preFork.openStack(), builder.openRecords());
        assertEquals(1, outcome.pending().size());
        assertTrue(builder.pendingIds().isEmpty());
        assertTrue(preFork.pending().containsKey(outerId));
    }

    @Test
    void idIsIgnoredOnlyIfEverySiblingIgnoredIt() {
        BranchState preFork = builder.beginBranch();
        builder.collapse(null, 7);
        builder.collapse(null, 9);
        BranchState first = builder.prepareOtherBranch(preFork);
        builder.collapse(null, 9);
        BranchState second = builder.prepareOtherBranch(preFork);
        builder.collapse(null, 7);
        builder.collapse(null, 9);
        builder.endBranch(preFork, List.of(first, second), 3);

        assertEquals(Set.of(9), builder.ignoredIds());
    }

    @Test
    void closeSeenByOnlyOneOfTwoSiblingsIsNotReplayed() {
        ProgramNode outer = stmt("R");
        int outerId = builder.insert(StepRecord.execute(outer, null, Set.of()));
        SymbolicRecord outerRecord = builder.currentRecord();

        BranchState preFork = builder.beginBranch();
        builder.collapse(outer, outerId);
        BranchState first = builder.prepareOtherBranch(preFork);
        builder.endBranch(preFork, List.of(first), 2);

        assertFalse(builder.ignoredIds().contains(outerId));
        assertEquals(outerRecord, builder.currentRecord());
        assertEquals(0, outerRecord.endTimeMs());

        builder.collapse(outer, outerId);

        assertEquals(List.of(builder.root()), builder.openRecords());
        assertFalse(builder.pendingIds().containsKey(outerId));
        assertTrue(outerRecord.endTimeMs() > 0);
    }

    @Test
    void ignoredIdsFromBeforeTheForkSurviveTheMerge() {
        builder.collapse(null, 42);
        BranchState preFork = builder.beginBranch();
        assertTrue(builder.ignoredIds().isEmpty());
        BranchState first = builder.prepareOtherBranch(preFork);
        builder.endBranch(preFork, List.of(first), 2);

        assertEquals(Set.of(42), builder.ignoredIds());
    }

    @Test
    void strictPolicyIgnoresNothingNewAfterAnAbortedSibling() {
        BranchState preFork = builder.beginBranch();
        builder.collapse(null, 5);
        BranchState first = builder.prepareOtherBranch(preFork);
        builder.collapse(null, 5);
        builder.markBranchAborted();
        builder.endBranch(preFork, List.of(first), 2);

        assertTrue(builder.ignoredIds().isEmpty());
    }

    @Test
    void excludePolicyMergesOverCompletedSiblingsOnly() {
        TraceBuilder exclude = newBuilder(AbortedBranchPolicy.EXCLUDE);
        BranchState preFork = exclude.beginBranch();
        exclude.collapse(null, 5);
        exclude.markBranchAborted();
        BranchState first = exclude.prepareOtherBranch(preFork);
        assertTrue(first.aborted());
        exclude.collapse(null, 5);
        exclude.collapse(null, 6);
        exclude.endBranch(preFork, List.of(first), 2);

        assertEquals(Set.of(5, 6), exclude.ignoredIds());
    }

    @Test
    void missingSiblingOutcomesCountAsAborted() {
        BranchState preFork = builder.beginBranch();
        builder.collapse(null, 5);
        builder.endBranch(preFork, List.of(), 2);
        assertTrue(builder.ignoredIds().isEmpty());

        TraceBuilder exclude = newBuilder(AbortedBranchPolicy.EXCLUDE);
        BranchState excludePreFork = exclude.beginBranch();
        exclude.collapse(null, 5);
        exclude.endBranch(excludePreFork, List.of(), 2);
        assertEquals(Set.of(5), exclude.ignoredIds());
    }

    @Test
    void excludePolicyWithEveryBranchAbortedIgnoresNothingNew() {
        TraceBuilder exclude = newBuilder(AbortedBranchPolicy.EXCLUDE);
        BranchState preFork = exclude.beginBranch();
        exclude.collapse(null, 5);
        exclude.markBranchAborted();
        exclude.endBranch(preFork, List.of(), 1);

        assertTrue(exclude.ignoredIds().isEmpty());
    }

    // --- Unit-level annotations ---

    @Test
    void failedProverQueryIsKeptUntilDiscarded() {
        Term query = () -> "x > 0";
        builder.setSmtQuery(query);
        assertSame(query, builder.root().lastFailedProverQuery());
        builder.discardSmtQuery();
        assertNull(builder.root().lastFailedProverQuery());
    }

    @Test
    void endMemberStampsTheRoot() {
        assertEquals(0, builder.root().endTimeMs());
        builder.endMember();
        assertTrue(builder.root().endTimeMs() > 0);
    }

    @Test
    void macrosKeepInsertionOrder() {
        Term m1 = () -> "m1";
        Term m2 = () -> "m2";
        Term body = () -> "true";
        builder.addMacro(m1, body);
        builder.addMacro(m2, body);
        assertEquals(List.of(m1, m2), List.copyOf(builder.macros().keySet()));
    }

    @Test
    void noopBuilderAcceptsEverythingAndRecordsNothing() {
        TraceBuilder noop = TraceBuilder.noop();
        assertFalse(noop.isRecording());
        assertEquals(TraceBuilder.SENTINEL_ID, noop.insert(StepRecord.execute(stmt("s"), null, Set.of())));
        assertDoesNotThrow(() -> {
            noop.collapse(stmt("s"), 3);
            BranchState preFork = noop.beginBranch();
            noop.endBranch(preFork, List.of(noop.prepareOtherBranch(preFork)), 2);
            noop.endMember();
        });
        assertNull(noop.root());
    }
}

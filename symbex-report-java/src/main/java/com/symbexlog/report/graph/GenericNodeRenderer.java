package com.symbexlog.report.graph;

import com.symbexlog.recorder.TraceBuilder;
import com.symbexlog.recorder.model.AssertionQueryRecord;
import com.symbexlog.recorder.model.CfgBranchRecord;
import com.symbexlog.recorder.model.ConditionalEdgeRecord;
import com.symbexlog.recorder.model.MemberRecord;
import com.symbexlog.recorder.model.RecordKind;
import com.symbexlog.recorder.model.SymbolicRecord;
import com.symbexlog.recorder.model.TwoBranchRecord;
import com.symbexlog.report.render.Renderer;

import java.util.List;

/**
 * Reinterprets unit traces as a control-flow graph of {@link GenericNode}s.
 *
 * A branching record keeps its condition as a child and gets one successor per
 * continuation, timed by the record's phase timestamps. Local branches join
 * again in a synthetic {@code Join Point} successor of both continuations. The
 * branching node itself ends when its condition has been decided. All units
 * hang below a {@code Members} node spanning their combined time.
 */
public class GenericNodeRenderer implements Renderer<TraceBuilder, GenericNode> {

    @Override
    public GenericNode render(List<TraceBuilder> members) {
        GenericNode node = new GenericNode("Members");
        long startTimeMs = 0;
        long endTimeMs = 0;
        for (TraceBuilder member : members) {
            node.children().add(renderMember(member));
            MemberRecord root = member.root();
            if (startTimeMs == 0 || root.startTimeMs() < startTimeMs) {
                startTimeMs = root.startTimeMs();
            }
            endTimeMs = Math.max(endTimeMs, root.endTimeMs());
        }
        node.setStartTimeMs(startTimeMs);
        node.setEndTimeMs(endTimeMs);
        return node;
    }

    @Override
    public GenericNode renderMember(TraceBuilder member) {
        return renderRecord(member.root());
    }

    public GenericNode renderRecord(SymbolicRecord record) {
        GenericNode node = new GenericNode(record.toString());
        node.setStartTimeMs(record.startTimeMs());
        node.setEndTimeMs(record.endTimeMs());
        if (record.kind() == RecordKind.PROVER_ASSERT) {
            node.setSmtQuery(((AssertionQueryRecord) record).isSmtQuery());
        }

        switch (record.kind()) {
            case CFG_BRANCH: {
                for (List<SymbolicRecord> branch : ((CfgBranchRecord) record).branches()) {
                    if (branch.size() != 1) {
                        throw new IllegalStateException("CFG branch successor must consist of exactly one edge record, found "
                            + branch.size() + " in " + record);
                    }
                    node.successors().add(renderRecord(branch.get(0)));
                }
                node.setSyntactic(true);
                // ends when the first successor starts
                for (GenericNode successor : node.successors()) {
                    if (successor.startTimeMs() < node.endTimeMs()) {
                        node.setEndTimeMs(successor.startTimeMs());
                    }
                }
                break;
            }
            case CONDITIONAL_EDGE: {
                ConditionalEdgeRecord edge = (ConditionalEdgeRecord) record;
                node.children().add(renderRecord(edge.condition()));
                node.setEndTimeMs(edge.condEndTimeMs());
                node.successors().add(renderBranch(edge.thenChildren(), edge.condEndTimeMs(), edge.thenEndTimeMs()));
                break;
            }
            case UNCONDITIONAL_EDGE:
                node.setSyntactic(true);
                renderChildren(node, record.children());
                break;
            case GLOBAL_BRANCH: {
                TwoBranchRecord branch = (TwoBranchRecord) record;
                node.children().add(renderRecord(branch.condition()));
                node.setEndTimeMs(branch.condEndTimeMs());
                node.successors().add(renderBranch(branch.thenChildren(), branch.condEndTimeMs(), branch.thenEndTimeMs()));
                node.successors().add(renderBranch(branch.elseChildren(), branch.thenEndTimeMs(), branch.elseEndTimeMs()));
                break;
            }
            case LOCAL_BRANCH: {
                TwoBranchRecord branch = (TwoBranchRecord) record;
                node.children().add(renderRecord(branch.condition()));
                node.setEndTimeMs(branch.condEndTimeMs());
                GenericNode thenNode = renderBranch(branch.thenChildren(), branch.condEndTimeMs(), branch.thenEndTimeMs());
                GenericNode elseNode = renderBranch(branch.elseChildren(), branch.thenEndTimeMs(), branch.elseEndTimeMs());
                node.successors().add(thenNode);
                node.successors().add(elseNode);

                GenericNode join = new GenericNode("Join Point");
                join.setStartTimeMs(Math.max(branch.thenEndTimeMs(), branch.elseEndTimeMs()));
                join.setEndTimeMs(branch.endTimeMs());
                thenNode.successors().add(join);
                elseNode.successors().add(join);
                break;
            }
            default:
                renderChildren(node, record.children());
        }
        return node;
    }

    private GenericNode renderBranch(List<SymbolicRecord> records, long startTimeMs, long endTimeMs) {
        GenericNode branch = new GenericNode("Branch");
        branch.setStartTimeMs(startTimeMs);
        branch.setEndTimeMs(endTimeMs);
        branch.setSyntactic(true);
        renderChildren(branch, records);
        return branch;
    }

    private void renderChildren(GenericNode node, List<SymbolicRecord> records) {
        for (SymbolicRecord record : records) {
            node.children().add(renderRecord(record));
        }
    }
}

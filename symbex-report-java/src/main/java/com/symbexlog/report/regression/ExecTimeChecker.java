package com.symbexlog.report.regression;

import com.symbexlog.recorder.TraceBuilder;
import com.symbexlog.recorder.model.CfgBranchRecord;
import com.symbexlog.recorder.model.CommentRecord;
import com.symbexlog.recorder.model.ConditionalEdgeRecord;
import com.symbexlog.recorder.model.MethodCallRecord;
import com.symbexlog.recorder.model.RecordKind;
import com.symbexlog.recorder.model.SymbolicRecord;
import com.symbexlog.recorder.model.TwoBranchRecord;
import com.symbexlog.report.render.Renderer;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Checks that every reachable record has a start and an end time.
 * Placeholders of unexplored branches are exempt.
 *
 * The result is one {@code incomplete exec timing: <record>} line per
 * offending record; the empty string means the traces are complete.
 */
public class ExecTimeChecker implements Renderer<TraceBuilder, String> {

    @Override
    public String render(List<TraceBuilder> members) {
        return members.stream()
            .map(this::renderMember)
            .filter(check -> !check.isEmpty())
            .collect(Collectors.joining("\n"));
    }

    @Override
    public String renderMember(TraceBuilder member) {
        return String.join("\n", checkRecord(member.root()));
    }

    List<String> checkRecord(SymbolicRecord record) {
        List<String> problems = new ArrayList<>();
        for (SymbolicRecord sub : reachable(record)) {
            problems.addAll(checkRecord(sub));
        }
        boolean placeholder = record.kind() == RecordKind.COMMENT
            && ((CommentRecord) record).isUnreachablePlaceholder();
        if (!placeholder && (record.startTimeMs() == 0 || record.endTimeMs() == 0)) {
            problems.add("incomplete exec timing: " + record);
        }
        return problems;
    }

    /** Records directly below {@code record}: its children plus the variant's named slots. */
    static List<SymbolicRecord> reachable(SymbolicRecord record) {
        List<SymbolicRecord> subs = new ArrayList<>(record.children());
        switch (record.kind()) {
            case CONDITIONAL_EDGE: {
                ConditionalEdgeRecord edge = (ConditionalEdgeRecord) record;
                subs.add(edge.condition());
                subs.addAll(edge.thenChildren());
                break;
            }
            case GLOBAL_BRANCH:
            case LOCAL_BRANCH: {
                TwoBranchRecord branch = (TwoBranchRecord) record;
                subs.add(branch.condition());
                subs.addAll(branch.thenChildren());
                subs.addAll(branch.elseChildren());
                break;
            }
            case METHOD_CALL: {
                MethodCallRecord call = (MethodCallRecord) record;
                subs.add(call.precondition());
                subs.add(call.postcondition());
                subs.addAll(call.parameters());
                break;
            }
            case CFG_BRANCH:
                ((CfgBranchRecord) record).branches().forEach(subs::addAll);
                break;
            default:
                break;
        }
        return subs;
    }
}

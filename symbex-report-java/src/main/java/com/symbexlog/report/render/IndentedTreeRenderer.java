package com.symbexlog.report.render;

import com.symbexlog.recorder.TraceBuilder;
import com.symbexlog.recorder.model.CfgBranchRecord;
import com.symbexlog.recorder.model.ConditionalEdgeRecord;
import com.symbexlog.recorder.model.MethodCallRecord;
import com.symbexlog.recorder.model.SymbolicRecord;
import com.symbexlog.recorder.model.TwoBranchRecord;

import java.util.List;

/**
 * Depth-first, two-spaces-per-level text dump of unit traces.
 *
 * Control-flow edge records and single-successor CFG branches carry no
 * information of their own and are flattened into their parent's level.
 * Decider assumptions are left out. Subclasses choose what a record's line says.
 */
public abstract class IndentedTreeRenderer implements Renderer<TraceBuilder, String> {

    /** Text of the line that represents {@code record}. */
    protected abstract String label(SymbolicRecord record);

    @Override
    public String render(List<TraceBuilder> members) {
        StringBuilder sb = new StringBuilder();
        for (TraceBuilder member : members) {
            sb.append(renderMember(member)).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String renderMember(TraceBuilder member) {
        return renderRecord(member.root(), 1);
    }

    /** True for records that are left out of the dump entirely. */
    public boolean isFiltered(SymbolicRecord record) {
        switch (record.kind()) {
            case CFG_BRANCH: {
                List<List<SymbolicRecord>> branches = ((CfgBranchRecord) record).branches();
                return branches.size() <= 1 && allFiltered(branches.isEmpty() ? List.of() : branches.get(0));
            }
            case UNCONDITIONAL_EDGE:
                return allFiltered(record.children());
            case CONDITIONAL_EDGE: {
                ConditionalEdgeRecord edge = (ConditionalEdgeRecord) record;
                return isFiltered(edge.condition()) && allFiltered(edge.thenChildren());
            }
            case DECIDER_ASSUME:
                return true;
            default:
                return false;
        }
    }

    private boolean allFiltered(List<SymbolicRecord> records) {
        return records.stream().allMatch(this::isFiltered);
    }

    /**
     * Renders {@code record} at depth {@code depth}. The first line carries no
     * indentation (the caller has written it); nested lines are indented.
     */
    protected String renderRecord(SymbolicRecord record, int depth) {
        String indent = "  ".repeat(depth);
        String outer = indent.substring(2);
        StringBuilder sb = new StringBuilder();

        switch (record.kind()) {
            case CFG_BRANCH: {
                List<List<SymbolicRecord>> branches = ((CfgBranchRecord) record).branches();
                if (branches.size() == 1) {
                    appendFlattened(sb, branches.get(0), depth, outer, 0);
                } else {
                    for (int i = 0; i < branches.size(); i++) {
                        sb.append(i != 0 ? outer : "").append("Branch ").append(i + 1).append(":\n");
                        appendNested(sb, branches.get(i), depth, indent);
                    }
                }
                break;
            }
            case CONDITIONAL_EDGE: {
                ConditionalEdgeRecord edge = (ConditionalEdgeRecord) record;
                int emitted = 0;
                if (!isFiltered(edge.condition())) {
                    sb.append(renderRecord(edge.condition(), depth));
                    emitted++;
                }
                appendFlattened(sb, edge.thenChildren(), depth, outer, emitted);
                break;
            }
            case UNCONDITIONAL_EDGE:
                appendFlattened(sb, record.children(), depth, outer, 0);
                break;
            case GLOBAL_BRANCH:
            case LOCAL_BRANCH: {
                TwoBranchRecord branch = (TwoBranchRecord) record;
                sb.append(record.toTypeString()).append(":\n");
                if (!isFiltered(branch.condition())) {
                    sb.append(indent).append(renderRecord(branch.condition(), depth + 1));
                }
                sb.append(outer).append("Branch 1:\n");
                appendNested(sb, branch.thenChildren(), depth, indent);
                sb.append(outer).append("Branch 2:\n");
                appendNested(sb, branch.elseChildren(), depth, indent);
                break;
            }
            case METHOD_CALL: {
                MethodCallRecord call = (MethodCallRecord) record;
                sb.append(label(call)).append('\n');
                if (!isFiltered(call.precondition())) {
                    sb.append(indent).append("precondition: ").append(renderRecord(call.precondition(), depth + 1));
                }
                if (!isFiltered(call.postcondition())) {
                    sb.append(indent).append("postcondition: ").append(renderRecord(call.postcondition(), depth + 1));
                }
                for (SymbolicRecord parameter : call.parameters()) {
                    if (!isFiltered(parameter)) {
                        sb.append(indent).append("parameter: ").append(renderRecord(parameter, depth + 1));
                    }
                }
                break;
            }
            default:
                sb.append(label(record)).append('\n');
                appendNested(sb, record.children(), depth, indent);
        }
        return sb.toString();
    }

    /** Children one level deeper. */
    private void appendNested(StringBuilder sb, List<SymbolicRecord> children, int depth, String indent) {
        for (SymbolicRecord child : children) {
            if (!isFiltered(child)) {
                sb.append(indent).append(renderRecord(child, depth + 1));
            }
        }
    }

    /** Children on the caller's level, as if they were siblings of the flattened record. */
    private void appendFlattened(StringBuilder sb, List<SymbolicRecord> children, int depth, String outer, int emitted) {
        for (SymbolicRecord child : children) {
            if (!isFiltered(child)) {
                sb.append(emitted != 0 ? outer : "").append(renderRecord(child, depth));
                emitted++;
            }
        }
    }
}

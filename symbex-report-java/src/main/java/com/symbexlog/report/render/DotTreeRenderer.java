package com.symbexlog.report.render;

import com.symbexlog.recorder.TraceBuilder;
import com.symbexlog.recorder.model.CfgBranchRecord;
import com.symbexlog.recorder.model.ConditionalEdgeRecord;
import com.symbexlog.recorder.model.MethodCallRecord;
import com.symbexlog.recorder.model.SymbolicRecord;
import com.symbexlog.recorder.model.TwoBranchRecord;

import java.util.List;

/**
 * GraphViz rendering: one rectangle per record, one edge per child relation.
 *
 * Branch-shaped records get an edge to their condition and one synthetic
 * {@code Branch i} node per successor. Method calls get labelled edges to
 * their parameter, precondition and postcondition records.
 */
public class DotTreeRenderer implements Renderer<TraceBuilder, String> {

    @Override
    public String render(List<TraceBuilder> members) {
        StringBuilder sb = new StringBuilder("digraph {\n");
        sb.append("node [shape=rectangle];\n\n");
        for (TraceBuilder member : members) {
            sb.append(renderMember(member)).append("\n\n");
        }
        sb.append("}");
        return sb.toString();
    }

    @Override
    public String renderMember(TraceBuilder member) {
        SymbolicRecord root = member.root();
        StringBuilder sb = new StringBuilder();
        node(sb, root.nodeId(), root.dotLabel());
        appendSubs(sb, root);
        return sb.toString();
    }

    private void appendSubs(StringBuilder sb, SymbolicRecord record) {
        String id = record.nodeId();
        for (SymbolicRecord child : record.children()) {
            appendChild(sb, id, child, null);
        }

        switch (record.kind()) {
            case GLOBAL_BRANCH:
            case LOCAL_BRANCH: {
                TwoBranchRecord branch = (TwoBranchRecord) record;
                appendChild(sb, id, branch.condition(), "condition");
                appendBranch(sb, id, 1, branch.thenChildren());
                appendBranch(sb, id, 2, branch.elseChildren());
                break;
            }
            case CONDITIONAL_EDGE: {
                ConditionalEdgeRecord edge = (ConditionalEdgeRecord) record;
                appendChild(sb, id, edge.condition(), "condition");
                appendBranch(sb, id, 1, edge.thenChildren());
                break;
            }
            case CFG_BRANCH: {
                List<List<SymbolicRecord>> branches = ((CfgBranchRecord) record).branches();
                for (int i = 0; i < branches.size(); i++) {
                    appendBranch(sb, id, i + 1, branches.get(i));
                }
                break;
            }
            case METHOD_CALL: {
                MethodCallRecord call = (MethodCallRecord) record;
                for (SymbolicRecord parameter : call.parameters()) {
                    appendChild(sb, id, parameter, "parameter");
                }
                appendChild(sb, id, call.precondition(), "precondition");
                appendChild(sb, id, call.postcondition(), "postcondition");
                break;
            }
            default:
                break;
        }
    }

    private void appendBranch(StringBuilder sb, String parentId, int number, List<SymbolicRecord> records) {
        String branchId = parentId + "_b" + number;
        node(sb, branchId, "\"Branch " + number + "\"");
        edge(sb, parentId, branchId, null);
        for (SymbolicRecord record : records) {
            appendChild(sb, branchId, record, null);
        }
    }

    private void appendChild(StringBuilder sb, String parentId, SymbolicRecord child, String edgeLabel) {
        node(sb, child.nodeId(), child.dotLabel());
        edge(sb, parentId, child.nodeId(), edgeLabel);
        appendSubs(sb, child);
    }

    private static void node(StringBuilder sb, String id, String quotedLabel) {
        sb.append("    ").append(id).append(" [label=").append(quotedLabel).append("];\n");
    }

    private static void edge(StringBuilder sb, String from, String to, String label) {
        sb.append("    ").append(from).append(" -> ").append(to);
        if (label != null) {
            sb.append(" [label=\"").append(label).append("\"]");
        }
        sb.append(";\n");
    }
}

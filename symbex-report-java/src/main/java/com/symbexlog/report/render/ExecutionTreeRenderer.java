package com.symbexlog.report.render;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.symbexlog.recorder.TraceBuilder;
import com.symbexlog.recorder.model.CfgBranchRecord;
import com.symbexlog.recorder.model.CommentRecord;
import com.symbexlog.recorder.model.ConditionalEdgeRecord;
import com.symbexlog.recorder.model.MethodCallRecord;
import com.symbexlog.recorder.model.SymbolicRecord;
import com.symbexlog.recorder.model.TwoBranchRecord;

import java.util.List;

/**
 * Nested-object tree for the browser viewer: a script assigning one entry per
 * unit to {@code executionTreeData}. Each record becomes an object with its
 * key/value export, an {@code open} flag, the pre-state as escaped JSON text
 * and its {@code children}.
 */
public class ExecutionTreeRenderer implements Renderer<TraceBuilder, String> {

    public static final String VARIABLE = "executionTreeData";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final DefaultStateFormatter stateFormatter;

    public ExecutionTreeRenderer() {
        this(new DefaultStateFormatter());
    }

    public ExecutionTreeRenderer(DefaultStateFormatter stateFormatter) {
        this.stateFormatter = stateFormatter;
    }

    @Override
    public String render(List<TraceBuilder> members) {
        JsonArray data = new JsonArray();
        for (TraceBuilder member : members) {
            data.add(toTree(member));
        }
        return "var " + VARIABLE + " = " + GSON.toJson(data) + "\n";
    }

    @Override
    public String renderMember(TraceBuilder member) {
        return GSON.toJson(toTree(member));
    }

    public JsonObject toTree(TraceBuilder member) {
        return recordToJs(member.root());
    }

    private JsonObject recordToJs(SymbolicRecord record) {
        switch (record.kind()) {
            case COMMENT: {
                JsonObject json = new JsonObject();
                json.addProperty("kind", "comment");
                if (((CommentRecord) record).comment() != null) {
                    json.addProperty("value", ((CommentRecord) record).comment());
                }
                json.addProperty("open", true);
                return json;
            }
            case GLOBAL_BRANCH:
            case LOCAL_BRANCH: {
                TwoBranchRecord branch = (TwoBranchRecord) record;
                JsonArray children = new JsonArray();
                children.add(group("condition", List.of(branch.condition()), null));
                children.add(group("Branch 1", branch.thenChildren(), null));
                children.add(group("Branch 2", branch.elseChildren(), null));
                return withChildren(header(record), children);
            }
            case CONDITIONAL_EDGE: {
                ConditionalEdgeRecord edge = (ConditionalEdgeRecord) record;
                JsonArray children = new JsonArray();
                children.add(group("condition", List.of(edge.condition()), null));
                children.add(group("Branch 1", edge.thenChildren(), null));
                return withChildren(header(record), children);
            }
            case CFG_BRANCH: {
                List<List<SymbolicRecord>> branches = ((CfgBranchRecord) record).branches();
                JsonArray children = new JsonArray();
                for (int i = 0; i < branches.size(); i++) {
                    children.add(group("Branch " + (i + 1), branches.get(i), null));
                }
                return withChildren(header(record), children);
            }
            case METHOD_CALL: {
                MethodCallRecord call = (MethodCallRecord) record;
                JsonArray children = new JsonArray();
                children.add(group("parameters", call.parameters(), null));
                children.add(group("precondition", List.of(call.precondition()), call.precondition()));
                children.add(group("postcondition", List.of(call.postcondition()), call.postcondition()));
                return withChildren(header(record), children);
            }
            default: {
                JsonObject json = header(record);
                if (!record.children().isEmpty()) {
                    json.add("children", toArray(record.children()));
                }
                return json;
            }
        }
    }

    private JsonObject header(SymbolicRecord record) {
        JsonObject json = record.toJson();
        json.addProperty("open", true);
        addPrestate(json, record);
        return json;
    }

    /** A labelled grouping node; {@code stateOf} contributes its pre-state if non-null. */
    private JsonObject group(String kind, List<SymbolicRecord> records, SymbolicRecord stateOf) {
        JsonObject json = new JsonObject();
        json.addProperty("kind", kind);
        json.addProperty("open", true);
        if (stateOf != null) {
            addPrestate(json, stateOf);
        }
        json.add("children", toArray(records));
        return json;
    }

    private JsonObject withChildren(JsonObject json, JsonArray children) {
        json.add("children", children);
        return json;
    }

    private JsonArray toArray(List<SymbolicRecord> records) {
        JsonArray array = new JsonArray();
        for (SymbolicRecord record : records) {
            array.add(recordToJs(record));
        }
        return array;
    }

    private void addPrestate(JsonObject json, SymbolicRecord record) {
        if (record.state() != null) {
            json.addProperty("prestate", stateFormatter.toJson(record.state(), record.pathConditions()));
        }
    }
}

package com.symbexlog.report.graph;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.symbexlog.report.render.Renderer;

import java.util.List;

/**
 * Flattens a generic-node graph into paired begin/end events of the Chrome
 * trace-event format (timestamps in milliseconds). A node without both
 * timestamps cannot be shown as an interval; it is skipped together with
 * everything below it.
 */
public class ChromeTraceRenderer implements Renderer<GenericNode, String> {

    private static final Gson GSON = new Gson();

    @Override
    public String render(List<GenericNode> members) {
        return GSON.toJson(toEvents(members));
    }

    @Override
    public String renderMember(GenericNode member) {
        return render(List.of(member));
    }

    public JsonArray toEvents(List<GenericNode> members) {
        JsonArray events = new JsonArray();
        members.forEach(m -> appendEvents(events, m));
        return events;
    }

    private void appendEvents(JsonArray events, GenericNode node) {
        if (!node.hasTiming()) {
            System.err.println("[symbex-report] skipping node without timing: " + node);
            return;
        }
        events.add(event(node, "B", node.startTimeMs()));
        events.add(event(node, "E", node.endTimeMs()));
        node.children().forEach(child -> appendEvents(events, child));
        node.successors().forEach(successor -> appendEvents(events, successor));
    }

    private static JsonObject event(GenericNode node, String phase, long ts) {
        JsonObject event = new JsonObject();
        event.addProperty("name", node.label());
        event.addProperty("cat", "PERF");
        event.addProperty("ph", phase);
        event.addProperty("pid", 1);
        event.addProperty("tid", 1);
        event.addProperty("ts", ts);
        return event;
    }
}

package com.symbexlog.report.graph;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.symbexlog.report.render.Renderer;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a generic-node graph as a flat JSON array. Every reachable node gets
 * an index; children and successors refer to nodes by index, so shared
 * successors are written once.
 */
public class GenericNodeJsonRenderer implements Renderer<GenericNode, String> {

    private static final Gson GSON = new Gson();

    @Override
    public String render(List<GenericNode> members) {
        List<GenericNode> nodes = new ArrayList<>();
        Map<GenericNode, Integer> index = new IdentityHashMap<>();
        members.forEach(m -> collect(m, nodes, index));

        JsonArray array = new JsonArray();
        for (GenericNode node : nodes) {
            array.add(renderNode(node, index));
        }
        return GSON.toJson(array);
    }

    @Override
    public String renderMember(GenericNode member) {
        return render(List.of(member));
    }

    private void collect(GenericNode node, List<GenericNode> nodes, Map<GenericNode, Integer> index) {
        if (index.containsKey(node)) {
            return;
        }
        index.put(node, nodes.size());
        nodes.add(node);
        node.children().forEach(child -> collect(child, nodes, index));
        node.successors().forEach(successor -> collect(successor, nodes, index));
    }

    /** Renders one node against {@code index}; a node referring to unindexed nodes degrades to its label. */
    JsonObject renderNode(GenericNode node, Map<GenericNode, Integer> index) {
        JsonArray children = indices(node.children(), index);
        JsonArray successors = indices(node.successors(), index);
        Integer id = index.get(node);
        if (id == null || children == null || successors == null) {
            System.err.println("[symbex-report] WARNING: unresolved node reference, writing label only: " + node);
            JsonObject degraded = new JsonObject();
            degraded.addProperty("label", node.label());
            return degraded;
        }
        JsonObject json = new JsonObject();
        json.addProperty("id", id);
        json.addProperty("label", node.label());
        json.addProperty("isSmtQuery", node.isSmtQuery());
        json.addProperty("isSyntactic", node.isSyntactic());
        json.addProperty("startTimeMs", node.startTimeMs());
        json.addProperty("endTimeMs", node.endTimeMs());
        json.add("children", children);
        json.add("successors", successors);
        return json;
    }

    private static JsonArray indices(List<GenericNode> nodes, Map<GenericNode, Integer> index) {
        JsonArray array = new JsonArray();
        for (GenericNode node : nodes) {
            Integer i = index.get(node);
            if (i == null) {
                return null;
            }
            array.add(i);
        }
        return array;
    }
}

package com.symbexlog.report.render;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.symbexlog.recorder.model.SymbolicState;
import com.symbexlog.recorder.model.Term;

import java.util.Map;
import java.util.Set;

/** Formats a state snapshot and its path conditions as compact JSON text. */
public class DefaultStateFormatter {

    private static final Gson GSON = new Gson();

    public JsonObject toJsonObject(SymbolicState state, Set<Term> pathConditions) {
        JsonObject json = new JsonObject();

        JsonArray store = new JsonArray();
        for (Map.Entry<String, String> binding : state.store().entrySet()) {
            JsonObject entry = new JsonObject();
            entry.addProperty("name", binding.getKey());
            entry.addProperty("value", binding.getValue());
            store.add(entry);
        }
        json.add("store", store);

        JsonArray heap = new JsonArray();
        state.heap().forEach(heap::add);
        json.add("heap", heap);

        JsonArray pcs = new JsonArray();
        if (pathConditions != null) {
            pathConditions.forEach(t -> pcs.add(t.render()));
        }
        json.add("pcs", pcs);
        return json;
    }

    public String toJson(SymbolicState state, Set<Term> pathConditions) {
        return GSON.toJson(toJsonObject(state, pathConditions));
    }
}

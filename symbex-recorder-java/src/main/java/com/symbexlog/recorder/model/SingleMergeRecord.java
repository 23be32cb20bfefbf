package com.symbexlog.recorder.model;

import com.google.gson.JsonObject;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Merge of newly produced heap chunks into the existing ones. */
public class SingleMergeRecord extends SymbolicRecord {

    private final List<HeapChunk> destChunks;
    private final List<HeapChunk> newChunks;

    public SingleMergeRecord(List<HeapChunk> destChunks, List<HeapChunk> newChunks, Set<Term> pathConditions) {
        super(RecordKind.SINGLE_MERGE, null, null, pathConditions);
        this.destChunks = destChunks != null ? List.copyOf(destChunks) : null;
        this.newChunks = newChunks != null ? List.copyOf(newChunks) : null;
    }

    public List<HeapChunk> destChunks() { return destChunks; }
    public List<HeapChunk> newChunks()  { return newChunks; }

    @Override
    public String toSimpleString() {
        if (destChunks == null || newChunks == null) {
            return "SingleMerge <null>";
        }
        return render(Stream.concat(destChunks.stream(), newChunks.stream()).collect(Collectors.toList()));
    }

    @Override
    public String toString() {
        if (destChunks == null || newChunks == null) {
            return "Single merge: <null>";
        }
        return "Single merge: " + render(destChunks) + " <= " + render(newChunks);
    }

    private static String render(List<HeapChunk> chunks) {
        return chunks.stream().map(HeapChunk::render).collect(Collectors.joining(" "));
    }

    @Override
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("kind", toTypeString());
        json.addProperty("value", toSimpleString());
        return json;
    }
}

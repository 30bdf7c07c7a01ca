package com.moveatlas.engine.discovery;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Finds object ids embedded in a decoded object snapshot.
 * The walk stops below {@link #MAX_DEPTH} nesting levels or after {@link #MAX_HITS} distinct ids.
 */
public final class SnapshotScanner {

    public static final Pattern OBJECT_ID = Pattern.compile("^0x[a-fA-F0-9]{64}$");
    public static final int MAX_DEPTH = 4;
    public static final int MAX_HITS = 20;

    private SnapshotScanner() {}

    /** Distinct object ids in first-seen order. */
    public static List<String> scan(JsonElement snapshot) {
        Set<String> hits = new LinkedHashSet<>();
        walk(snapshot, 0, hits);
        return new ArrayList<>(hits);
    }

    private static void walk(JsonElement node, int depth, Set<String> hits) {
        if (node == null || node.isJsonNull() || depth > MAX_DEPTH || hits.size() >= MAX_HITS) {
            return;
        }
        if (node.isJsonPrimitive()) {
            JsonPrimitive p = node.getAsJsonPrimitive();
            if (p.isString() && OBJECT_ID.matcher(p.getAsString()).matches()) {
                hits.add(p.getAsString());
            }
        } else if (node.isJsonArray()) {
            JsonArray arr = node.getAsJsonArray();
            for (JsonElement child : arr) {
                walk(child, depth + 1, hits);
            }
        } else if (node.isJsonObject()) {
            JsonObject obj = node.getAsJsonObject();
            for (Map.Entry<String, JsonElement> e : obj.entrySet()) {
                walk(e.getValue(), depth + 1, hits);
            }
        }
    }
}

package com.moveatlas.engine.static_analysis;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A Move type expression as it appears in normalized module metadata.
 *
 * Shapes: a plain string ("U64", or an already qualified "0x2::sui::SUI"),
 * {"Struct": {...}}, {"Reference": t}, {"MutableReference": t}, {"Vector": t},
 * {"TypeParameter": n}. Anything else is kept as {@link Opaque}.
 */
public interface MoveType {

    Gson GSON = new Gson();

    /** Fully-qualified struct names reachable from this type, in discovery order. */
    default List<String> referencedTypes() {
        Set<String> out = new LinkedHashSet<>();
        collectReferences(out);
        return new ArrayList<>(out);
    }

    void collectReferences(Set<String> out);

    /** String form stored on graph nodes: the raw string for string shapes, compact JSON otherwise. */
    String render();

    record Primitive(String name) implements MoveType {
        public void collectReferences(Set<String> out) {}
        public String render() { return name; }
    }

    /** A type given as a string that already contains {@code ::}. */
    record Named(String fqn) implements MoveType {
        public void collectReferences(Set<String> out) { out.add(fqn); }
        public String render() { return fqn; }
    }

    record StructRef(String address, String module, String name, List<MoveType> typeArguments, JsonElement raw)
            implements MoveType {
        public String fqn() { return address + "::" + module + "::" + name; }

        public void collectReferences(Set<String> out) {
            out.add(fqn());
            for (MoveType arg : typeArguments) arg.collectReferences(out);
        }

        public String render() { return GSON.toJson(raw); }
    }

    record Reference(MoveType inner, boolean mutable, JsonElement raw) implements MoveType {
        public void collectReferences(Set<String> out) { inner.collectReferences(out); }
        public String render() { return GSON.toJson(raw); }
    }

    record Vector(MoveType element, JsonElement raw) implements MoveType {
        public void collectReferences(Set<String> out) { element.collectReferences(out); }
        public String render() { return GSON.toJson(raw); }
    }

    record TypeParameter(int index, JsonElement raw) implements MoveType {
        public void collectReferences(Set<String> out) {}
        public String render() { return GSON.toJson(raw); }
    }

    /** Unrecognized shape; its nested values are still searched for struct references. */
    record Opaque(List<MoveType> children, JsonElement raw) implements MoveType {
        public void collectReferences(Set<String> out) {
            for (MoveType child : children) child.collectReferences(out);
        }
        public String render() { return raw == null ? "null" : GSON.toJson(raw); }
    }

    /**
     * Parses a normalized type expression. Never fails: shapes that do not match a known
     * variant become {@link Opaque}.
     */
    static MoveType parse(JsonElement json) {
        if (json == null || json.isJsonNull()) {
            return new Opaque(List.of(), json);
        }
        if (json.isJsonPrimitive()) {
            String s = json.getAsString();
            return s.contains("::") ? new Named(s) : new Primitive(s);
        }
        if (json.isJsonArray()) {
            return new Opaque(parseAll(json.getAsJsonArray()), json);
        }
        JsonObject obj = json.getAsJsonObject();
        if (obj.has("Struct") && obj.get("Struct").isJsonObject()) {
            JsonObject s = obj.getAsJsonObject("Struct");
            String address = stringOrNull(s, "address");
            String module = stringOrNull(s, "module");
            String name = stringOrNull(s, "name");
            List<MoveType> args = s.has("typeArguments") && s.get("typeArguments").isJsonArray()
                    ? parseAll(s.getAsJsonArray("typeArguments"))
                    : List.of();
            if (address != null && module != null && name != null) {
                return new StructRef(address, module, name, args, json);
            }
            return new Opaque(args, json);
        }
        if (obj.has("Reference")) {
            return new Reference(parse(obj.get("Reference")), false, json);
        }
        if (obj.has("MutableReference")) {
            return new Reference(parse(obj.get("MutableReference")), true, json);
        }
        if (obj.has("Vector")) {
            return new Vector(parse(obj.get("Vector")), json);
        }
        if (obj.has("TypeParameter")) {
            JsonElement idx = obj.get("TypeParameter");
            int index = idx.isJsonPrimitive() && idx.getAsJsonPrimitive().isNumber() ? idx.getAsInt() : -1;
            return new TypeParameter(index, json);
        }
        List<MoveType> children = new ArrayList<>();
        for (Map.Entry<String, JsonElement> e : obj.entrySet()) {
            children.add(parse(e.getValue()));
        }
        return new Opaque(children, json);
    }

    static List<MoveType> parseAll(JsonArray array) {
        List<MoveType> out = new ArrayList<>(array.size());
        for (JsonElement e : array) out.add(parse(e));
        return out;
    }

    private static String stringOrNull(JsonObject obj, String key) {
        JsonElement e = obj.get(key);
        return e != null && e.isJsonPrimitive() ? e.getAsString() : null;
    }
}

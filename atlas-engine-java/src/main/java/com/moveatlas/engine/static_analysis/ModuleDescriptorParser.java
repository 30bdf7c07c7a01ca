package com.moveatlas.engine.static_analysis;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.moveatlas.engine.static_analysis.ModuleDescriptor.FieldDescriptor;
import com.moveatlas.engine.static_analysis.ModuleDescriptor.FriendRef;
import com.moveatlas.engine.static_analysis.ModuleDescriptor.FunctionDescriptor;
import com.moveatlas.engine.static_analysis.ModuleDescriptor.StructDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts a raw normalized module (as returned by sui_getNormalizedMoveModulesByPackage)
 * into a {@link ModuleDescriptor}. Entries that do not fit the expected shape are skipped
 * with a warning rather than failing the whole module.
 */
public class ModuleDescriptorParser {

    public ModuleDescriptor parse(String moduleKey, JsonObject raw) {
        return new ModuleDescriptor(
                parseFunctions(moduleKey, raw),
                parseStructs(moduleKey, raw),
                parseFriends(moduleKey, raw));
    }

    private List<FunctionDescriptor> parseFunctions(String moduleKey, JsonObject raw) {
        List<FunctionDescriptor> out = new ArrayList<>();
        JsonObject functions = objectOrNull(raw, "exposedFunctions");
        if (functions == null) return out;

        for (Map.Entry<String, JsonElement> entry : functions.entrySet()) {
            if (!entry.getValue().isJsonObject()) {
                warn("function " + moduleKey + "::" + entry.getKey() + " is not an object, skipped");
                continue;
            }
            JsonObject fn = entry.getValue().getAsJsonObject();
            JsonArray params = arrayOrNull(fn, "parameters");
            JsonArray returns = arrayOrNull(fn, "return");
            out.add(new FunctionDescriptor(
                    entry.getKey(),
                    stringOrNull(fn, "visibility"),
                    fn.has("isEntry") && fn.get("isEntry").isJsonPrimitive() && fn.get("isEntry").getAsBoolean(),
                    params != null ? MoveType.parseAll(params) : List.of(),
                    returns != null ? MoveType.parseAll(returns) : List.of(),
                    returns));
        }
        return out;
    }

    private List<StructDescriptor> parseStructs(String moduleKey, JsonObject raw) {
        List<StructDescriptor> out = new ArrayList<>();
        JsonObject structs = objectOrNull(raw, "structs");
        if (structs == null) return out;

        for (Map.Entry<String, JsonElement> entry : structs.entrySet()) {
            String structName = entry.getKey();
            if (!entry.getValue().isJsonObject()) {
                warn("struct " + moduleKey + "::" + structName + " is not an object, skipped");
                continue;
            }
            JsonObject struct = entry.getValue().getAsJsonObject();

            // abilities arrive as {"abilities": ["Key", "Store"]}
            List<String> abilities = new ArrayList<>();
            JsonObject abilityHolder = objectOrNull(struct, "abilities");
            JsonArray abilityList = abilityHolder != null ? arrayOrNull(abilityHolder, "abilities") : null;
            if (abilityList != null) {
                for (JsonElement a : abilityList) {
                    if (a.isJsonPrimitive()) abilities.add(a.getAsString());
                }
            }

            List<FieldDescriptor> fields = new ArrayList<>();
            JsonArray fieldList = arrayOrNull(struct, "fields");
            if (fieldList != null) {
                for (JsonElement f : fieldList) {
                    if (!f.isJsonObject() || stringOrNull(f.getAsJsonObject(), "name") == null) {
                        warn("malformed field in " + moduleKey + "::" + structName + ", skipped: " + f);
                        continue;
                    }
                    JsonObject field = f.getAsJsonObject();
                    fields.add(new FieldDescriptor(field.get("name").getAsString(), MoveType.parse(field.get("type"))));
                }
            }
            out.add(new StructDescriptor(structName, abilities, fields));
        }
        return out;
    }

    private List<FriendRef> parseFriends(String moduleKey, JsonObject raw) {
        List<FriendRef> out = new ArrayList<>();
        JsonArray friends = arrayOrNull(raw, "friends");
        if (friends == null) return out;

        for (JsonElement f : friends) {
            if (!f.isJsonObject()) continue;
            String address = stringOrNull(f.getAsJsonObject(), "address");
            String name = stringOrNull(f.getAsJsonObject(), "name");
            if (address == null || address.isEmpty() || name == null || name.isEmpty()) {
                warn("friend declaration without address or name in " + moduleKey + ", skipped");
                continue;
            }
            out.add(new FriendRef(address, name));
        }
        return out;
    }

    static JsonObject objectOrNull(JsonObject obj, String key) {
        JsonElement e = obj.get(key);
        return e != null && e.isJsonObject() ? e.getAsJsonObject() : null;
    }

    static JsonArray arrayOrNull(JsonObject obj, String key) {
        JsonElement e = obj.get(key);
        return e != null && e.isJsonArray() ? e.getAsJsonArray() : null;
    }

    static String stringOrNull(JsonObject obj, String key) {
        JsonElement e = obj.get(key);
        return e != null && e.isJsonPrimitive() ? e.getAsString() : null;
    }

    private static void warn(String message) {
        System.err.println("[atlas-engine] WARNING: " + message);
    }
}

package com.moveatlas.rpc;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.moveatlas.engine.source.DynamicFieldSource;
import com.moveatlas.engine.source.EventSource;
import com.moveatlas.engine.source.ModuleMetadataSource;
import com.moveatlas.engine.source.OwnerInfo;
import com.moveatlas.engine.source.SourceException;
import com.moveatlas.rpc.transport.RpcTransport;
import com.moveatlas.rpc.transport.RpcTransport.RpcException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Module metadata, dynamic fields, object details and events from a Sui full node's JSON-RPC API.
 */
public class SuiJsonRpcClient implements ModuleMetadataSource, DynamicFieldSource, EventSource {

    static final String GET_MODULES = "sui_getNormalizedMoveModulesByPackage";
    static final String GET_DYNAMIC_FIELDS = "suix_getDynamicFields";
    static final String GET_OBJECT = "sui_getObject";
    static final String QUERY_EVENTS = "suix_queryEvents";

    private final RpcTransport transport;

    public SuiJsonRpcClient(RpcTransport transport) {
        this.transport = transport;
    }

    @Override
    public Map<String, JsonObject> getNormalizedModules(String packageAddress) {
        JsonArray params = new JsonArray();
        params.add(packageAddress);
        JsonElement result;
        try {
            result = transport.call(GET_MODULES, params);
        } catch (RpcException e) {
            if (isNotFound(e.getMessage())) {
                throw SourceException.notFound(GET_MODULES, "package " + packageAddress + " does not exist");
            }
            throw new SourceException(GET_MODULES, e.getMessage(), e);
        }
        if (result == null || !result.isJsonObject()) {
            throw new SourceException(GET_MODULES, "unexpected result for " + packageAddress);
        }

        Map<String, JsonObject> modules = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> e : result.getAsJsonObject().entrySet()) {
            if (e.getValue().isJsonObject()) {
                modules.put(e.getKey(), e.getValue().getAsJsonObject());
            } else {
                System.err.println("[atlas-rpc] WARNING: module " + e.getKey() + " is not an object, skipped");
            }
        }
        return modules;
    }

    @Override
    public List<String> listDynamicFields(String parentObjectId) {
        JsonArray params = new JsonArray();
        params.add(parentObjectId);
        JsonObject page = callForObject(GET_DYNAMIC_FIELDS, params);

        List<String> children = new ArrayList<>();
        JsonElement data = page.get("data");
        if (data != null && data.isJsonArray()) {
            for (JsonElement item : data.getAsJsonArray()) {
                String childId = item.isJsonObject() ? string(item.getAsJsonObject(), "objectId") : null;
                if (childId != null) children.add(childId);
            }
        }
        return children;
    }

    @Override
    public ObjectDetail getObject(String objectId) {
        JsonArray params = new JsonArray();
        params.add(objectId);
        JsonObject options = new JsonObject();
        options.addProperty("showOwner", true);
        options.addProperty("showType", true);
        params.add(options);

        JsonObject response = callForObject(GET_OBJECT, params);
        if (!response.has("data") || !response.get("data").isJsonObject()) {
            throw SourceException.notFound(GET_OBJECT, "object " + objectId + " has no data");
        }
        JsonObject data = response.getAsJsonObject("data");
        OwnerInfo owner = decodeOwner(data.get("owner"));
        return new ObjectDetail(owner, string(data, "type"));
    }

    @Override
    public List<ChainEvent> queryEvents(String packageId, int limit) {
        JsonObject filter = new JsonObject();
        filter.addProperty("Package", packageId);
        JsonArray params = new JsonArray();
        params.add(filter);
        params.add(JsonNull.INSTANCE);
        params.add(limit);
        params.add(true); // descending

        JsonObject page = callForObject(QUERY_EVENTS, params);
        List<ChainEvent> events = new ArrayList<>();
        JsonElement data = page.get("data");
        if (data == null || !data.isJsonArray()) return events;

        for (JsonElement item : data.getAsJsonArray()) {
            if (!item.isJsonObject()) continue;
            JsonObject evt = item.getAsJsonObject();
            JsonObject id = evt.has("id") && evt.get("id").isJsonObject() ? evt.getAsJsonObject("id") : new JsonObject();
            Long ts = null;
            String tsText = string(evt, "timestampMs");
            if (tsText != null) {
                try {
                    ts = Long.parseLong(tsText);
                } catch (NumberFormatException e) {
                    System.err.println("[atlas-rpc] WARNING: bad event timestamp " + tsText);
                }
            }
            JsonObject parsed = evt.has("parsedJson") && evt.get("parsedJson").isJsonObject()
                    ? evt.getAsJsonObject("parsedJson") : null;
            events.add(new ChainEvent(
                    string(id, "txDigest"),
                    string(id, "eventSeq"),
                    string(evt, "type"),
                    ts,
                    parsed,
                    string(evt, "sender")));
        }
        return events;
    }

    /**
     * JSON-RPC owner shapes: {@code "Immutable"}, {@code {"AddressOwner": addr}},
     * {@code {"ObjectOwner": id}}, {@code {"Shared": {...}}}.
     *
     * @throws SourceException for any other shape
     */
    static OwnerInfo decodeOwner(JsonElement owner) {
        if (owner != null && owner.isJsonPrimitive() && "Immutable".equals(owner.getAsString())) {
            return OwnerInfo.immutable();
        }
        if (owner != null && owner.isJsonObject()) {
            JsonObject o = owner.getAsJsonObject();
            if (o.has("AddressOwner") && o.get("AddressOwner").isJsonPrimitive()) {
                return OwnerInfo.address(o.get("AddressOwner").getAsString());
            }
            if (o.has("ObjectOwner") && o.get("ObjectOwner").isJsonPrimitive()) {
                return OwnerInfo.object(o.get("ObjectOwner").getAsString());
            }
            if (o.has("Shared")) {
                return OwnerInfo.shared();
            }
        }
        throw new SourceException("decodeOwner", "unsupported owner shape: " + owner);
    }

    static boolean isNotFound(String message) {
        if (message == null) return false;
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("not found") || lower.contains("does not exist") || lower.contains("notexists");
    }

    private JsonObject callForObject(String method, JsonArray params) {
        JsonElement result;
        try {
            result = transport.call(method, params);
        } catch (RpcException e) {
            throw new SourceException(method, e.getMessage(), e);
        }
        if (result == null || !result.isJsonObject()) {
            throw new SourceException(method, "unexpected result shape");
        }
        return result.getAsJsonObject();
    }

    private static String string(JsonObject obj, String key) {
        JsonElement v = obj.get(key);
        return v instanceof JsonPrimitive ? v.getAsString() : null;
    }
}

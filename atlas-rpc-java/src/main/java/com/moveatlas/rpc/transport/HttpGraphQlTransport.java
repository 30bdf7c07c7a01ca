package com.moveatlas.rpc.transport;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.moveatlas.rpc.transport.RpcTransport.RpcException;

/**
 * GraphQL over HTTP POST with a {@code {"query": ...}} body.
 */
public class HttpGraphQlTransport implements GraphQlTransport {

    private final String endpoint;
    private final int timeoutMs;

    public HttpGraphQlTransport(String endpoint) {
        this(endpoint, HttpPost.DEFAULT_TIMEOUT_MS);
    }

    public HttpGraphQlTransport(String endpoint, int timeoutMs) {
        this.endpoint = endpoint;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public JsonObject query(String query) {
        JsonObject body = new JsonObject();
        body.addProperty("query", query);
        return unwrap(HttpPost.postJson(endpoint, body.toString(), timeoutMs));
    }

    static JsonObject unwrap(JsonElement response) {
        if (response == null || !response.isJsonObject()) {
            throw new RpcException("GraphQL response is not a JSON object");
        }
        JsonObject obj = response.getAsJsonObject();
        if (obj.has("errors") && obj.get("errors").isJsonArray() && obj.getAsJsonArray("errors").size() > 0) {
            throw new RpcException("GraphQL errors: " + obj.get("errors"));
        }
        if (!obj.has("data") || !obj.get("data").isJsonObject()) {
            throw new RpcException("Invalid GraphQL response: missing data");
        }
        return obj.getAsJsonObject("data");
    }
}

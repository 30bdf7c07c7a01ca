package com.moveatlas.rpc.transport;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC 2.0 over HTTP POST.
 */
public class HttpRpcTransport implements RpcTransport {

    private final String endpoint;
    private final int timeoutMs;
    private final AtomicLong nextId = new AtomicLong(1);

    public HttpRpcTransport(String endpoint) {
        this(endpoint, HttpPost.DEFAULT_TIMEOUT_MS);
    }

    public HttpRpcTransport(String endpoint, int timeoutMs) {
        this.endpoint = endpoint;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public JsonElement call(String method, JsonArray params) {
        JsonObject request = new JsonObject();
        request.addProperty("jsonrpc", "2.0");
        request.addProperty("id", nextId.getAndIncrement());
        request.addProperty("method", method);
        request.add("params", params != null ? params : new JsonArray());

        JsonElement response = HttpPost.postJson(endpoint, request.toString(), timeoutMs);
        return unwrap(method, response);
    }

    static JsonElement unwrap(String method, JsonElement response) {
        if (response == null || !response.isJsonObject()) {
            throw new RpcException(method + ": response is not a JSON object");
        }
        JsonObject obj = response.getAsJsonObject();
        if (obj.has("error") && obj.get("error").isJsonObject()) {
            JsonObject error = obj.getAsJsonObject("error");
            Integer code = error.has("code") && error.get("code").isJsonPrimitive() ? error.get("code").getAsInt() : null;
            String message = error.has("message") ? error.get("message").getAsString() : error.toString();
            throw new RpcException(method + ": " + message, code, null);
        }
        if (!obj.has("result")) {
            throw new RpcException(method + ": response has no result");
        }
        return obj.get("result");
    }

    public String getEndpoint() { return endpoint; }
}

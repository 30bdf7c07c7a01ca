package com.moveatlas.rpc.transport;

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.moveatlas.rpc.transport.RpcTransport.RpcException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;

/**
 * JSON POST over {@link HttpURLConnection}, shared by the JSON-RPC and GraphQL transports.
 */
final class HttpPost {

    static final int DEFAULT_TIMEOUT_MS = 30_000;

    private HttpPost() {}

    static JsonElement postJson(String endpoint, String body, int timeoutMs) {
        HttpURLConnection conn = null;
        try {
            conn = (HttpURLConnection) new URL(endpoint).openConnection();
            conn.setRequestMethod("POST");
            conn.setConnectTimeout(timeoutMs);
            conn.setReadTimeout(timeoutMs);
            conn.setDoOutput(true);
            conn.setRequestProperty("Content-Type", "application/json");
            conn.setRequestProperty("Accept", "application/json");
            try (OutputStream out = conn.getOutputStream()) {
                out.write(body.getBytes(StandardCharsets.UTF_8));
            }

            int status = conn.getResponseCode();
            if (status < 200 || status >= 300) {
                throw new RpcException("HTTP " + status + " from " + endpoint, status, null);
            }
            try (InputStream in = conn.getInputStream()) {
                String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                return JsonParser.parseString(text);
            }
        } catch (IOException e) {
            throw new RpcException("Request to " + endpoint + " failed: " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new RpcException("Malformed JSON from " + endpoint + ": " + e.getMessage(), e);
        } finally {
            if (conn != null) conn.disconnect();
        }
    }
}

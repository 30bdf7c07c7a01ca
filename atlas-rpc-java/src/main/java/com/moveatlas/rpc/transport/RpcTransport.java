package com.moveatlas.rpc.transport;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;

/**
 * Sends one JSON-RPC 2.0 request and returns its {@code result} member.
 */
@FunctionalInterface
public interface RpcTransport {

    /**
     * @throws RpcException on transport failure or an {@code error} response
     */
    JsonElement call(String method, JsonArray params);

    class RpcException extends RuntimeException {
        private final Integer code;

        public RpcException(String msg) { this(msg, null, null); }
        public RpcException(String msg, Throwable cause) { this(msg, null, cause); }

        public RpcException(String msg, Integer code, Throwable cause) {
            super(msg, cause);
            this.code = code;
        }

        /** JSON-RPC error code or HTTP status, null for I/O failures. */
        public Integer getCode() { return code; }
    }
}

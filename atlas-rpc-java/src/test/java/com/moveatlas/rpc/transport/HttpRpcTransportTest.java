package com.moveatlas.rpc.transport;

import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import com.moveatlas.rpc.transport.RpcTransport.RpcException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HttpRpcTransportTest {

    @Test
    void resultIsUnwrapped() {
        JsonElement result = HttpRpcTransport.unwrap("m",
                JsonParser.parseString("{\"jsonrpc\": \"2.0\", \"id\": 1, \"result\": {\"a\": 1}}"));
        assertEquals(1, result.getAsJsonObject().get("a").getAsInt());
    }

    @Test
    void errorCarriesCodeAndMethod() {
        RpcException e = assertThrows(RpcException.class, () -> HttpRpcTransport.unwrap("sui_getObject",
                JsonParser.parseString("{\"error\": {\"code\": -32602, \"message\": \"Invalid params\"}}")));
        assertEquals(-32602, e.getCode());
        assertTrue(e.getMessage().startsWith("sui_getObject"));
        assertTrue(e.getMessage().contains("Invalid params"));
    }

    @Test
    void missingResultIsAnError() {
        assertThrows(RpcException.class, () -> HttpRpcTransport.unwrap("m", JsonParser.parseString("{\"id\": 1}")));
        assertThrows(RpcException.class, () -> HttpRpcTransport.unwrap("m", JsonParser.parseString("[1]")));
    }

    @Test
    void unreachableEndpointFails() {
        HttpRpcTransport transport = new HttpRpcTransport("http://127.0.0.1:1", 500);
        RpcException e = assertThrows(RpcException.class, () -> transport.call("m", null));
        assertNull(e.getCode());
    }
}

package com.moveatlas.rpc.transport;

import com.google.gson.JsonObject;

/**
 * Executes one GraphQL query and returns its {@code data} member.
 */
@FunctionalInterface
public interface GraphQlTransport {

    /**
     * @throws RpcTransport.RpcException on transport failure, errors in the response or missing data
     */
    JsonObject query(String query);
}

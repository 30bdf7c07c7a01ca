package com.moveatlas.rpc;

import com.moveatlas.engine.source.ChainSources;
import com.moveatlas.engine.source.ChainSourcesFactory;
import com.moveatlas.engine.source.Network;
import com.moveatlas.rpc.transport.HttpGraphQlTransport;
import com.moveatlas.rpc.transport.HttpRpcTransport;

import java.util.EnumMap;
import java.util.Map;

/**
 * Wires the JSON-RPC client and the GraphQL object source for each network.
 * Sources are created once per network and reused.
 */
public class SuiChainSourcesFactory implements ChainSourcesFactory {

    private final SuiEndpoints endpoints;
    private final Map<Network, ChainSources> cache = new EnumMap<>(Network.class);

    public SuiChainSourcesFactory(SuiEndpoints endpoints) {
        this.endpoints = endpoints;
    }

    public SuiChainSourcesFactory() {
        this(SuiEndpoints.fromEnvironment());
    }

    @Override
    public synchronized ChainSources forNetwork(Network network) {
        return cache.computeIfAbsent(network, this::create);
    }

    private ChainSources create(Network network) {
        SuiJsonRpcClient rpc = new SuiJsonRpcClient(new HttpRpcTransport(endpoints.rpcUrl(network)));
        String graphQlUrl = endpoints.graphQlUrl(network);
        SuiGraphQlObjectSource objects = new SuiGraphQlObjectSource(
                graphQlUrl != null ? new HttpGraphQlTransport(graphQlUrl) : null, network.id());
        System.err.println("[atlas-rpc] " + network.id() + " sources: rpc=" + endpoints.rpcUrl(network)
                + ", graphql=" + (graphQlUrl != null ? graphQlUrl : "none"));
        return new ChainSources(network, rpc, objects, rpc, rpc);
    }
}

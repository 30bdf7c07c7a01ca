package com.moveatlas.rpc;

import com.moveatlas.engine.source.Network;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * JSON-RPC and GraphQL endpoints per network.
 *
 * Defaults are the public full nodes; {@code SUI_RPC_URL_<NETWORK>} and
 * {@code SUI_GRAPHQL_URL_<NETWORK>} override them. GraphQL is only published for mainnet,
 * so the other networks have no GraphQL endpoint unless one is configured.
 */
public class SuiEndpoints {

    static final Map<Network, String> DEFAULT_RPC = new EnumMap<>(Map.of(
            Network.MAINNET, "https://fullnode.mainnet.sui.io:443",
            Network.TESTNET, "https://fullnode.testnet.sui.io:443",
            Network.DEVNET, "https://fullnode.devnet.sui.io:443"
    ));

    static final Map<Network, String> DEFAULT_GRAPHQL = new EnumMap<>(Map.of(
            Network.MAINNET, "https://sui-mainnet.mystenlabs.com/graphql"
    ));

    private final Map<String, String> env;

    public SuiEndpoints(Map<String, String> env) {
        this.env = env;
    }

    public static SuiEndpoints fromEnvironment() {
        return new SuiEndpoints(System.getenv());
    }

    public String rpcUrl(Network network) {
        String override = env.get("SUI_RPC_URL_" + network.name().toUpperCase(Locale.ROOT));
        return isSet(override) ? override : DEFAULT_RPC.get(network);
    }

    /** @return the GraphQL endpoint, or null when the network has none */
    public String graphQlUrl(Network network) {
        String override = env.get("SUI_GRAPHQL_URL_" + network.name().toUpperCase(Locale.ROOT));
        return isSet(override) ? override : DEFAULT_GRAPHQL.get(network);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}

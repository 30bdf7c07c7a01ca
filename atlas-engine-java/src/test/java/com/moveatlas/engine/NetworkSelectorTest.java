package com.moveatlas.engine;

import com.google.gson.JsonObject;
import com.moveatlas.engine.source.Network;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NetworkSelectorTest {

    private InMemoryChain mainnet;
    private InMemoryChain testnet;
    private NetworkSelector selector;

    @BeforeEach
    void setUp() {
        mainnet = new InMemoryChain();
        testnet = new InMemoryChain();
        selector = new NetworkSelector(network -> network == Network.MAINNET
                ? mainnet.sources(network)
                : testnet.sources(network));
    }

    private static Map<String, JsonObject> oneModule() {
        return Map.of("pool", new ModuleJson().build());
    }

    @Test
    void mainnetIsTriedFirst() {
        mainnet.packages.put("0xa", oneModule());
        testnet.packages.put("0xa", oneModule());
        assertEquals(Network.MAINNET, selector.select("0xa", null));
        assertTrue(testnet.moduleRequests.isEmpty());
    }

    @Test
    void fallsBackToTestnet() {
        testnet.packages.put("0xa", oneModule());
        assertEquals(Network.TESTNET, selector.select("0xa", null));
        assertEquals(1, mainnet.moduleRequests.size());
    }

    @Test
    void emptyModuleMapDoesNotResolve() {
        mainnet.packages.put("0xa", Map.of());
        testnet.packages.put("0xa", oneModule());
        assertEquals(Network.TESTNET, selector.select("0xa", null));
    }

    @Test
    void notFoundAnywhereNamesTriedNetworks() {
        NetworkSelector.PackageResolutionException e = assertThrows(
                NetworkSelector.PackageResolutionException.class, () -> selector.select("0xa", null));
        assertTrue(e.getMessage().contains("mainnet"));
        assertTrue(e.getMessage().contains("testnet"));
    }

    @Test
    void preferredNetworkHasNoFallback() {
        testnet.packages.put("0xa", oneModule());
        assertThrows(NetworkSelector.PackageResolutionException.class,
                () -> selector.select("0xa", Network.MAINNET));
        assertTrue(testnet.moduleRequests.isEmpty());

        assertEquals(Network.TESTNET, selector.select("0xa", Network.TESTNET));
    }
}

package com.moveatlas.engine.graph;

import com.moveatlas.engine.source.Network;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Block explorer URLs for packages and modules.
 */
public final class ExplorerLinks {

    private ExplorerLinks() {}

    public static Map<String, String> forPackage(String packageId, Network network) {
        Map<String, String> links = new LinkedHashMap<>();
        links.put("suiscan", "https://" + subdomain(network, "suiscan.xyz") + "/object/" + packageId);
        links.put("suiexplorer", "https://suiexplorer.com/object/" + packageId + networkParam(network));
        links.put("suivision", "https://" + subdomain(network, "suivision.xyz") + "/package/" + packageId);
        return links;
    }

    public static Map<String, String> forModule(String packageId, String module, Network network) {
        Map<String, String> links = new LinkedHashMap<>();
        links.put("suiscan", "https://" + subdomain(network, "suiscan.xyz")
                + "/object/" + packageId + "/contracts?module=" + module);
        links.put("suiexplorer", "https://suiexplorer.com/object/" + packageId + networkParam(network) + "#" + module);
        return links;
    }

    private static String subdomain(Network network, String domain) {
        return network == null || network == Network.MAINNET ? domain : network.id() + "." + domain;
    }

    private static String networkParam(Network network) {
        return network == null || network == Network.MAINNET ? "" : "?network=" + network.id();
    }
}

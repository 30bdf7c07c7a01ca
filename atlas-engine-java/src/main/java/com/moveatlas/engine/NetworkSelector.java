package com.moveatlas.engine;

import com.google.gson.JsonObject;
import com.moveatlas.engine.ProgressListener.AnalysisCancelledException;
import com.moveatlas.engine.source.ChainSourcesFactory;
import com.moveatlas.engine.source.Network;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Finds the network a package is published on by asking each candidate's module source.
 */
public class NetworkSelector {

    public static final List<Network> CANDIDATES = List.of(Network.MAINNET, Network.TESTNET);

    public static class PackageResolutionException extends RuntimeException {
        public PackageResolutionException(String msg) { super(msg); }
        public PackageResolutionException(String msg, Throwable cause) { super(msg, cause); }
    }

    /** The network a package was found on, with the modules fetched there. */
    public record Resolution(Network network, Map<String, JsonObject> modules) {}

    private final ChainSourcesFactory sourcesFactory;

    public NetworkSelector(ChainSourcesFactory sourcesFactory) {
        this.sourcesFactory = sourcesFactory;
    }

    /**
     * @see #resolve(String, Network)
     */
    public Network select(String packageId, Network preferred) {
        return resolve(packageId, preferred).network();
    }

    /**
     * A preferred network is the only one tried. Otherwise mainnet then testnet.
     *
     * @throws PackageResolutionException if the package resolves on none of the tried networks
     */
    public Resolution resolve(String packageId, Network preferred) {
        if (preferred != null) {
            try {
                Map<String, JsonObject> modules = fetch(packageId, preferred);
                if (modules != null) return new Resolution(preferred, modules);
            } catch (AnalysisCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new PackageResolutionException(
                        "Package " + packageId + " not found on " + preferred.id() + ": " + e.getMessage(), e);
            }
            throw new PackageResolutionException("Package " + packageId + " has no modules on " + preferred.id());
        }

        List<String> tried = new ArrayList<>();
        for (Network candidate : CANDIDATES) {
            tried.add(candidate.id());
            try {
                Map<String, JsonObject> modules = fetch(packageId, candidate);
                if (modules != null) {
                    System.err.println("[atlas-engine] Package " + packageId + " found on " + candidate.id());
                    return new Resolution(candidate, modules);
                }
            } catch (AnalysisCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                System.err.println("[atlas-engine] Package " + packageId + " not on " + candidate.id()
                        + ": " + e.getMessage());
            }
        }
        throw new PackageResolutionException(
                "Package " + packageId + " not found on any network (tried " + String.join(", ", tried) + ")");
    }

    /** Modules of the package on the network, or null when it has none. */
    private Map<String, JsonObject> fetch(String packageId, Network network) {
        Map<String, JsonObject> modules = sourcesFactory.forNetwork(network).modules().getNormalizedModules(packageId);
        return modules != null && !modules.isEmpty() ? modules : null;
    }
}

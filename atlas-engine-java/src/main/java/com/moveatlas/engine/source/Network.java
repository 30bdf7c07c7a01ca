package com.moveatlas.engine.source;

import java.util.Locale;

/**
 * Sui networks a package can be resolved on.
 */
public enum Network {
    MAINNET,
    TESTNET,
    DEVNET;

    /** Lower-case wire name ("mainnet"). */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a network name case-insensitively.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static Network fromId(String id) {
        for (Network n : values()) {
            if (n.id().equalsIgnoreCase(id)) return n;
        }
        throw new IllegalArgumentException("Unknown network: " + id);
    }
}

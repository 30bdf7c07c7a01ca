package com.moveatlas.engine.discovery;

import com.moveatlas.engine.graph.NodeIds;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Classifies struct types as critical: capabilities and treasury-like state that warrant
 * exhaustive object discovery and a CriticalType flag.
 *
 * Two sets are kept apart and combined at decision time: the versioned built-in table and
 * the user-provided substrings from the analysis config.
 */
public final class CriticalTypes {

    /** Bump when {@link #BUILT_IN} changes so stored analyses can be told apart. */
    public static final int TABLE_VERSION = 1;

    public static final List<String> BUILT_IN = List.of(
        "AdminCap",
        "UpgradeCap",
        "TreasuryCap",
        "State",
        "Config",
        "Treasury",
        "Vault",
        "Registry"
    );

    /** Any short name ending with this suffix is a capability. */
    public static final String CAP_SUFFIX = "Cap";

    private final Set<String> userTypes;

    public CriticalTypes(Collection<String> userTypes) {
        Set<String> cleaned = new LinkedHashSet<>();
        if (userTypes != null) {
            for (String t : userTypes) {
                if (t != null && !t.isBlank()) cleaned.add(t);
            }
        }
        this.userTypes = Collections.unmodifiableSet(cleaned);
    }

    public static CriticalTypes builtInOnly() {
        return new CriticalTypes(List.of());
    }

    public Set<String> userTypes() { return userTypes; }

    /**
     * Discovery-time check on a fully-qualified type: user substrings match anywhere in the FQN,
     * built-in rules look at the short name only.
     */
    public boolean isCritical(String typeFqn) {
        for (String user : userTypes) {
            if (typeFqn.contains(user)) return true;
        }
        return matchesBuiltIn(NodeIds.shortName(typeFqn));
    }

    /**
     * Parse-time check on a struct's short name (case-sensitive substring match).
     */
    public boolean matchesStructName(String structName) {
        for (String user : userTypes) {
            if (structName.contains(user)) return true;
        }
        return matchesBuiltIn(structName);
    }

    private static boolean matchesBuiltIn(String shortName) {
        if (shortName.endsWith(CAP_SUFFIX)) return true;
        for (String builtIn : BUILT_IN) {
            if (shortName.contains(builtIn)) return true;
        }
        return false;
    }
}

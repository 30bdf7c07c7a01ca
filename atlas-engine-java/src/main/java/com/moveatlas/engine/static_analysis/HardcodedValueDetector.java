package com.moveatlas.engine.static_analysis;

import com.moveatlas.engine.graph.GraphModel.Flag;
import com.moveatlas.engine.graph.GraphModel.FlagScope;
import com.moveatlas.engine.graph.GraphModel.ModuleConstant;
import com.moveatlas.engine.graph.GraphModel.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Flags constants that look like hardcoded addresses, fees or roles.
 */
public class HardcodedValueDetector {

    private static final Set<String> SYSTEM_ADDRESSES = Set.of("0x0", "0x1", "0x2");
    private static final Set<String> AMOUNT_TYPES = Set.of("u64", "u128", "U64", "U128");

    public List<Flag> detect(String moduleId, List<ModuleConstant> constants) {
        List<Flag> flags = new ArrayList<>();
        for (ModuleConstant constant : constants) {
            String lowerName = constant.name.toLowerCase(Locale.ROOT);

            if (constant.type.contains("address") || constant.type.contains("Address")) {
                String value = String.valueOf(constant.value);
                if (value.startsWith("0x") && !SYSTEM_ADDRESSES.contains(value)) {
                    flags.add(flag(Severity.MED, "HardcodedAddress", moduleId, constant,
                            "Hardcoded address detected - potential centralization risk"));
                }
            }

            if (AMOUNT_TYPES.contains(constant.type)
                    && (lowerName.contains("fee") || lowerName.contains("amount") || lowerName.contains("price"))) {
                flags.add(flag(Severity.LOW, "HardcodedFee", moduleId, constant,
                        "Hardcoded fee or amount - consider making it configurable"));
            }

            if (lowerName.contains("role") || lowerName.contains("admin") || lowerName.contains("owner")) {
                flags.add(flag(Severity.MED, "HardcodedRole", moduleId, constant,
                        "Hardcoded role detected - verify access control"));
            }
        }
        return flags;
    }

    private static Flag flag(Severity level, String kind, String moduleId, ModuleConstant constant, String message) {
        return new Flag(level, kind, FlagScope.MODULE, moduleId)
                .detail("constName", constant.name)
                .detail("value", constant.value)
                .detail("message", message);
    }
}

package com.moveatlas.engine.security;

import com.moveatlas.engine.graph.GraphBuilder;
import com.moveatlas.engine.graph.GraphModel.*;
import com.moveatlas.engine.graph.NodeIds;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Pattern-based findings over a package's assembled modules, types and objects.
 * Every rule is evaluated independently; one entity may trigger several flags.
 */
public class SecurityFlagDetector {

    static final Set<String> PAUSE_FUNCTIONS = Set.of("pause", "unpause", "set_pause");
    static final List<String> SINGLE_OWNER_CAPS = List.of("AdminCap", "UpgradeCap", "TreasuryCap");

    public List<Flag> detect(GraphBuilder graph) {
        List<Flag> flags = new ArrayList<>();
        for (ModuleNode module : graph.modules()) {
            if (module.placeholder) continue;
            List<Flag> moduleFlags = checkModule(module);
            for (Flag flag : moduleFlags) {
                if (!module.flags.contains(flag.kind)) module.flags.add(flag.kind);
            }
            flags.addAll(moduleFlags);
        }
        for (TypeNode type : graph.types()) {
            if (!type.placeholder) flags.addAll(checkType(type));
        }
        for (ObjectNode object : graph.objects()) {
            flags.addAll(checkObject(object));
        }
        flags.forEach(graph::addFlag);
        System.err.println("[atlas-engine] Security flags: " + flags.size());
        return flags;
    }

    List<Flag> checkModule(ModuleNode module) {
        List<Flag> flags = new ArrayList<>();
        for (String typeFqn : module.typesDefined) {
            String name = NodeIds.shortName(typeFqn);
            if (name.contains("AdminCap")) {
                flags.add(moduleFlag(Severity.HIGH, "AdminCap", module,
                        "Module defines admin capability " + name));
            }
            if (name.contains("UpgradeCap")) {
                flags.add(moduleFlag(Severity.HIGH, "UpgradeCap", module,
                        "Module defines upgrade capability " + name));
            }
        }
        for (FunctionSummary fn : module.functions) {
            String name = fn.name.toLowerCase(Locale.ROOT);
            if (name.contains("mint")) {
                flags.add(moduleFlag(Severity.MED, "MintFunction", module, "Mint function " + fn.name));
            }
            if (name.contains("burn")) {
                flags.add(moduleFlag(Severity.MED, "BurnFunction", module, "Burn function " + fn.name));
            }
            if (PAUSE_FUNCTIONS.contains(name)) {
                flags.add(moduleFlag(Severity.MED, "PauseFunction", module, "Pause control " + fn.name));
            }
            if (name.contains("set_fee") || name.contains("update_fee")) {
                flags.add(moduleFlag(Severity.LOW, "SetFeeFunction", module, "Fee can be changed by " + fn.name));
            }
            if (name.contains("blacklist") || name.contains("whitelist")) {
                flags.add(moduleFlag(Severity.MED, "BlacklistFunction", module, "Access list control " + fn.name));
            }
        }
        return flags;
    }

    List<Flag> checkType(TypeNode type) {
        List<Flag> flags = new ArrayList<>();
        if (!type.hasKey && type.abilities.contains("Store")) {
            flags.add(new Flag(Severity.LOW, "StoreWithoutKey", FlagScope.TYPE, type.id)
                    .detail("message", "Storable value without key ability: " + type.fqn));
        }
        if (type.abilities.contains("Drop")) {
            flags.add(new Flag(Severity.LOW, "Droppable", FlagScope.TYPE, type.id)
                    .detail("message", "Values can be silently dropped: " + type.fqn));
        }
        return flags;
    }

    List<Flag> checkObject(ObjectNode object) {
        List<Flag> flags = new ArrayList<>();
        if (object.owner != null && object.owner.kind == OwnerKind.ADDRESS_OWNER) {
            for (String cap : SINGLE_OWNER_CAPS) {
                if (object.typeFqn.contains(cap)) {
                    flags.add(new Flag(Severity.HIGH, "SingleOwnerCap", FlagScope.OBJECT, object.id)
                            .detail("message", cap + " held by a single address")
                            .detail("type", object.typeFqn)
                            .detail("owner", object.owner.address));
                    break;
                }
            }
        }
        if (object.shared && object.typeFqn.contains("Treasury")) {
            flags.add(new Flag(Severity.HIGH, "UnsafeShared", FlagScope.OBJECT, object.id)
                    .detail("message", "Treasury object is shared")
                    .detail("type", object.typeFqn));
        }
        return flags;
    }

    private static Flag moduleFlag(Severity level, String kind, ModuleNode module, String message) {
        return new Flag(level, kind, FlagScope.MODULE, module.id).detail("message", message);
    }
}

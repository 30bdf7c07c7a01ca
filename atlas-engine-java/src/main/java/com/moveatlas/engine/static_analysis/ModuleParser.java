package com.moveatlas.engine.static_analysis;

import com.google.gson.JsonObject;
import com.moveatlas.engine.discovery.CriticalTypes;
import com.moveatlas.engine.graph.ExplorerLinks;
import com.moveatlas.engine.graph.GraphBuilder;
import com.moveatlas.engine.graph.GraphModel.*;
import com.moveatlas.engine.graph.NodeIds;
import com.moveatlas.engine.static_analysis.ModuleDescriptor.FieldDescriptor;
import com.moveatlas.engine.static_analysis.ModuleDescriptor.FriendRef;
import com.moveatlas.engine.static_analysis.ModuleDescriptor.FunctionDescriptor;
import com.moveatlas.engine.static_analysis.ModuleDescriptor.StructDescriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns one package's normalized modules into module, type and intra-package edge records.
 *
 * Cross-package references are discovered from the struct types that appear in function
 * signatures; the callee function cannot be known from type references alone, so call
 * evidence carries a sentinel callee.
 */
public class ModuleParser {

    public static final String CALLEE_VIA_TYPE = "<via type reference>";
    public static final String CALLEE_INFERRED = "<inferred>";
    public static final String CALLER_DETECTED = "detected";

    private final ModuleDescriptorParser descriptorParser = new ModuleDescriptorParser();
    private final ConstantExtractor constantExtractor = new ConstantExtractor();
    private final HardcodedValueDetector hardcodedValueDetector = new HardcodedValueDetector();
    private final CriticalTypes criticalTypes;

    public ModuleParser(CriticalTypes criticalTypes) {
        this.criticalTypes = criticalTypes;
    }

    /**
     * Dependencies found while parsing: foreign package address → evidence that induced it.
     */
    public record ParsedPackage(int moduleCount, Map<String, List<DependencyEvidence>> packageDependencies) {}

    public ParsedPackage parse(String packageId, Map<String, JsonObject> normalizedModules, GraphBuilder graph) {
        Map<String, List<DependencyEvidence>> packageDependencies = new LinkedHashMap<>();
        int parsed = 0;

        for (Map.Entry<String, JsonObject> entry : normalizedModules.entrySet()) {
            String key = entry.getKey();
            String address;
            String module;
            if (key.contains("::")) {
                int sep = key.indexOf("::");
                address = key.substring(0, sep);
                module = key.substring(sep + 2);
            } else {
                address = packageId;
                module = key;
            }
            if (address.isEmpty() || module.isEmpty() || entry.getValue() == null) {
                System.err.println("[atlas-engine] WARNING: skipping invalid module name: " + key);
                continue;
            }

            ModuleDescriptor descriptor = descriptorParser.parse(key, entry.getValue());
            parseModule(address, module, descriptor, graph, packageDependencies);
            parsed++;
        }
        return new ParsedPackage(parsed, packageDependencies);
    }

    private void parseModule(
            String address,
            String moduleName,
            ModuleDescriptor descriptor,
            GraphBuilder graph,
            Map<String, List<DependencyEvidence>> packageDependencies) {

        String fqn = address + "::" + moduleName;
        String moduleId = NodeIds.forModule(fqn);
        String packageNodeId = graph.ensurePackage(address).id;

        ModuleNode node = new ModuleNode();
        node.id = moduleId;
        node.fullName = fqn;
        node.packageId = packageNodeId;
        node.name = moduleName;
        node.explorerLinks = ExplorerLinks.forModule(address, moduleName, graph.network());

        // dependent module FQN -> referenced from a parameter
        Map<String, Boolean> dependentModules = new LinkedHashMap<>();

        for (FunctionDescriptor fn : descriptor.functions()) {
            node.functions.add(summarize(fn));

            for (MoveType param : fn.parameters()) {
                for (String ref : param.referencedTypes()) {
                    String depFqn = recordDependency(address, moduleId, ref, packageDependencies);
                    if (depFqn != null) {
                        dependentModules.put(depFqn, true);
                    }
                }
            }
            for (MoveType ret : fn.returns()) {
                for (String ref : ret.referencedTypes()) {
                    String depFqn = recordDependency(address, moduleId, ref, packageDependencies);
                    if (depFqn != null) {
                        dependentModules.putIfAbsent(depFqn, false);
                    }
                }
            }
        }

        for (FriendRef friend : descriptor.friends()) {
            node.friends.add(friend.fqn());
            // callee grants the caller friend access
            graph.addEdge(EdgeKind.MOD_FRIEND_ALLOW, moduleId, NodeIds.forModule(friend.fqn()));
        }

        for (StructDescriptor struct : descriptor.structs()) {
            String typeFqn = fqn + "::" + struct.name();
            node.typesDefined.add(typeFqn);
            TypeNode type = buildType(typeFqn, moduleId, struct);
            graph.putType(type);
            graph.addEdge(EdgeKind.MOD_DEFINES_TYPE, moduleId, type.id);
            addFieldEdges(type, struct, graph);

            if (criticalTypes.matchesStructName(struct.name())) {
                addModuleFlagKind(node, "CriticalType");
                graph.addFlag(new Flag(Severity.MED, "CriticalType", FlagScope.TYPE, type.id)
                        .detail("structName", struct.name())
                        .detail("hasKey", type.hasKey)
                        .detail("abilities", new ArrayList<>(type.abilities)));
            }
        }

        List<ModuleConstant> constants = constantExtractor.extract(descriptor);
        for (Flag flag : hardcodedValueDetector.detect(moduleId, constants)) {
            graph.addFlag(flag);
            addModuleFlagKind(node, flag.kind);
        }
        node.constants = constants.isEmpty() ? null : constants;

        graph.putModule(node);
        graph.addEdge(EdgeKind.PKG_CONTAINS, packageNodeId, moduleId);

        for (Map.Entry<String, Boolean> dep : dependentModules.entrySet()) {
            String depFqn = dep.getKey();
            GraphEdge edge = graph.addEdge(EdgeKind.MOD_CALLS, moduleId, NodeIds.forModule(depFqn));
            edge.callType = classifyCall(depFqn, address, node.friends);
            String callee = dep.getValue() ? CALLEE_VIA_TYPE : CALLEE_INFERRED;
            edge.calls = new ArrayList<>(List.of(new CallEvidence(CALLER_DETECTED, depFqn, callee)));
        }
    }

    /**
     * Records a reference to a type in another package.
     *
     * @return the referenced module FQN, or null when the reference is local or not a struct FQN
     */
    private static String recordDependency(
            String address,
            String moduleId,
            String typeRef,
            Map<String, List<DependencyEvidence>> packageDependencies) {
        String depPackage = NodeIds.packageAddressOf(typeRef);
        String depModule = NodeIds.moduleNameOf(typeRef);
        if (depPackage == null || depModule == null || depPackage.equals(address)) {
            return null;
        }
        List<DependencyEvidence> evidence = packageDependencies.computeIfAbsent(depPackage, k -> new ArrayList<>());
        boolean seen = evidence.stream().anyMatch(e -> e.moduleId.equals(moduleId) && e.typeFqn.equals(typeRef));
        if (!seen) {
            evidence.add(new DependencyEvidence(moduleId, typeRef));
        }
        return depPackage + "::" + depModule;
    }

    static CallType classifyCall(String depFqn, String moduleAddress, List<String> friends) {
        if (friends.contains(depFqn)) {
            return CallType.FRIEND;
        }
        String depPackage = NodeIds.packageAddressOf(depFqn + "::");
        return moduleAddress.equals(depPackage) ? CallType.SAME_PACKAGE : CallType.EXTERNAL;
    }

    static Visibility classifyVisibility(FunctionDescriptor fn) {
        if (fn.isEntry()) return Visibility.ENTRY;
        if ("Friend".equals(fn.visibility())) return Visibility.FRIEND;
        if ("Private".equals(fn.visibility())) return Visibility.PRIVATE;
        return Visibility.PUBLIC;
    }

    private static FunctionSummary summarize(FunctionDescriptor fn) {
        FunctionSummary summary = new FunctionSummary();
        summary.name = fn.name();
        summary.visibility = classifyVisibility(fn);
        summary.isEntry = fn.isEntry();
        for (MoveType param : fn.parameters()) {
            summary.parameters.add(new Parameter("param", param.render()));
        }
        summary.returnType = fn.rawReturn() == null ? "void" : MoveType.GSON.toJson(fn.rawReturn());
        return summary;
    }

    private static TypeNode buildType(String typeFqn, String moduleId, StructDescriptor struct) {
        TypeNode type = new TypeNode();
        type.id = NodeIds.forType(typeFqn);
        type.fqn = typeFqn;
        type.moduleId = moduleId;
        type.abilities = new ArrayList<>(struct.abilities());
        type.hasKey = struct.abilities().contains("Key");
        for (FieldDescriptor field : struct.fields()) {
            type.fields.add(new FieldInfo(field.name(), field.type().render()));
        }
        return type;
    }

    /** One TYPE_USES_TYPE edge per distinct referenced type, tagged with the first field using it. */
    private static void addFieldEdges(TypeNode type, StructDescriptor struct, GraphBuilder graph) {
        Set<String> used = new LinkedHashSet<>();
        for (FieldDescriptor field : struct.fields()) {
            for (String usedFqn : field.type().referencedTypes()) {
                if (used.add(usedFqn)) {
                    GraphEdge edge = graph.addEdge(EdgeKind.TYPE_USES_TYPE, type.id, NodeIds.forType(usedFqn));
                    edge.fieldName = field.name();
                }
            }
        }
    }

    private static void addModuleFlagKind(ModuleNode node, String kind) {
        if (!node.flags.contains(kind)) {
            node.flags.add(kind);
        }
    }
}

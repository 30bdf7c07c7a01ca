package com.moveatlas.engine.graph;

import com.moveatlas.engine.graph.GraphModel.*;
import com.moveatlas.engine.source.Network;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Accumulates the nodes, edges, stats and flags of one package analysis.
 *
 * One builder is owned by exactly one in-flight package analysis and is finalized once
 * with {@link #build()}. Node maps are keyed by node ID.
 */
public class GraphBuilder {

    public static final String UNKNOWN_TYPE = "unknown";

    private final String rootPackageId;
    private final Network network;

    private final Map<String, PackageNode> packages = new LinkedHashMap<>();
    private final Map<String, ModuleNode> modules = new LinkedHashMap<>();
    private final Map<String, TypeNode> types = new LinkedHashMap<>();
    private final Map<String, ObjectNode> objects = new LinkedHashMap<>();
    private final Map<String, AddressNode> addresses = new LinkedHashMap<>();
    private final Map<String, EventNode> events = new LinkedHashMap<>();
    private final List<GraphEdge> edges = new ArrayList<>();
    private final Map<String, TypeStats> typeStats = new LinkedHashMap<>();
    private final List<Flag> flags = new ArrayList<>();
    private boolean built;

    public GraphBuilder(String rootPackageId, Network network) {
        this.rootPackageId = rootPackageId;
        this.network = network;
    }

    public String rootPackageId() { return rootPackageId; }
    public Network network()      { return network; }

    // --- Nodes ---

    /** Returns the package node for an address, creating it on first reference. */
    public PackageNode ensurePackage(String address) {
        return packages.computeIfAbsent(NodeIds.forPackage(address), id -> {
            PackageNode pkg = new PackageNode();
            pkg.id = id;
            pkg.address = address;
            pkg.displayName = address;
            pkg.explorerLinks = ExplorerLinks.forPackage(address, network);
            return pkg;
        });
    }

    public boolean hasPackage(String address) {
        return packages.containsKey(NodeIds.forPackage(address));
    }

    public void putModule(ModuleNode module)   { modules.put(module.id, module); }
    public void putType(TypeNode type)         { types.put(type.id, type); }
    public void putObject(ObjectNode object)   { objects.put(object.id, object); }
    public void putEvent(EventNode event)      { events.put(event.id, event); }

    public ModuleNode module(String moduleId)  { return modules.get(moduleId); }
    public boolean hasModuleFqn(String fqn)    { return modules.containsKey(NodeIds.forModule(fqn)); }
    public boolean hasObject(String objectId)  { return objects.containsKey(NodeIds.forObject(objectId)); }

    public Collection<PackageNode> packages()  { return packages.values(); }
    public Collection<ModuleNode> modules()    { return modules.values(); }
    public Collection<TypeNode> types()        { return types.values(); }
    public Collection<ObjectNode> objects()    { return objects.values(); }
    public Collection<AddressNode> addresses() { return addresses.values(); }
    public Collection<EventNode> events()      { return events.values(); }
    public List<GraphEdge> edges()             { return edges; }
    public List<Flag> flags()                  { return flags; }
    public Map<String, TypeStats> typeStats()  { return typeStats; }

    public AddressNode ensureAddress(String address) {
        return addresses.computeIfAbsent(NodeIds.forAddress(address), id -> {
            AddressNode node = new AddressNode();
            node.id = id;
            node.address = address;
            return node;
        });
    }

    /**
     * Minimal object node for an object that is referenced but was never fetched.
     * Existing nodes are left untouched.
     */
    public ObjectNode ensurePlaceholderObject(String objectId) {
        return objects.computeIfAbsent(NodeIds.forObject(objectId), id -> placeholderObject(objectId));
    }

    // --- Edges, flags, stats ---

    public GraphEdge addEdge(EdgeKind kind, String from, String to) {
        GraphEdge edge = new GraphEdge(kind, from, to);
        edges.add(edge);
        return edge;
    }

    public void addEdge(GraphEdge edge) {
        edges.add(edge);
    }

    public void addFlag(Flag flag) {
        flags.add(flag);
    }

    public void putTypeStats(TypeStats stats) {
        typeStats.put(stats.typeFqn, stats);
    }

    // --- Finalize ---

    /**
     * Finalize into a {@link Graph}. Edge endpoints without a node receive a placeholder node
     * so that every edge references an entity in the graph.
     *
     * @throws IllegalStateException if called twice
     */
    public Graph build() {
        if (built) {
            throw new IllegalStateException("graph for " + rootPackageId + " already built");
        }
        built = true;

        for (GraphEdge edge : edges) {
            materialize(edge.from);
            materialize(edge.to);
        }

        Graph graph = new Graph();
        graph.packages = new ArrayList<>(packages.values());
        graph.modules = new ArrayList<>(modules.values());
        graph.types = new ArrayList<>(types.values());
        graph.objects = new ArrayList<>(objects.values());
        graph.addresses = new ArrayList<>(addresses.values());
        graph.events = new ArrayList<>(events.values());
        graph.edges = new ArrayList<>(edges);
        graph.flags = new ArrayList<>(flags);
        graph.stats.types = new LinkedHashMap<>(typeStats);
        graph.stats.risk = riskOf(flags);

        PackageNode root = packages.get(NodeIds.forPackage(rootPackageId));
        if (root != null) {
            root.stats = rootStats();
        }
        return graph;
    }

    private PackageStats rootStats() {
        String rootId = NodeIds.forPackage(rootPackageId);
        PackageStats stats = new PackageStats();
        for (ModuleNode m : modules.values()) {
            if (!m.placeholder && rootId.equals(m.packageId)) {
                stats.modules++;
                stats.types += m.typesDefined.size();
            }
        }
        stats.recentEvents = events.size();
        return stats;
    }

    static Risk riskOf(List<Flag> flags) {
        Map<String, Set<String>> byModule = new LinkedHashMap<>();
        Map<String, Set<String>> byObject = new LinkedHashMap<>();
        for (Flag flag : flags) {
            if (flag.scope == FlagScope.MODULE && flag.refId != null) {
                String fqn = NodeIds.strip(flag.refId, NodeIds.MODULE);
                byModule.computeIfAbsent(fqn, k -> new LinkedHashSet<>()).add(flag.kind);
            } else if (flag.scope == FlagScope.OBJECT && flag.refId != null) {
                String objectId = NodeIds.strip(flag.refId, NodeIds.OBJECT);
                byObject.computeIfAbsent(objectId, k -> new LinkedHashSet<>()).add(flag.kind);
            }
        }
        Risk risk = new Risk();
        byModule.forEach((k, v) -> risk.modules.put(k, new ArrayList<>(v)));
        byObject.forEach((k, v) -> risk.objects.put(k, new ArrayList<>(v)));
        return risk;
    }

    private void materialize(String id) {
        if (id == null) return;
        if (id.startsWith(NodeIds.PACKAGE)) {
            ensurePackage(NodeIds.strip(id, NodeIds.PACKAGE));
        } else if (id.startsWith(NodeIds.MODULE)) {
            if (!modules.containsKey(id)) {
                ModuleNode placeholder = placeholderModule(NodeIds.strip(id, NodeIds.MODULE));
                modules.put(id, placeholder);
                if (placeholder.packageId != null) {
                    ensurePackage(NodeIds.strip(placeholder.packageId, NodeIds.PACKAGE));
                }
            }
        } else if (id.startsWith(NodeIds.TYPE)) {
            types.computeIfAbsent(id, k -> placeholderType(NodeIds.strip(k, NodeIds.TYPE)));
        } else if (id.startsWith(NodeIds.OBJECT)) {
            ensurePlaceholderObject(NodeIds.strip(id, NodeIds.OBJECT));
        } else if (id.startsWith(NodeIds.ADDRESS)) {
            ensureAddress(NodeIds.strip(id, NodeIds.ADDRESS));
        } else if (id.startsWith(NodeIds.EVENT) && !events.containsKey(id)) {
            System.err.println("[atlas-engine] WARNING: edge references unknown event " + id);
        }
    }

    static ModuleNode placeholderModule(String fqn) {
        ModuleNode m = new ModuleNode();
        m.id = NodeIds.forModule(fqn);
        m.fullName = fqn;
        int sep = fqn.indexOf("::");
        m.packageId = sep > 0 ? NodeIds.forPackage(fqn.substring(0, sep)) : null;
        m.name = sep > 0 ? fqn.substring(sep + 2) : fqn;
        m.placeholder = true;
        return m;
    }

    static TypeNode placeholderType(String fqn) {
        TypeNode t = new TypeNode();
        t.id = NodeIds.forType(fqn);
        t.fqn = fqn;
        String moduleFqn = NodeIds.moduleFqnOf(fqn);
        t.moduleId = moduleFqn != null ? NodeIds.forModule(moduleFqn) : null;
        t.hasKey = false;
        t.placeholder = true;
        return t;
    }

    static ObjectNode placeholderObject(String objectId) {
        ObjectNode o = new ObjectNode();
        o.id = NodeIds.forObject(objectId);
        o.objectId = objectId;
        o.typeFqn = UNKNOWN_TYPE;
        o.owner = new Owner(OwnerKind.SHARED, null);
        o.shared = false;
        return o;
    }
}

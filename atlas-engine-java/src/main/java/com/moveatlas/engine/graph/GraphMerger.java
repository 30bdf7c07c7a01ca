package com.moveatlas.engine.graph;

import com.moveatlas.engine.graph.GraphModel.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds per-package graphs into one graph.
 *
 * Nodes are unioned by id with the later graph winning, except that a placeholder never
 * replaces a real node and a package without stats never replaces one with stats.
 * Edges are deduplicated by (kind, from, to), first occurrence wins. Type stats are unioned
 * by FQN (last wins) and flags are concatenated. Merging a graph with itself is a no-op on
 * the node and edge sets.
 */
public class GraphMerger {

    public Graph merge(List<Graph> graphs) {
        Map<String, PackageNode> packages = new LinkedHashMap<>();
        Map<String, ModuleNode> modules = new LinkedHashMap<>();
        Map<String, TypeNode> types = new LinkedHashMap<>();
        Map<String, ObjectNode> objects = new LinkedHashMap<>();
        Map<String, AddressNode> addresses = new LinkedHashMap<>();
        Map<String, EventNode> events = new LinkedHashMap<>();
        Map<String, GraphEdge> edges = new LinkedHashMap<>();
        Map<String, TypeStats> typeStats = new LinkedHashMap<>();
        List<Flag> flags = new ArrayList<>();

        for (Graph g : graphs) {
            for (PackageNode p : g.packages) {
                PackageNode existing = packages.get(p.id);
                if (existing == null || p.stats != null || existing.stats == null) {
                    packages.put(p.id, p);
                }
            }
            for (ModuleNode m : g.modules) {
                ModuleNode existing = modules.get(m.id);
                if (existing != null && m.placeholder && !existing.placeholder) continue;
                if (existing != null && !existing.placeholder && !m.placeholder
                        && existing != m) {
                    System.err.println("[atlas-engine] WARNING: duplicate module " + m.fullName
                            + " across sub-analyses, keeping the later one");
                }
                modules.put(m.id, m);
            }
            for (TypeNode t : g.types) {
                TypeNode existing = types.get(t.id);
                if (existing != null && t.placeholder && !existing.placeholder) continue;
                types.put(t.id, t);
            }
            for (ObjectNode o : g.objects) {
                ObjectNode existing = objects.get(o.id);
                if (existing != null && isPlaceholder(o) && !isPlaceholder(existing)) continue;
                objects.put(o.id, o);
            }
            g.addresses.forEach(a -> addresses.put(a.id, a));
            g.events.forEach(e -> events.put(e.id, e));
            for (GraphEdge e : g.edges) {
                edges.putIfAbsent(e.key(), e);
            }
            if (g.stats != null) {
                typeStats.putAll(g.stats.types);
            }
            flags.addAll(g.flags);
        }

        Graph merged = new Graph();
        merged.packages = new ArrayList<>(packages.values());
        merged.modules = new ArrayList<>(modules.values());
        merged.types = new ArrayList<>(types.values());
        merged.objects = new ArrayList<>(objects.values());
        merged.addresses = new ArrayList<>(addresses.values());
        merged.events = new ArrayList<>(events.values());
        merged.edges = new ArrayList<>(edges.values());
        merged.stats.types = typeStats;
        merged.stats.risk = GraphBuilder.riskOf(flags);
        merged.flags = flags;
        return merged;
    }

    static boolean isPlaceholder(ObjectNode o) {
        return GraphBuilder.UNKNOWN_TYPE.equals(o.typeFqn) && o.version == null && o.snapshot == null;
    }
}

package com.moveatlas.engine.graph;

import com.moveatlas.engine.graph.GraphModel.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Read-only lookups over a finished graph for on-demand inspection of one module, type,
 * object or edge. Lookups accept either the bare name or the prefixed node id.
 */
public class GraphInspector {

    public static final int MAX_SAMPLES = 10;

    private final Graph graph;

    public GraphInspector(Graph graph) {
        this.graph = graph;
    }

    public record ModuleView(
            ModuleNode module,
            List<TypeNode> types,
            List<String> outgoingCalls,
            List<String> incomingCalls,
            List<String> friends,
            List<Flag> flags
    ) {}

    public record TypeView(
            TypeNode type,
            TypeStats stats,
            List<String> samples,
            int objectCount,
            String definedBy,
            List<String> usesTypes
    ) {}

    public record ObjectView(
            ObjectNode object,
            List<String> parents,
            List<String> children,
            List<String> refs,
            List<Flag> flags
    ) {}

    public Optional<ModuleView> module(String fqnOrId) {
        ModuleNode module = null;
        for (ModuleNode m : graph.modules) {
            if (fqnOrId.equals(m.fullName) || fqnOrId.equals(m.id)) {
                module = m;
                break;
            }
        }
        if (module == null) return Optional.empty();

        List<TypeNode> types = new ArrayList<>();
        for (TypeNode t : graph.types) {
            if (module.id.equals(t.moduleId)) types.add(t);
        }
        List<String> outgoing = new ArrayList<>();
        List<String> incoming = new ArrayList<>();
        List<String> friends = new ArrayList<>();
        for (GraphEdge e : graph.edges) {
            if (e.kind == EdgeKind.MOD_CALLS && e.from.equals(module.id)) outgoing.add(e.to);
            if (e.kind == EdgeKind.MOD_CALLS && e.to.equals(module.id)) incoming.add(e.from);
            if (e.kind == EdgeKind.MOD_FRIEND_ALLOW && e.from.equals(module.id)) friends.add(e.to);
        }
        return Optional.of(new ModuleView(module, types, outgoing, incoming, friends, flagsFor(module.id)));
    }

    /** Matches the exact FQN, the prefixed id, then the FQN ignoring case. */
    public Optional<TypeView> type(String fqnOrId) {
        TypeNode type = null;
        for (TypeNode t : graph.types) {
            if (fqnOrId.equals(t.fqn) || fqnOrId.equals(t.id)) {
                type = t;
                break;
            }
        }
        if (type == null) {
            String lower = fqnOrId.toLowerCase(Locale.ROOT);
            for (TypeNode t : graph.types) {
                if (t.fqn.toLowerCase(Locale.ROOT).equals(lower)) {
                    type = t;
                    break;
                }
            }
        }
        if (type == null) return Optional.empty();

        String definedBy = null;
        for (ModuleNode m : graph.modules) {
            if (type.fqn.startsWith(m.fullName + "::")) {
                definedBy = m.fullName;
                break;
            }
        }

        List<String> usesTypes = new ArrayList<>();
        for (GraphEdge e : graph.edges) {
            if (e.kind != EdgeKind.TYPE_USES_TYPE || !e.from.equals(type.id)) continue;
            for (TypeNode t : graph.types) {
                if (t.id.equals(e.to)) {
                    usesTypes.add(t.fqn);
                    break;
                }
            }
        }

        List<String> samples = new ArrayList<>();
        int objectCount = 0;
        for (ObjectNode o : graph.objects) {
            if (!type.fqn.equals(o.typeFqn)) continue;
            objectCount++;
            if (samples.size() < MAX_SAMPLES) samples.add(o.objectId);
        }
        TypeStats stats = graph.stats.types.get(type.fqn);
        return Optional.of(new TypeView(type, stats, samples, objectCount, definedBy, usesTypes));
    }

    public Optional<ObjectView> object(String objectIdOrId) {
        ObjectNode object = null;
        for (ObjectNode o : graph.objects) {
            if (objectIdOrId.equals(o.objectId) || objectIdOrId.equals(o.id)) {
                object = o;
                break;
            }
        }
        if (object == null) return Optional.empty();

        List<String> parents = new ArrayList<>();
        List<String> children = new ArrayList<>();
        List<String> refs = new ArrayList<>();
        for (GraphEdge e : graph.edges) {
            if (e.kind == EdgeKind.OBJ_DF_CHILD) {
                if (e.to.equals(object.id)) parents.add(e.from);
                if (e.from.equals(object.id)) children.add(e.to);
            } else if (e.kind == EdgeKind.OBJ_REFERS_OBJ) {
                if (e.from.equals(object.id)) refs.add(e.to);
                else if (e.to.equals(object.id)) refs.add(e.from);
            }
        }
        return Optional.of(new ObjectView(object, parents, children, refs, flagsFor(object.id)));
    }

    /** First edge between the two node ids, any kind. */
    public Optional<GraphEdge> edge(String from, String to) {
        for (GraphEdge e : graph.edges) {
            if (e.from.equals(from) && e.to.equals(to)) return Optional.of(e);
        }
        return Optional.empty();
    }

    private List<Flag> flagsFor(String refId) {
        List<Flag> flags = new ArrayList<>();
        for (Flag f : graph.flags) {
            if (refId.equals(f.refId)) flags.add(f);
        }
        return flags;
    }
}

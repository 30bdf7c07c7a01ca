package com.moveatlas.engine.discovery;

import com.moveatlas.engine.ProgressListener.AnalysisCancelledException;
import com.moveatlas.engine.config.AnalysisConfig;
import com.moveatlas.engine.graph.GraphBuilder;
import com.moveatlas.engine.graph.GraphModel.*;
import com.moveatlas.engine.graph.NodeIds;
import com.moveatlas.engine.source.ChainObject;
import com.moveatlas.engine.source.DynamicFieldSource;
import com.moveatlas.engine.source.DynamicFieldSource.ObjectDetail;
import com.moveatlas.engine.source.ObjectPageSource;
import com.moveatlas.engine.source.ObjectPageSource.CountEstimate;
import com.moveatlas.engine.source.ObjectPageSource.ObjectPage;
import com.moveatlas.engine.source.OwnerInfo;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Materializes on-chain instances of every key-capable type in a package graph.
 *
 * Failures are contained: a failing type yields no objects and no stats, a failing object
 * is skipped, a failing dynamic-field lookup drops only that object's children.
 */
public class ObjectDiscovery {

    public static final int PAGE_SIZE = 50;
    public static final int MAX_PAGES = 100;

    private final ObjectPageSource objectSource;
    private final DynamicFieldSource dynamicFieldSource;
    private final AnalysisConfig config;
    private final CriticalTypes criticalTypes;

    public ObjectDiscovery(
            ObjectPageSource objectSource,
            DynamicFieldSource dynamicFieldSource,
            AnalysisConfig config,
            CriticalTypes criticalTypes) {
        this.objectSource = objectSource;
        this.dynamicFieldSource = dynamicFieldSource;
        this.config = config;
        this.criticalTypes = criticalTypes;
    }

    public record DiscoveryResult(int typesExamined, int typesFailed, int objectsAdded) {}

    public DiscoveryResult discover(GraphBuilder graph) {
        List<TypeNode> keyTypes = new ArrayList<>();
        for (TypeNode type : graph.types()) {
            if (type.hasKey && !type.placeholder) keyTypes.add(type);
        }

        int failed = 0;
        int added = 0;
        for (TypeNode type : keyTypes) {
            try {
                added += discoverType(type, graph);
            } catch (AnalysisCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                failed++;
                System.err.println("[atlas-engine] WARNING: object discovery failed for " + type.fqn
                        + ": " + e.getMessage());
            }
        }
        System.err.println("[atlas-engine] Object discovery: " + keyTypes.size() + " key types, "
                + added + " objects, " + failed + " failed");
        return new DiscoveryResult(keyTypes.size(), failed, added);
    }

    private int discoverType(TypeNode type, GraphBuilder graph) {
        boolean critical = criticalTypes.isCritical(type.fqn);
        CountEstimate estimate = objectSource.estimateCount(type.fqn);
        FetchStrategy strategy = FetchStrategy.select(critical, estimate, config);
        List<ChainObject> fetched = fetchObjects(type.fqn, strategy.limit());

        int added = 0;
        int shared = 0;
        Set<String> owners = new HashSet<>();
        for (ChainObject object : fetched) {
            try {
                ObjectNode node = addObject(object, type, graph);
                added++;
                if (node.shared) shared++;
                if (node.owner.address != null) owners.add(node.owner.address);
            } catch (AnalysisCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                System.err.println("[atlas-engine] WARNING: skipping object " + object.objectId()
                        + " of " + type.fqn + ": " + e.getMessage());
            }
        }

        TypeStats stats = new TypeStats();
        stats.typeFqn = type.fqn;
        stats.count = reconcileCount(estimate, fetched.size());
        stats.sampled = fetched.size();
        stats.shared = shared;
        stats.uniqueOwners = owners.size();
        graph.putTypeStats(stats);
        return added;
    }

    /**
     * Best-effort total: when more pages exist the estimate is the floor, raised by any overshoot
     * of what was actually fetched. Approximate whenever the source reported more pages.
     */
    static long reconcileCount(CountEstimate estimate, int fetched) {
        if (!estimate.hasMore()) return fetched;
        return estimate.estimatedCount() + (long) Math.max(0, fetched - estimate.estimatedCount());
    }

    List<ChainObject> fetchObjects(String typeFqn, int limit) {
        List<ChainObject> fetched = new ArrayList<>();
        String cursor = null;
        int pages = 0;
        while (fetched.size() < limit && pages < MAX_PAGES) {
            ObjectPage page = objectSource.queryPage(typeFqn, PAGE_SIZE, cursor);
            pages++;
            fetched.addAll(page.objects());
            if (!page.hasNextPage() || page.nextCursor() == null) break;
            cursor = page.nextCursor();
        }
        if (pages >= MAX_PAGES && fetched.size() < limit) {
            System.err.println("[atlas-engine] WARNING: page cap reached for " + typeFqn
                    + " after " + fetched.size() + " objects");
        }
        return fetched.size() > limit ? new ArrayList<>(fetched.subList(0, limit)) : fetched;
    }

    private ObjectNode addObject(ChainObject object, TypeNode type, GraphBuilder graph) {
        if (object.objectId() == null || object.owner() == null) {
            throw new IllegalArgumentException("object without id or owner");
        }
        ObjectNode node = new ObjectNode();
        node.id = NodeIds.forObject(object.objectId());
        node.objectId = object.objectId();
        node.typeFqn = type.fqn;
        node.owner = toOwner(object.owner());
        node.shared = object.owner().kind() == OwnerKind.SHARED;
        node.version = object.version();
        node.digest = object.digest();
        node.snapshot = object.content();
        graph.putObject(node);

        graph.addEdge(EdgeKind.OBJ_INSTANCE_OF, node.id, type.id);
        linkOwner(node, graph);

        for (String referenced : SnapshotScanner.scan(object.content())) {
            if (referenced.equals(object.objectId())) continue;
            graph.ensurePlaceholderObject(referenced);
            graph.addEdge(EdgeKind.OBJ_REFERS_OBJ, node.id, NodeIds.forObject(referenced));
        }

        if (config.getMaxObjDepth() > 0) {
            expandDynamicFields(object.objectId(), graph);
        }
        return node;
    }

    /**
     * Breadth-first walk over dynamic-field children, {@code maxObjDepth} levels deep.
     * Known children are linked but not fetched again.
     */
    private void expandDynamicFields(String rootObjectId, GraphBuilder graph) {
        record Pending(String objectId, int depth) {}
        Deque<Pending> queue = new ArrayDeque<>();
        queue.add(new Pending(rootObjectId, 1));
        Set<String> expanded = new HashSet<>();

        while (!queue.isEmpty()) {
            Pending parent = queue.poll();
            if (!expanded.add(parent.objectId())) continue;

            List<String> children;
            try {
                children = dynamicFieldSource.listDynamicFields(parent.objectId());
            } catch (AnalysisCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                System.err.println("[atlas-engine] WARNING: dynamic fields unavailable for "
                        + parent.objectId() + ": " + e.getMessage());
                continue;
            }

            for (String childId : children) {
                String parentNodeId = NodeIds.forObject(parent.objectId());
                graph.addEdge(EdgeKind.OBJ_DF_CHILD, parentNodeId, NodeIds.forObject(childId));
                if (graph.hasObject(childId)) continue;

                addChild(childId, graph);
                if (parent.depth() < config.getMaxObjDepth()) {
                    queue.add(new Pending(childId, parent.depth() + 1));
                }
            }
        }
    }

    private void addChild(String childId, GraphBuilder graph) {
        ObjectDetail detail;
        try {
            detail = dynamicFieldSource.getObject(childId);
        } catch (AnalysisCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            System.err.println("[atlas-engine] WARNING: could not fetch dynamic field " + childId
                    + ", using placeholder: " + e.getMessage());
            graph.ensurePlaceholderObject(childId);
            return;
        }
        if (detail == null || detail.owner() == null) {
            graph.ensurePlaceholderObject(childId);
            return;
        }

        ObjectNode child = new ObjectNode();
        child.id = NodeIds.forObject(childId);
        child.objectId = childId;
        child.typeFqn = detail.type() != null ? detail.type() : GraphBuilder.UNKNOWN_TYPE;
        child.owner = toOwner(detail.owner());
        child.shared = detail.owner().kind() == OwnerKind.SHARED;
        graph.putObject(child);
        linkOwner(child, graph);
    }

    private static Owner toOwner(OwnerInfo info) {
        return new Owner(info.kind(), info.address());
    }

    private static void linkOwner(ObjectNode node, GraphBuilder graph) {
        if (node.owner.kind == OwnerKind.ADDRESS_OWNER) {
            AddressNode address = graph.ensureAddress(node.owner.address);
            graph.addEdge(EdgeKind.OBJ_OWNED_BY, node.id, address.id);
        }
    }
}

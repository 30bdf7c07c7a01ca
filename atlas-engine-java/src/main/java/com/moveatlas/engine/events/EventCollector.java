package com.moveatlas.engine.events;

import com.moveatlas.engine.ProgressListener.AnalysisCancelledException;
import com.moveatlas.engine.graph.GraphBuilder;
import com.moveatlas.engine.graph.GraphModel.EdgeKind;
import com.moveatlas.engine.graph.GraphModel.EventKind;
import com.moveatlas.engine.graph.GraphModel.EventNode;
import com.moveatlas.engine.graph.GraphModel.ModuleNode;
import com.moveatlas.engine.graph.NodeIds;
import com.moveatlas.engine.source.EventSource;
import com.moveatlas.engine.source.EventSource.ChainEvent;

import java.util.List;

/**
 * Links a bounded window of recent package events to the package and its emitting modules.
 * The configured window in days is recorded by callers but not applied to the query.
 */
public class EventCollector {

    public static final int EVENT_LIMIT = 100;

    private final EventSource eventSource;

    public EventCollector(EventSource eventSource) {
        this.eventSource = eventSource;
    }

    /**
     * @return number of events added; 0 when the event query fails
     */
    public int collect(String packageId, GraphBuilder graph) {
        List<ChainEvent> events;
        try {
            events = eventSource.queryEvents(packageId, EVENT_LIMIT);
        } catch (AnalysisCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            System.err.println("[atlas-engine] ERROR: event query failed for " + packageId + ": " + e.getMessage());
            return 0;
        }

        String packageNodeId = graph.ensurePackage(packageId).id;
        int added = 0;
        for (ChainEvent event : events) {
            if (event.txDigest() == null || event.eventSeq() == null) {
                System.err.println("[atlas-engine] WARNING: skipping event without id: " + event.type());
                continue;
            }
            EventNode node = new EventNode();
            node.id = NodeIds.forEvent(event.txDigest(), event.eventSeq());
            node.kind = classify(event.type());
            node.packageId = packageNodeId;
            node.timestampMs = event.timestampMs();
            node.txDigest = event.txDigest();
            node.data = event.parsedJson();
            node.sender = event.sender();

            // upgraded packages keep the original address in their event types
            String moduleName = NodeIds.moduleNameOf(event.type());
            if (moduleName != null) {
                node.moduleId = NodeIds.forModule(packageId + "::" + moduleName);
            }
            graph.putEvent(node);

            ModuleNode emitter = node.moduleId != null ? graph.module(node.moduleId) : null;
            if (emitter != null && !emitter.placeholder) {
                graph.addEdge(EdgeKind.MOD_EMITS_EVENT, emitter.id, node.id);
            }
            graph.addEdge(EdgeKind.PKG_EMITS_EVENT, packageNodeId, node.id);
            added++;
        }
        System.err.println("[atlas-engine] Events collected for " + packageId + ": " + added);
        return added;
    }

    static EventKind classify(String eventType) {
        if (eventType == null) return EventKind.CUSTOM;
        if (eventType.contains("::publish::")) return EventKind.PUBLISH;
        if (eventType.contains("::upgrade::")) return EventKind.UPGRADE;
        if (eventType.contains("::mint::")) return EventKind.MINT;
        if (eventType.contains("::burn::")) return EventKind.BURN;
        return EventKind.CUSTOM;
    }
}

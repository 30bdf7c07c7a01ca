package com.moveatlas.engine;

import com.moveatlas.engine.ProgressListener.AnalysisCancelledException;
import com.moveatlas.engine.config.AnalysisConfig;
import com.moveatlas.engine.graph.GraphMerger;
import com.moveatlas.engine.graph.GraphModel.CallType;
import com.moveatlas.engine.graph.GraphModel.EdgeKind;
import com.moveatlas.engine.graph.GraphModel.Graph;
import com.moveatlas.engine.graph.GraphModel.GraphEdge;
import com.moveatlas.engine.graph.NodeIds;
import com.moveatlas.engine.source.ChainSources;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks the package dependency frontier breadth-first up to the configured depth and merges
 * the per-package graphs. Every package is analyzed at most once, so cycles terminate.
 *
 * Progress: the root owns [0, 90]; each package's dependencies split its range evenly.
 * Reported values never decrease and are clamped to 95, which is emitted after the merge.
 */
public class RecursiveAnalyzer {

    static final double ROOT_RANGE = 90;
    static final int MAX_TRAVERSAL_PROGRESS = 95;

    private final PackageAnalyzer packageAnalyzer;
    private final GraphMerger merger = new GraphMerger();

    public RecursiveAnalyzer(PackageAnalyzer packageAnalyzer) {
        this.packageAnalyzer = packageAnalyzer;
    }

    private record Frontier(String packageId, int depth, double progressOffset, double progressRange) {}

    public Graph analyze(String rootPackageId, ChainSources sources, AnalysisConfig config, ProgressListener listener) {
        ProgressListener progress = monotonic(listener);
        int maxDepth = config.getMaxPkgDepth();
        Deque<Frontier> queue = new ArrayDeque<>();
        queue.add(new Frontier(rootPackageId, 1, 0, ROOT_RANGE));
        Set<String> visited = new HashSet<>();
        List<Graph> graphs = new ArrayList<>();

        while (!queue.isEmpty()) {
            Frontier current = queue.poll();
            if (current.depth() > maxDepth || !visited.add(current.packageId())) continue;

            System.err.println("[atlas-engine] Analyzing " + current.packageId() + " at depth " + current.depth());
            Graph graph;
            try {
                graph = packageAnalyzer.analyzeSingle(current.packageId(), sources, config, scaled(progress, current));
            } catch (AnalysisCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                if (current.depth() == 1) throw e;
                System.err.println("[atlas-engine] ERROR: dropping dependency " + current.packageId()
                        + ": " + e.getMessage());
                continue;
            }
            graphs.add(graph);

            if (current.depth() < maxDepth) {
                List<String> next = nextFrontier(current.packageId(), graph, visited);
                double childRange = current.progressRange() / (next.size() + 1);
                for (int i = 0; i < next.size(); i++) {
                    queue.add(new Frontier(next.get(i), current.depth() + 1,
                            current.progressOffset() + childRange * (i + 1), childRange));
                }
            }
        }

        Graph merged = merger.merge(graphs);
        progress.onProgress(MAX_TRAVERSAL_PROGRESS);
        System.err.println("[atlas-engine] Merged " + graphs.size() + " package graphs");
        return merged;
    }

    /**
     * Dependencies of {@code packageId}: PKG_DEPENDS targets plus packages of external MOD_CALLS targets,
     * minus anything already visited.
     */
    static List<String> nextFrontier(String packageId, Graph graph, Set<String> visited) {
        String from = NodeIds.forPackage(packageId);
        Set<String> next = new LinkedHashSet<>();
        for (GraphEdge e : graph.edges) {
            if (e.kind == EdgeKind.PKG_DEPENDS && e.from.equals(from)) {
                next.add(NodeIds.strip(e.to, NodeIds.PACKAGE));
            } else if (e.kind == EdgeKind.MOD_CALLS && e.callType == CallType.EXTERNAL) {
                String address = NodeIds.packageAddressOf(NodeIds.strip(e.to, NodeIds.MODULE) + "::");
                if (address != null) next.add(address);
            }
        }
        next.removeAll(visited);
        next.remove(packageId);
        return new ArrayList<>(next);
    }

    /** Repeats the highest value seen so far instead of going back; every call still reaches the listener. */
    private static ProgressListener monotonic(ProgressListener progress) {
        int[] highest = {0};
        return percent -> {
            highest[0] = Math.max(highest[0], percent);
            progress.onProgress(highest[0]);
        };
    }

    private static ProgressListener scaled(ProgressListener progress, Frontier frontier) {
        return percent -> {
            double value = frontier.progressOffset() + frontier.progressRange() * percent / 100.0;
            progress.onProgress((int) Math.min(MAX_TRAVERSAL_PROGRESS, Math.round(value)));
        };
    }
}

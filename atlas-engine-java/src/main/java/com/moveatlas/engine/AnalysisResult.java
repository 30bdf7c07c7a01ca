package com.moveatlas.engine;

import com.moveatlas.engine.graph.GraphModel.Flag;
import com.moveatlas.engine.graph.GraphModel.Graph;
import com.moveatlas.engine.graph.GraphModel.Severity;
import com.moveatlas.engine.source.Network;

import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of {@link PackageAnalyzer#analyzePackage}: the graph plus summary counts.
 *
 * @param depth the package depth the analysis ran with
 */
public record AnalysisResult(
        String packageId,
        Network network,
        int depth,
        Graph graph,
        Summary summary
) {

    public record Summary(
            int packages,
            int modules,
            int types,
            int objects,
            int addresses,
            int events,
            int edges,
            int flags,
            Map<Severity, Integer> flagsBySeverity
    ) {

        public static Summary of(Graph graph) {
            Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
            for (Severity s : Severity.values()) bySeverity.put(s, 0);
            for (Flag f : graph.flags) bySeverity.merge(f.level, 1, Integer::sum);
            return new Summary(
                    graph.packages.size(),
                    graph.modules.size(),
                    graph.types.size(),
                    graph.objects.size(),
                    graph.addresses.size(),
                    graph.events.size(),
                    graph.edges.size(),
                    graph.flags.size(),
                    bySeverity
            );
        }
    }
}

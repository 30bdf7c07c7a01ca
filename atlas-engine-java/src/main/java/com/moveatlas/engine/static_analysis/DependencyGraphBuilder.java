package com.moveatlas.engine.static_analysis;

import com.moveatlas.engine.graph.GraphBuilder;
import com.moveatlas.engine.graph.GraphModel.DependencyEvidence;
import com.moveatlas.engine.graph.GraphModel.EdgeKind;
import com.moveatlas.engine.graph.GraphModel.GraphEdge;
import com.moveatlas.engine.graph.NodeIds;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Materializes package-level dependency edges once every module of a package is parsed.
 */
public class DependencyGraphBuilder {

    /**
     * Creates a package node for each newly discovered dependency and one PKG_DEPENDS edge
     * from the analyzed package to it.
     *
     * @return number of dependency edges added
     */
    public int build(String packageId, Map<String, List<DependencyEvidence>> packageDependencies, GraphBuilder graph) {
        String from = NodeIds.forPackage(packageId);
        graph.ensurePackage(packageId);
        int added = 0;
        for (Map.Entry<String, List<DependencyEvidence>> dep : packageDependencies.entrySet()) {
            String depAddress = dep.getKey();
            if (depAddress.equals(packageId)) continue;
            graph.ensurePackage(depAddress);
            GraphEdge edge = graph.addEdge(EdgeKind.PKG_DEPENDS, from, NodeIds.forPackage(depAddress));
            edge.evidence = new ArrayList<>(dep.getValue());
            added++;
        }
        return added;
    }
}

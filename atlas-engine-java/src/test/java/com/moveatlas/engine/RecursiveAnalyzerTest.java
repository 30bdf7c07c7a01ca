package com.moveatlas.engine;

import com.moveatlas.engine.ProgressListener.AnalysisCancelledException;
import com.moveatlas.engine.config.AnalysisConfig;
import com.moveatlas.engine.graph.GraphModel.*;
import com.moveatlas.engine.source.Network;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.moveatlas.engine.ModuleJson.*;
import static org.junit.jupiter.api.Assertions.*;

class RecursiveAnalyzerTest {

    private InMemoryChain chain;
    private PackageAnalyzer packageAnalyzer;

    /** 0xa::pool takes a 0xb::math::Num; 0xb::math takes a 0xa::pool::Pool. */
    @BeforeEach
    void setUp() {
        chain = new InMemoryChain();
        chain.packages.put("0xa", Map.of("pool", new ModuleJson()
                .withStruct("Pool", abilities("Key"))
                .withFunction("swap", "Public", false, ref(struct("0xb", "math", "Num")))
                .build()));
        chain.packages.put("0xb", Map.of("math", new ModuleJson()
                .withStruct("Num", abilities("Copy", "Drop", "Store"))
                .withFunction("price", "Public", false, ref(struct("0xa", "pool", "Pool")))
                .build()));
        packageAnalyzer = new PackageAnalyzer(chain::sources);
    }

    private Graph analyze(int depth, ProgressListener progress) {
        AnalysisConfig config = AnalysisConfig.builder().maxPkgDepth(depth).build();
        return new RecursiveAnalyzer(packageAnalyzer).analyze("0xa", chain.sources(Network.MAINNET), config, progress);
    }

    private static ModuleNode module(Graph graph, String id) {
        return graph.modules.stream().filter(m -> m.id.equals(id)).findFirst().orElseThrow();
    }

    @Test
    void cycleAnalyzesEachPackageOnce() {
        Graph graph = analyze(3, ProgressListener.NONE);

        assertEquals(List.of("0xa", "0xb"), chain.moduleRequests);
        assertFalse(module(graph, "mod:0xa::pool").placeholder);
        assertFalse(module(graph, "mod:0xb::math").placeholder);

        Set<String> edgeKeys = new HashSet<>();
        for (GraphEdge e : graph.edges) {
            assertTrue(edgeKeys.add(e.key()), "duplicate edge " + e.key());
        }
        long depends = graph.edges.stream().filter(e -> e.kind == EdgeKind.PKG_DEPENDS).count();
        assertEquals(2, depends);
    }

    @Test
    void bothPackagesKeepTheirStats() {
        Graph graph = analyze(2, ProgressListener.NONE);
        for (PackageNode p : graph.packages) {
            assertNotNull(p.stats, p.id);
            assertEquals(1, p.stats.modules);
        }
    }

    @Test
    void depthOneStopsAtRoot() {
        Graph graph = analyze(1, ProgressListener.NONE);
        assertEquals(List.of("0xa"), chain.moduleRequests);
        assertTrue(module(graph, "mod:0xb::math").placeholder);
    }

    @Test
    void progressStaysBelowCompletion() {
        List<Integer> reported = new ArrayList<>();
        analyze(3, reported::add);

        assertFalse(reported.isEmpty());
        assertTrue(reported.stream().allMatch(p -> p >= 0 && p <= RecursiveAnalyzer.MAX_TRAVERSAL_PROGRESS));
        assertEquals(RecursiveAnalyzer.MAX_TRAVERSAL_PROGRESS, reported.get(reported.size() - 1));
    }

    @Test
    void progressNeverGoesBackwards() {
        List<Integer> reported = new ArrayList<>();
        analyze(2, reported::add);

        // root ends at 90 while 0xb's slice starts at 45
        assertEquals(17, reported.size());
        for (int i = 1; i < reported.size(); i++) {
            assertTrue(reported.get(i) >= reported.get(i - 1), "progress went back at " + i + ": " + reported);
        }
    }

    @Test
    void failingDependencyIsDropped() {
        chain.failingPackages.add("0xb");
        Graph graph = analyze(2, ProgressListener.NONE);

        assertFalse(module(graph, "mod:0xa::pool").placeholder);
        assertTrue(module(graph, "mod:0xb::math").placeholder);
    }

    @Test
    void failingRootIsThrown() {
        chain.failingPackages.add("0xa");
        assertThrows(PackageAnalyzer.AnalysisException.class, () -> analyze(2, ProgressListener.NONE));
    }

    @Test
    void cancellationPropagatesFromDependency() {
        int[] calls = {0};
        // the root reports eight milestones; the ninth comes from 0xb
        ProgressListener cancelAfterRoot = percent -> {
            if (++calls[0] > 8) throw new AnalysisCancelledException("cancelled by user");
        };
        assertThrows(AnalysisCancelledException.class, () -> analyze(2, cancelAfterRoot));
    }

    @Test
    void frontierSkipsVisitedAndSelf() {
        Graph graph = new Graph();
        GraphEdge dep = new GraphEdge(EdgeKind.PKG_DEPENDS, "pkg:0xa", "pkg:0xb");
        GraphEdge call = new GraphEdge(EdgeKind.MOD_CALLS, "mod:0xa::pool", "mod:0xc::oracle");
        call.callType = CallType.EXTERNAL;
        GraphEdge local = new GraphEdge(EdgeKind.MOD_CALLS, "mod:0xa::pool", "mod:0xd::x");
        local.callType = CallType.SAME_PACKAGE;
        GraphEdge foreign = new GraphEdge(EdgeKind.PKG_DEPENDS, "pkg:0xz", "pkg:0xe");
        graph.edges = List.of(dep, call, local, foreign);

        assertEquals(List.of("0xb", "0xc"), RecursiveAnalyzer.nextFrontier("0xa", graph, Set.of()));
        assertEquals(List.of("0xc"), RecursiveAnalyzer.nextFrontier("0xa", graph, Set.of("0xb")));
    }
}

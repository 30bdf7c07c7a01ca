package com.moveatlas.engine;

import com.google.gson.JsonObject;
import com.moveatlas.engine.ProgressListener.AnalysisCancelledException;
import com.moveatlas.engine.config.AnalysisConfig;
import com.moveatlas.engine.discovery.CriticalTypes;
import com.moveatlas.engine.discovery.ObjectDiscovery;
import com.moveatlas.engine.events.EventCollector;
import com.moveatlas.engine.graph.GraphBuilder;
import com.moveatlas.engine.graph.GraphModel.Graph;
import com.moveatlas.engine.security.SecurityFlagDetector;
import com.moveatlas.engine.source.ChainSources;
import com.moveatlas.engine.source.ChainSourcesFactory;
import com.moveatlas.engine.source.Network;
import com.moveatlas.engine.static_analysis.DependencyGraphBuilder;
import com.moveatlas.engine.static_analysis.ModuleParser;
import com.moveatlas.engine.static_analysis.ModuleParser.ParsedPackage;

import java.util.Map;

/**
 * Entry point: resolves the package's network and builds its graph, following
 * dependencies when the configured package depth is greater than one.
 *
 * Pipeline per package:
 *   1. fetch normalized modules
 *   2. parse modules, types and intra-package edges
 *   3. package dependency edges
 *   4. object discovery for key types
 *   5. recent events
 *   6. security flags
 *   7. finalize
 */
public class PackageAnalyzer {

    public static class AnalysisException extends RuntimeException {
        public AnalysisException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final ChainSourcesFactory sourcesFactory;
    private final NetworkSelector networkSelector;

    public PackageAnalyzer(ChainSourcesFactory sourcesFactory) {
        this(sourcesFactory, new NetworkSelector(sourcesFactory));
    }

    public PackageAnalyzer(ChainSourcesFactory sourcesFactory, NetworkSelector networkSelector) {
        this.sourcesFactory = sourcesFactory;
        this.networkSelector = networkSelector;
    }

    /**
     * @throws NetworkSelector.PackageResolutionException if the package resolves on no network
     * @throws AnalysisException on an unhandled failure while analyzing the root package
     * @throws AnalysisCancelledException if the listener cancels
     */
    public AnalysisResult analyzePackage(String packageId, AnalysisConfig config, ProgressListener listener) {
        ProgressListener progress = listener != null ? listener : ProgressListener.NONE;
        NetworkSelector.Resolution resolution = networkSelector.resolve(packageId, config.getNetwork());
        Network network = resolution.network();
        ChainSources base = sourcesFactory.forNetwork(network);
        // the root's modules were already fetched while resolving the network
        ChainSources sources = new ChainSources(network,
                address -> address.equals(packageId)
                        ? resolution.modules()
                        : base.modules().getNormalizedModules(address),
                base.objects(), base.dynamicFields(), base.events());
        System.err.println("[atlas-engine] Analyzing " + packageId + " on " + network.id()
                + " (depth " + config.getMaxPkgDepth() + ")");

        Graph graph;
        if (config.getMaxPkgDepth() > 1) {
            graph = new RecursiveAnalyzer(this).analyze(packageId, sources, config, progress);
            progress.onProgress(100);
        } else {
            graph = analyzeSingle(packageId, sources, config, progress);
        }

        AnalysisResult.Summary summary = AnalysisResult.Summary.of(graph);
        System.err.println("[atlas-engine] Analysis complete for " + packageId + ": "
                + summary.modules() + " modules, " + summary.types() + " types, "
                + summary.objects() + " objects, " + summary.edges() + " edges, "
                + summary.flags() + " flags");
        return new AnalysisResult(packageId, network, config.getMaxPkgDepth(), graph, summary);
    }

    /**
     * Builds the graph of one package with a fresh builder, reporting milestones
     * 5, 15, 35, 45, 65, 80, 90 and 100.
     *
     * @throws AnalysisException wrapping any failure other than cancellation
     */
    public Graph analyzeSingle(String packageId, ChainSources sources, AnalysisConfig config, ProgressListener progress) {
        try {
            GraphBuilder graph = new GraphBuilder(packageId, sources.network());
            CriticalTypes criticalTypes = new CriticalTypes(config.getCriticalTypes());

            progress.onProgress(5);
            Map<String, JsonObject> modules = sources.modules().getNormalizedModules(packageId);
            System.err.println("[atlas-engine] Fetched " + modules.size() + " modules for " + packageId);

            progress.onProgress(15);
            graph.ensurePackage(packageId);
            ParsedPackage parsed = new ModuleParser(criticalTypes).parse(packageId, modules, graph);
            System.err.println("[atlas-engine] Parsed " + parsed.moduleCount() + " modules, "
                    + graph.types().size() + " types");

            progress.onProgress(35);
            int deps = new DependencyGraphBuilder().build(packageId, parsed.packageDependencies(), graph);
            System.err.println("[atlas-engine] Package dependencies: " + deps);

            progress.onProgress(45);
            new ObjectDiscovery(sources.objects(), sources.dynamicFields(), config, criticalTypes).discover(graph);

            progress.onProgress(65);
            System.err.println("[atlas-engine] Collecting events (window " + config.getEventsWindowDays()
                    + " days, advisory)");
            new EventCollector(sources.events()).collect(packageId, graph);

            progress.onProgress(80);
            new SecurityFlagDetector().detect(graph);

            progress.onProgress(90);
            Graph built = graph.build();

            progress.onProgress(100);
            return built;
        } catch (AnalysisCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AnalysisException("Failed to analyze package " + packageId + ": " + e.getMessage(), e);
        }
    }
}

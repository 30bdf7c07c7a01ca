package com.moveatlas.engine.graph;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.moveatlas.engine.graph.GraphModel.Graph;
import com.moveatlas.engine.graph.GraphModel.GraphEdge;
import com.moveatlas.engine.source.Network;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.TreeMap;

/**
 * Writes a finished graph to graph.json with every array sorted for deterministic output,
 * plus metadata.json describing the analysis.
 */
public class GraphSerializer {

    public static final String ENGINE_VERSION = "0.1.0";

    static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes {@code graph} to {@code outputDir/graph.json} and {@code outputDir/metadata.json}.
     * The graph's lists are replaced by sorted copies.
     *
     * @param outputDir directory to write into (created if absent)
     */
    public void write(Graph graph, Path outputDir, String rootPackageId, Network network, int depth) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + outputDir, e);
        }

        sort(graph);

        Path graphPath = outputDir.resolve("graph.json");
        try (Writer w = Files.newBufferedWriter(graphPath, StandardCharsets.UTF_8)) {
            GSON.toJson(graph, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write graph.json: " + e.getMessage(), e);
        }
        System.err.println("[atlas-engine] graph.json written: " + graphPath);

        var meta = new Metadata(rootPackageId, network != null ? network.id() : null, depth,
                ENGINE_VERSION, Instant.now().toString());
        Path metaPath = outputDir.resolve("metadata.json");
        try (Writer w = Files.newBufferedWriter(metaPath, StandardCharsets.UTF_8)) {
            GSON.toJson(meta, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write metadata.json: " + e.getMessage(), e);
        }
        System.err.println("[atlas-engine] metadata.json written: " + metaPath);
    }

    /** Reads a graph.json previously written by {@link #write}. */
    public Graph read(Path graphFile) {
        try (Reader r = Files.newBufferedReader(graphFile, StandardCharsets.UTF_8)) {
            return GSON.fromJson(r, Graph.class);
        } catch (IOException e) {
            throw new SerializerException("Failed to read " + graphFile + ": " + e.getMessage(), e);
        }
    }

    static void sort(Graph graph) {
        graph.packages = new ArrayList<>(graph.packages);
        graph.packages.sort(Comparator.comparing(n -> n.id));
        graph.modules = new ArrayList<>(graph.modules);
        graph.modules.sort(Comparator.comparing(n -> n.id));
        graph.types = new ArrayList<>(graph.types);
        graph.types.sort(Comparator.comparing(n -> n.id));
        graph.objects = new ArrayList<>(graph.objects);
        graph.objects.sort(Comparator.comparing(n -> n.id));
        graph.addresses = new ArrayList<>(graph.addresses);
        graph.addresses.sort(Comparator.comparing(n -> n.id));
        graph.events = new ArrayList<>(graph.events);
        graph.events.sort(Comparator.comparing(n -> n.id));
        graph.edges = new ArrayList<>(graph.edges);
        graph.edges.sort(Comparator.comparing((GraphEdge e) -> e.kind.name())
                .thenComparing(e -> e.from)
                .thenComparing(e -> e.to));
        graph.flags = new ArrayList<>(graph.flags);
        graph.flags.sort(Comparator.comparing((GraphModel.Flag f) -> f.refId)
                .thenComparing(f -> f.kind));
        graph.stats.types = new TreeMap<>(graph.stats.types);
        graph.stats.risk.modules = new TreeMap<>(graph.stats.risk.modules);
        graph.stats.risk.objects = new TreeMap<>(graph.stats.risk.objects);
    }

    private record Metadata(
            String rootPackage,
            String network,
            int depth,
            String engineVersion,
            String timestamp
    ) {}
}

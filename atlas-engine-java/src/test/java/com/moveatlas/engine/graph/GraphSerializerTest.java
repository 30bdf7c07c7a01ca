package com.moveatlas.engine.graph;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.moveatlas.engine.graph.GraphModel.*;
import com.moveatlas.engine.source.Network;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphSerializerTest {

    private Graph makeGraph() {
        GraphBuilder builder = new GraphBuilder("0xa", Network.TESTNET);
        builder.ensurePackage("0xz");
        builder.ensurePackage("0xa");
        builder.addEdge(EdgeKind.PKG_DEPENDS, "pkg:0xz", "pkg:0xa");
        builder.addEdge(EdgeKind.PKG_DEPENDS, "pkg:0xa", "pkg:0xz");
        builder.addEdge(EdgeKind.MOD_CALLS, "mod:0xz::m", "mod:0xa::m");
        builder.addFlag(new Flag(Severity.LOW, "SetFeeFunction", FlagScope.MODULE, "mod:0xz::m"));
        builder.addFlag(new Flag(Severity.MED, "MintFunction", FlagScope.MODULE, "mod:0xa::m"));
        TypeStats zStats = new TypeStats();
        zStats.typeFqn = "0xz::m::Z";
        builder.putTypeStats(zStats);
        TypeStats aStats = new TypeStats();
        aStats.typeFqn = "0xa::m::A";
        builder.putTypeStats(aStats);
        return builder.build();
    }

    @Test
    void arraysSortedInOutput(@TempDir Path tmp) throws Exception {
        new GraphSerializer().write(makeGraph(), tmp, "0xa", Network.TESTNET, 1);

        Path graphPath = tmp.resolve("graph.json");
        assertTrue(Files.exists(graphPath));
        Graph parsed = new Gson().fromJson(new FileReader(graphPath.toFile()), Graph.class);

        assertEquals("pkg:0xa", parsed.packages.get(0).id);
        assertEquals("pkg:0xz", parsed.packages.get(1).id);
        assertEquals("mod:0xa::m", parsed.modules.get(0).id);

        // MOD_CALLS sorts before PKG_DEPENDS; within a kind by from
        assertEquals(EdgeKind.MOD_CALLS, parsed.edges.get(0).kind);
        assertEquals("pkg:0xa", parsed.edges.get(1).from);
        assertEquals("pkg:0xz", parsed.edges.get(2).from);

        assertEquals("mod:0xa::m", parsed.flags.get(0).refId);
        assertEquals(List.of("0xa::m::A", "0xz::m::Z"), List.copyOf(parsed.stats.types.keySet()));
    }

    @Test
    void metadataDescribesRun(@TempDir Path tmp) throws Exception {
        new GraphSerializer().write(makeGraph(), tmp.resolve("out"), "0xa", Network.TESTNET, 2);

        JsonObject meta = new Gson().fromJson(
                new FileReader(tmp.resolve("out/metadata.json").toFile()), JsonObject.class);
        assertEquals("0xa", meta.get("rootPackage").getAsString());
        assertEquals("testnet", meta.get("network").getAsString());
        assertEquals(2, meta.get("depth").getAsInt());
        assertEquals(GraphSerializer.ENGINE_VERSION, meta.get("engineVersion").getAsString());
        assertTrue(meta.has("timestamp"));
    }

    @Test
    void enumWireNamesAreUsed(@TempDir Path tmp) throws Exception {
        Graph graph = makeGraph();
        ObjectNode obj = new ObjectNode();
        obj.id = "obj:0x1";
        obj.objectId = "0x1";
        obj.typeFqn = "0xa::m::A";
        obj.owner = new Owner(OwnerKind.ADDRESS_OWNER, "0xb0b");
        graph.objects.add(obj);

        new GraphSerializer().write(graph, tmp, "0xa", Network.TESTNET, 1);
        String json = Files.readString(tmp.resolve("graph.json"));
        assertTrue(json.contains("\"AddressOwner\""));
        assertTrue(json.contains("\"MOD_CALLS\""));
        assertTrue(json.contains("\"MED\""));
    }

    @Test
    void writtenGraphReadsBack(@TempDir Path tmp) {
        GraphSerializer serializer = new GraphSerializer();
        serializer.write(makeGraph(), tmp, "0xa", Network.TESTNET, 1);

        Graph read = serializer.read(tmp.resolve("graph.json"));
        assertEquals(3, read.edges.size());
        assertEquals(2, read.flags.size());
    }

    @Test
    void readingMissingFileThrows(@TempDir Path tmp) {
        assertThrows(GraphSerializer.SerializerException.class,
                () -> new GraphSerializer().read(tmp.resolve("absent.json")));
    }
}

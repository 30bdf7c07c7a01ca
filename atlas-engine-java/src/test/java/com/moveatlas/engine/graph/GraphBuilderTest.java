package com.moveatlas.engine.graph;

import com.moveatlas.engine.graph.GraphModel.*;
import com.moveatlas.engine.source.Network;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphBuilderTest {

    private static ModuleNode module(String fqn, String packageId, String... types) {
        ModuleNode m = new ModuleNode();
        m.id = NodeIds.forModule(fqn);
        m.fullName = fqn;
        m.packageId = packageId;
        m.name = fqn.substring(fqn.lastIndexOf("::") + 2);
        m.typesDefined.addAll(List.of(types));
        return m;
    }

    @Test
    void edgeEndpointsBecomePlaceholders() {
        GraphBuilder builder = new GraphBuilder("0xa", Network.MAINNET);
        builder.ensurePackage("0xa");
        builder.addEdge(EdgeKind.MOD_CALLS, "mod:0xa::pool", "mod:0x2::coin");
        builder.addEdge(EdgeKind.TYPE_USES_TYPE, "type:0xa::pool::Pool", "type:0x2::balance::Balance");
        builder.addEdge(EdgeKind.OBJ_REFERS_OBJ, "obj:0x1", "obj:0x2");
        builder.addEdge(EdgeKind.OBJ_OWNED_BY, "obj:0x1", "addr:0xb0b");

        Graph graph = builder.build();

        assertEquals(2, graph.modules.size());
        assertTrue(graph.modules.stream().allMatch(m -> m.placeholder));
        ModuleNode coin = graph.modules.stream().filter(m -> m.id.equals("mod:0x2::coin")).findFirst().orElseThrow();
        assertEquals("pkg:0x2", coin.packageId);
        assertEquals("coin", coin.name);
        assertTrue(graph.packages.stream().anyMatch(p -> p.id.equals("pkg:0x2")));

        TypeNode balance = graph.types.stream().filter(t -> t.fqn.equals("0x2::balance::Balance")).findFirst().orElseThrow();
        assertTrue(balance.placeholder);
        assertEquals("mod:0x2::balance", balance.moduleId);
        assertFalse(balance.hasKey);

        assertEquals(2, graph.objects.size());
        assertTrue(graph.objects.stream().allMatch(o -> GraphBuilder.UNKNOWN_TYPE.equals(o.typeFqn)));
        assertEquals(1, graph.addresses.size());
    }

    @Test
    void realNodesAreNotReplacedByPlaceholders() {
        GraphBuilder builder = new GraphBuilder("0xa", Network.MAINNET);
        builder.putModule(module("0xa::pool", "pkg:0xa"));
        builder.addEdge(EdgeKind.MOD_FRIEND_ALLOW, "mod:0xa::pool", "mod:0xa::pool");

        Graph graph = builder.build();
        assertEquals(1, graph.modules.size());
        assertFalse(graph.modules.get(0).placeholder);
    }

    @Test
    void rootStatsCountRealRootModules() {
        GraphBuilder builder = new GraphBuilder("0xa", Network.MAINNET);
        builder.ensurePackage("0xa");
        builder.putModule(module("0xa::pool", "pkg:0xa", "0xa::pool::Pool", "0xa::pool::LP"));
        builder.putModule(module("0xa::math", "pkg:0xa"));
        builder.addEdge(EdgeKind.MOD_CALLS, "mod:0xa::pool", "mod:0x2::coin");
        EventNode event = new EventNode();
        event.id = "evt:tx:0";
        builder.putEvent(event);

        Graph graph = builder.build();
        PackageNode root = graph.packages.stream().filter(p -> p.id.equals("pkg:0xa")).findFirst().orElseThrow();
        assertNotNull(root.stats);
        assertEquals(2, root.stats.modules);
        assertEquals(2, root.stats.types);
        assertEquals(1, root.stats.recentEvents);

        PackageNode dependency = graph.packages.stream().filter(p -> p.id.equals("pkg:0x2")).findFirst().orElseThrow();
        assertNull(dependency.stats);
    }

    @Test
    void riskGroupsFlagKindsByEntity() {
        GraphBuilder builder = new GraphBuilder("0xa", Network.MAINNET);
        builder.addFlag(new Flag(Severity.HIGH, "AdminCap", FlagScope.MODULE, "mod:0xa::admin"));
        builder.addFlag(new Flag(Severity.MED, "MintFunction", FlagScope.MODULE, "mod:0xa::admin"));
        builder.addFlag(new Flag(Severity.MED, "MintFunction", FlagScope.MODULE, "mod:0xa::admin"));
        builder.addFlag(new Flag(Severity.HIGH, "UnsafeShared", FlagScope.OBJECT, "obj:0x2"));
        builder.addFlag(new Flag(Severity.LOW, "Droppable", FlagScope.TYPE, "type:0xa::admin::R"));

        Graph graph = builder.build();

        assertEquals(List.of("AdminCap", "MintFunction"), graph.stats.risk.modules.get("0xa::admin"));
        assertEquals(List.of("UnsafeShared"), graph.stats.risk.objects.get("0x2"));
        assertEquals(1, graph.stats.risk.modules.size());
        assertEquals(5, graph.flags.size());
    }

    @Test
    void buildTwiceThrows() {
        GraphBuilder builder = new GraphBuilder("0xa", Network.MAINNET);
        builder.build();
        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void packageLinksFollowNetwork() {
        GraphBuilder builder = new GraphBuilder("0xa", Network.TESTNET);
        PackageNode pkg = builder.ensurePackage("0xa");
        assertSame(pkg, builder.ensurePackage("0xa"));
        assertFalse(pkg.explorerLinks.isEmpty());
        assertTrue(pkg.explorerLinks.values().stream().allMatch(url -> url.contains("0xa")));
    }
}

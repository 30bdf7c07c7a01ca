package com.moveatlas.engine.graph;

import com.moveatlas.engine.graph.GraphModel.*;
import com.moveatlas.engine.source.Network;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphInspectorTest {

    private GraphInspector inspector;

    @BeforeEach
    void setUp() {
        GraphBuilder builder = new GraphBuilder("0xa", Network.MAINNET);
        builder.ensurePackage("0xa");

        ModuleNode pool = new ModuleNode();
        pool.id = "mod:0xa::pool";
        pool.fullName = "0xa::pool";
        pool.packageId = "pkg:0xa";
        pool.name = "pool";
        pool.typesDefined.add("0xa::pool::Pool");
        builder.putModule(pool);

        TypeNode poolType = new TypeNode();
        poolType.id = "type:0xa::pool::Pool";
        poolType.fqn = "0xa::pool::Pool";
        poolType.moduleId = "mod:0xa::pool";
        poolType.hasKey = true;
        builder.putType(poolType);

        for (int i = 0; i < 12; i++) {
            ObjectNode o = new ObjectNode();
            o.objectId = "0x" + Integer.toHexString(0x100 + i);
            o.id = NodeIds.forObject(o.objectId);
            o.typeFqn = "0xa::pool::Pool";
            o.owner = new Owner(OwnerKind.SHARED, null);
            o.shared = true;
            builder.putObject(o);
        }
        TypeStats stats = new TypeStats();
        stats.typeFqn = "0xa::pool::Pool";
        stats.count = 12;
        builder.putTypeStats(stats);

        builder.addEdge(EdgeKind.MOD_CALLS, "mod:0xa::pool", "mod:0x2::coin");
        builder.addEdge(EdgeKind.MOD_CALLS, "mod:0xa::router", "mod:0xa::pool");
        builder.addEdge(EdgeKind.MOD_FRIEND_ALLOW, "mod:0xa::pool", "mod:0xa::router");
        builder.addEdge(EdgeKind.TYPE_USES_TYPE, "type:0xa::pool::Pool", "type:0x2::balance::Balance");
        builder.addEdge(EdgeKind.OBJ_DF_CHILD, "obj:0x100", "obj:0x101");
        builder.addEdge(EdgeKind.OBJ_REFERS_OBJ, "obj:0x102", "obj:0x100");
        builder.addFlag(new Flag(Severity.MED, "MintFunction", FlagScope.MODULE, "mod:0xa::pool"));
        builder.addFlag(new Flag(Severity.HIGH, "UnsafeShared", FlagScope.OBJECT, "obj:0x100"));

        inspector = new GraphInspector(builder.build());
    }

    @Test
    void moduleViewCollectsNeighbours() {
        GraphInspector.ModuleView view = inspector.module("0xa::pool").orElseThrow();
        assertEquals(List.of("mod:0x2::coin"), view.outgoingCalls());
        assertEquals(List.of("mod:0xa::router"), view.incomingCalls());
        assertEquals(List.of("mod:0xa::router"), view.friends());
        assertEquals(1, view.types().size());
        assertEquals(1, view.flags().size());

        assertTrue(inspector.module("mod:0xa::pool").isPresent());
        assertTrue(inspector.module("0xa::missing").isEmpty());
    }

    @Test
    void typeViewCapsSamples() {
        GraphInspector.TypeView view = inspector.type("0xA::POOL::pool").orElseThrow();
        assertEquals("0xa::pool::Pool", view.type().fqn);
        assertEquals(12, view.objectCount());
        assertEquals(GraphInspector.MAX_SAMPLES, view.samples().size());
        assertEquals("0xa::pool", view.definedBy());
        assertEquals(List.of("0x2::balance::Balance"), view.usesTypes());
        assertEquals(12, view.stats().count);
    }

    @Test
    void objectViewSplitsRelations() {
        GraphInspector.ObjectView view = inspector.object("0x100").orElseThrow();
        assertEquals(List.of("obj:0x101"), view.children());
        assertTrue(view.parents().isEmpty());
        assertEquals(List.of("obj:0x102"), view.refs());
        assertEquals(1, view.flags().size());

        assertEquals(List.of("obj:0x100"), inspector.object("obj:0x101").orElseThrow().parents());
    }

    @Test
    void edgeLookup() {
        assertEquals(EdgeKind.MOD_FRIEND_ALLOW,
                inspector.edge("mod:0xa::pool", "mod:0xa::router").orElseThrow().kind);
        assertTrue(inspector.edge("mod:0x2::coin", "mod:0xa::pool").isEmpty());
    }
}

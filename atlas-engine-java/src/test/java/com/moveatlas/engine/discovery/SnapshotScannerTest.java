package com.moveatlas.engine.discovery;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.moveatlas.engine.InMemoryChain.objectId;
import static org.junit.jupiter.api.Assertions.*;

class SnapshotScannerTest {

    @Test
    void findsNestedObjectIds() {
        JsonObject snapshot = JsonParser.parseString("{\"pool\": {\"id\": \"" + objectId(7) + "\"},"
                + " \"list\": [\"" + objectId(8) + "\", \"0x2\"], \"name\": \"x\"}").getAsJsonObject();
        assertEquals(List.of(objectId(7), objectId(8)), SnapshotScanner.scan(snapshot));
    }

    @Test
    void shortHexIsNotAnObjectId() {
        JsonObject snapshot = JsonParser.parseString("{\"owner\": \"0xb0b\"}").getAsJsonObject();
        assertTrue(SnapshotScanner.scan(snapshot).isEmpty());
    }

    @Test
    void depthIsBounded() {
        // value sits at depth 5
        JsonObject snapshot = JsonParser.parseString(
                "{\"a\":{\"b\":{\"c\":{\"d\":{\"e\":\"" + objectId(1) + "\"}}}}}").getAsJsonObject();
        assertTrue(SnapshotScanner.scan(snapshot).isEmpty());

        JsonObject shallower = JsonParser.parseString(
                "{\"a\":{\"b\":{\"c\":{\"d\":\"" + objectId(1) + "\"}}}}").getAsJsonObject();
        assertEquals(1, SnapshotScanner.scan(shallower).size());
    }

    @Test
    void hitCountIsBounded() {
        JsonArray many = new JsonArray();
        for (int i = 1; i <= 30; i++) many.add(objectId(i));
        JsonObject snapshot = new JsonObject();
        snapshot.add("ids", many);
        assertEquals(SnapshotScanner.MAX_HITS, SnapshotScanner.scan(snapshot).size());
    }

    @Test
    void nullSnapshotYieldsNothing() {
        assertTrue(SnapshotScanner.scan(null).isEmpty());
    }
}

package com.moveatlas.engine.static_analysis;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.moveatlas.engine.ModuleJson;
import org.junit.jupiter.api.Test;

import static com.moveatlas.engine.ModuleJson.*;
import static org.junit.jupiter.api.Assertions.*;

class ModuleDescriptorParserTest {

    private final ModuleDescriptorParser parser = new ModuleDescriptorParser();

    @Test
    void parsesFunctionsStructsAndFriends() {
        JsonObject raw = new ModuleJson()
                .withStruct("Pool", abilities("Key", "Store"), "id", struct("0x2", "object", "UID"))
                .withFunction("swap", "Public", true, ref(struct("0xa", "pool", "Pool")))
                .withFriend("0xa", "router")
                .build();

        ModuleDescriptor d = parser.parse("pool", raw);
        assertEquals(1, d.functions().size());
        assertEquals("swap", d.functions().get(0).name());
        assertTrue(d.functions().get(0).isEntry());
        assertEquals(1, d.structs().size());
        assertEquals(java.util.List.of("Key", "Store"), d.structs().get(0).abilities());
        assertEquals("0xa::router", d.friends().get(0).fqn());
    }

    @Test
    void missingReturnKeyIsRecordedAsAbsent() {
        JsonObject raw = new ModuleJson()
                .withFunction("noop", "Private", false, new com.google.gson.JsonElement[0], null)
                .build();
        ModuleDescriptor d = parser.parse("m", raw);
        assertNull(d.functions().get(0).rawReturn());
        assertTrue(d.functions().get(0).returns().isEmpty());
    }

    @Test
    void malformedEntriesAreSkipped() {
        JsonObject raw = JsonParser.parseString("""
            {
              "exposedFunctions": { "broken": 42 },
              "structs": {
                "S": { "abilities": { "abilities": ["Copy"] },
                       "fields": [ { "type": "U8" }, { "name": "ok", "type": "U8" } ] },
                "Bad": "oops"
              },
              "friends": [ { "address": "0x1" }, { "address": "0x1", "name": "f" } ]
            }
            """).getAsJsonObject();

        ModuleDescriptor d = parser.parse("m", raw);
        assertTrue(d.functions().isEmpty());
        assertEquals(1, d.structs().size());
        assertEquals(1, d.structs().get(0).fields().size());
        assertEquals("ok", d.structs().get(0).fields().get(0).name());
        assertEquals(1, d.friends().size());
    }

    @Test
    void emptyModuleParsesToEmptyDescriptor() {
        ModuleDescriptor d = parser.parse("m", new JsonObject());
        assertTrue(d.functions().isEmpty());
        assertTrue(d.structs().isEmpty());
        assertTrue(d.friends().isEmpty());
    }
}

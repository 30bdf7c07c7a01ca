package com.moveatlas.engine.static_analysis;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.moveatlas.engine.ModuleJson.*;
import static org.junit.jupiter.api.Assertions.*;

class MoveTypeTest {

    @Test
    void primitiveStringHasNoReferences() {
        MoveType t = MoveType.parse(prim("U64"));
        assertInstanceOf(MoveType.Primitive.class, t);
        assertEquals("U64", t.render());
        assertTrue(t.referencedTypes().isEmpty());
    }

    @Test
    void qualifiedStringIsNamedReference() {
        MoveType t = MoveType.parse(prim("0x2::sui::SUI"));
        assertInstanceOf(MoveType.Named.class, t);
        assertEquals(List.of("0x2::sui::SUI"), t.referencedTypes());
    }

    @Test
    void structReferencesIncludeTypeArguments() {
        MoveType t = MoveType.parse(mutRef(struct("0x2", "coin", "Coin", struct("0x2", "sui", "SUI"))));
        assertInstanceOf(MoveType.Reference.class, t);
        assertTrue(((MoveType.Reference) t).mutable());
        assertEquals(List.of("0x2::coin::Coin", "0x2::sui::SUI"), t.referencedTypes());
    }

    @Test
    void vectorOfStructsReferencesElement() {
        MoveType t = MoveType.parse(vector(struct("0xabc", "pool", "Pool")));
        assertInstanceOf(MoveType.Vector.class, t);
        assertEquals(List.of("0xabc::pool::Pool"), t.referencedTypes());
    }

    @Test
    void typeParameterRecordsIndex() {
        JsonObject json = JsonParser.parseString("{\"TypeParameter\": 1}").getAsJsonObject();
        MoveType t = MoveType.parse(json);
        assertEquals(1, ((MoveType.TypeParameter) t).index());
        assertEquals("{\"TypeParameter\":1}", t.render());
    }

    @Test
    void unknownShapeIsOpaqueButStillWalked() {
        JsonObject json = JsonParser.parseString(
                "{\"Wrapped\": {\"Struct\": {\"address\": \"0x5\", \"module\": \"m\", \"name\": \"T\", \"typeArguments\": []}}}")
                .getAsJsonObject();
        MoveType t = MoveType.parse(json);
        assertInstanceOf(MoveType.Opaque.class, t);
        assertEquals(List.of("0x5::m::T"), t.referencedTypes());
        assertTrue(t.render().startsWith("{\"Wrapped\""));
    }

    @Test
    void structMissingNameIsOpaque() {
        JsonObject json = JsonParser.parseString("{\"Struct\": {\"address\": \"0x5\", \"module\": \"m\"}}")
                .getAsJsonObject();
        assertInstanceOf(MoveType.Opaque.class, MoveType.parse(json));
    }

    @Test
    void nullIsOpaque() {
        MoveType t = MoveType.parse(null);
        assertEquals("null", t.render());
        assertTrue(t.referencedTypes().isEmpty());
    }
}

package com.moveatlas.engine.source;

import com.google.gson.JsonObject;

import java.util.List;

/**
 * Recent events emitted by a package.
 */
@FunctionalInterface
public interface EventSource {

    List<ChainEvent> queryEvents(String packageId, int limit);

    /**
     * @param timestampMs may be null
     * @param parsedJson  may be null
     */
    record ChainEvent(
        String txDigest,
        String eventSeq,
        String type,
        Long timestampMs,
        JsonObject parsedJson,
        String sender
    ) {}
}

package com.moveatlas.engine.source;

import com.google.gson.JsonObject;

/**
 * One object as returned by an {@link ObjectPageSource}, already decoded at the source boundary.
 *
 * @param content decoded Move content, may be null
 */
public record ChainObject(
    String objectId,
    String version,
    String digest,
    OwnerInfo owner,
    JsonObject content
) {}

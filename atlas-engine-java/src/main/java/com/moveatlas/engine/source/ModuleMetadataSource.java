package com.moveatlas.engine.source;

import com.google.gson.JsonObject;

import java.util.Map;

/**
 * Normalized Move module metadata for a published package.
 */
@FunctionalInterface
public interface ModuleMetadataSource {

    /**
     * @return module key → raw normalized module description, in source order
     * @throws SourceException with {@link SourceException#isNotFound()} when the package does not exist
     */
    Map<String, JsonObject> getNormalizedModules(String packageAddress);
}

package com.moveatlas.engine.source;

/**
 * The collaborators one package analysis reads from, all bound to the same network.
 */
public record ChainSources(
    Network network,
    ModuleMetadataSource modules,
    ObjectPageSource objects,
    DynamicFieldSource dynamicFields,
    EventSource events
) {}

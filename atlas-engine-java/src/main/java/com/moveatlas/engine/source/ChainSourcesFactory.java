package com.moveatlas.engine.source;

/**
 * Creates the chain sources bound to one network.
 */
@FunctionalInterface
public interface ChainSourcesFactory {

    ChainSources forNetwork(Network network);
}

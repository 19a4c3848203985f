package io.dynamis.assets.core;

/**
 * Narrow seam through which an Asset hands itself to the loading pipeline.
 *
 * Implemented by AssetManager. Assets only see this interface, never the manager's
 * counters or registry.
 */
public interface AssetLoadQueue {

    /**
     * Schedules the asset for decoding on the loader thread at its current priority.
     * Called from Asset.load() on the main thread after the asset has entered LOADING.
     * Never blocks.
     *
     * @throws IllegalStateException if the pipeline has been shut down
     */
    void enqueue(Asset asset);
}

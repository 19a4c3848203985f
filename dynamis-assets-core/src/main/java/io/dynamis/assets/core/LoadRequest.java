package io.dynamis.assets.core;

import java.util.Comparator;

/**
 * One entry of the loader's priority queue.
 *
 * The priority is captured at enqueue time. Changing an asset's priority afterwards
 * only affects requests enqueued later; entries already in the heap never move.
 *
 * @param asset    asset to decode
 * @param priority asset priority at the moment of enqueue
 */
public record LoadRequest(Asset asset, int priority) {

    /**
     * Dequeue order: strictly higher priority first, then the asset created earliest.
     * Two requests for distinct assets never compare equal.
     */
    public static final Comparator<LoadRequest> LOAD_ORDER =
        Comparator.comparingInt(LoadRequest::priority).reversed()
                  .thenComparingLong(r -> r.asset().creationId());

    public LoadRequest {
        if (asset == null) {
            throw new NullPointerException("asset");
        }
    }

    /** Snapshots the asset's current priority. */
    public static LoadRequest of(Asset asset) {
        return new LoadRequest(asset, asset.priority());
    }
}

package io.dynamis.assets.api;

/**
 * Lifecycle states for an Asset.
 *
 * The unloading phase is not a state of its own. It is a transient flag that is
 * only set while a synchronous unload() runs on the caller thread.
 *
 * Valid transitions:
 *   UNLOADED -> LOADING   (load() called, request enqueued)
 *   LOADING  -> LOADED    (manager poll drained the completion)
 *   LOADED   -> UNLOADED  (unload() called)
 *   UNLOADED -> UNLOADED  (unload() on a never-loaded asset)
 *
 * LOADING -> UNLOADED is not a valid transition. unload() on a LOADING asset
 * throws IllegalStateException.
 */
public enum AssetState {

    /** Not in memory. No queue entry. */
    UNLOADED,

    /**
     * A load request has been handed to the manager. The asset may be queued,
     * decoding on the loader thread, or waiting in the results queue for the next poll.
     * An asset whose decode crashed the loader stays here.
     */
    LOADING,

    /** Decoded and usable. Completion callbacks have fired. */
    LOADED
}

package io.dynamis.assets.core;

import io.dynamis.assets.api.AssetConfig;
import io.dynamis.assets.api.AssetState;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A named, lazily loaded media resource.
 *
 * Each concrete kind (sounds, images, ...) extends this class and implements the
 * byte-level doLoad() / doUnload() hooks. Everything else - state, callbacks,
 * priority, hand-off to the loader - lives here.
 *
 * STATE MACHINE:
 *   UNLOADED -> LOADING  load() enqueues a request
 *   LOADING  -> LOADED   markLoaded() from the manager's poll; ignored in any other state
 *   LOADED   -> UNLOADED unload(), with the unloading flag set while doUnload() runs
 *
 * THREADING MODEL:
 *   - load(), unload() and markLoaded() run on the host's main thread only.
 *   - doLoad() runs on the loader thread. It reads state (via isLoaded()) but never writes it.
 *   - State and priority are volatile so the loader sees the main thread's writes.
 *   - The decode lock serialises doLoad() against doUnload() of the same asset.
 *     It does not guard the state fields.
 *
 * DUPLICATE REQUESTS:
 *   load() on an asset that is already LOADING enqueues a second request. This is legal:
 *   the loader skips the decode if the asset is LOADED by the time it dequeues the entry.
 */
public abstract class Asset {

    private static final Logger LOG = LoggerFactory.getLogger(Asset.class);

    // -- Identity -------------------------------------------------------------

    private static final AtomicLong CREATION_SEQUENCE = new AtomicLong(1L);

    private final long creationId;
    private final String classId;
    private final String name;
    private final Path filePath;
    private final AssetConfig config;
    private final AssetLoadQueue loadQueue;

    // -- State (main thread writes, loader thread reads) ---------------------

    private volatile AssetState state = AssetState.UNLOADED;
    private volatile boolean unloading = false;
    private volatile int priority;

    /** Pending completion callbacks. Main thread only. Identity set. */
    private final Set<LoadCallback<Asset>> callbacks =
        Collections.newSetFromMap(new IdentityHashMap<>());

    private final ReentrantLock decodeLock = new ReentrantLock();

    // -- Construction ---------------------------------------------------------

    /**
     * @param loadQueue pipeline this asset enqueues itself on; normally the AssetManager
     * @param classId   registry attribute of the asset kind, e.g. "sounds"
     * @param name      unique name within the kind's registry
     * @param filePath  absolute path of the backing file
     * @param config    merged asset config; its "priority" key seeds the load priority
     */
    protected Asset(AssetLoadQueue loadQueue, String classId, String name,
                    Path filePath, AssetConfig config) {
        if (loadQueue == null) throw new NullPointerException("loadQueue");
        if (classId == null) throw new NullPointerException("classId");
        if (name == null) throw new NullPointerException("name");
        if (filePath == null) throw new NullPointerException("filePath");
        if (config == null) throw new NullPointerException("config");
        this.creationId = CREATION_SEQUENCE.getAndIncrement();
        this.loadQueue = loadQueue;
        this.classId = classId;
        this.name = name;
        this.filePath = filePath;
        this.config = config;
        this.priority = config.priority();
    }

    // -- Concrete kind hooks --------------------------------------------------

    /**
     * Decodes the backing file into memory.
     *
     * Runs on the loader thread and may block. Must not touch manager state or this
     * asset's lifecycle state. Any exception is fatal to the loader thread.
     */
    protected abstract void doLoad() throws IOException;

    /**
     * Releases decoded data. Runs synchronously on the main thread.
     * Must be idempotent and must tolerate an asset that was never loaded.
     */
    protected abstract void doUnload();

    // -- Public lifecycle -----------------------------------------------------

    /** Requests a load with no completion callback. */
    public final void load() {
        load(null);
    }

    /**
     * Requests a load at a new priority. The priority only affects requests enqueued
     * from now on; a request already waiting in the queue keeps its position.
     */
    public final void load(LoadCallback<Asset> callback, int priority) {
        this.priority = priority;
        load(callback);
    }

    /**
     * Requests a load.
     *
     * If the asset is already LOADED the pending callbacks, including this one, fire
     * synchronously before this method returns and nothing is enqueued. Otherwise the
     * asset enters LOADING and is handed to the load queue. Never blocks.
     *
     * @param callback fired once when the asset is loaded; null for none
     */
    public final void load(LoadCallback<Asset> callback) {
        if (callback != null) {
            callbacks.add(callback);
        }

        if (state == AssetState.LOADED) {
            fireCallbacks();
            return;
        }

        if (unloading) {
            LOG.debug("Load of {} '{}' requested while unloading; enqueuing", classId, name);
        }

        state = AssetState.LOADING;
        loadQueue.enqueue(this);
    }

    /**
     * Unloads synchronously. Safe on an asset that was never loaded; doUnload() still runs.
     *
     * @throws IllegalStateException if the asset is LOADING. A queued or in-flight decode
     *                               cannot be cancelled.
     */
    public final void unload() {
        if (state == AssetState.LOADING) {
            throw new IllegalStateException(
                "Cannot unload " + classId + " '" + name + "' while it is loading");
        }
        unloading = true;
        state = AssetState.UNLOADED;
        decodeLock.lock();
        try {
            doUnload();
        } finally {
            decodeLock.unlock();
            unloading = false;
        }
        LOG.debug("Unloaded {} '{}'", classId, name);
    }

    // -- Pipeline internals ---------------------------------------------------

    /** Called by the loader thread. Holds the decode lock for the duration of doLoad(). */
    final void decode() throws IOException {
        decodeLock.lock();
        try {
            doLoad();
        } finally {
            decodeLock.unlock();
        }
    }

    /**
     * Marks a LOADING asset LOADED and fires its callbacks. Called only by the manager's
     * poll, on the main thread.
     *
     * A completion that finds the asset in any other state is stale (a skipped duplicate
     * whose asset was unloaded since, or one drained after the first completion) and
     * changes nothing.
     *
     * @return true if the asset transitioned to LOADED
     */
    final boolean markLoaded() {
        if (state != AssetState.LOADING) {
            LOG.debug("Ignoring stale completion of {} '{}' in state {}", classId, name, state);
            return false;
        }
        state = AssetState.LOADED;
        unloading = false;
        LOG.debug("Loaded {} '{}'", classId, name);
        fireCallbacks();
        return true;
    }

    /**
     * Fires and clears the pending callbacks. Every callback runs even if an earlier one
     * throws; the first failure is rethrown afterwards with later ones suppressed.
     */
    private void fireCallbacks() {
        if (callbacks.isEmpty()) {
            return;
        }
        // Drain first: a callback may call load() again and register new callbacks.
        List<LoadCallback<Asset>> pending = new ArrayList<>(callbacks);
        callbacks.clear();
        RuntimeException failure = null;
        for (LoadCallback<Asset> callback : pending) {
            try {
                callback.onLoaded(this);
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    // -- Accessors ------------------------------------------------------------

    /** Monotonically assigned at construction. Breaks priority ties in the load queue. */
    public final long creationId() { return creationId; }

    /** Registry attribute of this asset's kind. */
    public final String classId() { return classId; }

    public final String name() { return name; }

    public final Path filePath() { return filePath; }

    public final AssetConfig config() { return config; }

    /** Priority used for the next enqueue. Higher loads first. */
    public final int priority() { return priority; }

    public final AssetState state() { return state; }

    /** Safe to read from any thread. */
    public final boolean isLoaded() { return state == AssetState.LOADED; }

    public final boolean isLoading() { return state == AssetState.LOADING; }

    /** True only while unload() is running. */
    public final boolean isUnloading() { return unloading; }

    /** Number of callbacks waiting for the next completion. */
    public final int pendingCallbackCount() { return callbacks.size(); }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + classId + "/" + name
            + ", state=" + state + ", priority=" + priority + "}";
    }
}

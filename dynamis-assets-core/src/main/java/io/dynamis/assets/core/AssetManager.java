package io.dynamis.assets.core;

import io.dynamis.assets.api.AssetConfigurationException;
import io.dynamis.assets.api.AssetConstants;
import io.dynamis.assets.api.AssetProgressListener;
import io.dynamis.assets.api.BootGate;
import io.dynamis.assets.api.CrashReporter;
import io.dynamis.assets.api.LoadingProgress;
import io.dynamis.assets.api.PollScheduler;
import io.dynamis.assets.api.RemoteProgress;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.PriorityBlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates asset registration, background loading and progress reporting.
 *
 * Owns the load queue, the loaded queue, the AssetLoader thread and the progress
 * counters. Assets enqueue themselves through the AssetLoadQueue seam; the host drives
 * poll() from its frame loop through the PollScheduler.
 *
 * PIPELINE:
 *   Asset.load() -> enqueue(): pending++, request pushed by priority, poll armed.
 *   Loader thread: decode, push onto the loaded queue.
 *   poll(): drain completions, loaded++, markLoaded() each, one progress event each.
 *           When loaded == pending both reset to zero and the poll is disarmed.
 *
 * BOOT GATE:
 *   The first progress event with nothing remaining, local or remote, while the host has
 *   not completed boot clears the "assets" hold. At most once per manager.
 *
 * THREAD SAFETY:
 *   Everything except the queues is main-thread only: registration, registry, counters,
 *   poll, remote reports. The registry is only mutated during discovery, before loads start.
 *   Listeners: CopyOnWriteArrayList - may be added from any thread.
 */
public final class AssetManager implements AssetLoadQueue {

    private static final Logger LOG = LoggerFactory.getLogger(AssetManager.class);

    private static final int INITIAL_QUEUE_CAPACITY = 64;

    // -- Collaborators --------------------------------------------------------

    private final BootGate bootGate;
    private final PollScheduler pollScheduler;

    // -- Asset classes and registry -------------------------------------------

    /** Registrations in descending class priority. Stable for equal priorities. */
    private final List<AssetClassRegistration> registrations = new ArrayList<>();

    /** attribute -> (case-insensitive name -> asset). */
    private final Map<String, Map<String, Asset>> registry = new HashMap<>();

    // -- Loading pipeline -----------------------------------------------------

    private final PriorityBlockingQueue<LoadRequest> loadQueue =
        new PriorityBlockingQueue<>(INITIAL_QUEUE_CAPACITY, LoadRequest.LOAD_ORDER);
    private final LinkedBlockingQueue<Asset> loadedQueue = new LinkedBlockingQueue<>();
    private final AssetLoader loader;

    private final Runnable pollTask = this::poll;
    private boolean pollArmed = false;
    private volatile boolean shutdown = false;

    // -- Progress -------------------------------------------------------------

    private final LoadProgressCounters counters = new LoadProgressCounters();
    private final CopyOnWriteArrayList<AssetProgressListener> listeners =
        new CopyOnWriteArrayList<>();
    private boolean bootHoldCleared = false;

    // -- Construction ---------------------------------------------------------

    /**
     * Creates the manager and starts its loader thread.
     *
     * @param bootGate      host boot gate; BootGate.NONE if the host has none
     * @param crashReporter receives the loader thread's trace if it dies
     * @param pollScheduler runs poll() on the main thread while loads are outstanding
     */
    public AssetManager(BootGate bootGate, CrashReporter crashReporter, PollScheduler pollScheduler) {
        this(bootGate, crashReporter, pollScheduler, AssetConstants.LOADER_POLL_TIMEOUT_MS);
    }

    /**
     * @param loaderPollTimeoutMs upper bound of one blocking poll on the loader thread
     */
    public AssetManager(BootGate bootGate, CrashReporter crashReporter,
                        PollScheduler pollScheduler, long loaderPollTimeoutMs) {
        if (bootGate == null) throw new NullPointerException("bootGate");
        if (crashReporter == null) throw new NullPointerException("crashReporter");
        if (pollScheduler == null) throw new NullPointerException("pollScheduler");
        this.bootGate = bootGate;
        this.pollScheduler = pollScheduler;
        this.loader = new AssetLoader(loadQueue, loadedQueue, crashReporter, loaderPollTimeoutMs);
        this.loader.start();
    }

    // -- Asset class registration ---------------------------------------------

    /**
     * Registers an asset kind. Called once per kind at startup.
     *
     * @throws AssetConfigurationException if the attribute is already registered
     */
    public void registerAssetClass(AssetClassRegistration registration) {
        if (registration == null) {
            throw new NullPointerException("registration");
        }
        if (registry.containsKey(registration.attribute())) {
            throw new AssetConfigurationException(
                "Asset class attribute '" + registration.attribute() + "' is already registered");
        }
        registry.put(registration.attribute(), new TreeMap<>(String.CASE_INSENSITIVE_ORDER));
        registrations.add(registration);
        // List.sort is stable: equal class priorities keep registration order.
        registrations.sort(
            Comparator.comparingInt(AssetClassRegistration::classPriority).reversed());
        LOG.info("Registered asset class {}", registration);
    }

    /** Registrations in descending class priority. Unmodifiable. */
    public List<AssetClassRegistration> registrations() {
        return Collections.unmodifiableList(registrations);
    }

    /** Registration for the attribute, or null if not registered. */
    public AssetClassRegistration registration(String attribute) {
        for (AssetClassRegistration r : registrations) {
            if (r.attribute().equals(attribute)) {
                return r;
            }
        }
        return null;
    }

    // -- Registry (discovery phase) -------------------------------------------

    /**
     * Adds an asset to its kind's registry. Replaces an existing asset of the same name.
     * Discovery phase only.
     *
     * @throws AssetConfigurationException if the asset's kind is not registered
     */
    public void addAsset(Asset asset) {
        if (asset == null) {
            throw new NullPointerException("asset");
        }
        Map<String, Asset> byName = registry.get(asset.classId());
        if (byName == null) {
            throw new AssetConfigurationException(
                "Asset class '" + asset.classId() + "' is not registered (asset '"
                    + asset.name() + "')");
        }
        Asset previous = byName.put(asset.name(), asset);
        if (previous != null && previous != asset) {
            LOG.debug("Replaced {} '{}' in registry", asset.classId(), asset.name());
        }
    }

    /** Returns the named asset of the kind, or null. Name lookup is case-insensitive. */
    public Asset getAsset(String attribute, String name) {
        Map<String, Asset> byName = registry.get(attribute);
        return byName == null ? null : byName.get(name);
    }

    /**
     * All assets of one kind, ordered by name. Unmodifiable.
     *
     * @throws AssetConfigurationException if the kind is not registered
     */
    public Collection<Asset> assets(String attribute) {
        Map<String, Asset> byName = registry.get(attribute);
        if (byName == null) {
            throw new AssetConfigurationException(
                "Asset class '" + attribute + "' is not registered");
        }
        return Collections.unmodifiableCollection(byName.values());
    }

    /** Total number of registered assets across all kinds. */
    public int assetCount() {
        int count = 0;
        for (Map<String, Asset> byName : registry.values()) {
            count += byName.size();
        }
        return count;
    }

    // -- Bulk load / unload ---------------------------------------------------

    /**
     * Loads every asset whose "load" key equals keyName, each at its own priority.
     *
     * @return the assets triggered, in class-priority then name order
     */
    public Set<Asset> loadByKey(String keyName) {
        return loadByKey(keyName, null);
    }

    /**
     * Loads every asset whose "load" key equals keyName at the given priority.
     *
     * @return the assets triggered, in class-priority then name order; pass them to
     *         unloadAssets() to undo exactly this call
     */
    public Set<Asset> loadByKey(String keyName, int priority) {
        return loadByKey(keyName, Integer.valueOf(priority));
    }

    private Set<Asset> loadByKey(String keyName, Integer priority) {
        if (keyName == null) {
            throw new NullPointerException("keyName");
        }
        Set<Asset> triggered = new LinkedHashSet<>();
        for (AssetClassRegistration r : registrations) {
            for (Asset asset : registry.get(r.attribute()).values()) {
                if (keyName.equals(asset.config().loadKey())) {
                    triggered.add(asset);
                }
            }
        }
        for (Asset asset : triggered) {
            if (priority == null) {
                asset.load();
            } else {
                asset.load(null, priority);
            }
        }
        LOG.debug("Load key '{}' triggered {} asset(s)", keyName, triggered.size());
        return triggered;
    }

    /**
     * Loads the assets scheduled for a mode's start at the mode's priority.
     *
     * @return handle that unloads exactly these assets when the mode stops
     */
    public ModeAssets loadModeAssets(String modeName, int priority) {
        if (modeName == null) {
            throw new NullPointerException("modeName");
        }
        Set<Asset> assets = loadByKey(AssetConstants.modeStartKey(modeName), priority);
        return new ModeAssets(modeName, assets, this);
    }

    /**
     * Loads every asset marked "preload". If that leaves nothing outstanding (nothing to
     * preload, or all of it already loaded) the boot hold is released immediately, since
     * no completion will ever release it.
     *
     * @return the assets triggered
     */
    public Set<Asset> preload() {
        Set<Asset> assets = loadByKey(AssetConstants.LOAD_PRELOAD);
        if (assets.isEmpty()) {
            LOG.info("No assets to preload");
        }
        if (counters.remaining() == 0) {
            releaseBootHoldIfPending();
        }
        return assets;
    }

    /** Unloads each asset. Kinds may be mixed. Order unspecified. */
    public void unloadAssets(Collection<? extends Asset> assets) {
        if (assets == null) {
            throw new NullPointerException("assets");
        }
        for (Asset asset : assets) {
            asset.unload();
        }
    }

    // -- AssetLoadQueue -------------------------------------------------------

    @Override
    public void enqueue(Asset asset) {
        if (asset == null) {
            throw new NullPointerException("asset");
        }
        if (shutdown) {
            throw new IllegalStateException(
                "AssetManager is shut down; cannot load " + asset.classId() + " '" + asset.name() + "'");
        }
        counters.recordEnqueued();
        // A request may be queued more than once for the same asset; the loader skips
        // the decode if the asset is loaded by the time it dequeues.
        loadQueue.put(LoadRequest.of(asset));
        if (!pollArmed) {
            pollArmed = true;
            pollScheduler.arm(pollTask);
        }
    }

    // -- Poll (main thread) ---------------------------------------------------

    /**
     * Drains completed loads. Called by the PollScheduler on the main thread while armed.
     *
     * For each completion: loaded++, markLoaded() (fires asset callbacks unless the
     * completion is stale), one progress event. Once every pending request has completed
     * the local counters reset to zero and the poll disarms itself until the next enqueue.
     *
     * A callback that throws propagates out of this call after its completion has been
     * counted and reported. Undrained completions are handled by the next poll.
     */
    public void poll() {
        Asset asset;
        while ((asset = loadedQueue.poll()) != null) {
            // Counted before callbacks run: a throwing callback still counts as a completion.
            counters.recordLoaded();
            try {
                asset.markLoaded();
            } finally {
                postProgress();
            }
        }
        if (counters.isLocalComplete()) {
            counters.resetLocal();
            disarmPoll();
        }
    }

    private void disarmPoll() {
        if (pollArmed) {
            pollArmed = false;
            pollScheduler.disarm();
        }
    }

    /** True while the poll is armed, i.e. local loads are outstanding. */
    public boolean isPolling() { return pollArmed; }

    // -- Remote progress ------------------------------------------------------

    /**
     * Records progress self-reported by an out-of-process client and emits a combined
     * progress event.
     *
     * @throws IllegalArgumentException if a count is negative or remaining exceeds total
     */
    public void reportRemoteProgress(int total, int remaining) {
        reportRemoteProgress(new RemoteProgress(total, remaining));
    }

    public void reportRemoteProgress(RemoteProgress report) {
        if (report == null) {
            throw new NullPointerException("report");
        }
        counters.applyRemote(report);
        postProgress();
    }

    // -- Progress -------------------------------------------------------------

    /** Registers a progress listener. Thread-safe. */
    public void addProgressListener(AssetProgressListener listener) {
        if (listener != null) listeners.add(listener);
    }

    /** Removes a progress listener. Thread-safe. */
    public void removeProgressListener(AssetProgressListener listener) {
        listeners.remove(listener);
    }

    private void postProgress() {
        LoadingProgress progress = counters.snapshot();
        LOG.debug("Loading assets: {}/{} ({}%)",
            progress.loaded(), progress.total(), progress.percent());
        for (AssetProgressListener l : listeners) {
            try {
                l.onLoadingProgress(progress);
            } catch (RuntimeException e) {
                LOG.warn("Progress listener {} failed", l, e);
            }
        }
        if (progress.isComplete()) {
            releaseBootHoldIfPending();
        }
    }

    private void releaseBootHoldIfPending() {
        if (!bootHoldCleared && !bootGate.isBootComplete()) {
            bootHoldCleared = true;
            LOG.info("All boot-time assets loaded; clearing boot hold '{}'",
                AssetConstants.BOOT_HOLD_ASSETS);
            bootGate.clearBootHold(AssetConstants.BOOT_HOLD_ASSETS);
        }
    }

    /** Current combined progress. */
    public LoadingProgress progress() { return counters.snapshot(); }

    /** Combined completion percentage; 100 when nothing is outstanding. */
    public int loadingPercent() { return counters.loadingPercent(); }

    /** Local requests since the last reset. */
    public int pendingCount() { return counters.pendingCount(); }

    /** Local completions since the last reset. */
    public int loadedCount() { return counters.loadedCount(); }

    public int remoteTotal() { return counters.remoteTotal(); }

    public int remoteLoaded() { return counters.remoteLoaded(); }

    /** Local plus remote work not yet complete. */
    public int remainingCount() { return counters.remaining(); }

    // -- Shutdown -------------------------------------------------------------

    /**
     * Stops the loader thread, blocking until it exits, and discards queued requests
     * and undrained completions. Further load requests throw IllegalStateException.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        loader.stop();
        disarmPoll();
        LOG.info("AssetManager shut down");
    }

    public boolean isShutdown() { return shutdown; }

    // -- Diagnostics ----------------------------------------------------------

    /** Requests waiting for the loader thread (approximate - the loader drains concurrently). */
    public int queuedRequestCount() { return loadQueue.size(); }

    /** Completions waiting for the next poll (approximate). */
    public int undrainedCompletionCount() { return loadedQueue.size(); }

    /** True while the loader thread runs. False after shutdown() or a loader crash. */
    public boolean isLoaderAlive() { return loader.isAlive(); }

    /** Exposes the loader for telemetry and tests. */
    public AssetLoader loader() { return loader; }
}

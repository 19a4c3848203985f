package io.dynamis.assets.core;

import io.dynamis.assets.api.AssetConstants;
import io.dynamis.assets.api.CrashReporter;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background worker that decodes assets off the main thread.
 *
 * Owns one dedicated platform thread. Drains the load queue in LoadRequest.LOAD_ORDER,
 * decodes each asset and deposits it on the loaded queue for the manager's poll.
 * Has no reference to the manager: both queues are the only shared state.
 *
 * LOOP:
 *   1. Poll the load queue with a short timeout so the stop flag is observed promptly.
 *   2. If stopped, exit.
 *   3. If the asset is not LOADED, decode it under its decode lock; otherwise skip.
 *   4. Push the asset onto the loaded queue, decoded or skipped, so the poll still
 *      fires callbacks and counts the completion.
 *
 * FAILURE CONTRACT:
 *   Any Throwable escaping a decode, Errors included, terminates the thread. The formatted trace is
 *   logged and forwarded once to the CrashReporter. No retry. The failing asset never
 *   reaches the loaded queue and stays LOADING.
 *
 * SHUTDOWN:
 *   stop() blocks until the thread has exited. A decode in progress runs to completion.
 *   Entries not yet started are discarded from both queues.
 */
public final class AssetLoader implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(AssetLoader.class);

    private final BlockingQueue<LoadRequest> loadQueue;
    private final BlockingQueue<Asset> loadedQueue;
    private final CrashReporter crashReporter;
    private final long pollTimeoutMs;
    private final Thread thread;

    private volatile boolean running = false;

    // -- Telemetry ------------------------------------------------------------

    private final AtomicLong decodedCount = new AtomicLong();
    private final AtomicLong skippedCount = new AtomicLong();

    // -- Construction ---------------------------------------------------------

    /**
     * @param loadQueue     requests waiting to be decoded; must order by LoadRequest.LOAD_ORDER
     * @param loadedQueue   receives assets whose request has been served
     * @param crashReporter receives the trace if the thread dies
     * @param pollTimeoutMs upper bound of one blocking poll; must be >= 1
     */
    public AssetLoader(BlockingQueue<LoadRequest> loadQueue,
                       BlockingQueue<Asset> loadedQueue,
                       CrashReporter crashReporter,
                       long pollTimeoutMs) {
        if (loadQueue == null) throw new NullPointerException("loadQueue");
        if (loadedQueue == null) throw new NullPointerException("loadedQueue");
        if (crashReporter == null) throw new NullPointerException("crashReporter");
        if (pollTimeoutMs < 1) {
            throw new IllegalArgumentException("pollTimeoutMs must be >= 1; got " + pollTimeoutMs);
        }
        this.loadQueue = loadQueue;
        this.loadedQueue = loadedQueue;
        this.crashReporter = crashReporter;
        this.pollTimeoutMs = pollTimeoutMs;
        this.thread = new Thread(this, AssetConstants.LOADER_THREAD_NAME);
        this.thread.setDaemon(true);
    }

    /** Constructs with the default poll timeout from AssetConstants. */
    public AssetLoader(BlockingQueue<LoadRequest> loadQueue,
                       BlockingQueue<Asset> loadedQueue,
                       CrashReporter crashReporter) {
        this(loadQueue, loadedQueue, crashReporter, AssetConstants.LOADER_POLL_TIMEOUT_MS);
    }

    // -- Lifecycle ------------------------------------------------------------

    /**
     * Starts the loader thread.
     *
     * @throws IllegalStateException if already started
     */
    public void start() {
        if (thread.getState() != Thread.State.NEW) {
            throw new IllegalStateException("AssetLoader already started");
        }
        running = true;
        thread.start();
        LOG.info("Asset loader thread '{}' started", thread.getName());
    }

    /**
     * Stops the loader thread and blocks until it has exited, then discards every entry
     * left in both queues. Idempotent.
     */
    public void stop() {
        running = false;
        if (thread.isAlive()) {
            boolean interrupted = false;
            while (thread.isAlive()) {
                try {
                    thread.join();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            LOG.info("Asset loader thread '{}' stopped", thread.getName());
        }
        loadQueue.clear();
        loadedQueue.clear();
    }

    /** True while the loader thread is running. False before start(), after stop() or a crash. */
    public boolean isAlive() {
        return thread.isAlive();
    }

    // -- Loop (loader thread) -------------------------------------------------

    @Override
    public void run() {
        LoadRequest current = null;
        try {
            while (true) {
                LoadRequest request = loadQueue.poll(pollTimeoutMs, TimeUnit.MILLISECONDS);
                if (!running) {
                    break;
                }
                if (request == null) {
                    continue;
                }
                current = request;
                Asset asset = request.asset();
                if (asset.isLoaded()) {
                    skippedCount.incrementAndGet();
                } else {
                    asset.decode();
                    decodedCount.incrementAndGet();
                }
                current = null;
                loadedQueue.put(asset);
            }
        } catch (InterruptedException e) {
            // Only stop() ends the loop normally; an interrupt from elsewhere is a stop too.
            LOG.warn("Asset loader thread interrupted; exiting");
            Thread.currentThread().interrupt();
        } catch (Throwable e) {
            // Errors from a decoder (StackOverflowError, ExceptionInInitializerError) are
            // crashes too and must reach the reporter.
            String trace = formatTrace(e);
            LOG.error("Asset loader thread crashed while loading {}", current == null
                ? "<none>" : current.asset(), e);
            crashReporter.reportCrash(thread.getName(), trace);
        } finally {
            running = false;
        }
    }

    private static String formatTrace(Throwable t) {
        StringWriter out = new StringWriter();
        t.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    // -- Telemetry ------------------------------------------------------------

    /** Requests for which doLoad() ran to completion. */
    public long decodedCount() { return decodedCount.get(); }

    /** Requests skipped because the asset was already LOADED when dequeued. */
    public long skippedCount() { return skippedCount.get(); }

    /** Name of the loader thread. */
    public String threadName() { return thread.getName(); }
}

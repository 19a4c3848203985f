package io.dynamis.assets.core;

import io.dynamis.assets.api.LoadingProgress;
import io.dynamis.assets.api.RemoteProgress;

/**
 * Progress bookkeeping of one AssetManager: local requests and remote reports.
 *
 * Local counters track requests since the last reset. When every pending request has
 * completed both reset to zero, so progress reads "nothing outstanding" rather than
 * "100% forever", and the next batch of loads counts from zero again.
 *
 * Remote counters hold the latest self-report of an out-of-process client. They are
 * replaced, not accumulated, by each report and are additive with the local figures.
 *
 * THREAD SAFETY: none. Touched only by the manager on the main thread.
 */
public final class LoadProgressCounters {

    private int pendingCount = 0;
    private int loadedCount = 0;

    private int remoteTotal = 0;
    private int remoteLoaded = 0;
    private int remoteRemaining = 0;

    // -- Local ----------------------------------------------------------------

    /** One more request handed to the loader. */
    public void recordEnqueued() {
        pendingCount++;
    }

    /**
     * One more request completed.
     *
     * @throws IllegalStateException if every pending request has already completed
     */
    public void recordLoaded() {
        if (loadedCount >= pendingCount) {
            throw new IllegalStateException(
                "Completion without a pending request (pending=" + pendingCount
                    + ", loaded=" + loadedCount + ")");
        }
        loadedCount++;
    }

    /** True when no local request is outstanding. Also true with both counters at zero. */
    public boolean isLocalComplete() {
        return loadedCount == pendingCount;
    }

    /** Resets both local counters to zero. */
    public void resetLocal() {
        pendingCount = 0;
        loadedCount = 0;
    }

    // -- Remote ---------------------------------------------------------------

    /** Replaces the remote figures with the latest report. */
    public void applyRemote(RemoteProgress report) {
        remoteTotal = report.total();
        remoteLoaded = report.loaded();
        remoteRemaining = report.remaining();
    }

    // -- Derived --------------------------------------------------------------

    /** Local plus remote requests. */
    public int total() {
        return pendingCount + remoteTotal;
    }

    /** Local plus remote completions. */
    public int loaded() {
        return loadedCount + remoteLoaded;
    }

    public int remaining() {
        return total() - loaded();
    }

    /**
     * Combined completion percentage, rounded half up. 100 when nothing has been
     * requested locally or remotely.
     */
    public int loadingPercent() {
        int total = total();
        if (total == 0) {
            return 100;
        }
        return (int) Math.round(loaded() * 100.0 / total);
    }

    public LoadingProgress snapshot() {
        return new LoadingProgress(total(), loaded(), remaining(), loadingPercent());
    }

    // -- Accessors ------------------------------------------------------------

    public int pendingCount() { return pendingCount; }

    public int loadedCount() { return loadedCount; }

    public int remoteTotal() { return remoteTotal; }

    public int remoteLoaded() { return remoteLoaded; }

    public int remoteRemaining() { return remoteRemaining; }
}

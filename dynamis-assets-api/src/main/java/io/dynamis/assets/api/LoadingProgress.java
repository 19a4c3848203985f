package io.dynamis.assets.api;

/**
 * Snapshot of aggregate asset loading progress, local and remote combined.
 *
 * Emitted after every completion drained by the manager's poll and after every
 * remote progress report.
 *
 * @param total     assets requested since the counters were last reset, local plus remote
 * @param loaded    assets completed out of total
 * @param remaining total - loaded
 * @param percent   rounded completion percentage [0..100]; 100 when total is 0
 */
public record LoadingProgress(int total, int loaded, int remaining, int percent) {

    /** True if nothing is outstanding, locally or remotely. */
    public boolean isComplete() {
        return remaining == 0;
    }
}

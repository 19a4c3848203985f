package io.dynamis.assets.api;

/**
 * Receives asset loading progress notifications.
 *
 * Registered with the AssetManager. Called on the thread that runs the manager's
 * poll or reports remote progress, which is the host's main thread.
 * A listener that throws is logged and skipped; delivery to other listeners continues.
 */
@FunctionalInterface
public interface AssetProgressListener {

    /**
     * @param progress combined local and remote progress after the latest change
     */
    void onLoadingProgress(LoadingProgress progress);
}

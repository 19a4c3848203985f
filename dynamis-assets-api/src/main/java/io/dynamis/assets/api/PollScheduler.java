package io.dynamis.assets.api;

/**
 * Drives the asset manager's completion poll from the host's main loop.
 *
 * The manager arms the scheduler when the first load request arrives and disarms it
 * once every outstanding request has completed. While armed, the scheduler must run
 * the poll task repeatedly on the host's main thread, typically once per frame.
 *
 * arm() and disarm() are only called from the main thread.
 */
public interface PollScheduler {

    /**
     * Starts running the task periodically. Called at most once between disarm() calls.
     *
     * @param pollTask the manager's poll step; must run on the main thread
     */
    void arm(Runnable pollTask);

    /** Stops running the poll task. No-op if not armed. */
    void disarm();
}

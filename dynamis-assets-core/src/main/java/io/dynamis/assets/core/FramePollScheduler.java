package io.dynamis.assets.core;

import io.dynamis.assets.api.PollScheduler;

/**
 * PollScheduler driven by the host's frame loop.
 *
 * The host calls tick() once per frame on its main thread. While armed, each tick runs
 * the manager's poll. Unarmed ticks cost one field read.
 *
 * THREAD SAFETY: main thread only, like the manager it serves.
 */
public final class FramePollScheduler implements PollScheduler {

    private Runnable pollTask = null;
    private long armCount = 0L;

    @Override
    public void arm(Runnable pollTask) {
        if (pollTask == null) {
            throw new NullPointerException("pollTask");
        }
        this.pollTask = pollTask;
        armCount++;
    }

    @Override
    public void disarm() {
        this.pollTask = null;
    }

    /** Runs the armed poll task, if any. Call once per frame. */
    public void tick() {
        Runnable task = pollTask;
        if (task != null) {
            task.run();
        }
    }

    public boolean isArmed() { return pollTask != null; }

    /** Number of arm() calls since construction. */
    public long armCount() { return armCount; }
}

package io.dynamis.assets.api;

/**
 * Process-wide channel for failures on background threads.
 *
 * A background thread that dies must surface through here rather than fail silently.
 * Hosts typically rethrow the report on their main thread to bring the process down.
 *
 * THREAD SAFETY: called from the failing background thread. Implementations must
 * be safe to call from any thread.
 */
@FunctionalInterface
public interface CrashReporter {

    /**
     * @param threadName     name of the thread that terminated
     * @param formattedTrace full stack trace of the terminating exception
     */
    void reportCrash(String threadName, String formattedTrace);
}

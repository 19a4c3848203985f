package io.dynamis.assets.core;

/**
 * Completion callback for asynchronous loads of an Asset or an asset group.
 *
 * Callbacks are deduplicated by identity: registering the same instance twice before
 * completion fires it once. Fired on the host's main thread from the manager's poll,
 * or synchronously from load() if the target is already loaded.
 * Firing order across callbacks of one target is unspecified.
 *
 * @param <T> the loaded target type
 */
@FunctionalInterface
public interface LoadCallback<T> {

    void onLoaded(T loaded);
}

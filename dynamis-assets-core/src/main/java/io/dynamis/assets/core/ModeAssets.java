package io.dynamis.assets.core;

import java.util.Collections;
import java.util.Set;

/**
 * Assets loaded because a mode started. Unloading the handle when the mode stops
 * unloads exactly this set, whatever else was loaded in the meantime.
 */
public final class ModeAssets {

    private final String modeName;
    private final Set<Asset> assets;
    private final AssetManager manager;

    ModeAssets(String modeName, Set<Asset> assets, AssetManager manager) {
        this.modeName = modeName;
        this.assets = Collections.unmodifiableSet(assets);
        this.manager = manager;
    }

    /** Name of the mode whose start triggered the loads. */
    public String modeName() { return modeName; }

    /** Assets triggered by the mode start. Unmodifiable. */
    public Set<Asset> assets() { return assets; }

    /** Unloads every asset of this handle. */
    public void unload() {
        manager.unloadAssets(assets);
    }
}

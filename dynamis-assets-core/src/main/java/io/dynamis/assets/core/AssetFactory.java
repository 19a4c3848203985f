package io.dynamis.assets.core;

import io.dynamis.assets.api.AssetConfig;
import java.nio.file.Path;

/**
 * Creates instances of one concrete asset kind from discovered configuration.
 *
 * Usually a constructor reference, e.g. {@code PcmSoundAsset::new}.
 */
@FunctionalInterface
public interface AssetFactory {

    /**
     * @param loadQueue pipeline the new asset enqueues itself on
     * @param name      asset name, unique within its kind
     * @param file      absolute path of the backing file
     * @param config    merged asset config
     */
    Asset create(AssetLoadQueue loadQueue, String name, Path file, AssetConfig config);
}

package io.dynamis.assets.media;

import io.dynamis.assets.core.AssetClassRegistration;
import io.dynamis.assets.core.AssetManager;

/**
 * Registrations of the built-in media kinds.
 *
 * Sounds have the higher class priority so they are discovered before blobs.
 */
public final class MediaAssetKinds {

    private MediaAssetKinds() {}

    public static final int SOUND_CLASS_PRIORITY = 100;
    public static final int BLOB_CLASS_PRIORITY = 50;

    /** Group section of sound pools. */
    public static final String SOUND_POOLS_SECTION = "sound_pools";

    public static AssetClassRegistration sounds() {
        return AssetClassRegistration.builder(PcmSoundAsset.ATTRIBUTE, PcmSoundAsset::new)
            .pathString("sounds")
            .extensions("pcm", "f32")
            .classPriority(SOUND_CLASS_PRIORITY)
            .groupConfigSection(SOUND_POOLS_SECTION)
            .build();
    }

    public static AssetClassRegistration blobs() {
        return AssetClassRegistration.builder(BinaryAsset.ATTRIBUTE, BinaryAsset::new)
            .pathString("blobs")
            .extensions("bin", "png", "jpg", "gif")
            .classPriority(BLOB_CLASS_PRIORITY)
            .build();
    }

    /** Registers every built-in kind with the manager. */
    public static void registerAll(AssetManager manager) {
        if (manager == null) throw new NullPointerException("manager");
        manager.registerAssetClass(sounds());
        manager.registerAssetClass(blobs());
    }
}

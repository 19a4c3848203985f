package io.dynamis.assets.media;

import io.dynamis.assets.api.AssetConfig;
import io.dynamis.assets.core.Asset;
import io.dynamis.assets.core.AssetLoadQueue;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opaque file contents, read whole. Stands in for images and videos, whose decode is
 * up to the consumer.
 */
public final class BinaryAsset extends Asset {

    public static final String ATTRIBUTE = "blobs";

    private volatile byte[] bytes;

    public BinaryAsset(AssetLoadQueue loadQueue, String name, Path file, AssetConfig config) {
        super(loadQueue, ATTRIBUTE, name, file, config);
    }

    @Override
    protected void doLoad() throws IOException {
        bytes = Files.readAllBytes(filePath());
    }

    @Override
    protected void doUnload() {
        bytes = null;
    }

    /**
     * Copy of the file contents.
     *
     * @throws IllegalStateException if not loaded
     */
    public byte[] bytes() {
        byte[] b = bytes;
        if (b == null) {
            throw new IllegalStateException("Blob '" + name() + "' is not loaded");
        }
        return b.clone();
    }

    /** Bytes held, or 0 if not loaded. */
    public int size() {
        byte[] b = bytes;
        return b == null ? 0 : b.length;
    }
}

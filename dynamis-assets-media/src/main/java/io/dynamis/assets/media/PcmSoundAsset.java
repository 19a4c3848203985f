package io.dynamis.assets.media;

import io.dynamis.assets.api.AssetConfig;
import io.dynamis.assets.api.AssetConfigurationException;
import io.dynamis.assets.core.Asset;
import io.dynamis.assets.core.AssetLoadQueue;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sound asset backed by a raw interleaved PCM file of little-endian 32-bit floats.
 *
 * The channel count comes from the "channels" config key (default 2). The file carries
 * no header; its length must be a whole number of frames.
 *
 * THREAD SAFETY:
 *   doLoad() publishes the decoded buffer through a volatile field; readers on the main
 *   thread see either null or the complete buffer.
 */
public final class PcmSoundAsset extends Asset {

    private static final Logger LOG = LoggerFactory.getLogger(PcmSoundAsset.class);

    public static final String ATTRIBUTE = "sounds";
    public static final String KEY_CHANNELS = "channels";
    public static final int DEFAULT_CHANNELS = 2;

    private static final int BYTES_PER_SAMPLE = Float.BYTES;

    private final int channels;
    private volatile float[] samples;

    public PcmSoundAsset(AssetLoadQueue loadQueue, String name, Path file, AssetConfig config) {
        super(loadQueue, ATTRIBUTE, name, file, config);
        this.channels = config.getInt(KEY_CHANNELS, DEFAULT_CHANNELS);
        if (channels < 1) {
            throw new AssetConfigurationException(
                "Sound '" + name + "': channels must be >= 1; got " + channels);
        }
    }

    @Override
    protected void doLoad() throws IOException {
        try (FileChannel channel = FileChannel.open(filePath(), StandardOpenOption.READ)) {
            long size = channel.size();
            int frameBytes = channels * BYTES_PER_SAMPLE;
            if (size % frameBytes != 0) {
                throw new IOException("Sound '" + name() + "': " + size
                    + " bytes is not a whole number of " + channels + "-channel frames");
            }
            if (size > Integer.MAX_VALUE) {
                throw new IOException("Sound '" + name() + "' is too large: " + size + " bytes");
            }
            ByteBuffer buffer = ByteBuffer.allocate((int) size).order(ByteOrder.LITTLE_ENDIAN);
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) < 0) {
                    throw new IOException("Sound '" + name() + "': unexpected end of file");
                }
            }
            buffer.flip();
            float[] decoded = new float[(int) (size / BYTES_PER_SAMPLE)];
            buffer.asFloatBuffer().get(decoded);
            samples = decoded;
            LOG.debug("Decoded sound '{}': {} frame(s) x {} channel(s)",
                name(), decoded.length / channels, channels);
        }
    }

    @Override
    protected void doUnload() {
        samples = null;
    }

    /**
     * Copy of the decoded interleaved samples.
     *
     * @throws IllegalStateException if the sound is not loaded
     */
    public float[] samples() {
        float[] s = samples;
        if (s == null) {
            throw new IllegalStateException("Sound '" + name() + "' is not loaded");
        }
        return s.clone();
    }

    public int channelCount() { return channels; }

    /** Frames decoded, or 0 if not loaded. */
    public long frameCount() {
        float[] s = samples;
        return s == null ? 0 : s.length / channels;
    }
}

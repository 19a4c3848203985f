package io.dynamis.assets.api;

/**
 * Global constants for the Dynamis asset pipeline.
 *
 * Config key names and load trigger values are shared with the configuration
 * files authored by designers. Renaming any of them breaks existing content.
 */
public final class AssetConstants {

    private AssetConstants() {}

    // -- Loader thread --------------------------------------------------------

    /** Name given to the background loader thread. Visible in thread dumps and crash reports. */
    public static final String LOADER_THREAD_NAME = "asset_loader";

    /**
     * Upper bound on a single blocking poll of the load queue, in milliseconds.
     * Also the worst-case latency between stop() and the loader observing the stop flag,
     * unless a decode is in progress.
     */
    public static final long LOADER_POLL_TIMEOUT_MS = 100L;

    // -- Priorities -----------------------------------------------------------

    /** Load priority used when neither the config nor the load call supplies one. */
    public static final int DEFAULT_PRIORITY = 0;

    /** Class priority used when a registration does not supply one. Higher is created first. */
    public static final int DEFAULT_CLASS_PRIORITY = 0;

    // -- Config keys ----------------------------------------------------------

    /** Absolute path of the asset file. Always present in a discovered config. */
    public static final String KEY_FILE = "file";

    /** Load trigger key. See LOAD_PRELOAD, LOAD_ON_DEMAND, LOAD_MODE_START. */
    public static final String KEY_LOAD = "load";

    /** Integer load priority. */
    public static final String KEY_PRIORITY = "priority";

    /** Group selection policy name. */
    public static final String KEY_TYPE = "type";

    /** Name of the default section in an asset class's defaults block. */
    public static final String DEFAULT_SECTION = "default";

    /** Top-level config section holding per-class default blocks. */
    public static final String ASSETS_SECTION = "assets";

    // -- Load triggers --------------------------------------------------------

    /** Load during boot. Boot completion waits for these assets. */
    public static final String LOAD_PRELOAD = "preload";

    /** Never loaded automatically. Game code calls load() explicitly. */
    public static final String LOAD_ON_DEMAND = "on_demand";

    /** Placeholder expanded at discovery time to "&lt;mode&gt;_start". */
    public static final String LOAD_MODE_START = "mode_start";

    /** Suffix of the trigger key fired when a mode starts. */
    public static final String MODE_START_SUFFIX = "_start";

    // -- Boot gate ------------------------------------------------------------

    /** Hold name released on the boot gate once all boot-time assets are loaded. */
    public static final String BOOT_HOLD_ASSETS = "assets";

    // -- Groups ---------------------------------------------------------------

    /** Weight given to a group member that does not specify one. */
    public static final int DEFAULT_MEMBER_WEIGHT = 1;

    /** Separator between member name and weight in a group member string, e.g. "boom|3". */
    public static final String MEMBER_WEIGHT_SEPARATOR = "|";

    /** Load key for loading all assets scheduled for a given mode. */
    public static String modeStartKey(String modeName) {
        return modeName + MODE_START_SUFFIX;
    }
}

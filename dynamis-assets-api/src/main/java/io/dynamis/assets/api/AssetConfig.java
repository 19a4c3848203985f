package io.dynamis.assets.api;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable key/value configuration of a single asset.
 *
 * Built by the discovery layer from merged default, folder and per-asset sections.
 * Concrete asset kinds read their own keys (e.g. "channels") through the typed getters.
 * Values keep the types the host config loader produced; the getters coerce numbers
 * given as strings.
 */
public final class AssetConfig {

    private static final AssetConfig EMPTY = new AssetConfig(Map.of());

    private final Map<String, Object> values;

    private AssetConfig(Map<String, Object> values) {
        this.values = values;
    }

    /** Copies the given map. Null keys are rejected; null values are dropped. */
    public static AssetConfig of(Map<String, ?> values) {
        if (values == null) {
            throw new NullPointerException("values");
        }
        if (values.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : values.entrySet()) {
            if (e.getKey() == null) {
                throw new NullPointerException("config key");
            }
            if (e.getValue() != null) {
                copy.put(e.getKey(), e.getValue());
            }
        }
        return new AssetConfig(Collections.unmodifiableMap(copy));
    }

    public static AssetConfig empty() {
        return EMPTY;
    }

    // -- Raw access -----------------------------------------------------------

    public boolean has(String key) {
        return values.containsKey(key);
    }

    /** Raw value, or null if absent. */
    public Object get(String key) {
        return values.get(key);
    }

    public String getString(String key, String defaultValue) {
        Object v = values.get(key);
        return v == null ? defaultValue : v.toString();
    }

    /**
     * Integer value of the key. Accepts any Number or a decimal string.
     *
     * @throws AssetConfigurationException if the value is present but not an integer
     */
    public int getInt(String key, int defaultValue) {
        Object v = values.get(key);
        if (v == null) {
            return defaultValue;
        }
        if (v instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new AssetConfigurationException(
                "Config key '" + key + "' is not an integer: '" + v + "'", e);
        }
    }

    /** Unmodifiable view of every key/value pair, in insertion order. */
    public Map<String, Object> asMap() {
        return values;
    }

    /** Returns a copy with the key set to value. */
    public AssetConfig with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return of(copy);
    }

    // -- Well-known keys ------------------------------------------------------

    /**
     * Path of the asset file.
     *
     * @throws AssetConfigurationException if the "file" key is missing
     */
    public Path file() {
        Object v = values.get(AssetConstants.KEY_FILE);
        if (v == null) {
            throw new AssetConfigurationException(
                "Asset config is missing required key '" + AssetConstants.KEY_FILE + "'");
        }
        return v instanceof Path p ? p : Path.of(v.toString());
    }

    /** Load trigger key. Assets without one are loaded on demand only. */
    public String loadKey() {
        return getString(AssetConstants.KEY_LOAD, AssetConstants.LOAD_ON_DEMAND);
    }

    public int priority() {
        return getInt(AssetConstants.KEY_PRIORITY, AssetConstants.DEFAULT_PRIORITY);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AssetConfig other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "AssetConfig" + values;
    }
}

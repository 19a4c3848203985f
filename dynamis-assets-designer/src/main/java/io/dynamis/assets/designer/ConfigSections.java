package io.dynamis.assets.designer;

import io.dynamis.assets.api.AssetConfigurationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed access to nested sections of a host-provided configuration tree.
 *
 * The host config loader yields plain maps, lists and scalars. Sections are maps keyed
 * by string; a missing or null section reads as empty.
 */
final class ConfigSections {

    private ConfigSections() {}

    /**
     * Child section of parent, or an empty map if absent.
     *
     * @throws AssetConfigurationException if the value is present but not a map
     */
    static Map<String, Object> section(Map<String, ?> parent, String key) {
        if (parent == null) {
            return new LinkedHashMap<>();
        }
        return asSection(parent.get(key), key);
    }

    static Map<String, Object> asSection(Object value, String key) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (value == null) {
            return out;
        }
        if (!(value instanceof Map<?, ?> raw)) {
            throw new AssetConfigurationException(
                "Config section '" + key + "' must be a map; got " + value.getClass().getSimpleName());
        }
        for (Map.Entry<?, ?> e : raw.entrySet()) {
            out.put(String.valueOf(e.getKey()), e.getValue());
        }
        return out;
    }

    /**
     * Splits a list-valued setting. Accepts a comma and/or whitespace separated string or
     * a collection of strings. Blank items are dropped.
     */
    static List<String> asList(Object value) {
        List<String> out = new ArrayList<>();
        if (value == null) {
            return out;
        }
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                if (item != null && !item.toString().isBlank()) {
                    out.add(item.toString().trim());
                }
            }
            return out;
        }
        for (String item : value.toString().split("[,\\s]+")) {
            if (!item.isBlank()) {
                out.add(item.trim());
            }
        }
        return out;
    }
}

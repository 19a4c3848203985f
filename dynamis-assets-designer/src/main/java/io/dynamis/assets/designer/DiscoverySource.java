package io.dynamis.assets.designer;

import java.nio.file.Path;
import java.util.Map;

/**
 * One root to discover assets under, with its configuration.
 *
 * @param root     machine or mode folder; each kind's files live in root/&lt;path_string&gt;
 * @param config   configuration tree of that machine or mode; may be empty
 * @param modeName mode name, or null for the machine-wide root
 */
public record DiscoverySource(Path root, Map<String, Object> config, String modeName) {

    public DiscoverySource {
        if (root == null) throw new NullPointerException("root");
        if (config == null) config = Map.of();
    }

    public static DiscoverySource machine(Path root, Map<String, Object> config) {
        return new DiscoverySource(root, config, null);
    }

    public static DiscoverySource mode(String modeName, Path root, Map<String, Object> config) {
        if (modeName == null) throw new NullPointerException("modeName");
        return new DiscoverySource(root, config, modeName);
    }

    public boolean isMode() {
        return modeName != null;
    }
}

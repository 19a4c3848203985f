package io.dynamis.assets.designer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named asset groups per kind attribute. Name lookup is case-insensitive.
 *
 * Populated during discovery, read by game code afterwards. Main thread only.
 */
public final class AssetGroupRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(AssetGroupRegistry.class);

    private final Map<String, Map<String, AssetGroup>> groups = new LinkedHashMap<>();

    /** Adds a group under the kind attribute. Replaces a group of the same name. */
    public void add(String attribute, AssetGroup group) {
        if (attribute == null) throw new NullPointerException("attribute");
        if (group == null) throw new NullPointerException("group");
        AssetGroup previous = groups
            .computeIfAbsent(attribute, a -> new TreeMap<>(String.CASE_INSENSITIVE_ORDER))
            .put(group.name(), group);
        if (previous != null) {
            LOG.debug("Replaced {} group '{}'", attribute, group.name());
        }
    }

    /** The named group, or null. */
    public AssetGroup get(String attribute, String name) {
        Map<String, AssetGroup> byName = groups.get(attribute);
        return byName == null ? null : byName.get(name);
    }

    /** Groups of one kind ordered by name; empty if none. Unmodifiable. */
    public Collection<AssetGroup> groups(String attribute) {
        Map<String, AssetGroup> byName = groups.get(attribute);
        return byName == null
            ? Collections.emptyList()
            : Collections.unmodifiableCollection(byName.values());
    }

    /**
     * Loads every group whose own load key equals keyName.
     *
     * @return the groups triggered
     */
    public List<AssetGroup> loadByKey(String keyName) {
        if (keyName == null) throw new NullPointerException("keyName");
        List<AssetGroup> triggered = new ArrayList<>();
        for (Map<String, AssetGroup> byName : groups.values()) {
            for (AssetGroup group : byName.values()) {
                if (keyName.equals(group.loadKey())) {
                    triggered.add(group);
                }
            }
        }
        for (AssetGroup group : triggered) {
            group.load();
        }
        return triggered;
    }

    public int size() {
        int count = 0;
        for (Map<String, AssetGroup> byName : groups.values()) {
            count += byName.size();
        }
        return count;
    }
}

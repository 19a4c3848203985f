package io.dynamis.assets.designer;

import io.dynamis.assets.api.AssetConfigurationException;
import java.util.Locale;

/**
 * How an AssetGroup picks a member on each access.
 *
 * Every policy honours member weights and operates over the current membership.
 */
public enum SelectionType {

    /** Deterministic rotation; each member appears weight times in member order. */
    SEQUENCE("sequence"),

    /** Weighted draw with replacement. */
    RANDOM("random"),

    /** Weighted draw that never returns the previous pick twice in a row. */
    RANDOM_FORCE_NEXT("random_force_next"),

    /** Weighted draw without replacement until every member has been returned once. */
    RANDOM_FORCE_ALL("random_force_all");

    private final String configName;

    SelectionType(String configName) {
        this.configName = configName;
    }

    /** Name used in the "type" key of a group config. */
    public String configName() { return configName; }

    /**
     * @throws AssetConfigurationException if the name matches no selection type
     */
    public static SelectionType fromConfig(String name) {
        if (name == null) {
            throw new NullPointerException("name");
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        for (SelectionType t : values()) {
            if (t.configName.equals(key)) {
                return t;
            }
        }
        throw new AssetConfigurationException("Unknown asset group type '" + name + "'");
    }
}

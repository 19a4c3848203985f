package io.dynamis.assets.designer;

import io.dynamis.assets.api.AssetConfigurationException;
import io.dynamis.assets.api.AssetConstants;
import io.dynamis.assets.core.AssetClassRegistration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Folder-based default settings of one asset kind.
 *
 * Read from the "assets" section of a config, under the kind's config section:
 *
 * <pre>
 *   assets:
 *     sounds:
 *       default:   { load: preload }
 *       music:     { load: on_demand, priority: 5 }
 * </pre>
 *
 * Every section other than "default" is a copy of "default" overlaid with its own keys.
 * A file found in a sub-folder named like a section takes that section as its base
 * settings; any other file takes "default".
 */
public final class AssetClassDefaults {

    private final Map<String, Map<String, Object>> sections;

    private AssetClassDefaults(Map<String, Map<String, Object>> sections) {
        this.sections = sections;
    }

    /**
     * Builds the defaults of the registration's kind from a config tree.
     *
     * @throws AssetConfigurationException if the kind has sections but no "default"
     */
    public static AssetClassDefaults from(AssetClassRegistration registration, Map<String, ?> config) {
        if (registration == null) throw new NullPointerException("registration");
        Map<String, Object> assets = ConfigSections.section(config, AssetConstants.ASSETS_SECTION);
        Map<String, Object> kind = ConfigSections.section(assets, registration.configSection());

        Map<String, Map<String, Object>> sections = new LinkedHashMap<>();
        Map<String, Object> base = builtIn();
        if (!kind.isEmpty()) {
            if (!kind.containsKey(AssetConstants.DEFAULT_SECTION)) {
                throw new AssetConfigurationException(
                    "Section 'assets:" + registration.configSection() + "' has no '"
                        + AssetConstants.DEFAULT_SECTION + "' entry");
            }
            base.putAll(ConfigSections.asSection(
                kind.get(AssetConstants.DEFAULT_SECTION), AssetConstants.DEFAULT_SECTION));
        }
        sections.put(AssetConstants.DEFAULT_SECTION, Collections.unmodifiableMap(base));

        for (Map.Entry<String, Object> e : kind.entrySet()) {
            if (e.getKey().equals(AssetConstants.DEFAULT_SECTION)) {
                continue;
            }
            Map<String, Object> folder = new LinkedHashMap<>(base);
            folder.putAll(ConfigSections.asSection(e.getValue(), e.getKey()));
            sections.put(e.getKey(), Collections.unmodifiableMap(folder));
        }
        return new AssetClassDefaults(Collections.unmodifiableMap(sections));
    }

    private static Map<String, Object> builtIn() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(AssetConstants.KEY_LOAD, AssetConstants.LOAD_PRELOAD);
        m.put(AssetConstants.KEY_PRIORITY, AssetConstants.DEFAULT_PRIORITY);
        return m;
    }

    /** The "default" section merged over the built-in load/priority defaults. */
    public Map<String, Object> defaultSection() {
        return sections.get(AssetConstants.DEFAULT_SECTION);
    }

    /** The named folder section, or the "default" section if there is none. */
    public Map<String, Object> section(String folderName) {
        Map<String, Object> s = sections.get(folderName);
        return s != null ? s : defaultSection();
    }

    public boolean hasSection(String folderName) {
        return sections.containsKey(folderName);
    }

    /** Section names, "default" first. */
    public Set<String> sectionNames() {
        return sections.keySet();
    }
}

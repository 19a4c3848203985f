package io.dynamis.assets.designer;

import io.dynamis.assets.api.AssetConfig;
import io.dynamis.assets.api.AssetConfigurationException;
import io.dynamis.assets.api.AssetConstants;
import io.dynamis.assets.api.AssetNotFoundException;
import io.dynamis.assets.core.Asset;
import io.dynamis.assets.core.AssetClassRegistration;
import io.dynamis.assets.core.AssetManager;
import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds asset files on disk, builds their configs and registers the resulting assets
 * and groups with the manager.
 *
 * For each registered kind, in class priority order, discover() walks
 * root/&lt;path_string&gt; recursively, following links, and keeps files with one of the
 * kind's extensions.
 *
 * CONFIG OF A DISCOVERED FILE (later wins):
 *   1. Folder defaults: the section named like the file's parent folder, or "default"
 *      for files directly in the kind's root or in a folder with no section. Modes
 *      without their own "assets" block for the kind use the machine's.
 *   2. The config entry of the same name as the lower-cased file stem, or the entry whose
 *      "file" equals the file name. The entry's key becomes the asset name.
 *   3. "file" set to the absolute path; "load: mode_start" expanded to "&lt;mode&gt;_start".
 *
 * Config entries no file on disk matched are resolved through locateAssetFile(): the
 * mode's folder first, then the machine root.
 *
 * Discovery phase only. Main thread only.
 */
public final class AssetDiscovery {

    private static final Logger LOG = LoggerFactory.getLogger(AssetDiscovery.class);

    private final AssetManager manager;
    private final Path machineRoot;
    private final AssetGroupFactory groupFactory;
    private final AssetGroupRegistry groupRegistry;

    /** Folder defaults read from the machine config, per kind attribute. */
    private final Map<String, AssetClassDefaults> machineDefaults = new LinkedHashMap<>();

    public AssetDiscovery(AssetManager manager, Path machineRoot) {
        this(manager, machineRoot, new AssetGroupFactory(manager), new AssetGroupRegistry());
    }

    public AssetDiscovery(AssetManager manager, Path machineRoot,
                          AssetGroupFactory groupFactory, AssetGroupRegistry groupRegistry) {
        if (manager == null) throw new NullPointerException("manager");
        if (machineRoot == null) throw new NullPointerException("machineRoot");
        if (groupFactory == null) throw new NullPointerException("groupFactory");
        if (groupRegistry == null) throw new NullPointerException("groupRegistry");
        this.manager = manager;
        this.machineRoot = machineRoot;
        this.groupFactory = groupFactory;
        this.groupRegistry = groupRegistry;
    }

    // -- Assets ---------------------------------------------------------------

    /**
     * Discovers and registers the assets of every registered kind under the source root.
     *
     * @return the created assets per kind attribute, in class priority order
     * @throws IOException                 if a folder cannot be walked
     * @throws AssetNotFoundException      if a config-only entry names a file that exists nowhere
     * @throws AssetConfigurationException on malformed configuration
     */
    public Map<String, List<Asset>> discover(DiscoverySource source)
            throws IOException, AssetNotFoundException {
        if (source == null) throw new NullPointerException("source");
        Map<String, List<Asset>> created = new LinkedHashMap<>();
        for (AssetClassRegistration registration : manager.registrations()) {
            created.put(registration.attribute(), discoverKind(registration, source));
        }
        return created;
    }

    private List<Asset> discoverKind(AssetClassRegistration registration, DiscoverySource source)
            throws IOException, AssetNotFoundException {
        AssetClassDefaults defaults = defaultsFor(registration, source);
        Map<String, Object> entries =
            ConfigSections.section(source.config(), registration.configSection());
        Map<String, Map<String, Object>> unmatched = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : entries.entrySet()) {
            unmatched.put(e.getKey(), ConfigSections.asSection(e.getValue(), e.getKey()));
        }

        List<Asset> created = new ArrayList<>();
        Path kindRoot = source.root().resolve(registration.pathString());
        if (Files.isDirectory(kindRoot)) {
            for (Path file : listFiles(registration, kindRoot)) {
                String fileName = file.getFileName().toString();
                String name = stem(fileName).toLowerCase(Locale.ROOT);

                Path parent = file.getParent();
                Map<String, Object> settings = new LinkedHashMap<>(
                    parent.equals(kindRoot)
                        ? defaults.defaultSection()
                        : defaults.section(parent.getFileName().toString()));

                String entryKey = findEntry(unmatched, name, fileName);
                if (entryKey != null) {
                    settings.putAll(unmatched.remove(entryKey));
                    name = entryKey;
                }
                settings.put(AssetConstants.KEY_FILE, file.toAbsolutePath());
                created.add(createAsset(registration, source, name, settings));
            }
        } else {
            LOG.debug("No '{}' folder under {}", registration.pathString(), source.root());
        }

        for (Map.Entry<String, Map<String, Object>> e : unmatched.entrySet()) {
            Map<String, Object> settings = new LinkedHashMap<>(defaults.defaultSection());
            settings.putAll(e.getValue());
            Object file = settings.get(AssetConstants.KEY_FILE);
            if (file == null) {
                throw new AssetConfigurationException(
                    registration.attribute() + " entry '" + e.getKey()
                        + "' matches no file on disk and has no '" + AssetConstants.KEY_FILE + "' key");
            }
            settings.put(AssetConstants.KEY_FILE, locateAssetFile(file.toString(),
                registration.pathString(), source.isMode() ? source.root() : null));
            created.add(createAsset(registration, source, e.getKey(), settings));
        }

        if (!created.isEmpty()) {
            LOG.debug("Discovered {} {} asset(s) under {}",
                created.size(), registration.attribute(), source.root());
        }
        return created;
    }

    /** A mode without its own defaults block for the kind inherits the machine's. */
    private AssetClassDefaults defaultsFor(AssetClassRegistration registration, DiscoverySource source) {
        Map<String, Object> assets =
            ConfigSections.section(source.config(), AssetConstants.ASSETS_SECTION);
        if (source.isMode() && !assets.containsKey(registration.configSection())) {
            AssetClassDefaults inherited = machineDefaults.get(registration.attribute());
            if (inherited != null) {
                return inherited;
            }
        }
        AssetClassDefaults defaults = AssetClassDefaults.from(registration, source.config());
        if (!source.isMode()) {
            machineDefaults.put(registration.attribute(), defaults);
        }
        return defaults;
    }

    private static List<Path> listFiles(AssetClassRegistration registration, Path kindRoot)
            throws IOException {
        try (Stream<Path> walk = Files.walk(kindRoot, FileVisitOption.FOLLOW_LINKS)) {
            return walk
                .filter(Files::isRegularFile)
                .filter(p -> registration.accepts(p.getFileName().toString()))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    private static String findEntry(Map<String, Map<String, Object>> entries,
                                    String name, String fileName) {
        for (Map.Entry<String, Map<String, Object>> e : entries.entrySet()) {
            Object file = e.getValue().get(AssetConstants.KEY_FILE);
            if ((file != null && file.toString().equals(fileName))
                    || e.getKey().equalsIgnoreCase(name)) {
                return e.getKey();
            }
        }
        return null;
    }

    private Asset createAsset(AssetClassRegistration registration, DiscoverySource source,
                              String name, Map<String, Object> settings) {
        Object load = settings.get(AssetConstants.KEY_LOAD);
        if (load != null && AssetConstants.LOAD_MODE_START.equals(load.toString())) {
            if (!source.isMode()) {
                throw new AssetConfigurationException(
                    registration.attribute() + " '" + name + "' is set to load on "
                        + AssetConstants.LOAD_MODE_START + " outside a mode");
            }
            settings.put(AssetConstants.KEY_LOAD, AssetConstants.modeStartKey(source.modeName()));
        }
        AssetConfig config = AssetConfig.of(settings);
        Asset asset = registration.factory().create(manager, name, config.file(), config);
        manager.addAsset(asset);
        return asset;
    }

    private static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    // -- File lookup ----------------------------------------------------------

    /**
     * Resolves a file name on the search path: modePath/pathString/fileName, then
     * machineRoot/pathString/fileName.
     *
     * @param modePath mode folder to search first, or null for the machine root only
     * @throws AssetNotFoundException if the file exists on neither path
     */
    public Path locateAssetFile(String fileName, String pathString, Path modePath)
            throws AssetNotFoundException {
        if (fileName == null) throw new NullPointerException("fileName");
        if (pathString == null) throw new NullPointerException("pathString");
        List<Path> searched = new ArrayList<>(2);
        if (modePath != null) {
            searched.add(modePath.resolve(pathString).resolve(fileName));
        }
        searched.add(machineRoot.resolve(pathString).resolve(fileName));
        for (Path candidate : searched) {
            if (Files.isRegularFile(candidate)) {
                return candidate.toAbsolutePath();
            }
        }
        throw new AssetNotFoundException(fileName, searched);
    }

    // -- Groups ---------------------------------------------------------------

    /**
     * Creates the groups of every kind that has a group section present in the source's
     * config. Run after discover() for the same source so members resolve.
     *
     * @return the groups created
     * @throws AssetConfigurationException on an unknown group type or malformed member
     */
    public List<AssetGroup> createGroups(DiscoverySource source) {
        if (source == null) throw new NullPointerException("source");
        List<AssetGroup> created = new ArrayList<>();
        for (AssetClassRegistration registration : manager.registrations()) {
            if (!registration.hasGroups()) {
                continue;
            }
            Map<String, Object> section =
                ConfigSections.section(source.config(), registration.groupConfigSection());
            for (Map.Entry<String, Object> e : section.entrySet()) {
                AssetGroup group = groupFactory.create(registration, e.getKey(),
                    ConfigSections.asSection(e.getValue(), e.getKey()));
                groupRegistry.add(registration.attribute(), group);
                created.add(group);
            }
        }
        return created;
    }

    // -- Accessors ------------------------------------------------------------

    public Path machineRoot() { return machineRoot; }

    public AssetGroupRegistry groupRegistry() { return groupRegistry; }
}

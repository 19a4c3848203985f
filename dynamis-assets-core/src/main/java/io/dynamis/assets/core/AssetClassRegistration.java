package io.dynamis.assets.core;

import io.dynamis.assets.api.AssetConstants;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable registration of one asset kind with the AssetManager.
 *
 * Describes how the kind is discovered (folder, extensions, config section), how its
 * instances are created (factory) and where they live (registry attribute).
 *
 * CLASS PRIORITY:
 *   Kinds are discovered and created in descending class priority. A kind whose assets
 *   reference another kind's assets by name (e.g. a slideshow referencing images) must
 *   have the lower priority so its dependencies exist first.
 */
public final class AssetClassRegistration {

    private final String attribute;
    private final String configSection;
    private final String pathString;
    private final Set<String> extensions;
    private final int classPriority;
    private final String groupConfigSection;
    private final AssetFactory factory;

    private AssetClassRegistration(Builder builder) {
        this.attribute = builder.attribute;
        this.configSection = builder.configSection;
        this.pathString = builder.pathString;
        this.extensions = Collections.unmodifiableSet(new LinkedHashSet<>(builder.extensions));
        this.classPriority = builder.classPriority;
        this.groupConfigSection = builder.groupConfigSection;
        this.factory = builder.factory;
    }

    /** Registry attribute, e.g. "sounds". Also the classId of every instance. */
    public String attribute() { return attribute; }

    /** Config section holding per-asset entries. Defaults to the attribute. */
    public String configSection() { return configSection; }

    /** Folder name under a machine or mode root that holds files of this kind. */
    public String pathString() { return pathString; }

    /** Lower-case file extensions, without dots. */
    public Set<String> extensions() { return extensions; }

    /** Higher is discovered and created first. */
    public int classPriority() { return classPriority; }

    /** Config section of the kind's asset groups, or null if the kind has no groups. */
    public String groupConfigSection() { return groupConfigSection; }

    public boolean hasGroups() { return groupConfigSection != null; }

    public AssetFactory factory() { return factory; }

    /** True if the file name ends with one of this kind's extensions. Case-insensitive. */
    public boolean accepts(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return false;
        }
        return extensions.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return "AssetClassRegistration{attribute='" + attribute + "', path='" + pathString
            + "', extensions=" + extensions + ", classPriority=" + classPriority + "}";
    }

    // -- Builder --------------------------------------------------------------

    public static Builder builder(String attribute, AssetFactory factory) {
        return new Builder(attribute, factory);
    }

    public static final class Builder {

        private final String attribute;
        private final AssetFactory factory;
        private String configSection;
        private String pathString;
        private final Set<String> extensions = new LinkedHashSet<>();
        private int classPriority = AssetConstants.DEFAULT_CLASS_PRIORITY;
        private String groupConfigSection = null;

        private Builder(String attribute, AssetFactory factory) {
            if (attribute == null || attribute.isBlank()) {
                throw new IllegalArgumentException("Asset class attribute must not be blank");
            }
            if (factory == null) {
                throw new NullPointerException("factory");
            }
            this.attribute = attribute;
            this.factory = factory;
            this.configSection = attribute;
            this.pathString = attribute;
        }

        public Builder configSection(String section) { this.configSection = section; return this; }
        public Builder pathString(String path) { this.pathString = path; return this; }
        public Builder classPriority(int priority) { this.classPriority = priority; return this; }
        public Builder groupConfigSection(String section) { this.groupConfigSection = section; return this; }

        /** Adds extensions. A leading dot is stripped; case is folded. */
        public Builder extensions(String... exts) {
            for (String ext : exts) {
                String e = ext.startsWith(".") ? ext.substring(1) : ext;
                if (!e.isEmpty()) {
                    extensions.add(e.toLowerCase(Locale.ROOT));
                }
            }
            return this;
        }

        public AssetClassRegistration build() {
            if (configSection == null || configSection.isBlank()) {
                configSection = attribute;
            }
            if (pathString == null || pathString.isBlank()) {
                pathString = attribute;
            }
            return new AssetClassRegistration(this);
        }
    }
}

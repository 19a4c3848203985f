package io.dynamis.assets.designer;

import io.dynamis.assets.api.AssetConfigurationException;
import io.dynamis.assets.api.AssetConstants;
import io.dynamis.assets.core.Asset;
import io.dynamis.assets.core.AssetClassRegistration;
import io.dynamis.assets.core.AssetManager;
import java.util.Map;
import java.util.Random;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds AssetGroups from their config entries.
 *
 * A group entry lives under the kind's group section and names its members under the
 * kind's config section:
 *
 * <pre>
 *   sound_pools:
 *     explosions:
 *       type: random_force_next
 *       sounds: boom_1|3, boom_2, boom_3|2
 * </pre>
 *
 * MEMBER STRINGS:
 *   "name|weight" or "name". A missing or empty weight is 1. Members are resolved against
 *   the manager's registry of the same kind; a name with no asset is logged and skipped.
 *
 * DEFAULTS:
 *   type = sequence, load = on_demand.
 */
public final class AssetGroupFactory {

    private static final Logger LOG = LoggerFactory.getLogger(AssetGroupFactory.class);

    private final AssetManager manager;
    private final Supplier<Random> randomSource;

    public AssetGroupFactory(AssetManager manager) {
        this(manager, Random::new);
    }

    /**
     * @param randomSource supplies the Random of each new group
     */
    public AssetGroupFactory(AssetManager manager, Supplier<Random> randomSource) {
        if (manager == null) throw new NullPointerException("manager");
        if (randomSource == null) throw new NullPointerException("randomSource");
        this.manager = manager;
        this.randomSource = randomSource;
    }

    /**
     * Creates one group of the registration's kind.
     *
     * @throws AssetConfigurationException on an unknown type or a malformed weight
     */
    public AssetGroup create(AssetClassRegistration registration, String name,
                             Map<String, Object> settings) {
        if (registration == null) throw new NullPointerException("registration");
        if (name == null) throw new NullPointerException("name");
        if (settings == null) settings = Map.of();

        Object type = settings.get(AssetConstants.KEY_TYPE);
        SelectionType selectionType = type == null
            ? SelectionType.SEQUENCE
            : SelectionType.fromConfig(type.toString());
        Object load = settings.get(AssetConstants.KEY_LOAD);
        String loadKey = load == null ? AssetConstants.LOAD_ON_DEMAND : load.toString();

        AssetGroup group = new AssetGroup(name, selectionType, loadKey, randomSource.get());
        for (String member : ConfigSections.asList(settings.get(registration.configSection()))) {
            addMember(registration, group, member);
        }
        LOG.debug("Created {}", group);
        return group;
    }

    private void addMember(AssetClassRegistration registration, AssetGroup group, String member) {
        String memberName = member;
        int weight = AssetConstants.DEFAULT_MEMBER_WEIGHT;
        int sep = member.indexOf(AssetConstants.MEMBER_WEIGHT_SEPARATOR);
        if (sep >= 0) {
            memberName = member.substring(0, sep).trim();
            String w = member.substring(sep + 1).trim();
            if (!w.isEmpty()) {
                try {
                    weight = Integer.parseInt(w);
                } catch (NumberFormatException e) {
                    throw new AssetConfigurationException(
                        "Group '" + group.name() + "': member '" + member
                            + "' has a non-integer weight", e);
                }
                if (weight < 1) {
                    throw new AssetConfigurationException(
                        "Group '" + group.name() + "': member '" + member
                            + "' has weight < 1");
                }
            }
        }

        Asset asset = manager.getAsset(registration.attribute(), memberName);
        if (asset == null) {
            LOG.warn("Group '{}': no {} asset named '{}'; member skipped",
                group.name(), registration.attribute(), memberName);
            return;
        }
        try {
            group.addMember(asset, weight);
        } catch (IllegalArgumentException e) {
            throw new AssetConfigurationException(
                "Group '" + group.name() + "': member '" + member + "' rejected", e);
        }
    }
}

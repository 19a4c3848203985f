package io.dynamis.assets.designer;

import io.dynamis.assets.api.AssetConstants;
import io.dynamis.assets.api.AssetNotFoundException;
import io.dynamis.assets.core.Asset;
import io.dynamis.assets.core.AssetManager;
import java.io.IOException;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Boot-time creation pass.
 *
 * ORDER:
 *   1. Discover machine-wide assets, then create the machine's groups.
 *   2. For each mode in the order given: discover its assets, then its groups.
 *   3. Load the groups keyed "preload".
 *   4. manager.preload(): load every asset keyed "preload". If that leaves nothing
 *      outstanding the boot hold is released at once; otherwise the last completion
 *      releases it.
 *
 * Runs once per manager, on the main thread, after every asset kind is registered.
 */
public final class AssetBootstrap {

    private static final Logger LOG = LoggerFactory.getLogger(AssetBootstrap.class);

    private final AssetManager manager;
    private final AssetDiscovery discovery;

    public AssetBootstrap(AssetManager manager, AssetDiscovery discovery) {
        if (manager == null) throw new NullPointerException("manager");
        if (discovery == null) throw new NullPointerException("discovery");
        this.manager = manager;
        this.discovery = discovery;
    }

    /**
     * @return the assets triggered by the preload pass
     * @throws IOException            if an asset folder cannot be walked
     * @throws AssetNotFoundException if a configured file exists on no search path
     */
    public Set<Asset> boot(DiscoverySource machine, List<DiscoverySource> modes)
            throws IOException, AssetNotFoundException {
        if (machine == null) throw new NullPointerException("machine");
        if (modes == null) throw new NullPointerException("modes");

        discovery.discover(machine);
        discovery.createGroups(machine);
        for (DiscoverySource mode : modes) {
            discovery.discover(mode);
            discovery.createGroups(mode);
        }
        LOG.info("Created {} asset(s) and {} group(s)",
            manager.assetCount(), discovery.groupRegistry().size());

        discovery.groupRegistry().loadByKey(AssetConstants.LOAD_PRELOAD);
        return manager.preload();
    }
}

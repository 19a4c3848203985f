package io.dynamis.assets.designer;

import io.dynamis.assets.api.AssetConstants;
import io.dynamis.assets.core.Asset;
import io.dynamis.assets.core.LoadCallback;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named collection of weighted assets exposing a single "pick one" accessor.
 *
 * Designers define groups in data (e.g. a pool of explosion sounds). Game code asks the
 * group for an asset and gets one member according to the group's SelectionType.
 *
 * SELECTION:
 *   SEQUENCE          - each member weight times in a row, cycle length = total weight.
 *   RANDOM            - uniform draw in [1, totalWeight], cumulative-weight walk.
 *   RANDOM_FORCE_NEXT - as RANDOM, excluding the previous pick for that one draw.
 *   RANDOM_FORCE_ALL  - as RANDOM, over members not yet returned this cycle. The cycle
 *                       restarts once every member has been returned.
 *
 * LOADING:
 *   load() loads every member that is not loaded and fires the group's callbacks once
 *   the last of them completes. With nothing to load the callbacks fire immediately.
 *
 * THREAD SAFETY: none. Main thread only, like the assets it references.
 */
public final class AssetGroup {

    private static final Logger LOG = LoggerFactory.getLogger(AssetGroup.class);

    /**
     * One weighted member. Compared by identity inside the group, so the same asset
     * may appear as two distinct members.
     */
    public static final class Member {

        private final Asset asset;
        private final int weight;

        Member(Asset asset, int weight) {
            this.asset = asset;
            this.weight = weight;
        }

        public Asset asset() { return asset; }

        public int weight() { return weight; }

        @Override
        public String toString() {
            return asset.name() + AssetConstants.MEMBER_WEIGHT_SEPARATOR + weight;
        }
    }

    private final String name;
    private final SelectionType selectionType;
    private final String loadKey;
    private final Random random;

    // -- Membership -----------------------------------------------------------

    private final List<Member> members = new ArrayList<>();
    private int totalWeight = 0;

    // -- Selection state ------------------------------------------------------

    /** SEQUENCE: index of the member being repeated and how often it has been returned. */
    private int sequenceIndex = 0;
    private int sequenceRepeats = 0;

    /** RANDOM_FORCE_NEXT: previous pick. */
    private Member lastPicked = null;

    /** RANDOM_FORCE_ALL: members returned in the current cycle. */
    private final Set<Member> pickedThisCycle = Collections.newSetFromMap(new IdentityHashMap<>());

    // -- Loading --------------------------------------------------------------

    private final Set<Asset> loadingMembers = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<LoadCallback<AssetGroup>> callbacks =
        Collections.newSetFromMap(new IdentityHashMap<>());
    private final LoadCallback<Asset> memberLoaded = this::onMemberLoaded;
    private int priority = AssetConstants.DEFAULT_PRIORITY;

    // -- Construction ---------------------------------------------------------

    public AssetGroup(String name, SelectionType selectionType) {
        this(name, selectionType, AssetConstants.LOAD_ON_DEMAND, new Random());
    }

    /**
     * @param loadKey trigger key that loads the whole group, e.g. "preload"
     * @param random  source for the random policies; pass a seeded instance for
     *                reproducible selection
     */
    public AssetGroup(String name, SelectionType selectionType, String loadKey, Random random) {
        if (name == null) throw new NullPointerException("name");
        if (selectionType == null) throw new NullPointerException("selectionType");
        if (loadKey == null) throw new NullPointerException("loadKey");
        if (random == null) throw new NullPointerException("random");
        this.name = name;
        this.selectionType = selectionType;
        this.loadKey = loadKey;
        this.random = random;
    }

    // -- Membership -----------------------------------------------------------

    /**
     * Appends a member and rebuilds selection state.
     *
     * @throws IllegalArgumentException if weight < 1, or if the group's total weight would
     *                                  exceed Integer.MAX_VALUE
     */
    public void addMember(Asset asset, int weight) {
        if (asset == null) {
            throw new NullPointerException("asset");
        }
        if (weight < 1) {
            throw new IllegalArgumentException(
                "Member weight must be >= 1; got " + weight + " for '" + asset.name() + "'");
        }
        try {
            Math.addExact(totalWeight, weight);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                "Group '" + name + "': total weight overflows adding " + weight
                    + " for '" + asset.name() + "'", e);
        }
        members.add(new Member(asset, weight));
        rebuildSelection();
    }

    /**
     * Removes every member backed by the asset and rebuilds selection state.
     *
     * @return true if a member was removed
     */
    public boolean removeMember(Asset asset) {
        boolean removed = members.removeIf(m -> m.asset() == asset);
        if (removed) {
            rebuildSelection();
            if (loadingMembers.remove(asset) && loadingMembers.isEmpty()) {
                fireCallbacks();
            }
        }
        return removed;
    }

    private void rebuildSelection() {
        int total = 0;
        for (Member m : members) {
            total += m.weight();
        }
        totalWeight = total;

        sequenceIndex = 0;
        sequenceRepeats = 0;

        lastPicked = null;
        pickedThisCycle.clear();
    }

    // -- Selection ------------------------------------------------------------

    /**
     * Returns one member according to the selection type. Null if the group is empty.
     * Advances the selection state.
     */
    public Asset asset() {
        if (members.isEmpty()) {
            return null;
        }
        return switch (selectionType) {
            case SEQUENCE -> nextInSequence();
            case RANDOM -> pickWeighted(members).asset();
            case RANDOM_FORCE_NEXT -> pickForceNext();
            case RANDOM_FORCE_ALL -> pickForceAll();
        };
    }

    private Asset nextInSequence() {
        if (sequenceRepeats >= members.get(sequenceIndex).weight()) {
            sequenceIndex = (sequenceIndex + 1) % members.size();
            sequenceRepeats = 0;
        }
        sequenceRepeats++;
        return members.get(sequenceIndex).asset();
    }

    private Asset pickForceNext() {
        List<Member> candidates = new ArrayList<>(members.size());
        for (Member m : members) {
            if (m != lastPicked) {
                candidates.add(m);
            }
        }
        if (candidates.isEmpty()) {
            candidates = members;
        }
        lastPicked = pickWeighted(candidates);
        return lastPicked.asset();
    }

    private Asset pickForceAll() {
        if (pickedThisCycle.size() >= members.size()) {
            pickedThisCycle.clear();
        }
        List<Member> candidates = new ArrayList<>(members.size());
        for (Member m : members) {
            if (!pickedThisCycle.contains(m)) {
                candidates.add(m);
            }
        }
        Member picked = pickWeighted(candidates);
        pickedThisCycle.add(picked);
        return picked.asset();
    }

    /** Draws in [1, sum of candidate weights] and walks the cumulative weights. */
    private Member pickWeighted(List<Member> candidates) {
        int total = 0;
        for (Member m : candidates) {
            total += m.weight();
        }
        int value = random.nextInt(total) + 1;
        int cumulative = 0;
        for (Member m : candidates) {
            cumulative += m.weight();
            if (value <= cumulative) {
                return m;
            }
        }
        return candidates.get(candidates.size() - 1);
    }

    // -- Loading --------------------------------------------------------------

    /** Loads every member not yet loaded, with no group callback. */
    public void load() {
        load(null);
    }

    /**
     * Loads every member not yet loaded, at the given priority.
     */
    public void load(LoadCallback<AssetGroup> callback, int priority) {
        this.priority = priority;
        loadMembers(callback, true);
    }

    /**
     * Loads every member not yet loaded, each at its own priority.
     *
     * @param callback fired once every member is loaded; immediately if none needs loading
     */
    public void load(LoadCallback<AssetGroup> callback) {
        loadMembers(callback, false);
    }

    private void loadMembers(LoadCallback<AssetGroup> callback, boolean overridePriority) {
        if (callback != null) {
            callbacks.add(callback);
        }

        List<Asset> toLoad = new ArrayList<>();
        for (Member m : members) {
            Asset asset = m.asset();
            // A member already tracked is in flight from an earlier call.
            if (!asset.isLoaded() && loadingMembers.add(asset)) {
                toLoad.add(asset);
            }
        }
        for (Asset asset : toLoad) {
            if (overridePriority) {
                asset.load(memberLoaded, priority);
            } else {
                asset.load(memberLoaded);
            }
        }
        LOG.debug("Group '{}' loading {} member(s)", name, toLoad.size());

        if (loadingMembers.isEmpty()) {
            fireCallbacks();
        }
    }

    private void onMemberLoaded(Asset asset) {
        loadingMembers.remove(asset);
        if (loadingMembers.isEmpty()) {
            fireCallbacks();
        }
    }

    private void fireCallbacks() {
        if (callbacks.isEmpty()) {
            return;
        }
        List<LoadCallback<AssetGroup>> pending = new ArrayList<>(callbacks);
        callbacks.clear();
        for (LoadCallback<AssetGroup> callback : pending) {
            callback.onLoaded(this);
        }
    }

    /** True while at least one member requested by load() has not completed. */
    public boolean isLoading() { return !loadingMembers.isEmpty(); }

    /** True if every member is loaded. An empty group is loaded. */
    public boolean isLoaded() {
        for (Member m : members) {
            if (!m.asset().isLoaded()) {
                return false;
            }
        }
        return true;
    }

    // -- Accessors ------------------------------------------------------------

    public String name() { return name; }

    public SelectionType selectionType() { return selectionType; }

    /** Trigger key of the group itself. Defaults to "on_demand". */
    public String loadKey() { return loadKey; }

    /** Members in order. Unmodifiable. */
    public List<Member> members() { return Collections.unmodifiableList(members); }

    /** Sum of member weights. */
    public int totalWeight() { return totalWeight; }

    /** Picks in one SEQUENCE cycle. Equals totalWeight. */
    public int sequenceLength() { return totalWeight; }

    /** Priority of the last prioritised load() call. */
    public int priority() { return priority; }

    @Override
    public String toString() {
        return "AssetGroup{name='" + name + "', type=" + selectionType.configName()
            + ", members=" + members + "}";
    }
}

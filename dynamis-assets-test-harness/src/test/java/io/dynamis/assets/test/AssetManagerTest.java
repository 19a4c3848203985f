package io.dynamis.assets.test;

import io.dynamis.assets.api.*;
import io.dynamis.assets.core.*;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.*;
import static org.assertj.core.api.Assertions.*;

class AssetManagerTest {

    private TestSupport.RecordingBootGate bootGate;
    private TestSupport.RecordingCrashReporter crashReporter;
    private FramePollScheduler scheduler;
    private AssetManager manager;

    @BeforeEach
    void setUp() {
        bootGate = new TestSupport.RecordingBootGate();
        crashReporter = new TestSupport.RecordingCrashReporter();
        scheduler = new FramePollScheduler();
        manager = new AssetManager(bootGate, crashReporter, scheduler, 10L);
        manager.registerAssetClass(StubAsset.registration());
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    private StubAsset stub(String name) {
        StubAsset asset = StubAsset.of(manager, name);
        manager.addAsset(asset);
        return asset;
    }

    private StubAsset stub(String name, Map<String, Object> config) {
        StubAsset asset = new StubAsset(manager, name, Path.of(name + ".stub"), AssetConfig.of(config));
        manager.addAsset(asset);
        return asset;
    }

    // ── Registration ──────────────────────────────────────────────────────

    @Test
    void duplicateRegistrationThrows() {
        assertThatThrownBy(() -> manager.registerAssetClass(StubAsset.registration()))
            .isInstanceOf(AssetConfigurationException.class)
            .hasMessageContaining(StubAsset.ATTRIBUTE);
    }

    @Test
    void registrationsOrderedByDescendingClassPriority() {
        manager.registerAssetClass(AssetClassRegistration.builder("low", StubAsset::new)
            .classPriority(-5).build());
        manager.registerAssetClass(AssetClassRegistration.builder("high", StubAsset::new)
            .classPriority(100).build());
        manager.registerAssetClass(AssetClassRegistration.builder("also_low", StubAsset::new)
            .classPriority(-5).build());

        assertThat(manager.registrations())
            .extracting(AssetClassRegistration::attribute)
            .containsExactly("high", StubAsset.ATTRIBUTE, "low", "also_low");
    }

    @Test
    void registrationBuilderDefaultsPathAndSectionToAttribute() {
        AssetClassRegistration r = manager.registration(StubAsset.ATTRIBUTE);
        assertThat(r.pathString()).isEqualTo(StubAsset.ATTRIBUTE);
        assertThat(r.configSection()).isEqualTo(StubAsset.ATTRIBUTE);
        assertThat(r.accepts("Intro.STUB")).isTrue();
        assertThat(r.accepts("intro.wav")).isFalse();
        assertThat(r.accepts("stub")).isFalse();
    }

    @Test
    void addAssetOfUnregisteredKindThrows() {
        AssetManager bare = new AssetManager(BootGate.NONE, crashReporter, new FramePollScheduler());
        try {
            assertThatThrownBy(() -> bare.addAsset(StubAsset.of(bare, "a")))
                .isInstanceOf(AssetConfigurationException.class);
        } finally {
            bare.shutdown();
        }
    }

    @Test
    void assetLookupIsCaseInsensitive() {
        StubAsset asset = stub("Intro");
        assertThat(manager.getAsset(StubAsset.ATTRIBUTE, "intro")).isSameAs(asset);
        assertThat(manager.getAsset(StubAsset.ATTRIBUTE, "INTRO")).isSameAs(asset);
        assertThat(manager.getAsset("nope", "intro")).isNull();
        assertThat(manager.assetCount()).isEqualTo(1);
    }

    // ── Idle state ────────────────────────────────────────────────────────

    @Test
    void percentIsHundredWithNothingRequested() {
        assertThat(manager.loadingPercent()).isEqualTo(100);
        assertThat(manager.progress()).isEqualTo(new LoadingProgress(0, 0, 0, 100));
    }

    @Test
    void pollWithNothingOutstandingIsNoOp() {
        List<LoadingProgress> events = new CopyOnWriteArrayList<>();
        manager.addProgressListener(events::add);

        manager.poll();

        assertThat(events).isEmpty();
        assertThat(manager.pendingCount()).isZero();
        assertThat(manager.loadedCount()).isZero();
        assertThat(manager.isPolling()).isFalse();
    }

    // ── Load pipeline ─────────────────────────────────────────────────────

    @Test
    void loadCompletesThroughPollAndFiresCallbackOnce() throws Exception {
        StubAsset asset = stub("a");
        AtomicInteger fired = new AtomicInteger();
        LoadCallback<Asset> cb = a -> fired.incrementAndGet();
        asset.load(cb);
        asset.load(cb);

        TestSupport.pollUntil(manager, asset::isLoaded);

        assertThat(fired.get()).isEqualTo(1);
        assertThat(asset.loadCount.get()).isEqualTo(1);
    }

    @Test
    void countersResetOnceAllRequestsComplete() throws Exception {
        StubAsset a = stub("a");
        StubAsset b = stub("b");
        a.load();
        b.load();
        assertThat(manager.pendingCount()).isEqualTo(2);

        TestSupport.pollUntil(manager, () -> a.isLoaded() && b.isLoaded() && !manager.isPolling());

        assertThat(manager.pendingCount()).isZero();
        assertThat(manager.loadedCount()).isZero();
        assertThat(manager.loadingPercent()).isEqualTo(100);
    }

    @Test
    void loadOfLoadedAssetFiresSynchronouslyWithoutEnqueue() throws Exception {
        StubAsset asset = stub("a");
        asset.load();
        TestSupport.pollUntil(manager, () -> asset.isLoaded() && !manager.isPolling());

        AtomicInteger fired = new AtomicInteger();
        asset.load(a -> fired.incrementAndGet());

        assertThat(fired.get()).isEqualTo(1);
        assertThat(manager.pendingCount()).isZero();
        assertThat(manager.isPolling()).isFalse();
        assertThat(asset.loadCount.get()).isEqualTo(1);
    }

    @Test
    void higherPriorityAssetDecodesFirst() throws Exception {
        List<String> order = new CopyOnWriteArrayList<>();
        StubAsset gate = StubAsset.of(manager, "gate", order);
        StubAsset bg = StubAsset.of(manager, "bg", order);
        StubAsset logo = StubAsset.of(manager, "logo", order);
        CountDownLatch release = gate.blockDecode();

        gate.load();
        gate.awaitDecodeStarted();
        bg.load(null, 1);
        logo.load(null, 5);
        release.countDown();

        TestSupport.pollUntil(manager, () -> bg.isLoaded() && logo.isLoaded());
        assertThat(order).containsExactly("gate", "logo", "bg");
    }

    @Test
    void duplicateRequestForLoadedAssetIsSkipped() throws Exception {
        StubAsset gate = stub("gate");
        StubAsset hold = stub("hold");
        StubAsset x = stub("x");
        CountDownLatch releaseGate = gate.blockDecode();
        CountDownLatch releaseHold = hold.blockDecode();

        gate.load(null, 100);
        gate.awaitDecodeStarted();
        x.load(null, 10);
        hold.load(null, 5);
        x.load(null, 1);
        releaseGate.countDown();

        TestSupport.pollUntil(manager, x::isLoaded);
        hold.awaitDecodeStarted();
        releaseHold.countDown();
        TestSupport.pollUntil(manager, () -> hold.isLoaded() && !manager.isPolling());

        assertThat(x.loadCount.get()).isEqualTo(1);
        assertThat(manager.loader().skippedCount()).isEqualTo(1L);
    }

    @Test
    void skippedCompletionDrainedAfterUnloadLeavesAssetUnloaded() throws Exception {
        StubAsset gate = stub("gate");
        StubAsset hold = stub("hold");
        StubAsset x = stub("x");
        CountDownLatch releaseGate = gate.blockDecode();
        CountDownLatch releaseHold = hold.blockDecode();

        gate.load(null, 100);
        gate.awaitDecodeStarted();
        x.load(null, 5);
        hold.load(null, 3);
        x.load(null, 1);
        releaseGate.countDown();

        TestSupport.pollUntil(manager, x::isLoaded);
        hold.awaitDecodeStarted();
        releaseHold.countDown();
        // Both completions wait undrained: hold's decode and x's skipped duplicate.
        TestSupport.waitUntil(() -> manager.undrainedCompletionCount() == 2);

        x.unload();
        manager.poll();

        assertThat(x.state()).isEqualTo(AssetState.UNLOADED);
        assertThat(x.loadCount.get()).isEqualTo(1);
        assertThat(x.unloadCount.get()).isEqualTo(1);
        assertThat(hold.isLoaded()).isTrue();
        assertThat(manager.loader().skippedCount()).isEqualTo(1L);
        assertThat(manager.pendingCount()).isZero();
        assertThat(manager.isPolling()).isFalse();
    }

    @Test
    void throwingCallbackStillCountsCompletionAndFiresOthers() throws Exception {
        StubAsset a = stub("a");
        AtomicInteger fired = new AtomicInteger();
        a.load(asset -> {
            throw new IllegalStateException("host callback bug");
        });
        a.load(asset -> fired.incrementAndGet());

        TestSupport.waitUntil(() -> manager.undrainedCompletionCount() == 2);

        assertThatThrownBy(manager::poll)
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("host callback bug");
        assertThat(a.isLoaded()).isTrue();
        assertThat(fired.get()).isEqualTo(1);
        // The first completion is counted even though its callback threw.
        assertThat(manager.loadedCount()).isEqualTo(1);
        assertThat(manager.pendingCount()).isEqualTo(2);

        manager.poll();

        assertThat(fired.get()).isEqualTo(1);
        assertThat(bootGate.cleared).containsExactly(AssetConstants.BOOT_HOLD_ASSETS);
        assertThat(manager.pendingCount()).isZero();
        assertThat(manager.loadedCount()).isZero();
        assertThat(manager.isPolling()).isFalse();
    }

    @Test
    void frameSchedulerArmsOnceAndDisarmsWhenDone() throws Exception {
        StubAsset a = stub("a");
        StubAsset b = stub("b");
        a.load();
        b.load();

        assertThat(scheduler.isArmed()).isTrue();
        assertThat(scheduler.armCount()).isEqualTo(1L);

        long deadline = System.currentTimeMillis() + 5_000L;
        while (scheduler.isArmed() && System.currentTimeMillis() < deadline) {
            scheduler.tick();
            Thread.sleep(2);
        }

        assertThat(scheduler.isArmed()).isFalse();
        assertThat(a.isLoaded()).isTrue();
        assertThat(b.isLoaded()).isTrue();
    }

    @Test
    void unloadAfterLoadReturnsToUnloaded() throws Exception {
        StubAsset asset = stub("a");
        asset.load();
        TestSupport.pollUntil(manager, asset::isLoaded);

        manager.unloadAssets(List.of(asset));

        assertThat(asset.state()).isEqualTo(AssetState.UNLOADED);
        assertThat(asset.unloadCount.get()).isEqualTo(1);
    }

    // ── Load keys ─────────────────────────────────────────────────────────

    @Test
    void loadByKeyTriggersOnlyMatchingAssets() throws Exception {
        StubAsset a = stub("a", Map.of(AssetConstants.KEY_LOAD, "attract_start"));
        StubAsset b = stub("b", Map.of(AssetConstants.KEY_LOAD, AssetConstants.LOAD_ON_DEMAND));

        Set<Asset> triggered = manager.loadByKey("attract_start", 3);

        assertThat(triggered).containsExactly(a);
        assertThat(a.priority()).isEqualTo(3);
        assertThat(b.isLoading()).isFalse();
        TestSupport.pollUntil(manager, a::isLoaded);
    }

    @Test
    void loadByKeyWithoutPriorityKeepsAssetPriority() {
        StubAsset a = stub("a", Map.of(AssetConstants.KEY_LOAD, "k", AssetConstants.KEY_PRIORITY, 8));
        manager.loadByKey("k");
        assertThat(a.priority()).isEqualTo(8);
    }

    @Test
    void modeAssetsHandleUnloadsExactlyItsSet() throws Exception {
        StubAsset a = stub("a", Map.of(AssetConstants.KEY_LOAD, "attract_start"));
        StubAsset b = stub("b", Map.of(AssetConstants.KEY_LOAD, "attract_start"));
        StubAsset other = stub("other", Map.of(AssetConstants.KEY_LOAD, "game_start"));
        manager.loadByKey("game_start");

        ModeAssets handle = manager.loadModeAssets("attract", 10);
        TestSupport.pollUntil(manager, () -> a.isLoaded() && b.isLoaded() && other.isLoaded());

        assertThat(handle.modeName()).isEqualTo("attract");
        assertThat(handle.assets()).containsExactlyInAnyOrder(a, b);
        assertThat(a.priority()).isEqualTo(10);

        handle.unload();

        assertThat(a.isLoaded()).isFalse();
        assertThat(b.isLoaded()).isFalse();
        assertThat(other.isLoaded()).isTrue();
    }

    // ── Progress and remote progress ──────────────────────────────────────

    @Test
    void progressEventPerCompletion() throws Exception {
        List<LoadingProgress> events = new CopyOnWriteArrayList<>();
        manager.addProgressListener(events::add);
        StubAsset a = stub("a");
        StubAsset b = stub("b");
        a.load();
        b.load();

        TestSupport.pollUntil(manager, () -> a.isLoaded() && b.isLoaded());

        assertThat(events).containsExactly(
            new LoadingProgress(2, 1, 1, 50),
            new LoadingProgress(2, 2, 0, 100));
    }

    @Test
    void throwingListenerDoesNotStopDelivery() throws Exception {
        List<LoadingProgress> events = new CopyOnWriteArrayList<>();
        manager.addProgressListener(p -> { throw new IllegalStateException("listener bug"); });
        manager.addProgressListener(events::add);
        StubAsset a = stub("a");
        a.load();

        TestSupport.pollUntil(manager, a::isLoaded);

        assertThat(events).hasSize(1);
    }

    @Test
    void removedListenerReceivesNothing() {
        List<LoadingProgress> events = new CopyOnWriteArrayList<>();
        AssetProgressListener listener = events::add;
        manager.addProgressListener(listener);
        manager.removeProgressListener(listener);

        manager.reportRemoteProgress(3, 1);

        assertThat(events).isEmpty();
    }

    @Test
    void remoteProgressCombinesWithLocal() throws Exception {
        StubAsset gate = stub("gate");
        CountDownLatch release = gate.blockDecode();
        gate.load();
        gate.awaitDecodeStarted();

        manager.reportRemoteProgress(10, 4);

        assertThat(manager.remoteTotal()).isEqualTo(10);
        assertThat(manager.remoteLoaded()).isEqualTo(6);
        assertThat(manager.remainingCount()).isEqualTo((1 - 0) + 4);
        assertThat(manager.loadingPercent()).isEqualTo(55);

        release.countDown();
        TestSupport.pollUntil(manager, () -> gate.isLoaded() && !manager.isPolling());

        assertThat(manager.remainingCount()).isEqualTo(4);
        assertThat(manager.loadingPercent()).isEqualTo(60);
    }

    @Test
    void remoteReportReplacesPreviousReport() {
        manager.reportRemoteProgress(10, 4);
        manager.reportRemoteProgress(3, 3);
        assertThat(manager.remoteTotal()).isEqualTo(3);
        assertThat(manager.remoteLoaded()).isZero();
        assertThat(manager.loadingPercent()).isZero();
    }

    @Test
    void invalidRemoteReportThrows() {
        assertThatThrownBy(() -> manager.reportRemoteProgress(-1, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> manager.reportRemoteProgress(2, 3))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ── Boot gate ─────────────────────────────────────────────────────────

    @Test
    void preloadWithNothingClearsBootHoldOnce() {
        assertThat(manager.preload()).isEmpty();
        manager.reportRemoteProgress(0, 0);
        manager.reportRemoteProgress(2, 0);

        assertThat(bootGate.cleared).containsExactly(AssetConstants.BOOT_HOLD_ASSETS);
    }

    @Test
    void lastPreloadCompletionClearsBootHold() throws Exception {
        StubAsset a = stub("a", Map.of(AssetConstants.KEY_LOAD, AssetConstants.LOAD_PRELOAD));
        StubAsset b = stub("b", Map.of(AssetConstants.KEY_LOAD, AssetConstants.LOAD_PRELOAD));

        assertThat(manager.preload()).containsExactlyInAnyOrder(a, b);
        assertThat(bootGate.cleared).isEmpty();

        TestSupport.pollUntil(manager, () -> a.isLoaded() && b.isLoaded());

        assertThat(bootGate.cleared).containsExactly(AssetConstants.BOOT_HOLD_ASSETS);
    }

    @Test
    void outstandingRemoteWorkHoldsBoot() {
        manager.reportRemoteProgress(5, 2);
        manager.preload();
        assertThat(bootGate.cleared).isEmpty();

        manager.reportRemoteProgress(5, 0);
        assertThat(bootGate.cleared).containsExactly(AssetConstants.BOOT_HOLD_ASSETS);
    }

    @Test
    void bootHoldNotClearedAfterBootCompleted() {
        bootGate.bootComplete = true;
        manager.preload();
        assertThat(bootGate.cleared).isEmpty();
    }

    // ── Failure and shutdown ──────────────────────────────────────────────

    @Test
    void loaderCrashLeavesAssetLoading() throws Exception {
        StubAsset bad = stub("bad");
        bad.failDecodeWith(new java.io.IOException("truncated"));
        AtomicInteger fired = new AtomicInteger();
        bad.load(a -> fired.incrementAndGet());

        TestSupport.pollUntil(manager, () -> !manager.isLoaderAlive());

        assertThat(crashReporter.traces).hasSize(1);
        assertThat(bad.isLoading()).isTrue();
        assertThat(fired.get()).isZero();
        assertThat(manager.remainingCount()).isEqualTo(1);
    }

    @Test
    void shutdownStopsLoaderAndRejectsLoads() {
        StubAsset a = stub("a");
        manager.shutdown();

        assertThat(manager.isShutdown()).isTrue();
        assertThat(manager.isLoaderAlive()).isFalse();
        assertThat(scheduler.isArmed()).isFalse();
        assertThatThrownBy(a::load).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shutdownIsIdempotent() {
        manager.shutdown();
        manager.shutdown();
        assertThat(manager.isShutdown()).isTrue();
    }
}

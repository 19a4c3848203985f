package io.dynamis.assets.test;

import io.dynamis.assets.core.LoadRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.PriorityBlockingQueue;
import org.junit.jupiter.api.*;
import static org.assertj.core.api.Assertions.*;

class LoadRequestOrderTest {

    private TestSupport.RecordingQueue queue;
    private PriorityBlockingQueue<LoadRequest> heap;

    @BeforeEach
    void setUp() {
        queue = new TestSupport.RecordingQueue();
        heap = new PriorityBlockingQueue<>(11, LoadRequest.LOAD_ORDER);
    }

    private List<String> drainNames() {
        List<String> names = new ArrayList<>();
        LoadRequest r;
        while ((r = heap.poll()) != null) {
            names.add(r.asset().name());
        }
        return names;
    }

    @Test
    void higherPriorityDequeuesFirst() {
        StubAsset bg = StubAsset.of(queue, "bg");
        StubAsset logo = StubAsset.of(queue, "logo");
        heap.put(new LoadRequest(bg, 1));
        heap.put(new LoadRequest(logo, 5));

        assertThat(drainNames()).containsExactly("logo", "bg");
    }

    @Test
    void equalPriorityDequeuesInCreationOrder() {
        StubAsset first = StubAsset.of(queue, "first");
        StubAsset second = StubAsset.of(queue, "second");
        StubAsset third = StubAsset.of(queue, "third");
        heap.put(new LoadRequest(third, 3));
        heap.put(new LoadRequest(first, 3));
        heap.put(new LoadRequest(second, 3));

        assertThat(drainNames()).containsExactly("first", "second", "third");
    }

    @Test
    void negativePrioritiesSortBelowDefault() {
        StubAsset low = StubAsset.of(queue, "low");
        StubAsset normal = StubAsset.of(queue, "normal");
        heap.put(new LoadRequest(low, -10));
        heap.put(new LoadRequest(normal, 0));

        assertThat(drainNames()).containsExactly("normal", "low");
    }

    @Test
    void requestSnapshotsPriorityAtCreation() {
        StubAsset asset = StubAsset.of(queue, "a");
        asset.load(null, 4);
        LoadRequest request = LoadRequest.of(asset);

        asset.load(null, 9);

        assertThat(request.priority()).isEqualTo(4);
        assertThat(asset.priority()).isEqualTo(9);
    }

    @Test
    void laterPriorityChangeDoesNotReorderQueuedRequests() {
        StubAsset a = StubAsset.of(queue, "a");
        StubAsset b = StubAsset.of(queue, "b");
        heap.put(new LoadRequest(a, 5));
        heap.put(new LoadRequest(b, 1));

        b.load(null, 100);

        assertThat(drainNames()).containsExactly("a", "b");
    }

    @Test
    void nullAssetThrows() {
        assertThatThrownBy(() -> new LoadRequest(null, 0))
            .isInstanceOf(NullPointerException.class);
    }
}

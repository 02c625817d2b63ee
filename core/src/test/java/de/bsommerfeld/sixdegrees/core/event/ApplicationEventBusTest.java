package de.bsommerfeld.sixdegrees.core.event;

import com.google.common.eventbus.Subscribe;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationEventBusTest {

    @Test
    void post_shouldDeliverToRegisteredListener() {
        var bus = new ApplicationEventBus();
        var listener = new RecordingListener();
        bus.register(listener);

        bus.post(new IngestEvents.TableLoaded("movies", 3, 1));

        assertEquals(1, listener.loaded.size());
        assertEquals("movies", listener.loaded.get(0).table());
    }

    @Test
    void post_shouldDeliverBatchEventsSynchronously() {
        var bus = new ApplicationEventBus();
        var listener = new RecordingListener();
        bus.register(listener);

        bus.post(new IngestEvents.BatchCommitted("edges", 100));
        bus.post(new IngestEvents.BatchCommitted("edges", 200));

        assertEquals(List.of(100L, 200L), listener.batches);
    }

    @Test
    void unregister_shouldStopDelivery() {
        var bus = new ApplicationEventBus();
        var listener = new RecordingListener();
        bus.register(listener);
        bus.unregister(listener);

        bus.post(new IngestEvents.TableLoaded("people", 1, 0));

        assertTrue(listener.loaded.isEmpty());
    }

    static class RecordingListener {
        final List<IngestEvents.TableLoaded> loaded = new ArrayList<>();
        final List<Long> batches = new ArrayList<>();

        @Subscribe
        public void onLoaded(IngestEvents.TableLoaded event) {
            loaded.add(event);
        }

        @Subscribe
        public void onBatch(IngestEvents.BatchCommitted event) {
            batches.add(event.rowsSoFar());
        }
    }
}

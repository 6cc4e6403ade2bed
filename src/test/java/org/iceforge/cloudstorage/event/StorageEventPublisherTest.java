package org.iceforge.cloudstorage.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StorageEventPublisherTest {

    @Test
    void failingListener_isSkipped() {
        List<StorageEvent> seen = new ArrayList<>();
        StorageEventCounters counters = new StorageEventCounters();
        StorageEventPublisher publisher = new StorageEventPublisher(List.of(
                event -> { throw new IllegalStateException("listener bug"); },
                seen::add,
                counters));

        publisher.publish(StorageEvent.Type.PART_RETRIED, "users/u1/a.bin", Map.of("partNumber", 2));
        publisher.publish(StorageEvent.Type.PART_RETRIED, "users/u1/a.bin");

        assertEquals(2, seen.size());
        assertEquals("users/u1/a.bin", seen.get(0).subject());
        assertEquals(2, seen.get(0).attributes().get("partNumber"));
        assertEquals(2, counters.count(StorageEvent.Type.PART_RETRIED));
        assertEquals(0, counters.count(StorageEvent.Type.PART_FAILED));
    }

    @Test
    void noop_acceptsEvents() {
        assertDoesNotThrow(() -> StorageEventPublisher.noop().publish(StorageEvent.Type.CACHE_HIT, "k"));
    }
}

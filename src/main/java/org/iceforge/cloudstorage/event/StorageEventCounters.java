package org.iceforge.cloudstorage.event;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Minimal in-memory counters per event type.
 */
@Component
public class StorageEventCounters implements StorageEventListener {
    private final Map<StorageEvent.Type, LongAdder> counters = new EnumMap<>(StorageEvent.Type.class);

    public StorageEventCounters() {
        for (StorageEvent.Type type : StorageEvent.Type.values()) {
            counters.put(type, new LongAdder());
        }
    }

    @Override
    public void onEvent(StorageEvent event) {
        counters.get(event.type()).increment();
    }

    public long count(StorageEvent.Type type) {
        return counters.get(type).sum();
    }
}

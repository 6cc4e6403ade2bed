package org.iceforge.cloudstorage.event;

/**
 * Sink for {@link StorageEvent}s. Implementations must not block.
 */
public interface StorageEventListener {

    void onEvent(StorageEvent event);
}

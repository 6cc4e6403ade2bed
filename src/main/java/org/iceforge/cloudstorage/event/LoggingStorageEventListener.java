package org.iceforge.cloudstorage.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingStorageEventListener implements StorageEventListener {
    private static final Logger logger = LoggerFactory.getLogger("cloudstorage.events");

    @Override
    public void onEvent(StorageEvent event) {
        switch (event.type()) {
            case PART_FAILED, LOCK_TIMEOUT, UPLOAD_ABORTED ->
                    logger.warn("event={} subject={} attributes={}", event.type().eventName(), event.subject(), event.attributes());
            case UPLOAD_COMPLETED ->
                    logger.info("event={} subject={} attributes={}", event.type().eventName(), event.subject(), event.attributes());
            default ->
                    logger.debug("event={} subject={} attributes={}", event.type().eventName(), event.subject(), event.attributes());
        }
    }
}

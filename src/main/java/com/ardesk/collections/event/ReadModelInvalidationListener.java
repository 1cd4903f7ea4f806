package com.ardesk.collections.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Nothing in this service caches read-models, so invalidations are only traced.
 */
@Slf4j
@Component
public class ReadModelInvalidationListener {

    @EventListener
    public void onInvalidated(ReadModelsInvalidatedEvent event) {
        log.debug("Tenant {}: {} invalidated {}", event.getTenantId(), event.getMutation(), event.getReadModels());
    }
}

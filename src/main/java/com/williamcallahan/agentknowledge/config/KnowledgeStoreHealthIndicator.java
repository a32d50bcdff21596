package com.williamcallahan.agentknowledge.config;

import com.williamcallahan.agentknowledge.store.KnowledgeStore;
import com.williamcallahan.agentknowledge.store.KnowledgeStoreException;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Spring Actuator health indicator for the knowledge store.
 *
 * <p>Exposed through {@code /actuator/health} as {@code knowledgeStore}.</p>
 */
@Component
public class KnowledgeStoreHealthIndicator implements HealthIndicator {

    /** Health detail key for human-readable status message. */
    private static final String DETAIL_KEY_STATUS = "status";
    /** Health detail key for whether the failure may clear on its own. */
    private static final String DETAIL_KEY_TRANSIENT = "transient";

    private final KnowledgeStore knowledgeStore;

    public KnowledgeStoreHealthIndicator(KnowledgeStore knowledgeStore) {
        this.knowledgeStore = knowledgeStore;
    }

    /**
     * Pings the store.
     *
     * @return Health.UP when the store answers, Health.DOWN otherwise
     */
    @Override
    public Health health() {
        try {
            knowledgeStore.ping();
            return Health.up().withDetail(DETAIL_KEY_STATUS, "Knowledge store reachable").build();
        } catch (KnowledgeStoreException storeFailure) {
            return Health.down()
                    .withDetail(DETAIL_KEY_STATUS, storeFailure.getMessage())
                    .withDetail(DETAIL_KEY_TRANSIENT, storeFailure.isTransient())
                    .build();
        }
    }
}

package com.williamcallahan.agentknowledge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.agentknowledge.store.JdbcKnowledgeStore;
import com.williamcallahan.agentknowledge.store.KnowledgeStore;
import com.williamcallahan.agentknowledge.store.KnowledgeStoreException;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Verifies that actuator health reflects a live ping of the knowledge store.
 */
class KnowledgeStoreHealthIndicatorTest {

    @Test
    void health_isUpWhenStoreAnswers() {
        KnowledgeStore knowledgeStore = mock(KnowledgeStore.class);

        Health health = new KnowledgeStoreHealthIndicator(knowledgeStore).health();

        verify(knowledgeStore).ping();
        assertEquals(Status.UP, health.getStatus());
        assertEquals("Knowledge store reachable", health.getDetails().get("status"));
    }

    @Test
    void health_isDownWithTransientFlagWhenPingFails() {
        KnowledgeStore knowledgeStore = mock(KnowledgeStore.class);
        doThrow(new KnowledgeStoreException("Knowledge store ping failed: connection refused", true))
                .when(knowledgeStore)
                .ping();

        Health health = new KnowledgeStoreHealthIndicator(knowledgeStore).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("Knowledge store ping failed: connection refused", health.getDetails().get("status"));
        assertEquals(true, health.getDetails().get("transient"));
    }

    @Test
    void health_isDownWhenDatabaseAnswersButEntriesTableIsMissing() {
        JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
        when(jdbcTemplate.queryForObject(contains("from entries"), eq(Integer.class)))
                .thenThrow(new BadSqlGrammarException(
                        "ping", "select 1 from entries", new SQLException("relation \"entries\" does not exist", "42P01")));
        KnowledgeStore knowledgeStore =
                new JdbcKnowledgeStore(jdbcTemplate, TransactionOperations.withoutTransaction(), "english");

        Health health = new KnowledgeStoreHealthIndicator(knowledgeStore).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals(false, health.getDetails().get("transient"));
    }
}

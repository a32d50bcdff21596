package com.williamcallahan.agentknowledge.config;

import com.williamcallahan.agentknowledge.store.InMemoryKnowledgeStore;
import com.williamcallahan.agentknowledge.store.JdbcKnowledgeStore;
import com.williamcallahan.agentknowledge.store.KnowledgeStore;
import java.time.Duration;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Selects the knowledge store backend from {@code app.store.mode}.
 *
 * <p>The in-memory backend needs no data source; run it with
 * {@code spring.autoconfigure.exclude} listing the data source auto-configuration. The JDBC backend
 * gets its own template whose statement timeout follows {@code app.search.query-timeout}, so the
 * database stops a query that the search fan-out has already given up on.</p>
 */
@Configuration
public class KnowledgeStoreConfig {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeStoreConfig.class);

    /**
     * Creates the configured store.
     *
     * @param appProperties application configuration
     * @param jdbcTemplate JDBC template, present when a data source is configured
     * @param transactionManager transaction manager, present when a data source is configured
     * @return knowledge store
     * @throws IllegalStateException when JDBC mode is selected without a data source
     */
    @Bean
    public KnowledgeStore knowledgeStore(
            AppProperties appProperties,
            ObjectProvider<JdbcTemplate> jdbcTemplate,
            ObjectProvider<PlatformTransactionManager> transactionManager) {
        StoreSettings store = appProperties.getStore();
        if (store.getMode() == StoreSettings.Mode.IN_MEMORY) {
            return new InMemoryKnowledgeStore();
        }
        JdbcTemplate template = jdbcTemplate.getIfAvailable();
        PlatformTransactionManager manager = transactionManager.getIfAvailable();
        if (template == null || manager == null) {
            throw new IllegalStateException(
                    "app.store.mode=jdbc requires a configured spring.datasource (url, username, password)");
        }
        JdbcTemplate storeTemplate = storeJdbcTemplate(template, appProperties.getSearch().getQueryTimeout());
        log.info("[STORE] Using PostgreSQL knowledge store (textSearchConfig={}, statementTimeout={}s)",
                store.getTextSearchConfig(), storeTemplate.getQueryTimeout());
        return new JdbcKnowledgeStore(storeTemplate, new TransactionTemplate(manager), store.getTextSearchConfig());
    }

    static JdbcTemplate storeJdbcTemplate(JdbcTemplate shared, Duration queryTimeout) {
        DataSource dataSource = shared.getDataSource();
        if (dataSource == null) {
            throw new IllegalStateException("app.store.mode=jdbc requires a JdbcTemplate bound to a data source");
        }
        JdbcTemplate storeTemplate = new JdbcTemplate(dataSource);
        storeTemplate.setFetchSize(shared.getFetchSize());
        storeTemplate.setMaxRows(shared.getMaxRows());
        // JDBC timeouts are whole seconds; round up so a sub-second setting still applies
        long seconds = (queryTimeout.toMillis() + 999L) / 1000L;
        storeTemplate.setQueryTimeout((int) Math.max(1L, Math.min(Integer.MAX_VALUE, seconds)));
        return storeTemplate;
    }
}

package com.williamcallahan.agentknowledge.config;

import com.williamcallahan.agentknowledge.store.KnowledgeSchema;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the PostgreSQL tables and indexes at startup when {@code app.store.initialize-schema}
 * is enabled. Every statement is idempotent.
 */
@Component
public class KnowledgeSchemaInitializer implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeSchemaInitializer.class);

    private final AppProperties appProperties;
    private final ObjectProvider<JdbcTemplate> jdbcTemplate;

    public KnowledgeSchemaInitializer(AppProperties appProperties, ObjectProvider<JdbcTemplate> jdbcTemplate) {
        this.appProperties = appProperties;
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void run(ApplicationArguments args) {
        StoreSettings store = appProperties.getStore();
        if (store.getMode() != StoreSettings.Mode.JDBC || !store.isInitializeSchema()) {
            return;
        }
        JdbcTemplate template = jdbcTemplate.getIfAvailable();
        if (template == null) {
            log.warn("[STORE] Schema initialization skipped: no data source configured");
            return;
        }
        List<String> statements = KnowledgeSchema.statements(
                appProperties.getEmbeddings().getDimensions(), store.getTextSearchConfig());
        try {
            for (String statement : statements) {
                template.execute(statement);
            }
            log.info("[STORE] Ensured knowledge schema ({} statements)", statements.size());
        } catch (DataAccessException schemaFailure) {
            // Health reports the store as down until the schema exists
            log.warn("[STORE] Unable to ensure knowledge schema (will continue): {}", schemaFailure.getMessage());
        }
    }
}

package com.williamcallahan.agentknowledge.config;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Knowledge store backend settings.
 */
public class StoreSettings {

    private static final String TEXT_SEARCH_CONFIG_DEF = "english";
    private static final String MODE_KEY = "app.store.mode";
    private static final String TEXT_SEARCH_CONFIG_KEY = "app.store.text-search-config";
    private static final String NULL_TEXT_FMT = "%s must not be null.";
    private static final String IDENTIFIER_FMT = "%s must be a simple identifier (got %s).";
    private static final Pattern SQL_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * Which {@code KnowledgeStore} implementation backs the service.
     */
    public enum Mode {
        JDBC,
        IN_MEMORY
    }

    private Mode mode = Mode.JDBC;
    private boolean initializeSchema = true;
    private String textSearchConfig = TEXT_SEARCH_CONFIG_DEF;

    public StoreSettings() {}

    /**
     * Validates store settings. The text search config is inlined into DDL, so it must be an identifier.
     */
    public void validateConfiguration() {
        if (mode == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_TEXT_FMT, MODE_KEY));
        }
        if (textSearchConfig == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_TEXT_FMT, TEXT_SEARCH_CONFIG_KEY));
        }
        if (!SQL_IDENTIFIER.matcher(textSearchConfig).matches()) {
            throw new IllegalArgumentException(
                    String.format(Locale.ROOT, IDENTIFIER_FMT, TEXT_SEARCH_CONFIG_KEY, textSearchConfig));
        }
    }

    public Mode getMode() {
        return mode;
    }

    public void setMode(final Mode mode) {
        this.mode = mode;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(final boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public String getTextSearchConfig() {
        return textSearchConfig;
    }

    public void setTextSearchConfig(final String textSearchConfig) {
        this.textSearchConfig = textSearchConfig;
    }
}

package com.williamcallahan.agentknowledge.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * Verifies startup validation of the {@code app.*} settings.
 */
class AppPropertiesValidationTest {

    @Test
    void acceptsDefaults() {
        assertDoesNotThrow(new AppProperties()::validateConfiguration);
    }

    @Test
    void rejectsOverlapNotSmallerThanChunkSize() {
        AppProperties appProperties = new AppProperties();
        appProperties.getChunking().setChunkSize(100);
        appProperties.getChunking().setOverlap(100);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNegativeRrfK() {
        AppProperties appProperties = new AppProperties();
        appProperties.getSearch().setRrfK(-1);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsDefaultTopKAboveMax() {
        AppProperties appProperties = new AppProperties();
        appProperties.getSearch().setDefaultTopK(60);
        appProperties.getSearch().setMaxTopK(50);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsMaxTopKAboveFifty() {
        AppProperties appProperties = new AppProperties();
        appProperties.getSearch().setMaxTopK(500);

        IllegalArgumentException thrown =
                assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
        assertEquals("app.search.max-top-k must be at most 50 (got 500).", thrown.getMessage());
    }

    @Test
    void rejectsZeroQueryTimeout() {
        AppProperties appProperties = new AppProperties();
        appProperties.getSearch().setQueryTimeout(Duration.ZERO);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsUnknownEmbeddingProvider() {
        AppProperties appProperties = new AppProperties();
        appProperties.getEmbeddings().setProvider("word2vec");

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveDimensions() {
        AppProperties appProperties = new AppProperties();
        appProperties.getEmbeddings().setDimensions(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsTextSearchConfigThatIsNotAnIdentifier() {
        AppProperties appProperties = new AppProperties();
        appProperties.getStore().setTextSearchConfig("english; drop table entries");

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsZeroRetryAttempts() {
        AppProperties appProperties = new AppProperties();
        appProperties.getRetry().setMaxAttempts(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }
}

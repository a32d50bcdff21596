package com.williamcallahan.agentknowledge.config;

import com.williamcallahan.agentknowledge.service.EmbeddingClient;
import com.williamcallahan.agentknowledge.service.EmbeddingInputTruncator;
import com.williamcallahan.agentknowledge.service.EmbeddingServiceUnavailableException;
import com.williamcallahan.agentknowledge.service.HashingEmbeddingClient;
import com.williamcallahan.agentknowledge.service.NormalizingEmbeddingClient;
import com.williamcallahan.agentknowledge.service.OpenAiCompatibleEmbeddingClient;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Embedding provider configuration with strict error propagation.
 *
 * <p>The provider is selected from {@code app.embeddings.provider}. No runtime fallback is
 * attempted, so a misconfigured provider fails startup instead of producing vectors from a
 * different model. Every provider is wrapped so callers always receive unit-length vectors of the
 * configured dimension.</p>
 */
@Configuration
public class EmbeddingConfig {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);
    private static final String API_KEY_PROPERTY = "app.embeddings.api-key";

    /**
     * Creates the embedding client for the configured provider.
     *
     * @param appProperties application configuration
     * @return normalizing embedding client
     * @throws EmbeddingServiceUnavailableException when the remote provider has no API key
     */
    @Bean(destroyMethod = "close")
    public NormalizingEmbeddingClient embeddingClient(AppProperties appProperties) {
        EmbeddingSettings embeddings =
                Objects.requireNonNull(appProperties, "appProperties").getEmbeddings();
        String provider = embeddings.getProvider().trim().toLowerCase(Locale.ROOT);

        EmbeddingClient providerClient;
        if (EmbeddingSettings.PROVIDER_HASHING.equals(provider)) {
            log.info("[EMBEDDING] Using local hashing embeddings (dimensions={})", embeddings.getDimensions());
            providerClient = new HashingEmbeddingClient(embeddings.getDimensions());
        } else {
            if (embeddings.getApiKey().isBlank()) {
                throw new EmbeddingServiceUnavailableException(
                        "Embedding provider unavailable: " + API_KEY_PROPERTY + " is not configured. "
                                + "Set OPENAI_API_KEY or switch app.embeddings.provider to hashing.");
            }
            log.info(
                    "[EMBEDDING] Using OpenAI-compatible provider (urlId={}, model={})",
                    Integer.toHexString(Objects.hashCode(embeddings.getBaseUrl())),
                    embeddings.getModel());
            providerClient = OpenAiCompatibleEmbeddingClient.create(embeddings);
        }

        return new NormalizingEmbeddingClient(
                providerClient,
                new EmbeddingInputTruncator(embeddings.getMaxInputChars(), embeddings.getMaxInputTokens()),
                embeddings.getDimensions(),
                embeddings.getDimensionMismatchPolicy());
    }
}

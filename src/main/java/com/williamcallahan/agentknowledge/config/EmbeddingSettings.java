package com.williamcallahan.agentknowledge.config;

import com.williamcallahan.agentknowledge.service.DimensionMismatchPolicy;
import java.util.Locale;

/**
 * Embedding provider settings.
 */
public class EmbeddingSettings {

    private static final String PROVIDER_DEF = "openai";
    private static final String BASE_URL_DEF = "https://api.openai.com/v1";
    private static final String MODEL_DEF = "text-embedding-3-small";
    private static final String API_KEY_DEF = "";
    private static final int DIM_DEF = 1_536;
    private static final int MAX_INPUT_CHARS_DEF = 8_000;
    private static final int MAX_INPUT_TOKENS_DEF = 8_191;
    private static final String PROVIDER_KEY = "app.embeddings.provider";
    private static final String BASE_URL_KEY = "app.embeddings.base-url";
    private static final String MODEL_KEY = "app.embeddings.model";
    private static final String API_KEY_PROP = "app.embeddings.api-key";
    private static final String DIM_KEY = "app.embeddings.dimensions";
    private static final String MAX_INPUT_CHARS_KEY = "app.embeddings.max-input-chars";
    private static final String MAX_INPUT_TOKENS_KEY = "app.embeddings.max-input-tokens";
    private static final String POLICY_KEY = "app.embeddings.dimension-mismatch-policy";
    private static final String NULL_TEXT_FMT = "%s must not be null.";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String PROVIDER_FMT = "%s must be one of openai, hashing (got %s).";

    /** Provider backed by an OpenAI-compatible {@code /v1/embeddings} endpoint. */
    public static final String PROVIDER_OPENAI = "openai";
    /** Deterministic offline provider based on token feature hashing. */
    public static final String PROVIDER_HASHING = "hashing";

    private String provider = PROVIDER_DEF;
    private String baseUrl = BASE_URL_DEF;
    private String model = MODEL_DEF;
    private String apiKey = API_KEY_DEF;
    private int dimensions = DIM_DEF;
    private int maxInputChars = MAX_INPUT_CHARS_DEF;
    private int maxInputTokens = MAX_INPUT_TOKENS_DEF;
    private DimensionMismatchPolicy dimensionMismatchPolicy = DimensionMismatchPolicy.REJECT;

    public EmbeddingSettings() {}

    /**
     * Validates embedding settings.
     */
    public void validateConfiguration() {
        requireNonNullText(PROVIDER_KEY, provider);
        requireNonNullText(BASE_URL_KEY, baseUrl);
        requireNonNullText(MODEL_KEY, model);
        requireNonNullText(API_KEY_PROP, apiKey);
        String normalizedProvider = provider.trim().toLowerCase(Locale.ROOT);
        if (!PROVIDER_OPENAI.equals(normalizedProvider) && !PROVIDER_HASHING.equals(normalizedProvider)) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, PROVIDER_FMT, PROVIDER_KEY, provider));
        }
        requirePositive(DIM_KEY, dimensions);
        requirePositive(MAX_INPUT_CHARS_KEY, maxInputChars);
        requirePositive(MAX_INPUT_TOKENS_KEY, maxInputTokens);
        if (dimensionMismatchPolicy == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_TEXT_FMT, POLICY_KEY));
        }
    }

    private static void requirePositive(String propertyKey, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, propertyKey));
        }
    }

    private static String requireNonNullText(final String propertyKey, final String text) {
        if (text == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_TEXT_FMT, propertyKey));
        }
        return text;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(final String provider) {
        this.provider = requireNonNullText(PROVIDER_KEY, provider);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(final String baseUrl) {
        this.baseUrl = requireNonNullText(BASE_URL_KEY, baseUrl);
    }

    public String getModel() {
        return model;
    }

    public void setModel(final String model) {
        this.model = requireNonNullText(MODEL_KEY, model);
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(final String apiKey) {
        this.apiKey = requireNonNullText(API_KEY_PROP, apiKey);
    }

    public int getDimensions() {
        return dimensions;
    }

    public void setDimensions(final int dimensions) {
        this.dimensions = dimensions;
    }

    public int getMaxInputChars() {
        return maxInputChars;
    }

    public void setMaxInputChars(final int maxInputChars) {
        this.maxInputChars = maxInputChars;
    }

    public int getMaxInputTokens() {
        return maxInputTokens;
    }

    public void setMaxInputTokens(final int maxInputTokens) {
        this.maxInputTokens = maxInputTokens;
    }

    public DimensionMismatchPolicy getDimensionMismatchPolicy() {
        return dimensionMismatchPolicy;
    }

    public void setDimensionMismatchPolicy(final DimensionMismatchPolicy dimensionMismatchPolicy) {
        this.dimensionMismatchPolicy = dimensionMismatchPolicy;
    }
}

package com.williamcallahan.agentknowledge.support;

/**
 * Normalizes embedding provider base URLs for the OpenAI Java SDK.
 *
 * <p>The SDK expects base URLs to end with the API version prefix ({@code /v1}). Operators often
 * paste the full {@code /v1/embeddings} endpoint instead, so that suffix is stripped.</p>
 */
public final class OpenAiSdkUrlNormalizer {

    private static final String VERSION_SUFFIX = "/v1";
    private static final String EMBEDDINGS_SUFFIX = "/embeddings";

    private OpenAiSdkUrlNormalizer() {}

    /**
     * Normalizes a base URL for the OpenAI Java SDK.
     *
     * @param baseUrl raw base URL from configuration
     * @return normalized URL suitable for {@code OpenAIOkHttpClient.builder().baseUrl()}
     * @throws IllegalStateException if baseUrl is null or blank
     */
    public static String normalize(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("Embedding base URL is not configured");
        }
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.endsWith(EMBEDDINGS_SUFFIX)) {
            trimmed = trimmed.substring(0, trimmed.length() - EMBEDDINGS_SUFFIX.length());
        }
        if (trimmed.endsWith(VERSION_SUFFIX)) {
            return trimmed;
        }
        return trimmed + VERSION_SUFFIX;
    }
}

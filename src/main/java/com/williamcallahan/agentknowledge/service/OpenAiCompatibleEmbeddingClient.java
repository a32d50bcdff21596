package com.williamcallahan.agentknowledge.service;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.embeddings.CreateEmbeddingResponse;
import com.openai.models.embeddings.Embedding;
import com.openai.models.embeddings.EmbeddingCreateParams;
import com.williamcallahan.agentknowledge.config.EmbeddingSettings;
import com.williamcallahan.agentknowledge.support.OpenAiSdkUrlNormalizer;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embeds chunk and query text through an OpenAI-compatible {@code /embeddings} endpoint.
 *
 * <p>All inputs of a call travel in one request. Unreachable providers, throttling, server errors,
 * and answers that lack a vector for some input are retried with doubling backoff; the final failure
 * surfaces as {@link EmbeddingServiceUnavailableException}. Vectors come back exactly as the provider
 * sent them, so shaping them is left to {@link NormalizingEmbeddingClient}.</p>
 */
public class OpenAiCompatibleEmbeddingClient implements EmbeddingClient, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleEmbeddingClient.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration CALL_TIMEOUT = Duration.ofSeconds(60);
    private static final int MAX_ATTEMPTS = 4;
    private static final Duration FIRST_BACKOFF = Duration.ofSeconds(1);
    private static final Duration BACKOFF_CEILING = Duration.ofSeconds(8);
    private static final int ERROR_DETAIL_LIMIT = 512;

    // request timeout, conflict, too early, too many requests
    private static final Set<Integer> RETRYABLE_CLIENT_STATUSES = Set.of(408, 409, 425, 429);
    private static final int FIRST_SERVER_ERROR_STATUS = 500;

    private final OpenAIClient client;
    private final String model;
    private final Duration firstBackoff;
    private final RequestOptions requestOptions;

    /**
     * Builds a client for the configured endpoint.
     *
     * @throws IllegalStateException when the API key or model is blank
     */
    public static OpenAiCompatibleEmbeddingClient create(EmbeddingSettings settings) {
        Objects.requireNonNull(settings, "settings");
        if (settings.getApiKey().isBlank()) {
            throw new IllegalStateException("Embedding API key is not configured (app.embeddings.api-key)");
        }
        OpenAIClient client = OpenAIOkHttpClient.builder()
                .apiKey(settings.getApiKey())
                .baseUrl(OpenAiSdkUrlNormalizer.normalize(settings.getBaseUrl()))
                .build();
        return new OpenAiCompatibleEmbeddingClient(client, settings.getModel(), FIRST_BACKOFF);
    }

    static OpenAiCompatibleEmbeddingClient create(OpenAIClient client, String model, Duration firstBackoff) {
        return new OpenAiCompatibleEmbeddingClient(Objects.requireNonNull(client, "client"), model, firstBackoff);
    }

    private OpenAiCompatibleEmbeddingClient(OpenAIClient client, String model, Duration firstBackoff) {
        if (model == null || model.isBlank()) {
            throw new IllegalStateException("Embedding model is not configured (app.embeddings.model)");
        }
        this.client = client;
        this.model = model;
        this.firstBackoff = Objects.requireNonNull(firstBackoff, "firstBackoff");
        this.requestOptions = RequestOptions.builder()
                .timeout(Timeout.builder()
                        .connect(CONNECT_TIMEOUT)
                        .read(CALL_TIMEOUT)
                        .request(CALL_TIMEOUT)
                        .build())
                .build();
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        EmbeddingCreateParams params =
                EmbeddingCreateParams.builder().model(model).inputOfArrayOfStrings(texts).build();
        Duration backoff = firstBackoff;
        for (int attempt = 1; ; attempt++) {
            try {
                return requestVectors(params, texts.size());
            } catch (EmbeddingServiceUnavailableException failure) {
                if (!failure.isRetryable() || attempt >= MAX_ATTEMPTS) {
                    throw new EmbeddingServiceUnavailableException(
                            "Embedding request for " + texts.size() + " input(s) failed after " + attempt
                                    + " attempt(s): " + failure.getMessage(),
                            failure.isRetryable(),
                            failure);
                }
                log.warn("[EMBEDDING] Attempt {}/{} failed, retrying in {}ms: {}",
                        attempt, MAX_ATTEMPTS, backoff.toMillis(), failure.getMessage());
                pause(backoff);
                Duration doubled = backoff.multipliedBy(2);
                backoff = doubled.compareTo(BACKOFF_CEILING) > 0 ? BACKOFF_CEILING : doubled;
            }
        }
    }

    /**
     * Closes the SDK client and its connection pool.
     */
    @Override
    public void close() {
        client.close();
    }

    private List<float[]> requestVectors(EmbeddingCreateParams params, int inputCount) {
        CreateEmbeddingResponse response;
        try {
            response = client.embeddings().create(params, requestOptions);
        } catch (OpenAIServiceException serviceFailure) {
            int status = serviceFailure.statusCode();
            boolean retryable = status >= FIRST_SERVER_ERROR_STATUS || RETRYABLE_CLIENT_STATUSES.contains(status);
            throw new EmbeddingServiceUnavailableException(
                    "provider answered HTTP " + status + detail(serviceFailure), retryable, serviceFailure);
        } catch (OpenAIIoException ioFailure) {
            throw new EmbeddingServiceUnavailableException(
                    "provider unreachable" + detail(ioFailure), true, ioFailure);
        } catch (RuntimeException unexpected) {
            throw new EmbeddingServiceUnavailableException(
                    unexpected.getClass().getSimpleName() + detail(unexpected), false, unexpected);
        }
        if (response == null) {
            throw new EmbeddingServiceUnavailableException("provider sent no response body", true, null);
        }
        return vectorsInInputOrder(response.data(), inputCount);
    }

    // the provider may answer out of order; its index field is authoritative
    private static List<float[]> vectorsInInputOrder(List<Embedding> data, int inputCount) {
        float[][] byInput = new float[inputCount][];
        for (Embedding item : data) {
            long inputIndex = item.index();
            if (inputIndex < 0 || inputIndex >= inputCount) {
                log.debug("[EMBEDDING] Dropping vector for unknown input index {} of {}", inputIndex, inputCount);
                continue;
            }
            byInput[(int) inputIndex] = toVector(item.embedding(), inputIndex);
        }
        for (int inputIndex = 0; inputIndex < inputCount; inputIndex++) {
            if (byInput[inputIndex] == null) {
                throw new EmbeddingServiceUnavailableException(
                        "provider sent no vector for input " + inputIndex + " of " + inputCount, true, null);
            }
        }
        return List.copyOf(Arrays.asList(byInput));
    }

    private static float[] toVector(List<Float> values, long inputIndex) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        float[] vector = new float[values.size()];
        for (int component = 0; component < vector.length; component++) {
            Float value = values.get(component);
            if (value == null) {
                throw new EmbeddingServiceUnavailableException(
                        "provider sent a null component " + component + " for input " + inputIndex, false, null);
            }
            vector[component] = value;
        }
        return vector;
    }

    private static String detail(Exception failure) {
        String message = failure.getMessage();
        if (message == null || message.isBlank()) {
            return "";
        }
        String singleLine = message.replace('\r', ' ').replace('\n', ' ').trim();
        return ": " + (singleLine.length() > ERROR_DETAIL_LIMIT
                ? singleLine.substring(0, ERROR_DETAIL_LIMIT) + "..."
                : singleLine);
    }

    private static void pause(Duration backoff) {
        if (backoff.isZero() || backoff.isNegative()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new EmbeddingServiceUnavailableException("Embedding retry interrupted", false, interrupted);
        }
    }
}

package com.williamcallahan.agentknowledge.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a provider client so every vector leaving it has the configured shape.
 *
 * <p>Inputs are truncated before the call. Returned vectors longer than the configured dimension are
 * cut; shorter ones follow the {@link DimensionMismatchPolicy}. Vectors are then scaled to unit
 * length, except all-zero vectors which are returned unchanged.</p>
 */
public class NormalizingEmbeddingClient implements EmbeddingClient, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NormalizingEmbeddingClient.class);

    private final EmbeddingClient delegate;
    private final EmbeddingInputTruncator inputTruncator;
    private final int dimensions;
    private final DimensionMismatchPolicy dimensionMismatchPolicy;
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * Creates a normalizing wrapper.
     *
     * @param delegate provider client
     * @param inputTruncator input length caps
     * @param dimensions configured vector dimension
     * @param dimensionMismatchPolicy handling for short vectors
     */
    public NormalizingEmbeddingClient(
            EmbeddingClient delegate,
            EmbeddingInputTruncator inputTruncator,
            int dimensions,
            DimensionMismatchPolicy dimensionMismatchPolicy) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.inputTruncator = Objects.requireNonNull(inputTruncator, "inputTruncator");
        this.dimensionMismatchPolicy = Objects.requireNonNull(dimensionMismatchPolicy, "dimensionMismatchPolicy");
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Embedding dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (closed.get()) {
            throw new IllegalStateException("Embedding client has been closed");
        }
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        List<String> truncatedInputs = texts.stream().map(inputTruncator::truncate).toList();
        List<float[]> rawVectors = delegate.embed(truncatedInputs);
        if (rawVectors == null || rawVectors.size() != texts.size()) {
            throw new EmbeddingServiceUnavailableException("Embedding provider returned "
                    + (rawVectors == null ? 0 : rawVectors.size()) + " vectors for " + texts.size() + " inputs");
        }
        List<float[]> normalized = new ArrayList<>(rawVectors.size());
        for (int index = 0; index < rawVectors.size(); index++) {
            normalized.add(normalize(fitDimensions(rawVectors.get(index), index)));
        }
        return List.copyOf(normalized);
    }

    /**
     * Closes the wrapped provider client when it holds resources. Later calls are rejected.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (delegate instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception closeFailure) {
                log.warn("[EMBEDDING] Failed to close embedding provider client: {}", closeFailure.getMessage());
            }
        }
    }

    private float[] fitDimensions(float[] rawVector, int inputIndex) {
        if (rawVector == null || rawVector.length == 0) {
            throw new EmbeddingServiceUnavailableException("Embedding provider returned an empty vector for input "
                    + inputIndex);
        }
        if (rawVector.length > dimensions) {
            return Arrays.copyOf(rawVector, dimensions);
        }
        if (rawVector.length < dimensions && dimensionMismatchPolicy == DimensionMismatchPolicy.REJECT) {
            throw new EmbeddingServiceUnavailableException("Embedding dimension mismatch: expected "
                    + dimensions + " but received " + rawVector.length + " for input " + inputIndex);
        }
        return rawVector.clone();
    }

    private static float[] normalize(float[] vector) {
        double sumOfSquares = 0.0d;
        for (float component : vector) {
            sumOfSquares += (double) component * component;
        }
        double norm = Math.sqrt(sumOfSquares);
        if (norm == 0.0d) {
            return vector;
        }
        for (int index = 0; index < vector.length; index++) {
            vector[index] = (float) (vector[index] / norm);
        }
        return vector;
    }
}

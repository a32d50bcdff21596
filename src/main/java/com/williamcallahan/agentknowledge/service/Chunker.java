package com.williamcallahan.agentknowledge.service;

import com.williamcallahan.agentknowledge.config.AppProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Splits text into overlapping fixed-size character windows.
 *
 * <p>Whitespace runs collapse to a single space before splitting. Consecutive windows start
 * {@code chunkSize - overlap} characters apart, and the window that reaches the end of the text is
 * the last one. A window never ends between the two halves of a surrogate pair.</p>
 */
@Component
public class Chunker {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private final int chunkSize;
    private final int overlap;

    /**
     * Creates a chunker from the configured window settings.
     */
    @Autowired
    public Chunker(AppProperties appProperties) {
        this(
                Objects.requireNonNull(appProperties, "appProperties").getChunking().getChunkSize(),
                appProperties.getChunking().getOverlap());
    }

    /**
     * Creates a chunker with explicit window settings.
     *
     * @throws IllegalArgumentException unless {@code chunkSize > 0} and {@code 0 <= overlap < chunkSize}
     */
    public Chunker(int chunkSize, int overlap) {
        validateWindow(chunkSize, overlap);
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    /**
     * Chunks text with the configured window settings.
     */
    public List<String> chunk(String text) {
        return split(text, chunkSize, overlap);
    }

    /**
     * Chunks text with explicit window settings.
     *
     * @throws IllegalArgumentException unless {@code chunkSize > 0} and {@code 0 <= overlap < chunkSize}
     */
    public List<String> chunk(String text, int windowSize, int windowOverlap) {
        validateWindow(windowSize, windowOverlap);
        return split(text, windowSize, windowOverlap);
    }

    private static List<String> split(String text, int windowSize, int windowOverlap) {
        if (text == null) {
            return List.of();
        }
        String cleaned = WHITESPACE_RUN.matcher(text).replaceAll(" ").trim();
        int length = cleaned.length();
        List<String> chunks = new ArrayList<>();
        int start = 0;
        while (start < length) {
            int end = Math.min(length, start + windowSize);
            if (end < length && end - 1 > start && Character.isHighSurrogate(cleaned.charAt(end - 1))) {
                end--;
            }
            chunks.add(cleaned.substring(start, end));
            if (end == length) {
                break;
            }
            start = Math.max(start + 1, end - windowOverlap);
        }
        return List.copyOf(chunks);
    }

    private static void validateWindow(int windowSize, int windowOverlap) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be greater than 0 (got " + windowSize + ")");
        }
        if (windowOverlap < 0 || windowOverlap >= windowSize) {
            throw new IllegalArgumentException("Chunk overlap must be between 0 and chunk size - 1 (got overlap "
                    + windowOverlap + ", chunk size " + windowSize + ")");
        }
    }
}

package com.williamcallahan.agentknowledge.service;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.IntArrayList;

/**
 * Caps embedding inputs to what the provider accepts: first by characters, then by cl100k tokens.
 */
public class EmbeddingInputTruncator {

    private final Encoding encoding;
    private final int maxInputChars;
    private final int maxInputTokens;

    public EmbeddingInputTruncator(int maxInputChars, int maxInputTokens) {
        if (maxInputChars <= 0 || maxInputTokens <= 0) {
            throw new IllegalArgumentException("Embedding input limits must be positive");
        }
        EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
        this.encoding = registry.getEncoding(EncodingType.CL100K_BASE);
        this.maxInputChars = maxInputChars;
        this.maxInputTokens = maxInputTokens;
    }

    /**
     * Returns the text cut to the character limit and then to the token limit.
     *
     * @param text input text, may be null
     * @return truncated text; empty for null input
     */
    public String truncate(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String charCapped = text.length() > maxInputChars ? text.substring(0, maxInputChars) : text;
        IntArrayList tokens = encoding.encode(charCapped);
        if (tokens.size() <= maxInputTokens) {
            return charCapped;
        }
        int keep = maxInputTokens;
        String candidate = decodePrefix(tokens, keep, charCapped);
        while (keep > 0 && encoding.countTokens(candidate) > maxInputTokens) {
            keep--;
            candidate = decodePrefix(tokens, keep, charCapped);
        }
        return candidate;
    }

    // a token window may end inside a multi-byte character; drop the partial character
    private String decodePrefix(IntArrayList tokens, int keep, String source) {
        IntArrayList window = new IntArrayList();
        for (int i = 0; i < keep; i++) {
            window.add(tokens.get(i));
        }
        String decoded = encoding.decode(window);
        while (!decoded.isEmpty() && !source.startsWith(decoded)) {
            decoded = decoded.substring(0, decoded.length() - 1);
        }
        return decoded;
    }
}

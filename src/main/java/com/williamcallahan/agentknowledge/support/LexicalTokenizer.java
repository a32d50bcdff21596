package com.williamcallahan.agentknowledge.support;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.util.StringHelper;

/**
 * Splits free text into lowercase lexical tokens with Lucene's standard analyzer.
 *
 * <p>English stop words are dropped so that ranking is driven by content terms, roughly matching
 * what PostgreSQL's {@code english} text search configuration keeps.</p>
 */
public final class LexicalTokenizer {

    private static final String TOKEN_STREAM_FIELD = "text";
    private static final int MIN_TOKEN_LENGTH = 2;
    private static final CharArraySet ENGLISH_STOP_WORDS = CharArraySet.unmodifiableSet(new CharArraySet(
            List.of("a", "an", "and", "are", "as", "at", "be", "but", "by", "for", "if", "in", "into", "is",
                    "it", "no", "not", "of", "on", "or", "such", "that", "the", "their", "then", "there",
                    "these", "they", "this", "to", "was", "will", "with"),
            true));

    private LexicalTokenizer() {}

    /**
     * Tokenizes text in reading order. Repeated terms are kept.
     *
     * @param text text to tokenize, may be null
     * @return lowercase tokens; empty when the text has no usable terms
     */
    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        try (StandardAnalyzer standardAnalyzer = new StandardAnalyzer(ENGLISH_STOP_WORDS);
                TokenStream tokenStream = standardAnalyzer.tokenStream(TOKEN_STREAM_FIELD, text)) {
            CharTermAttribute termAttribute = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken()) {
                String lexicalToken = termAttribute.toString();
                if (lexicalToken.length() >= MIN_TOKEN_LENGTH) {
                    tokens.add(lexicalToken);
                }
            }
            tokenStream.end();
        } catch (IOException ioException) {
            throw new UncheckedIOException("Failed to tokenize text", ioException);
        }
        return List.copyOf(tokens);
    }

    /**
     * Murmur3 32-bit hash for stable token feature hashing.
     */
    public static int murmurHash32(String token) {
        byte[] tokenBytes = token.getBytes(StandardCharsets.UTF_8);
        return StringHelper.murmurhash3_x86_32(tokenBytes, 0, tokenBytes.length, 0);
    }
}

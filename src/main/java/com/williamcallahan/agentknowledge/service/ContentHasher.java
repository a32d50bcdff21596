package com.williamcallahan.agentknowledge.service;

import com.williamcallahan.agentknowledge.domain.EntryKind;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Computes the content fingerprint that identifies an entry for deduplication.
 */
@Component
public class ContentHasher {

    /**
     * Generates SHA-256 hash for any text content.
     *
     * @param text the text to hash
     * @return 64 lowercase hexadecimal characters
     */
    public String sha256(String text) {
        Objects.requireNonNull(text, "text");
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Fingerprints an entry over its canonical fields.
     *
     * <p>Fields must already be redacted. Each field is written as {@code <length>:<value>} so that
     * blank lines inside free text cannot shift a boundary; absent fields hash like empty ones.</p>
     *
     * @return fingerprint of {@code kind, title, body, code, stackTrace, reproSteps, resolution}
     */
    public String fingerprint(
            EntryKind kind,
            String title,
            String body,
            String code,
            String stackTrace,
            String reproSteps,
            String resolution) {
        Objects.requireNonNull(kind, "kind");
        StringBuilder canonical = new StringBuilder();
        for (String field : new String[] {kind.wireName(), title, body, code, stackTrace, reproSteps, resolution}) {
            appendField(canonical, field);
        }
        return sha256(canonical.toString());
    }

    private static void appendField(StringBuilder canonical, String value) {
        String field = value == null ? "" : value;
        canonical.append(field.length()).append(':').append(field);
    }
}

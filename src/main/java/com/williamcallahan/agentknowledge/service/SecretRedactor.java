package com.williamcallahan.agentknowledge.service;

import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Replaces secret-shaped substrings with fixed category markers.
 *
 * <p>Patterns run in order, so a JWT that also contains an email-like fragment is reported as a JWT.
 * Redaction is lossy: inputs differing only in a secret value produce identical output.</p>
 */
@Component
public class SecretRedactor {

    static final String SECRET_MARKER = "[REDACTED_SECRET]";
    static final String JWT_MARKER = "[REDACTED_JWT]";
    static final String EMAIL_MARKER = "[REDACTED_EMAIL]";
    static final String IP_MARKER = "[REDACTED_IP]";

    private static final List<Redaction> REDACTIONS = List.of(
            new Redaction(Pattern.compile("sk-[A-Za-z0-9]{20,}"), SECRET_MARKER),
            new Redaction(Pattern.compile("ghp_[A-Za-z0-9]{20,}"), SECRET_MARKER),
            new Redaction(
                    Pattern.compile("eyJ[A-Za-z0-9_\\-]{10,}\\.[A-Za-z0-9_\\-]{10,}\\.[A-Za-z0-9_\\-]{10,}"),
                    JWT_MARKER),
            new Redaction(Pattern.compile("[\\w.-]+@[\\w.-]+\\.[A-Za-z]{2,}"), EMAIL_MARKER),
            new Redaction(Pattern.compile("\\b\\d{1,3}(?:\\.\\d{1,3}){3}\\b"), IP_MARKER));

    /**
     * Redacts known secret shapes.
     *
     * @param text input text, may be null
     * @return redacted text; empty string for null input
     */
    public String redact(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String redacted = text;
        for (Redaction redaction : REDACTIONS) {
            redacted = redaction.pattern().matcher(redacted).replaceAll(redaction.replacement());
        }
        return redacted;
    }

    private record Redaction(Pattern pattern, String replacement) {}
}

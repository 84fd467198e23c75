package com.expertagent.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts sensitive entries from attribute maps before they are written to logs.
 * <p>
 * Default sensitive patterns cover credentials and personal data that show up in principal
 * attributes: password, token, secret, authorization, apiKey, credential, email, ipAddress.
 * Matching is case-insensitive and by substring, so {@code accessToken} and {@code userEmail}
 * are both redacted. Nested maps are redacted recursively.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "token", "secret", "authorization", "apikey", "credential",
            "email", "ipaddress"
    );

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    /**
     * Creates a redactor with the default sensitive field patterns.
     */
    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * Creates a redactor with custom sensitive field patterns (case-insensitive).
     *
     * @param patterns field name patterns to treat as sensitive
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a new map with sensitive values replaced by {@value #REDACTED}.
     * Null input returns an empty map.
     *
     * @param data the attribute map (keys are field names, values are arbitrary)
     * @return a new map with sensitive values redacted
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }

        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (isSensitive(key)) {
                result.put(key, REDACTED);
            } else if (value instanceof Map<?, ?> nested) {
                result.put(key, redactNested(nested));
            } else {
                result.put(key, value);
            }
        }
        return result;
    }

    /**
     * Checks whether a field name matches any sensitive pattern (case-insensitive).
     */
    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }

    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }

    private Map<String, Object> redactNested(Map<?, ?> nested) {
        Map<String, Object> asStrings = new LinkedHashMap<>(nested.size());
        nested.forEach((k, v) -> asStrings.put(String.valueOf(k), v));
        return redact(asStrings);
    }
}

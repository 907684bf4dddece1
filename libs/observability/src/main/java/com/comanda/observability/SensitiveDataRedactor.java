package com.comanda.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks customer personal data before it reaches a log line.
 *
 * <p>Field names are matched case-insensitively against the sensitive patterns (phone, email,
 * address, card number by default). Matching values keep only their last four characters.
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS =
            Set.of("phone", "email", "address", "cardnumber", "card_number");

    private static final int VISIBLE_SUFFIX = 4;

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    public SensitiveDataRedactor(Set<String> patterns) {
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream().map(Pattern::quote).toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a copy of {@code data} with the values of sensitive fields masked. Null input returns
     * an empty map; null values stay null.
     */
    public Map<String, Object> redact(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            Object value = entry.getValue();
            if (value != null && isSensitive(entry.getKey())) {
                result.put(entry.getKey(), mask(value.toString()));
            } else {
                result.put(entry.getKey(), value);
            }
        }
        return result;
    }

    /** "+1 555 010 4567" becomes "***4567"; values of four characters or fewer are fully hidden. */
    public String mask(String value) {
        if (value == null) {
            return null;
        }
        if (value.length() <= VISIBLE_SUFFIX) {
            return REDACTED;
        }
        return "***" + value.substring(value.length() - VISIBLE_SUFFIX);
    }

    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }

    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }
}

package com.beacon.observability;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides which payload keys hold data that must not leave the device or reach a log: credentials
 * by default, plus any keys the application adds (e.g. "ssn", "phone").
 * <p>
 * A key is sensitive when it contains one of the patterns, case-insensitively, so "userPassword"
 * and "X-Api-Key" both match.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    /** Default set of field name patterns considered sensitive. */
    public static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "token", "secret", "authorization", "apikey", "api-key", "credential"
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
     * @param patterns field name patterns to treat as sensitive; must not be empty
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
     * Checks whether a field name matches any sensitive pattern (case-insensitive).
     *
     * @param fieldName the field name to check
     * @return true if the field name contains a sensitive pattern
     */
    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }

    /**
     * Returns the set of sensitive patterns this redactor uses.
     */
    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }
}

package com.switchboard.observability;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Redacts credential-bearing query parameters from request URIs before they are logged.
 * <p>
 * Connection URIs carry the terminal's signature in the query string. The signature is
 * replayable for as long as the key pair is valid, so it never reaches a log line
 * verbatim. Matching of parameter names is case-insensitive.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PARAMETERS = Set.of(
            "signature", "private_key", "token", "secret", "password"
    );

    private final Set<String> sensitiveParameters;
    private final Pattern queryPattern;

    /**
     * Creates a redactor with the default sensitive parameter names.
     */
    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PARAMETERS);
    }

    /**
     * @param parameters query parameter names to treat as sensitive
     */
    public SensitiveDataRedactor(Set<String> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            throw new IllegalArgumentException("parameters must not be null or empty");
        }
        this.sensitiveParameters = Set.copyOf(parameters);
        String names = String.join("|", sensitiveParameters.stream()
                .map(Pattern::quote)
                .toList());
        // name=value pairs delimited by ? or & on the left and & or # (or end) on the right
        this.queryPattern = Pattern.compile("([?&](?:" + names + ")=)[^&#]*", Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns {@code uri} with the values of sensitive query parameters replaced by
     * {@value #REDACTED}. Null input returns an empty string.
     */
    public String redactUri(String uri) {
        if (uri == null) {
            return "";
        }
        Matcher matcher = queryPattern.matcher(uri);
        return matcher.replaceAll(result -> Matcher.quoteReplacement(result.group(1) + REDACTED));
    }

    /**
     * Whether a query parameter name is considered sensitive.
     */
    public boolean isSensitive(String parameterName) {
        if (parameterName == null) {
            return false;
        }
        return sensitiveParameters.stream().anyMatch(p -> p.equalsIgnoreCase(parameterName));
    }

    public Set<String> sensitiveParameters() {
        return sensitiveParameters;
    }
}

package com.skyfare.common.util;

import org.apache.commons.lang3.StringUtils;

import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Masks credentials and bearer tokens in log lines and error messages.
 */
public final class SensitiveDataFilter {

    private SensitiveDataFilter() {
        // utility
    }

    private static final String MASKED_VALUE = "***";
    private static final int TOKEN_PREVIEW_LENGTH = 8;

    private static final Set<String> SENSITIVE_KEYS = Set.of(
            "secret",
            "token",
            "apikey", "api-key", "api_key",
            "authorization",
            "client_id", "clientid", "client-id",
            "client_secret", "clientsecret", "client-secret",
            "access_token", "accesstoken", "access-token",
            "amadeus_api_key", "amadeus_api_secret"
    );

    // longest first so "access_token" wins over "token"
    private static final String KEYS = SENSITIVE_KEYS.stream()
            .sorted((a, b) -> Integer.compare(b.length(), a.length()))
            .map(Pattern::quote)
            .reduce((a, b) -> a + "|" + b)
            .orElseThrow();

    /**
     * Groups: 1 key (may be quoted), 2 separator, 3 opening quote, 4 value, 5 closing quote.
     * The value ends at a delimiter, at the end of input, or right before the next sensitive key.
     */
    private static final Pattern SENSITIVE_PATTERN = Pattern.compile(
            "(?i)" +
                    "(\"?(?:" + KEYS + ")\"?)" +
                    "\\s*([:=])\\s*" +
                    "(\"?)" +
                    "(.*?)" +
                    "(\"?)" +
                    "(?=" +
                    "\\s+(?:\"?(?:" + KEYS + ")\"?)\\s*[:=]" +
                    "|[,;&}\"]" +
                    "|$" +
                    ")"
    );

    private static final Pattern BEARER_PATTERN = Pattern.compile("(?i)(Bearer\\s+)[A-Za-z0-9._~+/=-]+");

    public static String maskSensitiveData(String message) {
        if (StringUtils.isBlank(message)) {
            return message;
        }

        String masked = BEARER_PATTERN.matcher(message).replaceAll("$1" + MASKED_VALUE);

        var matcher = SENSITIVE_PATTERN.matcher(masked);
        if (!matcher.find()) {
            return masked;
        }

        return matcher.replaceAll(SensitiveDataFilter::replacement);
    }

    public static boolean containsSensitiveData(String message) {
        if (StringUtils.isBlank(message)) {
            return false;
        }
        return SENSITIVE_PATTERN.matcher(message).find() || BEARER_PATTERN.matcher(message).find();
    }

    /**
     * Short, log-safe preview of a token: the first characters followed by an ellipsis.
     */
    public static String previewToken(String token) {
        if (StringUtils.isBlank(token)) {
            return MASKED_VALUE;
        }
        if (token.length() <= TOKEN_PREVIEW_LENGTH) {
            return MASKED_VALUE;
        }
        return token.substring(0, TOKEN_PREVIEW_LENGTH) + "...";
    }

    private static String replacement(MatchResult m) {
        String key = m.group(1);
        String sep = m.group(2);

        boolean keyQuoted = key.startsWith("\"") && key.endsWith("\"");
        return key + sep + (keyQuoted ? "\"" + MASKED_VALUE + "\"" : MASKED_VALUE);
    }
}

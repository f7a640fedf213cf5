package org.example.verse.config;

import jakarta.servlet.http.HttpServletRequest;

import java.util.UUID;

/**
 * Request id carried in the {@code X-Request-Id} header, the request attributes and the
 * {@code requestId} MDC key used by the log pattern.
 */
public final class RequestCorrelation {

    public static final String HEADER_NAME = "X-Request-Id";
    public static final String ATTRIBUTE_NAME = "requestId";
    public static final String MDC_KEY = "requestId";
    public static final String UNKNOWN = "unknown";

    static final int MAX_LENGTH = 64;

    private RequestCorrelation() {
    }

    /**
     * Returns the id assigned by {@link RequestCorrelationFilter}, or {@link #UNKNOWN}
     * outside a filtered request.
     */
    public static String resolveRequestId(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }
        return request.getAttribute(ATTRIBUTE_NAME) instanceof String id && !id.isBlank() ? id : UNKNOWN;
    }

    static String newRequestId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Keeps a caller-supplied id only if it is safe to echo into a header and a log line:
     * letters, digits and {@code . _ : -}, at most {@value #MAX_LENGTH} characters.
     *
     * @return the trimmed id, or {@code null} when absent or unusable
     */
    static String acceptIncoming(String header) {
        if (header == null) {
            return null;
        }
        String candidate = header.trim();
        if (candidate.isEmpty() || candidate.length() > MAX_LENGTH) {
            return null;
        }
        for (int i = 0; i < candidate.length(); i++) {
            char c = candidate.charAt(i);
            boolean allowed = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '.' || c == '_' || c == ':' || c == '-';
            if (!allowed) {
                return null;
            }
        }
        return candidate;
    }
}

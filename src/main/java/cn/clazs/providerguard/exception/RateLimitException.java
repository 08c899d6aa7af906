package cn.clazs.providerguard.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when an inbound request is rejected by the request throttler
 *
 * <p>Carries everything the 429 response needs: the denial reason as message, the
 * rate-limit headers and the Retry-After value.
 *
 * <p>Usage:
 * <pre>
 * try {
 *     // business code
 * } catch (RateLimitException e) {
 *     log.warn("Throttled: {}", e.getMessage());
 *     return "Too many requests, please retry later";
 * }
 * </pre>
 *
 * @author clazs
 * @since 1.0.0
 */
public class RateLimitException extends RuntimeException {

    /**
     * Throttled key (client IP)
     */
    @Getter
    private final String limitKey;

    /**
     * X-RateLimit-* headers to send with the rejection
     */
    @Getter
    private final Map<String, String> headers;

    /**
     * Seconds until the denying budget resets, 0 when unknown
     */
    @Getter
    private final long retryAfterSeconds;

    /**
     * @param limitKey throttled key
     * @param message  denial reason
     */
    public RateLimitException(String limitKey, String message) {
        this(limitKey, message, Collections.emptyMap(), 0L);
    }

    /**
     * @param limitKey          throttled key
     * @param message           denial reason, e.g. "IP rate limit exceeded"
     * @param headers           rate-limit headers
     * @param retryAfterSeconds seconds until retry makes sense
     */
    public RateLimitException(String limitKey, String message, Map<String, String> headers, long retryAfterSeconds) {
        super(message);
        this.limitKey = limitKey;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.retryAfterSeconds = retryAfterSeconds;
    }

    @Override
    public String toString() {
        return String.format("RateLimitException{limitKey='%s', message='%s', retryAfter=%ds}",
                limitKey, getMessage(), retryAfterSeconds);
    }
}

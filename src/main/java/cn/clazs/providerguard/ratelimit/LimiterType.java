package cn.clazs.providerguard.ratelimit;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * The budgets a {@link RequestThrottler} checks, in evaluation order
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@AllArgsConstructor
public enum LimiterType {

    /**
     * One budget shared by every request
     */
    GLOBAL("Global", "X-RateLimit-Global"),

    /**
     * Per client IP
     */
    IP("IP", "X-RateLimit-IP"),

    /**
     * Per API credential, only when a key is supplied
     */
    API_KEY("API key", "X-RateLimit-APIKey");

    private final String label;
    private final String headerPrefix;

    /**
     * @return human readable denial reason, e.g. "IP rate limit exceeded"
     */
    public String getExceededReason() {
        return label + " rate limit exceeded";
    }
}

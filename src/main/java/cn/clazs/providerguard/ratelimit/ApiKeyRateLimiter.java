package cn.clazs.providerguard.ratelimit;

import java.time.Clock;
import java.time.Duration;

/**
 * Rate limiter keyed by API credential, with its own counter table and limit
 *
 * @author clazs
 * @since 1.0.0
 */
public class ApiKeyRateLimiter extends FixedWindowRateLimiter {

    /**
     * @param requestsPerMinute requests allowed per API key per minute
     */
    public ApiKeyRateLimiter(int requestsPerMinute) {
        super(Duration.ofMinutes(1), requestsPerMinute);
    }

    public ApiKeyRateLimiter(Duration window, int limit, Clock clock) {
        super(window, limit, clock);
    }

    public ApiKeyRateLimiter(Duration window, int limit, Clock clock, long maxTrackedKeys) {
        super(window, limit, clock, maxTrackedKeys);
    }

    public boolean allowApiKey(String apiKey) {
        return allow(apiKey);
    }
}

package cn.clazs.providerguard.ratelimit;

import java.time.Clock;
import java.time.Duration;

/**
 * Rate limiter keyed by client IP, with its own counter table and limit
 *
 * @author clazs
 * @since 1.0.0
 */
public class IpRateLimiter extends FixedWindowRateLimiter {

    /**
     * @param requestsPerMinute requests allowed per IP per minute
     */
    public IpRateLimiter(int requestsPerMinute) {
        super(Duration.ofMinutes(1), requestsPerMinute);
    }

    public IpRateLimiter(Duration window, int limit, Clock clock) {
        super(window, limit, clock);
    }

    public IpRateLimiter(Duration window, int limit, Clock clock, long maxTrackedKeys) {
        super(window, limit, clock, maxTrackedKeys);
    }

    public boolean allowIp(String ip) {
        return allow(ip);
    }
}

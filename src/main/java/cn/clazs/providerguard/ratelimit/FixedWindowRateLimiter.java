package cn.clazs.providerguard.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed window rate limiter
 *
 * <p>Each identifier gets a counter and a window start. The first request after the window
 * has elapsed starts a new window at the current instant with the counter reset.
 * <ul>
 *   <li>Storage: Caffeine cache of identifier to counter; idle identifiers are evicted so
 *       that a flood of distinct keys cannot exhaust memory</li>
 *   <li>Concurrency: one {@link ReentrantLock} per counter, so identifiers never contend with each other</li>
 *   <li>Time: all window arithmetic uses the injected {@link Clock}</li>
 * </ul>
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class FixedWindowRateLimiter implements RateLimiter {

    public static final long DEFAULT_MAX_TRACKED_KEYS = 100_000L;

    /**
     * Lower bound for idle eviction, matches the periodic cleanup of the counter table
     */
    private static final Duration MIN_IDLE_EXPIRY = Duration.ofMinutes(5);

    private static class WindowCounter {
        /** requests counted in the current window, capped at limit + 1 */
        int count;

        /** start of the current window, null before the first request */
        Instant windowStart;

        final ReentrantLock lock = new ReentrantLock();
    }

    private final Cache<String, WindowCounter> counters;

    private final Duration window;

    private final int limit;

    private final Clock clock;

    public FixedWindowRateLimiter(Duration window, int limit) {
        this(window, limit, Clock.systemUTC());
    }

    public FixedWindowRateLimiter(Duration window, int limit, Clock clock) {
        this(window, limit, clock, DEFAULT_MAX_TRACKED_KEYS);
    }

    /**
     * @param window         counting window, must be positive
     * @param limit          requests allowed per identifier per window, must be &gt; 0
     * @param clock          time source
     * @param maxTrackedKeys upper bound of identifiers kept in memory
     */
    public FixedWindowRateLimiter(Duration window, int limit, Clock clock, long maxTrackedKeys) {
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive, got: " + window);
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got: " + limit);
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (maxTrackedKeys <= 0) {
            throw new IllegalArgumentException("maxTrackedKeys must be > 0, got: " + maxTrackedKeys);
        }
        this.window = window;
        this.limit = limit;
        this.clock = clock;

        Duration idleExpiry = window.compareTo(MIN_IDLE_EXPIRY) > 0 ? window : MIN_IDLE_EXPIRY;
        this.counters = Caffeine.newBuilder()
                .expireAfterAccess(idleExpiry)
                .maximumSize(maxTrackedKeys)
                .build();
    }

    @Override
    public boolean allow(String id) {
        validateId(id);

        WindowCounter counter = counters.get(id, k -> new WindowCounter());
        counter.lock.lock();
        try {
            Instant now = clock.instant();
            if (isExpired(counter, now)) {
                counter.windowStart = now;
                counter.count = 0;
            }

            if (counter.count <= limit) {
                counter.count++;
            }
            boolean allowed = counter.count <= limit;

            if (!allowed && log.isDebugEnabled()) {
                log.debug("Rate limit reached: id={}, limit={}, window={}", id, limit, window);
            }
            return allowed;
        } finally {
            counter.lock.unlock();
        }
    }

    @Override
    public int getRemainingRequests(String id) {
        validateId(id);

        WindowCounter counter = counters.getIfPresent(id);
        if (counter == null) {
            return limit;
        }
        counter.lock.lock();
        try {
            if (isExpired(counter, clock.instant())) {
                return limit;
            }
            return Math.max(0, limit - counter.count);
        } finally {
            counter.lock.unlock();
        }
    }

    @Override
    public Instant getResetTime(String id) {
        validateId(id);

        Instant now = clock.instant();
        WindowCounter counter = counters.getIfPresent(id);
        if (counter == null) {
            return now.plus(window);
        }
        counter.lock.lock();
        try {
            if (isExpired(counter, now)) {
                return now.plus(window);
            }
            return counter.windowStart.plus(window);
        } finally {
            counter.lock.unlock();
        }
    }

    @Override
    public Duration getTimeUntilReset(String id) {
        Duration remaining = Duration.between(clock.instant(), getResetTime(id));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    @Override
    public int getLimit() {
        return limit;
    }

    @Override
    public Duration getWindow() {
        return window;
    }

    @Override
    public void reset(String id) {
        if (id != null) {
            counters.invalidate(id);
        }
    }

    @Override
    public long getTrackedCount() {
        return counters.estimatedSize();
    }

    private boolean isExpired(WindowCounter counter, Instant now) {
        return counter.windowStart == null
                || Duration.between(counter.windowStart, now).compareTo(window) >= 0;
    }

    private static void validateId(String id) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Rate limit identifier cannot be empty");
        }
    }

    @Override
    public String toString() {
        return String.format("%s{limit=%d, window=%s}", getClass().getSimpleName(), limit, window);
    }
}

package cn.clazs.providerguard.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Request counter keyed by an arbitrary identifier
 *
 * <p>Every identifier has its own budget; exhausting one never affects another.
 * Implementations must be thread safe.
 *
 * @author clazs
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * Count one request for the identifier and decide whether it is admitted
     *
     * @param id identifier (client IP, API key, shared global key...)
     * @return true-admitted, false-budget exhausted for the current window
     */
    boolean allow(String id);

    /**
     * Requests left in the identifier's current window, never negative
     *
     * @param id identifier
     * @return remaining budget, {@link #getLimit()} for an identifier never seen
     */
    int getRemainingRequests(String id);

    /**
     * Instant the identifier's current window ends
     *
     * @param id identifier
     * @return window end, {@code now + window} for an identifier never seen
     */
    Instant getResetTime(String id);

    /**
     * Time left until {@link #getResetTime(String)}, never negative
     */
    Duration getTimeUntilReset(String id);

    /**
     * @return maximum requests per identifier per window
     */
    int getLimit();

    /**
     * @return length of the counting window
     */
    Duration getWindow();

    /**
     * Forget the identifier's counter
     *
     * @param id identifier
     */
    void reset(String id);

    /**
     * @return number of identifiers currently tracked (estimate)
     */
    long getTrackedCount();
}

package cn.clazs.providerguard.circuit;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-provider circuit breaker
 *
 * <p>Wraps outbound calls to one provider and stops calling it for a cooldown period once it
 * keeps failing:
 * <ul>
 *     <li>CLOSED: calls pass through; {@code threshold} consecutive failures trip the breaker to OPEN</li>
 *     <li>OPEN: calls are rejected with {@link CircuitOpenException} without running the action,
 *         until {@code timeout} has elapsed since the last failure</li>
 *     <li>HALF_OPEN: exactly one trial call runs; success closes the breaker, failure re-opens it</li>
 * </ul>
 *
 * <p>The read-decide-mutate sequence runs under a {@link ReentrantLock}, the action itself runs
 * outside it. The breaker never retries; retries are the caller's business.
 *
 * <p>Usage:
 * <pre>
 * CircuitBreaker breaker = new CircuitBreaker("openai", 3, Duration.ofSeconds(30), Clock.systemUTC());
 * String body = breaker.call(() -&gt; client.complete(request));
 * </pre>
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class CircuitBreaker {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;

    public static final Duration DEFAULT_OPEN_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Void action for {@link #run(CheckedRunnable)}
     */
    @FunctionalInterface
    public interface CheckedRunnable {
        void run() throws Exception;
    }

    /**
     * Breaker name (provider id or resource name)
     */
    @Getter
    private final String name;

    /**
     * Consecutive failures that trip CLOSED to OPEN
     */
    @Getter
    private final int threshold;

    /**
     * How long an OPEN breaker waits before allowing a trial call
     */
    @Getter
    private final Duration timeout;

    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();

    private CircuitState state = CircuitState.CLOSED;

    private int failureCount;

    private Instant lastFailureTime;

    /** true while the single HALF_OPEN trial is running */
    private boolean trialInFlight;

    public CircuitBreaker(String name) {
        this(name, DEFAULT_FAILURE_THRESHOLD, DEFAULT_OPEN_TIMEOUT, Clock.systemUTC());
    }

    /**
     * @param name      breaker name
     * @param threshold consecutive failures before tripping, must be &gt; 0
     * @param timeout   cooldown before a trial call, must be positive
     * @param clock     time source
     */
    public CircuitBreaker(String name, int threshold, Duration timeout, Clock clock) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Circuit breaker name cannot be empty");
        }
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.name = name;
        this.threshold = threshold;
        this.timeout = timeout;
        this.clock = clock;
    }

    /**
     * Run the action if the breaker currently admits calls and record the outcome
     *
     * <p>Anything the action throws is rethrown unchanged and counts as a failure; a normal
     * return counts as a success.
     *
     * @param action the protected call
     * @return the action's result
     * @throws CircuitOpenException if the breaker rejected the call without running it
     * @throws Exception            whatever the action threw
     */
    public <T> T call(Callable<T> action) throws Exception {
        Objects.requireNonNull(action, "action cannot be null");

        boolean trial = acquirePermission();
        T result;
        try {
            result = action.call();
        } catch (Exception | Error e) {
            onCallFailure(trial);
            throw e;
        }
        onCallSuccess(trial);
        return result;
    }

    /**
     * Void variant of {@link #call(Callable)}
     */
    public void run(CheckedRunnable action) throws Exception {
        Objects.requireNonNull(action, "action cannot be null");
        call(() -> {
            action.run();
            return null;
        });
    }

    /**
     * Current state, read only: an OPEN breaker whose timeout has elapsed still reports OPEN
     * until a call moves it to HALF_OPEN
     */
    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether a {@link #call(Callable)} issued right now would run its action. Does not mutate state.
     */
    public boolean isAvailable() {
        lock.lock();
        try {
            return isAvailableLocked(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    public int getFailureCount() {
        lock.lock();
        try {
            return failureCount;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return instant of the most recent failure, null if none was recorded since creation or reset
     */
    public Instant getLastFailureTime() {
        lock.lock();
        try {
            return lastFailureTime;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Force the breaker back to CLOSED and clear its counters
     */
    public void reset() {
        lock.lock();
        try {
            if (state != CircuitState.CLOSED) {
                transitionTo(CircuitState.CLOSED);
            }
            failureCount = 0;
            lastFailureTime = null;
            trialInFlight = false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record a successful passive health probe
     *
     * <ul>
     *     <li>CLOSED: clears the failure count</li>
     *     <li>OPEN: moves to HALF_OPEN at once; a trial call or the next probe must confirm recovery.
     *         A trial call still running from before the breaker re-opened stays the only trial</li>
     *     <li>HALF_OPEN: closes the breaker unless a trial call is in flight, which then decides</li>
     * </ul>
     */
    public void recordProbeSuccess() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    failureCount = 0;
                    break;
                case OPEN:
                    // a trial still running from before the re-open keeps its slot
                    transitionTo(CircuitState.HALF_OPEN);
                    break;
                case HALF_OPEN:
                    if (!trialInFlight) {
                        close();
                    }
                    break;
                default:
                    throw new IllegalStateException("Unexpected state: " + state);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record a failed passive health probe. Counts toward the threshold when CLOSED, re-opens a
     * HALF_OPEN breaker and restarts the cooldown of an OPEN one.
     */
    public void recordProbeFailure() {
        lock.lock();
        try {
            Instant now = clock.instant();
            switch (state) {
                case CLOSED:
                    registerClosedFailure(now);
                    break;
                case HALF_OPEN:
                    failureCount++;
                    open(now);
                    break;
                case OPEN:
                    lastFailureTime = now;
                    break;
                default:
                    throw new IllegalStateException("Unexpected state: " + state);
            }
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            return new CircuitBreakerSnapshot(name, state, failureCount, lastFailureTime,
                    isAvailableLocked(clock.instant()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Decide whether a call may proceed, moving OPEN to HALF_OPEN when the cooldown has elapsed
     *
     * @return true if the admitted call is the HALF_OPEN trial
     */
    private boolean acquirePermission() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return false;
                case OPEN:
                    Instant retryAt = lastFailureTime.plus(timeout);
                    if (clock.instant().isBefore(retryAt)) {
                        log.debug("Circuit breaker [{}] rejected call, open until {}", name, retryAt);
                        throw new CircuitOpenException(name, retryAt);
                    }
                    if (trialInFlight) {
                        log.debug("Circuit breaker [{}] rejected call, earlier trial still in flight", name);
                        throw new CircuitOpenException(name, null);
                    }
                    transitionTo(CircuitState.HALF_OPEN);
                    trialInFlight = true;
                    return true;
                case HALF_OPEN:
                    if (trialInFlight) {
                        log.debug("Circuit breaker [{}] rejected call, half-open trial in flight", name);
                        throw new CircuitOpenException(name, null);
                    }
                    trialInFlight = true;
                    return true;
                default:
                    throw new IllegalStateException("Unexpected state: " + state);
            }
        } finally {
            lock.unlock();
        }
    }

    private void onCallSuccess(boolean trial) {
        lock.lock();
        try {
            if (trial) {
                trialInFlight = false;
                if (state == CircuitState.HALF_OPEN) {
                    close();
                }
            } else if (state == CircuitState.CLOSED) {
                failureCount = 0;
            }
            // a non-trial result arriving after the breaker left CLOSED is stale
        } finally {
            lock.unlock();
        }
    }

    private void onCallFailure(boolean trial) {
        lock.lock();
        try {
            Instant now = clock.instant();
            if (trial) {
                trialInFlight = false;
                if (state == CircuitState.HALF_OPEN) {
                    failureCount++;
                    open(now);
                }
            } else if (state == CircuitState.CLOSED) {
                registerClosedFailure(now);
            }
        } finally {
            lock.unlock();
        }
    }

    private void registerClosedFailure(Instant now) {
        failureCount++;
        lastFailureTime = now;
        if (failureCount >= threshold) {
            open(now);
        }
    }

    private boolean isAvailableLocked(Instant now) {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                return !trialInFlight && !now.isBefore(lastFailureTime.plus(timeout));
            case HALF_OPEN:
                return !trialInFlight;
            default:
                return false;
        }
    }

    private void open(Instant now) {
        lastFailureTime = now;
        transitionTo(CircuitState.OPEN);
    }

    private void close() {
        failureCount = 0;
        transitionTo(CircuitState.CLOSED);
    }

    private void transitionTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        if (previous != next) {
            log.info("Circuit breaker [{}] {} -> {} (failures={})", name, previous.getCode(), next.getCode(), failureCount);
        }
    }

    @Override
    public String toString() {
        return String.format("CircuitBreaker{name='%s', threshold=%d, timeout=%s}", name, threshold, timeout);
    }
}

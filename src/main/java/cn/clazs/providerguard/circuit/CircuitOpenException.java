package cn.clazs.providerguard.circuit;

import lombok.Getter;

import java.time.Instant;

/**
 * Thrown when a circuit breaker rejects a call without attempting it
 *
 * <p>Callers can catch it to fall back to another provider or report degraded service:
 * <pre>
 * try {
 *     breaker.call(() -&gt; client.complete(request));
 * } catch (CircuitOpenException e) {
 *     log.warn("provider {} unavailable until {}", e.getBreakerName(), e.getRetryAt());
 *     return fallback(request);
 * }
 * </pre>
 *
 * @author clazs
 * @since 1.0.0
 */
public class CircuitOpenException extends RuntimeException {

    /**
     * Name of the rejecting breaker (usually the provider id)
     */
    @Getter
    private final String breakerName;

    /**
     * Earliest instant a trial call becomes eligible, null while a trial call is in flight
     */
    @Getter
    private final Instant retryAt;

    public CircuitOpenException(String breakerName, Instant retryAt) {
        super("circuit breaker is open: " + breakerName);
        this.breakerName = breakerName;
        this.retryAt = retryAt;
    }

    @Override
    public String toString() {
        return String.format("CircuitOpenException{breakerName='%s', retryAt=%s}", breakerName, retryAt);
    }
}

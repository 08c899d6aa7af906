package cn.clazs.providerguard.circuit;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Point-in-time view of a circuit breaker, used for status reporting
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@ToString
@AllArgsConstructor
public class CircuitBreakerSnapshot {
    private final String name;
    private final CircuitState state;
    private final int failureCount;
    private final Instant lastFailureTime;  // null if the breaker never failed
    private final boolean available;
}

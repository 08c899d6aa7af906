package cn.clazs.providerguard.circuit;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Circuit breaker states
 *
 * <pre>
 *     CLOSED ──(failures >= threshold)──> OPEN
 *        ^                                  │
 *    (success)                        (timeout expires)
 *        │                                  │
 *        └──────── HALF_OPEN <──────────────┘
 *                     │
 *                 (failure) ──────> OPEN
 * </pre>
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@AllArgsConstructor
public enum CircuitState {

    /**
     * Calls pass through, consecutive failures are counted
     */
    CLOSED("closed", "calls pass through"),

    /**
     * Calls are rejected until the open timeout has elapsed
     */
    OPEN("open", "calls rejected"),

    /**
     * A single trial call is allowed to test recovery
     */
    HALF_OPEN("half-open", "single trial call");

    private final String code;
    private final String description;

    /**
     * Look up a state by its code
     *
     * @param code state code, case insensitive
     * @return matching state
     * @throws IllegalArgumentException if the code is unknown
     */
    public static CircuitState fromCode(String code) {
        for (CircuitState state : values()) {
            if (state.code.equalsIgnoreCase(code)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown circuit state code: " + code);
    }
}

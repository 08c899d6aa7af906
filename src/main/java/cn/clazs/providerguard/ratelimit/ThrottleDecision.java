package cn.clazs.providerguard.ratelimit;

import lombok.Getter;

/**
 * Admission decision of {@link RequestThrottler#checkRequest(String, String)}
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
public final class ThrottleDecision {

    private static final ThrottleDecision ALLOWED = new ThrottleDecision(true, "", null);

    private final boolean allowed;

    /**
     * Empty when allowed, otherwise e.g. "IP rate limit exceeded"
     */
    private final String reason;

    /**
     * Limiter that denied the request, null when allowed
     */
    private final LimiterType deniedBy;

    private ThrottleDecision(boolean allowed, String reason, LimiterType deniedBy) {
        this.allowed = allowed;
        this.reason = reason;
        this.deniedBy = deniedBy;
    }

    public static ThrottleDecision allow() {
        return ALLOWED;
    }

    public static ThrottleDecision deny(LimiterType limiterType) {
        return new ThrottleDecision(false, limiterType.getExceededReason(), limiterType);
    }

    @Override
    public String toString() {
        return allowed ? "ThrottleDecision{allowed}" : "ThrottleDecision{denied, reason='" + reason + "'}";
    }
}

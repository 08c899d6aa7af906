package cn.clazs.providerguard.ratelimit;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Inbound admission control combining a global, a per-IP and a per-API-key budget
 *
 * <p>Evaluation order:
 * <ol>
 *     <li>global limiter (single shared key)</li>
 *     <li>IP limiter</li>
 *     <li>API key limiter, skipped when no key was supplied</li>
 * </ol>
 * The first limiter that denies short-circuits the check. Limiters evaluated before the
 * denying one have already counted the request.
 *
 * <p>Usage:
 * <pre>
 * RequestThrottler throttler = new RequestThrottler(60, 100, 1000);
 * ThrottleDecision decision = throttler.checkRequest(clientIp, apiKey);
 * if (!decision.isAllowed()) {
 *     // respond 429 with decision.getReason() and throttler.getRateLimitHeaders(clientIp, apiKey)
 * }
 * </pre>
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
@Getter
public class RequestThrottler {

    /**
     * Key under which the global limiter counts every request
     */
    public static final String GLOBAL_KEY = "global";

    /**
     * Key used when the client IP could not be determined
     */
    public static final String UNKNOWN_IP = "unknown";

    private final RateLimiter globalLimiter;
    private final IpRateLimiter ipLimiter;
    private final ApiKeyRateLimiter apiKeyLimiter;

    /**
     * Throttler with one-minute windows
     *
     * @param ipLimit     requests per IP per minute
     * @param apiKeyLimit requests per API key per minute
     * @param globalLimit requests per minute across all clients
     */
    public RequestThrottler(int ipLimit, int apiKeyLimit, int globalLimit) {
        this(new FixedWindowRateLimiter(Duration.ofMinutes(1), globalLimit),
                new IpRateLimiter(ipLimit),
                new ApiKeyRateLimiter(apiKeyLimit));
    }

    public RequestThrottler(RateLimiter globalLimiter, IpRateLimiter ipLimiter, ApiKeyRateLimiter apiKeyLimiter) {
        this.globalLimiter = Objects.requireNonNull(globalLimiter, "globalLimiter cannot be null");
        this.ipLimiter = Objects.requireNonNull(ipLimiter, "ipLimiter cannot be null");
        this.apiKeyLimiter = Objects.requireNonNull(apiKeyLimiter, "apiKeyLimiter cannot be null");
    }

    /**
     * Decide whether an inbound request is admitted
     *
     * @param ip     client IP, null or blank is counted as {@value #UNKNOWN_IP}
     * @param apiKey API credential, null or blank when the request is anonymous
     * @return decision with the denying limiter's reason
     */
    public ThrottleDecision checkRequest(String ip, String apiKey) {
        if (!globalLimiter.allow(GLOBAL_KEY)) {
            return deny(LimiterType.GLOBAL, ip);
        }

        String ipKey = normalizeIp(ip);
        if (!ipLimiter.allowIp(ipKey)) {
            return deny(LimiterType.IP, ipKey);
        }

        if (hasApiKey(apiKey) && !apiKeyLimiter.allowApiKey(apiKey)) {
            // never log the credential itself
            return deny(LimiterType.API_KEY, ipKey);
        }

        return ThrottleDecision.allow();
    }

    /**
     * Configured limit of every applicable limiter plus what is left of it, keyed by standard
     * header names. API key headers are omitted when no key was supplied. Does not count a request.
     */
    public Map<String, String> getRateLimitHeaders(String ip, String apiKey) {
        Map<String, String> headers = new LinkedHashMap<>();
        String ipKey = normalizeIp(ip);

        putHeaders(headers, LimiterType.GLOBAL, globalLimiter, GLOBAL_KEY);
        putHeaders(headers, LimiterType.IP, ipLimiter, ipKey);
        if (hasApiKey(apiKey)) {
            putHeaders(headers, LimiterType.API_KEY, apiKeyLimiter, apiKey);
        }
        return headers;
    }

    /**
     * Seconds until the limiter that denied the request starts a new window, at least 1
     *
     * @param decision a denial returned by {@link #checkRequest(String, String)}
     * @return seconds to wait, 0 if the decision was an admission
     */
    public long getRetryAfterSeconds(ThrottleDecision decision, String ip, String apiKey) {
        if (decision.isAllowed()) {
            return 0L;
        }
        Duration wait;
        switch (decision.getDeniedBy()) {
            case GLOBAL:
                wait = globalLimiter.getTimeUntilReset(GLOBAL_KEY);
                break;
            case IP:
                wait = ipLimiter.getTimeUntilReset(normalizeIp(ip));
                break;
            case API_KEY:
                wait = apiKeyLimiter.getTimeUntilReset(apiKey);
                break;
            default:
                throw new IllegalStateException("Unexpected limiter: " + decision.getDeniedBy());
        }
        long seconds = (wait.toMillis() + 999L) / 1000L;
        return Math.max(1L, seconds);
    }

    private ThrottleDecision deny(LimiterType limiterType, String ip) {
        log.debug("Request throttled: limiter={}, ip={}", limiterType, ip);
        return ThrottleDecision.deny(limiterType);
    }

    private static void putHeaders(Map<String, String> headers, LimiterType type, RateLimiter limiter, String key) {
        headers.put(type.getHeaderPrefix() + "-Limit", String.valueOf(limiter.getLimit()));
        headers.put(type.getHeaderPrefix() + "-Remaining", String.valueOf(limiter.getRemainingRequests(key)));
    }

    private static String normalizeIp(String ip) {
        return ip == null || ip.trim().isEmpty() ? UNKNOWN_IP : ip.trim();
    }

    private static boolean hasApiKey(String apiKey) {
        return apiKey != null && !apiKey.trim().isEmpty();
    }
}

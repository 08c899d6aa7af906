package cn.clazs.providerguard.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider guard configuration properties
 * Maps the {@code clazs.providerguard} section of application.yml
 *
 * <p>YAML example:
 * <pre>
 * clazs:
 *   providerguard:
 *     enabled: true
 *     circuit-breaker:
 *       failure-threshold: 5
 *       open-timeout: 30000
 *     health:
 *       check-interval: 30000
 *       probe-timeout: 10000
 *       providers:
 *         openai: https://api.openai.com/v1/models
 *         anthropic: https://api.anthropic.com/v1/models
 *     throttle:
 *       window: 60000
 *       global-limit: 1000
 *       ip-limit: 60
 *       api-key-limit: 100
 *       path-patterns: /api/**
 * </pre>
 *
 * <p>All durations are in milliseconds.
 *
 * @author clazs
 * @since 1.0.0
 */
@Data
@ConfigurationProperties(prefix = "clazs.providerguard")
public class ProviderGuardProperties {

    /**
     * Whether the provider guard is enabled
     */
    private boolean enabled = true;

    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();

    private HealthConfig health = new HealthConfig();

    private ThrottleConfig throttle = new ThrottleConfig();

    /**
     * Validate the configuration
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    public void validate() {
        if (circuitBreaker.getFailureThreshold() < 1) {
            throw new IllegalArgumentException("Invalid configuration: circuit-breaker.failure-threshold must be >= 1, current value: "
                    + circuitBreaker.getFailureThreshold());
        }
        requirePositive("circuit-breaker.open-timeout", circuitBreaker.getOpenTimeout());

        requirePositive("health.check-interval", health.getCheckInterval());
        requirePositive("health.probe-timeout", health.getProbeTimeout());
        if (health.getProbeTimeout() > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Invalid configuration: health.probe-timeout is too large, current value: "
                    + health.getProbeTimeout());
        }
        if (health.getStopGracePeriod() < 0) {
            throw new IllegalArgumentException("Invalid configuration: health.stop-grace-period cannot be negative, current value: "
                    + health.getStopGracePeriod());
        }
        requirePositive("health.probe-parallelism", health.getProbeParallelism());
        if (health.getProviders() == null) {
            throw new IllegalArgumentException("Invalid configuration: health.providers cannot be null");
        }

        requirePositive("throttle.window", throttle.getWindow());
        requirePositive("throttle.global-limit", throttle.getGlobalLimit());
        requirePositive("throttle.ip-limit", throttle.getIpLimit());
        requirePositive("throttle.api-key-limit", throttle.getApiKeyLimit());
        requirePositive("throttle.max-tracked-keys", throttle.getMaxTrackedKeys());
        if (throttle.getPathPatterns() == null || throttle.getPathPatterns().isEmpty()) {
            throw new IllegalArgumentException("Invalid configuration: throttle.path-patterns cannot be empty");
        }
        if (throttle.getApiKeyHeader() == null || throttle.getApiKeyHeader().trim().isEmpty()) {
            throw new IllegalArgumentException("Invalid configuration: throttle.api-key-header cannot be empty");
        }
    }

    /**
     * Configuration summary for log output
     */
    public String getSummary() {
        return String.format(
                "ProviderGuardProperties{enabled=%s, failureThreshold=%d, openTimeout=%dms, " +
                        "healthEnabled=%s, checkInterval=%dms, probeTimeout=%dms, providers=%s, " +
                        "throttleEnabled=%s, window=%dms, globalLimit=%d, ipLimit=%d, apiKeyLimit=%d}",
                enabled, circuitBreaker.getFailureThreshold(), circuitBreaker.getOpenTimeout(),
                health.isEnabled(), health.getCheckInterval(), health.getProbeTimeout(),
                health.getProviders() == null ? "[]" : health.getProviders().keySet(),
                throttle.isEnabled(), throttle.getWindow(), throttle.getGlobalLimit(),
                throttle.getIpLimit(), throttle.getApiKeyLimit()
        );
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Invalid configuration: " + name + " must be > 0, current value: " + value);
        }
    }

    /**
     * Circuit breaker settings, shared by every provider's breaker
     */
    @Data
    public static class CircuitBreakerConfig {
        /**
         * Consecutive failures that open the breaker (default: 5)
         */
        private int failureThreshold = 5;

        /**
         * Time an open breaker rejects calls before admitting a trial (default: 30000ms)
         */
        private long openTimeout = 30000L;
    }

    /**
     * Background health checking
     */
    @Data
    public static class HealthConfig {
        /**
         * Whether the HealthChecker bean is created
         */
        private boolean enabled = true;

        /**
         * Start the sweep when the context starts
         */
        private boolean autoStart = true;

        /**
         * Delay between two sweeps (default: 30000ms)
         */
        private long checkInterval = 30000L;

        /**
         * Connect and read timeout of one probe (default: 10000ms)
         */
        private long probeTimeout = 10000L;

        /**
         * Maximum wait for in-flight probes on shutdown (default: 15000ms)
         */
        private long stopGracePeriod = 15000L;

        /**
         * Concurrent probes per sweep (default: 4)
         */
        private int probeParallelism = 4;

        /**
         * Provider id -> health endpoint, registered on startup
         */
        private Map<String, String> providers = new LinkedHashMap<>();
    }

    /**
     * Inbound request throttling
     */
    @Data
    public static class ThrottleConfig {
        /**
         * Whether the throttling interceptor is registered
         */
        private boolean enabled = true;

        /**
         * Window length shared by the three budgets (default: 60000ms)
         */
        private long window = 60000L;

        /**
         * Requests per window across all clients (default: 1000)
         */
        private int globalLimit = 1000;

        /**
         * Requests per window per client IP (default: 60)
         */
        private int ipLimit = 60;

        /**
         * Requests per window per API key (default: 100)
         */
        private int apiKeyLimit = 100;

        /**
         * Max distinct IPs or keys tracked per limiter, least recently used are evicted (default: 100000)
         */
        private long maxTrackedKeys = 100000L;

        /**
         * Paths the interceptor applies to (default: all)
         */
        private List<String> pathPatterns = new ArrayList<>(List.of("/**"));

        /**
         * Header carrying the API key (default: X-API-Key)
         */
        private String apiKeyHeader = "X-API-Key";
    }
}

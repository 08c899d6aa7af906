package cn.clazs.providerguard.health;

import cn.clazs.providerguard.circuit.CircuitBreaker;
import cn.clazs.providerguard.circuit.CircuitBreakerSnapshot;
import cn.clazs.providerguard.properties.ProviderGuardProperties;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Provider health checker
 *
 * <p>Owns one {@link CircuitBreaker} per registered provider and runs a background sweep that
 * probes every provider's HTTP endpoint and feeds the result into its breaker. The sweep lets
 * an OPEN breaker protecting a recovered provider be rediscovered even when no application
 * traffic is probing it.
 *
 * <p>Core behavior:
 * <ul>
 *     <li>Registry: provider id to breaker behind a {@link ReentrantReadWriteLock}; lookups share
 *         the read lock, add/remove take the write lock</li>
 *     <li>Probes: HTTP GET through {@link RestTemplate} with bounded connect/read timeouts, run on
 *         a small pool outside any registry lock; any 2xx is healthy, anything else (non-2xx,
 *         timeout, refused connection, DNS failure, malformed URL) is a failure</li>
 *     <li>Lifecycle: {@link #start()} schedules a sweep every check interval, {@link #stop()}
 *         cancels it and waits a bounded grace period for in-flight probes</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 * HealthChecker checker = new HealthChecker(properties);
 * checker.addProvider("openai", "https://api.openai.com/v1/models");
 * checker.start();
 *
 * CircuitBreaker breaker = checker.getCircuitBreaker("openai");
 * String answer = breaker.call(() -&gt; client.complete(request));
 * </pre>
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class HealthChecker {

    private final ReentrantReadWriteLock registryLock = new ReentrantReadWriteLock();

    /**
     * Provider id -> breaker, insertion ordered
     */
    private final Map<String, CircuitBreaker> circuitBreakers = new LinkedHashMap<>();

    /**
     * Provider id -> endpoint registered with {@link #addProvider(String, String)}
     */
    private final Map<String, String> endpoints = new LinkedHashMap<>();

    private final RestTemplate restTemplate;

    /**
     * Fallback endpoint lookup, may be null
     */
    private final ProviderEndpointResolver endpointResolver;

    private final Clock clock;

    private final int failureThreshold;

    private final Duration openTimeout;

    @Getter
    private final Duration checkInterval;

    private final Duration stopGracePeriod;

    private final int probeParallelism;

    private ScheduledExecutorService scheduler;

    private volatile ExecutorService probePool;

    public HealthChecker(ProviderGuardProperties properties) {
        this(properties,
                createProbeRestTemplate(Duration.ofMillis(properties.getHealth().getProbeTimeout())),
                null,
                Clock.systemUTC());
    }

    /**
     * @param properties       breaker and sweep settings
     * @param restTemplate     client used for probes, its timeouts bound each probe
     * @param endpointResolver fallback lookup for providers registered without an endpoint, may be null
     * @param clock            time source shared with every breaker
     */
    public HealthChecker(ProviderGuardProperties properties,
                         RestTemplate restTemplate,
                         ProviderEndpointResolver endpointResolver,
                         Clock clock) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        if (restTemplate == null) {
            throw new IllegalArgumentException("restTemplate cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        properties.validate();

        ProviderGuardProperties.CircuitBreakerConfig breakerConfig = properties.getCircuitBreaker();
        ProviderGuardProperties.HealthConfig healthConfig = properties.getHealth();

        this.restTemplate = restTemplate;
        this.endpointResolver = endpointResolver;
        this.clock = clock;
        this.failureThreshold = breakerConfig.getFailureThreshold();
        this.openTimeout = Duration.ofMillis(breakerConfig.getOpenTimeout());
        this.checkInterval = Duration.ofMillis(healthConfig.getCheckInterval());
        this.stopGracePeriod = Duration.ofMillis(healthConfig.getStopGracePeriod());
        this.probeParallelism = healthConfig.getProbeParallelism();

        log.info("HealthChecker created: threshold={}, openTimeout={}, checkInterval={}",
                failureThreshold, openTimeout, checkInterval);
    }

    /**
     * RestTemplate whose connect and read timeouts are both {@code probeTimeout}
     */
    public static RestTemplate createProbeRestTemplate(Duration probeTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) probeTimeout.toMillis());
        requestFactory.setReadTimeout((int) probeTimeout.toMillis());
        return new RestTemplate(requestFactory);
    }

    // ==================== Registry ====================

    /**
     * Register a provider, creating its breaker if none exists
     *
     * @param providerId provider identifier
     */
    public void addProvider(String providerId) {
        addProvider(providerId, null);
    }

    /**
     * Register a provider with the endpoint the sweep should probe. For a provider that is
     * already registered the endpoint is updated and the existing breaker kept.
     *
     * @param providerId provider identifier
     * @param endpoint   HTTP(S) health endpoint, null to rely on the {@link ProviderEndpointResolver}
     */
    public void addProvider(String providerId, String endpoint) {
        validateProviderId(providerId);

        registryLock.writeLock().lock();
        try {
            if (!circuitBreakers.containsKey(providerId)) {
                circuitBreakers.put(providerId,
                        new CircuitBreaker(providerId, failureThreshold, openTimeout, clock));
                log.info("Provider registered: id={}, endpoint={}", providerId, endpoint);
            }
            if (endpoint != null && !endpoint.trim().isEmpty()) {
                endpoints.put(providerId, endpoint.trim());
            }
        } finally {
            registryLock.writeLock().unlock();
        }
    }

    /**
     * Unregister a provider and drop its breaker, no-op if absent
     */
    public void removeProvider(String providerId) {
        if (providerId == null) {
            return;
        }
        registryLock.writeLock().lock();
        try {
            endpoints.remove(providerId);
            if (circuitBreakers.remove(providerId) != null) {
                log.info("Provider removed: id={}", providerId);
            }
        } finally {
            registryLock.writeLock().unlock();
        }
    }

    /**
     * @return the provider's breaker, null if the provider is not registered
     */
    public CircuitBreaker getCircuitBreaker(String providerId) {
        if (providerId == null) {
            return null;
        }
        registryLock.readLock().lock();
        try {
            return circuitBreakers.get(providerId);
        } finally {
            registryLock.readLock().unlock();
        }
    }

    /**
     * @return ids of all registered providers whose breaker would currently admit a call
     */
    public List<String> getHealthyProviders() {
        List<String> healthy = new ArrayList<>();
        registryLock.readLock().lock();
        try {
            for (Map.Entry<String, CircuitBreaker> entry : circuitBreakers.entrySet()) {
                if (entry.getValue().isAvailable()) {
                    healthy.add(entry.getKey());
                }
            }
        } finally {
            registryLock.readLock().unlock();
        }
        return healthy;
    }

    /**
     * @return snapshot of every registered provider's breaker
     */
    public Map<String, CircuitBreakerSnapshot> getProviderStatus() {
        Map<String, CircuitBreakerSnapshot> status = new LinkedHashMap<>();
        registryLock.readLock().lock();
        try {
            circuitBreakers.forEach((id, breaker) -> status.put(id, breaker.snapshot()));
        } finally {
            registryLock.readLock().unlock();
        }
        return status;
    }

    public int getProviderCount() {
        registryLock.readLock().lock();
        try {
            return circuitBreakers.size();
        } finally {
            registryLock.readLock().unlock();
        }
    }

    /**
     * Feed an externally observed health signal into the provider's breaker without going
     * through {@link CircuitBreaker#call}. Unknown providers are ignored.
     *
     * @param providerId provider identifier
     * @param healthy    true-probe succeeded, false-probe failed
     */
    public void updateProviderHealth(String providerId, boolean healthy) {
        CircuitBreaker breaker = getCircuitBreaker(providerId);
        if (breaker == null) {
            log.debug("Health update for unregistered provider ignored: id={}", providerId);
            return;
        }
        if (healthy) {
            breaker.recordProbeSuccess();
        } else {
            breaker.recordProbeFailure();
        }
    }

    // ==================== Lifecycle ====================

    /**
     * Start the background sweep. Calling it on a running checker does nothing.
     */
    public synchronized void start() {
        if (scheduler != null) {
            log.debug("HealthChecker already running");
            return;
        }

        CustomizableThreadFactory sweepThreads = new CustomizableThreadFactory("providerguard-health-sweep-");
        sweepThreads.setDaemon(true);
        CustomizableThreadFactory probeThreads = new CustomizableThreadFactory("providerguard-health-probe-");
        probeThreads.setDaemon(true);

        probePool = Executors.newFixedThreadPool(probeParallelism, probeThreads);
        scheduler = Executors.newSingleThreadScheduledExecutor(sweepThreads);
        scheduler.scheduleWithFixedDelay(this::runScheduledSweep,
                checkInterval.toMillis(), checkInterval.toMillis(), TimeUnit.MILLISECONDS);

        log.info("HealthChecker started: checkInterval={}, probeParallelism={}", checkInterval, probeParallelism);
    }

    /**
     * Stop the background sweep and wait up to the grace period for running probes.
     * Safe to call when never started and safe to call twice.
     */
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }

        ScheduledExecutorService stoppingScheduler = scheduler;
        ExecutorService stoppingPool = probePool;
        scheduler = null;
        probePool = null;

        stoppingScheduler.shutdownNow();
        stoppingPool.shutdownNow();

        long deadline = System.nanoTime() + stopGracePeriod.toNanos();
        try {
            boolean terminated = stoppingScheduler.awaitTermination(remainingNanos(deadline), TimeUnit.NANOSECONDS)
                    && stoppingPool.awaitTermination(remainingNanos(deadline), TimeUnit.NANOSECONDS);
            if (terminated) {
                log.info("HealthChecker stopped");
            } else {
                log.warn("HealthChecker stop timed out after {}, probes may still be running", stopGracePeriod);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for HealthChecker to stop");
        }
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    // ==================== Sweep ====================

    private void runScheduledSweep() {
        try {
            performHealthChecks();
        } catch (RuntimeException e) {
            // an escaping exception would cancel the schedule
            log.error("Health check sweep failed", e);
        }
    }

    /**
     * Probe every registered provider once and record the results. Probes run on the probe
     * pool while the checker is running, otherwise on the calling thread.
     */
    void performHealthChecks() {
        List<String> providerIds;
        registryLock.readLock().lock();
        try {
            providerIds = new ArrayList<>(circuitBreakers.keySet());
        } finally {
            registryLock.readLock().unlock();
        }

        if (providerIds.isEmpty()) {
            log.debug("Health check sweep skipped, no providers registered");
            return;
        }
        log.debug("Health check sweep started: providers={}", providerIds.size());

        ExecutorService pool = probePool;
        if (pool == null) {
            providerIds.forEach(this::checkProviderHealth);
            return;
        }

        List<Future<?>> futures = new ArrayList<>(providerIds.size());
        try {
            for (String providerId : providerIds) {
                futures.add(pool.submit(() -> checkProviderHealth(providerId)));
            }
        } catch (RejectedExecutionException e) {
            log.debug("Health check sweep aborted, checker is stopping");
            return;
        }

        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ExecutionException e) {
                log.warn("Health probe task failed", e.getCause());
            }
        }
    }

    /**
     * Probe one provider and feed the result into its breaker. Providers without a
     * resolvable endpoint are skipped.
     */
    void checkProviderHealth(String providerId) {
        String endpoint = resolveEndpoint(providerId);
        if (endpoint == null) {
            log.debug("No health endpoint for provider, skipped: id={}", providerId);
            return;
        }

        boolean healthy = checkProviderEndpoint(endpoint);
        if (!healthy) {
            log.warn("Health probe failed: provider={}, endpoint={}", providerId, endpoint);
        }
        updateProviderHealth(providerId, healthy);
    }

    /**
     * Issue one HTTP GET against the endpoint
     *
     * @param endpoint absolute HTTP(S) URL
     * @return true only for a 2xx response
     */
    boolean checkProviderEndpoint(String endpoint) {
        try {
            Boolean healthy = restTemplate.execute(URI.create(endpoint), HttpMethod.GET, null, response -> {
                int status = response.getRawStatusCode();
                return status >= 200 && status < 300;
            });
            return Boolean.TRUE.equals(healthy);
        } catch (RestClientException | IllegalArgumentException e) {
            log.debug("Health probe error: endpoint={}, error={}", endpoint, e.getMessage());
            return false;
        }
    }

    private String resolveEndpoint(String providerId) {
        registryLock.readLock().lock();
        try {
            String endpoint = endpoints.get(providerId);
            if (endpoint != null) {
                return endpoint;
            }
        } finally {
            registryLock.readLock().unlock();
        }

        if (endpointResolver == null) {
            return null;
        }
        Optional<String> resolved = endpointResolver.resolveEndpoint(providerId);
        return resolved.filter(e -> !e.trim().isEmpty()).orElse(null);
    }

    private static long remainingNanos(long deadline) {
        return Math.max(0L, deadline - System.nanoTime());
    }

    private static void validateProviderId(String providerId) {
        if (providerId == null || providerId.trim().isEmpty()) {
            throw new IllegalArgumentException("Provider id cannot be empty");
        }
    }
}

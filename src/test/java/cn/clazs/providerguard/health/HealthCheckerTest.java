package cn.clazs.providerguard.health;

import cn.clazs.providerguard.circuit.CircuitBreaker;
import cn.clazs.providerguard.circuit.CircuitBreakerSnapshot;
import cn.clazs.providerguard.circuit.CircuitState;
import cn.clazs.providerguard.properties.ProviderGuardProperties;
import cn.clazs.providerguard.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * HealthChecker tests, HTTP probes answered by {@link MockRestServiceServer}
 */
@DisplayName("HealthChecker tests")
class HealthCheckerTest {

    private static final String OPENAI_HEALTH = "http://openai.test/health";
    private static final String ANTHROPIC_HEALTH = "http://anthropic.test/health";

    private ProviderGuardProperties properties;
    private MutableClock clock;
    private MockRestServiceServer server;
    private HealthChecker checker;

    @BeforeEach
    void setUp() {
        properties = new ProviderGuardProperties();
        properties.getCircuitBreaker().setFailureThreshold(2);
        properties.getCircuitBreaker().setOpenTimeout(1000L);
        properties.getHealth().setCheckInterval(50L);
        properties.getHealth().setStopGracePeriod(2000L);

        clock = new MutableClock();
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).ignoreExpectOrder(true).build();
        checker = new HealthChecker(properties, restTemplate, null, clock);
    }

    @AfterEach
    void tearDown() {
        checker.stop();
    }

    // ==================== Registry ====================

    @Test
    @DisplayName("Registry: a registered provider gets a closed breaker")
    void testAddProvider() {
        checker.addProvider("openai");

        CircuitBreaker breaker = checker.getCircuitBreaker("openai");
        assertNotNull(breaker);
        assertEquals("openai", breaker.getName());
        assertEquals(2, breaker.getThreshold());
        assertEquals(Duration.ofSeconds(1), breaker.getTimeout());
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(1, checker.getProviderCount());
    }

    @Test
    @DisplayName("Registry: registering twice keeps the existing breaker")
    void testAddProviderTwice() {
        checker.addProvider("openai");
        CircuitBreaker first = checker.getCircuitBreaker("openai");
        first.recordProbeFailure();

        checker.addProvider("openai", OPENAI_HEALTH);

        assertSame(first, checker.getCircuitBreaker("openai"), "breaker state must survive re-registration");
        assertEquals(1, checker.getCircuitBreaker("openai").getFailureCount());
    }

    @Test
    @DisplayName("Registry: unknown and removed providers have no breaker")
    void testUnknownAndRemovedProvider() {
        assertNull(checker.getCircuitBreaker("missing"));
        assertNull(checker.getCircuitBreaker(null));

        checker.addProvider("openai");
        checker.removeProvider("openai");
        checker.removeProvider("never-added");

        assertNull(checker.getCircuitBreaker("openai"));
        assertEquals(0, checker.getProviderCount());
    }

    @Test
    @DisplayName("Registry: empty provider ids are rejected")
    void testEmptyProviderId() {
        assertThrows(IllegalArgumentException.class, () -> checker.addProvider(null));
        assertThrows(IllegalArgumentException.class, () -> checker.addProvider(" "));
    }

    @Test
    @DisplayName("Registry: healthy providers exclude open breakers")
    void testHealthyProviders() {
        checker.addProvider("openai");
        checker.addProvider("anthropic");
        checker.addProvider("mistral");

        checker.updateProviderHealth("anthropic", false);
        checker.updateProviderHealth("anthropic", false);

        assertEquals(Arrays.asList("openai", "mistral"), checker.getHealthyProviders());
    }

    @Test
    @DisplayName("Registry: status reports every provider")
    void testProviderStatus() {
        checker.addProvider("openai");
        checker.addProvider("anthropic");
        checker.updateProviderHealth("anthropic", false);

        Map<String, CircuitBreakerSnapshot> status = checker.getProviderStatus();

        assertEquals(2, status.size());
        assertEquals(0, status.get("openai").getFailureCount());
        assertEquals(1, status.get("anthropic").getFailureCount());
        assertTrue(status.get("anthropic").isAvailable());
    }

    // ==================== Health signals ====================

    @Test
    @DisplayName("Signals: updates for unknown providers are ignored")
    void testUpdateUnknownProvider() {
        assertDoesNotThrow(() -> checker.updateProviderHealth("missing", false));
        assertNull(checker.getCircuitBreaker("missing"));
    }

    @Test
    @DisplayName("Signals: a healthy probe moves an open breaker to half-open")
    void testHealthyProbeOnOpenBreaker() {
        checker.addProvider("openai");
        checker.updateProviderHealth("openai", false);
        checker.updateProviderHealth("openai", false);
        assertEquals(CircuitState.OPEN, checker.getCircuitBreaker("openai").getState());

        checker.updateProviderHealth("openai", true);

        assertEquals(CircuitState.HALF_OPEN, checker.getCircuitBreaker("openai").getState());
        assertTrue(checker.getHealthyProviders().contains("openai"));
    }

    // ==================== Probes ====================

    @Test
    @DisplayName("Probe: 2xx responses are healthy")
    void testProbe2xx() {
        server.expect(requestTo(OPENAI_HEALTH)).andExpect(method(HttpMethod.GET)).andRespond(withSuccess());
        server.expect(requestTo(ANTHROPIC_HEALTH)).andRespond(withStatus(HttpStatus.NO_CONTENT));

        assertTrue(checker.checkProviderEndpoint(OPENAI_HEALTH));
        assertTrue(checker.checkProviderEndpoint(ANTHROPIC_HEALTH));
        server.verify();
    }

    @Test
    @DisplayName("Probe: non-2xx responses and I/O errors are unhealthy")
    void testProbeFailures() {
        server.expect(requestTo("http://down.test/500")).andRespond(withServerError());
        server.expect(requestTo("http://down.test/404")).andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo("http://down.test/timeout")).andRespond(withException(new SocketTimeoutException("read timed out")));

        assertFalse(checker.checkProviderEndpoint("http://down.test/500"));
        assertFalse(checker.checkProviderEndpoint("http://down.test/404"));
        assertFalse(checker.checkProviderEndpoint("http://down.test/timeout"));
        server.verify();
    }

    @Test
    @DisplayName("Probe: malformed URLs are unhealthy, not errors")
    void testProbeInvalidUrl() {
        HealthChecker realClient = new HealthChecker(properties);

        assertFalse(realClient.checkProviderEndpoint("://invalid-url"));
        assertFalse(realClient.checkProviderEndpoint("not-a-url"));
    }

    @Test
    @DisplayName("Sweep: failing endpoints open the breaker after the threshold")
    void testSweepOpensBreaker() {
        checker.addProvider("openai", OPENAI_HEALTH);
        checker.addProvider("anthropic", ANTHROPIC_HEALTH);
        server.expect(ExpectedCount.times(2), requestTo(OPENAI_HEALTH)).andRespond(withServerError());
        server.expect(ExpectedCount.times(2), requestTo(ANTHROPIC_HEALTH)).andRespond(withSuccess());

        checker.performHealthChecks();
        assertEquals(CircuitState.CLOSED, checker.getCircuitBreaker("openai").getState());

        checker.performHealthChecks();
        assertEquals(CircuitState.OPEN, checker.getCircuitBreaker("openai").getState());
        assertEquals(CircuitState.CLOSED, checker.getCircuitBreaker("anthropic").getState());
        assertEquals(Arrays.asList("anthropic"), checker.getHealthyProviders());
        server.verify();
    }

    @Test
    @DisplayName("Sweep: a recovered endpoint is rediscovered without traffic")
    void testSweepRecoversBreaker() {
        checker.addProvider("openai", OPENAI_HEALTH);
        checker.updateProviderHealth("openai", false);
        checker.updateProviderHealth("openai", false);
        server.expect(ExpectedCount.times(2), requestTo(OPENAI_HEALTH)).andRespond(withSuccess());

        checker.performHealthChecks();
        assertEquals(CircuitState.HALF_OPEN, checker.getCircuitBreaker("openai").getState());

        checker.performHealthChecks();
        assertEquals(CircuitState.CLOSED, checker.getCircuitBreaker("openai").getState());
        server.verify();
    }

    @Test
    @DisplayName("Sweep: providers without an endpoint are skipped")
    void testSweepSkipsProviderWithoutEndpoint() {
        checker.addProvider("local");

        checker.performHealthChecks();

        assertEquals(0, checker.getCircuitBreaker("local").getFailureCount());
        server.verify();
    }

    @Test
    @DisplayName("Sweep: the endpoint resolver supplies missing endpoints")
    void testEndpointResolver() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer resolverServer = MockRestServiceServer.bindTo(restTemplate).build();
        ProviderEndpointResolver resolver = id -> "openai".equals(id) ? Optional.of(OPENAI_HEALTH) : Optional.empty();
        HealthChecker resolving = new HealthChecker(properties, restTemplate, resolver, clock);
        resolving.addProvider("openai");
        resolving.addProvider("unknown");
        resolverServer.expect(requestTo(OPENAI_HEALTH)).andRespond(withServerError());

        resolving.performHealthChecks();

        assertEquals(1, resolving.getCircuitBreaker("openai").getFailureCount());
        assertEquals(0, resolving.getCircuitBreaker("unknown").getFailureCount());
        resolverServer.verify();
    }

    // ==================== Lifecycle ====================

    @Test
    @DisplayName("Lifecycle: stop before start is a no-op")
    void testStopBeforeStart() {
        assertDoesNotThrow(() -> checker.stop());
        assertFalse(checker.isRunning());
    }

    @Test
    @DisplayName("Lifecycle: start and stop are idempotent, the checker can restart")
    void testStartStopTwice() {
        checker.start();
        checker.start();
        assertTrue(checker.isRunning());

        checker.stop();
        checker.stop();
        assertFalse(checker.isRunning());

        checker.start();
        assertTrue(checker.isRunning());
        checker.stop();
        assertFalse(checker.isRunning());
    }

    @Test
    @DisplayName("Lifecycle: the background sweep runs every check interval")
    void testBackgroundSweep() throws InterruptedException {
        CountDownLatch sweeps = new CountDownLatch(3);
        ProviderEndpointResolver countingResolver = id -> {
            sweeps.countDown();
            return Optional.empty();
        };
        HealthChecker scheduled = new HealthChecker(properties, new RestTemplate(), countingResolver, clock);
        scheduled.addProvider("openai");

        scheduled.start();
        try {
            assertTrue(sweeps.await(5, TimeUnit.SECONDS), "at least three sweeps should run within 5s");
        } finally {
            scheduled.stop();
        }
        assertFalse(scheduled.isRunning());
    }

    @Test
    @DisplayName("Lifecycle: invalid configuration fails fast")
    void testInvalidConfiguration() {
        properties.getHealth().setCheckInterval(0L);

        assertThrows(IllegalArgumentException.class, () -> new HealthChecker(properties));
    }
}

package cn.clazs.providerguard.web;

import cn.clazs.providerguard.exception.DefaultRateLimitExceptionHandler;
import cn.clazs.providerguard.exception.RateLimitException;
import cn.clazs.providerguard.ratelimit.ApiKeyRateLimiter;
import cn.clazs.providerguard.ratelimit.FixedWindowRateLimiter;
import cn.clazs.providerguard.ratelimit.IpRateLimiter;
import cn.clazs.providerguard.ratelimit.RequestThrottler;
import cn.clazs.providerguard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RequestThrottleInterceptor + DefaultRateLimitExceptionHandler tests
 */
@DisplayName("RequestThrottleInterceptor tests")
class RequestThrottleInterceptorTest {

    private RequestThrottleInterceptor interceptor;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock();
        Duration window = Duration.ofMinutes(1);
        RequestThrottler throttler = new RequestThrottler(
                new FixedWindowRateLimiter(window, 100, clock),
                new IpRateLimiter(window, 1, clock),
                new ApiKeyRateLimiter(window, 10, clock));
        interceptor = new RequestThrottleInterceptor(throttler, new ClientIdentityResolver());
    }

    private MockHttpServletRequest request(String ip) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/v1/chat/completions");
        request.setRemoteAddr(ip);
        return request;
    }

    @Test
    @DisplayName("Admitted: request continues with rate-limit headers")
    void testAdmittedRequest() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        assertTrue(interceptor.preHandle(request("127.0.0.1"), response, new Object()));

        assertEquals("1", response.getHeader("X-RateLimit-IP-Limit"));
        assertEquals("0", response.getHeader("X-RateLimit-IP-Remaining"));
        assertEquals("100", response.getHeader("X-RateLimit-Global-Limit"));
        assertNull(response.getHeader("X-RateLimit-APIKey-Limit"), "anonymous request has no key headers");
    }

    @Test
    @DisplayName("Admitted: API key headers are sent when a key is supplied")
    void testAdmittedRequestWithKey() {
        MockHttpServletRequest request = request("127.0.0.1");
        request.addHeader("X-API-Key", "sk-live");
        MockHttpServletResponse response = new MockHttpServletResponse();

        assertTrue(interceptor.preHandle(request, response, new Object()));

        assertEquals("10", response.getHeader("X-RateLimit-APIKey-Limit"));
        assertEquals("9", response.getHeader("X-RateLimit-APIKey-Remaining"));
    }

    @Test
    @DisplayName("Rejected: RateLimitException carries reason, headers and retry-after")
    void testRejectedRequest() {
        interceptor.preHandle(request("127.0.0.1"), new MockHttpServletResponse(), new Object());

        RateLimitException e = assertThrows(RateLimitException.class,
                () -> interceptor.preHandle(request("127.0.0.1"), new MockHttpServletResponse(), new Object()));

        assertEquals("IP rate limit exceeded", e.getMessage());
        assertEquals("127.0.0.1", e.getLimitKey());
        assertEquals("0", e.getHeaders().get("X-RateLimit-IP-Remaining"));
        assertEquals(60L, e.getRetryAfterSeconds());
    }

    @Test
    @DisplayName("Rejected: forwarded clients are limited by their own address")
    void testForwardedClientsAreSeparate() {
        MockHttpServletRequest first = request("10.0.0.1");
        first.addHeader("X-Forwarded-For", "203.0.113.1");
        MockHttpServletRequest second = request("10.0.0.1");
        second.addHeader("X-Forwarded-For", "203.0.113.2");

        assertTrue(interceptor.preHandle(first, new MockHttpServletResponse(), new Object()));
        assertTrue(interceptor.preHandle(second, new MockHttpServletResponse(), new Object()),
                "same proxy, different client");
    }

    @Test
    @DisplayName("Handler: rejection becomes 429 with headers and Retry-After")
    void testExceptionHandler() {
        interceptor.preHandle(request("127.0.0.1"), new MockHttpServletResponse(), new Object());
        RateLimitException e = assertThrows(RateLimitException.class,
                () -> interceptor.preHandle(request("127.0.0.1"), new MockHttpServletResponse(), new Object()));

        ResponseEntity<DefaultRateLimitExceptionHandler.ErrorResponse> response =
                new DefaultRateLimitExceptionHandler().handleRateLimitException(e);

        assertEquals(HttpStatus.TOO_MANY_REQUESTS, response.getStatusCode());
        assertEquals("60", response.getHeaders().getFirst("Retry-After"));
        assertEquals("1", response.getHeaders().getFirst("X-RateLimit-IP-Limit"));
        assertNotNull(response.getBody());
        assertEquals(429, response.getBody().getStatus());
        assertEquals("TOO_MANY_REQUESTS", response.getBody().getError());
        assertEquals("IP rate limit exceeded", response.getBody().getMessage());
    }
}

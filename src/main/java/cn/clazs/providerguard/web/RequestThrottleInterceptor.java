package cn.clazs.providerguard.web;

import cn.clazs.providerguard.exception.RateLimitException;
import cn.clazs.providerguard.ratelimit.RequestThrottler;
import cn.clazs.providerguard.ratelimit.ThrottleDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.HandlerInterceptor;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.util.Map;

/**
 * Admits or rejects inbound HTTP requests through a {@link RequestThrottler}
 *
 * <p>Admitted requests get the X-RateLimit-* headers and continue. Rejected requests raise
 * {@link RateLimitException}, which {@link cn.clazs.providerguard.exception.DefaultRateLimitExceptionHandler}
 * turns into 429.
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class RequestThrottleInterceptor implements HandlerInterceptor {

    private final RequestThrottler requestThrottler;
    private final ClientIdentityResolver identityResolver;

    public RequestThrottleInterceptor(RequestThrottler requestThrottler, ClientIdentityResolver identityResolver) {
        this.requestThrottler = requestThrottler;
        this.identityResolver = identityResolver;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String ip = identityResolver.resolveClientIp(request);
        String apiKey = identityResolver.resolveApiKey(request).orElse(null);

        ThrottleDecision decision = requestThrottler.checkRequest(ip, apiKey);
        Map<String, String> headers = requestThrottler.getRateLimitHeaders(ip, apiKey);

        if (!decision.isAllowed()) {
            long retryAfter = requestThrottler.getRetryAfterSeconds(decision, ip, apiKey);
            throw new RateLimitException(ip, decision.getReason(), headers, retryAfter);
        }

        headers.forEach(response::setHeader);
        if (log.isDebugEnabled()) {
            log.debug("Request admitted: uri={}, ip={}", request.getRequestURI(), ip);
        }
        return true;
    }
}

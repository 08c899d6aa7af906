package cn.clazs.providerguard.autoconfigure;

import cn.clazs.providerguard.aspect.ProviderCallAspect;
import cn.clazs.providerguard.exception.DefaultRateLimitExceptionHandler;
import cn.clazs.providerguard.health.HealthChecker;
import cn.clazs.providerguard.health.ProviderEndpointResolver;
import cn.clazs.providerguard.properties.ProviderGuardProperties;
import cn.clazs.providerguard.ratelimit.ApiKeyRateLimiter;
import cn.clazs.providerguard.ratelimit.FixedWindowRateLimiter;
import cn.clazs.providerguard.ratelimit.IpRateLimiter;
import cn.clazs.providerguard.ratelimit.RequestThrottler;
import cn.clazs.providerguard.web.ClientIdentityResolver;
import cn.clazs.providerguard.web.RequestThrottleInterceptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.DispatcherServlet;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Clock;
import java.time.Duration;

/**
 * Provider guard auto-configuration
 *
 * <p>Registers:
 * <ul>
 *     <li>{@link HealthChecker} with every provider from {@code clazs.providerguard.health.providers},
 *         its sweep started on creation when {@code auto-start} is true and stopped on shutdown</li>
 *     <li>{@link ProviderCallAspect} for {@link cn.clazs.providerguard.annotation.GuardedProviderCall}</li>
 *     <li>{@link RequestThrottler} and, in servlet web applications, the {@link RequestThrottleInterceptor}
 *         plus the {@link DefaultRateLimitExceptionHandler} that maps rejections to 429</li>
 * </ul>
 *
 * <p>Disable everything with {@code clazs.providerguard.enabled=false}, or one part with
 * {@code health.enabled=false} / {@code throttle.enabled=false}. Every bean backs off when the
 * application declares its own (@ConditionalOnMissingBean).
 *
 * <p>Loaded through {@code META-INF/spring.factories}.
 *
 * @author clazs
 * @since 1.0.0
 * @see ProviderGuardProperties
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ProviderGuardProperties.class)
@ConditionalOnProperty(prefix = "clazs.providerguard", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ProviderGuardAutoConfiguration {

    // ==================== Health checking ====================

    /**
     * Health checker holding one circuit breaker per provider
     *
     * @param properties       bound configuration
     * @param resolverProvider optional endpoint lookup for providers registered without an endpoint
     */
    @Bean(destroyMethod = "stop")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "clazs.providerguard.health", name = "enabled", havingValue = "true", matchIfMissing = true)
    public HealthChecker healthChecker(ProviderGuardProperties properties,
                                       ObjectProvider<ProviderEndpointResolver> resolverProvider) {
        log.info("Initializing HealthChecker bean, configuration: {}", properties.getSummary());
        properties.validate();

        HealthChecker checker = new HealthChecker(
                properties,
                HealthChecker.createProbeRestTemplate(Duration.ofMillis(properties.getHealth().getProbeTimeout())),
                resolverProvider.getIfAvailable(),
                Clock.systemUTC());
        properties.getHealth().getProviders().forEach(checker::addProvider);

        if (properties.getHealth().isAutoStart()) {
            checker.start();
        }

        log.info("HealthChecker bean created, providers={}", checker.getProviderCount());
        return checker;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(HealthChecker.class)
    public ProviderCallAspect providerCallAspect(HealthChecker healthChecker) {
        log.info("Initializing ProviderCallAspect bean");
        return new ProviderCallAspect(healthChecker);
    }

    // ==================== Inbound throttling ====================

    /**
     * Global, per-IP and per-API-key budgets, all sharing {@code throttle.window}
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "clazs.providerguard.throttle", name = "enabled", havingValue = "true", matchIfMissing = true)
    public RequestThrottler requestThrottler(ProviderGuardProperties properties) {
        properties.validate();
        ProviderGuardProperties.ThrottleConfig throttle = properties.getThrottle();
        Duration window = Duration.ofMillis(throttle.getWindow());
        Clock clock = Clock.systemUTC();

        RequestThrottler throttler = new RequestThrottler(
                new FixedWindowRateLimiter(window, throttle.getGlobalLimit(), clock, throttle.getMaxTrackedKeys()),
                new IpRateLimiter(window, throttle.getIpLimit(), clock, throttle.getMaxTrackedKeys()),
                new ApiKeyRateLimiter(window, throttle.getApiKeyLimit(), clock, throttle.getMaxTrackedKeys()));

        log.info("RequestThrottler bean created: window={}ms, global={}, ip={}, apiKey={}",
                throttle.getWindow(), throttle.getGlobalLimit(), throttle.getIpLimit(), throttle.getApiKeyLimit());
        return throttler;
    }

    @Bean
    @ConditionalOnMissingBean
    public ClientIdentityResolver clientIdentityResolver(ProviderGuardProperties properties) {
        return new ClientIdentityResolver(properties.getThrottle().getApiKeyHeader());
    }

    /**
     * Servlet web parts, skipped when Spring MVC is not on the classpath.
     * Nested classes are processed before the outer @Bean methods, so conditions here
     * must not depend on beans declared above.
     */
    @Configuration
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(DispatcherServlet.class)
    static class WebMvcThrottleConfiguration {

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnProperty(prefix = "clazs.providerguard.throttle", name = "enabled", havingValue = "true", matchIfMissing = true)
        public RequestThrottleInterceptor requestThrottleInterceptor(RequestThrottler requestThrottler,
                                                                     ClientIdentityResolver identityResolver) {
            log.info("Initializing RequestThrottleInterceptor bean");
            return new RequestThrottleInterceptor(requestThrottler, identityResolver);
        }

        @Bean
        @ConditionalOnBean(RequestThrottleInterceptor.class)
        public WebMvcConfigurer requestThrottleWebMvcConfigurer(RequestThrottleInterceptor interceptor,
                                                                ProviderGuardProperties properties) {
            return new WebMvcConfigurer() {
                @Override
                public void addInterceptors(InterceptorRegistry registry) {
                    registry.addInterceptor(interceptor)
                            .addPathPatterns(properties.getThrottle().getPathPatterns());
                    log.info("RequestThrottleInterceptor registered for {}", properties.getThrottle().getPathPatterns());
                }
            };
        }

        @Bean
        @ConditionalOnMissingBean
        public DefaultRateLimitExceptionHandler defaultRateLimitExceptionHandler() {
            log.info("Initializing DefaultRateLimitExceptionHandler bean");
            return new DefaultRateLimitExceptionHandler();
        }
    }
}

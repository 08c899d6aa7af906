package cn.clazs.providerguard.aspect;

import cn.clazs.providerguard.annotation.GuardedProviderCall;
import cn.clazs.providerguard.circuit.CircuitBreaker;
import cn.clazs.providerguard.health.HealthChecker;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.ParameterNameDiscoverer;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;

import java.lang.reflect.Method;

/**
 * Outbound guard aspect
 * Intercepts methods annotated with {@link GuardedProviderCall} and runs them through the
 * provider's {@link CircuitBreaker}
 *
 * <p>Core behavior:
 * <ul>
 *     <li>Resolves the provider id from a constant or SpEL expression</li>
 *     <li>Looks the breaker up in the {@link HealthChecker}, registering the provider on first use</li>
 *     <li>Open breaker: the method is skipped and {@link cn.clazs.providerguard.circuit.CircuitOpenException}
 *         reaches the caller unchanged</li>
 *     <li>Exceptions thrown by the method count as failures and are rethrown as is</li>
 * </ul>
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
@Aspect
public class ProviderCallAspect {

    private final HealthChecker healthChecker;

    private final ExpressionParser parser = new SpelExpressionParser();

    private final ParameterNameDiscoverer nameDiscoverer = new DefaultParameterNameDiscoverer();

    public ProviderCallAspect(HealthChecker healthChecker) {
        this.healthChecker = healthChecker;
    }

    @Around("@annotation(guardedProviderCall)")
    public Object around(ProceedingJoinPoint joinPoint, GuardedProviderCall guardedProviderCall) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        String providerId = parseProvider(guardedProviderCall.provider(), method, joinPoint.getArgs());

        CircuitBreaker breaker = healthChecker.getCircuitBreaker(providerId);
        if (breaker == null) {
            if (!guardedProviderCall.autoRegister()) {
                log.debug("No breaker for provider, call unguarded: provider={}, method={}",
                        providerId, method.getName());
                return joinPoint.proceed();
            }
            healthChecker.addProvider(providerId);
            breaker = healthChecker.getCircuitBreaker(providerId);
            if (breaker == null) {
                // removed concurrently right after registration
                log.warn("Provider removed while registering, call unguarded: provider={}, method={}",
                        providerId, method.getName());
                return joinPoint.proceed();
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Guarded provider call: provider={}, method={}, state={}",
                    providerId, method.getName(), breaker.getState());
        }

        try {
            return breaker.call(() -> proceed(joinPoint));
        } catch (TunnelledThrowable e) {
            throw e.getCause();
        }
    }

    private static Object proceed(ProceedingJoinPoint joinPoint) throws Exception {
        try {
            return joinPoint.proceed();
        } catch (Exception | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new TunnelledThrowable(t);
        }
    }

    /**
     * Carries a Throwable that is neither Exception nor Error through {@link CircuitBreaker#call}
     */
    private static final class TunnelledThrowable extends RuntimeException {

        private TunnelledThrowable(Throwable cause) {
            super(cause);
        }
    }

    /**
     * Resolve the provider id
     *
     * @param providerExpression constant or SpEL expression (contains '#')
     * @param method             target method
     * @param args               argument values
     * @return provider id
     */
    private String parseProvider(String providerExpression, Method method, Object[] args) {
        if (!providerExpression.contains("#")) {
            return providerExpression;
        }

        EvaluationContext context = new StandardEvaluationContext();
        String[] parameterNames = nameDiscoverer.getParameterNames(method);
        if (parameterNames != null) {
            for (int i = 0; i < parameterNames.length; i++) {
                context.setVariable(parameterNames[i], args[i]);
            }
        }

        Expression expression = parser.parseExpression(providerExpression);
        Object value = expression.getValue(context);
        if (value == null || value.toString().trim().isEmpty()) {
            throw new IllegalArgumentException("Cannot resolve provider id, SpEL expression: " + providerExpression);
        }
        return value.toString();
    }
}

package cn.clazs.providerguard.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Routes a method through the circuit breaker of an LLM provider
 *
 * <p>Usage:
 * <pre>{@code
 * // constant provider id
 * @GuardedProviderCall(provider = "openai")
 * public String complete(String prompt) {
 *     return client.complete(prompt);
 * }
 *
 * // SpEL over the method arguments
 * @GuardedProviderCall(provider = "#request.providerId")
 * public Completion complete(CompletionRequest request) {
 *     return clients.get(request.getProviderId()).complete(request);
 * }
 * }</pre>
 *
 * <p>While the provider's breaker is open the method is not invoked and
 * {@link cn.clazs.providerguard.circuit.CircuitOpenException} is thrown instead.
 *
 * @author clazs
 * @since 1.0.0
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface GuardedProviderCall {

    /**
     * Provider id, a constant or a SpEL expression
     *
     * <ul>
     *     <li>{@code openai} - constant</li>
     *     <li>{@code #providerId} - method argument providerId</li>
     *     <li>{@code #request.providerId} - property of argument request</li>
     * </ul>
     */
    String provider();

    /**
     * Register the provider with the health checker when it has no breaker yet.
     * If false, calls for unknown providers run unguarded.
     */
    boolean autoRegister() default true;
}

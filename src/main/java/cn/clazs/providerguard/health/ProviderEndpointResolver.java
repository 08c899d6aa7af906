package cn.clazs.providerguard.health;

import java.util.Optional;

/**
 * Looks up the health endpoint of a provider that was registered without one
 *
 * <p>Lets the surrounding system keep endpoints in its own provider store (database,
 * config service...). Declare a bean of this type and the auto-configuration passes it to the
 * {@link HealthChecker}.
 *
 * @author clazs
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProviderEndpointResolver {

    /**
     * @param providerId provider identifier
     * @return HTTP(S) endpoint to probe, empty if the provider is unknown
     */
    Optional<String> resolveEndpoint(String providerId);
}

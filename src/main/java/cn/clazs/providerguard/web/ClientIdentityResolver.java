package cn.clazs.providerguard.web;

import javax.servlet.http.HttpServletRequest;
import java.util.Optional;

/**
 * Extracts the client identity (IP and API key) the request throttler keys its budgets on
 *
 * <p>IP resolution order:
 * <ol>
 *     <li>first entry of {@code X-Forwarded-For}</li>
 *     <li>{@code X-Real-IP}</li>
 *     <li>{@link HttpServletRequest#getRemoteAddr()}</li>
 * </ol>
 *
 * <p>Forwarding headers are trusted as sent, so deploy behind a proxy that overwrites them.
 *
 * @author clazs
 * @since 1.0.0
 */
public class ClientIdentityResolver {

    public static final String DEFAULT_API_KEY_HEADER = "X-API-Key";

    static final String X_FORWARDED_FOR = "X-Forwarded-For";
    static final String X_REAL_IP = "X-Real-IP";
    static final String AUTHORIZATION = "Authorization";
    static final String BEARER_PREFIX = "Bearer ";

    private final String apiKeyHeader;

    public ClientIdentityResolver() {
        this(DEFAULT_API_KEY_HEADER);
    }

    /**
     * @param apiKeyHeader header that carries the API key
     */
    public ClientIdentityResolver(String apiKeyHeader) {
        if (apiKeyHeader == null || apiKeyHeader.trim().isEmpty()) {
            throw new IllegalArgumentException("apiKeyHeader cannot be empty");
        }
        this.apiKeyHeader = apiKeyHeader.trim();
    }

    public String resolveClientIp(HttpServletRequest request) {
        String forwardedFor = request.getHeader(X_FORWARDED_FOR);
        if (hasText(forwardedFor)) {
            String first = forwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }

        String realIp = request.getHeader(X_REAL_IP);
        if (hasText(realIp)) {
            return realIp.trim();
        }

        return request.getRemoteAddr();
    }

    /**
     * @return the key from the configured header, else a bearer token, else empty
     */
    public Optional<String> resolveApiKey(HttpServletRequest request) {
        String apiKey = request.getHeader(apiKeyHeader);
        if (hasText(apiKey)) {
            return Optional.of(apiKey.trim());
        }

        String authorization = request.getHeader(AUTHORIZATION);
        if (authorization != null && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}

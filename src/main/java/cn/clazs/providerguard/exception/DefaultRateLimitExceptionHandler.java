package cn.clazs.providerguard.exception;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Default handler for {@link RateLimitException}
 *
 * <p>Turns a throttled request into HTTP 429 (Too Many Requests) with the rate-limit headers,
 * Retry-After and a small JSON body. Registered by the auto-configuration in servlet web
 * applications only; declare your own bean of this type to replace it.
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
@RestControllerAdvice
@Order(1)
public class DefaultRateLimitExceptionHandler {

    /**
     * Short WARN line, no stack trace
     *
     * @param e throttling exception
     * @return 429 + error body
     */
    @ExceptionHandler(RateLimitException.class)
    public ResponseEntity<ErrorResponse> handleRateLimitException(RateLimitException e) {
        log.warn("Request throttled: key={}, message={}", e.getLimitKey(), e.getMessage());

        HttpHeaders headers = new HttpHeaders();
        e.getHeaders().forEach(headers::set);
        if (e.getRetryAfterSeconds() > 0) {
            headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()));
        }

        ErrorResponse response = new ErrorResponse(
                HttpStatus.TOO_MANY_REQUESTS.value(),
                "TOO_MANY_REQUESTS",
                e.getMessage()
        );

        return ResponseEntity
                .status(HttpStatus.TOO_MANY_REQUESTS)
                .headers(headers)
                .body(response);
    }

    @Data
    public static class ErrorResponse {
        private int status;
        private String error;
        private String message;

        public ErrorResponse(int status, String error, String message) {
            this.status = status;
            this.error = error;
            this.message = message;
        }
    }
}

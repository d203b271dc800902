package com.orbit.pipeline.core.error;

/**
 * 원격 호스트가 요청 한도 초과를 응답한 경우 (예: HTTP 429).
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public class RateLimitExceededException extends ScrapingException {

    public RateLimitExceededException(String message) {
        super(message, "RATE_LIMIT_EXCEEDED", null);
    }
}

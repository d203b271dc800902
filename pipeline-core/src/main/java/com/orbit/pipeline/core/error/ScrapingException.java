package com.orbit.pipeline.core.error;

/**
 * 페이지 수집 실패.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public class ScrapingException extends TransientPipelineException {

    public ScrapingException(String message) {
        super(message);
    }

    public ScrapingException(String message, Throwable cause) {
        super(message, cause);
    }

    protected ScrapingException(String message, String errorCode, Throwable cause) {
        super(message, errorCode, cause);
    }
}

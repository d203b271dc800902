package com.orbit.pipeline.core.error;

/**
 * 잘못된 설정으로 인한 실패.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public class ConfigurationException extends PermanentPipelineException {

    public ConfigurationException(String message) {
        super(message);
    }
}

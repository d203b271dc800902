/**
 * 파이프라인 예외 계층과 오류 분류.
 *
 * <pre>
 * PipelineException
 * ├── TransientPipelineException
 * │   └── ScrapingException
 * │       └── RateLimitExceededException
 * ├── PermanentPipelineException
 * │   ├── ExtractionException
 * │   ├── ValidationException
 * │   └── ConfigurationException
 * ├── CircuitBreakerOpenException
 * └── CacheException
 * </pre>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
package com.orbit.pipeline.core.error;

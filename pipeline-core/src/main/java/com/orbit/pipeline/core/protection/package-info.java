/**
 * 원격 호출 보호 SPI.
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>{@link com.orbit.pipeline.core.protection.RateLimiter}: 키 단위 Token Bucket</li>
 *   <li>{@link com.orbit.pipeline.core.protection.CircuitBreaker}: 연속 실패 기반 차단</li>
 *   <li>{@link com.orbit.pipeline.core.protection.RetryPolicy}: 지수 백오프 재시도</li>
 *   <li>{@link com.orbit.pipeline.core.protection.TimeoutPolicy}: 시도당 타임아웃</li>
 * </ul>
 *
 * <p>각 SPI는 {@code noop} 패키지에 아무 보호도 하지 않는 구현을 가집니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
package com.orbit.pipeline.core.protection;

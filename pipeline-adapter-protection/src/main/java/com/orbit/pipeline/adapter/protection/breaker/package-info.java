/**
 * 연속 실패 기반 Circuit Breaker와 작업별 등록소.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
package com.orbit.pipeline.adapter.protection.breaker;

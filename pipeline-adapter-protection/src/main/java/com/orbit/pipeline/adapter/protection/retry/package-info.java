/**
 * 지수 백오프 재시도 정책.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
package com.orbit.pipeline.adapter.protection.retry;

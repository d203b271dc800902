/**
 * 시도당 타임아웃 정책.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
package com.orbit.pipeline.adapter.protection.timeout;

/**
 * 키 단위 Token Bucket Rate Limiter.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
package com.orbit.pipeline.adapter.protection.ratelimit;

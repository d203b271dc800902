/**
 * 백그라운드 작업 런타임 포트.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
package com.orbit.pipeline.application.runtime;

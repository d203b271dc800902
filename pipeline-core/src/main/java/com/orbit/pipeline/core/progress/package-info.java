/**
 * 실행 진행 이벤트 스트림.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
package com.orbit.pipeline.core.progress;

/**
 * JSON 기반 콘텐츠 해시.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
package com.orbit.pipeline.adapter.file.hash;

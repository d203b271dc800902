/**
 * 보호 SPI의 NoOp 구현.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
package com.orbit.pipeline.core.protection.noop;

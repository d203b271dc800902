/**
 * Test support utilities: controllable clock, recording listener and fixtures.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
package com.orbit.pipeline.testkit.support;

/**
 * Contract test bases for adapter implementations.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
package com.orbit.pipeline.testkit.contract;

/**
 * In-memory cache store adapter.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
package com.orbit.pipeline.adapter.inmemory.store;

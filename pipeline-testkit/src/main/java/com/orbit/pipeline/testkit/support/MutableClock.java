package com.orbit.pipeline.testkit.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * A {@link Clock} whose current instant is advanced manually.
 *
 * <p>Time-dependent components (cache expiry, breaker recovery, token refill)
 * take a Clock so tests can move time forward instead of sleeping.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * MutableClock clock = MutableClock.at("2026-01-01T00:00:00Z");
 * cache.set("k", value, Duration.ofMinutes(5), "A");
 * clock.advance(Duration.ofMinutes(5));
 * assertThat(cache.get("k")).isEmpty();
 * </pre>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private final ZoneId zone;
    private volatile Instant instant;

    public MutableClock(Instant instant) {
        this(instant, ZoneOffset.UTC);
    }

    private MutableClock(Instant instant, ZoneId zone) {
        this.instant = instant;
        this.zone = zone;
    }

    /**
     * Creates a clock fixed at the given ISO-8601 instant.
     *
     * @param isoInstant e.g. "2026-01-01T00:00:00Z"
     * @return a new clock
     */
    public static MutableClock at(String isoInstant) {
        return new MutableClock(Instant.parse(isoInstant));
    }

    /**
     * Moves the clock forward.
     *
     * @param duration amount to advance
     */
    public void advance(Duration duration) {
        instant = instant.plus(duration);
    }

    /**
     * Sets the current instant.
     *
     * @param instant new instant
     */
    public void set(Instant instant) {
        this.instant = instant;
    }

    /**
     * Nanosecond reading consistent with this clock, for components that take a nano-time source.
     *
     * @return epoch-based nanoseconds
     */
    public long nanoTime() {
        Instant now = instant;
        return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(instant, zone);
    }

    @Override
    public Instant instant() {
        return instant;
    }
}

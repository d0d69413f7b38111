package com.ryuqq.dmo.testkit.contract;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Manually advanced UTC clock for deterministic timestamps in backend tests.
 *
 * <p>Two backends fed clocks that start at the same instant and advance the same way
 * produce identical {@code createdAt}/{@code updatedAt} values.</p>
 *
 * @author DMO Team
 * @since 1.0.0
 */
public final class TestClock extends Clock {

    private Instant now;

    public TestClock(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = start;
    }

    /**
     * Moves the clock forward.
     *
     * @param duration amount to advance
     */
    public void advance(Duration duration) {
        now = now.plus(duration);
    }

    /**
     * Moves the clock to an arbitrary instant, backwards included.
     *
     * @param instant new current instant
     */
    public void set(Instant instant) {
        now = instant;
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return now;
    }
}

package com.ryuqq.flow.testkit.fixture;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Test clock that only moves when told to.
 *
 * <p>Thread-safe; components reading {@link #millis()} from worker threads see advances immediately.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private final AtomicLong epochMillis;
    private final ZoneId zone;

    public MutableClock(long epochMillis) {
        this(new AtomicLong(epochMillis), ZoneOffset.UTC);
    }

    private MutableClock(AtomicLong epochMillis, ZoneId zone) {
        this.epochMillis = epochMillis;
        this.zone = zone;
    }

    public void advance(long millis) {
        epochMillis.addAndGet(millis);
    }

    public void advance(Duration duration) {
        advance(duration.toMillis());
    }

    public void set(long millis) {
        epochMillis.set(millis);
    }

    @Override
    public long millis() {
        return epochMillis.get();
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(millis());
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    /**
     * Returns a view sharing the same time source.
     */
    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(epochMillis, zone);
    }
}

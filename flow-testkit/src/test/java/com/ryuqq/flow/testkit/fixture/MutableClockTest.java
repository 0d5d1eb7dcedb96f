package com.ryuqq.flow.testkit.fixture;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MutableClock 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class MutableClockTest {

    @Test
    void testAdvance_MovesTimeForward() {
        MutableClock clock = new MutableClock(1_000);

        clock.advance(250);
        clock.advance(Duration.ofSeconds(1));

        assertEquals(2_250, clock.millis());
        assertEquals(Instant.ofEpochMilli(2_250), clock.instant());
    }

    @Test
    void testWithZone_SharesTimeSource() {
        MutableClock clock = new MutableClock(0);
        Clock seoul = clock.withZone(ZoneId.of("Asia/Seoul"));

        clock.advance(500);

        assertEquals(500, seoul.millis());
        assertEquals(ZoneId.of("Asia/Seoul"), seoul.getZone());
    }
}

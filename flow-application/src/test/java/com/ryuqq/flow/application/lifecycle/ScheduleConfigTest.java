package com.ryuqq.flow.application.lifecycle;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduleConfig 검증 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ScheduleConfigTest {

    @Test
    void at_한번_실행() {
        // When
        ScheduleConfig schedule = ScheduleConfig.at(5_000L);

        // Then
        assertEquals(5_000L, schedule.executeAt());
        assertFalse(schedule.repeat());
        assertFalse(schedule.isCron());
    }

    @Test
    void every_반복_실행() {
        ScheduleConfig schedule = ScheduleConfig.every(1_000L, 60_000L);

        assertTrue(schedule.repeat());
        assertEquals(60_000L, schedule.repeatIntervalMs());
    }

    @Test
    void cron_표현식() {
        ScheduleConfig schedule = ScheduleConfig.cron("0 * * * *", true);

        assertTrue(schedule.isCron());
        assertNull(schedule.executeAt());
    }

    @Test
    void validate_시각과_cron_둘다_없으면_예외() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new ScheduleConfig(null, null, false, null)
        );
        assertTrue(exception.getMessage().contains("exactly one of executeAt or cronExpression"));
    }

    @Test
    void validate_시각과_cron_둘다_있으면_예외() {
        assertThrows(IllegalArgumentException.class,
            () -> new ScheduleConfig(1_000L, "0 * * * *", false, null));
    }

    @Test
    void validate_공백_cron은_없는_것으로_취급() {
        assertThrows(IllegalArgumentException.class,
            () -> new ScheduleConfig(null, "  ", false, null));
    }

    @Test
    void validate_반복_간격_없는_반복_예외() {
        assertThrows(IllegalArgumentException.class,
            () -> new ScheduleConfig(1_000L, null, true, null));
        assertThrows(IllegalArgumentException.class,
            () -> ScheduleConfig.every(1_000L, 0));
    }
}

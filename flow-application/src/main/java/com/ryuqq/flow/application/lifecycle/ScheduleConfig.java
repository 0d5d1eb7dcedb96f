package com.ryuqq.flow.application.lifecycle;

/**
 * 예약 설정.
 *
 * <p>절대 시각({@code executeAt}) 또는 cron 유사 표현식 중 정확히 하나를 지정합니다.
 * cron 경로는 아직 파싱하지 않으며 항상 "지금부터 1분 뒤"로 해석됩니다.</p>
 *
 * <p><strong>반복:</strong></p>
 * <ul>
 *   <li>cron: 매 실행 후 다시 1분 뒤로 재등록</li>
 *   <li>절대 시각: {@code repeatIntervalMs}가 필요하며 매 실행 후 그 간격으로 재등록</li>
 * </ul>
 *
 * @param executeAt 실행 시각 (epoch millis, cron 사용 시 null)
 * @param cronExpression cron 유사 표현식 (절대 시각 사용 시 null)
 * @param repeat 반복 여부
 * @param repeatIntervalMs 절대 시각 반복 간격 (cron 또는 비반복 시 null)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ScheduleConfig(
    Long executeAt,
    String cronExpression,
    boolean repeat,
    Long repeatIntervalMs
) {

    public ScheduleConfig {
        boolean hasTime = executeAt != null;
        boolean hasCron = cronExpression != null && !cronExpression.isBlank();
        if (hasTime == hasCron) {
            throw new IllegalArgumentException(
                "exactly one of executeAt or cronExpression must be set (executeAt: "
                    + executeAt + ", cronExpression: " + cronExpression + ")"
            );
        }
        if (hasTime && repeat && (repeatIntervalMs == null || repeatIntervalMs <= 0)) {
            throw new IllegalArgumentException(
                "repeatIntervalMs must be positive for repeating absolute schedules (current: " + repeatIntervalMs + ")"
            );
        }
    }

    public static ScheduleConfig at(long executeAt) {
        return new ScheduleConfig(executeAt, null, false, null);
    }

    public static ScheduleConfig every(long firstExecuteAt, long intervalMs) {
        return new ScheduleConfig(firstExecuteAt, null, true, intervalMs);
    }

    public static ScheduleConfig cron(String expression, boolean repeat) {
        return new ScheduleConfig(null, expression, repeat, null);
    }

    public boolean isCron() {
        return cronExpression != null;
    }
}

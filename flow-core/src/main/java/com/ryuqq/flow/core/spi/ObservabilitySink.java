package com.ryuqq.flow.core.spi;

import java.util.Map;
import java.util.function.Supplier;

/**
 * 관측성 수집기 SPI.
 *
 * <p>로그와 트레이스 스팬을 외부로 내보냅니다. 구현체는 제어 흐름이나
 * 예외 의미를 바꾸면 안 됩니다: {@code trace}는 본문의 반환값과 예외를
 * 그대로 전달해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ObservabilitySink {

    /**
     * 로그 레벨.
     */
    enum Level {
        DEBUG, INFO, WARN, ERROR
    }

    /**
     * 구조화 로그 기록.
     *
     * @param level 레벨
     * @param message 메시지
     * @param context 구조화 컨텍스트 (null 허용)
     */
    void log(Level level, String message, Map<String, Object> context);

    /**
     * 본문을 트레이스 스팬으로 감싸 실행.
     *
     * @param name 스팬 이름
     * @param attributes 스팬 속성
     * @param body 실행할 본문
     * @param <T> 결과 타입
     * @return 본문 결과
     */
    <T> T trace(String name, Map<String, Object> attributes, Supplier<T> body);
}

package com.ryuqq.flow.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 런타임 도메인 예외의 공통 상위 타입.
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>code: 기계 판독용 에러 코드 ({@link ErrorCodes})</li>
 *   <li>statusCode: HTTP 유사 상태 코드 (선택, 재시도 분류에 사용)</li>
 *   <li>context: 진단용 부가 정보</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FlowException extends RuntimeException {

    private final String code;
    private final Integer statusCode;
    private final Map<String, Object> context;

    public FlowException(String code, String message) {
        this(code, message, null, Map.of(), null);
    }

    public FlowException(String code, String message, Throwable cause) {
        this(code, message, null, Map.of(), cause);
    }

    public FlowException(String code, String message, Integer statusCode) {
        this(code, message, statusCode, Map.of(), null);
    }

    /**
     * 전체 생성자.
     *
     * @param code 에러 코드 (null 또는 blank 불가)
     * @param message 메시지
     * @param statusCode 상태 코드 (null 허용)
     * @param context 진단 컨텍스트 (null 허용, null 값 항목 허용)
     * @param cause 원인 (null 허용)
     * @throws IllegalArgumentException code가 null 또는 blank인 경우
     */
    public FlowException(String code, String message, Integer statusCode,
                         Map<String, Object> context, Throwable cause) {
        super(message, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        this.code = code;
        this.statusCode = statusCode;
        this.context = context == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public String getCode() {
        return code;
    }

    /**
     * @return 상태 코드, 없으면 null
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}

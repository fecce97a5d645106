package com.ryuqq.pipeline.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 상태 조정 코어가 발생시키는 모든 예외의 최상위 타입.
 *
 * <p>안정적인 {@link ErrorCode}와 함께 프로젝트 ID, 섹션, 시도한 전이, 잠금 리소스 등의
 * 컨텍스트를 담습니다. 재시도 여부는 {@link #getCategory()}로 결정됩니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class PipelineStateException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> context;

    public PipelineStateException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    public PipelineStateException(ErrorCode errorCode, String message, Map<String, ?> context) {
        this(errorCode, message, context, null);
    }

    public PipelineStateException(ErrorCode errorCode, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        this.errorCode = errorCode;
        this.context = context == null || context.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public ErrorCategory getCategory() {
        return errorCode.category();
    }

    public Severity getSeverity() {
        return errorCode.severity();
    }

    /**
     * 오류 컨텍스트 (불변, 삽입 순서 유지).
     */
    public Map<String, Object> getContext() {
        return context;
    }

    public boolean isRetryable() {
        return getCategory().isRetryable();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + errorCode.code() + "]: " + getMessage();
    }

    static Map<String, Object> context(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return map;
    }
}

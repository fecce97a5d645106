package com.ryuqq.pipeline.core.error;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * 예외를 {@link ErrorCategory}로 분류.
 *
 * <p><strong>분류 순서 (cause 체인을 따라가며 첫 번째로 판정되는 것):</strong></p>
 * <ol>
 *   <li>{@link PipelineStateException}: 오류 코드의 분류</li>
 *   <li>JSON 파싱 오류: FATAL (손상된 레코드)</li>
 *   <li>{@link IOException}, {@link TimeoutException}: TRANSIENT</li>
 *   <li>{@link InterruptedException}: FATAL</li>
 * </ol>
 * <p>판정되지 않으면 메시지를 재시도 가능 패턴과 비교하여 일치하면 TRANSIENT,
 * 아니면 FATAL로 분류합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class ErrorClassifier {

    private static final List<Pattern> DEFAULT_RETRYABLE_PATTERNS = List.of(
        Pattern.compile("timed?\\s*out", Pattern.CASE_INSENSITIVE),
        Pattern.compile("timeout", Pattern.CASE_INSENSITIVE),
        Pattern.compile("temporar(il)?y unavailable", Pattern.CASE_INSENSITIVE),
        Pattern.compile("try again", Pattern.CASE_INSENSITIVE),
        Pattern.compile("resource busy", Pattern.CASE_INSENSITIVE),
        Pattern.compile("too many open files", Pattern.CASE_INSENSITIVE),
        Pattern.compile("rate limit", Pattern.CASE_INSENSITIVE),
        Pattern.compile("connection (reset|refused)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\b(EBUSY|EAGAIN|ETIMEDOUT|ECONNRESET|EMFILE)\\b")
    );

    private final List<Pattern> retryablePatterns;

    /**
     * 기본 재시도 가능 메시지 패턴으로 생성.
     */
    public ErrorClassifier() {
        this(DEFAULT_RETRYABLE_PATTERNS);
    }

    /**
     * 커스텀 재시도 가능 메시지 패턴으로 생성.
     *
     * @param retryablePatterns 알 수 없는 오류에 적용할 패턴
     */
    public ErrorClassifier(List<Pattern> retryablePatterns) {
        if (retryablePatterns == null) {
            throw new IllegalArgumentException("retryablePatterns cannot be null");
        }
        this.retryablePatterns = List.copyOf(retryablePatterns);
    }

    /**
     * 오류 분류.
     *
     * @param error 분류할 예외
     * @return 분류 결과 (null이면 FATAL)
     */
    public ErrorCategory classify(Throwable error) {
        if (error == null) {
            return ErrorCategory.FATAL;
        }
        for (Throwable current = error; current != null; current = nextCause(current)) {
            ErrorCategory known = classifyKnown(current);
            if (known != null) {
                return known;
            }
        }
        for (Throwable current = error; current != null; current = nextCause(current)) {
            if (matchesRetryablePattern(current.getMessage())) {
                return ErrorCategory.TRANSIENT;
            }
        }
        return ErrorCategory.FATAL;
    }

    public boolean isRetryable(Throwable error) {
        return classify(error).isRetryable();
    }

    /**
     * 시도 기록용 오류 코드.
     *
     * @return 코어 예외면 코드 문자열, 아니면 예외 클래스 이름
     */
    public String errorCodeOf(Throwable error) {
        if (error instanceof PipelineStateException) {
            return ((PipelineStateException) error).getErrorCode().code();
        }
        return error == null ? "UNKNOWN" : error.getClass().getSimpleName();
    }

    private ErrorCategory classifyKnown(Throwable error) {
        if (error instanceof PipelineStateException) {
            return ((PipelineStateException) error).getCategory();
        }
        // JsonProcessingException은 IOException의 하위 타입이므로 먼저 검사
        if (error instanceof JsonProcessingException) {
            return ErrorCategory.FATAL;
        }
        if (error instanceof IOException || error instanceof UncheckedIOException
                || error instanceof TimeoutException) {
            return ErrorCategory.TRANSIENT;
        }
        if (error instanceof InterruptedException) {
            return ErrorCategory.FATAL;
        }
        return null;
    }

    private boolean matchesRetryablePattern(String message) {
        if (message == null || message.isEmpty()) {
            return false;
        }
        for (Pattern pattern : retryablePatterns) {
            if (pattern.matcher(message).find()) {
                return true;
            }
        }
        return false;
    }

    private static Throwable nextCause(Throwable error) {
        Throwable cause = error.getCause();
        return cause == error ? null : cause;
    }
}

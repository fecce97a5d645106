package com.ryuqq.pipeline.core.model;

import java.util.regex.Pattern;

/**
 * 프로젝트 상태의 이름 있는 파티션.
 *
 * <p>각 Section은 독립적인 값, 버전, 이력을 가지며 하나의 파일로 저장됩니다.</p>
 *
 * <p><strong>예약된 Section:</strong></p>
 * <ul>
 *   <li>{@link #PROGRESS} - 상태 머신이 현재 파이프라인 상태를 기록하는 Section</li>
 * </ul>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 소문자, 숫자, 하이픈(-), 언더스코어(_)만 허용 (언더스코어로 시작 불가)</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class SectionName {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9\\-_]*$");

    /** 수집된 요구사항 정보. */
    public static final SectionName INFO = new SectionName("info");

    /** 생성된 문서 상태. */
    public static final SectionName DOCUMENTS = new SectionName("documents");

    /** 이슈 목록. */
    public static final SectionName ISSUES = new SectionName("issues");

    /** 파이프라인 진행 상태 (상태 머신 전용). */
    public static final SectionName PROGRESS = new SectionName("progress");

    private final String value;

    private SectionName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SectionName cannot be null or blank");
        }
        if (value.length() > 64) {
            throw new IllegalArgumentException("SectionName length cannot exceed 64 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "SectionName must contain only lowercase letters, digits, hyphen and underscore: " + value
            );
        }
        this.value = value;
    }

    /**
     * SectionName 생성.
     *
     * @param value Section 이름 (예: info, issues)
     * @return SectionName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static SectionName of(String value) {
        return new SectionName(value);
    }

    /**
     * Section 이름 조회.
     *
     * @return Section 이름
     */
    public String getValue() {
        return value;
    }

    /**
     * 상태 머신 전용 Section인지 확인.
     *
     * @return progress Section이면 true
     */
    public boolean isReserved() {
        return PROGRESS.value.equals(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SectionName that = (SectionName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}

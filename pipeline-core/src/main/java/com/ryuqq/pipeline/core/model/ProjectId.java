package com.ryuqq.pipeline.core.model;

import java.util.regex.Pattern;

/**
 * 프로젝트의 안정적인 식별자.
 *
 * <p>ProjectId는 상태 저장소에서 프로젝트 네임스페이스(디렉터리)를 결정하므로
 * 파일 경로로 안전하게 사용할 수 있는 문자만 허용합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class ProjectId {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_]+$");

    private final String value;

    private ProjectId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ProjectId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ProjectId length cannot exceed 255 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "ProjectId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed"
            );
        }
        this.value = value;
    }

    /**
     * ProjectId 생성.
     *
     * @param value ProjectId 값 (예: "001")
     * @return ProjectId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ProjectId of(String value) {
        return new ProjectId(value);
    }

    /**
     * ProjectId 값 조회.
     *
     * @return ProjectId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProjectId that = (ProjectId) o;
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

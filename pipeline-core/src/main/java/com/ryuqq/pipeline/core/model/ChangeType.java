package com.ryuqq.pipeline.core.model;

/**
 * Section 변경 종류.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum ChangeType {

    /** Section 최초 쓰기. */
    CREATE,

    /** 기존 Section 갱신. */
    UPDATE,

    /** 프로젝트 삭제로 인한 Section 제거. */
    DELETE
}

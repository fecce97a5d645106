package com.ryuqq.pipeline.core.config;

/**
 * 오래된(stale) 잠금을 만났을 때의 처리 방식.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum StaleLockPolicy {

    /**
     * 탈취 가드를 잡은 뒤 즉시 잠금 레코드를 교체합니다.
     */
    FORCE_TAKEOVER,

    /**
     * 해제 요청 파일을 남기고 보유자가 스스로 놓기를 기다린 뒤, 시간이 지나면 교체합니다.
     */
    COOPERATIVE_THEN_FORCE
}

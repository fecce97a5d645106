package com.ryuqq.pipeline.core.error;

/**
 * 보유 중이던 잠금을 잃음 (LOCK-002, TRANSIENT).
 *
 * <p>하트비트 갱신 실패, 다른 프로세스의 탈취, 협조적 해제 요청 수락 등으로 발생합니다.
 * 쓰기 도중 발생하면 해당 쓰기는 커밋되지 않습니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class LockLostException extends PipelineStateException {

    private final String resource;

    public LockLostException(String resource, String holderId, String reason) {
        super(ErrorCode.LOCK_LOST,
            "Lock lost on " + resource + " (holder: " + holderId + "): " + reason,
            context("resource", resource, "holderId", holderId));
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}

package com.ryuqq.pipeline.core.model;

/**
 * 리소스 경로에 1:1로 묶인 잠금 레코드.
 *
 * <p>잠금 파일에 JSON으로 저장되며, 보유자 식별자와 heartbeat 시각을 담습니다.
 * {@code generation}은 stale 잠금을 탈취할 때마다 증가하여 ABA 문제를 방지합니다.</p>
 *
 * <p><strong>Stale 판정:</strong></p>
 * <pre>
 * now - lastHeartbeat &gt; heartbeatTimeoutMs
 * </pre>
 *
 * <p>프로세스 간 시계 차이(clock skew)가 있으면 살아 있는 보유자의 잠금도
 * stale로 보일 수 있습니다. 이는 보정하지 않는 알려진 한계입니다.</p>
 *
 * @param resource 잠금 대상 리소스 (잠금 루트 기준 상대 경로)
 * @param holderId 보유자 식별자
 * @param acquiredAt 획득 시각 (epoch 밀리초)
 * @param lastHeartbeat 마지막 heartbeat 시각 (epoch 밀리초)
 * @param expiresAt 예상 만료 시각 (선택, null 가능)
 * @param generation 탈취 세대 (0부터 시작)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record LockRecord(
    String resource,
    String holderId,
    long acquiredAt,
    long lastHeartbeat,
    Long expiresAt,
    long generation
) {

    public LockRecord {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource cannot be null or blank");
        }
        if (holderId == null || holderId.isBlank()) {
            throw new IllegalArgumentException("holderId cannot be null or blank");
        }
        if (generation < 0) {
            throw new IllegalArgumentException("generation must be non-negative (current: " + generation + ")");
        }
    }

    /**
     * 새로 획득한 잠금 레코드 생성.
     *
     * @param resource 리소스
     * @param holderId 보유자
     * @param now 현재 시각 (epoch 밀리초)
     * @param heartbeatTimeoutMs heartbeat 타임아웃
     * @return generation 0 레코드
     */
    public static LockRecord acquired(String resource, String holderId, long now, long heartbeatTimeoutMs) {
        return new LockRecord(resource, holderId, now, now, now + heartbeatTimeoutMs, 0L);
    }

    /**
     * heartbeat가 타임아웃을 넘겼는지 확인.
     *
     * @param now 현재 시각 (epoch 밀리초)
     * @param heartbeatTimeoutMs heartbeat 타임아웃
     * @return stale이면 true
     */
    public boolean isStale(long now, long heartbeatTimeoutMs) {
        return now - lastHeartbeat > heartbeatTimeoutMs;
    }

    /**
     * 보유자 일치 여부.
     */
    public boolean isHeldBy(String candidate) {
        return holderId.equals(candidate);
    }

    /**
     * heartbeat 갱신본 생성.
     */
    public LockRecord renewed(long now, long heartbeatTimeoutMs) {
        return new LockRecord(resource, holderId, acquiredAt, now, now + heartbeatTimeoutMs, generation);
    }

    /**
     * 다른 보유자가 탈취한 다음 세대 레코드 생성.
     */
    public LockRecord takenOverBy(String newHolderId, long now, long heartbeatTimeoutMs) {
        return new LockRecord(resource, newHolderId, now, now, now + heartbeatTimeoutMs, generation + 1);
    }
}

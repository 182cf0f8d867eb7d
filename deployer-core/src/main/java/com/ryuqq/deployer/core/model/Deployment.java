package com.ryuqq.deployer.core.model;

import java.time.Instant;

/**
 * App을 한 Release에서 다른 Release로 옮기는 관리형 전환.
 *
 * <p>Admission 단계에서 한 번 생성되며, id와 createdAt은 저장 시점에 채워집니다.
 * finishedAt은 엔진이 terminal 성공 또는 terminal 실패 시점에 정확히 한 번 설정하고,
 * 그 외 필드는 생성 후 변하지 않습니다.</p>
 *
 * <p><strong>finishedAt 전이 규칙:</strong></p>
 * <pre>
 * null ──(markFinished)──► set
 *
 * 금지된 전이:
 * - set → set ❌ (두 번째 설정)
 * - set → null ❌
 * </pre>
 *
 * @param id 배포 식별자 (admission 전에는 null 가능)
 * @param appId App 식별자
 * @param oldReleaseId 현재 Release
 * @param newReleaseId 목표 Release
 * @param strategy 배포 전략
 * @param createdAt 저장 시각 (저장 전 null)
 * @param finishedAt 종료 시각 (진행 중이면 null)
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public record Deployment(
    String id,
    String appId,
    String oldReleaseId,
    String newReleaseId,
    StrategyKind strategy,
    Instant createdAt,
    Instant finishedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException appId, newReleaseId 또는 strategy가 없는 경우
     */
    public Deployment {
        if (appId == null || appId.isBlank()) {
            throw new IllegalArgumentException("appId cannot be null or blank");
        }
        if (newReleaseId == null || newReleaseId.isBlank()) {
            throw new IllegalArgumentException("newReleaseId cannot be null or blank");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (id != null && id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
    }

    /**
     * 아직 저장되지 않은 Deployment 생성.
     *
     * @param appId App 식별자
     * @param oldReleaseId 현재 Release
     * @param newReleaseId 목표 Release
     * @param strategy 배포 전략
     * @return id/createdAt이 비어있는 Deployment
     */
    public static Deployment of(String appId, String oldReleaseId, String newReleaseId, StrategyKind strategy) {
        return new Deployment(null, appId, oldReleaseId, newReleaseId, strategy, null, null);
    }

    /**
     * 종료 여부 확인.
     *
     * @return finishedAt이 설정된 경우 true
     */
    public boolean isFinished() {
        return finishedAt != null;
    }

    /**
     * id만 변경한 새 인스턴스 생성.
     */
    public Deployment withId(String id) {
        return new Deployment(id, appId, oldReleaseId, newReleaseId, strategy, createdAt, finishedAt);
    }

    /**
     * createdAt만 변경한 새 인스턴스 생성.
     */
    public Deployment withCreatedAt(Instant createdAt) {
        return new Deployment(id, appId, oldReleaseId, newReleaseId, strategy, createdAt, finishedAt);
    }

    /**
     * finishedAt 설정 (한 번만 허용).
     *
     * @param finishedAt 종료 시각
     * @return finishedAt이 설정된 새 인스턴스
     * @throws IllegalArgumentException finishedAt이 null인 경우
     * @throws IllegalStateException 이미 종료된 경우
     */
    public Deployment finish(Instant finishedAt) {
        if (finishedAt == null) {
            throw new IllegalArgumentException("finishedAt cannot be null");
        }
        if (isFinished()) {
            throw new IllegalStateException(
                "Deployment " + id + " already finished at " + this.finishedAt
            );
        }
        return new Deployment(id, appId, oldReleaseId, newReleaseId, strategy, createdAt, finishedAt);
    }
}

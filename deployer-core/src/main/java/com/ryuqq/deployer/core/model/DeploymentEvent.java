package com.ryuqq.deployer.core.model;

import java.time.Instant;

/**
 * 확인된 배포 단계 하나를 기록하는 영속 이벤트.
 *
 * <p>id는 append 시점에 부여되는 전역 단조 증가 시퀀스입니다. 한 Deployment의 이벤트끼리는
 * id 순서가 보장되지만, 서로 다른 Deployment 간 순서는 보장되지 않습니다.</p>
 *
 * <p>append 전의 이벤트(draft)는 id = 0, createdAt = null 입니다.
 * jobType/jobState는 어떤 단계도 시도하기 전에 실패한 FAILED 이벤트에서만 null일 수 있습니다.</p>
 *
 * @param id 전역 시퀀스 (draft는 0)
 * @param deploymentId 배포 식별자
 * @param releaseId 단계가 적용된 Release
 * @param jobType 프로세스 타입
 * @param jobState 확인된 Job 상태
 * @param status 배포 진행 상태
 * @param createdAt 저장 시각 (draft는 null)
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public record DeploymentEvent(
    long id,
    String deploymentId,
    String releaseId,
    String jobType,
    JobState jobState,
    DeploymentStatus status,
    Instant createdAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 음수이거나 필수 값이 없는 경우
     */
    public DeploymentEvent {
        if (id < 0) {
            throw new IllegalArgumentException("id must be non-negative (current: " + id + ")");
        }
        if (deploymentId == null || deploymentId.isBlank()) {
            throw new IllegalArgumentException("deploymentId cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (status != DeploymentStatus.FAILED && (jobType == null || jobState == null)) {
            throw new IllegalArgumentException("jobType and jobState are required for " + status + " events");
        }
    }

    /**
     * append 전 이벤트 생성.
     *
     * @param deploymentId 배포 식별자
     * @param releaseId Release 식별자
     * @param jobType 프로세스 타입
     * @param jobState Job 상태
     * @param status 배포 진행 상태
     * @return draft 이벤트
     */
    public static DeploymentEvent draft(
        String deploymentId,
        String releaseId,
        String jobType,
        JobState jobState,
        DeploymentStatus status
    ) {
        return new DeploymentEvent(0L, deploymentId, releaseId, jobType, jobState, status, null);
    }

    /**
     * 저장소가 부여한 id와 시각을 채운 새 인스턴스 생성.
     *
     * @param id 전역 시퀀스 (1 이상)
     * @param createdAt 저장 시각
     * @return 영속 이벤트
     */
    public DeploymentEvent persisted(long id, Instant createdAt) {
        if (id <= 0) {
            throw new IllegalArgumentException("persisted id must be positive (current: " + id + ")");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        return new DeploymentEvent(id, deploymentId, releaseId, jobType, jobState, status, createdAt);
    }

    /**
     * append 전 이벤트인지 확인.
     *
     * @return id가 0인 경우 true
     */
    public boolean isDraft() {
        return id == 0L;
    }
}

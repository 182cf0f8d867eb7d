package com.ryuqq.deployer.core.model;

/**
 * Scheduler가 비동기로 보고하는 Job 생명주기 이벤트.
 *
 * <p>JobEvent는 휘발성이며 core가 그대로 저장하지 않습니다. 이벤트 스트림은 at-least-once,
 * 순서 무보장이며 중복을 포함할 수 있습니다.</p>
 *
 * @param appId App 식별자
 * @param releaseId 이벤트를 발생시킨 Job의 Release
 * @param processType 프로세스 타입 (예: web, worker)
 * @param state Job 상태
 * @param jobId Job 식별자
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public record JobEvent(
    String appId,
    String releaseId,
    String processType,
    JobState state,
    String jobId
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null인 경우
     */
    public JobEvent {
        if (appId == null || appId.isBlank()) {
            throw new IllegalArgumentException("appId cannot be null or blank");
        }
        if (processType == null || processType.isBlank()) {
            throw new IllegalArgumentException("processType cannot be null or blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        // releaseId, jobId는 null 허용 (scheduler가 채우지 못하는 경우)
    }
}

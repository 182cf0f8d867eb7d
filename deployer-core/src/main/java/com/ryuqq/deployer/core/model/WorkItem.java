package com.ryuqq.deployer.core.model;

import java.util.UUID;

/**
 * At-least-once 작업 큐의 단위 메시지.
 *
 * @param itemId 메시지 식별자 (ack/nack 추적용)
 * @param jobType 작업 종류 (예: "Deployment")
 * @param payload 직렬화된 작업 인자 (JSON)
 * @param enqueuedAt 큐 수락 시각 (epoch millis)
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public record WorkItem(
    String itemId,
    String jobType,
    String payload,
    long enqueuedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 없거나 enqueuedAt이 음수인 경우
     */
    public WorkItem {
        if (itemId == null || itemId.isBlank()) {
            throw new IllegalArgumentException("itemId cannot be null or blank");
        }
        if (jobType == null || jobType.isBlank()) {
            throw new IllegalArgumentException("jobType cannot be null or blank");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (enqueuedAt < 0) {
            throw new IllegalArgumentException("enqueuedAt must be non-negative (current: " + enqueuedAt + ")");
        }
    }

    /**
     * 현재 시각으로 새 WorkItem 생성 (itemId는 UUID).
     *
     * @param jobType 작업 종류
     * @param payload 작업 인자
     * @return WorkItem 인스턴스
     */
    public static WorkItem now(String jobType, String payload) {
        return new WorkItem(UUID.randomUUID().toString(), jobType, payload, System.currentTimeMillis());
    }
}

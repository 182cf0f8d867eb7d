package com.ryuqq.deployer.core.outcome;

/**
 * 대기가 기대를 채우지 못한 사유.
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public enum UnmetReason {

    /**
     * 이벤트 스트림이 닫히거나 오류로 끊김. 완료를 가정할 수 없음.
     */
    STREAM_CLOSED,

    /**
     * 어떤 타입이든 crashed 이벤트가 관측됨 (terminal failure).
     */
    CRASHED,

    /**
     * 외부 취소 (스레드 인터럽트, deadline 초과).
     */
    CANCELLED
}

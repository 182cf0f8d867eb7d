package com.ryuqq.deployer.core.model;

/**
 * DeploymentEvent에 기록되는 배포 진행 상태.
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public enum DeploymentStatus {

    PENDING("pending"),

    RUNNING("running"),

    COMPLETE("complete"),

    FAILED("failed");

    private final String wireName;

    DeploymentStatus(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 외부 표현 조회.
     *
     * @return wire name (예: "running")
     */
    public String wireName() {
        return wireName;
    }

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETE 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}

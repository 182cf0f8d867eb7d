package com.ryuqq.deployer.core.model;

/**
 * Scheduler가 보고하는 Job(프로세스 인스턴스)의 생명주기 상태.
 *
 * <p>{@link #CRASHED}는 terminal-failure 상태입니다. 교체 도중 어떤 타입이든 crash가 관측되면
 * 새 Release가 정상 기동하지 못한 것으로 보고 배포를 즉시 중단합니다.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public enum JobState {

    /**
     * 기동 중.
     */
    STARTING("starting"),

    /**
     * 기동 완료 (트래픽 처리 가능).
     */
    UP("up"),

    /**
     * 정상 종료.
     */
    DOWN("down"),

    /**
     * 비정상 종료 (terminal failure).
     */
    CRASHED("crashed");

    private final String wireName;

    JobState(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 외부 표현(소문자) 조회.
     *
     * @return wire name (예: "up")
     */
    public String wireName() {
        return wireName;
    }

    /**
     * 배포 중단 사유가 되는 상태인지 확인.
     *
     * @return CRASHED인 경우 true
     */
    public boolean isTerminalFailure() {
        return this == CRASHED;
    }

    /**
     * wire name으로 JobState 조회.
     *
     * @param wireName 소문자 상태 이름
     * @return JobState
     * @throws IllegalArgumentException 알 수 없는 이름인 경우
     */
    public static JobState fromWireName(String wireName) {
        for (JobState state : values()) {
            if (state.wireName.equals(wireName)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown job state: " + wireName);
    }
}

package com.ryuqq.deployer.core.statemachine;

/**
 * Live tail 상태 전이 검증 유틸리티.
 *
 * <p>{@link TailState}에 정의된 전이 규칙만 허용하고, 그 외 전이는 예외로 거부합니다.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이 검증.
     *
     * @param from 현재 상태
     * @param to 다음 상태
     * @throws IllegalArgumentException 상태가 null인 경우
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    public static void validate(TailState from, TailState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        // 종료 상태에서는 어디로도 전이 불가
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case CONNECTING -> to == TailState.READY || to == TailState.CLOSED;
            case READY -> to == TailState.TAILING || to == TailState.CLOSED;
            case TAILING -> to == TailState.CLOSED;
            case CLOSED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 검증 후 다음 상태 반환.
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return next
     */
    public static TailState transition(TailState current, TailState next) {
        validate(current, next);
        return next;
    }
}

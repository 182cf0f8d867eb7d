package com.ryuqq.deployer.core.statemachine;

/**
 * Live tail 세션의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>CONNECTING → READY (wake-up 구독 준비 완료)</li>
 *   <li>READY → TAILING (첫 keep-alive 전송 후 실시간 전달 시작)</li>
 *   <li>CONNECTING / READY / TAILING → CLOSED (종료)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * CONNECTING ──────────────┐
 *    │                     │
 *    ▼ (Connected)         │
 * READY ───────────────────┤
 *    │                     │
 *    ▼ (keep-alive)        │
 * TAILING ─────────────────┤
 *                          ▼
 *                       CLOSED
 *
 * 금지된 전이:
 * - CLOSED → * ❌
 * - TAILING → READY ❌
 * - READY → CONNECTING ❌
 * </pre>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public enum TailState {

    /**
     * wake-up 구독이 아직 준비되지 않음 (실시간 전달 불가).
     */
    CONNECTING,

    /**
     * 구독 준비 완료.
     */
    READY,

    /**
     * 실시간 전달 중.
     */
    TAILING,

    /**
     * 종료.
     */
    CLOSED;

    /**
     * 종료 상태인지 확인.
     *
     * @return CLOSED인 경우 true
     */
    public boolean isTerminal() {
        return this == CLOSED;
    }
}

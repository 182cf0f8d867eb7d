package com.ryuqq.deployer.application.tail;

/**
 * LiveTail 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>keepAliveIntervalMs: 유휴 상태에서 keep-alive를 보내는 간격 (기본 30000ms). 이 주기마다 로그도 다시 조회합니다.</li>
 *   <li>pollIntervalMs: wake-up 구독을 한 번 기다리는 최대 시간 (기본 1000ms)</li>
 * </ul>
 *
 * <p>pollIntervalMs는 keepAliveIntervalMs보다 클 수 없습니다.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 * @param keepAliveIntervalMs keep-alive 간격 (밀리초, 양수)
 * @param pollIntervalMs 구독 대기 간격 (밀리초, 양수)
 */
public record LiveTailConfig(long keepAliveIntervalMs, long pollIntervalMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: keepAliveIntervalMs=30000ms, pollIntervalMs=1000ms</p>
     */
    public LiveTailConfig() {
        this(30000, 1000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LiveTailConfig {
        if (keepAliveIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "keepAliveIntervalMs must be positive (current: " + keepAliveIntervalMs + ")"
            );
        }
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollIntervalMs must be positive (current: " + pollIntervalMs + ")"
            );
        }
        if (pollIntervalMs > keepAliveIntervalMs) {
            throw new IllegalArgumentException(
                "pollIntervalMs (" + pollIntervalMs + ") must not exceed keepAliveIntervalMs (" + keepAliveIntervalMs + ")"
            );
        }
    }

    /**
     * keepAliveIntervalMs만 변경한 새 인스턴스 생성.
     *
     * @param keepAliveIntervalMs 새로운 keep-alive 간격
     * @return 새 LiveTailConfig 인스턴스
     */
    public LiveTailConfig withKeepAliveIntervalMs(long keepAliveIntervalMs) {
        return new LiveTailConfig(keepAliveIntervalMs, this.pollIntervalMs);
    }

    /**
     * pollIntervalMs만 변경한 새 인스턴스 생성.
     *
     * @param pollIntervalMs 새로운 구독 대기 간격
     * @return 새 LiveTailConfig 인스턴스
     */
    public LiveTailConfig withPollIntervalMs(long pollIntervalMs) {
        return new LiveTailConfig(this.keepAliveIntervalMs, pollIntervalMs);
    }
}

package com.ryuqq.deployer.core.outcome;

import com.ryuqq.deployer.core.model.JobEvent;
import com.ryuqq.deployer.core.model.JobState;

import java.util.Map;

/**
 * 실패 결과.
 *
 * <p>어떤 기대가 왜 채워지지 않았는지를 나타냅니다.</p>
 *
 * @param reason 실패 사유
 * @param remaining 채워지지 않은 기대 (type → state → 남은 count)
 * @param trigger 대기를 중단시킨 이벤트 (CRASHED인 경우, 그 외 null)
 * @param cause 원인 예외 (STREAM_CLOSED/CANCELLED인 경우, null 가능)
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public record Unmatched(
    UnmetReason reason,
    Map<String, Map<JobState, Integer>> remaining,
    JobEvent trigger,
    Throwable cause
) implements WaitOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException reason 또는 remaining이 null이거나, CRASHED인데 trigger가 없는 경우
     */
    public Unmatched {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        remaining = Tallies.copyOf(remaining);
        if (reason == UnmetReason.CRASHED && trigger == null) {
            throw new IllegalArgumentException("CRASHED outcome requires the crash event");
        }
    }

    /**
     * crash 관측으로 인한 실패.
     */
    public static Unmatched crashed(Map<String, Map<JobState, Integer>> remaining, JobEvent crash) {
        return new Unmatched(UnmetReason.CRASHED, remaining, crash, null);
    }

    /**
     * 스트림 종료/오류로 인한 실패.
     */
    public static Unmatched streamClosed(Map<String, Map<JobState, Integer>> remaining, Throwable cause) {
        return new Unmatched(UnmetReason.STREAM_CLOSED, remaining, null, cause);
    }

    /**
     * 외부 취소로 인한 실패.
     */
    public static Unmatched cancelled(Map<String, Map<JobState, Integer>> remaining, Throwable cause) {
        return new Unmatched(UnmetReason.CANCELLED, remaining, null, cause);
    }
}

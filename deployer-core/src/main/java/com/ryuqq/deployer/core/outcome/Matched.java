package com.ryuqq.deployer.core.outcome;

import com.ryuqq.deployer.core.model.JobState;

import java.util.Map;

/**
 * 성공 결과.
 *
 * <p>기대한 (type, state) 항목이 모두 0에 도달했음을 나타냅니다.</p>
 *
 * @param confirmed 확인된 이벤트 집계 (type → state → count)
 * @param eventsConsumed 대기 중 소비한 이벤트 수 (무시된 이벤트 포함)
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public record Matched(
    Map<String, Map<JobState, Integer>> confirmed,
    int eventsConsumed
) implements WaitOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException confirmed가 null이거나 eventsConsumed가 음수인 경우
     */
    public Matched {
        confirmed = Tallies.copyOf(confirmed);
        if (eventsConsumed < 0) {
            throw new IllegalArgumentException("eventsConsumed must be non-negative (current: " + eventsConsumed + ")");
        }
    }
}

package com.ryuqq.deployer.application.engine;

import com.ryuqq.deployer.core.model.Formation;
import com.ryuqq.deployer.core.model.JobState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * 배포 계획의 한 단계: formation 덮어쓰기 + 확인 이벤트 기대치.
 *
 * <p>기대치는 항상 {@code formation.releaseId()} release로 범위가 제한됩니다.</p>
 *
 * @param formation 덮어쓸 전체 formation
 * @param expected 이 단계를 확인하는 type → state → count
 * @author Deployer Team
 * @since 1.0.0
 */
public record Step(
    Formation formation,
    Map<String, Map<JobState, Integer>> expected
) {

    public Step {
        if (formation == null) {
            throw new IllegalArgumentException("formation cannot be null");
        }
        if (expected == null) {
            throw new IllegalArgumentException("expected cannot be null");
        }
        TreeMap<String, Map<JobState, Integer>> copy = new TreeMap<>();
        for (Map.Entry<String, Map<JobState, Integer>> entry : expected.entrySet()) {
            EnumMap<JobState, Integer> states = new EnumMap<>(JobState.class);
            states.putAll(entry.getValue());
            copy.put(entry.getKey(), Collections.unmodifiableMap(states));
        }
        expected = Collections.unmodifiableMap(copy);
    }

    /**
     * 단일 (type, state) 기대치를 가진 단계 생성.
     *
     * @param formation 덮어쓸 formation
     * @param processType process type
     * @param state 기대 상태
     * @param count 기대 개수
     * @return Step
     */
    public static Step of(Formation formation, String processType, JobState state, int count) {
        return new Step(formation, Map.of(processType, Map.of(state, count)));
    }

    /**
     * 기대치가 범위로 삼는 release.
     *
     * @return release id
     */
    public String releaseId() {
        return formation.releaseId();
    }
}

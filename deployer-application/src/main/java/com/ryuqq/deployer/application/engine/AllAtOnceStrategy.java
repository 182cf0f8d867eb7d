package com.ryuqq.deployer.application.engine;

import com.ryuqq.deployer.core.model.Deployment;
import com.ryuqq.deployer.core.model.Formation;
import com.ryuqq.deployer.core.model.JobState;
import com.ryuqq.deployer.core.model.StrategyKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 모든 unit을 한 번에 교체하는 전략.
 *
 * <p>두 단계로 실행됩니다:</p>
 * <ol>
 *   <li>새 release에 이전 count 전체를 기록 → type별 {@code up} N개 대기</li>
 *   <li>이전 release의 모든 type을 0으로 기록 → type별 {@code down} N개 대기</li>
 * </ol>
 *
 * <p>교체 중에는 일시적으로 2N개의 unit이 실행됩니다.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public final class AllAtOnceStrategy implements Strategy {

    @Override
    public StrategyKind kind() {
        return StrategyKind.ALL_AT_ONCE;
    }

    @Override
    public List<Step> plan(Deployment deployment, Formation oldFormation) {
        TreeMap<String, Integer> started = new TreeMap<>();
        TreeMap<String, Integer> stopped = new TreeMap<>();
        Map<String, Map<JobState, Integer>> ups = new LinkedHashMap<>();
        Map<String, Map<JobState, Integer>> downs = new LinkedHashMap<>();

        for (Map.Entry<String, Integer> process : oldFormation.processes().entrySet()) {
            stopped.put(process.getKey(), 0);
            if (process.getValue() > 0) {
                started.put(process.getKey(), process.getValue());
                ups.put(process.getKey(), Map.of(JobState.UP, process.getValue()));
                downs.put(process.getKey(), Map.of(JobState.DOWN, process.getValue()));
            }
        }
        if (started.isEmpty()) {
            return List.of();
        }

        return List.of(
            new Step(new Formation(deployment.appId(), deployment.newReleaseId(), started), ups),
            new Step(new Formation(oldFormation.appId(), oldFormation.releaseId(), stopped), downs)
        );
    }
}

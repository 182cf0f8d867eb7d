package com.ryuqq.deployer.application.engine;

import com.ryuqq.deployer.core.model.Deployment;
import com.ryuqq.deployer.core.model.Formation;
import com.ryuqq.deployer.core.model.JobState;
import com.ryuqq.deployer.core.model.StrategyKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 한 번에 한 unit씩 교체하는 전략.
 *
 * <p>process type을 사전순으로 방문하고, type마다 N번 반복합니다:</p>
 * <ol>
 *   <li>새 release의 count +1 → 새 formation 덮어쓰기 → {@code up} 1개 대기</li>
 *   <li>이전 release의 count -1 → 이전 formation 덮어쓰기 → {@code down} 1개 대기</li>
 * </ol>
 *
 * <p>한 type을 끝까지 교체한 뒤 다음 type으로 넘어가며, 동시에 교체 중인 unit은 최대 1개입니다.
 * 따라서 type t의 총 count는 항상 N 또는 N+1입니다.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public final class OneByOneStrategy implements Strategy {

    @Override
    public StrategyKind kind() {
        return StrategyKind.ONE_BY_ONE;
    }

    @Override
    public List<Step> plan(Deployment deployment, Formation oldFormation) {
        Formation next = Formation.empty(deployment.appId(), deployment.newReleaseId());
        Formation old = oldFormation;
        List<Step> steps = new ArrayList<>();

        for (Map.Entry<String, Integer> process : oldFormation.processes().entrySet()) {
            String type = process.getKey();
            for (int i = 0; i < process.getValue(); i++) {
                next = next.withCount(type, next.count(type) + 1);
                steps.add(Step.of(next, type, JobState.UP, 1));

                old = old.withCount(type, old.count(type) - 1);
                steps.add(Step.of(old, type, JobState.DOWN, 1));
            }
        }
        return steps;
    }
}

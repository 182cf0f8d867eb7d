package com.ryuqq.deployer.application.engine;

import com.ryuqq.deployer.core.model.Deployment;
import com.ryuqq.deployer.core.model.Formation;
import com.ryuqq.deployer.core.model.StrategyKind;

import java.util.List;

/**
 * 배포 전략.
 *
 * <p>전략은 formation 변경 순서와 묶음만 결정합니다. 실행 (mutate → wait → emit)은
 * {@link StrategyEngine}이 담당하므로 전략은 계획만 만들고 I/O를 수행하지 않습니다.</p>
 *
 * <p>전략 종류는 닫힌 집합이며 {@link #forKind(StrategyKind)}가 {@link StrategyKind}를
 * 빠짐없이 매핑합니다.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public sealed interface Strategy permits OneByOneStrategy, AllAtOnceStrategy {

    /**
     * 이 전략의 종류.
     *
     * @return StrategyKind
     */
    StrategyKind kind();

    /**
     * 배포 계획 생성.
     *
     * @param deployment 대상 배포
     * @param oldFormation 이전 release의 현재 formation
     * @return 순서대로 실행할 단계 목록 (비어 있을 수 있음)
     */
    List<Step> plan(Deployment deployment, Formation oldFormation);

    /**
     * 전략 종류에 해당하는 구현 반환.
     *
     * @param kind 전략 종류
     * @return Strategy
     * @throws IllegalArgumentException kind가 null인 경우
     */
    static Strategy forKind(StrategyKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return switch (kind) {
            case ONE_BY_ONE -> new OneByOneStrategy();
            case ALL_AT_ONCE -> new AllAtOnceStrategy();
        };
    }
}

/**
 * 배포 전략 실행 엔진.
 *
 * <p>전략은 계획({@link com.ryuqq.deployer.application.engine.Step} 목록)만 만들고,
 * {@link com.ryuqq.deployer.application.engine.StrategyEngine}이 mutate → wait → emit 순서로 실행합니다.</p>
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.deployer.application.engine.StrategyEngine} - 계획 실행, 실패 처리</li>
 *   <li>{@link com.ryuqq.deployer.application.engine.Strategy} - 닫힌 전략 집합</li>
 *   <li>{@link com.ryuqq.deployer.application.engine.OneByOneStrategy} - 한 unit씩 교체</li>
 *   <li>{@link com.ryuqq.deployer.application.engine.AllAtOnceStrategy} - 한 번에 교체</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.deployer.application.engine;

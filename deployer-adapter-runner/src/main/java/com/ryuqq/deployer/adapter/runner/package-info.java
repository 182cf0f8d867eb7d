/**
 * Runner Adapter Layer - Runtime 구현체.
 *
 * <p>이 패키지는 Runtime 인터페이스의 구체적인 구현체를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.deployer.adapter.runner.DeploymentWorker} - 배포 작업 큐 소비 및 실행</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DeploymentWorker)
 *   ↓ implements
 * application (Runtime interface, StrategyEngine)
 *   ↓ depends on
 * core (Deployment, WorkItem, WorkQueue, DeploymentStore)
 * </pre>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
package com.ryuqq.deployer.adapter.runner;

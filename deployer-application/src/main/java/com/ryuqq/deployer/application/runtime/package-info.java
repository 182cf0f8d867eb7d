/**
 * Runtime 인터페이스.
 *
 * <p>이 패키지는 배포 작업 큐 소비를 위한 Runtime 인터페이스를 제공합니다.</p>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 deployer-adapter-runner 모듈의 {@code DeploymentWorker}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.deployer.application.runtime;

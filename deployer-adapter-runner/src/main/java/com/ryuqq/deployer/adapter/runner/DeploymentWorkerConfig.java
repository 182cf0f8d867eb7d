package com.ryuqq.deployer.adapter.runner;

/**
 * DeploymentWorker 설정 (불변 record).
 *
 * <p>이 record는 DeploymentWorker의 동작을 제어하는 설정값을 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollingIntervalMs: 큐 폴링 간격 (기본 100ms)</li>
 *   <li>batchSize: 한 번에 dequeue할 작업 수 (기본 10)</li>
 *   <li>concurrency: 동시에 실행하는 배포 수 (기본 5)</li>
 *   <li>maxDeploymentTimeMs: 배포 하나의 최대 실행 시간 (기본 0 = 제한 없음)</li>
 *   <li>dlqEnabled: 실패한 작업의 DLQ 전송 여부 (기본 true)</li>
 * </ul>
 *
 * <p><strong>실행 시간 제한:</strong></p>
 * <p>배포 확인 대기에는 자체 타임아웃이 없습니다. maxDeploymentTimeMs를 양수로 지정하면
 * 시간 초과 시 실행 스레드를 인터럽트하여 배포를 취소합니다.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 * @param pollingIntervalMs 큐 폴링 간격 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param concurrency 동시 실행 수 (1 이상이어야 함)
 * @param maxDeploymentTimeMs 최대 실행 시간 (밀리초, 0이면 제한 없음)
 * @param dlqEnabled DLQ 전송 활성화 여부
 */
public record DeploymentWorkerConfig(
    long pollingIntervalMs,
    int batchSize,
    int concurrency,
    long maxDeploymentTimeMs,
    boolean dlqEnabled
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollingIntervalMs=100ms, batchSize=10, concurrency=5,
     * maxDeploymentTimeMs=0 (제한 없음), dlqEnabled=true</p>
     */
    public DeploymentWorkerConfig() {
        this(100, 10, 5, 0, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DeploymentWorkerConfig {
        if (pollingIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollingIntervalMs must be positive (current: " + pollingIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (maxDeploymentTimeMs < 0) {
            throw new IllegalArgumentException(
                "maxDeploymentTimeMs must be non-negative (current: " + maxDeploymentTimeMs + ")"
            );
        }
    }

    /**
     * 실행 시간 제한 여부.
     *
     * @return maxDeploymentTimeMs가 양수면 true
     */
    public boolean hasDeadline() {
        return maxDeploymentTimeMs > 0;
    }

    public DeploymentWorkerConfig withPollingIntervalMs(long pollingIntervalMs) {
        return new DeploymentWorkerConfig(pollingIntervalMs, batchSize, concurrency, maxDeploymentTimeMs, dlqEnabled);
    }

    public DeploymentWorkerConfig withBatchSize(int batchSize) {
        return new DeploymentWorkerConfig(pollingIntervalMs, batchSize, concurrency, maxDeploymentTimeMs, dlqEnabled);
    }

    public DeploymentWorkerConfig withConcurrency(int concurrency) {
        return new DeploymentWorkerConfig(pollingIntervalMs, batchSize, concurrency, maxDeploymentTimeMs, dlqEnabled);
    }

    public DeploymentWorkerConfig withMaxDeploymentTimeMs(long maxDeploymentTimeMs) {
        return new DeploymentWorkerConfig(pollingIntervalMs, batchSize, concurrency, maxDeploymentTimeMs, dlqEnabled);
    }

    public DeploymentWorkerConfig withDlqEnabled(boolean dlqEnabled) {
        return new DeploymentWorkerConfig(pollingIntervalMs, batchSize, concurrency, maxDeploymentTimeMs, dlqEnabled);
    }
}

package com.ryuqq.deployer.adapter.runner;

import com.ryuqq.deployer.application.admission.DeploymentJobCodec;
import com.ryuqq.deployer.application.engine.StrategyEngine;
import com.ryuqq.deployer.application.runtime.Runtime;
import com.ryuqq.deployer.core.exception.DeploymentFailedException;
import com.ryuqq.deployer.core.exception.NotFoundException;
import com.ryuqq.deployer.core.model.Deployment;
import com.ryuqq.deployer.core.model.Failure;
import com.ryuqq.deployer.core.model.WorkItem;
import com.ryuqq.deployer.core.spi.DeploymentStore;
import com.ryuqq.deployer.core.spi.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 배포 작업 큐 Worker.
 *
 * <p>작업 큐에서 배포 작업을 가져와 {@link StrategyEngine}으로 실행합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * dequeue(batchSize) → [WorkItem1, WorkItem2, ...]
 *   ↓
 * For each WorkItem (worker pool):
 *   1. payload {"id": ...} 디코딩 → store.findById(id)
 *   2. finishedAt != null → ack (재전달된 작업)
 *      이 Worker에서 이미 실행 중 → 건너뜀 (lease 유지, 원래 실행이 ack)
 *   3. engine.execute(deployment)  (maxDeploymentTimeMs > 0이면 deadline 적용)
 *   4. 결과 처리:
 *      - 성공 → ack
 *      - crash (종료 실패) → ack
 *      - 그 외 실패 → DLQ (dlqEnabled=false면 ack)
 * </pre>
 *
 * <p><strong>재시도 정책:</strong></p>
 * <p>배포 단계는 재시도하지 않습니다. 실패한 배포는 finishedAt이 비어 있는 상태로 남고,
 * 운영자가 DLQ 항목을 보고 판단합니다.</p>
 *
 * <p><strong>Deadline:</strong></p>
 * <p>maxDeploymentTimeMs가 양수면 배포를 별도 스레드에서 실행하고, 시간 초과 시
 * {@link Future#cancel(boolean)}로 인터럽트합니다. 엔진은 인터럽트를 취소로 처리하여
 * FAILED 이벤트를 남깁니다.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public final class DeploymentWorker implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(DeploymentWorker.class);

    private static final long CANCEL_GRACE_MS = 5000;

    private final WorkQueue queue;
    private final DeploymentStore store;
    private final StrategyEngine engine;
    private final DeploymentJobCodec codec;
    private final DeploymentWorkerConfig config;
    private final ExecutorService workerExecutor;
    private final ExecutorService deadlineExecutor;
    private final ScheduledExecutorService scheduler;
    private final Set<String> running = ConcurrentHashMap.newKeySet();

    /**
     * 생성자 (기본 codec 사용).
     *
     * @param queue 작업 큐
     * @param store 배포 저장소
     * @param engine 전략 엔진
     * @param config 설정
     */
    public DeploymentWorker(WorkQueue queue, DeploymentStore store, StrategyEngine engine, DeploymentWorkerConfig config) {
        this(queue, store, engine, new DeploymentJobCodec(), config);
    }

    /**
     * 생성자 (의존성 주입).
     *
     * @param queue 작업 큐
     * @param store 배포 저장소
     * @param engine 전략 엔진
     * @param codec 작업 payload codec
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DeploymentWorker(
        WorkQueue queue,
        DeploymentStore store,
        StrategyEngine engine,
        DeploymentJobCodec codec,
        DeploymentWorkerConfig config
    ) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.queue = queue;
        this.store = store;
        this.engine = engine;
        this.codec = codec;
        this.config = config;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency());
        this.deadlineExecutor = config.hasDeadline() ? Executors.newFixedThreadPool(config.concurrency()) : null;
        this.scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @Override
    public void pump() {
        List<WorkItem> items = queue.dequeue(config.batchSize());

        for (WorkItem item : items) {
            workerExecutor.submit(() -> process(item));
        }
    }

    /**
     * pollingIntervalMs 간격으로 pump()를 반복 실행.
     */
    public void start() {
        scheduler.scheduleWithFixedDelay(this::pumpSafely, 0, config.pollingIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("DeploymentWorker started: {}", config);
    }

    /**
     * Worker 종료 (리소스 정리).
     *
     * <p>polling을 멈추고, 진행 중인 배포가 완료되도록 대기합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        scheduler.shutdown();
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
            log.warn("DeploymentWorker did not drain in 60s, interrupting running deployments");
            workerExecutor.shutdownNow();
        }
        if (deadlineExecutor != null) {
            deadlineExecutor.shutdownNow();
        }
        log.info("DeploymentWorker stopped");
    }

    private void pumpSafely() {
        try {
            pump();
        } catch (RuntimeException e) {
            log.error("Failed to dequeue deployment work items", e);
        }
    }

    /**
     * WorkItem 처리 (해석 → 실행 → ACK/DLQ).
     *
     * @param item 처리할 작업
     */
    void process(WorkItem item) {
        if (!DeploymentJobCodec.JOB_TYPE.equals(item.jobType())) {
            deadLetter(item, Failure.of("UNKNOWN_JOB_TYPE", "Unsupported job type: " + item.jobType()));
            return;
        }

        Deployment deployment;
        try {
            deployment = store.findById(codec.decode(item.payload()));
        } catch (IllegalArgumentException e) {
            deadLetter(item, Failure.of("MALFORMED_PAYLOAD", messageOf(e)));
            return;
        } catch (NotFoundException e) {
            deadLetter(item, Failure.of("DEPLOYMENT_NOT_FOUND", messageOf(e)));
            return;
        } catch (RuntimeException e) {
            log.error("Failed to resolve deployment for work item {}", item.itemId(), e);
            queue.nack(item);
            return;
        }

        if (deployment.isFinished()) {
            log.info("Deployment {} already finished at {}, skipping redelivered work item", deployment.id(), deployment.finishedAt());
            queue.ack(item);
            return;
        }

        // 배포 하나당 실행 중인 엔진은 하나
        if (!running.add(deployment.id())) {
            log.info("Deployment {} is already running, leaving redelivered work item {} to the running execution",
                deployment.id(), item.itemId());
            return;
        }

        try {
            execute(item, deployment);
        } finally {
            running.remove(deployment.id());
        }
    }

    private void execute(WorkItem item, Deployment deployment) {
        try {
            run(deployment);
            queue.ack(item);
        } catch (DeploymentFailedException e) {
            if (e.isTerminal()) {
                log.warn("Deployment {} crashed and was marked finished", deployment.id());
                queue.ack(item);
            } else {
                deadLetter(item, Failure.of(e.getReason().name(), messageOf(e), causeOf(e)));
            }
        } catch (DeploymentTimeoutException e) {
            deadLetter(item, Failure.of("DEPLOYMENT_TIMEOUT", e.getMessage()));
        } catch (RuntimeException e) {
            deadLetter(item, Failure.of("DEPLOYMENT_FAILED", messageOf(e), causeOf(e)));
        }
    }

    private void run(Deployment deployment) {
        if (!config.hasDeadline()) {
            engine.execute(deployment);
            return;
        }

        CountDownLatch done = new CountDownLatch(1);
        Future<?> execution = deadlineExecutor.submit(() -> {
            try {
                engine.execute(deployment);
            } finally {
                done.countDown();
            }
        });

        try {
            execution.get(config.maxDeploymentTimeMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            execution.cancel(true);
            awaitCancellation(deployment, done);
            throw new DeploymentTimeoutException(deployment.id(), config.maxDeploymentTimeMs());
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new IllegalStateException("Deployment " + deployment.id() + " failed", e.getCause());
        } catch (InterruptedException e) {
            execution.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for deployment " + deployment.id(), e);
        }
    }

    private void awaitCancellation(Deployment deployment, CountDownLatch done) {
        try {
            if (!done.await(CANCEL_GRACE_MS, TimeUnit.MILLISECONDS)) {
                log.warn("Deployment {} did not stop within {}ms of cancellation", deployment.id(), CANCEL_GRACE_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void deadLetter(WorkItem item, Failure failure) {
        log.error("Work item {} failed: {} - {}", item.itemId(), failure.errorCode(), failure.message());

        if (config.dlqEnabled()) {
            queue.publishToDLQ(item, failure);
        } else {
            queue.ack(item);
        }
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null && !e.getMessage().isBlank() ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String causeOf(Throwable e) {
        Throwable cause = e.getCause();
        return cause == null ? null : cause.getClass().getName() + ": " + cause.getMessage();
    }
}

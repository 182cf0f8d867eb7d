package com.ryuqq.deployer.application.engine;

import com.ryuqq.deployer.application.log.DeploymentEventLog;
import com.ryuqq.deployer.application.matcher.ExpectedEvents;
import com.ryuqq.deployer.application.matcher.JobEventMatcher;
import com.ryuqq.deployer.core.exception.DeploymentFailedException;
import com.ryuqq.deployer.core.model.Deployment;
import com.ryuqq.deployer.core.model.DeploymentEvent;
import com.ryuqq.deployer.core.model.DeploymentStatus;
import com.ryuqq.deployer.core.model.Formation;
import com.ryuqq.deployer.core.model.JobEvent;
import com.ryuqq.deployer.core.model.JobState;
import com.ryuqq.deployer.core.outcome.Matched;
import com.ryuqq.deployer.core.outcome.Unmatched;
import com.ryuqq.deployer.core.outcome.WaitOutcome;
import com.ryuqq.deployer.core.spi.Controller;
import com.ryuqq.deployer.core.spi.DeploymentStore;
import com.ryuqq.deployer.core.spi.JobEventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 배포 계획 실행기.
 *
 * <p>{@link Strategy}가 만든 계획을 순서대로 실행합니다. 엔진 루프는 전략의 종류를 모르며,
 * 각 단계를 동일한 세 가지 기본 동작으로 처리합니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * execute(deployment)
 *   ↓
 * controller.streamJobEvents(appId, 0)     → formation 조회 전에 스트림부터 연결
 *   ↓
 * controller.getFormation(appId, oldRelease)
 *   ↓
 * strategy.plan(deployment, oldFormation)  → [Step1, Step2, ...]
 *   ↓
 * For each Step (엄격히 순차):
 *   1. controller.putFormation(step.formation)   (mutate)
 *   2. matcher.await(stream, step.expected)      (wait)
 *   3. 확인된 (type, state)마다 DeploymentEvent 1개 append  (emit)
 *   ↓
 * store.markFinished(id, now)
 * </pre>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>변경 실패, 스트림 실패, crash, 취소 → 이후 변경 중단, FAILED 이벤트 best-effort append, 예외 전파</li>
 *   <li>crash (scheduler가 보고한 종료 실패) → finishedAt 기록</li>
 *   <li>인프라 실패 (I/O, 스트림 종료, 취소) → finishedAt은 null로 유지</li>
 *   <li>자동 rollback 없음</li>
 * </ul>
 *
 * <p><strong>동시성:</strong></p>
 * <p>배포 하나는 호출 스레드 하나에서 실행됩니다. 같은 app에 대한 동시 배포는 외부 admission에서 막아야 합니다.
 * 취소는 실행 스레드 인터럽트로 전달됩니다.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public class StrategyEngine {

    private static final Logger log = LoggerFactory.getLogger(StrategyEngine.class);

    private final Controller controller;
    private final DeploymentStore deploymentStore;
    private final DeploymentEventLog eventLog;
    private final JobEventMatcher matcher;
    private final Clock clock;

    /**
     * 생성자 (기본 matcher, UTC clock 사용).
     *
     * @param controller controller
     * @param deploymentStore 배포 저장소
     * @param eventLog 배포 이벤트 로그
     */
    public StrategyEngine(Controller controller, DeploymentStore deploymentStore, DeploymentEventLog eventLog) {
        this(controller, deploymentStore, eventLog, new JobEventMatcher(), Clock.systemUTC());
    }

    /**
     * 생성자 (의존성 주입).
     *
     * @param controller controller
     * @param deploymentStore 배포 저장소
     * @param eventLog 배포 이벤트 로그
     * @param matcher job event matcher
     * @param clock finishedAt 기록용 clock
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StrategyEngine(
        Controller controller,
        DeploymentStore deploymentStore,
        DeploymentEventLog eventLog,
        JobEventMatcher matcher,
        Clock clock
    ) {
        if (controller == null) {
            throw new IllegalArgumentException("controller cannot be null");
        }
        if (deploymentStore == null) {
            throw new IllegalArgumentException("deploymentStore cannot be null");
        }
        if (eventLog == null) {
            throw new IllegalArgumentException("eventLog cannot be null");
        }
        if (matcher == null) {
            throw new IllegalArgumentException("matcher cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.controller = controller;
        this.deploymentStore = deploymentStore;
        this.eventLog = eventLog;
        this.matcher = matcher;
        this.clock = clock;
    }

    /**
     * 배포 실행.
     *
     * <p>성공하면 finishedAt이 기록된 상태로 반환합니다.</p>
     *
     * @param deployment 실행할 배포 (저장된 상태여야 함)
     * @throws IllegalArgumentException deployment가 null이거나 id가 없는 경우
     * @throws IllegalStateException 이미 종료된 배포인 경우
     * @throws DeploymentFailedException 확인 대기가 실패한 경우 (crash, 스트림 종료, 취소)
     * @throws RuntimeException controller 또는 저장소 오류
     */
    public void execute(Deployment deployment) {
        if (deployment == null) {
            throw new IllegalArgumentException("deployment cannot be null");
        }
        if (deployment.id() == null) {
            throw new IllegalArgumentException("deployment must be persisted before execution");
        }
        if (deployment.isFinished()) {
            throw new IllegalStateException("Deployment " + deployment.id() + " already finished");
        }

        Strategy strategy = Strategy.forKind(deployment.strategy());
        log.info("Deployment {} started: app={}, {} → {}, strategy={}",
            deployment.id(), deployment.appId(), deployment.oldReleaseId(), deployment.newReleaseId(),
            strategy.kind().wireName());

        Step current = null;
        try (JobEventStream stream = controller.streamJobEvents(deployment.appId(), 0)) {
            Formation oldFormation = controller.getFormation(deployment.appId(), deployment.oldReleaseId());
            List<Step> plan = strategy.plan(deployment, oldFormation);

            for (int i = 0; i < plan.size(); i++) {
                current = plan.get(i);
                controller.putFormation(current.formation());

                WaitOutcome outcome = matcher.await(stream, ExpectedEvents.of(current.releaseId(), current.expected()));
                if (outcome instanceof Unmatched unmatched) {
                    throw new DeploymentFailedException(deployment.id(), unmatched);
                }

                emitConfirmed(deployment, current, (Matched) outcome, i == plan.size() - 1);
                log.info("Deployment {} step {}/{} confirmed: {}", deployment.id(), i + 1, plan.size(), current.expected());
            }
        } catch (RuntimeException e) {
            handleFailure(deployment, current, e);
            throw e;
        }

        deploymentStore.markFinished(deployment.id(), Instant.now(clock));
        log.info("Deployment {} complete", deployment.id());
    }

    private void emitConfirmed(Deployment deployment, Step step, Matched matched, boolean lastStep) {
        int remaining = 0;
        for (Map<JobState, Integer> states : matched.confirmed().values()) {
            remaining += states.size();
        }

        for (Map.Entry<String, Map<JobState, Integer>> type : matched.confirmed().entrySet()) {
            for (JobState state : type.getValue().keySet()) {
                remaining--;
                DeploymentStatus status = lastStep && remaining == 0 ? DeploymentStatus.COMPLETE : DeploymentStatus.RUNNING;
                eventLog.append(DeploymentEvent.draft(deployment.id(), step.releaseId(), type.getKey(), state, status));
            }
        }
    }

    private void handleFailure(Deployment deployment, Step step, RuntimeException error) {
        log.warn("Deployment {} failed: {}", deployment.id(), error.getMessage(), error);

        try {
            eventLog.append(failedEvent(deployment, step, error));
        } catch (RuntimeException e) {
            log.error("Failed to record failure event for deployment {}", deployment.id(), e);
            error.addSuppressed(e);
        }

        if (error instanceof DeploymentFailedException failed && failed.isTerminal()) {
            try {
                deploymentStore.markFinished(deployment.id(), Instant.now(clock));
            } catch (RuntimeException e) {
                log.error("Failed to mark crashed deployment {} finished", deployment.id(), e);
                error.addSuppressed(e);
            }
        }
    }

    private static DeploymentEvent failedEvent(Deployment deployment, Step step, RuntimeException error) {
        if (error instanceof DeploymentFailedException failed && failed.getOutcome().trigger() != null) {
            JobEvent crash = failed.getOutcome().trigger();
            String releaseId = crash.releaseId() != null ? crash.releaseId() : releaseOf(deployment, step);
            return DeploymentEvent.draft(deployment.id(), releaseId, crash.processType(), crash.state(), DeploymentStatus.FAILED);
        }
        if (step == null) {
            return DeploymentEvent.draft(deployment.id(), deployment.newReleaseId(), null, null, DeploymentStatus.FAILED);
        }
        Map.Entry<String, Map<JobState, Integer>> first = step.expected().entrySet().iterator().next();
        JobState state = first.getValue().keySet().iterator().next();
        return DeploymentEvent.draft(deployment.id(), step.releaseId(), first.getKey(), state, DeploymentStatus.FAILED);
    }

    private static String releaseOf(Deployment deployment, Step step) {
        return step == null ? deployment.newReleaseId() : step.releaseId();
    }
}

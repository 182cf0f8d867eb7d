package com.ryuqq.deployer.application.engine;

import com.ryuqq.deployer.adapter.inmemory.channel.InMemoryWakeUpChannel;
import com.ryuqq.deployer.adapter.inmemory.controller.InMemoryController;
import com.ryuqq.deployer.adapter.inmemory.store.InMemoryDeploymentEventStore;
import com.ryuqq.deployer.adapter.inmemory.store.InMemoryDeploymentStore;
import com.ryuqq.deployer.application.log.DeploymentEventLog;
import com.ryuqq.deployer.core.exception.ControllerException;
import com.ryuqq.deployer.core.exception.DeploymentFailedException;
import com.ryuqq.deployer.core.exception.NotFoundException;
import com.ryuqq.deployer.core.model.Deployment;
import com.ryuqq.deployer.core.model.DeploymentEvent;
import com.ryuqq.deployer.core.model.DeploymentStatus;
import com.ryuqq.deployer.core.model.Formation;
import com.ryuqq.deployer.core.model.JobState;
import com.ryuqq.deployer.core.model.StrategyKind;
import com.ryuqq.deployer.core.outcome.UnmetReason;
import com.ryuqq.deployer.core.spi.Controller;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * StrategyEngine 통합 테스트 (in-memory adapter 사용).
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>one-by-one: up/down 교대, 전환 중 실행 중인 unit 수 N 또는 N+1 유지</li>
 *   <li>all-at-once: 새 release 전체 기동 후 기존 release 전체 중지</li>
 *   <li>crash / controller 실패 / 스트림 종료 / 인터럽트 시 failed 이벤트 기록</li>
 *   <li>스트림 구독이 formation 조회보다 먼저 수행됨</li>
 * </ul>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
class StrategyEngineTest {

    private static final String APP = "app";

    private InMemoryController controller;
    private InMemoryDeploymentStore deploymentStore;
    private InMemoryDeploymentEventStore eventStore;
    private DeploymentEventLog eventLog;
    private StrategyEngine engine;

    @BeforeEach
    void setUp() {
        controller = new InMemoryController();
        deploymentStore = new InMemoryDeploymentStore();
        eventStore = new InMemoryDeploymentEventStore();
        eventLog = new DeploymentEventLog(eventStore, new InMemoryWakeUpChannel());
        engine = new StrategyEngine(controller, deploymentStore, eventLog);
    }

    private Deployment persist(String id, StrategyKind strategy) {
        return deploymentStore.insert(Deployment.of(APP, "r1", "r2", strategy).withId(id));
    }

    private List<DeploymentEvent> events(String deploymentId) {
        return eventLog.listSince(deploymentId, 0);
    }

    // ============================================================
    // 1. one-by-one 정상 흐름
    // ============================================================

    @Test
    void execute_one_by_one_web3_up_down_교대_6개_이벤트() {
        // given
        controller.seedFormation(Formation.of(APP, "r1", Map.of("web", 3)));
        Deployment deployment = persist("d1", StrategyKind.ONE_BY_ONE);

        // when
        engine.execute(deployment);

        // then
        assertThat(events("d1"))
            .extracting(DeploymentEvent::releaseId, DeploymentEvent::jobType, DeploymentEvent::jobState, DeploymentEvent::status)
            .containsExactly(
                tuple("r2", "web", JobState.UP, DeploymentStatus.RUNNING),
                tuple("r1", "web", JobState.DOWN, DeploymentStatus.RUNNING),
                tuple("r2", "web", JobState.UP, DeploymentStatus.RUNNING),
                tuple("r1", "web", JobState.DOWN, DeploymentStatus.RUNNING),
                tuple("r2", "web", JobState.UP, DeploymentStatus.RUNNING),
                tuple("r1", "web", JobState.DOWN, DeploymentStatus.COMPLETE)
            );
        assertThat(controller.getFormation(APP, "r1").count("web")).isZero();
        assertThat(controller.getFormation(APP, "r2").count("web")).isEqualTo(3);
        assertThat(deploymentStore.findById("d1").isFinished()).isTrue();
    }

    @Test
    void execute_one_by_one_전환_중_실행_unit_수는_N_또는_N_plus_1() {
        // given
        controller.seedFormation(Formation.of(APP, "r1", Map.of("web", 3)));
        Deployment deployment = persist("d1", StrategyKind.ONE_BY_ONE);

        // when
        engine.execute(deployment);

        // then
        Map<String, Integer> running = new HashMap<>(Map.of("r1", 3, "r2", 0));
        for (Formation formation : controller.formationHistory()) {
            running.put(formation.releaseId(), formation.count("web"));
            int total = running.get("r1") + running.get("r2");
            assertThat(total).isBetween(3, 4);
        }
        assertThat(controller.formationHistory()).hasSize(6);
    }

    @Test
    void execute_one_by_one_여러_type은_이름_순서로_처리() {
        // given
        controller.seedFormation(Formation.of(APP, "r1", Map.of("worker", 1, "web", 2)));
        Deployment deployment = persist("d1", StrategyKind.ONE_BY_ONE);

        // when
        engine.execute(deployment);

        // then
        assertThat(events("d1"))
            .extracting(DeploymentEvent::jobType, DeploymentEvent::jobState)
            .containsExactly(
                tuple("web", JobState.UP),
                tuple("web", JobState.DOWN),
                tuple("web", JobState.UP),
                tuple("web", JobState.DOWN),
                tuple("worker", JobState.UP),
                tuple("worker", JobState.DOWN)
            );
        assertThat(controller.getFormation(APP, "r2").processes()).containsOnly(
            Map.entry("web", 2), Map.entry("worker", 1)
        );
    }

    @Test
    void execute_빈_formation이면_이벤트_없이_완료() {
        // given
        controller.seedFormation(Formation.empty(APP, "r1"));
        Deployment deployment = persist("d1", StrategyKind.ONE_BY_ONE);

        // when
        engine.execute(deployment);

        // then
        assertThat(events("d1")).isEmpty();
        assertThat(controller.formationHistory()).isEmpty();
        assertThat(deploymentStore.findById("d1").isFinished()).isTrue();
    }

    // ============================================================
    // 2. all-at-once
    // ============================================================

    @Test
    void execute_all_at_once_type별_up과_down_이벤트() {
        // given
        controller.seedFormation(Formation.of(APP, "r1", Map.of("web", 2, "worker", 1)));
        Deployment deployment = persist("d1", StrategyKind.ALL_AT_ONCE);

        // when
        engine.execute(deployment);

        // then
        assertThat(events("d1"))
            .extracting(DeploymentEvent::releaseId, DeploymentEvent::jobType, DeploymentEvent::jobState, DeploymentEvent::status)
            .containsExactly(
                tuple("r2", "web", JobState.UP, DeploymentStatus.RUNNING),
                tuple("r2", "worker", JobState.UP, DeploymentStatus.RUNNING),
                tuple("r1", "web", JobState.DOWN, DeploymentStatus.RUNNING),
                tuple("r1", "worker", JobState.DOWN, DeploymentStatus.COMPLETE)
            );
        assertThat(controller.formationHistory()).hasSize(2);
        assertThat(controller.getFormation(APP, "r1").total()).isZero();
        assertThat(controller.getFormation(APP, "r2").total()).isEqualTo(3);
    }

    // ============================================================
    // 3. 실패 처리
    // ============================================================

    @Test
    void execute_새_unit_crash시_failed_이벤트와_종료_시각_기록() {
        // given
        controller.seedFormation(Formation.of(APP, "r1", Map.of("web", 2)));
        controller.crashOnStart("r2", "web");
        Deployment deployment = persist("d1", StrategyKind.ONE_BY_ONE);

        // when & then
        assertThatThrownBy(() -> engine.execute(deployment))
            .isInstanceOf(DeploymentFailedException.class)
            .satisfies(e -> assertThat(((DeploymentFailedException) e).getReason()).isEqualTo(UnmetReason.CRASHED));

        List<DeploymentEvent> events = events("d1");
        assertThat(events).hasSize(1);
        DeploymentEvent failed = events.get(0);
        assertThat(failed.status()).isEqualTo(DeploymentStatus.FAILED);
        assertThat(failed.jobType()).isEqualTo("web");
        assertThat(failed.jobState()).isEqualTo(JobState.CRASHED);
        assertThat(failed.releaseId()).isEqualTo("r2");
        assertThat(deploymentStore.findById("d1").isFinished()).isTrue();
    }

    @Test
    void execute_crash는_이전_단계_확정_이벤트_뒤에_기록() {
        // given
        controller.seedFormation(Formation.of(APP, "r1", Map.of("web", 1, "worker", 1)));
        controller.crashOnStart("r2", "worker");
        Deployment deployment = persist("d1", StrategyKind.ONE_BY_ONE);

        // when
        assertThatThrownBy(() -> engine.execute(deployment)).isInstanceOf(DeploymentFailedException.class);

        // then
        assertThat(events("d1"))
            .extracting(DeploymentEvent::jobType, DeploymentEvent::jobState, DeploymentEvent::status)
            .containsExactly(
                tuple("web", JobState.UP, DeploymentStatus.RUNNING),
                tuple("web", JobState.DOWN, DeploymentStatus.RUNNING),
                tuple("worker", JobState.CRASHED, DeploymentStatus.FAILED)
            );
    }

    @Test
    void execute_formation_쓰기_실패시_failed_이벤트_종료_시각_미설정() {
        // given
        controller.seedFormation(Formation.of(APP, "r1", Map.of("web", 1)));
        controller.failNextPut("scheduler unavailable");
        Deployment deployment = persist("d1", StrategyKind.ONE_BY_ONE);

        // when & then
        assertThatThrownBy(() -> engine.execute(deployment))
            .isInstanceOf(ControllerException.class)
            .hasMessage("scheduler unavailable");

        List<DeploymentEvent> events = events("d1");
        assertThat(events).hasSize(1);
        assertThat(events.get(0).status()).isEqualTo(DeploymentStatus.FAILED);
        assertThat(events.get(0).jobType()).isEqualTo("web");
        assertThat(events.get(0).jobState()).isEqualTo(JobState.UP);
        assertThat(deploymentStore.findById("d1").isFinished()).isFalse();
    }

    @Test
    void execute_기존_formation_없으면_job_정보_없는_failed_이벤트() {
        // given
        Deployment deployment = persist("d1", StrategyKind.ONE_BY_ONE);

        // when & then
        assertThatThrownBy(() -> engine.execute(deployment)).isInstanceOf(NotFoundException.class);

        List<DeploymentEvent> events = events("d1");
        assertThat(events).hasSize(1);
        assertThat(events.get(0).status()).isEqualTo(DeploymentStatus.FAILED);
        assertThat(events.get(0).jobType()).isNull();
        assertThat(events.get(0).jobState()).isNull();
        assertThat(events.get(0).releaseId()).isEqualTo("r2");
        assertThat(deploymentStore.findById("d1").isFinished()).isFalse();
    }

    @Test
    void execute_대기_중_스트림_종료시_STREAM_CLOSED() {
        // given
        controller.seedFormation(Formation.of(APP, "r1", Map.of("web", 1)));
        controller.setScheduling(false);
        Deployment deployment = persist("d1", StrategyKind.ONE_BY_ONE);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread runner = startAsync(deployment, failure);
        await().atMost(Duration.ofSeconds(5)).until(() -> controller.formationHistory().size() == 1);

        // when
        controller.disconnectStreams(APP, null);

        // then
        await().atMost(Duration.ofSeconds(5)).until(() -> !runner.isAlive());
        assertThat(failure.get()).isInstanceOf(DeploymentFailedException.class);
        assertThat(((DeploymentFailedException) failure.get()).getReason()).isEqualTo(UnmetReason.STREAM_CLOSED);
        assertThat(events("d1")).extracting(DeploymentEvent::status).containsExactly(DeploymentStatus.FAILED);
        assertThat(deploymentStore.findById("d1").isFinished()).isFalse();
    }

    @Test
    void execute_대기_중_인터럽트시_CANCELLED() {
        // given
        controller.seedFormation(Formation.of(APP, "r1", Map.of("web", 1)));
        controller.setScheduling(false);
        Deployment deployment = persist("d1", StrategyKind.ONE_BY_ONE);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread runner = startAsync(deployment, failure);
        await().atMost(Duration.ofSeconds(5)).until(() -> controller.formationHistory().size() == 1);

        // when
        runner.interrupt();

        // then
        await().atMost(Duration.ofSeconds(5)).until(() -> !runner.isAlive());
        assertThat(((DeploymentFailedException) failure.get()).getReason()).isEqualTo(UnmetReason.CANCELLED);
        assertThat(events("d1")).extracting(DeploymentEvent::status).containsExactly(DeploymentStatus.FAILED);
        assertThat(controller.openStreamCount(APP)).isZero();
    }

    // ============================================================
    // 4. 호출 순서 / 입력 검증
    // ============================================================

    @Test
    void execute_스트림_구독_후_formation_조회() {
        // given
        Controller mockController = mock(Controller.class);
        when(mockController.streamJobEvents(any(), anyLong())).thenReturn(controller.streamJobEvents(APP, 0));
        when(mockController.getFormation(APP, "r1")).thenReturn(Formation.empty(APP, "r1"));
        StrategyEngine mocked = new StrategyEngine(mockController, deploymentStore, eventLog);
        Deployment deployment = persist("d1", StrategyKind.ONE_BY_ONE);

        // when
        mocked.execute(deployment);

        // then
        InOrder inOrder = inOrder(mockController);
        inOrder.verify(mockController).streamJobEvents(APP, 0);
        inOrder.verify(mockController).getFormation(APP, "r1");
        verify(mockController, never()).putFormation(any());
    }

    @Test
    void execute_이미_종료된_배포는_거부() {
        // given
        controller.seedFormation(Formation.of(APP, "r1", Map.of("web", 1)));
        Deployment deployment = persist("d1", StrategyKind.ONE_BY_ONE);
        Deployment finished = deploymentStore.markFinished("d1", deployment.createdAt());

        // when & then
        assertThatThrownBy(() -> engine.execute(finished)).isInstanceOf(IllegalStateException.class);
        assertThat(controller.formationHistory()).isEmpty();
    }

    @Test
    void execute_id_없는_배포는_거부() {
        assertThatThrownBy(() -> engine.execute(Deployment.of(APP, "r1", "r2", StrategyKind.ONE_BY_ONE)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private Thread startAsync(Deployment deployment, AtomicReference<Throwable> failure) {
        Thread thread = new Thread(() -> {
            try {
                engine.execute(deployment);
            } catch (Throwable t) {
                failure.set(t);
            }
        }, "engine-test");
        thread.start();
        return thread;
    }
}

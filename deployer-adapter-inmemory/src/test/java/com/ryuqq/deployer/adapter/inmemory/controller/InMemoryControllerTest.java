package com.ryuqq.deployer.adapter.inmemory.controller;

import com.ryuqq.deployer.core.exception.ControllerException;
import com.ryuqq.deployer.core.exception.JobEventStreamException;
import com.ryuqq.deployer.core.exception.NotFoundException;
import com.ryuqq.deployer.core.model.Formation;
import com.ryuqq.deployer.core.model.JobEvent;
import com.ryuqq.deployer.core.model.JobState;
import com.ryuqq.deployer.core.spi.JobEventStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryController 유닛 테스트.
 *
 * <p>formation 저장과 simulated scheduler의 이벤트 발행을 검증합니다:</p>
 * <ul>
 *   <li>putFormation은 전체 덮어쓰기</li>
 *   <li>증가한 unit → starting, up (crashOnStart면 crashed)</li>
 *   <li>감소한 unit → down</li>
 *   <li>스트림 종료/실패, sinceId replay</li>
 * </ul>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
class InMemoryControllerTest {

    private InMemoryController controller;

    @BeforeEach
    void setUp() {
        controller = new InMemoryController();
    }

    @Test
    void getFormation_없는_release면_NotFoundException() {
        assertThatThrownBy(() -> controller.getFormation("app", "r1"))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void putFormation_전체_덮어쓰기() {
        // given
        controller.putFormation(Formation.of("app", "r1", Map.of("web", 2, "worker", 1)));

        // when
        controller.putFormation(Formation.of("app", "r1", Map.of("web", 1)));

        // then
        Formation current = controller.getFormation("app", "r1");
        assertThat(current.processes()).containsOnly(Map.entry("web", 1));
        assertThat(current.count("worker")).isZero();
        assertThat(controller.formationHistory()).hasSize(2);
    }

    @Test
    void putFormation_증가와_감소에_맞는_job_event_발행() throws InterruptedException {
        // given
        controller.seedFormation(Formation.of("app", "r1", Map.of("web", 2)));

        try (JobEventStream stream = controller.streamJobEvents("app", 0)) {
            // when
            controller.putFormation(Formation.of("app", "r1", Map.of("web", 3)));
            controller.putFormation(Formation.of("app", "r1", Map.of("web", 2)));

            // then
            assertThat(stream.next().state()).isEqualTo(JobState.STARTING);
            JobEvent up = stream.next();
            assertThat(up.state()).isEqualTo(JobState.UP);
            assertThat(up.releaseId()).isEqualTo("r1");
            assertThat(up.processType()).isEqualTo("web");
            assertThat(stream.next().state()).isEqualTo(JobState.DOWN);
        }
    }

    @Test
    void crashOnStart_등록된_type은_crashed_발행() throws InterruptedException {
        controller.crashOnStart("r2", "web");

        try (JobEventStream stream = controller.streamJobEvents("app", 0)) {
            controller.putFormation(Formation.of("app", "r2", Map.of("web", 1)));

            assertThat(stream.next().state()).isEqualTo(JobState.STARTING);
            assertThat(stream.next().state()).isEqualTo(JobState.CRASHED);
        }
    }

    @Test
    void streamJobEvents_다른_app_이벤트는_받지_않음() throws InterruptedException {
        try (JobEventStream stream = controller.streamJobEvents("app", 0)) {
            controller.emit(new JobEvent("other", "r1", "web", JobState.UP, "j1"));
            controller.emit(new JobEvent("app", "r1", "web", JobState.DOWN, "j2"));

            assertThat(stream.next().jobId()).isEqualTo("j2");
        }
    }

    @Test
    void streamJobEvents_sinceId_이후_이력_replay() throws InterruptedException {
        // given: 3 events in history
        controller.emit(new JobEvent("app", "r1", "web", JobState.UP, "j1"));
        controller.emit(new JobEvent("app", "r1", "web", JobState.UP, "j2"));
        controller.emit(new JobEvent("app", "r1", "web", JobState.UP, "j3"));

        // when
        try (JobEventStream stream = controller.streamJobEvents("app", 1)) {
            // then
            assertThat(stream.next().jobId()).isEqualTo("j2");
            assertThat(stream.next().jobId()).isEqualTo("j3");
        }
    }

    @Test
    void close된_스트림의_next는_closed_예외() {
        JobEventStream stream = controller.streamJobEvents("app", 0);

        stream.close();

        assertThatThrownBy(stream::next)
            .isInstanceOf(JobEventStreamException.class)
            .satisfies(e -> assertThat(((JobEventStreamException) e).isClosed()).isTrue());
        assertThat(controller.openStreamCount("app")).isZero();
    }

    @Test
    void disconnectStreams_원인과_함께_failed_예외() {
        JobEventStream stream = controller.streamJobEvents("app", 0);
        IOException cause = new IOException("connection reset");

        controller.disconnectStreams("app", cause);

        assertThatThrownBy(stream::next)
            .isInstanceOf(JobEventStreamException.class)
            .hasCause(cause);
    }

    @Test
    void failNextPut_한번만_ControllerException() {
        controller.failNextPut("controller unavailable");
        Formation formation = Formation.of("app", "r1", Map.of("web", 1));

        assertThatThrownBy(() -> controller.putFormation(formation)).isInstanceOf(ControllerException.class);
        controller.putFormation(formation);

        assertThat(controller.getFormation("app", "r1")).isEqualTo(formation);
    }

    @Test
    void setScheduling_false면_이벤트_발행_안함() {
        controller.setScheduling(false);

        controller.putFormation(Formation.of("app", "r1", Map.of("web", 3)));

        assertThat(controller.eventHistory()).isEmpty();
    }
}

package com.ryuqq.deployer.application.admission;

import com.ryuqq.deployer.adapter.inmemory.queue.InMemoryWorkQueue;
import com.ryuqq.deployer.adapter.inmemory.store.InMemoryDeploymentStore;
import com.ryuqq.deployer.core.exception.NotFoundException;
import com.ryuqq.deployer.core.model.Deployment;
import com.ryuqq.deployer.core.model.StrategyKind;
import com.ryuqq.deployer.core.model.WorkItem;
import com.ryuqq.deployer.core.spi.WorkQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * DeploymentRepo 유닛 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>id, createdAt 부여 후 저장하고 작업 큐에 한 건 등록</li>
 *   <li>입력 검증</li>
 *   <li>큐 등록 실패 시 예외 전파 (저장된 레코드는 유지)</li>
 * </ul>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
class DeploymentRepoTest {

    private InMemoryDeploymentStore store;
    private InMemoryWorkQueue queue;
    private DeploymentRepo repo;
    private final DeploymentJobCodec codec = new DeploymentJobCodec();

    @BeforeEach
    void setUp() {
        store = new InMemoryDeploymentStore();
        queue = new InMemoryWorkQueue();
        repo = new DeploymentRepo(store, queue);
    }

    // ============================================================
    // 1. 정상 등록
    // ============================================================

    @Test
    void add_id와_createdAt을_부여하고_작업_한_건_등록() {
        // when
        Deployment added = repo.add(Deployment.of("app", "r1", "r2", StrategyKind.ONE_BY_ONE));

        // then
        assertThat(UUID.fromString(added.id()).toString()).isEqualTo(added.id());
        assertThat(added.createdAt()).isNotNull();
        assertThat(added.finishedAt()).isNull();
        assertThat(repo.get(added.id())).isEqualTo(added);

        List<WorkItem> items = queue.dequeue(10);
        assertThat(items).hasSize(1);
        assertThat(items.get(0).jobType()).isEqualTo(DeploymentJobCodec.JOB_TYPE);
        assertThat(codec.decode(items.get(0).payload())).isEqualTo(added.id());
    }

    @Test
    void add_지정된_id는_유지() {
        Deployment added = repo.add(Deployment.of("app", "r1", "r2", StrategyKind.ALL_AT_ONCE).withId("d1"));

        assertThat(added.id()).isEqualTo("d1");
        assertThat(added.strategy()).isEqualTo(StrategyKind.ALL_AT_ONCE);
    }

    @Test
    void add_배포마다_별도의_작업_등록() {
        repo.add(Deployment.of("app", "r1", "r2", StrategyKind.ONE_BY_ONE));
        repo.add(Deployment.of("app", "r2", "r3", StrategyKind.ONE_BY_ONE));

        assertThat(queue.pendingCount()).isEqualTo(2);
    }

    // ============================================================
    // 2. 입력 검증
    // ============================================================

    @Test
    void add_기존_release가_없으면_거부() {
        assertThatThrownBy(() -> repo.add(Deployment.of("app", null, "r2", StrategyKind.ONE_BY_ONE)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("oldReleaseId");
        assertThat(queue.pendingCount()).isZero();
    }

    @Test
    void add_기존과_새_release가_같으면_거부() {
        assertThatThrownBy(() -> repo.add(Deployment.of("app", "r1", "r1", StrategyKind.ONE_BY_ONE)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must differ");
        assertThat(store.findAll()).isEmpty();
    }

    @Test
    void add_종료_시각이_설정된_배포는_거부() {
        Deployment finished = Deployment.of("app", "r1", "r2", StrategyKind.ONE_BY_ONE)
            .finish(Instant.parse("2026-01-01T00:00:00Z"));

        assertThatThrownBy(() -> repo.add(finished))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void add_app이_없으면_배포_생성_단계에서_거부() {
        assertThatThrownBy(() -> Deployment.of(" ", "r1", "r2", StrategyKind.ONE_BY_ONE))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // 3. 실패
    // ============================================================

    @Test
    void add_큐_등록_실패시_예외_전파_저장은_유지() {
        // given
        WorkQueue failingQueue = mock(WorkQueue.class);
        doThrow(new IllegalStateException("queue unavailable")).when(failingQueue).enqueue(any(), anyLong());
        DeploymentRepo failingRepo = new DeploymentRepo(store, failingQueue);

        // when & then
        assertThatThrownBy(() -> failingRepo.add(Deployment.of("app", "r1", "r2", StrategyKind.ONE_BY_ONE).withId("d1")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("queue unavailable");
        assertThat(store.findById("d1").createdAt()).isNotNull();
    }

    @Test
    void get_없는_id면_NotFoundException() {
        assertThatThrownBy(() -> repo.get("missing"))
            .isInstanceOf(NotFoundException.class)
            .satisfies(e -> assertThat(((NotFoundException) e).getKey()).isEqualTo("missing"));
    }
}

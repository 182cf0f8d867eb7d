package com.ryuqq.deployer.application.admission;

import com.ryuqq.deployer.core.model.Deployment;
import com.ryuqq.deployer.core.model.WorkItem;
import com.ryuqq.deployer.core.spi.DeploymentStore;
import com.ryuqq.deployer.core.spi.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * 배포 admission.
 *
 * <p>배포 행을 저장한 뒤 실행 작업을 at-least-once 작업 큐에 정확히 하나 등록합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * add(deployment)
 *   ↓
 * 검증 (appId, old/new release, strategy, old ≠ new)
 *   ↓
 * id 미지정 시 UUID 할당
 *   ↓
 * store.insert(deployment)                        → createdAt 할당
 *   ↓
 * queue.enqueue(WorkItem("Deployment", {"id":...}), 0)
 * </pre>
 *
 * <p><strong>알려진 한계:</strong></p>
 * <p>insert 이후 enqueue가 실패하면 배포 행은 남지만 실행되지 않습니다. 예외는 로그를 남기고
 * 호출자에게 전파되며, 재등록은 외부 reconciler의 책임입니다.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public class DeploymentRepo {

    private static final Logger log = LoggerFactory.getLogger(DeploymentRepo.class);

    private final DeploymentStore store;
    private final WorkQueue queue;
    private final DeploymentJobCodec codec;

    /**
     * 생성자 (기본 codec 사용).
     *
     * @param store 배포 저장소
     * @param queue 작업 큐
     */
    public DeploymentRepo(DeploymentStore store, WorkQueue queue) {
        this(store, queue, new DeploymentJobCodec());
    }

    /**
     * 생성자 (의존성 주입).
     *
     * @param store 배포 저장소
     * @param queue 작업 큐
     * @param codec 작업 payload codec
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DeploymentRepo(DeploymentStore store, WorkQueue queue, DeploymentJobCodec codec) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.store = store;
        this.queue = queue;
        this.codec = codec;
    }

    /**
     * 배포 등록.
     *
     * @param deployment 등록할 배포 (id는 선택)
     * @return 저장된 배포 (id, createdAt 할당됨)
     * @throws IllegalArgumentException 검증 실패 시
     * @throws RuntimeException 저장 또는 enqueue 실패 시
     */
    public Deployment add(Deployment deployment) {
        validate(deployment);

        Deployment toInsert = deployment.id() == null ? deployment.withId(UUID.randomUUID().toString()) : deployment;
        Deployment stored = store.insert(toInsert);

        WorkItem item = WorkItem.now(DeploymentJobCodec.JOB_TYPE, codec.encode(stored.id()));
        try {
            queue.enqueue(item, 0);
        } catch (RuntimeException e) {
            log.error("Deployment {} stored but could not be enqueued; it will not run until re-enqueued", stored.id(), e);
            throw e;
        }

        log.info("Deployment {} admitted: app={}, {} → {}", stored.id(), stored.appId(), stored.oldReleaseId(), stored.newReleaseId());
        return stored;
    }

    /**
     * id로 배포 조회.
     *
     * @param id 배포 id
     * @return 배포
     * @throws com.ryuqq.deployer.core.exception.NotFoundException 존재하지 않는 경우
     */
    public Deployment get(String id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return store.findById(id);
    }

    private static void validate(Deployment deployment) {
        if (deployment == null) {
            throw new IllegalArgumentException("deployment cannot be null");
        }
        if (deployment.oldReleaseId() == null || deployment.oldReleaseId().isBlank()) {
            throw new IllegalArgumentException("oldReleaseId cannot be null or blank");
        }
        if (deployment.oldReleaseId().equals(deployment.newReleaseId())) {
            throw new IllegalArgumentException(
                "oldReleaseId and newReleaseId must differ (current: " + deployment.newReleaseId() + ")"
            );
        }
        if (deployment.createdAt() != null || deployment.finishedAt() != null) {
            throw new IllegalArgumentException("createdAt and finishedAt are assigned by the store");
        }
    }
}

package com.ryuqq.deployer.core.spi;

import com.ryuqq.deployer.core.model.DeploymentEvent;

import java.util.List;

/**
 * Durable, append-only storage SPI for deployment events.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Insert with a server-assigned global sequence id and timestamp</li>
 *   <li>Ascending range scan by deployment id ({@code id > sinceId})</li>
 *   <li>Point lookup by global sequence id</li>
 * </ul>
 *
 * <p><strong>Query Example:</strong></p>
 * <pre>
 * INSERT INTO deployment_events (deployment_id, release_id, job_type, job_state, status)
 * VALUES (?, ?, ?, ?, ?) RETURNING event_id, created_at;
 *
 * SELECT * FROM deployment_events
 * WHERE deployment_id = ? AND event_id > ?
 * ORDER BY event_id ASC;
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Ids strictly increase across the whole store and are never reused</li>
 *   <li>An inserted event is visible to {@code findSince}/{@code findById} once insert returns</li>
 *   <li>Concurrent inserts from unrelated deployments must not block each other on readers</li>
 * </ul>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public interface DeploymentEventStore {

    /**
     * Persists a draft event.
     *
     * @param draft event with id 0 and no createdAt
     * @return the persisted event with id and createdAt assigned
     * @throws IllegalArgumentException if draft is null or already persisted
     */
    DeploymentEvent insert(DeploymentEvent draft);

    /**
     * Lists a deployment's events after a cursor.
     *
     * @param deploymentId deployment id
     * @param sinceId exclusive lower bound, 0 for all
     * @return events with {@code id > sinceId}, ascending (may be empty)
     */
    List<DeploymentEvent> findSince(String deploymentId, long sinceId);

    /**
     * Fetches one event.
     *
     * @param id global sequence id
     * @return the event
     * @throws com.ryuqq.deployer.core.exception.NotFoundException if absent
     */
    DeploymentEvent findById(long id);
}

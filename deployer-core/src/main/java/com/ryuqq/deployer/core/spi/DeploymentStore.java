package com.ryuqq.deployer.core.spi;

import com.ryuqq.deployer.core.model.Deployment;

import java.time.Instant;

/**
 * Durable storage SPI for deployment records.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Insert with a server-assigned creation timestamp</li>
 *   <li>Lookup by deployment id</li>
 *   <li>One-time completion marking ({@code finishedAt: null → set})</li>
 * </ul>
 *
 * <p><strong>Query Example:</strong></p>
 * <pre>
 * INSERT INTO deployments (deployment_id, app_id, old_release_id, new_release_id, strategy)
 * VALUES (?, ?, ?, ?, ?) RETURNING created_at;
 *
 * UPDATE deployments SET finished_at = ?
 * WHERE deployment_id = ? AND finished_at IS NULL;
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called from multiple threads</li>
 *   <li>finishedAt is set at most once; a second attempt is rejected</li>
 * </ul>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public interface DeploymentStore {

    /**
     * Inserts a new deployment.
     *
     * @param deployment deployment with an assigned id and no createdAt/finishedAt
     * @return the stored deployment with createdAt assigned by the store
     * @throws IllegalArgumentException if deployment is null or has no id
     * @throws IllegalStateException if a deployment with the same id exists
     */
    Deployment insert(Deployment deployment);

    /**
     * Looks up a deployment.
     *
     * @param id deployment id
     * @return the stored deployment
     * @throws com.ryuqq.deployer.core.exception.NotFoundException if absent
     */
    Deployment findById(String id);

    /**
     * Sets finishedAt exactly once.
     *
     * @param id deployment id
     * @param finishedAt completion time
     * @return the updated deployment
     * @throws com.ryuqq.deployer.core.exception.NotFoundException if absent
     * @throws IllegalStateException if already finished
     */
    Deployment markFinished(String id, Instant finishedAt);
}

package com.ryuqq.deployer.adapter.inmemory.store;

import com.ryuqq.deployer.core.exception.NotFoundException;
import com.ryuqq.deployer.core.model.Deployment;
import com.ryuqq.deployer.core.spi.DeploymentStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link DeploymentStore} SPI for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>deployments:</strong> ConcurrentHashMap&lt;String, Deployment&gt; - records by deployment id (O(1) access)</li>
 * </ul>
 *
 * <p>The store plays the role of the database server: it assigns {@code createdAt} on insert
 * from its own clock, and rejects a second {@code markFinished} atomically.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public class InMemoryDeploymentStore implements DeploymentStore {

    private final ConcurrentHashMap<String, Deployment> deployments;
    private final Clock clock;

    /**
     * Creates an empty store on the system UTC clock.
     */
    public InMemoryDeploymentStore() {
        this(Clock.systemUTC());
    }

    /**
     * Creates an empty store with a custom clock.
     *
     * @param clock clock used for createdAt
     */
    public InMemoryDeploymentStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.deployments = new ConcurrentHashMap<>();
        this.clock = clock;
    }

    @Override
    public Deployment insert(Deployment deployment) {
        if (deployment == null) {
            throw new IllegalArgumentException("deployment cannot be null");
        }
        if (deployment.id() == null) {
            throw new IllegalArgumentException("deployment id must be assigned before insert");
        }
        if (deployment.createdAt() != null || deployment.finishedAt() != null) {
            throw new IllegalArgumentException("createdAt and finishedAt are assigned by the store");
        }

        Deployment stored = deployment.withCreatedAt(Instant.now(clock));
        Deployment existing = deployments.putIfAbsent(stored.id(), stored);
        if (existing != null) {
            throw new IllegalStateException("Deployment already exists: " + deployment.id());
        }
        return stored;
    }

    @Override
    public Deployment findById(String id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }

        Deployment deployment = deployments.get(id);
        if (deployment == null) {
            throw new NotFoundException("deployment", id);
        }
        return deployment;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Atomic per id: {@link ConcurrentHashMap#compute} runs the null → set transition
     * under the bin lock, so concurrent callers see exactly one success.</p>
     */
    @Override
    public Deployment markFinished(String id, Instant finishedAt) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (finishedAt == null) {
            throw new IllegalArgumentException("finishedAt cannot be null");
        }

        Deployment updated = deployments.computeIfPresent(id, (key, current) -> current.finish(finishedAt));
        if (updated == null) {
            throw new NotFoundException("deployment", id);
        }
        return updated;
    }

    /**
     * Returns every stored deployment. Used for test assertions.
     *
     * @return snapshot of all deployments
     */
    public List<Deployment> findAll() {
        return new ArrayList<>(deployments.values());
    }

    /**
     * Clears all records. Used for test cleanup.
     */
    public void clear() {
        deployments.clear();
    }
}

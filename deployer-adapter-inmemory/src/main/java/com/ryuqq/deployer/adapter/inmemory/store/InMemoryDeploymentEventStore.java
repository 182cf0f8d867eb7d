package com.ryuqq.deployer.adapter.inmemory.store;

import com.ryuqq.deployer.core.exception.NotFoundException;
import com.ryuqq.deployer.core.model.DeploymentEvent;
import com.ryuqq.deployer.core.spi.DeploymentEventStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link DeploymentEventStore} SPI for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>sequence:</strong> AtomicLong - global event id sequence (never reused)</li>
 *   <li><strong>eventsById:</strong> ConcurrentSkipListMap&lt;Long, DeploymentEvent&gt; - point lookup by id</li>
 *   <li><strong>eventsByDeployment:</strong> ConcurrentHashMap&lt;String, ConcurrentSkipListMap&lt;Long, DeploymentEvent&gt;&gt;
 *       - ordered per-deployment index for {@code id > sinceId} range scans (O(log N))</li>
 * </ul>
 *
 * <p><strong>Ordering Guarantee:</strong></p>
 * <p>Id assignment and indexing happen under the deployment's own index lock, so within one
 * deployment an event never becomes visible before an event with a smaller id. Appends for
 * different deployments take different locks and interleave freely.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public class InMemoryDeploymentEventStore implements DeploymentEventStore {

    private final AtomicLong sequence;
    private final ConcurrentSkipListMap<Long, DeploymentEvent> eventsById;
    private final ConcurrentHashMap<String, ConcurrentSkipListMap<Long, DeploymentEvent>> eventsByDeployment;
    private final AtomicReference<RuntimeException> nextInsertFailure;
    private final Clock clock;

    /**
     * Creates an empty store on the system UTC clock.
     */
    public InMemoryDeploymentEventStore() {
        this(Clock.systemUTC());
    }

    /**
     * Creates an empty store with a custom clock.
     *
     * @param clock clock used for createdAt
     */
    public InMemoryDeploymentEventStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.sequence = new AtomicLong();
        this.eventsById = new ConcurrentSkipListMap<>();
        this.eventsByDeployment = new ConcurrentHashMap<>();
        this.nextInsertFailure = new AtomicReference<>();
        this.clock = clock;
    }

    @Override
    public DeploymentEvent insert(DeploymentEvent draft) {
        if (draft == null) {
            throw new IllegalArgumentException("draft cannot be null");
        }
        if (!draft.isDraft()) {
            throw new IllegalArgumentException("event already persisted with id " + draft.id());
        }

        RuntimeException failure = nextInsertFailure.getAndSet(null);
        if (failure != null) {
            throw failure;
        }

        ConcurrentSkipListMap<Long, DeploymentEvent> index =
            eventsByDeployment.computeIfAbsent(draft.deploymentId(), key -> new ConcurrentSkipListMap<>());

        synchronized (index) {
            DeploymentEvent event = draft.persisted(sequence.incrementAndGet(), Instant.now(clock));
            eventsById.put(event.id(), event);
            index.put(event.id(), event);
            return event;
        }
    }

    @Override
    public List<DeploymentEvent> findSince(String deploymentId, long sinceId) {
        if (deploymentId == null) {
            throw new IllegalArgumentException("deploymentId cannot be null");
        }
        if (sinceId < 0) {
            throw new IllegalArgumentException("sinceId must be non-negative, but was: " + sinceId);
        }

        ConcurrentSkipListMap<Long, DeploymentEvent> index = eventsByDeployment.get(deploymentId);
        if (index == null) {
            return List.of();
        }
        return new ArrayList<>(index.tailMap(sinceId, false).values());
    }

    @Override
    public DeploymentEvent findById(long id) {
        DeploymentEvent event = eventsById.get(id);
        if (event == null) {
            throw new NotFoundException("deployment event", Long.toString(id));
        }
        return event;
    }

    /**
     * Makes the next {@link #insert} throw. Used to simulate storage I/O failures in tests.
     *
     * @param failure exception to throw once
     */
    public void failNextInsert(RuntimeException failure) {
        nextInsertFailure.set(failure);
    }

    /**
     * Returns the number of stored events. Used for test assertions.
     *
     * @return event count
     */
    public int size() {
        return eventsById.size();
    }

    /**
     * Clears all events. The id sequence keeps counting so ids are never reused.
     */
    public void clear() {
        eventsById.clear();
        eventsByDeployment.clear();
    }
}

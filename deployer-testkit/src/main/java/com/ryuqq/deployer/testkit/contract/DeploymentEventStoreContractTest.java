package com.ryuqq.deployer.testkit.contract;

import com.ryuqq.deployer.core.exception.NotFoundException;
import com.ryuqq.deployer.core.model.DeploymentEvent;
import com.ryuqq.deployer.core.model.DeploymentStatus;
import com.ryuqq.deployer.core.model.JobState;
import com.ryuqq.deployer.core.spi.DeploymentEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the {@link DeploymentEventStore} SPI.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>insert assigns increasing positive ids and createdAt</li>
 *   <li>findSince returns only the deployment's events with id &gt; sinceId, ascending</li>
 *   <li>findById returns the event or throws NotFoundException</li>
 *   <li>concurrent appends from two deployments keep each subsequence strictly increasing</li>
 * </ul>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public abstract class DeploymentEventStoreContractTest {

    protected DeploymentEventStore store;

    /**
     * Creates the store under test.
     *
     * @return a new, empty store
     */
    protected abstract DeploymentEventStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    protected static DeploymentEvent draft(String deploymentId, String jobType, JobState state) {
        return DeploymentEvent.draft(deploymentId, "r2", jobType, state, DeploymentStatus.RUNNING);
    }

    @Test
    void testInsert_AssignsIncreasingIdsAndTimestamp() {
        // When
        DeploymentEvent first = store.insert(draft("d1", "web", JobState.UP));
        DeploymentEvent second = store.insert(draft("d1", "web", JobState.DOWN));

        // Then
        assertTrue(first.id() > 0, "id should be positive");
        assertTrue(second.id() > first.id(), "ids should increase");
        assertNotNull(first.createdAt());
        assertEquals("web", first.jobType());
        assertEquals(JobState.UP, first.jobState());
    }

    @Test
    void testInsert_PersistedEvent_Rejected() {
        DeploymentEvent persisted = store.insert(draft("d1", "web", JobState.UP));

        assertThrows(IllegalArgumentException.class, () -> store.insert(persisted));
    }

    @Test
    void testFindSince_FiltersByDeploymentAndCursor() {
        // Given
        DeploymentEvent a1 = store.insert(draft("a", "web", JobState.UP));
        store.insert(draft("b", "web", JobState.UP));
        DeploymentEvent a2 = store.insert(draft("a", "web", JobState.DOWN));
        DeploymentEvent a3 = store.insert(draft("a", "worker", JobState.UP));

        // When
        List<DeploymentEvent> all = store.findSince("a", 0);
        List<DeploymentEvent> afterFirst = store.findSince("a", a1.id());

        // Then
        assertEquals(List.of(a1, a2, a3), all);
        assertEquals(List.of(a2, a3), afterFirst);
        assertTrue(store.findSince("a", a3.id()).isEmpty());
        assertTrue(store.findSince("unknown", 0).isEmpty());
    }

    @Test
    void testFindById_ReturnsEventOrNotFound() {
        DeploymentEvent event = store.insert(draft("d1", "web", JobState.UP));

        assertEquals(event, store.findById(event.id()));
        assertThrows(NotFoundException.class, () -> store.findById(event.id() + 1000));
    }

    @Test
    void testConcurrentAppends_TwoDeployments_EachSubsequenceStrictlyIncreasing() throws InterruptedException {
        // Given
        int perDeployment = 200;
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);

        // When: two writers per deployment
        for (String deploymentId : List.of("a", "a", "b", "b")) {
            executor.submit(() -> {
                start.await();
                for (int i = 0; i < perDeployment; i++) {
                    store.insert(draft(deploymentId, "web", JobState.UP));
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

        // Then
        List<Long> allIds = new ArrayList<>();
        for (String deploymentId : List.of("a", "b")) {
            List<DeploymentEvent> events = store.findSince(deploymentId, 0);
            assertEquals(perDeployment * 2, events.size());
            for (int i = 1; i < events.size(); i++) {
                assertTrue(events.get(i).id() > events.get(i - 1).id(), "ids must strictly increase within " + deploymentId);
            }
            events.forEach(event -> allIds.add(event.id()));
        }
        assertEquals(allIds.size(), allIds.stream().distinct().count(), "ids must never be reused");
    }
}

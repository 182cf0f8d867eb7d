package com.ryuqq.deployer.adapter.inmemory.store;

import com.ryuqq.deployer.core.model.DeploymentEvent;
import com.ryuqq.deployer.core.model.JobState;
import com.ryuqq.deployer.core.spi.DeploymentEventStore;
import com.ryuqq.deployer.testkit.contract.DeploymentEventStoreContractTest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link InMemoryDeploymentEventStore}.
 *
 * @author Deployer Team
 * @since 1.0.0
 * @see DeploymentEventStoreContractTest
 */
class InMemoryDeploymentEventStoreContractTest extends DeploymentEventStoreContractTest {

    @Override
    protected DeploymentEventStore createStore() {
        return new InMemoryDeploymentEventStore();
    }

    @Test
    void testFailNextInsert_FailsOnceWithoutConsumingId() {
        // Given
        InMemoryDeploymentEventStore inMemory = (InMemoryDeploymentEventStore) store;
        inMemory.failNextInsert(new IllegalStateException("disk full"));

        // When / Then
        assertThrows(IllegalStateException.class, () -> inMemory.insert(draft("d1", "web", JobState.UP)));
        DeploymentEvent event = inMemory.insert(draft("d1", "web", JobState.UP));

        assertEquals(1L, event.id());
        assertEquals(1, inMemory.size());
    }

    @Test
    void testClear_DoesNotReuseIds() {
        InMemoryDeploymentEventStore inMemory = (InMemoryDeploymentEventStore) store;
        DeploymentEvent before = inMemory.insert(draft("d1", "web", JobState.UP));

        inMemory.clear();
        DeploymentEvent after = inMemory.insert(draft("d1", "web", JobState.UP));

        assertTrue(after.id() > before.id());
        assertEquals(1, inMemory.findSince("d1", 0).size());
    }
}

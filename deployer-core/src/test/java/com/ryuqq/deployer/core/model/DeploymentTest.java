package com.ryuqq.deployer.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deployment / DeploymentEvent 테스트.
 *
 * @author Deployer Team
 * @since 1.0.0
 */
class DeploymentTest {

    @Test
    void of_ValidFields_CreatesUnpersistedDeployment() {
        // When
        Deployment deployment = Deployment.of("app", "r1", "r2", StrategyKind.ONE_BY_ONE);

        // Then
        assertNull(deployment.id());
        assertNull(deployment.createdAt());
        assertFalse(deployment.isFinished());
    }

    @Test
    void of_MissingStrategy_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Deployment.of("app", "r1", "r2", null));
    }

    @Test
    void finish_SecondTime_ThrowsException() {
        // Given
        Deployment finished = Deployment.of("app", "r1", "r2", StrategyKind.ONE_BY_ONE)
            .withId("d1")
            .finish(Instant.parse("2024-01-01T00:00:00Z"));

        // When & Then
        assertTrue(finished.isFinished());
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> finished.finish(Instant.now())
        );
        assertTrue(exception.getMessage().contains("d1"));
    }

    @Test
    void strategyKind_WireNames_RoundTrip() {
        assertEquals(StrategyKind.ONE_BY_ONE, StrategyKind.fromWireName("one-by-one"));
        assertEquals(StrategyKind.ALL_AT_ONCE, StrategyKind.fromWireName("all-at-once"));
        assertThrows(IllegalArgumentException.class, () -> StrategyKind.fromWireName("canary"));
    }

    @Test
    void jobState_OnlyCrashedIsTerminalFailure() {
        assertTrue(JobState.CRASHED.isTerminalFailure());
        assertFalse(JobState.DOWN.isTerminalFailure());
        assertEquals(JobState.UP, JobState.fromWireName("up"));
    }

    @Test
    void deploymentEvent_FailedMayOmitJob_OthersMayNot() {
        assertDoesNotThrow(() -> DeploymentEvent.draft("d1", "r2", null, null, DeploymentStatus.FAILED));
        assertThrows(
            IllegalArgumentException.class,
            () -> DeploymentEvent.draft("d1", "r2", null, null, DeploymentStatus.RUNNING)
        );
    }

    @Test
    void deploymentEvent_Persisted_AssignsIdAndTimestamp() {
        // Given
        DeploymentEvent draft = DeploymentEvent.draft("d1", "r2", "web", JobState.UP, DeploymentStatus.RUNNING);
        Instant createdAt = Instant.parse("2024-01-01T00:00:00Z");

        // When
        DeploymentEvent persisted = draft.persisted(7, createdAt);

        // Then
        assertTrue(draft.isDraft());
        assertFalse(persisted.isDraft());
        assertEquals(7, persisted.id());
        assertEquals(createdAt, persisted.createdAt());
        assertThrows(IllegalArgumentException.class, () -> draft.persisted(0, createdAt));
    }
}

package com.ryuqq.deployer.application.log;

import com.ryuqq.deployer.core.model.DeploymentEvent;
import com.ryuqq.deployer.core.spi.DeploymentEventStore;
import com.ryuqq.deployer.core.spi.WakeUpChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Durable, append-only, strictly ordered deployment event log.
 *
 * <p>The store is the sole authority. After an event is persisted, a wake-up carrying the
 * decimal event id is published on the deployment's channel; the wake-up is only a hint that
 * tells live tails to re-read the store.</p>
 *
 * <p><strong>Write Path:</strong></p>
 * <pre>
 * append(draft)
 *   ↓
 * store.insert(draft)            → id + createdAt assigned, durable
 *   ↓
 * channel.publish("deployment_events:" + deploymentId, "42")
 *   (failure logged, never propagated)
 * </pre>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public class DeploymentEventLog {

    private static final Logger log = LoggerFactory.getLogger(DeploymentEventLog.class);

    /**
     * Prefix of every deployment's wake-up channel name.
     */
    public static final String CHANNEL_PREFIX = "deployment_events:";

    private final DeploymentEventStore store;
    private final WakeUpChannel channel;

    /**
     * Creates a log over a store and a wake-up channel.
     *
     * @param store durable event store
     * @param channel wake-up channel
     * @throws IllegalArgumentException if any dependency is null
     */
    public DeploymentEventLog(DeploymentEventStore store, WakeUpChannel channel) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        this.store = store;
        this.channel = channel;
    }

    /**
     * Returns the wake-up channel name of a deployment.
     *
     * @param deploymentId deployment id
     * @return channel name
     */
    public static String channelFor(String deploymentId) {
        return CHANNEL_PREFIX + deploymentId;
    }

    /**
     * Persists an event and publishes its wake-up.
     *
     * @param draft event without id
     * @return the persisted event with id and createdAt
     * @throws IllegalArgumentException if draft is null or already persisted
     * @throws RuntimeException if the store insert fails
     */
    public DeploymentEvent append(DeploymentEvent draft) {
        if (draft == null) {
            throw new IllegalArgumentException("draft cannot be null");
        }

        DeploymentEvent event = store.insert(draft);
        try {
            channel.publish(channelFor(event.deploymentId()), Long.toString(event.id()));
        } catch (RuntimeException e) {
            log.warn("Failed to publish wake-up for deployment event {} of {}", event.id(), event.deploymentId(), e);
        }
        return event;
    }

    /**
     * Lists a deployment's events with id greater than {@code sinceId}, ascending.
     *
     * @param deploymentId deployment id
     * @param sinceId exclusive lower bound, 0 for all
     * @return events in id order
     */
    public List<DeploymentEvent> listSince(String deploymentId, long sinceId) {
        return store.findSince(deploymentId, sinceId);
    }

    /**
     * Fetches one event by id.
     *
     * @param id event id
     * @return the event
     * @throws com.ryuqq.deployer.core.exception.NotFoundException if no event has this id
     */
    public DeploymentEvent getById(long id) {
        return store.findById(id);
    }
}

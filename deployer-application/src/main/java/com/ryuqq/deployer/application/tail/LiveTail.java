package com.ryuqq.deployer.application.tail;

import com.ryuqq.deployer.application.log.DeploymentEventLog;
import com.ryuqq.deployer.core.exception.LiveTailException;
import com.ryuqq.deployer.core.spi.WakeUpChannel;
import com.ryuqq.deployer.core.spi.WakeUpSubscription;

/**
 * Streams one deployment's events to an observer, from a cursor, exactly once and in id order.
 *
 * <p><strong>Protocol:</strong></p>
 * <ol>
 *   <li>Subscribe to {@code deployment_events:<id>}; failure is thrown, nothing is emitted</li>
 *   <li>Catch-up: emit {@code listSince(id, sinceId)}</li>
 *   <li>On {@code Connected}: re-poll the log, send a keep-alive, start tailing</li>
 *   <li>On each wake-up: re-validate against the log and emit what is new</li>
 *   <li>Keep-alive and re-poll every {@code keepAliveIntervalMs} of idleness</li>
 * </ol>
 *
 * <p>Subscribing before the catch-up read means an event appended in between is announced on
 * a subscription that already exists; the re-poll on readiness covers the rest of the window.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * TailSession session = liveTail.stream(deploymentId, lastSeenId, new EventStreamWriter(writer));
 * long resumeFrom = session.cursor();
 * </pre>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public class LiveTail {

    private final DeploymentEventLog eventLog;
    private final WakeUpChannel channel;
    private final LiveTailConfig config;

    /**
     * Creates a live tail with default settings.
     *
     * @param eventLog deployment event log
     * @param channel wake-up channel
     */
    public LiveTail(DeploymentEventLog eventLog, WakeUpChannel channel) {
        this(eventLog, channel, new LiveTailConfig());
    }

    /**
     * Creates a live tail.
     *
     * @param eventLog deployment event log
     * @param channel wake-up channel
     * @param config keep-alive and polling settings
     * @throws IllegalArgumentException if any dependency is null
     */
    public LiveTail(DeploymentEventLog eventLog, WakeUpChannel channel, LiveTailConfig config) {
        if (eventLog == null) {
            throw new IllegalArgumentException("eventLog cannot be null");
        }
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.eventLog = eventLog;
        this.channel = channel;
        this.config = config;
    }

    /**
     * Subscribes and returns a session that has not started emitting yet.
     *
     * @param deploymentId deployment to tail
     * @param sinceId resume cursor, 0 for a new observer
     * @param sink destination
     * @return session in CONNECTING state
     * @throws IllegalArgumentException if arguments are invalid
     * @throws LiveTailException if the wake-up subscription cannot be established
     */
    public TailSession open(String deploymentId, long sinceId, TailSink sink) {
        if (deploymentId == null || deploymentId.isBlank()) {
            throw new IllegalArgumentException("deploymentId cannot be null or blank");
        }
        if (sinceId < 0) {
            throw new IllegalArgumentException("sinceId must be non-negative (current: " + sinceId + ")");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }

        WakeUpSubscription subscription;
        try {
            subscription = channel.subscribe(DeploymentEventLog.channelFor(deploymentId));
        } catch (RuntimeException e) {
            throw new LiveTailException("Failed to subscribe to events of deployment " + deploymentId, e);
        }
        return new TailSession(deploymentId, sinceId, eventLog, subscription, sink, config);
    }

    /**
     * Subscribes and streams on the calling thread until the session closes.
     *
     * @param deploymentId deployment to tail
     * @param sinceId resume cursor, 0 for a new observer
     * @param sink destination
     * @return the closed session
     * @throws LiveTailException if the wake-up subscription cannot be established
     */
    public TailSession stream(String deploymentId, long sinceId, TailSink sink) {
        TailSession session = open(deploymentId, sinceId, sink);
        session.run();
        return session;
    }
}

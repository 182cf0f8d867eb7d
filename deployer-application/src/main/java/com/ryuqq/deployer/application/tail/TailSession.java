package com.ryuqq.deployer.application.tail;

import com.ryuqq.deployer.application.log.DeploymentEventLog;
import com.ryuqq.deployer.core.model.DeploymentEvent;
import com.ryuqq.deployer.core.spi.ChannelSignal;
import com.ryuqq.deployer.core.spi.WakeUpSubscription;
import com.ryuqq.deployer.core.statemachine.StateTransition;
import com.ryuqq.deployer.core.statemachine.TailState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * One live tail of one deployment.
 *
 * <p>Created by {@link LiveTail#open} with its wake-up subscription already requested, then
 * driven to completion by {@link #run()} on the caller's thread. The session reacts only to
 * signals polled from the subscription; it registers no callbacks.</p>
 *
 * <p><strong>State Machine:</strong></p>
 * <pre>
 * CONNECTING ── catch-up emitted, Connected ──→ READY ── re-poll, keep-alive ──→ TAILING
 *     │                                            │                               │
 *     └──────────── Disconnected / error ──────────┴───────────────────────────────┴──→ CLOSED
 * </pre>
 *
 * <p><strong>Delivery Guarantee:</strong></p>
 * <p>Events reach the sink in strictly increasing id order, each at most once. Every wake-up
 * is re-validated against the log; a wake-up ahead of the cursor also emits any events between
 * the cursor and the candidate that earlier wake-ups missed.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public final class TailSession {

    private static final Logger log = LoggerFactory.getLogger(TailSession.class);

    private final String deploymentId;
    private final DeploymentEventLog eventLog;
    private final WakeUpSubscription subscription;
    private final TailSink sink;
    private final LiveTailConfig config;

    private volatile TailState state;
    private volatile long cursor;
    private volatile CloseReason closeReason;
    private long lastWriteNanos;

    TailSession(
        String deploymentId,
        long sinceId,
        DeploymentEventLog eventLog,
        WakeUpSubscription subscription,
        TailSink sink,
        LiveTailConfig config
    ) {
        this.deploymentId = deploymentId;
        this.cursor = sinceId;
        this.eventLog = eventLog;
        this.subscription = subscription;
        this.sink = sink;
        this.config = config;
        this.state = TailState.CONNECTING;
    }

    /**
     * Runs the session until it closes.
     *
     * @return why the session closed
     * @throws IllegalStateException if the session already ran
     */
    public CloseReason run() {
        if (state != TailState.CONNECTING) {
            throw new IllegalStateException("Tail session for " + deploymentId + " already ran (state: " + state + ")");
        }

        try {
            return close(tail());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return close(CloseReason.INTERRUPTED);
        } catch (EventLogReadException e) {
            log.warn("Live tail of deployment {} failed reading the log at cursor {}", deploymentId, cursor, e.getCause());
            return close(CloseReason.FETCH_FAILED);
        } catch (RuntimeException e) {
            log.warn("Live tail of deployment {} failed writing to its sink at cursor {}", deploymentId, cursor, e);
            return close(CloseReason.SINK_FAILED);
        } finally {
            subscription.close();
        }
    }

    private CloseReason tail() throws InterruptedException {
        if (!emitSince()) {
            return CloseReason.SUBSCRIBER_GONE;
        }

        CloseReason notReady = awaitReady();
        if (notReady != null) {
            return notReady;
        }
        state = StateTransition.transition(state, TailState.READY);

        if (!emitSince()) {
            return CloseReason.SUBSCRIBER_GONE;
        }
        keepAlive();
        state = StateTransition.transition(state, TailState.TAILING);
        log.debug("Live tail of deployment {} tailing from cursor {}", deploymentId, cursor);

        long keepAliveNanos = TimeUnit.MILLISECONDS.toNanos(config.keepAliveIntervalMs());
        while (true) {
            if (!sink.isOpen()) {
                return CloseReason.SUBSCRIBER_GONE;
            }

            ChannelSignal signal = subscription.poll(config.pollIntervalMs(), TimeUnit.MILLISECONDS);
            if (signal instanceof ChannelSignal.Notification notification) {
                CloseReason reason = onNotification(notification);
                if (reason != null) {
                    return reason;
                }
            } else if (signal instanceof ChannelSignal.Disconnected disconnected) {
                if (disconnected.isError()) {
                    log.warn("Wake-up channel of deployment {} failed", deploymentId, disconnected.cause());
                    return CloseReason.CHANNEL_FAILED;
                }
                return CloseReason.CHANNEL_CLOSED;
            }

            if (System.nanoTime() - lastWriteNanos >= keepAliveNanos) {
                if (!emitSince()) {
                    return CloseReason.SUBSCRIBER_GONE;
                }
                keepAlive();
            }
        }
    }

    private CloseReason awaitReady() throws InterruptedException {
        while (true) {
            if (!sink.isOpen()) {
                return CloseReason.SUBSCRIBER_GONE;
            }
            ChannelSignal signal = subscription.poll(config.pollIntervalMs(), TimeUnit.MILLISECONDS);
            if (signal instanceof ChannelSignal.Connected) {
                return null;
            }
            if (signal instanceof ChannelSignal.Disconnected disconnected) {
                log.warn("Wake-up channel of deployment {} never became ready", deploymentId, disconnected.cause());
                return CloseReason.CHANNEL_FAILED;
            }
            // notifications before readiness are covered by the re-poll on READY
        }
    }

    private CloseReason onNotification(ChannelSignal.Notification notification) {
        long candidate;
        try {
            candidate = Long.parseLong(notification.payload().trim());
        } catch (NumberFormatException e) {
            log.warn("Malformed wake-up payload on {}: '{}'", notification.channel(), notification.payload());
            return CloseReason.CHANNEL_FAILED;
        }

        if (candidate <= cursor) {
            log.trace("Discarding stale wake-up {} at cursor {}", candidate, cursor);
            return null;
        }

        DeploymentEvent target = fetch(candidate);
        if (!target.deploymentId().equals(deploymentId)) {
            log.debug("Ignoring wake-up {} of deployment {} on channel of {}", candidate, target.deploymentId(), deploymentId);
            return null;
        }

        for (DeploymentEvent event : fetchSince()) {
            if (event.id() > candidate) {
                break;
            }
            if (!emit(event)) {
                return CloseReason.SUBSCRIBER_GONE;
            }
        }
        return null;
    }

    private boolean emitSince() {
        for (DeploymentEvent event : fetchSince()) {
            if (!emit(event)) {
                return false;
            }
        }
        return sink.isOpen();
    }

    private List<DeploymentEvent> fetchSince() {
        try {
            return eventLog.listSince(deploymentId, cursor);
        } catch (RuntimeException e) {
            throw new EventLogReadException(e);
        }
    }

    private DeploymentEvent fetch(long eventId) {
        try {
            return eventLog.getById(eventId);
        } catch (RuntimeException e) {
            throw new EventLogReadException(e);
        }
    }

    private boolean emit(DeploymentEvent event) {
        sink.send(event);
        if (!sink.isOpen()) {
            return false;
        }
        cursor = event.id();
        lastWriteNanos = System.nanoTime();
        return true;
    }

    private void keepAlive() {
        sink.keepAlive();
        lastWriteNanos = System.nanoTime();
    }

    private CloseReason close(CloseReason reason) {
        closeReason = reason;
        state = StateTransition.transition(state, TailState.CLOSED);
        log.debug("Live tail of deployment {} closed at cursor {}: {}", deploymentId, cursor, reason);
        return reason;
    }

    /**
     * Deployment this session tails.
     *
     * @return deployment id
     */
    public String deploymentId() {
        return deploymentId;
    }

    /**
     * Id of the last event delivered, or the starting {@code sinceId} if none. Resume from here.
     *
     * @return resume cursor
     */
    public long cursor() {
        return cursor;
    }

    /**
     * Current state.
     *
     * @return TailState
     */
    public TailState state() {
        return state;
    }

    /**
     * Why the session closed, or null while it is still running.
     *
     * @return CloseReason
     */
    public CloseReason closeReason() {
        return closeReason;
    }

    /**
     * Marks a failure of the event log, as opposed to one of the sink.
     */
    private static final class EventLogReadException extends RuntimeException {

        EventLogReadException(RuntimeException cause) {
            super(cause);
        }
    }
}

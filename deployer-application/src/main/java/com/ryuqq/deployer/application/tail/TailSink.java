package com.ryuqq.deployer.application.tail;

import com.ryuqq.deployer.core.model.DeploymentEvent;

/**
 * Destination of a live tail session.
 *
 * <p>Implementations must not throw on a broken connection: they mark themselves closed and
 * report it through {@link #isOpen()}.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public interface TailSink {

    /**
     * Delivers one event.
     *
     * @param event persisted deployment event
     */
    void send(DeploymentEvent event);

    /**
     * Sends a no-op keep-alive.
     */
    void keepAlive();

    /**
     * Whether the subscriber is still connected.
     *
     * @return false once the subscriber went away
     */
    boolean isOpen();
}

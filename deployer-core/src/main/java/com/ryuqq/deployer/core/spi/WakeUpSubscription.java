package com.ryuqq.deployer.core.spi;

import java.util.concurrent.TimeUnit;

/**
 * A live subscription to one wake-up channel.
 *
 * <p>The first signal is {@link ChannelSignal.Connected} once the subscription is ready, or
 * {@link ChannelSignal.Disconnected} if it could not be established. After a
 * {@code Disconnected} no further signals arrive.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public interface WakeUpSubscription extends AutoCloseable {

    /**
     * Waits for the next signal.
     *
     * @param timeout maximum wait
     * @param unit unit of timeout
     * @return the next signal, or null if none arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    ChannelSignal poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Unsubscribes. Idempotent.
     */
    @Override
    void close();
}

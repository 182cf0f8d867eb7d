package com.ryuqq.deployer.core.spi;

/**
 * Message delivered on a {@link WakeUpSubscription}.
 *
 * <p>Subscription lifecycle (connected, notified, disconnected) travels through the same
 * queue as notifications, so a subscriber drives its state machine by taking messages
 * instead of registering callbacks.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public sealed interface ChannelSignal {

    /**
     * The subscription is established; notifications published from now on will arrive.
     */
    record Connected() implements ChannelSignal {
    }

    /**
     * A wake-up hint. The payload is small and must never be trusted as data.
     *
     * @param channel channel the hint was published on
     * @param payload hint payload (for deployment events: the decimal event id)
     */
    record Notification(String channel, String payload) implements ChannelSignal {
    }

    /**
     * The subscription ended.
     *
     * @param cause error that ended it, null for an orderly disconnect
     */
    record Disconnected(Throwable cause) implements ChannelSignal {

        public boolean isError() {
            return cause != null;
        }
    }
}

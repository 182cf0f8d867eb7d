package com.ryuqq.deployer.core.spi;

/**
 * Lightweight publish/subscribe SPI for wake-up hints.
 *
 * <p>Used by the deployment event log to tell live tails that a new event exists.
 * The channel only carries hints: subscribers always re-read the durable log.</p>
 *
 * <p><strong>Delivery Guarantees:</strong></p>
 * <ul>
 *   <li>At-least-once, unordered, possibly duplicated</li>
 *   <li>Small payloads only</li>
 *   <li>{@code publish} never blocks on subscriber presence</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * try (WakeUpSubscription subscription = channel.subscribe("deployment_events:" + id)) {
 *     ChannelSignal signal = subscription.poll(1, TimeUnit.SECONDS);
 *     ...
 * }
 * </pre>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public interface WakeUpChannel {

    /**
     * Publishes a hint to every current subscriber of the channel.
     *
     * @param channel channel name
     * @param payload hint payload
     * @throws IllegalArgumentException if channel or payload is null
     */
    void publish(String channel, String payload);

    /**
     * Subscribes to a channel.
     *
     * @param channel channel name
     * @return the subscription; readiness is signalled through it
     * @throws IllegalArgumentException if channel is null
     * @throws com.ryuqq.deployer.core.exception.DeployerException if the subscription cannot be created
     */
    WakeUpSubscription subscribe(String channel);
}

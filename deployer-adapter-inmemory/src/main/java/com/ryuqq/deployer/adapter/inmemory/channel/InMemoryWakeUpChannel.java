package com.ryuqq.deployer.adapter.inmemory.channel;

import com.ryuqq.deployer.core.exception.DeployerException;
import com.ryuqq.deployer.core.spi.ChannelSignal;
import com.ryuqq.deployer.core.spi.WakeUpChannel;
import com.ryuqq.deployer.core.spi.WakeUpSubscription;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link WakeUpChannel} SPI for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>subscriptions:</strong> ConcurrentHashMap&lt;String, CopyOnWriteArrayList&lt;InMemoryWakeUpSubscription&gt;&gt;
 *       - live subscribers per channel name</li>
 * </ul>
 *
 * <p><strong>Delivery Semantics:</strong></p>
 * <ul>
 *   <li>Fan-out: every live subscriber of a channel receives each publish</li>
 *   <li>No retention: a publish with no subscriber is dropped</li>
 *   <li>Readiness: a new subscription signals {@link ChannelSignal.Connected} first</li>
 * </ul>
 *
 * <p><strong>Fault Injection:</strong></p>
 * <p>{@link #failNextSubscribe}, {@link #failNextPublish} and {@link #disconnect} let tests
 * reproduce listener failures, and {@link #setDuplicateDelivery} doubles every publish to
 * exercise at-least-once consumers.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public class InMemoryWakeUpChannel implements WakeUpChannel {

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<InMemoryWakeUpSubscription>> subscriptions;
    private final AtomicReference<RuntimeException> nextSubscribeFailure;
    private final AtomicReference<RuntimeException> nextPublishFailure;
    private volatile boolean duplicateDelivery;

    /**
     * Creates a channel hub with no subscribers.
     */
    public InMemoryWakeUpChannel() {
        this.subscriptions = new ConcurrentHashMap<>();
        this.nextSubscribeFailure = new AtomicReference<>();
        this.nextPublishFailure = new AtomicReference<>();
    }

    @Override
    public void publish(String channel, String payload) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }

        RuntimeException failure = nextPublishFailure.getAndSet(null);
        if (failure != null) {
            throw failure;
        }

        List<InMemoryWakeUpSubscription> subscribers = subscriptions.get(channel);
        if (subscribers == null) {
            return;
        }
        ChannelSignal.Notification notification = new ChannelSignal.Notification(channel, payload);
        for (InMemoryWakeUpSubscription subscriber : subscribers) {
            subscriber.deliver(notification);
            if (duplicateDelivery) {
                subscriber.deliver(notification);
            }
        }
    }

    @Override
    public WakeUpSubscription subscribe(String channel) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }

        RuntimeException failure = nextSubscribeFailure.getAndSet(null);
        if (failure != null) {
            throw failure;
        }

        InMemoryWakeUpSubscription subscription = new InMemoryWakeUpSubscription(channel, this::unsubscribe);
        subscriptions.computeIfAbsent(channel, key -> new CopyOnWriteArrayList<>()).add(subscription);
        subscription.deliver(new ChannelSignal.Connected());
        return subscription;
    }

    /**
     * Makes the next {@link #subscribe} throw a {@link DeployerException}.
     *
     * @param message failure message
     */
    public void failNextSubscribe(String message) {
        nextSubscribeFailure.set(new DeployerException(message));
    }

    /**
     * Makes the next {@link #publish} throw a {@link DeployerException}.
     *
     * @param message failure message
     */
    public void failNextPublish(String message) {
        nextPublishFailure.set(new DeployerException(message));
    }

    /**
     * Drops every subscriber of a channel, signalling {@link ChannelSignal.Disconnected} to each.
     *
     * @param channel channel name
     * @param cause disconnect cause, null for a clean close
     */
    public void disconnect(String channel, Throwable cause) {
        List<InMemoryWakeUpSubscription> subscribers = subscriptions.remove(channel);
        if (subscribers == null) {
            return;
        }
        for (InMemoryWakeUpSubscription subscriber : subscribers) {
            subscriber.deliver(new ChannelSignal.Disconnected(cause));
        }
    }

    /**
     * Enables or disables delivering each publish twice.
     *
     * @param duplicateDelivery true to duplicate
     */
    public void setDuplicateDelivery(boolean duplicateDelivery) {
        this.duplicateDelivery = duplicateDelivery;
    }

    /**
     * Returns the number of live subscribers on a channel.
     *
     * @param channel channel name
     * @return subscriber count
     */
    public int subscriberCount(String channel) {
        List<InMemoryWakeUpSubscription> subscribers = subscriptions.get(channel);
        return subscribers == null ? 0 : subscribers.size();
    }

    private void unsubscribe(InMemoryWakeUpSubscription subscription) {
        subscriptions.computeIfPresent(subscription.channel(), (key, subscribers) -> {
            subscribers.remove(subscription);
            return subscribers.isEmpty() ? null : subscribers;
        });
    }
}

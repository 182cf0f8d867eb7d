package com.ryuqq.deployer.adapter.inmemory.channel;

import com.ryuqq.deployer.core.spi.ChannelSignal;
import com.ryuqq.deployer.core.spi.WakeUpSubscription;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Queue-backed subscription handed out by {@link InMemoryWakeUpChannel}.
 *
 * <p>Signals are buffered in an unbounded {@link LinkedBlockingQueue}. After a
 * {@link ChannelSignal.Disconnected} is buffered, later deliveries are ignored.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
final class InMemoryWakeUpSubscription implements WakeUpSubscription {

    private final String channel;
    private final Consumer<InMemoryWakeUpSubscription> onClose;
    private final LinkedBlockingQueue<ChannelSignal> signals;
    private final AtomicBoolean closed;
    private volatile boolean disconnected;

    InMemoryWakeUpSubscription(String channel, Consumer<InMemoryWakeUpSubscription> onClose) {
        this.channel = channel;
        this.onClose = onClose;
        this.signals = new LinkedBlockingQueue<>();
        this.closed = new AtomicBoolean(false);
    }

    String channel() {
        return channel;
    }

    synchronized void deliver(ChannelSignal signal) {
        if (disconnected || closed.get()) {
            return;
        }
        if (signal instanceof ChannelSignal.Disconnected) {
            disconnected = true;
        }
        signals.offer(signal);
    }

    @Override
    public ChannelSignal poll(long timeout, TimeUnit unit) throws InterruptedException {
        return signals.poll(timeout, unit);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            onClose.accept(this);
        }
    }
}

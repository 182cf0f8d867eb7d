package com.ryuqq.deployer.adapter.inmemory.controller;

import com.ryuqq.deployer.core.exception.JobEventStreamException;
import com.ryuqq.deployer.core.model.JobEvent;
import com.ryuqq.deployer.core.spi.JobEventStream;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Queue-backed {@link JobEventStream} handed out by {@link InMemoryController}.
 *
 * <p>Termination is delivered in-band as an end marker so that a blocked {@link #next()}
 * wakes up. The marker stays at the head of the queue: every later {@code next()} throws too.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
final class InMemoryJobEventStream implements JobEventStream {

    private final String appId;
    private final Consumer<InMemoryJobEventStream> onClose;
    private final LinkedBlockingQueue<Object> items;
    private final AtomicBoolean ended;

    InMemoryJobEventStream(String appId, Consumer<InMemoryJobEventStream> onClose) {
        this.appId = appId;
        this.onClose = onClose;
        this.items = new LinkedBlockingQueue<>();
        this.ended = new AtomicBoolean(false);
    }

    String appId() {
        return appId;
    }

    void deliver(JobEvent event) {
        if (!ended.get()) {
            items.offer(event);
        }
    }

    void end(Throwable cause) {
        if (ended.compareAndSet(false, true)) {
            items.offer(new End(cause));
        }
    }

    @Override
    public JobEvent next() throws InterruptedException {
        Object item = items.take();
        if (item instanceof End end) {
            items.offer(end);
            if (end.cause() == null) {
                throw JobEventStreamException.closed(appId);
            }
            throw JobEventStreamException.failed(appId, end.cause());
        }
        return (JobEvent) item;
    }

    @Override
    public void close() {
        end(null);
        onClose.accept(this);
    }

    private record End(Throwable cause) {
    }
}

package com.ryuqq.deployer.core.spi;

import com.ryuqq.deployer.core.model.JobEvent;

/**
 * Blocking view over an app's asynchronous job event source.
 *
 * <p>Delivery is at-least-once and unordered; consumers must tolerate duplicates and
 * events they did not ask for.</p>
 *
 * <p><strong>Blocking Behavior:</strong></p>
 * <ul>
 *   <li>{@link #next()} blocks until an event arrives, the stream ends, or the thread is interrupted</li>
 *   <li>There is no timeout; bounded waiting is the caller's concern (interrupt or close)</li>
 *   <li>{@link #close()} from another thread wakes a blocked {@code next()}</li>
 * </ul>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public interface JobEventStream extends AutoCloseable {

    /**
     * Takes the next event.
     *
     * @return the next job event, never null
     * @throws InterruptedException if the waiting thread is interrupted
     * @throws com.ryuqq.deployer.core.exception.JobEventStreamException if the stream closed or failed
     */
    JobEvent next() throws InterruptedException;

    /**
     * Closes the stream and releases the subscription. Idempotent.
     */
    @Override
    void close();
}

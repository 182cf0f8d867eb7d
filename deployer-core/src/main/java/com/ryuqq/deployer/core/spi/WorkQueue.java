package com.ryuqq.deployer.core.spi;

import com.ryuqq.deployer.core.model.Failure;
import com.ryuqq.deployer.core.model.WorkItem;

import java.util.List;

/**
 * Work queue SPI for asynchronous deployment execution.
 *
 * <p>Admission enqueues one work item per deployment; the deployment worker dequeues,
 * executes and acknowledges.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Enqueueing work items with optional delay</li>
 *   <li>Dequeuing batches of work items for processing</li>
 *   <li>Acknowledging processed items</li>
 *   <li>Negative acknowledging items for redelivery</li>
 *   <li>Moving failed items to the Dead Letter Queue (DLQ)</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Idempotent: ack/nack operations should be idempotent</li>
 *   <li>Visibility Timeout: dequeued items stay invisible until ack/nack or timeout</li>
 *   <li>At-least-once Delivery: items may be delivered multiple times</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * queue.enqueue(WorkItem.now("Deployment", "{\"id\":\"...\"}"), 0L);
 *
 * List&lt;WorkItem&gt; batch = queue.dequeue(10);
 * for (WorkItem item : batch) {
 *     try {
 *         process(item);
 *         queue.ack(item);
 *     } catch (Exception e) {
 *         queue.publishToDLQ(item, Failure.of("DEPLOYMENT_ABORTED", e.getMessage()));
 *     }
 * }
 * </pre>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public interface WorkQueue {

    /**
     * Enqueues a work item.
     *
     * @param item the item
     * @param delayMs delay before the item becomes visible (0 for immediate)
     * @throws IllegalArgumentException if item is null or delayMs is negative
     */
    void enqueue(WorkItem item, long delayMs);

    /**
     * Dequeues up to {@code batchSize} visible items and starts their visibility timeout.
     *
     * @param batchSize maximum number of items
     * @return dequeued items (may be empty)
     * @throws IllegalArgumentException if batchSize is not positive
     */
    List<WorkItem> dequeue(int batchSize);

    /**
     * Acknowledges an item, removing it permanently.
     *
     * @param item the item
     * @throws IllegalArgumentException if item is null
     */
    void ack(WorkItem item);

    /**
     * Returns an item to the queue for immediate redelivery.
     *
     * @param item the item
     * @throws IllegalArgumentException if item is null
     */
    void nack(WorkItem item);

    /**
     * Moves an item to the Dead Letter Queue with failure metadata.
     *
     * @param item the item
     * @param failure failure details
     * @throws IllegalArgumentException if item or failure is null
     */
    void publishToDLQ(WorkItem item, Failure failure);
}

package com.ryuqq.deployer.adapter.inmemory.queue;

import com.ryuqq.deployer.core.model.Failure;
import com.ryuqq.deployer.core.model.WorkItem;
import com.ryuqq.deployer.core.spi.WorkQueue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * In-memory {@link WorkQueue} with leases and a dead letter list.
 *
 * <p>A dequeued item is leased for {@code leaseMs}. Leases that run out before the item is
 * acknowledged are reclaimed at the start of the next {@link #dequeue(int)} and the item is
 * handed out again, so a polling worker observes at-least-once delivery without a background
 * thread.</p>
 *
 * <p>All methods synchronize on the queue instance.</p>
 *
 * <pre>
 * WorkQueue queue = new InMemoryWorkQueue();
 * queue.enqueue(WorkItem.now("Deployment", payload), 0);
 *
 * for (WorkItem item : queue.dequeue(10)) {
 *     process(item);
 *     queue.ack(item);
 * }
 * </pre>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public class InMemoryWorkQueue implements WorkQueue {

    private static final long DEFAULT_LEASE_MS = 30_000L;

    private final long leaseMs;
    private final PriorityQueue<Pending> pending =
        new PriorityQueue<>(Comparator.comparingLong(Pending::visibleAt).thenComparingLong(Pending::sequence));
    private final Map<String, Lease> leases = new HashMap<>();
    private final List<DeadLetter> deadLetters = new ArrayList<>();
    private long sequence;
    private int redeliveries;

    /**
     * Creates a queue that leases items for 30 seconds.
     */
    public InMemoryWorkQueue() {
        this(DEFAULT_LEASE_MS);
    }

    /**
     * Creates a queue with a custom lease.
     *
     * @param leaseMs how long a dequeued item stays invisible
     * @throws IllegalArgumentException if leaseMs is not positive
     */
    public InMemoryWorkQueue(long leaseMs) {
        if (leaseMs <= 0) {
            throw new IllegalArgumentException("leaseMs must be positive, but was: " + leaseMs);
        }
        this.leaseMs = leaseMs;
    }

    @Override
    public synchronized void enqueue(WorkItem item, long delayMs) {
        requireItem(item);
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative, but was: " + delayMs);
        }
        pending.add(new Pending(item, System.currentTimeMillis() + delayMs, sequence++));
    }

    @Override
    public synchronized List<WorkItem> dequeue(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }

        long now = System.currentTimeMillis();
        reclaimExpiredLeases(now);

        List<WorkItem> batch = new ArrayList<>();
        while (batch.size() < batchSize && !pending.isEmpty() && pending.peek().visibleAt() <= now) {
            WorkItem item = pending.poll().item();
            leases.put(item.itemId(), new Lease(item, now + leaseMs));
            batch.add(item);
        }
        return batch;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Also drops a reclaimed copy still waiting for redelivery. Unknown items are ignored.</p>
     */
    @Override
    public synchronized void ack(WorkItem item) {
        requireItem(item);
        settle(item);
    }

    @Override
    public synchronized void nack(WorkItem item) {
        requireItem(item);
        if (leases.remove(item.itemId()) != null) {
            pending.add(new Pending(item, System.currentTimeMillis(), sequence++));
        }
    }

    @Override
    public synchronized void publishToDLQ(WorkItem item, Failure failure) {
        requireItem(item);
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        settle(item);
        deadLetters.add(new DeadLetter(item, failure));
    }

    /**
     * Ends the lease of an item now, so the next dequeue hands it out again.
     *
     * @param item leased item
     * @return true if the item was leased
     */
    public synchronized boolean expireLease(WorkItem item) {
        requireItem(item);
        Lease lease = leases.get(item.itemId());
        if (lease == null) {
            return false;
        }
        leases.put(item.itemId(), new Lease(lease.item(), Long.MIN_VALUE));
        return true;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized int leasedCount() {
        return leases.size();
    }

    /**
     * @return number of items handed out again because their lease ran out
     */
    public synchronized int redeliveries() {
        return redeliveries;
    }

    public synchronized List<DeadLetter> deadLetters() {
        return List.copyOf(deadLetters);
    }

    private void reclaimExpiredLeases(long now) {
        Iterator<Lease> it = leases.values().iterator();
        while (it.hasNext()) {
            Lease lease = it.next();
            if (lease.expiresAt() <= now) {
                it.remove();
                pending.add(new Pending(lease.item(), now, sequence++));
                redeliveries++;
            }
        }
    }

    private void settle(WorkItem item) {
        leases.remove(item.itemId());
        pending.removeIf(p -> p.item().itemId().equals(item.itemId()));
    }

    private static void requireItem(WorkItem item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
    }

    private record Pending(WorkItem item, long visibleAt, long sequence) {
    }

    private record Lease(WorkItem item, long expiresAt) {
    }

    /**
     * Item moved to the dead letter list, with the failure that sent it there.
     *
     * @param item failed item
     * @param failure failure metadata
     */
    public record DeadLetter(WorkItem item, Failure failure) {
    }
}

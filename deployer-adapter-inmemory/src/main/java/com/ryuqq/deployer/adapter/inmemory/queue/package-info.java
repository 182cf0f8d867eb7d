/**
 * In-memory work queue adapter.
 *
 * <p>Reference implementation of {@link com.ryuqq.deployer.core.spi.WorkQueue} with leases
 * and a dead letter list.</p>
 *
 * <h2>Item Lifecycle</h2>
 *
 * <pre>
 * enqueue ──► pending ──► dequeue (leased)
 *                            │
 *                            ├──► ack() ──────────────► [Removed]
 *                            ├──► nack() ─────────────► [Pending]
 *                            ├──► publishToDLQ() ─────► [Dead letters]
 *                            └──► lease runs out ─────► [Pending, reclaimed by the next dequeue]
 * </pre>
 *
 * <p>Data is lost on process restart.</p>
 *
 * @see com.ryuqq.deployer.core.spi.WorkQueue
 * @author Deployer Team
 * @since 1.0.0
 */
package com.ryuqq.deployer.adapter.inmemory.queue;

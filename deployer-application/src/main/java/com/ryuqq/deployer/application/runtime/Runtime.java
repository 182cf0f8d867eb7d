package com.ryuqq.deployer.application.runtime;

/**
 * Asynchronous deployment runtime.
 *
 * <p>Consumes deployment work items admitted by
 * {@link com.ryuqq.deployer.application.admission.DeploymentRepo} and executes them with the
 * {@link com.ryuqq.deployer.application.engine.StrategyEngine}.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * pump()
 *   ↓
 * 1. Dequeue work items from the WorkQueue (batch)
 * 2. For each WorkItem (bounded worker pool):
 *    a. Decode {"id": ...} and resolve the Deployment
 *    b. Already finished → ack (redelivery)
 *    c. Execute via StrategyEngine, optionally under a deadline
 *    d. Success or crash → ack
 *       Other failure → DLQ (or ack when DLQ is disabled)
 * </pre>
 *
 * <p><strong>Processing Guarantees:</strong></p>
 * <ul>
 *   <li>At-least-once delivery: a deployment may be dequeued more than once</li>
 *   <li>{@code finishedAt} is the durable completion marker; finished deployments are skipped</li>
 *   <li>Deployment steps are never retried by the runtime</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * // Typically invoked by a scheduler
 * {@literal @Scheduled}(fixedDelay = 100)
 * public void scheduledPump() {
 *     runtime.pump();
 * }
 * </pre>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Executes a single pump cycle: dequeue a batch and hand each item to the worker pool.
     *
     * <p>Returns once the batch is submitted; item processing continues in the background.
     * The caller is responsible for continuous invocation.</p>
     *
     * @throws RuntimeException if the work queue is unavailable
     */
    void pump();
}

/**
 * Live tail of the deployment event log.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.deployer.application.tail.LiveTail} - opens sessions</li>
 *   <li>{@link com.ryuqq.deployer.application.tail.TailSession} - catch-up then tail, driven by wake-up signals</li>
 *   <li>{@link com.ryuqq.deployer.application.tail.TailSink} - destination abstraction</li>
 *   <li>{@link com.ryuqq.deployer.application.tail.EventStreamWriter} - {@code text/event-stream} rendering</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.deployer.application.tail;

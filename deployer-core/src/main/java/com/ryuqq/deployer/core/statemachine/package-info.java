/**
 * Live tail session state machine.
 *
 * <p>A tail session moves {@code CONNECTING → READY → TAILING → CLOSED}; any non-terminal
 * state may close. Transitions are driven by signals taken from the wake-up subscription
 * queue rather than registered callbacks.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.deployer.core.statemachine.TailState} - session states</li>
 *   <li>{@link com.ryuqq.deployer.core.statemachine.StateTransition} - transition validation</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Deployer Team
 */
package com.ryuqq.deployer.core.statemachine;

/**
 * Wait outcome package.
 *
 * <p>This package defines the sealed result of a blocking wait for job events,
 * so callers handle every case explicitly.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.deployer.core.outcome.WaitOutcome} - Sealed interface (permits Matched, Unmatched)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.deployer.core.outcome.Matched} - Every expectation reached zero (success tally)</li>
 *   <li>{@link com.ryuqq.deployer.core.outcome.Unmatched} - Expectations left unmet, with the {@link com.ryuqq.deployer.core.outcome.UnmetReason}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Deployer Team
 */
package com.ryuqq.deployer.core.outcome;

/**
 * Deployment event log.
 *
 * <p>{@link com.ryuqq.deployer.application.log.DeploymentEventLog} combines the durable
 * {@link com.ryuqq.deployer.core.spi.DeploymentEventStore} with wake-up publication on
 * {@link com.ryuqq.deployer.core.spi.WakeUpChannel}.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.deployer.application.log;

/**
 * In-memory wake-up channel adapter.
 *
 * <p>Provides a process-local implementation of {@link com.ryuqq.deployer.core.spi.WakeUpChannel}
 * with fan-out delivery and fault injection hooks for tests.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
package com.ryuqq.deployer.adapter.inmemory.channel;

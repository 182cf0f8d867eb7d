/**
 * In-memory storage adapters.
 *
 * <p>This package provides reference implementations of the storage SPIs
 * for testing and educational purposes.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.deployer.adapter.inmemory.store.InMemoryDeploymentStore}:
 *       Thread-safe implementation of {@link com.ryuqq.deployer.core.spi.DeploymentStore}</li>
 *   <li>{@link com.ryuqq.deployer.adapter.inmemory.store.InMemoryDeploymentEventStore}:
 *       Thread-safe, append-only implementation of {@link com.ryuqq.deployer.core.spi.DeploymentEventStore}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No actual ACID transaction support</li>
 *   <li>Data lost on process restart</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
package com.ryuqq.deployer.adapter.inmemory.store;

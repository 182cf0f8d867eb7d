/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the contracts the deployer core consumes. Infrastructure adapters
 * provide the implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.deployer.core.spi.Controller} - formations and job event streams</li>
 *   <li>{@link com.ryuqq.deployer.core.spi.DeploymentStore} - deployment records</li>
 *   <li>{@link com.ryuqq.deployer.core.spi.DeploymentEventStore} - append-only deployment event log storage</li>
 *   <li>{@link com.ryuqq.deployer.core.spi.WakeUpChannel} - wake-up hints for live tails</li>
 *   <li>{@link com.ryuqq.deployer.core.spi.WorkQueue} - at-least-once work queue</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>Pluggability:</strong> In-memory adapters for tests, database/broker adapters for production</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Deployer Team
 */
package com.ryuqq.deployer.core.spi;

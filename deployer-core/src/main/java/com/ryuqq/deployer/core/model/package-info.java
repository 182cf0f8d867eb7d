/**
 * Core domain model for rolling deployments.
 *
 * <h2>Values</h2>
 * <ul>
 *   <li>{@link com.ryuqq.deployer.core.model.Formation} - desired instance count per process type for one release</li>
 *   <li>{@link com.ryuqq.deployer.core.model.JobEvent} - ephemeral scheduler lifecycle notification</li>
 *   <li>{@link com.ryuqq.deployer.core.model.Deployment} - managed transition between two releases</li>
 *   <li>{@link com.ryuqq.deployer.core.model.DeploymentEvent} - persisted record of one confirmed step</li>
 *   <li>{@link com.ryuqq.deployer.core.model.WorkItem} - unit of the at-least-once work queue</li>
 *   <li>{@link com.ryuqq.deployer.core.model.Failure} - dead-letter metadata</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> records with validating compact constructors; changes produce copies</li>
 *   <li><strong>Pure Java:</strong> no external dependencies</li>
 *   <li><strong>Closed sets:</strong> states, statuses and strategy kinds are enums</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Deployer Team
 */
package com.ryuqq.deployer.core.model;

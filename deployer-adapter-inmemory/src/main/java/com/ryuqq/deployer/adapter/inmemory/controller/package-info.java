/**
 * In-memory controller adapter.
 *
 * <p>Provides {@link com.ryuqq.deployer.adapter.inmemory.controller.InMemoryController}, a
 * process-local controller that keeps formations in memory and simulates the scheduler by
 * emitting job lifecycle events for every formation change.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
package com.ryuqq.deployer.adapter.inmemory.controller;

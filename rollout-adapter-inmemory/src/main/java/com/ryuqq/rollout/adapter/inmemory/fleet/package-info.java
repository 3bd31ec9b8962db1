/**
 * In-memory {@link com.ryuqq.rollout.core.spi.FleetClient} implementation.
 *
 * <p>Provides a deterministic, tick-driven simulated fleet for tests and local
 * experiments with the rollout runner.</p>
 *
 * <h2>Classes</h2>
 * <ul>
 *   <li>{@link com.ryuqq.rollout.adapter.inmemory.fleet.InMemoryFleetClient} - SPI implementation</li>
 *   <li>{@link com.ryuqq.rollout.adapter.inmemory.fleet.SimulatedNode} - Agent state machine</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.rollout.adapter.inmemory.fleet;

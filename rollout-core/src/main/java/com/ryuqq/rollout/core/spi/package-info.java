/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interface infrastructure adapters implement so the
 * runner can reach the fleet.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.rollout.core.spi.FleetClient} - Node discovery, run trigger and status queries</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., rollout-adapter-inmemory, or an RPC-backed client) provide
 * concrete implementations of this SPI.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on the transport</li>
 *   <li><strong>Pluggability:</strong> InMemory for tests, RPC transport for production</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.rollout.core.spi;

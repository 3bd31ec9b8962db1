/**
 * Core domain model for fleet rollouts.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.rollout.core.model.NodeName} - Fleet member identifier</li>
 *   <li>{@link com.ryuqq.rollout.core.model.TrackedNode} - In-flight entry {name, initiatedAt, checks}</li>
 *   <li>{@link com.ryuqq.rollout.core.model.NodeStatus} - Agent status snapshot</li>
 *   <li>{@link com.ryuqq.rollout.core.model.RunResponse} - Agent answer to a run request</li>
 *   <li>{@link com.ryuqq.rollout.core.model.FleetFilter} - Client selection snapshot</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Tracked entries are replaced on every poll, never mutated</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.rollout.core.model;

/**
 * Rollout runtime port.
 *
 * <p>{@link com.ryuqq.rollout.application.runtime.Rollout} is implemented by the runner
 * adapter; hosts (CLI, scheduler) depend only on this interface.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.rollout.application.runtime;

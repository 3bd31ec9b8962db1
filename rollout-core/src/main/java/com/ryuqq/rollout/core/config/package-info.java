/**
 * Runner configuration.
 *
 * <p>{@link com.ryuqq.rollout.core.config.RunnerConfiguration} is validated on construction;
 * an invalid configuration raises {@link com.ryuqq.rollout.core.config.ConfigurationException}
 * so no runner is ever built in an invalid state.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.rollout.core.config;

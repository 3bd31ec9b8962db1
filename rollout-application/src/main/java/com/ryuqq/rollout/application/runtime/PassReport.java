package com.ryuqq.rollout.application.runtime;

import com.ryuqq.rollout.core.model.NodeName;

import java.util.List;

/**
 * Summary of one pass over the fleet.
 *
 * @param enabledNodes number of enabled nodes discovered for the pass
 * @param dispatched number of nodes a run was successfully triggered on
 * @param failedToStart nodes whose run trigger failed
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PassReport(int enabledNodes, int dispatched, List<NodeName> failedToStart) {

    public PassReport {
        if (enabledNodes < 0) {
            throw new IllegalArgumentException("enabledNodes must be non-negative (current: " + enabledNodes + ")");
        }
        if (dispatched < 0) {
            throw new IllegalArgumentException("dispatched must be non-negative (current: " + dispatched + ")");
        }
        failedToStart = failedToStart == null ? List.of() : List.copyOf(failedToStart);
    }
}

package com.ryuqq.rollout.core.model;

import java.util.List;

/**
 * Snapshot of the selection currently applied by a {@link com.ryuqq.rollout.core.spi.FleetClient}.
 *
 * @param identity identity clauses (one node name each)
 * @param compound compound predicates (e.g. {@code puppet().enabled=true})
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record FleetFilter(List<NodeName> identity, List<String> compound) {

    public FleetFilter {
        identity = identity == null ? List.of() : List.copyOf(identity);
        compound = compound == null ? List.of() : List.copyOf(compound);
    }

    /**
     * Filter selecting every node.
     *
     * @return empty filter
     */
    public static FleetFilter empty() {
        return new FleetFilter(List.of(), List.of());
    }

    public boolean hasCompound() {
        return !compound.isEmpty();
    }

    public boolean isEmpty() {
        return identity.isEmpty() && compound.isEmpty();
    }
}

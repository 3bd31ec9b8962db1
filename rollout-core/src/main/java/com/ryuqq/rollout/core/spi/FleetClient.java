package com.ryuqq.rollout.core.spi;

import com.ryuqq.rollout.core.model.FleetFilter;
import com.ryuqq.rollout.core.model.NodeName;
import com.ryuqq.rollout.core.model.NodeStatus;
import com.ryuqq.rollout.core.model.RunResponse;

import java.util.List;
import java.util.Map;

/**
 * Remote fleet client SPI used by the rollout runner.
 *
 * <p>This interface abstracts the remote procedure transport that discovers nodes,
 * triggers agent runs and reports agent status. The runner never talks to the
 * network directly; it only calls the operations below.</p>
 *
 * <p><strong>Filter Model:</strong></p>
 * <ul>
 *   <li>Filters are stateful: {@link #compoundFilter(String)} and {@link #identityFilter(NodeName)}
 *       restrict every subsequent discovery, run and status call</li>
 *   <li>{@link #reset()} clears all filter and discovery state</li>
 *   <li>The runner always resets after a filtered call so later calls are not polluted</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * client.identityFilter(NodeName.of("web1.example.com"));
 * List&lt;NodeStatus&gt; statuses = client.status();
 * client.reset();
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Calls may block on the network; the runner calls them from a single thread</li>
 *   <li>Transport failures are reported as unchecked exceptions</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface FleetClient {

    /**
     * Returns a snapshot of the filter currently applied.
     *
     * @return current filter (never null)
     */
    FleetFilter filter();

    /**
     * Adds a compound predicate restricting subsequent discovery.
     *
     * @param predicate predicate in the client's query language (e.g. {@code puppet().enabled=true})
     * @throws IllegalArgumentException if predicate is null or blank
     */
    void compoundFilter(String predicate);

    /**
     * Restricts subsequent discovery and status calls to the given node.
     *
     * <p>Repeated calls accumulate: the filter then matches any of the given nodes.</p>
     *
     * @param name node identity
     * @throws IllegalArgumentException if name is null
     */
    void identityFilter(NodeName name);

    /**
     * Discovers the nodes matching the current filter.
     *
     * @return matching node names (may be empty)
     */
    List<NodeName> discover();

    /**
     * Uses the given nodes as the discovery result instead of querying the network.
     *
     * @param nodes nodes to address with the next request
     * @return the nodes now addressed (may be empty if none is known)
     * @throws IllegalArgumentException if nodes is null
     */
    List<NodeName> discover(List<NodeName> nodes);

    /**
     * Triggers a single agent run on the discovered nodes.
     *
     * @param arguments run arguments (e.g. {@code force}, {@code noop}, {@code tags})
     * @return one response per answering node
     */
    List<RunResponse> runOnce(Map<String, Object> arguments);

    /**
     * Queries agent status on the nodes matching the current filter.
     *
     * @return one status per answering node
     */
    List<NodeStatus> status();

    /**
     * Clears filter and discovery state.
     */
    void reset();

    /**
     * Enables or disables the client's own progress output.
     *
     * @param enabled false to suppress progress output
     */
    void progress(boolean enabled);
}

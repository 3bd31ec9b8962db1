package com.ryuqq.rollout.adapter.inmemory.fleet;

import com.ryuqq.rollout.core.model.FleetFilter;
import com.ryuqq.rollout.core.model.NodeName;
import com.ryuqq.rollout.core.model.NodeStatus;
import com.ryuqq.rollout.core.model.RunResponse;
import com.ryuqq.rollout.core.spi.FleetClient;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory implementation of {@link FleetClient} SPI for testing and reference purposes.
 *
 * <p>The fleet is a fixed set of {@link SimulatedNode}s driven by a logical clock.
 * Each {@link #status()} call is one tick: every node advances one step, then the
 * nodes matching the current filter report their state.</p>
 *
 * <p><strong>Filter Support:</strong></p>
 * <ul>
 *   <li>Identity filters: accumulate, match any of the given names</li>
 *   <li>Compound predicates: only {@code <agent>().enabled=true|false} is understood</li>
 *   <li>{@link #discover(List)}: pins the addressed nodes until {@link #reset()}</li>
 * </ul>
 *
 * <p><strong>Inspection:</strong></p>
 * <ul>
 *   <li>{@link #runCount(String)}: how many runs a node actually started</li>
 *   <li>{@link #maxInFlight()}: highest number of client-triggered nodes running at once</li>
 *   <li>{@link #runArguments()}: every argument map passed to {@link #runOnce(Map)}</li>
 * </ul>
 *
 * <p>All methods are synchronized; the instance may be shared between threads.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryFleetClient fleet = new InMemoryFleetClient(List.of(
 *     SimulatedNode.named("web1"),
 *     SimulatedNode.named("web2").startDelayPolls(2).runPolls(3),
 *     SimulatedNode.named("db1").disabled()
 * ));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryFleetClient implements FleetClient {

    private static final String ENABLED_SUFFIX = ".enabled=";

    private final Map<NodeName, SimulatedNode> nodes = new LinkedHashMap<>();
    private final List<NodeName> identity = new ArrayList<>();
    private final List<String> compound = new ArrayList<>();
    private final List<Map<String, Object>> runArguments = new ArrayList<>();

    private List<NodeName> discovered;
    private long tick = 1;
    private int maxInFlight;
    private int statusQueries;
    private boolean progress = true;

    /**
     * Creates a fleet of the given nodes.
     *
     * @param nodes fleet members (names must be unique)
     * @throws IllegalArgumentException if nodes is null or contains duplicate names
     */
    public InMemoryFleetClient(List<SimulatedNode> nodes) {
        if (nodes == null) {
            throw new IllegalArgumentException("nodes cannot be null");
        }
        for (SimulatedNode node : nodes) {
            if (this.nodes.putIfAbsent(node.name(), node) != null) {
                throw new IllegalArgumentException("Duplicate node: " + node.name());
            }
        }
    }

    @Override
    public synchronized FleetFilter filter() {
        return new FleetFilter(identity, compound);
    }

    @Override
    public synchronized void compoundFilter(String predicate) {
        if (predicate == null || predicate.isBlank()) {
            throw new IllegalArgumentException("predicate cannot be null or blank");
        }
        if (!predicate.contains(ENABLED_SUFFIX)) {
            throw new IllegalArgumentException("Unsupported compound predicate: " + predicate);
        }
        compound.add(predicate);
    }

    @Override
    public synchronized void identityFilter(NodeName name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        identity.add(name);
    }

    @Override
    public synchronized List<NodeName> discover() {
        List<NodeName> matching = new ArrayList<>();
        for (SimulatedNode node : nodes.values()) {
            if (matches(node)) {
                matching.add(node.name());
            }
        }
        discovered = matching;
        return List.copyOf(matching);
    }

    @Override
    public synchronized List<NodeName> discover(List<NodeName> requested) {
        if (requested == null) {
            throw new IllegalArgumentException("nodes cannot be null");
        }
        List<NodeName> known = new ArrayList<>();
        for (NodeName name : requested) {
            if (nodes.containsKey(name) && !known.contains(name)) {
                known.add(name);
            }
        }
        discovered = known;
        return List.copyOf(known);
    }

    @Override
    public synchronized List<RunResponse> runOnce(Map<String, Object> arguments) {
        runArguments.add(arguments == null ? Map.of() : Map.copyOf(arguments));

        List<RunResponse> responses = new ArrayList<>();
        for (NodeName name : targets()) {
            SimulatedNode node = nodes.get(name);
            int runsBefore = node.runCount();
            long initiatedAt = node.trigger(tick + 1);
            boolean started = node.runCount() > runsBefore;
            responses.add(new RunResponse(name, responseData(node, started, initiatedAt)));
        }
        maxInFlight = Math.max(maxInFlight, inFlight());
        return responses;
    }

    @Override
    public synchronized List<NodeStatus> status() {
        tick++;
        statusQueries++;

        List<NodeName> targets = targets();
        List<NodeStatus> statuses = new ArrayList<>();
        for (SimulatedNode node : nodes.values()) {
            NodeStatus status = node.advance(tick);
            if (targets.contains(node.name())) {
                statuses.add(status);
            }
        }
        return statuses;
    }

    @Override
    public synchronized void reset() {
        identity.clear();
        compound.clear();
        discovered = null;
    }

    @Override
    public synchronized void progress(boolean enabled) {
        this.progress = enabled;
    }

    public synchronized int runCount(String name) {
        SimulatedNode node = nodes.get(NodeName.of(name));
        if (node == null) {
            throw new IllegalArgumentException("Unknown node: " + name);
        }
        return node.runCount();
    }

    public synchronized int maxInFlight() {
        return maxInFlight;
    }

    public synchronized int statusQueries() {
        return statusQueries;
    }

    public synchronized boolean isProgressEnabled() {
        return progress;
    }

    public synchronized long currentTick() {
        return tick;
    }

    public synchronized List<Map<String, Object>> runArguments() {
        return Collections.unmodifiableList(new ArrayList<>(runArguments));
    }

    private List<NodeName> targets() {
        if (discovered != null) {
            return discovered;
        }
        List<NodeName> matching = new ArrayList<>();
        for (SimulatedNode node : nodes.values()) {
            if (matches(node)) {
                matching.add(node.name());
            }
        }
        return matching;
    }

    private boolean matches(SimulatedNode node) {
        if (!identity.isEmpty() && !identity.contains(node.name())) {
            return false;
        }
        for (String predicate : compound) {
            boolean wanted = Boolean.parseBoolean(
                predicate.substring(predicate.indexOf(ENABLED_SUFFIX) + ENABLED_SUFFIX.length()).trim());
            if (node.isEnabled() != wanted) {
                return false;
            }
        }
        return true;
    }

    private int inFlight() {
        int count = 0;
        for (SimulatedNode node : nodes.values()) {
            if (node.isInFlightFromClient()) {
                count++;
            }
        }
        return count;
    }

    private static Map<String, Object> responseData(SimulatedNode node, boolean started, long initiatedAt) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (started) {
            data.put(RunResponse.SUMMARY, "Started a run");
        } else if (!node.isEnabled()) {
            data.put(RunResponse.SUMMARY, "Agent is disabled");
        } else {
            data.put(RunResponse.SUMMARY, "Agent is already running");
        }
        if (!node.isLegacyAgent()) {
            data.put(RunResponse.INITIATED_AT, initiatedAt);
        }
        return data;
    }
}

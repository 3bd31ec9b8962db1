package com.ryuqq.rollout.adapter.inmemory.fleet;

import com.ryuqq.rollout.core.model.NodeName;
import com.ryuqq.rollout.core.model.NodeStatus;

/**
 * A single agent in an {@link InMemoryFleetClient}.
 *
 * <p>The node is configured fluently and then driven by the client: every
 * {@link InMemoryFleetClient#status()} call advances all nodes by one tick.</p>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * IDLE ──trigger──▶ REQUESTED (startDelayPolls ticks, applying=false)
 *                      ↓
 *                   APPLYING  (runPolls ticks, applying=true)
 *                      ↓
 *                   IDLE      (lastRun = finishing tick)
 * </pre>
 *
 * <p>A stuck node stays REQUESTED forever. A legacy node never reports {@code initiated_at}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SimulatedNode {

    enum Phase { IDLE, REQUESTED, APPLYING }

    private final NodeName name;
    private boolean enabled = true;
    private boolean legacyAgent;
    private boolean stuck;
    private int startDelayPolls;
    private int runPolls = 1;

    private Phase phase = Phase.IDLE;
    private int remaining;
    private long lastRun;
    private long initiatedAt;
    private boolean triggeredByClient;
    private int runCount;

    private SimulatedNode(NodeName name) {
        this.name = name;
    }

    /**
     * Creates an enabled, idle node that starts applying on the first tick after a
     * trigger and finishes one tick later.
     *
     * @param name node identity
     * @return new node
     */
    public static SimulatedNode named(String name) {
        return new SimulatedNode(NodeName.of(name));
    }

    public SimulatedNode disabled() {
        this.enabled = false;
        return this;
    }

    public SimulatedNode legacyAgent() {
        this.legacyAgent = true;
        return this;
    }

    public SimulatedNode stuck() {
        this.stuck = true;
        return this;
    }

    public SimulatedNode startDelayPolls(int polls) {
        if (polls < 0) {
            throw new IllegalArgumentException("startDelayPolls must be non-negative (current: " + polls + ")");
        }
        this.startDelayPolls = polls;
        return this;
    }

    public SimulatedNode runPolls(int polls) {
        if (polls < 1) {
            throw new IllegalArgumentException("runPolls must be positive (current: " + polls + ")");
        }
        this.runPolls = polls;
        return this;
    }

    /**
     * Puts the node into the applying state as if an operator had started a run by hand.
     *
     * @param polls ticks until the run finishes
     * @return this node
     */
    public SimulatedNode applyingOutOfBand(int polls) {
        if (polls < 1) {
            throw new IllegalArgumentException("polls must be positive (current: " + polls + ")");
        }
        this.phase = Phase.APPLYING;
        this.remaining = polls;
        this.initiatedAt = legacyAgent ? 0 : 1;
        return this;
    }

    public NodeName name() {
        return name;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isLegacyAgent() {
        return legacyAgent;
    }

    public int runCount() {
        return runCount;
    }

    public long lastRun() {
        return lastRun;
    }

    boolean isInFlightFromClient() {
        return triggeredByClient && phase != Phase.IDLE;
    }

    /**
     * Handles a run request at the given tick.
     *
     * @return the reported trigger timestamp, 0 if the node does not report one
     */
    long trigger(long tick) {
        if (!enabled || phase != Phase.IDLE) {
            return legacyAgent ? 0 : initiatedAt;
        }
        runCount++;
        triggeredByClient = true;
        initiatedAt = legacyAgent ? 0 : tick;
        if (!stuck && startDelayPolls == 0) {
            phase = Phase.APPLYING;
            remaining = runPolls;
        } else {
            phase = Phase.REQUESTED;
            remaining = startDelayPolls;
        }
        return initiatedAt;
    }

    /**
     * Advances the node by one tick and returns what it reports for that tick.
     */
    NodeStatus advance(long tick) {
        switch (phase) {
            case REQUESTED:
                if (!stuck) {
                    remaining--;
                    if (remaining <= 0) {
                        phase = Phase.APPLYING;
                        remaining = runPolls;
                    }
                }
                return snapshot(false);
            case APPLYING:
                NodeStatus status = snapshot(true);
                remaining--;
                if (remaining <= 0) {
                    phase = Phase.IDLE;
                    lastRun = tick;
                    triggeredByClient = false;
                }
                return status;
            default:
                return snapshot(false);
        }
    }

    private NodeStatus snapshot(boolean applying) {
        return new NodeStatus(name, applying, lastRun, legacyAgent ? 0 : initiatedAt);
    }
}

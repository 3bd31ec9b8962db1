package com.ryuqq.rollout.application.runtime;

import java.time.Duration;

/**
 * Fleet rollout pass driver.
 *
 * <p>This interface defines how a full sweep over the fleet is started: either a
 * single pass, or passes repeated forever with a minimum cadence.</p>
 *
 * <p><strong>Pass Flow:</strong></p>
 * <pre>
 * runAllOnce()
 *   ↓
 * 1. Discover enabled nodes
 * 2. Dispatch runs while at most {@code concurrency} nodes are in flight
 * 3. Poll agent status until every dispatched node finished or was evicted
 *   ↓
 * PassReport
 * </pre>
 *
 * <p><strong>Repeat Mode:</strong></p>
 * <ul>
 *   <li>Each pass is timed wall-clock, before and after {@link #runAllOnce()}</li>
 *   <li>A pass shorter than {@code minInterval} is followed by a sleep for the difference</li>
 *   <li>A pass at least as long as {@code minInterval} is followed immediately by the next one</li>
 * </ul>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>Single control thread; calls block until the pass completes</li>
 *   <li>No cancellation mid-pass; repeat mode only stops on process termination or interrupt</li>
 * </ul>
 *
 * <p><strong>Error Handling Strategy:</strong></p>
 * <ul>
 *   <li>Per-node failures (run never reached applying state, trigger failed) are logged, never abort the pass</li>
 *   <li>Discovery failures propagate to the caller</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Rollout {

    /**
     * Runs one pass, or passes forever when {@code repeat} is set.
     *
     * @param repeat true to repeat passes forever
     * @param minInterval minimum time between the starts of two passes (used only when repeating)
     * @throws IllegalArgumentException if minInterval is null or negative
     */
    void runAll(boolean repeat, Duration minInterval);

    /**
     * Runs a single pass over all enabled nodes.
     *
     * @return pass summary
     */
    PassReport runAllOnce();

    /**
     * Repeats passes forever, starting at most one pass per {@code minInterval}.
     *
     * @param minInterval minimum time between the starts of two passes
     * @throws IllegalArgumentException if minInterval is null or negative
     */
    void runAllForever(Duration minInterval);
}

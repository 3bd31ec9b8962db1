package com.ryuqq.rollout.adapter.inmemory.fleet;

import com.ryuqq.rollout.core.model.NodeName;
import com.ryuqq.rollout.core.model.NodeStatus;
import com.ryuqq.rollout.core.model.RunResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link InMemoryFleetClient} and the {@link SimulatedNode} lifecycle it drives.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryFleetClientTest {

    private static final NodeName WEB1 = NodeName.of("web1");
    private static final NodeName WEB2 = NodeName.of("web2");
    private static final NodeName DB1 = NodeName.of("db1");

    private InMemoryFleetClient fleet() {
        return new InMemoryFleetClient(List.of(
            SimulatedNode.named("web1"),
            SimulatedNode.named("web2").startDelayPolls(1).runPolls(2),
            SimulatedNode.named("db1").disabled()
        ));
    }

    @Test
    @DisplayName("discover() with the enabled predicate returns only enabled nodes")
    void discover_EnabledPredicate_ReturnsEnabledNodes() {
        // Given
        InMemoryFleetClient fleet = fleet();
        fleet.compoundFilter("puppet().enabled=true");

        // When
        List<NodeName> nodes = fleet.discover();

        // Then
        assertThat(nodes).containsExactly(WEB1, WEB2);
        assertThat(fleet.filter().hasCompound()).isTrue();
    }

    @Test
    @DisplayName("reset() clears identity and compound filters")
    void reset_ClearsFilters() {
        // Given
        InMemoryFleetClient fleet = fleet();
        fleet.compoundFilter("puppet().enabled=false");
        fleet.identityFilter(DB1);

        // When
        fleet.reset();

        // Then
        assertThat(fleet.filter().isEmpty()).isTrue();
        assertThat(fleet.discover()).containsExactly(WEB1, WEB2, DB1);
    }

    @Test
    @DisplayName("compoundFilter() rejects predicates it cannot evaluate")
    void compoundFilter_UnsupportedPredicate_ThrowsException() {
        InMemoryFleetClient fleet = fleet();

        assertThatThrownBy(() -> fleet.compoundFilter("facts.os=linux"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unsupported compound predicate");
    }

    @Test
    @DisplayName("runOnce() on a discovered node starts a run and reports its trigger time")
    void runOnce_IdleNode_StartsRun() {
        // Given
        InMemoryFleetClient fleet = fleet();
        fleet.discover(List.of(WEB1));

        // When
        List<RunResponse> responses = fleet.runOnce(Map.of("force", true));

        // Then
        assertThat(responses).hasSize(1);
        RunResponse response = responses.get(0);
        assertThat(response.sender()).isEqualTo(WEB1);
        assertThat(response.summary()).isEqualTo("Started a run");
        assertThat(response.initiatedAt()).hasValue(fleet.currentTick() + 1);
        assertThat(fleet.runCount("web1")).isEqualTo(1);
        assertThat(fleet.runArguments()).containsExactly(Map.of("force", true));
    }

    @Test
    @DisplayName("runOnce() reports disabled and busy agents without starting a run")
    void runOnce_DisabledOrBusyNode_DoesNotStartRun() {
        // Given
        InMemoryFleetClient fleet = new InMemoryFleetClient(List.of(
            SimulatedNode.named("db1").disabled(),
            SimulatedNode.named("web1").applyingOutOfBand(2)
        ));

        // When
        List<RunResponse> responses = fleet.runOnce(Map.of());

        // Then
        assertThat(responses).extracting(RunResponse::summary)
            .containsExactly("Agent is disabled", "Agent is already running");
        assertThat(fleet.runCount("db1")).isZero();
        assertThat(fleet.runCount("web1")).isZero();
        assertThat(fleet.maxInFlight()).isZero();
    }

    @Test
    @DisplayName("A legacy agent omits initiated_at")
    void runOnce_LegacyAgent_OmitsInitiatedAt() {
        // Given
        InMemoryFleetClient fleet = new InMemoryFleetClient(List.of(SimulatedNode.named("old").legacyAgent()));

        // When
        RunResponse response = fleet.runOnce(Map.of()).get(0);

        // Then
        assertThat(response.data()).doesNotContainKey(RunResponse.INITIATED_AT);
        assertThat(response.initiatedAt()).isEmpty();
    }

    @Test
    @DisplayName("status() walks a triggered node through requested, applying and idle")
    void status_TriggeredNode_FollowsLifecycle() {
        // Given
        InMemoryFleetClient fleet = fleet();
        fleet.discover(List.of(WEB2));
        long initiatedAt = fleet.runOnce(Map.of()).get(0).initiatedAt().getAsLong();
        fleet.reset();
        fleet.identityFilter(WEB2);

        // When
        NodeStatus requested = fleet.status().get(0);
        NodeStatus applying1 = fleet.status().get(0);
        NodeStatus applying2 = fleet.status().get(0);
        NodeStatus idle = fleet.status().get(0);

        // Then
        assertThat(requested.applying()).isFalse();
        assertThat(requested.initiatedAt()).isEqualTo(initiatedAt);
        assertThat(applying1.applying()).isTrue();
        assertThat(applying2.applying()).isTrue();
        assertThat(idle.applying()).isFalse();
        assertThat(idle.lastRun()).isGreaterThanOrEqualTo(initiatedAt);
        assertThat(fleet.statusQueries()).isEqualTo(4);
    }

    @Test
    @DisplayName("A stuck node never reports applying")
    void status_StuckNode_NeverApplies() {
        // Given
        InMemoryFleetClient fleet = new InMemoryFleetClient(List.of(SimulatedNode.named("stuck").stuck()));
        fleet.runOnce(Map.of());

        // When & Then
        for (int i = 0; i < 10; i++) {
            assertThat(fleet.status()).singleElement()
                .satisfies(status -> assertThat(status.applying()).isFalse());
        }
    }

    @Test
    @DisplayName("maxInFlight() records the highest number of client-triggered nodes running at once")
    void maxInFlight_TracksConcurrentRuns() {
        // Given
        InMemoryFleetClient fleet = new InMemoryFleetClient(List.of(
            SimulatedNode.named("a").runPolls(5),
            SimulatedNode.named("b").runPolls(5),
            SimulatedNode.named("c").runPolls(5)
        ));

        // When
        fleet.discover(List.of(NodeName.of("a"), NodeName.of("b")));
        fleet.runOnce(Map.of());
        fleet.reset();
        fleet.discover(List.of(NodeName.of("c")));
        fleet.runOnce(Map.of());

        // Then
        assertThat(fleet.maxInFlight()).isEqualTo(3);
    }

    @Test
    @DisplayName("progress() toggles the progress flag")
    void progress_TogglesFlag() {
        InMemoryFleetClient fleet = fleet();
        assertThat(fleet.isProgressEnabled()).isTrue();

        fleet.progress(false);

        assertThat(fleet.isProgressEnabled()).isFalse();
    }

    @Test
    @DisplayName("Constructor rejects duplicate node names")
    void constructor_DuplicateNames_ThrowsException() {
        assertThatThrownBy(() -> new InMemoryFleetClient(List.of(
            SimulatedNode.named("web1"),
            SimulatedNode.named("web1")
        )))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate node");
    }

    @Test
    @DisplayName("SimulatedNode rejects invalid poll counts")
    void simulatedNode_InvalidPolls_ThrowsException() {
        assertThatThrownBy(() -> SimulatedNode.named("x").runPolls(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SimulatedNode.named("x").startDelayPolls(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> fleet().runCount("unknown"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown node");
    }
}

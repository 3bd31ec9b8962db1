package com.ryuqq.rollout.adapter.runner;

import com.ryuqq.rollout.core.config.RunnerConfiguration;
import com.ryuqq.rollout.core.logging.RunLog;
import com.ryuqq.rollout.core.model.NodeName;
import com.ryuqq.rollout.core.model.RunResponse;
import com.ryuqq.rollout.core.spi.FleetClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * NodeRunTrigger 유닛 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>구버전 에이전트 (initiated_at 없음) → 0</li>
 *   <li>initiated_at 보고 → 해당 값</li>
 *   <li>discover → runOnce → reset 순서, 실패 시에도 reset</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class NodeRunTriggerTest {

    private static final NodeName HOST = NodeName.of("web1.example.com");
    private static final Map<String, Object> FORCE_ONLY = Map.of("force", true);

    @Mock
    private FleetClient client;

    private NodeRunTrigger trigger;

    @BeforeEach
    void setUp() {
        trigger = new NodeRunTrigger(client, RunArguments.forTrigger(RunnerConfiguration.of(1)), new RunLog());
    }

    @Test
    void runHost_구버전_에이전트면_0을_반환함() {
        // given
        when(client.runOnce(FORCE_ONLY))
            .thenReturn(List.of(new RunResponse(HOST, Map.of("summary", "Started a run"))));

        // when
        long initiatedAt = trigger.runHost(HOST);

        // then
        assertThat(initiatedAt).isZero();
        InOrder inOrder = inOrder(client);
        inOrder.verify(client).discover(List.of(HOST));
        inOrder.verify(client).runOnce(FORCE_ONLY);
        inOrder.verify(client).reset();
    }

    @Test
    void runHost_실행_요청_시각을_반환함() {
        // given
        when(client.runOnce(FORCE_ONLY))
            .thenReturn(List.of(new RunResponse(HOST, Map.of("summary", "Started a run", "initiated_at", "123"))));

        // when
        long initiatedAt = trigger.runHost(HOST);

        // then
        assertThat(initiatedAt).isEqualTo(123L);
        verify(client).reset();
    }

    @Test
    void runHost_응답이_없으면_0을_반환함() {
        // given
        when(client.runOnce(FORCE_ONLY)).thenReturn(List.of());

        // when & then
        assertThat(trigger.runHost(HOST)).isZero();
        verify(client).reset();
    }

    @Test
    void runHost_원격_호출이_실패해도_필터를_초기화함() {
        // given
        when(client.runOnce(FORCE_ONLY)).thenThrow(new IllegalStateException("rpc timeout"));

        // when & then
        assertThatThrownBy(() -> trigger.runHost(HOST))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("rpc timeout");
        verify(client).reset();
    }

    @Test
    void runHost_설정된_실행_인자를_force와_함께_전달함() {
        // given
        RunnerConfiguration configuration = RunnerConfiguration.of(1).withNoop(true).withTags(List.of("web", "db"));
        trigger = new NodeRunTrigger(client, RunArguments.forTrigger(configuration), new RunLog());
        Map<String, Object> expected = Map.of("force", true, "noop", true, "tags", "web,db");
        when(client.runOnce(expected))
            .thenReturn(List.of(new RunResponse(HOST, Map.of("initiated_at", 7L))));

        // when
        long initiatedAt = trigger.runHost(HOST);

        // then
        assertThat(initiatedAt).isEqualTo(7L);
    }

    @Test
    void runHost_실행_요청을_로그로_남김() {
        // given
        RunLog runLog = new RunLog();
        List<String> lines = new ArrayList<>();
        runLog.install(lines::add);
        trigger = new NodeRunTrigger(client, FORCE_ONLY, runLog);

        // when
        trigger.runHost(HOST);

        // then
        assertThat(lines).containsExactly("Running agent on host web1.example.com");
    }

    @Test
    void 생성자_의존성이_null이면_예외() {
        assertThatThrownBy(() -> new NodeRunTrigger(null, FORCE_ONLY, new RunLog()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("client cannot be null");
    }
}

package com.ryuqq.rollout.adapter.runner;

import com.ryuqq.rollout.core.logging.RunLog;
import com.ryuqq.rollout.core.model.NodeName;
import com.ryuqq.rollout.core.model.RunResponse;
import com.ryuqq.rollout.core.spi.FleetClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * 단일 노드 실행 트리거.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * runHost(name)
 *   ↓
 * 1. client.discover([name]) → 대상 노드 지정
 * 2. client.runOnce(arguments) → 원격 실행 요청 (force=true)
 * 3. 첫 응답의 initiated_at 반환 (없으면 0: 구버전 에이전트)
 * 4. client.reset() → 필터 초기화 (예외 발생 시에도 항상)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class NodeRunTrigger {

    private static final Logger log = LoggerFactory.getLogger(NodeRunTrigger.class);

    private final FleetClient client;
    private final Map<String, Object> arguments;
    private final RunLog runLog;

    /**
     * 생성자.
     *
     * @param client fleet 클라이언트
     * @param arguments run once 인자 (force 포함)
     * @param runLog 진단 메시지 sink 홀더
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public NodeRunTrigger(FleetClient client, Map<String, Object> arguments, RunLog runLog) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (arguments == null) {
            throw new IllegalArgumentException("arguments cannot be null");
        }
        if (runLog == null) {
            throw new IllegalArgumentException("runLog cannot be null");
        }
        this.client = client;
        this.arguments = Map.copyOf(arguments);
        this.runLog = runLog;
    }

    /**
     * 노드에 1회 실행을 요청하고 트리거 시각을 반환.
     *
     * @param host 대상 노드
     * @return 에이전트가 보고한 트리거 시각, 보고하지 않으면 0
     * @throws RuntimeException 원격 호출이 실패한 경우 (클라이언트 예외 그대로 전파)
     */
    public long runHost(NodeName host) {
        runLog.log("Running agent on host " + host);
        try {
            client.discover(List.of(host));
            List<RunResponse> responses = client.runOnce(arguments);

            if (responses == null || responses.isEmpty()) {
                log.warn("No response to run request from {}", host);
                return 0;
            }

            RunResponse response = responses.get(0);
            log.debug("{} answered run request: {}", host, response.summary());

            OptionalLong initiatedAt = response.initiatedAt();
            if (initiatedAt.isEmpty()) {
                // 구버전 에이전트는 initiated_at을 보고하지 않음
                log.debug("{} did not report initiated_at, treating it as an older agent", host);
                return 0;
            }
            return Math.max(0L, initiatedAt.getAsLong());

        } finally {
            client.reset();
        }
    }
}

package com.ryuqq.rollout.adapter.runner;

import com.ryuqq.rollout.core.logging.RunLog;
import com.ryuqq.rollout.core.model.NodeName;
import com.ryuqq.rollout.core.model.NodeStatus;
import com.ryuqq.rollout.core.model.TrackedNode;
import com.ryuqq.rollout.core.spi.FleetClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-flight 노드 집합 갱신기.
 *
 * <p>이전 폴링의 추적 목록을 받아 상태를 조회하고, 여전히 진행 중인 노드 목록을 새로 만들어 반환합니다.
 * 입력 목록은 변경하지 않습니다.</p>
 *
 * <p><strong>판정 규칙 (후보 노드별):</strong></p>
 * <pre>
 * status 없음                         → 제거 (이미 완료된 것으로 간주)
 * applying = true                     → 유지, checks = 0
 * applying = false, 이전에 applying 관측  → 제거 (요청한 실행이 끝남)
 * applying = false, lastRun ≥ 트리거 시각 → 제거
 * applying = false, 그 외              → 유지, checks + 1
 *                                         checks > 5 이면 제거 + 로그
 * </pre>
 *
 * <p>"applying"은 재시도 카운터를 초기화하고, "요청했지만 아직 시작 안 함"은 카운터를 진행시킵니다.
 * 5회 폴링 안에 applying 상태로 넘어가지 않는 노드는 패스를 막지 않도록 포기합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ApplyingSetTracker {

    /**
     * applying 상태로 넘어가기를 기다리는 최대 폴링 횟수.
     */
    public static final int MAX_CHECKS = 5;

    private static final Logger log = LoggerFactory.getLogger(ApplyingSetTracker.class);

    private final FleetClient client;
    private final RunLog runLog;

    /**
     * 생성자.
     *
     * @param client fleet 클라이언트
     * @param runLog 진단 메시지 sink 홀더
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ApplyingSetTracker(FleetClient client, RunLog runLog) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (runLog == null) {
            throw new IllegalArgumentException("runLog cannot be null");
        }
        this.client = client;
        this.runLog = runLog;
    }

    /**
     * 이전 추적 정보 없이 후보 노드의 진행 상태 조회.
     *
     * @param candidates 후보 노드
     * @return 진행 중인 노드 목록
     */
    public List<TrackedNode> findApplyingNodes(List<NodeName> candidates) {
        return findApplyingNodes(candidates, List.of());
    }

    /**
     * 후보 노드의 상태를 조회하여 갱신된 추적 목록 반환.
     *
     * @param candidates 실행을 요청했고 아직 완료가 확인되지 않은 노드
     * @param previouslyTracked 이전 폴링 결과
     * @return 여전히 진행 중인 노드 목록 (완료/제외된 노드 제외)
     */
    public List<TrackedNode> findApplyingNodes(List<NodeName> candidates, List<TrackedNode> previouslyTracked) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        Set<NodeName> names = new LinkedHashSet<>(candidates);
        Map<NodeName, TrackedNode> previous = index(previouslyTracked);
        Map<NodeName, NodeStatus> latest = queryStatus(names);

        List<TrackedNode> applying = new ArrayList<>();
        for (NodeName name : names) {
            NodeStatus status = latest.get(name);
            if (status == null) {
                continue;
            }

            TrackedNode tracked = previous.get(name);
            if (status.applying()) {
                applying.add(tracked != null
                    ? tracked.observedApplying()
                    : TrackedNode.dispatched(name, Math.max(0L, status.initiatedAt())).observedApplying());
                continue;
            }

            if (tracked != null && tracked.completedBy(status.lastRun())) {
                log.debug("{} finished its run (lastRun={}, initiatedAt={})", name, status.lastRun(), tracked.initiatedAt());
                continue;
            }

            TrackedNode waiting = tracked != null
                ? tracked.nextCheck()
                : new TrackedNode(name, Math.max(0L, status.initiatedAt()), 1);
            if (waiting.checks() > MAX_CHECKS) {
                log.warn("{} did not start applying after {} checks, evicting", name, MAX_CHECKS);
                runLog.log("Host " + name + " did not move into an applying state. Skipping.");
                continue;
            }
            applying.add(waiting);
        }
        return applying;
    }

    private Map<NodeName, NodeStatus> queryStatus(Set<NodeName> names) {
        List<NodeStatus> statuses;
        try {
            for (NodeName name : names) {
                client.identityFilter(name);
            }
            statuses = client.status();
        } finally {
            client.reset();
        }

        Map<NodeName, NodeStatus> latest = new HashMap<>();
        if (statuses != null) {
            for (NodeStatus status : statuses) {
                if (names.contains(status.sender())) {
                    latest.put(status.sender(), status);
                }
            }
        }
        return latest;
    }

    private static Map<NodeName, TrackedNode> index(List<TrackedNode> tracked) {
        Map<NodeName, TrackedNode> byName = new HashMap<>();
        if (tracked != null) {
            for (TrackedNode node : tracked) {
                byName.putIfAbsent(node.name(), node);
            }
        }
        return byName;
    }
}

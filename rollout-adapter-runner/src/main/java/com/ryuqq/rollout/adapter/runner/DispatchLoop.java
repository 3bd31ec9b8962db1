package com.ryuqq.rollout.adapter.runner;

import com.ryuqq.rollout.core.logging.RunLog;
import com.ryuqq.rollout.core.model.NodeName;
import com.ryuqq.rollout.core.model.TrackedNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 동시성 한도를 지키는 노드 실행 스케줄러.
 *
 * <p>작업 큐의 노드를 순서대로 실행시키되, in-flight 노드 수가 concurrency를 넘지 않도록
 * 빈 슬롯이 생길 때만 다음 노드를 꺼냅니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * while (queue 또는 running 비어있지 않음):
 *   1. 슬롯이 남는 동안: queue.poll() → trigger.runHost() → running 추가 (checks=0)
 *   2. running = tracker.findApplyingNodes(running 이름, running)
 *   3. 빈 슬롯 없음 또는 queue 소진 후 대기 중인 노드 있음 → sleep(1초)
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>단일 제어 스레드에서 동작 (concurrency는 원격 노드 수 기준)</li>
 *   <li>queue와 running은 runHosts() 호출 동안 이 메서드만 소유</li>
 *   <li>재귀 없이 명시적 루프로 동작하여 fleet 크기와 무관하게 스택 깊이 일정</li>
 * </ul>
 *
 * <p>개별 노드의 트리거 실패는 로그만 남기고 건너뛰며, 패스 전체를 중단하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DispatchLoop {

    /**
     * 슬롯이 없을 때 다음 폴링까지 대기하는 시간.
     */
    public static final Duration POLL_INTERVAL = Duration.ofSeconds(1);

    private static final Logger log = LoggerFactory.getLogger(DispatchLoop.class);

    private final NodeRunTrigger trigger;
    private final ApplyingSetTracker tracker;
    private final int concurrency;
    private final Sleeper sleeper;
    private final RunLog runLog;

    /**
     * 생성자.
     *
     * @param trigger 노드 실행 트리거
     * @param tracker in-flight 집합 갱신기
     * @param concurrency 동시 실행 노드 수 (1 이상)
     * @param sleeper 폴링 대기
     * @param runLog 진단 메시지 sink 홀더
     * @throws IllegalArgumentException 의존성이 null이거나 concurrency가 1 미만인 경우
     */
    public DispatchLoop(NodeRunTrigger trigger, ApplyingSetTracker tracker, int concurrency, Sleeper sleeper, RunLog runLog) {
        if (trigger == null) {
            throw new IllegalArgumentException("trigger cannot be null");
        }
        if (tracker == null) {
            throw new IllegalArgumentException("tracker cannot be null");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be positive (current: " + concurrency + ")");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (runLog == null) {
            throw new IllegalArgumentException("runLog cannot be null");
        }
        this.trigger = trigger;
        this.tracker = tracker;
        this.concurrency = concurrency;
        this.sleeper = sleeper;
        this.runLog = runLog;
    }

    /**
     * 큐의 모든 노드를 실행시키고, 모두 완료되거나 제외될 때까지 대기.
     *
     * @param hosts 실행할 노드 (앞쪽부터 실행)
     * @return 실행 결과 요약
     * @throws RolloutInterruptedException 폴링 대기 중 인터럽트 발생 시
     */
    public DispatchResult runHosts(List<NodeName> hosts) {
        Deque<NodeName> queue = hosts == null ? new ArrayDeque<>() : new ArrayDeque<>(hosts);
        List<TrackedNode> running = new ArrayList<>();
        List<NodeName> failedToStart = new ArrayList<>();
        int dispatched = 0;

        while (!queue.isEmpty() || !running.isEmpty()) {
            // 1. 빈 슬롯만큼 실행 요청
            while (running.size() < concurrency && !queue.isEmpty()) {
                NodeName host = queue.poll();
                if (isTracked(running, host)) {
                    log.debug("{} is already in flight, not dispatching it twice", host);
                    continue;
                }
                try {
                    long initiatedAt = trigger.runHost(host);
                    running.add(TrackedNode.dispatched(host, initiatedAt));
                    dispatched++;
                } catch (RolloutInterruptedException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.error("Failed to trigger a run on {}", host, e);
                    runLog.log("Failed to start a run on host " + host + ": " + e.getMessage());
                    failedToStart.add(host);
                }
            }

            if (running.isEmpty()) {
                continue;
            }

            // 2. 상태 폴링 (완료/제외된 노드는 목록에서 빠짐)
            running = new ArrayList<>(tracker.findApplyingNodes(names(running), running));

            // 3. 슬롯이 없거나 남은 노드를 기다리는 중이면 대기
            if (running.size() >= concurrency || (queue.isEmpty() && !running.isEmpty())) {
                log.trace("{} nodes in flight, {} queued; waiting {}", running.size(), queue.size(), POLL_INTERVAL);
                sleep(POLL_INTERVAL);
            }
        }

        log.info("Dispatch finished: {} dispatched, {} failed to start", dispatched, failedToStart.size());
        return new DispatchResult(dispatched, failedToStart);
    }

    public int concurrency() {
        return concurrency;
    }

    private static boolean isTracked(List<TrackedNode> running, NodeName host) {
        for (TrackedNode node : running) {
            if (node.name().equals(host)) {
                return true;
            }
        }
        return false;
    }

    private static List<NodeName> names(List<TrackedNode> running) {
        List<NodeName> names = new ArrayList<>(running.size());
        for (TrackedNode node : running) {
            names.add(node.name());
        }
        return names;
    }

    /**
     * Sleep (폴링 간격 대기).
     *
     * <p>InterruptedException 발생 시 현재 스레드의 인터럽트 플래그를 복원하고
     * RolloutInterruptedException으로 래핑하여 던집니다.</p>
     *
     * @param duration 대기 시간
     */
    private void sleep(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RolloutInterruptedException("Polling interrupted", e);
        }
    }
}

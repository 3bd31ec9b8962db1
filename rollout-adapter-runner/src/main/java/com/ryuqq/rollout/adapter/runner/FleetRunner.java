package com.ryuqq.rollout.adapter.runner;

import com.ryuqq.rollout.application.runtime.PassReport;
import com.ryuqq.rollout.application.runtime.Rollout;
import com.ryuqq.rollout.core.config.ConfigurationException;
import com.ryuqq.rollout.core.config.RunnerConfiguration;
import com.ryuqq.rollout.core.logging.RunLog;
import com.ryuqq.rollout.core.logging.RunLogger;
import com.ryuqq.rollout.core.model.NodeName;
import com.ryuqq.rollout.core.model.TrackedNode;
import com.ryuqq.rollout.core.spi.FleetClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Fleet 롤아웃 러너 ({@link Rollout} 구현체).
 *
 * <p>활성화된 노드를 찾아 {@link DispatchLoop}에 넘기는 패스를 1회 또는 무한 반복 실행합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>생성 시 설정 검증 (concurrency, compound 필터)</li>
 *   <li>활성 노드 탐색 ({@value #ENABLED_NODES_FILTER})</li>
 *   <li>패스 반복 시 최소 간격 유지</li>
 *   <li>진단 메시지 sink 관리 ({@link #logger(RunLogger)})</li>
 * </ul>
 *
 * <p><strong>반복 모드 타이밍:</strong></p>
 * <pre>
 * start = clock.instant()
 * runAllOnce()
 * elapsed = clock.instant() - start
 * elapsed &lt; minInterval  → sleep(minInterval - elapsed)
 * elapsed ≥ minInterval  → 즉시 다음 패스
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FleetRunner implements Rollout {

    /**
     * 활성화된(관리자가 비활성화하지 않은) 노드만 선택하는 compound 조건.
     */
    public static final String ENABLED_NODES_FILTER = "puppet().enabled=true";

    /**
     * {@link #runAllForever(Duration, long)}의 패스 수 제한 없음.
     */
    public static final long UNBOUNDED = -1L;

    private static final Logger log = LoggerFactory.getLogger(FleetRunner.class);

    private final FleetClient client;
    private final RunnerConfiguration configuration;
    private final Clock clock;
    private final Sleeper sleeper;
    private final RunLog runLog;
    private final Map<String, Object> runArguments;
    private final NodeRunTrigger trigger;
    private final ApplyingSetTracker tracker;
    private final DispatchLoop dispatchLoop;

    /**
     * 생성자 (시스템 시계, 실제 sleep 사용).
     *
     * @param client fleet 클라이언트
     * @param configuration 러너 설정
     * @throws ConfigurationException 설정이 없거나 클라이언트에 compound 필터가 있는 경우
     */
    public FleetRunner(FleetClient client, RunnerConfiguration configuration) {
        this(client, configuration, Clock.systemUTC(), Sleeper.threadSleeper());
    }

    /**
     * 생성자 (시계와 Sleeper 주입).
     *
     * @param client fleet 클라이언트
     * @param configuration 러너 설정
     * @param clock 패스 시간 측정용 시계
     * @param sleeper 대기 구현
     * @throws ConfigurationException 설정이 없거나 클라이언트에 compound 필터가 있는 경우
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public FleetRunner(FleetClient client, RunnerConfiguration configuration, Clock clock, Sleeper sleeper) {
        if (configuration == null) {
            throw new ConfigurationException("Concurrency has to be > 0");
        }
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (client.filter().hasCompound()) {
            throw new ConfigurationException("The compound filter should be empty");
        }

        this.client = client;
        this.configuration = configuration;
        this.clock = clock;
        this.sleeper = sleeper;
        this.runLog = new RunLog();
        this.runArguments = RunArguments.from(configuration);
        this.trigger = new NodeRunTrigger(client, RunArguments.forTrigger(configuration), runLog);
        this.tracker = new ApplyingSetTracker(client, runLog);
        this.dispatchLoop = new DispatchLoop(trigger, tracker, configuration.concurrency(), sleeper, runLog);

        client.progress(false);
    }

    @Override
    public void runAll(boolean repeat, Duration minInterval) {
        if (repeat) {
            runAllForever(minInterval);
        } else {
            runAllOnce();
        }
    }

    @Override
    public PassReport runAllOnce() {
        log("Running all nodes with a concurrency of " + configuration.concurrency());
        List<NodeName> nodes = findEnabledNodes();
        log("Found " + nodes.size() + " enabled nodes");
        log.info("Pass started: {} enabled nodes, concurrency {}", nodes.size(), configuration.concurrency());

        DispatchResult result = runHosts(nodes);
        return new PassReport(nodes.size(), result.dispatched(), result.failedToStart());
    }

    @Override
    public void runAllForever(Duration minInterval) {
        runAllForever(minInterval, UNBOUNDED);
    }

    /**
     * 최대 maxPasses번 패스를 반복 (테스트용 상한).
     *
     * @param minInterval 두 패스 시작 사이 최소 간격
     * @param maxPasses 실행할 패스 수, {@link #UNBOUNDED}이면 무한
     * @throws IllegalArgumentException minInterval이 null/음수이거나 maxPasses가 유효하지 않은 경우
     * @throws RolloutInterruptedException 대기 중 인터럽트 발생 시
     */
    public void runAllForever(Duration minInterval, long maxPasses) {
        if (minInterval == null || minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must be non-negative (current: " + minInterval + ")");
        }
        if (maxPasses < 0 && maxPasses != UNBOUNDED) {
            throw new IllegalArgumentException("maxPasses must be non-negative or UNBOUNDED (current: " + maxPasses + ")");
        }

        for (long pass = 0; maxPasses == UNBOUNDED || pass < maxPasses; pass++) {
            Instant start = clock.instant();
            runAllOnce();
            Instant stop = clock.instant();

            Duration elapsed = Duration.between(start, stop);
            if (elapsed.compareTo(minInterval) < 0) {
                Duration remaining = minInterval.minus(elapsed);
                log("Sleeping for " + seconds(remaining) + " seconds before the next run");
                sleep(remaining);
            } else {
                log.debug("Pass took {}, not shorter than {}; starting the next pass immediately", elapsed, minInterval);
            }
        }
    }

    /**
     * 활성화된 노드 탐색.
     *
     * @return 활성 노드 목록
     */
    public List<NodeName> findEnabledNodes() {
        try {
            client.compoundFilter(ENABLED_NODES_FILTER);
            List<NodeName> nodes = client.discover();
            return nodes == null ? List.of() : nodes;
        } finally {
            client.reset();
        }
    }

    /**
     * 주어진 노드들을 동시성 한도 안에서 실행.
     *
     * @param hosts 실행할 노드
     * @return 실행 결과 요약
     */
    public DispatchResult runHosts(List<NodeName> hosts) {
        return dispatchLoop.runHosts(hosts);
    }

    /**
     * 단일 노드 실행 트리거.
     *
     * @param host 대상 노드
     * @return 트리거 시각 (구버전 에이전트는 0)
     */
    public long runHost(NodeName host) {
        return trigger.runHost(host);
    }

    /**
     * 후보 노드의 진행 상태 갱신.
     *
     * @param candidates 후보 노드
     * @param previouslyTracked 이전 폴링 결과
     * @return 여전히 진행 중인 노드
     */
    public List<TrackedNode> findApplyingNodes(List<NodeName> candidates, List<TrackedNode> previouslyTracked) {
        return tracker.findApplyingNodes(candidates, previouslyTracked);
    }

    /**
     * 설정에서 만든 run once 인자 (force 강제 전).
     *
     * @return 변경 불가능한 인자 맵
     */
    public Map<String, Object> runOnceArguments() {
        return runArguments;
    }

    /**
     * 진단 메시지 sink 설치.
     *
     * @param sink 한 줄씩 메시지를 받을 sink
     */
    public void logger(RunLogger sink) {
        runLog.install(sink);
    }

    /**
     * 설치된 sink로 메시지 전달 (sink가 없으면 무시).
     *
     * @param message 진단 메시지
     */
    public void log(String message) {
        runLog.log(message);
    }

    public RunnerConfiguration configuration() {
        return configuration;
    }

    public FleetClient client() {
        return client;
    }

    private static String seconds(Duration duration) {
        return String.valueOf(duration.toMillis() / 1000.0);
    }

    /**
     * Sleep (패스 사이 대기).
     *
     * @param duration 대기 시간
     */
    private void sleep(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RolloutInterruptedException("Interrupted while waiting for the next pass", e);
        }
    }
}

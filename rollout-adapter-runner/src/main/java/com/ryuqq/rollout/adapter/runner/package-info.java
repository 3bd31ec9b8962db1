/**
 * Runner Adapter Layer - Rollout 구현체.
 *
 * <h2>구성요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.rollout.adapter.runner.FleetRunner} - 패스 드라이버 (1회 / 최소 간격 반복)</li>
 *   <li>{@link com.ryuqq.rollout.adapter.runner.DispatchLoop} - 동시성 한도 스케줄러</li>
 *   <li>{@link com.ryuqq.rollout.adapter.runner.ApplyingSetTracker} - in-flight 집합 갱신 및 제외 정책</li>
 *   <li>{@link com.ryuqq.rollout.adapter.runner.NodeRunTrigger} - 단일 노드 실행 요청</li>
 *   <li>{@link com.ryuqq.rollout.adapter.runner.RunArguments} - 설정 → 실행 인자 변환</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (FleetRunner)
 *   ↓ implements
 * application (Rollout interface)
 *   ↓ depends on
 * core (NodeName, TrackedNode, RunnerConfiguration, RunLog)
 *   ↓ depends on
 * core/spi (FleetClient interface)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.rollout.adapter.runner;

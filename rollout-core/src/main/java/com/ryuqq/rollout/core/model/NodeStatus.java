package com.ryuqq.rollout.core.model;

/**
 * 원격 에이전트가 보고한 노드 상태 스냅샷.
 *
 * @param sender 응답한 노드
 * @param applying 실행이 진행 중이면 true
 * @param lastRun 마지막 실행 완료 시각
 * @param initiatedAt 마지막으로 트리거된 시각 (보고하지 않는 에이전트는 0)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record NodeStatus(NodeName sender, boolean applying, long lastRun, long initiatedAt) {

    public NodeStatus {
        if (sender == null) {
            throw new IllegalArgumentException("sender cannot be null");
        }
    }
}

package com.ryuqq.rollout.adapter.runner;

import com.ryuqq.rollout.core.model.NodeName;

import java.util.List;

/**
 * {@link DispatchLoop#runHosts(List)} 결과.
 *
 * @param dispatched 실행 트리거에 성공한 노드 수
 * @param failedToStart 실행 트리거가 실패한 노드
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DispatchResult(int dispatched, List<NodeName> failedToStart) {

    public DispatchResult {
        if (dispatched < 0) {
            throw new IllegalArgumentException("dispatched must be non-negative (current: " + dispatched + ")");
        }
        failedToStart = failedToStart == null ? List.of() : List.copyOf(failedToStart);
    }
}

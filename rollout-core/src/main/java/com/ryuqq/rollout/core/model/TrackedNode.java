package com.ryuqq.rollout.core.model;

/**
 * 실행 요청 후 아직 완료가 확인되지 않은 노드 (in-flight 항목).
 *
 * <p>폴링할 때마다 값이 바뀌는 대신 새 인스턴스로 교체됩니다.</p>
 *
 * @param name 노드 식별자
 * @param initiatedAt 실행이 트리거된 시각 (에이전트 기준 epoch, 구버전 에이전트는 0)
 * @param checks applying 상태로 관측되지 않은 연속 폴링 횟수 (0 이상)
 * @param applied 트리거 이후 applying 상태가 한 번이라도 관측되었는지 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TrackedNode(NodeName name, long initiatedAt, int checks, boolean applied) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public TrackedNode {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (initiatedAt < 0) {
            throw new IllegalArgumentException("initiatedAt must be non-negative (current: " + initiatedAt + ")");
        }
        if (checks < 0) {
            throw new IllegalArgumentException("checks must be non-negative (current: " + checks + ")");
        }
    }

    /**
     * applying 상태가 아직 관측되지 않은 항목.
     *
     * @param name 노드 식별자
     * @param initiatedAt 트리거 시각
     * @param checks applying 상태로 관측되지 않은 연속 폴링 횟수
     */
    public TrackedNode(NodeName name, long initiatedAt, int checks) {
        this(name, initiatedAt, checks, false);
    }

    /**
     * 방금 실행을 요청한 노드의 항목 생성 (checks = 0).
     *
     * @param name 노드 식별자
     * @param initiatedAt 트리거 시각
     * @return 새 TrackedNode
     */
    public static TrackedNode dispatched(NodeName name, long initiatedAt) {
        return new TrackedNode(name, initiatedAt, 0);
    }

    /**
     * applying 상태가 관측되지 않은 폴링 1회를 반영한 새 인스턴스.
     *
     * @return checks가 1 증가한 TrackedNode
     */
    public TrackedNode nextCheck() {
        return new TrackedNode(name, initiatedAt, checks + 1, applied);
    }

    /**
     * applying 상태가 관측되어 재시도 카운터를 초기화한 새 인스턴스.
     *
     * @return checks가 0이고 applied가 true인 TrackedNode
     */
    public TrackedNode observedApplying() {
        return checks == 0 && applied ? this : new TrackedNode(name, initiatedAt, 0, true);
    }

    /**
     * applying이 아닌 상태 보고가 트리거된 실행의 완료를 의미하는지 여부.
     *
     * <p>이전 폴링에서 applying이 관측되었으면 완료입니다. 그 외에는 lastRun이 트리거 시각 이후여야
     * 하며, initiatedAt이 0(구버전 에이전트)이면 lastRun만으로는 판단하지 않습니다.</p>
     *
     * @param lastRun 에이전트가 보고한 마지막 실행 완료 시각
     * @return 트리거된 실행이 이미 끝났으면 true
     */
    public boolean completedBy(long lastRun) {
        return applied || (initiatedAt > 0 && lastRun >= initiatedAt);
    }
}

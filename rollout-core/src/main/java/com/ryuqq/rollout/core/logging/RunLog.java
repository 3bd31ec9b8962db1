package com.ryuqq.rollout.core.logging;

/**
 * 설치 가능한 {@link RunLogger} 하나를 보관하는 홀더.
 *
 * <p>sink가 설치되지 않았으면 {@link #log(String)}는 아무 것도 하지 않습니다.
 * 러너의 구성요소들은 같은 RunLog 인스턴스를 공유하므로,
 * 나중에 설치한 sink도 모든 구성요소에 즉시 반영됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunLog {

    private volatile RunLogger sink;

    /**
     * sink 설치 (기존 sink 대체).
     *
     * @param sink 설치할 sink, null이면 기록 중단
     */
    public void install(RunLogger sink) {
        this.sink = sink;
    }

    /**
     * 설치된 sink로 메시지 전달.
     *
     * @param message 진단 메시지
     */
    public void log(String message) {
        RunLogger current = sink;
        if (current != null) {
            current.log(message);
        }
    }

    public boolean isInstalled() {
        return sink != null;
    }
}

package com.ryuqq.rollout.core.logging;

/**
 * 러너가 진단 메시지를 내보내는 한 줄 단위 sink.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RunLogger {

    /**
     * 메시지 한 줄 기록.
     *
     * @param message 진단 메시지
     */
    void log(String message);
}

package com.ryuqq.rollout.adapter.runner;

/**
 * 폴링 또는 패스 사이 대기 중 제어 스레드가 인터럽트되었을 때 발생하는 예외.
 *
 * <p>던지기 전에 스레드의 인터럽트 플래그는 복원됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RolloutInterruptedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RolloutInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}

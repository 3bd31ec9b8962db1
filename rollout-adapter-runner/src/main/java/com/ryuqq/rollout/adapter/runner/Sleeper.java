package com.ryuqq.rollout.adapter.runner;

import java.time.Duration;

/**
 * 제어 스레드를 지정한 시간만큼 멈추는 기능.
 *
 * <p>테스트에서는 실제로 잠들지 않고 요청된 시간만 기록하는 구현을 주입합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 지정한 시간만큼 대기.
     *
     * @param duration 대기 시간 (0 이하이면 즉시 반환)
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * {@link Thread#sleep(long, int)} 기반 기본 구현.
     *
     * @return 실제로 스레드를 재우는 Sleeper
     */
    static Sleeper threadSleeper() {
        return duration -> {
            if (duration == null || duration.isNegative() || duration.isZero()) {
                return;
            }
            long millis = duration.toMillis();
            int nanos = (int) duration.minusMillis(millis).toNanos();
            Thread.sleep(millis, nanos);
        };
    }
}

package com.ryuqq.rollout.adapter.runner;

import com.ryuqq.rollout.core.logging.RunLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SLF4J 로거로 진단 메시지를 전달하는 {@link RunLogger}.
 *
 * <pre>
 * runner.logger(Slf4jRunLogger.of(MyApp.class));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Slf4jRunLogger implements RunLogger {

    private final Logger logger;

    public Slf4jRunLogger(Logger logger) {
        if (logger == null) {
            throw new IllegalArgumentException("logger cannot be null");
        }
        this.logger = logger;
    }

    public static Slf4jRunLogger of(Class<?> type) {
        return new Slf4jRunLogger(LoggerFactory.getLogger(type));
    }

    @Override
    public void log(String message) {
        logger.info(message);
    }
}

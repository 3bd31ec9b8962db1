package com.ryuqq.rollout.core.config;

/**
 * 러너 구성이 잘못되어 생성을 진행할 수 없을 때 발생하는 예외.
 *
 * <p>잘못된 상태의 러너가 만들어지지 않도록 생성 시점에 즉시 던져집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

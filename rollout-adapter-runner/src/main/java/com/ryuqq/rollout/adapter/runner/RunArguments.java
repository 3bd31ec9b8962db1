package com.ryuqq.rollout.adapter.runner;

import com.ryuqq.rollout.core.config.RunnerConfiguration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 설정값을 원격 "run once" 명령 인자로 변환.
 *
 * <p><strong>변환 규칙:</strong></p>
 * <ul>
 *   <li>force, server, noop, environment, splay, splaylimit, ignoreschedules: 설정된 경우 그대로 전달</li>
 *   <li>tag 목록: 쉼표로 이어 붙여 {@code tags} 키로 전달</li>
 *   <li>설정되지 않은 항목: 키 자체를 생략 (false/null로 채우지 않음)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunArguments {

    public static final String FORCE = "force";
    public static final String SERVER = "server";
    public static final String NOOP = "noop";
    public static final String ENVIRONMENT = "environment";
    public static final String SPLAY = "splay";
    public static final String SPLAY_LIMIT = "splaylimit";
    public static final String TAGS = "tags";
    public static final String IGNORE_SCHEDULES = "ignoreschedules";

    private RunArguments() {
    }

    /**
     * 설정에서 run once 인자 생성.
     *
     * @param configuration 러너 설정
     * @return 변경 불가능한 인자 맵
     * @throws IllegalArgumentException configuration이 null인 경우
     */
    public static Map<String, Object> from(RunnerConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration cannot be null");
        }
        Map<String, Object> arguments = new LinkedHashMap<>();
        putIfPresent(arguments, FORCE, configuration.force());
        putIfPresent(arguments, SERVER, configuration.server());
        putIfPresent(arguments, NOOP, configuration.noop());
        putIfPresent(arguments, ENVIRONMENT, configuration.environment());
        putIfPresent(arguments, SPLAY, configuration.splay());
        putIfPresent(arguments, SPLAY_LIMIT, configuration.splayLimit());
        putIfPresent(arguments, IGNORE_SCHEDULES, configuration.ignoreSchedules());

        List<String> tags = configuration.tags();
        if (tags != null && !tags.isEmpty()) {
            arguments.put(TAGS, String.join(",", tags));
        }
        return Collections.unmodifiableMap(arguments);
    }

    /**
     * 노드 실행 트리거용 인자 생성 ({@link #from(RunnerConfiguration)} + {@code force=true}).
     *
     * @param configuration 러너 설정
     * @return 변경 불가능한 인자 맵
     */
    public static Map<String, Object> forTrigger(RunnerConfiguration configuration) {
        Map<String, Object> arguments = new LinkedHashMap<>(from(configuration));
        arguments.put(FORCE, Boolean.TRUE);
        return Collections.unmodifiableMap(arguments);
    }

    private static void putIfPresent(Map<String, Object> arguments, String key, Object value) {
        if (value != null) {
            arguments.put(key, value);
        }
    }
}

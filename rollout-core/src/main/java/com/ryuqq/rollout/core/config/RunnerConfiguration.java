package com.ryuqq.rollout.core.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 롤아웃 러너 설정 (불변 record).
 *
 * <p>concurrency를 제외한 모든 항목은 선택값이며, null은 "설정되지 않음"을 뜻합니다.
 * 설정되지 않은 항목은 원격 실행 인자에서 빠지므로 에이전트 자체 기본값이 적용됩니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시에 실행 중일 수 있는 노드 수 (1 이상, 필수)</li>
 *   <li>force: splay 무시 여부</li>
 *   <li>server: 에이전트가 접속할 서버 (host:port)</li>
 *   <li>noop: 변경 없이 시뮬레이션만 수행</li>
 *   <li>environment: 적용할 환경 이름</li>
 *   <li>splay / splayLimit: 실행 전 임의 지연 여부와 상한 (초)</li>
 *   <li>tags: 실행을 제한할 태그 목록</li>
 *   <li>ignoreSchedules: 스케줄 리소스 무시 여부</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param concurrency 동시 실행 노드 수 (1 이상이어야 함)
 * @param force force 플래그 (nullable)
 * @param server 서버 주소 (nullable)
 * @param noop noop 플래그 (nullable)
 * @param environment 환경 이름 (nullable)
 * @param splay splay 플래그 (nullable)
 * @param splayLimit splay 상한 (nullable)
 * @param tags 태그 목록 (nullable)
 * @param ignoreSchedules ignoreschedules 플래그 (nullable)
 */
public record RunnerConfiguration(
    int concurrency,
    Boolean force,
    String server,
    Boolean noop,
    String environment,
    Boolean splay,
    Integer splayLimit,
    List<String> tags,
    Boolean ignoreSchedules
) {

    public static final String CONCURRENCY = "concurrency";
    public static final String FORCE = "force";
    public static final String SERVER = "server";
    public static final String NOOP = "noop";
    public static final String ENVIRONMENT = "environment";
    public static final String SPLAY = "splay";
    public static final String SPLAY_LIMIT = "splaylimit";
    public static final String TAG = "tag";
    public static final String IGNORE_SCHEDULES = "ignoreschedules";

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws ConfigurationException concurrency가 1 미만인 경우
     */
    public RunnerConfiguration {
        if (concurrency < 1) {
            throw new ConfigurationException("Concurrency has to be > 0");
        }
        tags = tags == null ? null : List.copyOf(tags);
    }

    /**
     * concurrency만 지정한 설정 생성.
     *
     * @param concurrency 동시 실행 노드 수
     * @return 새 RunnerConfiguration
     * @throws ConfigurationException concurrency가 1 미만인 경우
     */
    public static RunnerConfiguration of(int concurrency) {
        return new RunnerConfiguration(concurrency, null, null, null, null, null, null, null, null);
    }

    /**
     * 느슨한 타입의 옵션 맵에서 설정 생성.
     *
     * <p>값은 타입이 맞는 객체이거나 문자열일 수 있습니다. tag는 목록 또는 쉼표로 구분된 문자열입니다.</p>
     *
     * @param options 옵션 맵 (키: concurrency, force, server, noop, environment, splay, splaylimit, tag, ignoreschedules)
     * @return 새 RunnerConfiguration
     * @throws ConfigurationException concurrency가 없거나 1 미만이거나, 값의 형식이 잘못된 경우
     */
    public static RunnerConfiguration fromMap(Map<String, ?> options) {
        if (options == null) {
            throw new ConfigurationException("Concurrency has to be > 0");
        }
        Integer concurrency = toInteger(CONCURRENCY, options.get(CONCURRENCY));
        if (concurrency == null) {
            throw new ConfigurationException("Concurrency has to be > 0");
        }
        return new RunnerConfiguration(
            concurrency,
            toBoolean(FORCE, options.get(FORCE)),
            toText(options.get(SERVER)),
            toBoolean(NOOP, options.get(NOOP)),
            toText(options.get(ENVIRONMENT)),
            toBoolean(SPLAY, options.get(SPLAY)),
            toInteger(SPLAY_LIMIT, options.get(SPLAY_LIMIT)),
            toTags(options.get(TAG)),
            toBoolean(IGNORE_SCHEDULES, options.get(IGNORE_SCHEDULES))
        );
    }

    /**
     * Properties에서 설정 생성 ({@link #fromMap(Map)}과 같은 키 사용).
     *
     * @param properties 설정 파일 등에서 읽은 Properties
     * @return 새 RunnerConfiguration
     * @throws ConfigurationException concurrency가 없거나 값의 형식이 잘못된 경우
     */
    public static RunnerConfiguration fromProperties(Properties properties) {
        Map<String, Object> options = new HashMap<>();
        if (properties != null) {
            for (String key : properties.stringPropertyNames()) {
                options.put(key, properties.getProperty(key));
            }
        }
        return fromMap(options);
    }

    /**
     * force만 변경한 새 인스턴스 생성.
     */
    public RunnerConfiguration withForce(Boolean force) {
        return new RunnerConfiguration(concurrency, force, server, noop, environment, splay, splayLimit, tags, ignoreSchedules);
    }

    /**
     * server만 변경한 새 인스턴스 생성.
     */
    public RunnerConfiguration withServer(String server) {
        return new RunnerConfiguration(concurrency, force, server, noop, environment, splay, splayLimit, tags, ignoreSchedules);
    }

    /**
     * noop만 변경한 새 인스턴스 생성.
     */
    public RunnerConfiguration withNoop(Boolean noop) {
        return new RunnerConfiguration(concurrency, force, server, noop, environment, splay, splayLimit, tags, ignoreSchedules);
    }

    /**
     * environment만 변경한 새 인스턴스 생성.
     */
    public RunnerConfiguration withEnvironment(String environment) {
        return new RunnerConfiguration(concurrency, force, server, noop, environment, splay, splayLimit, tags, ignoreSchedules);
    }

    /**
     * splay만 변경한 새 인스턴스 생성.
     */
    public RunnerConfiguration withSplay(Boolean splay) {
        return new RunnerConfiguration(concurrency, force, server, noop, environment, splay, splayLimit, tags, ignoreSchedules);
    }

    /**
     * splayLimit만 변경한 새 인스턴스 생성.
     */
    public RunnerConfiguration withSplayLimit(Integer splayLimit) {
        return new RunnerConfiguration(concurrency, force, server, noop, environment, splay, splayLimit, tags, ignoreSchedules);
    }

    /**
     * tags만 변경한 새 인스턴스 생성.
     */
    public RunnerConfiguration withTags(List<String> tags) {
        return new RunnerConfiguration(concurrency, force, server, noop, environment, splay, splayLimit, tags, ignoreSchedules);
    }

    /**
     * ignoreSchedules만 변경한 새 인스턴스 생성.
     */
    public RunnerConfiguration withIgnoreSchedules(Boolean ignoreSchedules) {
        return new RunnerConfiguration(concurrency, force, server, noop, environment, splay, splayLimit, tags, ignoreSchedules);
    }

    private static Integer toInteger(String key, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            Number number = (Number) value;
            long whole = number.longValue();
            if (number.doubleValue() != whole || whole < Integer.MIN_VALUE || whole > Integer.MAX_VALUE) {
                throw new ConfigurationException(key + " must be an integer (current: " + value + ")");
            }
            return (int) whole;
        }
        try {
            return Integer.valueOf(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer (current: " + value + ")", e);
        }
    }

    private static Boolean toBoolean(String key, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(text)) {
            return Boolean.FALSE;
        }
        throw new ConfigurationException(key + " must be true or false (current: " + value + ")");
    }

    private static String toText(Object value) {
        return value == null ? null : value.toString();
    }

    private static List<String> toTags(Object value) {
        if (value == null) {
            return null;
        }
        Collection<?> raw = value instanceof Collection
            ? (Collection<?>) value
            : Arrays.asList(value.toString().split(","));
        List<String> tags = new ArrayList<>();
        for (Object tag : raw) {
            if (tag != null && !tag.toString().isBlank()) {
                tags.add(tag.toString().trim());
            }
        }
        return tags;
    }
}

package com.ryuqq.rollout.core.model;

/**
 * Fleet 구성원(노드)의 식별자.
 *
 * <p>보통 호스트명이며, 원격 에이전트가 status 응답의 sender로 보고하는 값과
 * 정확히 같은 문자열이어야 합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>동등성: 대소문자를 구분하는 정확한 문자열 비교</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NodeName {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private NodeName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("NodeName cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("NodeName length cannot exceed " + MAX_LENGTH + " characters");
        }
        this.value = value;
    }

    /**
     * NodeName 생성.
     *
     * @param value 노드 식별 문자열 (예: host1.example.com)
     * @return NodeName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static NodeName of(String value) {
        return new NodeName(value);
    }

    /**
     * NodeName 값 조회.
     *
     * @return 노드 식별 문자열
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeName that = (NodeName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}

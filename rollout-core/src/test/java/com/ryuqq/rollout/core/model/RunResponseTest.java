package com.ryuqq.rollout.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RunResponse 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RunResponseTest {

    private static final NodeName HOST = NodeName.of("web1.example.com");

    @Test
    void initiatedAt_NumericString_ParsesValue() {
        // Given
        RunResponse response = new RunResponse(HOST, Map.of("summary", "Started a run", "initiated_at", "123"));

        // Then
        assertEquals(OptionalLong.of(123), response.initiatedAt());
    }

    @Test
    void initiatedAt_Number_ReturnsValue() {
        // Given
        RunResponse response = new RunResponse(HOST, Map.of("initiated_at", 1700000000L));

        // Then
        assertEquals(OptionalLong.of(1700000000L), response.initiatedAt());
    }

    @Test
    void initiatedAt_Missing_ReturnsEmpty() {
        // Given
        RunResponse response = new RunResponse(HOST, Map.of("summary", "Started a run"));

        // Then
        assertTrue(response.initiatedAt().isEmpty());
        assertEquals("Started a run", response.summary());
    }

    @Test
    void initiatedAt_NotNumeric_ReturnsEmpty() {
        // Given
        RunResponse response = new RunResponse(HOST, Map.of("initiated_at", "yesterday"));

        // Then
        assertTrue(response.initiatedAt().isEmpty());
    }

    @Test
    void data_IsDefensivelyCopied() {
        // Given
        Map<String, Object> data = new HashMap<>();
        data.put("summary", "first");
        RunResponse response = new RunResponse(HOST, data);

        // When
        data.put("summary", "second");

        // Then
        assertEquals("first", response.summary());
        assertThrows(UnsupportedOperationException.class, () -> response.data().put("x", 1));
    }

    @Test
    void nullData_TreatedAsEmpty() {
        // When
        RunResponse response = new RunResponse(HOST, null);

        // Then
        assertEquals("", response.summary());
        assertTrue(response.initiatedAt().isEmpty());
    }
}

package com.ryuqq.rollout.core.logging;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RunLog 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RunLogTest {

    @Test
    void log_WithoutSink_DoesNothing() {
        // Given
        RunLog runLog = new RunLog();

        // When & Then
        assertFalse(runLog.isInstalled());
        assertDoesNotThrow(() -> runLog.log("nobody listens"));
    }

    @Test
    void log_WithSink_ForwardsMessage() {
        // Given
        List<String> lines = new ArrayList<>();
        RunLog runLog = new RunLog();
        runLog.install(lines::add);

        // When
        runLog.log("first line");

        // Then
        assertEquals(List.of("first line"), lines);
    }

    @Test
    void install_ReplacesPreviousSink() {
        // Given
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();
        RunLog runLog = new RunLog();
        runLog.install(first::add);

        // When
        runLog.install(second::add);
        runLog.log("hello");

        // Then
        assertTrue(first.isEmpty());
        assertEquals(List.of("hello"), second);
    }
}

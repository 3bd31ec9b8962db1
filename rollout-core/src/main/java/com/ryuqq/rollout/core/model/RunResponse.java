package com.ryuqq.rollout.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Response of a single node to a "run once" request.
 *
 * <p>The payload is kept as the loosely typed map the agent returned. Older agents
 * only report a {@code summary}; newer ones also report {@code initiated_at}, either
 * as a number or as a numeric string.</p>
 *
 * @param sender the node that answered
 * @param data response payload (never null, unmodifiable)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunResponse(NodeName sender, Map<String, Object> data) {

    public static final String SUMMARY = "summary";
    public static final String INITIATED_AT = "initiated_at";

    public RunResponse {
        if (sender == null) {
            throw new IllegalArgumentException("sender cannot be null");
        }
        data = data == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * Summary line reported by the agent.
     *
     * @return summary, or an empty string when absent
     */
    public String summary() {
        Object summary = data.get(SUMMARY);
        return summary == null ? "" : summary.toString();
    }

    /**
     * Timestamp at which the agent accepted the run request.
     *
     * @return the timestamp, or empty if the agent did not report a usable one
     */
    public OptionalLong initiatedAt() {
        Object value = data.get(INITIATED_AT);
        if (value instanceof Number) {
            return OptionalLong.of(((Number) value).longValue());
        }
        if (value instanceof String) {
            try {
                return OptionalLong.of(Long.parseLong(((String) value).trim()));
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }
}

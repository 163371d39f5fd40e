package app.webradio.engagement.activity;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One credited activity. {@code kind} is the raw activity code, which may be outside {@link ActivityKind}.
 */
public record ActivityRecord(
        String kind,
        Instant timestamp,
        int pointsAwarded,
        JsonNode details
) {
}

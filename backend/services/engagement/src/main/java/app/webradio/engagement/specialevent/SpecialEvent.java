package app.webradio.engagement.specialevent;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Read-only copy of an event, participants in join order.
 */
public record SpecialEvent(
        String id,
        String name,
        String description,
        String type,
        Instant startsAt,
        Instant endsAt,
        JsonNode rewards,
        List<String> participants,
        Instant createdAt
) {
    @JsonProperty("participantCount")
    public int participantCount() {
        return participants.size();
    }
}

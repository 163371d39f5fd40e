package app.webradio.engagement.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;

import java.time.Instant;

public record ActivityEvent(
        @NotBlank String userId,
        @NotBlank String kind,
        Instant timestamp,
        JsonNode details
) {
}

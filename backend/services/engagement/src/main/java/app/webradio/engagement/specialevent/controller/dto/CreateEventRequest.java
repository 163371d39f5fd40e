package app.webradio.engagement.specialevent.controller.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record CreateEventRequest(
        @NotBlank String name,
        String description,
        String type,
        @Positive @Max(744) Integer durationHours,
        JsonNode rewards
) {
    public int durationHoursOrDefault() {
        return durationHours == null ? 24 : durationHours;
    }
}

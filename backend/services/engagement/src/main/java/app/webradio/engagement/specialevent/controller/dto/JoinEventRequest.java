package app.webradio.engagement.specialevent.controller.dto;

import jakarta.validation.constraints.NotBlank;

public record JoinEventRequest(
        @NotBlank String userId
) {
}

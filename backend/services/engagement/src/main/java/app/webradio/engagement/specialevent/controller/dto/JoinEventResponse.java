package app.webradio.engagement.specialevent.controller.dto;

import app.webradio.engagement.specialevent.SpecialEvent;

public record JoinEventResponse(
        boolean newlyJoined,
        String message,
        SpecialEvent event
) {
}

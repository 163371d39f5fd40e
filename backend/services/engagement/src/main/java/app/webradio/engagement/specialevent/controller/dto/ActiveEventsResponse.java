package app.webradio.engagement.specialevent.controller.dto;

import app.webradio.engagement.specialevent.SpecialEvent;

import java.util.List;

public record ActiveEventsResponse(
        List<SpecialEvent> activeEvents
) {
}

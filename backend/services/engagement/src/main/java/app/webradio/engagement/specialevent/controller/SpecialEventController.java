package app.webradio.engagement.specialevent.controller;

import app.webradio.engagement.specialevent.JoinResult;
import app.webradio.engagement.specialevent.SpecialEvent;
import app.webradio.engagement.specialevent.SpecialEventService;
import app.webradio.engagement.specialevent.controller.dto.ActiveEventsResponse;
import app.webradio.engagement.specialevent.controller.dto.CreateEventRequest;
import app.webradio.engagement.specialevent.controller.dto.JoinEventRequest;
import app.webradio.engagement.specialevent.controller.dto.JoinEventResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@RestController
@RequestMapping("/gamification/events")
public class SpecialEventController {

    private final SpecialEventService specialEvents;
    private final Clock clock;

    public SpecialEventController(SpecialEventService specialEvents, Clock clock) {
        this.specialEvents = specialEvents;
        this.clock = clock;
    }

    @GetMapping
    public ActiveEventsResponse active() {
        return new ActiveEventsResponse(specialEvents.active());
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SpecialEvent create(@Valid @RequestBody CreateEventRequest request) {
        Instant start = clock.instant();
        return specialEvents.create(
                request.name(),
                request.description(),
                request.type(),
                start,
                start.plus(Duration.ofHours(request.durationHoursOrDefault())),
                request.rewards()
        );
    }

    @PostMapping("/{eventId}/join")
    public JoinEventResponse join(@PathVariable String eventId,
                                  @Valid @RequestBody JoinEventRequest request) {
        JoinResult result = specialEvents.join(request.userId(), eventId);
        return switch (result.outcome()) {
            case JOINED -> new JoinEventResponse(true, "Joined \"" + result.event().name() + "\"", result.event());
            case ALREADY_JOINED -> new JoinEventResponse(false, "Already joined \"" + result.event().name() + "\"", result.event());
            case EVENT_NOT_FOUND -> throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Event not found: " + eventId);
            case USER_NOT_FOUND -> throw new ResponseStatusException(HttpStatus.NOT_FOUND, "User not found: " + request.userId());
            case OUTSIDE_WINDOW -> throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Event is not active: " + eventId);
        };
    }
}

package app.webradio.engagement.specialevent.controller;

import app.webradio.engagement.specialevent.JoinResult;
import app.webradio.engagement.specialevent.SpecialEvent;
import app.webradio.engagement.specialevent.SpecialEventService;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SpecialEventController.class)
@ActiveProfiles("test")
class SpecialEventControllerWebMvcTest {

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    SpecialEventService specialEvents;

    @MockitoBean
    Clock clock;

    private final SpecialEvent event = new SpecialEvent(
            "e1",
            "Rock Night",
            "All rock",
            "custom",
            Instant.parse("2026-01-14T12:00:00Z"),
            Instant.parse("2026-01-15T12:00:00Z"),
            JsonNodeFactory.instance.objectNode(),
            List.of("u1"),
            Instant.parse("2026-01-14T12:00:00Z")
    );

    @Test
    void active_listsEvents() throws Exception {
        when(specialEvents.active()).thenReturn(List.of(event));

        mockMvc.perform(get("/gamification/events"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeEvents[0].id").value("e1"))
                .andExpect(jsonPath("$.activeEvents[0].participantCount").value(1));
    }

    @Test
    void create_returnsCreated() throws Exception {
        when(clock.instant()).thenReturn(Instant.parse("2026-01-14T12:00:00Z"));
        when(specialEvents.create(eq("Rock Night"), eq("All rock"), isNull(), any(), any(), isNull()))
                .thenReturn(event);

        mockMvc.perform(post("/gamification/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Rock Night\",\"description\":\"All rock\",\"durationHours\":24}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Rock Night"));
    }

    @Test
    void join_outsideWindowIsBadRequest() throws Exception {
        when(specialEvents.join("u1", "e1")).thenReturn(new JoinResult(JoinResult.Outcome.OUTSIDE_WINDOW, event));

        mockMvc.perform(post("/gamification/events/e1/join")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"u1\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void join_success() throws Exception {
        when(specialEvents.join("u1", "e1")).thenReturn(new JoinResult(JoinResult.Outcome.JOINED, event));

        mockMvc.perform(post("/gamification/events/e1/join")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"u1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.newlyJoined").value(true))
                .andExpect(jsonPath("$.message").value("Joined \"Rock Night\""));
    }
}

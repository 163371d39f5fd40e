package app.webradio.engagement.specialevent;

import app.webradio.engagement.notification.SystemAnnouncement;
import app.webradio.engagement.support.EngagementFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpecialEventServiceTest {

    EngagementFixture fx;
    SpecialEvent event;

    @BeforeEach
    void setup() {
        fx = new EngagementFixture();
        fx.users.register("u1", "Ana");
        Instant now = fx.clock.instant();
        event = fx.specialEvents.create("Rock Night", "All rock", null, now, now.plus(Duration.ofHours(24)), null);
    }

    @Test
    void create_announcesAndListsAsActive() {
        assertThat(event.type()).isEqualTo(SpecialEventType.CUSTOM);
        assertThat(fx.specialEvents.active()).extracting(SpecialEvent::id).containsExactly(event.id());
        assertThat(fx.eventsOf(SystemAnnouncement.class)).singleElement()
                .satisfies(a -> assertThat(a.message()).isEqualTo("Special event: Rock Night - All rock"));
    }

    @Test
    void join_creditsParticipationOnce() {
        JoinResult first = fx.specialEvents.join("u1", event.id());
        JoinResult second = fx.specialEvents.join("u1", event.id());

        assertThat(first.outcome()).isEqualTo(JoinResult.Outcome.JOINED);
        assertThat(first.event().participants()).containsExactly("u1");
        assertThat(second.outcome()).isEqualTo(JoinResult.Outcome.ALREADY_JOINED);
        assertThat(fx.points.overview("u1").orElseThrow().points().totalPoints()).isEqualTo(20);
    }

    @Test
    void join_rejectsUnknownUserEventAndClosedWindow() {
        assertThat(fx.specialEvents.join("ghost", event.id()).outcome()).isEqualTo(JoinResult.Outcome.USER_NOT_FOUND);
        assertThat(fx.specialEvents.join("u1", "nope").outcome()).isEqualTo(JoinResult.Outcome.EVENT_NOT_FOUND);

        fx.clock.advance(Duration.ofHours(25));

        assertThat(fx.specialEvents.join("u1", event.id()).outcome()).isEqualTo(JoinResult.Outcome.OUTSIDE_WINDOW);
        assertThat(fx.specialEvents.active()).isEmpty();
    }

    @Test
    void create_rejectsInvertedWindow() {
        Instant now = fx.clock.instant();

        assertThatThrownBy(() -> fx.specialEvents.create("Bad", null, null, now, now.minusSeconds(1), null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

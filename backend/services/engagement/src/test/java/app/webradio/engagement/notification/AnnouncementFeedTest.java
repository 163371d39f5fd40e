package app.webradio.engagement.notification;

import app.webradio.engagement.config.EngagementProps;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class AnnouncementFeedTest {

    @Test
    void recent_keepsNewestWithinCapacity() {
        AnnouncementFeed feed = new AnnouncementFeed(new EngagementProps("UTC", 100, 1000, 20, 10, 7, 20, 3, 366));
        Instant at = Instant.parse("2026-01-14T12:00:00Z");
        for (int i = 1; i <= 5; i++) {
            feed.onAnnouncement(SystemAnnouncement.of("message " + i, at.plusSeconds(i)));
        }

        assertThat(feed.recent(10)).extracting(SystemAnnouncement::message)
                .containsExactly("message 3", "message 4", "message 5");
        assertThat(feed.recent(1)).extracting(SystemAnnouncement::message).containsExactly("message 5");
    }
}

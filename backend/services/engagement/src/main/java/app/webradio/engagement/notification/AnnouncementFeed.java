package app.webradio.engagement.notification;

import app.webradio.engagement.config.EngagementProps;
import app.webradio.engagement.support.BoundedHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class AnnouncementFeed {

    private static final Logger log = LoggerFactory.getLogger(AnnouncementFeed.class);

    private final BoundedHistory<SystemAnnouncement> announcements;

    public AnnouncementFeed(EngagementProps props) {
        this.announcements = new BoundedHistory<>(props.announcementCapacity());
    }

    @EventListener
    public void onAnnouncement(SystemAnnouncement announcement) {
        synchronized (announcements) {
            announcements.append(announcement);
        }
        log.info("Announcement: {}", announcement.message());
    }

    public List<SystemAnnouncement> recent(int limit) {
        synchronized (announcements) {
            return announcements.latest(limit);
        }
    }
}

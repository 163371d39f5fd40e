package app.webradio.engagement.notification.controller;

import app.webradio.engagement.notification.AnnouncementFeed;
import app.webradio.engagement.notification.SystemAnnouncement;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/announcements")
public class AnnouncementController {

    private final AnnouncementFeed feed;

    public AnnouncementController(AnnouncementFeed feed) {
        this.feed = feed;
    }

    @GetMapping
    public List<SystemAnnouncement> recent(@RequestParam(defaultValue = "20") int limit) {
        return feed.recent(limit);
    }
}

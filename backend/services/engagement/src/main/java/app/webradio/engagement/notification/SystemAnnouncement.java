package app.webradio.engagement.notification;

import java.time.Instant;
import java.util.UUID;

/**
 * Chat-style message posted by the system, e.g. a badge award or a special event.
 */
public record SystemAnnouncement(
        String id,
        String message,
        Instant createdAt
) {
    public static SystemAnnouncement of(String message, Instant createdAt) {
        return new SystemAnnouncement(UUID.randomUUID().toString(), message, createdAt);
    }
}

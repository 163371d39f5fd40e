package app.webradio.engagement.badge;

import java.time.Instant;

public record BadgeEarned(
        String userId,
        Badge badge,
        Instant earnedAt,
        String message
) {
}

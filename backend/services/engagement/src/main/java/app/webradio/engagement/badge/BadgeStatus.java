package app.webradio.engagement.badge;

import java.time.Instant;

public record BadgeStatus(
        Badge badge,
        boolean earned,
        Instant earnedAt,
        int progressPercent
) {
}

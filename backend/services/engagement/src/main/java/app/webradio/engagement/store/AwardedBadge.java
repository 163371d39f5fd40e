package app.webradio.engagement.store;

import java.time.Instant;

public record AwardedBadge(
        String badgeId,
        String userId,
        Instant earnedAt
) {
}

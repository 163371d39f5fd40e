package app.webradio.engagement.eventlog;

import app.webradio.engagement.badge.BadgeEarned;
import app.webradio.engagement.leaderboard.LeaderboardUpdated;
import app.webradio.engagement.points.PointsEarned;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Default consumer of the outbound engagement events until a push channel subscribes to them.
 */
@Component
public class EngagementEventLogger {

    private static final Logger log = LoggerFactory.getLogger(EngagementEventLogger.class);

    @EventListener
    public void onPointsEarned(PointsEarned event) {
        log.debug("Points earned: userId={}, points={}, kind={}, total={}",
                event.userId(), event.points(), event.activityKind(), event.totalPoints());
    }

    @EventListener
    public void onBadgeEarned(BadgeEarned event) {
        log.debug("Badge earned: userId={}, badgeId={}", event.userId(), event.badge().id());
    }

    @EventListener
    public void onLeaderboardUpdated(LeaderboardUpdated event) {
        log.debug("Leaderboard updated: period={}, entries={}", event.period().code(), event.entries().size());
    }
}

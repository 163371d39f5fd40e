package app.webradio.engagement.support;

import app.webradio.engagement.activity.ActivityPointsTable;
import app.webradio.engagement.analytics.ListeningAnalytics;
import app.webradio.engagement.badge.BadgeCatalog;
import app.webradio.engagement.badge.BadgeEvaluator;
import app.webradio.engagement.config.EngagementProps;
import app.webradio.engagement.leaderboard.LeaderboardBuilder;
import app.webradio.engagement.points.PointsAccumulator;
import app.webradio.engagement.points.PointsOverview;
import app.webradio.engagement.specialevent.SpecialEventService;
import app.webradio.engagement.store.AwardedBadge;
import app.webradio.engagement.store.UserEngagementStore;
import app.webradio.engagement.streak.StreakTracker;
import app.webradio.engagement.user.InMemoryUserDirectory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The real services wired by hand, with published events collected in {@link #events}.
 * Starts on Wednesday 2026-01-14 12:00 UTC, outside every hour and weekend badge window.
 */
public final class EngagementFixture {

    public static final Instant WEDNESDAY_NOON = Instant.parse("2026-01-14T12:00:00Z");

    public final EngagementProps props = new EngagementProps("UTC", 100, 1000, 20, 10, 7, 20, 50, 366);
    public final MutableClock clock = new MutableClock(WEDNESDAY_NOON, ZoneOffset.UTC);
    public final List<Object> events = new CopyOnWriteArrayList<>();

    public final InMemoryUserDirectory users = new InMemoryUserDirectory();
    public final UserEngagementStore store = new UserEngagementStore(props);
    public final ActivityPointsTable pointsTable = new ActivityPointsTable();
    public final BadgeCatalog catalog = new BadgeCatalog();
    public final LeaderboardBuilder leaderboard = new LeaderboardBuilder(store, users, events::add, clock, props);
    public final BadgeEvaluator badges = new BadgeEvaluator(users, store, catalog, leaderboard, events::add, clock);
    public final PointsAccumulator points =
            new PointsAccumulator(users, store, pointsTable, badges, leaderboard, events::add, clock, props);
    public final StreakTracker streaks = new StreakTracker(users, store, points, leaderboard, events::add, clock);
    public final ListeningAnalytics analytics = new ListeningAnalytics(props, clock);
    public final SpecialEventService specialEvents = new SpecialEventService(users, points, events::add, clock, props);

    public List<String> badgeIds(String userId) {
        return points.overview(userId)
                .map(PointsOverview::badges)
                .orElse(List.of())
                .stream()
                .map(AwardedBadge::badgeId)
                .toList();
    }

    public <T> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }
}

package app.webradio.engagement.points;

import app.webradio.engagement.activity.ActivityPointsTable;
import app.webradio.engagement.activity.ActivityRecord;
import app.webradio.engagement.badge.BadgeEvaluator;
import app.webradio.engagement.config.EngagementProps;
import app.webradio.engagement.leaderboard.LeaderboardBuilder;
import app.webradio.engagement.store.AwardedBadge;
import app.webradio.engagement.store.PointsSnapshot;
import app.webradio.engagement.store.PointsState;
import app.webradio.engagement.store.UserEngagement;
import app.webradio.engagement.store.UserEngagementStore;
import app.webradio.engagement.user.ResolvedUser;
import app.webradio.engagement.user.UserDirectory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Service
public class PointsAccumulator {

    private static final Logger log = LoggerFactory.getLogger(PointsAccumulator.class);

    private final UserDirectory userDirectory;
    private final UserEngagementStore store;
    private final ActivityPointsTable pointsTable;
    private final BadgeEvaluator badgeEvaluator;
    private final LeaderboardBuilder leaderboardBuilder;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final int recentActivities;

    public PointsAccumulator(UserDirectory userDirectory,
                             UserEngagementStore store,
                             ActivityPointsTable pointsTable,
                             BadgeEvaluator badgeEvaluator,
                             LeaderboardBuilder leaderboardBuilder,
                             ApplicationEventPublisher eventPublisher,
                             Clock clock,
                             EngagementProps props) {
        this.userDirectory = userDirectory;
        this.store = store;
        this.pointsTable = pointsTable;
        this.badgeEvaluator = badgeEvaluator;
        this.leaderboardBuilder = leaderboardBuilder;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.recentActivities = props.recentActivities();
    }

    public CreditResult creditActivity(String userId, String activityKind, JsonNode details) {
        return creditActivity(userId, activityKind, details, clock.instant());
    }

    public CreditResult creditActivity(String userId, String activityKind, JsonNode details, Instant occurredAt) {
        if (activityKind == null || activityKind.isBlank()) {
            throw new IllegalArgumentException("activityKind is required");
        }
        Optional<ResolvedUser> user = userDirectory.resolve(userId);
        if (user.isEmpty()) {
            log.warn("Activity skipped, user not found: userId={}, kind={}", userId, activityKind);
            return CreditResult.userNotFound(userId);
        }

        List<Object> outbox = new ArrayList<>();
        CreditResult result = store.withUser(userId, engagement ->
                creditLocked(engagement, user.get(), activityKind, details, occurredAt, outbox));
        outbox.forEach(eventPublisher::publishEvent);
        leaderboardBuilder.markDirty();
        return result;
    }

    /**
     * Credits one activity: rolls the daily window, appends to the ledger, updates the counters and runs
     * badge evaluation. The caller must hold the user's lock and publish {@code outbox} after releasing it.
     */
    public CreditResult creditLocked(UserEngagement engagement,
                                     ResolvedUser user,
                                     String activityKind,
                                     JsonNode details,
                                     Instant occurredAt,
                                     List<Object> outbox) {
        engagement.requireHeldByCurrentThread();

        String kind = activityKind.trim().toLowerCase(Locale.ROOT);
        int points = pointsTable.pointsFor(kind);
        PointsState state = engagement.points();
        state.rollDailyWindow(LocalDate.now(clock));
        state.credit(points);

        JsonNode safeDetails = details == null || details.isNull() ? JsonNodeFactory.instance.objectNode() : details.deepCopy();
        engagement.ledger().append(new ActivityRecord(kind, occurredAt, points, safeDetails), clock.getZone());

        List<AwardedBadge> badges = badgeEvaluator.evaluateLocked(engagement, user, outbox);

        log.debug("Activity credited: userId={}, kind={}, points={}, total={}",
                engagement.userId(), kind, points, state.totalPoints());
        outbox.add(new PointsEarned(
                engagement.userId(),
                points,
                kind,
                state.totalPoints(),
                "+" + points + " points for " + pointsTable.describe(kind)
        ));
        return CreditResult.credited(engagement.userId(), points, state.snapshot(LocalDate.now(clock)), badges);
    }

    /**
     * Current counters, earned badges and most recent activities, or empty for an unknown user.
     */
    public Optional<PointsOverview> overview(String userId) {
        if (userDirectory.resolve(userId).isEmpty()) {
            return Optional.empty();
        }
        LocalDate today = LocalDate.now(clock);
        PointsOverview overview = store.readUser(userId, engagement -> new PointsOverview(
                        userId,
                        engagement.points().snapshot(today),
                        engagement.badges(),
                        engagement.ledger().recent(recentActivities)
                ))
                .orElseGet(() -> new PointsOverview(userId, PointsSnapshot.empty(), List.of(), List.of()));
        return Optional.of(overview);
    }
}

package app.webradio.engagement.badge;

import app.webradio.engagement.badge.rule.BadgeContext;
import app.webradio.engagement.leaderboard.LeaderboardBuilder;
import app.webradio.engagement.notification.SystemAnnouncement;
import app.webradio.engagement.store.AwardedBadge;
import app.webradio.engagement.store.UserEngagement;
import app.webradio.engagement.store.UserEngagementStore;
import app.webradio.engagement.user.ResolvedUser;
import app.webradio.engagement.user.UserDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class BadgeEvaluator {

    private static final Logger log = LoggerFactory.getLogger(BadgeEvaluator.class);

    private final UserDirectory userDirectory;
    private final UserEngagementStore store;
    private final BadgeCatalog catalog;
    private final LeaderboardBuilder leaderboardBuilder;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public BadgeEvaluator(UserDirectory userDirectory,
                          UserEngagementStore store,
                          BadgeCatalog catalog,
                          LeaderboardBuilder leaderboardBuilder,
                          ApplicationEventPublisher eventPublisher,
                          Clock clock) {
        this.userDirectory = userDirectory;
        this.store = store;
        this.catalog = catalog;
        this.leaderboardBuilder = leaderboardBuilder;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public EvaluationResult evaluate(String userId) {
        Optional<ResolvedUser> user = userDirectory.resolve(userId);
        if (user.isEmpty()) {
            log.warn("Badge evaluation skipped, user not found: userId={}", userId);
            return EvaluationResult.userNotFound();
        }

        List<Object> outbox = new ArrayList<>();
        List<AwardedBadge> awarded = store.withUser(userId, engagement -> evaluateLocked(engagement, user.get(), outbox));
        outbox.forEach(eventPublisher::publishEvent);
        if (!awarded.isEmpty()) {
            leaderboardBuilder.markDirty();
        }
        return EvaluationResult.of(awarded);
    }

    /**
     * Awards every badge whose rule now holds and that the user does not have yet, crediting the bonus
     * into all point counters. Events to publish once the lock is released are added to {@code outbox}.
     * The caller must hold the user's lock.
     */
    public List<AwardedBadge> evaluateLocked(UserEngagement engagement, ResolvedUser user, List<Object> outbox) {
        engagement.requireHeldByCurrentThread();

        BadgeContext context = new BadgeContext(engagement.ledger(), engagement.points());
        List<AwardedBadge> awarded = new ArrayList<>();
        for (BadgeCatalog.Definition definition : catalog.definitions()) {
            Badge badge = definition.badge();
            if (engagement.hasBadge(badge.id()) || !definition.rule().isSatisfied(context)) {
                continue;
            }

            Instant now = clock.instant();
            AwardedBadge earned = new AwardedBadge(badge.id(), engagement.userId(), now);
            if (!engagement.award(earned)) {
                continue;
            }
            engagement.points().rollDailyWindow(LocalDate.now(clock));
            engagement.points().credit(badge.bonusPoints());
            awarded.add(earned);

            log.info("Badge awarded: userId={}, badgeId={}, bonus={}", engagement.userId(), badge.id(), badge.bonusPoints());
            outbox.add(new BadgeEarned(
                    engagement.userId(),
                    badge,
                    now,
                    "Congratulations! You earned the badge \"" + badge.displayName() + "\""
            ));
            outbox.add(SystemAnnouncement.of(
                    user.displayName() + " earned the badge \"" + badge.displayName() + "\"!",
                    now
            ));
        }
        return awarded;
    }

    /**
     * Earned flag and progress of every catalog badge, or empty for an unknown user.
     */
    public Optional<List<BadgeStatus>> progress(String userId) {
        if (userDirectory.resolve(userId).isEmpty()) {
            return Optional.empty();
        }
        List<BadgeStatus> statuses = store.readUser(userId, this::statusesOf)
                .orElseGet(this::emptyStatuses);
        return Optional.of(statuses);
    }

    private List<BadgeStatus> statusesOf(UserEngagement engagement) {
        BadgeContext context = new BadgeContext(engagement.ledger(), engagement.points());
        List<BadgeStatus> out = new ArrayList<>();
        for (BadgeCatalog.Definition definition : catalog.definitions()) {
            AwardedBadge earned = engagement.badge(definition.badge().id());
            out.add(new BadgeStatus(
                    definition.badge(),
                    earned != null,
                    earned == null ? null : earned.earnedAt(),
                    earned != null ? 100 : definition.rule().progressPercent(context)
            ));
        }
        return List.copyOf(out);
    }

    private List<BadgeStatus> emptyStatuses() {
        List<BadgeStatus> out = new ArrayList<>();
        for (Badge badge : catalog.badges()) {
            out.add(new BadgeStatus(badge, false, null, 0));
        }
        return List.copyOf(out);
    }
}

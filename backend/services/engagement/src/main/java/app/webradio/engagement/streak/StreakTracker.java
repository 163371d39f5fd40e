package app.webradio.engagement.streak;

import app.webradio.engagement.activity.ActivityKind;
import app.webradio.engagement.leaderboard.LeaderboardBuilder;
import app.webradio.engagement.points.CreditResult;
import app.webradio.engagement.points.PointsAccumulator;
import app.webradio.engagement.store.PointsState;
import app.webradio.engagement.store.UserEngagementStore;
import app.webradio.engagement.user.ResolvedUser;
import app.webradio.engagement.user.UserDirectory;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class StreakTracker {

    private static final Logger log = LoggerFactory.getLogger(StreakTracker.class);

    public static final String CONSECUTIVE_DAYS_DETAIL = "consecutiveDays";

    private final UserDirectory userDirectory;
    private final UserEngagementStore store;
    private final PointsAccumulator pointsAccumulator;
    private final LeaderboardBuilder leaderboardBuilder;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public StreakTracker(UserDirectory userDirectory,
                         UserEngagementStore store,
                         PointsAccumulator pointsAccumulator,
                         LeaderboardBuilder leaderboardBuilder,
                         ApplicationEventPublisher eventPublisher,
                         Clock clock) {
        this.userDirectory = userDirectory;
        this.store = store;
        this.pointsAccumulator = pointsAccumulator;
        this.leaderboardBuilder = leaderboardBuilder;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Records today's login. The first login of a calendar day updates the streak and credits
     * {@code daily_login}; later logins the same day change nothing.
     */
    public LoginResult registerLogin(String userId) {
        Optional<ResolvedUser> user = userDirectory.resolve(userId);
        if (user.isEmpty()) {
            log.warn("Login skipped, user not found: userId={}", userId);
            return LoginResult.userNotFound();
        }

        List<Object> outbox = new ArrayList<>();
        LoginResult result = store.withUser(userId, engagement -> {
            PointsState points = engagement.points();
            LocalDate today = LocalDate.now(clock);
            if (today.equals(points.lastLoginDate())) {
                return new LoginResult(
                        LoginResult.Outcome.ALREADY_REGISTERED,
                        points.consecutiveDays(),
                        points.totalPoints(),
                        null
                );
            }

            int streak = nextStreak(points.lastLoginDate(), points.consecutiveDays(), today);
            points.registerLogin(today, streak);

            ObjectNode details = JsonNodeFactory.instance.objectNode();
            details.put(CONSECUTIVE_DAYS_DETAIL, streak);
            CreditResult credit = pointsAccumulator.creditLocked(
                    engagement,
                    user.get(),
                    ActivityKind.DAILY_LOGIN.code(),
                    details,
                    clock.instant(),
                    outbox
            );
            log.info("Login registered: userId={}, consecutiveDays={}", userId, streak);
            return new LoginResult(LoginResult.Outcome.REGISTERED, streak, credit.totals().totalPoints(), credit);
        });

        outbox.forEach(eventPublisher::publishEvent);
        if (result.outcome() == LoginResult.Outcome.REGISTERED) {
            leaderboardBuilder.markDirty();
        }
        return result;
    }

    static int nextStreak(LocalDate lastLogin, int current, LocalDate today) {
        if (lastLogin == null) {
            return 1;
        }
        long gap = ChronoUnit.DAYS.between(lastLogin, today);
        return gap == 1 ? current + 1 : 1;
    }
}

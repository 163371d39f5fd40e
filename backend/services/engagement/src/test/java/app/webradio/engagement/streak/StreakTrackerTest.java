package app.webradio.engagement.streak;

import app.webradio.engagement.store.AwardedBadge;
import app.webradio.engagement.support.EngagementFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class StreakTrackerTest {

    EngagementFixture fx;

    @BeforeEach
    void setup() {
        fx = new EngagementFixture();
        fx.users.register("u1", "Ana");
    }

    @Test
    void loginsOnDayOneTwoAndFour_resetStreakAfterGap() {
        assertThat(fx.streaks.registerLogin("u1").consecutiveDays()).isEqualTo(1);

        fx.clock.advance(Duration.ofDays(1));
        assertThat(fx.streaks.registerLogin("u1").consecutiveDays()).isEqualTo(2);

        fx.clock.advance(Duration.ofDays(2));
        assertThat(fx.streaks.registerLogin("u1").consecutiveDays()).isEqualTo(1);
    }

    @Test
    void firstLogin_creditsDailyLoginAndFirstLoginBadge() {
        LoginResult result = fx.streaks.registerLogin("u1");

        assertThat(result.outcome()).isEqualTo(LoginResult.Outcome.REGISTERED);
        assertThat(result.credit().pointsAwarded()).isEqualTo(10);
        assertThat(result.credit().badgesAwarded()).extracting(AwardedBadge::badgeId).containsExactly("first_login");
        assertThat(result.totalPoints()).isEqualTo(20);
    }

    @Test
    void secondLoginSameDay_changesNothing() {
        fx.streaks.registerLogin("u1");
        fx.clock.advance(Duration.ofHours(3));

        LoginResult again = fx.streaks.registerLogin("u1");

        assertThat(again.outcome()).isEqualTo(LoginResult.Outcome.ALREADY_REGISTERED);
        assertThat(again.consecutiveDays()).isEqualTo(1);
        assertThat(again.totalPoints()).isEqualTo(20);
        assertThat(fx.points.overview("u1").orElseThrow().recentActivities()).hasSize(1);
    }

    @Test
    void unknownUser_isReported() {
        assertThat(fx.streaks.registerLogin("ghost").outcome()).isEqualTo(LoginResult.Outcome.USER_NOT_FOUND);
        assertThat(fx.points.overview("ghost")).isEmpty();
    }

    @Test
    void sevenDayStreak_awardsDailyVisitor() {
        for (int day = 0; day < 7; day++) {
            fx.streaks.registerLogin("u1");
            fx.clock.advance(Duration.ofDays(1));
        }

        assertThat(fx.points.overview("u1").orElseThrow().points().consecutiveDays()).isEqualTo(7);
        assertThat(fx.badgeIds("u1")).contains("daily_visitor");
    }

    @Test
    void nextStreak_dayArithmetic() {
        LocalDate day = LocalDate.of(2026, 2, 28);

        assertThat(StreakTracker.nextStreak(null, 0, day)).isEqualTo(1);
        assertThat(StreakTracker.nextStreak(day, 4, day.plusDays(1))).isEqualTo(5);
        assertThat(StreakTracker.nextStreak(day, 4, day.plusDays(2))).isEqualTo(1);
        assertThat(StreakTracker.nextStreak(LocalDate.of(2025, 12, 31), 9, LocalDate.of(2026, 1, 1))).isEqualTo(10);
    }
}

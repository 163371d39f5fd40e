package app.webradio.engagement.leaderboard;

import app.webradio.engagement.support.EngagementFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class WeeklyResetSchedulerTest {

    EngagementFixture fx;
    WeeklyResetScheduler scheduler;

    @BeforeEach
    void setup() {
        fx = new EngagementFixture();
        scheduler = new WeeklyResetScheduler(fx.leaderboard, fx.clock);
        fx.users.register("u1", "Ana");
        fx.points.creditActivity("u1", "add_friend", null);
    }

    @Test
    void checkBoundary_sameWeekDoesNothing() {
        fx.clock.set(Instant.parse("2026-01-17T23:59:00Z"));

        assertThat(scheduler.checkBoundary()).isFalse();
        assertThat(weeklyPoints()).isEqualTo(10);
    }

    @Test
    void checkBoundary_resetsOnceAtSundayMidnight() {
        fx.clock.set(Instant.parse("2026-01-18T00:00:30Z"));

        assertThat(scheduler.checkBoundary()).isTrue();
        assertThat(scheduler.checkBoundary()).isFalse();
        assertThat(weeklyPoints()).isZero();
        assertThat(totalPoints()).isEqualTo(10);
    }

    @Test
    void checkBoundary_lateTickStillResets() {
        fx.clock.set(Instant.parse("2026-01-20T09:00:00Z"));

        assertThat(scheduler.checkBoundary()).isTrue();
        assertThat(weeklyPoints()).isZero();
    }

    @Test
    void weekId_startsOnSunday() {
        assertThat(WeeklyResetScheduler.WeekId.of(LocalDate.of(2026, 1, 17)))
                .isNotEqualTo(WeeklyResetScheduler.WeekId.of(LocalDate.of(2026, 1, 18)));
        assertThat(WeeklyResetScheduler.WeekId.of(LocalDate.of(2026, 1, 18)))
                .isEqualTo(WeeklyResetScheduler.WeekId.of(LocalDate.of(2026, 1, 24)));
    }

    private long weeklyPoints() {
        return fx.points.overview("u1").orElseThrow().points().weeklyPoints();
    }

    private long totalPoints() {
        return fx.points.overview("u1").orElseThrow().points().totalPoints();
    }
}

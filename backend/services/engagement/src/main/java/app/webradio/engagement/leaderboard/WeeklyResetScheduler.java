package app.webradio.engagement.leaderboard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.WeekFields;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fires the weekly points reset once per week. Weeks start on Sunday 00:00 in the clock's zone.
 * The check compares week ids, so a late or skipped tick still resets exactly once.
 */
@Component
public class WeeklyResetScheduler {

    private static final Logger log = LoggerFactory.getLogger(WeeklyResetScheduler.class);
    private static final WeekFields WEEKS = WeekFields.of(DayOfWeek.SUNDAY, 1);

    private final LeaderboardBuilder leaderboardBuilder;
    private final Clock clock;
    private final AtomicReference<WeekId> lastResetWeek;

    public WeeklyResetScheduler(LeaderboardBuilder leaderboardBuilder, Clock clock) {
        this.leaderboardBuilder = leaderboardBuilder;
        this.clock = clock;
        this.lastResetWeek = new AtomicReference<>(WeekId.of(LocalDate.now(clock)));
    }

    @Scheduled(fixedDelayString = "${app.engagement.weekly-check-ms:60000}")
    public void tick() {
        checkBoundary();
    }

    /**
     * @return true when this call performed the reset
     */
    public boolean checkBoundary() {
        WeekId current = WeekId.of(LocalDate.now(clock));
        WeekId last = lastResetWeek.get();
        if (current.equals(last) || !lastResetWeek.compareAndSet(last, current)) {
            return false;
        }
        log.info("Weekly boundary crossed: from={} to={}", last, current);
        leaderboardBuilder.resetWeekly();
        return true;
    }

    public record WeekId(int weekBasedYear, int week) {
        public static WeekId of(LocalDate date) {
            return new WeekId(date.get(WEEKS.weekBasedYear()), date.get(WEEKS.weekOfWeekBasedYear()));
        }

        @Override
        public String toString() {
            return weekBasedYear + "-W" + week;
        }
    }
}

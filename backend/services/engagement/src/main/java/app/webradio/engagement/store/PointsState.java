package app.webradio.engagement.store;

import java.time.LocalDate;

/**
 * Mutable point counters of one user. Guarded by the lock of the owning
 * {@link app.webradio.engagement.store.UserEngagement}.
 */
public final class PointsState {

    private long totalPoints;
    private long dailyPoints;
    private long weeklyPoints;
    private LocalDate dailyPointsDate;
    private LocalDate lastLoginDate;
    private int consecutiveDays;

    /**
     * Starts a fresh daily window when {@code today} differs from the day the daily counter belongs to.
     */
    public void rollDailyWindow(LocalDate today) {
        if (!today.equals(dailyPointsDate)) {
            dailyPoints = 0;
            dailyPointsDate = today;
        }
    }

    public void credit(int points) {
        if (points < 0) {
            throw new IllegalArgumentException("points must not be negative: " + points);
        }
        totalPoints += points;
        dailyPoints += points;
        weeklyPoints += points;
    }

    public void resetWeekly() {
        weeklyPoints = 0;
    }

    public void registerLogin(LocalDate day, int consecutiveDays) {
        this.lastLoginDate = day;
        this.consecutiveDays = consecutiveDays;
    }

    public long totalPoints() {
        return totalPoints;
    }

    public long weeklyPoints() {
        return weeklyPoints;
    }

    /**
     * Daily points as seen on {@code today}; a counter left over from an earlier day reads as zero.
     */
    public long dailyPointsOn(LocalDate today) {
        return today.equals(dailyPointsDate) ? dailyPoints : 0;
    }

    public LocalDate lastLoginDate() {
        return lastLoginDate;
    }

    public int consecutiveDays() {
        return consecutiveDays;
    }

    public PointsSnapshot snapshot(LocalDate today) {
        return new PointsSnapshot(totalPoints, dailyPointsOn(today), weeklyPoints, lastLoginDate, consecutiveDays);
    }
}

package app.webradio.engagement.store;

import java.time.LocalDate;

public record PointsSnapshot(
        long totalPoints,
        long dailyPoints,
        long weeklyPoints,
        LocalDate lastLoginDate,
        int consecutiveDays
) {
    public static PointsSnapshot empty() {
        return new PointsSnapshot(0, 0, 0, null, 0);
    }
}

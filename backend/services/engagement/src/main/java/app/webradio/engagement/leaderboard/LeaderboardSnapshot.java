package app.webradio.engagement.leaderboard;

import java.time.Instant;
import java.util.List;

public record LeaderboardSnapshot(
        Instant builtAt,
        int rankedUsers,
        List<LeaderboardEntry> daily,
        List<LeaderboardEntry> weekly,
        List<LeaderboardEntry> allTime
) {
    public static LeaderboardSnapshot empty(Instant at) {
        return new LeaderboardSnapshot(at, 0, List.of(), List.of(), List.of());
    }

    public List<LeaderboardEntry> entries(LeaderboardPeriod period) {
        return switch (period) {
            case DAILY -> daily;
            case WEEKLY -> weekly;
            case ALL_TIME -> allTime;
        };
    }
}

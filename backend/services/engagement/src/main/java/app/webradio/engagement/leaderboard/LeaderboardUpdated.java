package app.webradio.engagement.leaderboard;

import java.util.List;

public record LeaderboardUpdated(
        LeaderboardPeriod period,
        List<LeaderboardEntry> entries
) {
}

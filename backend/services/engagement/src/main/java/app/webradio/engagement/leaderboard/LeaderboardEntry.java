package app.webradio.engagement.leaderboard;

public record LeaderboardEntry(
        String userId,
        String displayName,
        long points,
        int rank
) {
}

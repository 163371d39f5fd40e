package app.webradio.engagement.leaderboard;

/**
 * A user's standing in each period. {@code rank} is null when the user is outside the ranked top.
 */
public record UserRank(
        Position daily,
        Position weekly,
        Position allTime
) {
    public record Position(Integer rank, long points) {
    }
}

package app.webradio.engagement.points;

public record PointsEarned(
        String userId,
        int points,
        String activityKind,
        long totalPoints,
        String message
) {
}

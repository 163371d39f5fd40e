package app.webradio.engagement.streak.controller.dto;

public record LoginResponse(
        boolean newDay,
        int consecutiveDays,
        int pointsAwarded,
        long totalPoints
) {
}

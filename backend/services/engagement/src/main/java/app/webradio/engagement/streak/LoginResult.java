package app.webradio.engagement.streak;

import app.webradio.engagement.points.CreditResult;

public record LoginResult(
        Outcome outcome,
        int consecutiveDays,
        long totalPoints,
        CreditResult credit
) {
    public enum Outcome {
        REGISTERED,
        ALREADY_REGISTERED,
        USER_NOT_FOUND
    }

    public static LoginResult userNotFound() {
        return new LoginResult(Outcome.USER_NOT_FOUND, 0, 0, null);
    }
}

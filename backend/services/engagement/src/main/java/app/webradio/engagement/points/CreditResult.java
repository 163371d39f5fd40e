package app.webradio.engagement.points;

import app.webradio.engagement.store.AwardedBadge;
import app.webradio.engagement.store.PointsSnapshot;

import java.util.List;

public record CreditResult(
        Outcome outcome,
        String userId,
        int pointsAwarded,
        PointsSnapshot totals,
        List<AwardedBadge> badgesAwarded
) {
    public enum Outcome {
        CREDITED,
        USER_NOT_FOUND
    }

    public static CreditResult userNotFound(String userId) {
        return new CreditResult(Outcome.USER_NOT_FOUND, userId, 0, PointsSnapshot.empty(), List.of());
    }

    public static CreditResult credited(String userId,
                                        int pointsAwarded,
                                        PointsSnapshot totals,
                                        List<AwardedBadge> badgesAwarded) {
        return new CreditResult(Outcome.CREDITED, userId, pointsAwarded, totals, List.copyOf(badgesAwarded));
    }

    public boolean credited() {
        return outcome == Outcome.CREDITED;
    }
}

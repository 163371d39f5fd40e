package app.webradio.engagement.badge;

import app.webradio.engagement.store.AwardedBadge;

import java.util.List;

public record EvaluationResult(
        boolean userFound,
        List<AwardedBadge> awarded
) {
    public static EvaluationResult userNotFound() {
        return new EvaluationResult(false, List.of());
    }

    public static EvaluationResult of(List<AwardedBadge> awarded) {
        return new EvaluationResult(true, List.copyOf(awarded));
    }
}

package app.webradio.engagement.badge.rule;

import app.webradio.engagement.activity.ActivityKind;

/**
 * At least {@code threshold} activities of one kind over the user's whole history.
 */
public record ActivityCountRule(ActivityKind kind, long threshold) implements BadgeRule {

    public ActivityCountRule {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive");
        }
    }

    @Override
    public boolean isSatisfied(BadgeContext context) {
        return context.activityCount(kind) >= threshold;
    }

    @Override
    public int progressPercent(BadgeContext context) {
        return BadgeRule.percent(context.activityCount(kind), threshold);
    }
}

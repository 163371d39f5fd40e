package app.webradio.engagement.badge.rule;

public record WeekendActivityRule(long threshold) implements BadgeRule {

    public WeekendActivityRule {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive");
        }
    }

    @Override
    public boolean isSatisfied(BadgeContext context) {
        return context.weekendActivities() >= threshold;
    }

    @Override
    public int progressPercent(BadgeContext context) {
        return BadgeRule.percent(context.weekendActivities(), threshold);
    }
}

package app.webradio.engagement.badge.rule;

public record ConsecutiveDaysRule(int days) implements BadgeRule {

    public ConsecutiveDaysRule {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive");
        }
    }

    @Override
    public boolean isSatisfied(BadgeContext context) {
        return context.consecutiveDays() >= days;
    }

    @Override
    public int progressPercent(BadgeContext context) {
        return BadgeRule.percent(context.consecutiveDays(), days);
    }
}

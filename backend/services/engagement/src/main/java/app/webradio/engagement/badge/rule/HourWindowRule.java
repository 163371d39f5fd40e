package app.webradio.engagement.badge.rule;

/**
 * At least {@code threshold} activities whose local hour falls in [fromHour, toHour].
 * A window with fromHour greater than toHour spans midnight.
 */
public record HourWindowRule(int fromHour, int toHour, long threshold) implements BadgeRule {

    public HourWindowRule {
        if (fromHour < 0 || fromHour > 23 || toHour < 0 || toHour > 23) {
            throw new IllegalArgumentException("Hours must be within 0..23");
        }
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive");
        }
    }

    @Override
    public boolean isSatisfied(BadgeContext context) {
        return context.activitiesBetweenHours(fromHour, toHour) >= threshold;
    }

    @Override
    public int progressPercent(BadgeContext context) {
        return BadgeRule.percent(context.activitiesBetweenHours(fromHour, toHour), threshold);
    }
}

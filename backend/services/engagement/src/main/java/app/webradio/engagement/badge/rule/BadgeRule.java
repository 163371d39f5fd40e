package app.webradio.engagement.badge.rule;

/**
 * Unlock condition of a badge.
 */
public interface BadgeRule {

    boolean isSatisfied(BadgeContext context);

    /**
     * Completion towards the unlock condition, 0..100.
     */
    int progressPercent(BadgeContext context);

    static int percent(long value, long threshold) {
        if (threshold <= 0) {
            return 100;
        }
        if (value <= 0) {
            return 0;
        }
        return (int) Math.min(100L, value * 100L / threshold);
    }
}

package app.webradio.engagement.badge.rule;

import app.webradio.engagement.activity.ActivityKind;
import app.webradio.engagement.activity.ActivityLedger;
import app.webradio.engagement.store.PointsState;

import java.util.Set;

/**
 * Read view over one user's ledger and counters, valid only while the user's lock is held.
 */
public final class BadgeContext {

    private final ActivityLedger ledger;
    private final PointsState points;

    public BadgeContext(ActivityLedger ledger, PointsState points) {
        this.ledger = ledger;
        this.points = points;
    }

    public long activityCount(ActivityKind kind) {
        return ledger.lifetimeCount(kind);
    }

    public long activitiesBetweenHours(int fromHour, int toHour) {
        return ledger.activitiesBetweenHours(fromHour, toHour);
    }

    public long weekendActivities() {
        return ledger.weekendActivities();
    }

    public Set<String> visitedRooms() {
        return ledger.visitedRooms();
    }

    public int consecutiveDays() {
        return points.consecutiveDays();
    }
}

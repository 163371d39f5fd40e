package app.webradio.engagement.store;

import app.webradio.engagement.activity.ActivityLedger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * All engagement state of one user: point counters, activity ledger and earned badges.
 * Every read or write goes through {@link UserEngagementStore#withUser} which holds {@link #lock()}.
 */
public final class UserEngagement {

    private final String userId;
    private final long creationOrder;
    private final ReentrantLock lock = new ReentrantLock();
    private final PointsState points = new PointsState();
    private final ActivityLedger ledger;
    private final Map<String, AwardedBadge> badges = new LinkedHashMap<>();

    UserEngagement(String userId, long creationOrder, int ledgerCapacity) {
        this.userId = userId;
        this.creationOrder = creationOrder;
        this.ledger = new ActivityLedger(ledgerCapacity);
    }

    public String userId() {
        return userId;
    }

    /**
     * Position at which the user's state was first created; earlier users win leaderboard ties.
     */
    public long creationOrder() {
        return creationOrder;
    }

    public ReentrantLock lock() {
        return lock;
    }

    public PointsState points() {
        return points;
    }

    public ActivityLedger ledger() {
        return ledger;
    }

    public boolean hasBadge(String badgeId) {
        return badges.containsKey(badgeId);
    }

    /**
     * @return false when the badge was already present, in which case nothing changes
     */
    public boolean award(AwardedBadge badge) {
        return badges.putIfAbsent(badge.badgeId(), badge) == null;
    }

    public List<AwardedBadge> badges() {
        return List.copyOf(badges.values());
    }

    public AwardedBadge badge(String badgeId) {
        return badges.get(badgeId);
    }

    public void requireHeldByCurrentThread() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Engagement state of " + userId + " accessed without its lock");
        }
    }
}

package app.webradio.engagement.points;

import app.webradio.engagement.activity.ActivityRecord;
import app.webradio.engagement.store.AwardedBadge;
import app.webradio.engagement.store.PointsSnapshot;

import java.util.List;

public record PointsOverview(
        String userId,
        PointsSnapshot points,
        List<AwardedBadge> badges,
        List<ActivityRecord> recentActivities
) {
}

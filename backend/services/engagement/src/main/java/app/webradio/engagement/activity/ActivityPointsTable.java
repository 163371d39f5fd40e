package app.webradio.engagement.activity;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class ActivityPointsTable {

    private final Map<ActivityKind, Integer> points;

    public ActivityPointsTable() {
        this.points = defaultPoints();
    }

    /**
     * Unknown activity codes are worth nothing.
     */
    public int pointsFor(String activityCode) {
        return ActivityKind.fromCode(activityCode)
                .map(kind -> points.getOrDefault(kind, 0))
                .orElse(0);
    }

    public String describe(String activityCode) {
        return ActivityKind.fromCode(activityCode)
                .map(ActivityKind::description)
                .orElse(activityCode);
    }

    /**
     * Activity code to point value, in declaration order.
     */
    public Map<String, Integer> asTable() {
        Map<String, Integer> table = new LinkedHashMap<>();
        points.forEach((kind, value) -> table.put(kind.code(), value));
        return Collections.unmodifiableMap(table);
    }

    private static Map<ActivityKind, Integer> defaultPoints() {
        Map<ActivityKind, Integer> map = new EnumMap<>(ActivityKind.class);
        map.put(ActivityKind.CHAT_MESSAGE, 2);
        map.put(ActivityKind.MUSIC_REQUEST, 3);
        map.put(ActivityKind.SONG_LISTEN_COMPLETE, 5);
        map.put(ActivityKind.ADD_FRIEND, 10);
        map.put(ActivityKind.SONG_COMMENT, 5);
        map.put(ActivityKind.COMMENT_LIKE, 1);
        map.put(ActivityKind.DAILY_LOGIN, 10);
        map.put(ActivityKind.ROOM_VISIT, 2);
        map.put(ActivityKind.SHARE_SONG, 8);
        map.put(ActivityKind.EVENT_PARTICIPATION, 20);
        // per hour of listening
        map.put(ActivityKind.LISTENING_TIME_HOUR, 15);
        return map;
    }
}

package app.webradio.engagement.activity;

import app.webradio.engagement.support.BoundedHistory;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Per-user activity log.
 * <p>
 * The raw records are kept in a window of the most recent {@code capacity} entries. Badge progress is
 * read from the lifetime tallies maintained next to the window, which only ever grow, so evicting old
 * records never takes progress away.
 */
public final class ActivityLedger {

    public static final String ROOM_ID_DETAIL = "roomId";

    private final BoundedHistory<ActivityRecord> window;
    private final Map<String, Long> lifetimeCounts = new HashMap<>();
    private final long[] hourCounts = new long[24];
    private final Set<String> visitedRooms = new HashSet<>();
    private long weekendCount;

    public ActivityLedger(int capacity) {
        this.window = new BoundedHistory<>(capacity);
    }

    public void append(ActivityRecord record, ZoneId zone) {
        window.append(record);
        lifetimeCounts.merge(record.kind(), 1L, Long::sum);

        ZonedDateTime at = record.timestamp().atZone(zone);
        hourCounts[at.getHour()]++;
        DayOfWeek day = at.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            weekendCount++;
        }

        if (ActivityKind.ROOM_VISIT.code().equals(record.kind()) && record.details() != null) {
            String roomId = record.details().path(ROOM_ID_DETAIL).asText("");
            if (!roomId.isBlank()) {
                visitedRooms.add(roomId.trim().toLowerCase(Locale.ROOT));
            }
        }
    }

    public List<ActivityRecord> recent(int limit) {
        return window.latest(limit);
    }

    public long lifetimeCount(ActivityKind kind) {
        return lifetimeCounts.getOrDefault(kind.code(), 0L);
    }

    /**
     * Activities whose local hour is within [fromHour, toHour], wrapping past midnight when fromHour > toHour.
     */
    public long activitiesBetweenHours(int fromHour, int toHour) {
        if (fromHour < 0 || fromHour > 23 || toHour < 0 || toHour > 23) {
            throw new IllegalArgumentException("Hours must be within 0..23: " + fromHour + ".." + toHour);
        }
        long count = 0;
        int hour = fromHour;
        while (true) {
            count += hourCounts[hour];
            if (hour == toHour) {
                return count;
            }
            hour = (hour + 1) % 24;
        }
    }

    public long weekendActivities() {
        return weekendCount;
    }

    public Set<String> visitedRooms() {
        return Collections.unmodifiableSet(visitedRooms);
    }
}

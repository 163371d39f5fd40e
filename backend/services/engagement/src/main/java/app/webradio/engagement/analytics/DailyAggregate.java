package app.webradio.engagement.analytics;

import java.time.Duration;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;

/**
 * Rollup of one calendar day. Guarded by the {@link ListeningAnalytics} lock.
 */
final class DailyAggregate {

    private final LocalDate date;
    private final Set<String> uniqueListenerIds = new HashSet<>();
    private final Set<String> songIdsPlayed = new HashSet<>();
    private Duration totalListeningTime = Duration.ZERO;

    DailyAggregate(LocalDate date) {
        this.date = date;
    }

    void addListener(String connectionId) {
        uniqueListenerIds.add(connectionId);
    }

    void addSong(String songId) {
        songIdsPlayed.add(songId);
    }

    void addListeningTime(Duration time) {
        totalListeningTime = totalListeningTime.plus(time);
    }

    DailyReport report() {
        return report(date, uniqueListenerIds.size(), totalListeningTime, songIdsPlayed.size());
    }

    static DailyReport empty(LocalDate date) {
        return report(date, 0, Duration.ZERO, 0);
    }

    private static DailyReport report(LocalDate date, int listeners, Duration total, int songs) {
        long avg = listeners > 0 ? Math.round(total.toMillis() / (double) listeners / 60_000d) : 0;
        return new DailyReport(date, listeners, ListeningAnalytics.minutes(total), songs, avg);
    }
}

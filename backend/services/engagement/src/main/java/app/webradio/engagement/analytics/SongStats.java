package app.webradio.engagement.analytics;

import java.util.HashSet;
import java.util.Set;

/**
 * Global play statistics of one song. Guarded by the {@link ListeningAnalytics} lock.
 */
final class SongStats {

    private final String songId;
    private String title;
    private long playCount;
    private final Set<String> listeners = new HashSet<>();

    SongStats(String songId, String title) {
        this.songId = songId;
        this.title = title;
    }

    void played(String title) {
        playCount++;
        if (title != null && !title.isBlank()) {
            this.title = title;
        }
    }

    void addListener(String connectionId) {
        listeners.add(connectionId);
    }

    long playCount() {
        return playCount;
    }

    AnalyticsReport.SongPlayStats report() {
        return new AnalyticsReport.SongPlayStats(songId, title, playCount, listeners.size());
    }
}

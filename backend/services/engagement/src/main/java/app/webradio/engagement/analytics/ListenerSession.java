package app.webradio.engagement.analytics;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Live connection. Guarded by the {@link ListeningAnalytics} lock.
 */
final class ListenerSession {

    private final String connectionId;
    private final Instant connectedAt;
    private final Instant sessionStart;
    private final Set<String> songsListened = new LinkedHashSet<>();
    private String displayName;
    private Duration accumulatedListeningTime = Duration.ZERO;

    ListenerSession(String connectionId, String displayName, Instant connectedAt) {
        this.connectionId = connectionId;
        this.displayName = displayName;
        this.connectedAt = connectedAt;
        this.sessionStart = connectedAt;
    }

    String connectionId() {
        return connectionId;
    }

    String displayName() {
        return displayName;
    }

    void rename(String displayName) {
        this.displayName = displayName;
    }

    Instant connectedAt() {
        return connectedAt;
    }

    Duration currentSessionTime(Instant now) {
        Duration elapsed = Duration.between(sessionStart, now);
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }

    Duration listeningTime(Instant now) {
        return accumulatedListeningTime.plus(currentSessionTime(now));
    }

    Duration close(Instant now) {
        Duration sessionTime = currentSessionTime(now);
        accumulatedListeningTime = accumulatedListeningTime.plus(sessionTime);
        return sessionTime;
    }

    Duration accumulatedListeningTime() {
        return accumulatedListeningTime;
    }

    void markListening(String songId) {
        songsListened.add(songId);
    }

    Set<String> songsListened() {
        return songsListened;
    }
}

package app.webradio.engagement.analytics;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record SessionRecord(
        String id,
        String connectionId,
        String displayName,
        Instant connectedAt,
        Instant disconnectedAt,
        Duration totalListeningTime,
        List<String> songsListened,
        LocalDate date
) {
}

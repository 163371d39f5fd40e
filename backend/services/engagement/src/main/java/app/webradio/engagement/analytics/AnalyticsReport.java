package app.webradio.engagement.analytics;

import java.time.Instant;
import java.util.List;

public record AnalyticsReport(
        Instant generatedAt,
        int simultaneousListeners,
        List<SongPlayStats> topSongs,
        List<ActiveListener> activeListeners,
        List<DailyReport> audienceReports,
        GeneralStats generalStats
) {
    public record SongPlayStats(
            String songId,
            String title,
            long playCount,
            int currentListeners
    ) {
    }

    public record ActiveListener(
            String connectionId,
            String displayName,
            Instant connectedAt,
            long listeningMinutes,
            int songsListened
    ) {
    }

    public record GeneralStats(
            int totalSessions,
            long avgSessionMinutes,
            CurrentSong currentSong
    ) {
    }

    public record CurrentSong(
            String songId,
            String title,
            int currentListeners,
            long playCount
    ) {
    }
}

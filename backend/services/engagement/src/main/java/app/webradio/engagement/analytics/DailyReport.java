package app.webradio.engagement.analytics;

import java.time.LocalDate;

public record DailyReport(
        LocalDate date,
        int uniqueListeners,
        long totalListeningMinutes,
        int songsPlayed,
        long avgListeningMinutes
) {
}

package app.webradio.engagement.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

@Validated
@ConfigurationProperties(prefix = "app.engagement")
public record EngagementProps(
        @NotBlank String zoneId,
        @Positive int ledgerCapacity,
        @Positive int sessionHistoryCapacity,
        @Positive int leaderboardSize,
        @Positive int topSongs,
        @Positive int reportDays,
        @Positive int recentActivities,
        @Positive int announcementCapacity,
        @Positive int dailyRetentionDays
) {
    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }
}

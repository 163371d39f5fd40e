package app.webradio.engagement.leaderboard.controller.dto;

import app.webradio.engagement.leaderboard.LeaderboardEntry;

import java.time.Instant;
import java.util.List;

public record LeaderboardResponse(
        String period,
        List<LeaderboardEntry> leaderboard,
        int totalUsers,
        Instant builtAt
) {
}

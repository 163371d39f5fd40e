package app.webradio.engagement.badge.controller.dto;

import app.webradio.engagement.badge.BadgeStatus;

import java.util.List;

public record BadgeProgressResponse(
        List<BadgeStatus> badges,
        int totalEarned,
        int totalAvailable
) {
}

package app.webradio.engagement.badge.controller.dto;

import app.webradio.engagement.badge.Badge;

import java.util.List;
import java.util.Map;

public record BadgeCatalogResponse(
        List<Badge> availableBadges,
        Map<String, Integer> pointsSystem
) {
}

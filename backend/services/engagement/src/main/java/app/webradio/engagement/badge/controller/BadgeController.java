package app.webradio.engagement.badge.controller;

import app.webradio.engagement.activity.ActivityPointsTable;
import app.webradio.engagement.badge.BadgeCatalog;
import app.webradio.engagement.badge.BadgeEvaluator;
import app.webradio.engagement.badge.BadgeStatus;
import app.webradio.engagement.badge.controller.dto.BadgeCatalogResponse;
import app.webradio.engagement.badge.controller.dto.BadgeProgressResponse;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/gamification/badges")
public class BadgeController {

    private final BadgeCatalog catalog;
    private final BadgeEvaluator badgeEvaluator;
    private final ActivityPointsTable pointsTable;

    public BadgeController(BadgeCatalog catalog,
                           BadgeEvaluator badgeEvaluator,
                           ActivityPointsTable pointsTable) {
        this.catalog = catalog;
        this.badgeEvaluator = badgeEvaluator;
        this.pointsTable = pointsTable;
    }

    @GetMapping
    public BadgeCatalogResponse catalog() {
        return new BadgeCatalogResponse(catalog.badges(), pointsTable.asTable());
    }

    @GetMapping("/{userId}")
    public BadgeProgressResponse progress(@PathVariable String userId) {
        List<BadgeStatus> statuses = badgeEvaluator.progress(userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "User not found: " + userId));
        int earned = (int) statuses.stream().filter(BadgeStatus::earned).count();
        return new BadgeProgressResponse(statuses, earned, catalog.size());
    }
}

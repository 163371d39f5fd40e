package app.webradio.engagement.points.controller;

import app.webradio.engagement.points.PointsAccumulator;
import app.webradio.engagement.points.PointsOverview;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/gamification/points")
public class PointsController {

    private final PointsAccumulator pointsAccumulator;

    public PointsController(PointsAccumulator pointsAccumulator) {
        this.pointsAccumulator = pointsAccumulator;
    }

    @GetMapping("/{userId}")
    public PointsOverview points(@PathVariable String userId) {
        return pointsAccumulator.overview(userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "User not found: " + userId));
    }
}

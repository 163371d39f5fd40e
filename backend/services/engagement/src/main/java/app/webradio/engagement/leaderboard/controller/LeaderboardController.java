package app.webradio.engagement.leaderboard.controller;

import app.webradio.engagement.leaderboard.LeaderboardBuilder;
import app.webradio.engagement.leaderboard.LeaderboardPeriod;
import app.webradio.engagement.leaderboard.LeaderboardSnapshot;
import app.webradio.engagement.leaderboard.UserRank;
import app.webradio.engagement.leaderboard.controller.dto.LeaderboardResponse;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/gamification")
public class LeaderboardController {

    private final LeaderboardBuilder leaderboardBuilder;

    public LeaderboardController(LeaderboardBuilder leaderboardBuilder) {
        this.leaderboardBuilder = leaderboardBuilder;
    }

    @GetMapping("/leaderboard")
    public LeaderboardResponse leaderboard(@RequestParam(defaultValue = "alltime") String period) {
        LeaderboardPeriod resolved = LeaderboardPeriod.fromCode(period)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown period: " + period));
        LeaderboardSnapshot snapshot = leaderboardBuilder.current();
        return new LeaderboardResponse(
                resolved.code(),
                snapshot.entries(resolved),
                snapshot.rankedUsers(),
                snapshot.builtAt()
        );
    }

    @GetMapping("/user-rank/{userId}")
    public UserRank userRank(@PathVariable String userId) {
        return leaderboardBuilder.rankOf(userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "User not found: " + userId));
    }
}

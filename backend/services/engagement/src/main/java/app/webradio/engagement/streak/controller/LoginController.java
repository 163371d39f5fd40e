package app.webradio.engagement.streak.controller;

import app.webradio.engagement.streak.LoginResult;
import app.webradio.engagement.streak.StreakTracker;
import app.webradio.engagement.streak.controller.dto.LoginResponse;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/users")
public class LoginController {

    private final StreakTracker streakTracker;

    public LoginController(StreakTracker streakTracker) {
        this.streakTracker = streakTracker;
    }

    @PostMapping("/{userId}/login")
    public LoginResponse login(@PathVariable String userId) {
        LoginResult result = streakTracker.registerLogin(userId);
        return switch (result.outcome()) {
            case USER_NOT_FOUND -> throw new ResponseStatusException(HttpStatus.NOT_FOUND, "User not found: " + userId);
            case ALREADY_REGISTERED -> new LoginResponse(false, result.consecutiveDays(), 0, result.totalPoints());
            case REGISTERED -> new LoginResponse(
                    true,
                    result.consecutiveDays(),
                    result.credit().pointsAwarded(),
                    result.totalPoints()
            );
        };
    }
}

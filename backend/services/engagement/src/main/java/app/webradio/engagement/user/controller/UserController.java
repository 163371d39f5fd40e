package app.webradio.engagement.user.controller;

import app.webradio.engagement.user.InMemoryUserDirectory;
import app.webradio.engagement.user.ResolvedUser;
import app.webradio.engagement.user.controller.dto.RegisterUserRequest;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
public class UserController {

    private final InMemoryUserDirectory userDirectory;

    public UserController(InMemoryUserDirectory userDirectory) {
        this.userDirectory = userDirectory;
    }

    @PutMapping("/{userId}")
    public ResolvedUser register(@PathVariable String userId,
                                 @Valid @RequestBody RegisterUserRequest request) {
        return userDirectory.register(userId, request.displayName());
    }
}

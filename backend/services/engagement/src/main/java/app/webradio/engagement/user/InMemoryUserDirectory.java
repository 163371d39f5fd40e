package app.webradio.engagement.user;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryUserDirectory implements UserDirectory {

    private static final Logger log = LoggerFactory.getLogger(InMemoryUserDirectory.class);

    private final Map<String, ResolvedUser> users = new ConcurrentHashMap<>();

    @Override
    public Optional<ResolvedUser> resolve(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(users.get(userId));
    }

    public ResolvedUser register(String userId, String displayName) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("displayName is required");
        }
        ResolvedUser user = new ResolvedUser(userId, displayName.trim());
        ResolvedUser previous = users.put(userId, user);
        if (previous == null) {
            log.info("User registered: userId={}, displayName={}", userId, user.displayName());
        }
        return user;
    }
}

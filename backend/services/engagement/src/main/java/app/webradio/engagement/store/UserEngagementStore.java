package app.webradio.engagement.store;

import app.webradio.engagement.config.EngagementProps;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Owner of every user's engagement aggregate. Mutations of one user are serialized by that
 * user's lock; different users proceed in parallel.
 */
@Component
public class UserEngagementStore {

    private final ConcurrentMap<String, UserEngagement> users = new ConcurrentHashMap<>();
    private final AtomicLong registrations = new AtomicLong();
    private final int ledgerCapacity;

    public UserEngagementStore(EngagementProps props) {
        this.ledgerCapacity = props.ledgerCapacity();
    }

    /**
     * Runs {@code action} under the user's lock, creating the user's state on first use.
     */
    public <T> T withUser(String userId, Function<UserEngagement, T> action) {
        UserEngagement engagement = users.computeIfAbsent(
                userId,
                id -> new UserEngagement(id, registrations.incrementAndGet(), ledgerCapacity)
        );
        return locked(engagement, action);
    }

    /**
     * Like {@link #withUser} but never creates state.
     */
    public <T> Optional<T> readUser(String userId, Function<UserEngagement, T> action) {
        UserEngagement engagement = users.get(userId);
        if (engagement == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(locked(engagement, action));
    }

    /**
     * Applies {@code action} to every user in creation order, one lock at a time.
     */
    public void forEachUser(Consumer<UserEngagement> action) {
        for (UserEngagement engagement : usersInCreationOrder()) {
            locked(engagement, e -> {
                action.accept(e);
                return null;
            });
        }
    }

    /**
     * Per-user copies taken under each user's lock, in creation order.
     */
    public <T> List<T> collect(Function<UserEngagement, T> mapper) {
        List<T> out = new ArrayList<>();
        for (UserEngagement engagement : usersInCreationOrder()) {
            out.add(locked(engagement, mapper));
        }
        return out;
    }

    private List<UserEngagement> usersInCreationOrder() {
        List<UserEngagement> ordered = new ArrayList<>(users.values());
        ordered.sort(Comparator.comparingLong(UserEngagement::creationOrder));
        return ordered;
    }

    private static <T> T locked(UserEngagement engagement, Function<UserEngagement, T> action) {
        engagement.lock().lock();
        try {
            return action.apply(engagement);
        } finally {
            engagement.lock().unlock();
        }
    }
}

package app.webradio.engagement.leaderboard;

import app.webradio.engagement.config.EngagementProps;
import app.webradio.engagement.store.PointsSnapshot;
import app.webradio.engagement.store.UserEngagementStore;
import app.webradio.engagement.user.ResolvedUser;
import app.webradio.engagement.user.UserDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.ToLongFunction;

/**
 * Ranked daily, weekly and all-time views recomputed from the point counters.
 * <p>
 * Mutations only mark the view stale; the rebuild happens on the next read or on the periodic flush,
 * so a burst of credits costs one recompute.
 */
@Service
public class LeaderboardBuilder {

    private static final Logger log = LoggerFactory.getLogger(LeaderboardBuilder.class);

    private final UserEngagementStore store;
    private final UserDirectory userDirectory;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final int size;

    private final AtomicBoolean dirty = new AtomicBoolean(true);
    private volatile LeaderboardSnapshot latest;
    private volatile LocalDate builtFor;

    public LeaderboardBuilder(UserEngagementStore store,
                              UserDirectory userDirectory,
                              ApplicationEventPublisher eventPublisher,
                              Clock clock,
                              EngagementProps props) {
        this.store = store;
        this.userDirectory = userDirectory;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.size = props.leaderboardSize();
        this.latest = LeaderboardSnapshot.empty(clock.instant());
    }

    public void markDirty() {
        dirty.set(true);
    }

    boolean isDirty() {
        return dirty.get();
    }

    public synchronized LeaderboardSnapshot rebuild() {
        dirty.set(false);
        LocalDate today = LocalDate.now(clock);
        List<Standing> standings = store.collect(e -> new Standing(
                e.userId(),
                e.creationOrder(),
                e.points().snapshot(today)
        ));

        List<Ranked> ranked = new ArrayList<>();
        for (Standing standing : standings) {
            Optional<ResolvedUser> user = userDirectory.resolve(standing.userId());
            if (user.isEmpty()) {
                continue;
            }
            ranked.add(new Ranked(standing, user.get().displayName()));
        }

        LeaderboardSnapshot snapshot = new LeaderboardSnapshot(
                clock.instant(),
                ranked.size(),
                rank(ranked, PointsSnapshot::dailyPoints),
                rank(ranked, PointsSnapshot::weeklyPoints),
                rank(ranked, PointsSnapshot::totalPoints)
        );
        latest = snapshot;
        builtFor = today;

        log.debug("Leaderboard rebuilt: users={}", ranked.size());
        for (LeaderboardPeriod period : LeaderboardPeriod.values()) {
            eventPublisher.publishEvent(new LeaderboardUpdated(period, snapshot.entries(period)));
        }
        return snapshot;
    }

    /**
     * Latest snapshot, rebuilt first when a mutation happened since the previous build or the
     * calendar day has changed since it was built.
     */
    public LeaderboardSnapshot current() {
        if (isStale()) {
            return rebuild();
        }
        return latest;
    }

    @Scheduled(fixedDelayString = "${app.engagement.leaderboard-flush-ms:1000}")
    public void flushIfDirty() {
        if (isStale()) {
            rebuild();
        }
    }

    /**
     * Zeroes every user's weekly counter and rebuilds.
     */
    public LeaderboardSnapshot resetWeekly() {
        int[] users = {0};
        store.forEachUser(engagement -> {
            engagement.points().resetWeekly();
            users[0]++;
        });
        log.info("Weekly points reset: users={}", users[0]);
        return rebuild();
    }

    public Optional<UserRank> rankOf(String userId) {
        if (userDirectory.resolve(userId).isEmpty()) {
            return Optional.empty();
        }
        LeaderboardSnapshot snapshot = current();
        PointsSnapshot points = store.readUser(userId, e -> e.points().snapshot(LocalDate.now(clock)))
                .orElse(PointsSnapshot.empty());
        return Optional.of(new UserRank(
                position(snapshot.daily(), userId, points.dailyPoints()),
                position(snapshot.weekly(), userId, points.weeklyPoints()),
                position(snapshot.allTime(), userId, points.totalPoints())
        ));
    }

    private boolean isStale() {
        return dirty.get() || !LocalDate.now(clock).equals(builtFor);
    }

    private List<LeaderboardEntry> rank(List<Ranked> users, ToLongFunction<PointsSnapshot> counter) {
        List<Ranked> sorted = new ArrayList<>(users);
        sorted.sort(Comparator
                .comparingLong((Ranked r) -> counter.applyAsLong(r.standing().points())).reversed()
                .thenComparingLong(r -> r.standing().creationOrder()));

        List<LeaderboardEntry> out = new ArrayList<>(Math.min(size, sorted.size()));
        for (int i = 0; i < sorted.size() && i < size; i++) {
            Ranked r = sorted.get(i);
            out.add(new LeaderboardEntry(
                    r.standing().userId(),
                    r.displayName(),
                    counter.applyAsLong(r.standing().points()),
                    i + 1
            ));
        }
        return List.copyOf(out);
    }

    private static UserRank.Position position(List<LeaderboardEntry> entries, String userId, long points) {
        for (LeaderboardEntry entry : entries) {
            if (entry.userId().equals(userId)) {
                return new UserRank.Position(entry.rank(), entry.points());
            }
        }
        return new UserRank.Position(null, points);
    }

    private record Standing(String userId, long creationOrder, PointsSnapshot points) {
    }

    private record Ranked(Standing standing, String displayName) {
    }
}

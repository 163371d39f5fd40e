package app.webradio.engagement.ingest;

import app.webradio.engagement.activity.ActivityKind;
import app.webradio.engagement.analytics.ListeningAnalytics;
import app.webradio.engagement.points.CreditResult;
import app.webradio.engagement.points.PointsAccumulator;
import app.webradio.engagement.streak.LoginResult;
import app.webradio.engagement.streak.StreakTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Entry point for events coming from the radio front end. Nothing thrown here reaches the producer:
 * malformed or unresolvable events are logged and dropped.
 */
@Service
public class EngagementEventIngestor {

    private static final Logger log = LoggerFactory.getLogger(EngagementEventIngestor.class);

    private final PointsAccumulator pointsAccumulator;
    private final StreakTracker streakTracker;
    private final ListeningAnalytics analytics;
    private final Clock clock;

    public EngagementEventIngestor(PointsAccumulator pointsAccumulator,
                                   StreakTracker streakTracker,
                                   ListeningAnalytics analytics,
                                   Clock clock) {
        this.pointsAccumulator = pointsAccumulator;
        this.streakTracker = streakTracker;
        this.analytics = analytics;
        this.clock = clock;
    }

    /**
     * {@code daily_login} goes through the streak tracker so it is credited at most once per day;
     * every other kind is credited directly.
     */
    public IngestOutcome accept(ActivityEvent event) {
        if (event == null || isBlank(event.userId()) || isBlank(event.kind())) {
            log.warn("Dropping malformed activity event: {}", event);
            return IngestOutcome.DROPPED;
        }
        try {
            if (ActivityKind.fromCode(event.kind()).orElse(null) == ActivityKind.DAILY_LOGIN) {
                LoginResult login = streakTracker.registerLogin(event.userId());
                return switch (login.outcome()) {
                    case REGISTERED -> IngestOutcome.ACCEPTED;
                    case ALREADY_REGISTERED -> IngestOutcome.IGNORED;
                    case USER_NOT_FOUND -> IngestOutcome.USER_NOT_FOUND;
                };
            }

            Instant occurredAt = event.timestamp() == null ? clock.instant() : event.timestamp();
            CreditResult result = pointsAccumulator.creditActivity(event.userId(), event.kind(), event.details(), occurredAt);
            return result.credited() ? IngestOutcome.ACCEPTED : IngestOutcome.USER_NOT_FOUND;
        } catch (RuntimeException ex) {
            log.error("Activity event failed: userId={}, kind={}", event.userId(), event.kind(), ex);
            return IngestOutcome.FAILED;
        }
    }

    public IngestOutcome accept(ConnectionEvent event) {
        if (event == null || isBlank(event.connectionId()) || event.kind() == null) {
            log.warn("Dropping malformed connection event: {}", event);
            return IngestOutcome.DROPPED;
        }
        try {
            boolean changed = switch (event.kind()) {
                case CONNECT -> analytics.onConnect(event.connectionId(), event.displayName());
                case DISCONNECT -> analytics.onDisconnect(event.connectionId()).isPresent();
                case IDENTIFY -> analytics.onIdentify(event.connectionId(), event.displayName());
            };
            return changed ? IngestOutcome.ACCEPTED : IngestOutcome.IGNORED;
        } catch (RuntimeException ex) {
            log.error("Connection event failed: connectionId={}, kind={}", event.connectionId(), event.kind(), ex);
            return IngestOutcome.FAILED;
        }
    }

    public IngestOutcome accept(SongStartEvent event) {
        if (event == null || isBlank(event.songId())) {
            log.warn("Dropping malformed song start event: {}", event);
            return IngestOutcome.DROPPED;
        }
        try {
            analytics.onSongStart(event.songId(), event.title());
            return IngestOutcome.ACCEPTED;
        } catch (RuntimeException ex) {
            log.error("Song start event failed: songId={}", event.songId(), ex);
            return IngestOutcome.FAILED;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

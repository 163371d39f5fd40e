package app.webradio.engagement.specialevent;

import app.webradio.engagement.activity.ActivityKind;
import app.webradio.engagement.config.EngagementProps;
import app.webradio.engagement.notification.SystemAnnouncement;
import app.webradio.engagement.points.PointsAccumulator;
import app.webradio.engagement.user.UserDirectory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Service
public class SpecialEventService {

    private static final Logger log = LoggerFactory.getLogger(SpecialEventService.class);

    private final Map<String, StoredEvent> events = new LinkedHashMap<>();
    private final UserDirectory userDirectory;
    private final PointsAccumulator pointsAccumulator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final Duration retention;

    public SpecialEventService(UserDirectory userDirectory,
                               PointsAccumulator pointsAccumulator,
                               ApplicationEventPublisher eventPublisher,
                               Clock clock,
                               EngagementProps props) {
        this.userDirectory = userDirectory;
        this.pointsAccumulator = pointsAccumulator;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.retention = Duration.ofDays(props.dailyRetentionDays());
    }

    public SpecialEvent create(String name,
                               String description,
                               String type,
                               Instant startsAt,
                               Instant endsAt,
                               JsonNode rewards) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (startsAt == null || endsAt == null || endsAt.isBefore(startsAt)) {
            throw new IllegalArgumentException("Invalid event window: " + startsAt + " - " + endsAt);
        }
        Instant now = clock.instant();
        StoredEvent stored = new StoredEvent(
                UUID.randomUUID().toString(),
                name.trim(),
                description == null ? "" : description.trim(),
                type == null || type.isBlank() ? SpecialEventType.CUSTOM : type.trim().toLowerCase(Locale.ROOT),
                startsAt,
                endsAt,
                rewards == null || rewards.isNull() ? JsonNodeFactory.instance.objectNode() : rewards.deepCopy(),
                now
        );

        SpecialEvent created;
        synchronized (events) {
            pruneEnded(now);
            events.put(stored.id, stored);
            created = stored.view();
        }
        log.info("Special event created: id={}, type={}, startsAt={}, endsAt={}",
                created.id(), created.type(), created.startsAt(), created.endsAt());
        eventPublisher.publishEvent(SystemAnnouncement.of(
                "Special event: " + created.name() + " - " + created.description(), now));
        return created;
    }

    /**
     * Adds the user to the event's participants. {@code event_participation} is credited on the first join only.
     */
    public JoinResult join(String userId, String eventId) {
        if (userDirectory.resolve(userId).isEmpty()) {
            return new JoinResult(JoinResult.Outcome.USER_NOT_FOUND, null);
        }
        Instant now = clock.instant();
        SpecialEvent joined;
        synchronized (events) {
            StoredEvent stored = events.get(eventId);
            if (stored == null) {
                return new JoinResult(JoinResult.Outcome.EVENT_NOT_FOUND, null);
            }
            if (!stored.activeAt(now)) {
                return new JoinResult(JoinResult.Outcome.OUTSIDE_WINDOW, stored.view());
            }
            if (!stored.participants.add(userId)) {
                return new JoinResult(JoinResult.Outcome.ALREADY_JOINED, stored.view());
            }
            joined = stored.view();
        }

        ObjectNode details = JsonNodeFactory.instance.objectNode();
        details.put("eventId", joined.id());
        details.put("eventName", joined.name());
        pointsAccumulator.creditActivity(userId, ActivityKind.EVENT_PARTICIPATION.code(), details, now);
        log.info("User joined special event: userId={}, eventId={}", userId, eventId);
        return new JoinResult(JoinResult.Outcome.JOINED, joined);
    }

    public List<SpecialEvent> active() {
        Instant now = clock.instant();
        List<SpecialEvent> out = new ArrayList<>();
        synchronized (events) {
            for (StoredEvent stored : events.values()) {
                if (stored.activeAt(now)) {
                    out.add(stored.view());
                }
            }
        }
        out.sort(Comparator.comparing(SpecialEvent::startsAt));
        return out;
    }

    /**
     * Whether an event of {@code type} already covers {@code at}. Keeps the daily job from creating duplicates.
     */
    public boolean hasEventCovering(String type, Instant at) {
        synchronized (events) {
            return events.values().stream().anyMatch(e -> e.type.equals(type) && e.activeAt(at));
        }
    }

    private void pruneEnded(Instant now) {
        Instant cutoff = now.minus(retention);
        events.values().removeIf(e -> e.endsAt.isBefore(cutoff));
    }

    private static final class StoredEvent {
        private final String id;
        private final String name;
        private final String description;
        private final String type;
        private final Instant startsAt;
        private final Instant endsAt;
        private final JsonNode rewards;
        private final Instant createdAt;
        private final Set<String> participants = new LinkedHashSet<>();

        private StoredEvent(String id,
                            String name,
                            String description,
                            String type,
                            Instant startsAt,
                            Instant endsAt,
                            JsonNode rewards,
                            Instant createdAt) {
            this.id = id;
            this.name = name;
            this.description = description;
            this.type = type;
            this.startsAt = startsAt;
            this.endsAt = endsAt;
            this.rewards = rewards;
            this.createdAt = createdAt;
        }

        private boolean activeAt(Instant at) {
            return !at.isBefore(startsAt) && !at.isAfter(endsAt);
        }

        private SpecialEvent view() {
            return new SpecialEvent(
                    id, name, description, type, startsAt, endsAt,
                    rewards.deepCopy(), List.copyOf(participants), createdAt
            );
        }
    }
}

package app.webradio.engagement.specialevent;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates the recurring events: double points from Friday 18:00 to the end of Sunday, and the
 * genre exploration event for the whole month on its first day.
 */
@Component
public class SpecialEventScheduler {

    private static final Logger log = LoggerFactory.getLogger(SpecialEventScheduler.class);

    private static final LocalTime WEEKEND_START = LocalTime.of(18, 0);
    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);

    private final SpecialEventService specialEvents;
    private final Clock clock;

    public SpecialEventScheduler(SpecialEventService specialEvents, Clock clock) {
        this.specialEvents = specialEvents;
        this.clock = clock;
    }

    @Scheduled(cron = "${app.engagement.special-events.cron:0 0 0 * * *}", zone = "${app.engagement.zone-id:UTC}")
    public void createDueEvents() {
        try {
            List<SpecialEvent> created = createDueEvents(LocalDate.now(clock));
            if (!created.isEmpty()) {
                log.info("Recurring special events created: count={}", created.size());
            }
        } catch (RuntimeException ex) {
            log.error("Recurring special events failed", ex);
        }
    }

    List<SpecialEvent> createDueEvents(LocalDate today) {
        ZoneId zone = clock.getZone();
        List<SpecialEvent> created = new ArrayList<>();

        if (today.getDayOfWeek() == DayOfWeek.FRIDAY) {
            Instant start = today.atTime(WEEKEND_START).atZone(zone).toInstant();
            Instant end = today.plusDays(2).atTime(END_OF_DAY).atZone(zone).toInstant();
            if (!specialEvents.hasEventCovering(SpecialEventType.DOUBLE_POINTS, start)) {
                ObjectNode rewards = JsonNodeFactory.instance.objectNode();
                rewards.put("pointsMultiplier", 2);
                created.add(specialEvents.create(
                        "Musical Weekend",
                        "Double points all weekend!",
                        SpecialEventType.DOUBLE_POINTS,
                        start,
                        end,
                        rewards
                ));
            }
        }

        if (today.getDayOfMonth() == 1) {
            Instant start = today.atStartOfDay(zone).toInstant();
            Instant end = today.withDayOfMonth(today.lengthOfMonth()).atTime(END_OF_DAY).atZone(zone).toInstant();
            if (!specialEvents.hasEventCovering(SpecialEventType.GENRE_EXPLORATION, start)) {
                ObjectNode rewards = JsonNodeFactory.instance.objectNode();
                rewards.put("specialBadge", "monthly_explorer");
                rewards.put("points", 200);
                created.add(specialEvents.create(
                        "Music Explorer",
                        "Listen to different genres to earn special badges!",
                        SpecialEventType.GENRE_EXPLORATION,
                        start,
                        end,
                        rewards
                ));
            }
        }
        return created;
    }
}

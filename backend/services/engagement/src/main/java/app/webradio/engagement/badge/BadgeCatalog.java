package app.webradio.engagement.badge;

import app.webradio.engagement.activity.ActivityKind;
import app.webradio.engagement.badge.rule.ActivityCountRule;
import app.webradio.engagement.badge.rule.BadgeRule;
import app.webradio.engagement.badge.rule.ConsecutiveDaysRule;
import app.webradio.engagement.badge.rule.HourWindowRule;
import app.webradio.engagement.badge.rule.VisitedRoomsRule;
import app.webradio.engagement.badge.rule.WeekendActivityRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed badge table. Evaluation walks it in declaration order.
 */
@Component
public class BadgeCatalog {

    public static final Set<String> GENRE_ROOMS = Set.of("pop", "rock", "eletronica", "mpb", "internacional", "geral");

    private final Map<String, Definition> definitions;

    public BadgeCatalog() {
        this(defaultDefinitions());
    }

    public BadgeCatalog(List<Definition> definitions) {
        Map<String, Definition> map = new LinkedHashMap<>();
        for (Definition definition : definitions) {
            if (map.putIfAbsent(definition.badge().id(), definition) != null) {
                throw new IllegalArgumentException("Duplicate badge id: " + definition.badge().id());
            }
        }
        this.definitions = map;
    }

    public List<Definition> definitions() {
        return List.copyOf(definitions.values());
    }

    public List<Badge> badges() {
        List<Badge> out = new ArrayList<>(definitions.size());
        for (Definition definition : definitions.values()) {
            out.add(definition.badge());
        }
        return List.copyOf(out);
    }

    public int size() {
        return definitions.size();
    }

    public record Definition(Badge badge, BadgeRule rule) {
    }

    private static List<Definition> defaultDefinitions() {
        List<Definition> list = new ArrayList<>();

        list.add(define("first_login", "First Access", "Welcome to WebRadio!", 10, BadgeCategory.MILESTONE,
                new ActivityCountRule(ActivityKind.DAILY_LOGIN, 1)));
        list.add(define("chat_rookie", "Chat Rookie", "Sent 10 chat messages", 20, BadgeCategory.SOCIAL,
                new ActivityCountRule(ActivityKind.CHAT_MESSAGE, 10)));
        list.add(define("chat_veteran", "Chat Veteran", "Sent 100 chat messages", 50, BadgeCategory.SOCIAL,
                new ActivityCountRule(ActivityKind.CHAT_MESSAGE, 100)));
        list.add(define("music_lover", "Music Lover", "Listened to 50 full songs", 30, BadgeCategory.LISTENING,
                new ActivityCountRule(ActivityKind.SONG_LISTEN_COMPLETE, 50)));
        list.add(define("dedicated_listener", "Dedicated Listener", "Spent 5 hours listening", 75, BadgeCategory.LISTENING,
                new ActivityCountRule(ActivityKind.LISTENING_TIME_HOUR, 5)));
        list.add(define("social_butterfly", "Social Butterfly", "Added 5 friends", 40, BadgeCategory.SOCIAL,
                new ActivityCountRule(ActivityKind.ADD_FRIEND, 5)));
        list.add(define("commenter", "Commenter", "Commented on 25 songs", 35, BadgeCategory.ENGAGEMENT,
                new ActivityCountRule(ActivityKind.SONG_COMMENT, 25)));
        list.add(define("early_bird", "Early Bird", "Active between 5am and 7am", 25, BadgeCategory.SPECIAL,
                new HourWindowRule(5, 7, 5)));
        list.add(define("night_owl", "Night Owl", "Active between 11pm and 1am", 25, BadgeCategory.SPECIAL,
                new HourWindowRule(23, 1, 5)));
        list.add(define("weekend_warrior", "Weekend Warrior", "Active on weekends", 30, BadgeCategory.SPECIAL,
                new WeekendActivityRule(5)));
        list.add(define("loyal_fan", "Loyal Fan", "Listened 30 days in a row", 100, BadgeCategory.MILESTONE,
                new ConsecutiveDaysRule(30)));
        list.add(define("request_master", "Request Master", "Made 20 song requests", 45, BadgeCategory.ENGAGEMENT,
                new ActivityCountRule(ActivityKind.MUSIC_REQUEST, 20)));
        list.add(define("genre_explorer", "Genre Explorer", "Visited every genre room", 60, BadgeCategory.EXPLORATION,
                new VisitedRoomsRule(GENRE_ROOMS)));
        list.add(define("like_giver", "Generous Heart", "Liked 100 comments", 40, BadgeCategory.SOCIAL,
                new ActivityCountRule(ActivityKind.COMMENT_LIKE, 100)));
        list.add(define("daily_visitor", "Daily Visitor", "Visited the radio 7 days in a row", 80, BadgeCategory.MILESTONE,
                new ConsecutiveDaysRule(7)));

        return list;
    }

    private static Definition define(String id,
                                     String displayName,
                                     String description,
                                     int bonusPoints,
                                     BadgeCategory category,
                                     BadgeRule rule) {
        return new Definition(new Badge(id, displayName, description, bonusPoints, category), rule);
    }
}

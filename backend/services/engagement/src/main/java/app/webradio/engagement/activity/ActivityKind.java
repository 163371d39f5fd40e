package app.webradio.engagement.activity;

import java.util.Locale;
import java.util.Optional;

public enum ActivityKind {
    CHAT_MESSAGE("chat_message", "sending a chat message"),
    MUSIC_REQUEST("music_request", "requesting a song"),
    SONG_LISTEN_COMPLETE("song_listen_complete", "listening to a full song"),
    ADD_FRIEND("add_friend", "adding a friend"),
    SONG_COMMENT("song_comment", "commenting on a song"),
    COMMENT_LIKE("comment_like", "liking a comment"),
    DAILY_LOGIN("daily_login", "daily login"),
    ROOM_VISIT("room_visit", "visiting a room"),
    SHARE_SONG("share_song", "sharing a song"),
    EVENT_PARTICIPATION("event_participation", "joining an event"),
    LISTENING_TIME_HOUR("listening_time_hour", "an hour of listening");

    private final String code;
    private final String description;

    ActivityKind(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String code() {
        return code;
    }

    public String description() {
        return description;
    }

    public static Optional<ActivityKind> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (ActivityKind kind : values()) {
            if (kind.code.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}

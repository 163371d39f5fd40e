package app.webradio.engagement.leaderboard;

import java.util.Locale;
import java.util.Optional;

public enum LeaderboardPeriod {
    DAILY("daily"),
    WEEKLY("weekly"),
    ALL_TIME("alltime");

    private final String code;

    LeaderboardPeriod(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<LeaderboardPeriod> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (LeaderboardPeriod period : values()) {
            if (period.code.equals(normalized)) {
                return Optional.of(period);
            }
        }
        return Optional.empty();
    }
}

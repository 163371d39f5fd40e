package app.webradio.engagement.analytics;

import app.webradio.engagement.config.EngagementProps;
import app.webradio.engagement.support.BoundedHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Connection lifetime, listening time and per-day audience figures. All aggregates here are shared by
 * every connection and are mutated under a single lock; reports are computed on read.
 */
@Service
public class ListeningAnalytics {

    private static final Logger log = LoggerFactory.getLogger(ListeningAnalytics.class);

    static final String ANONYMOUS = "Anonymous";
    static final int MAX_REPORT_DAYS = 366;

    private final Clock clock;
    private final int topSongs;
    private final int reportDays;
    private final int retentionDays;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ListenerSession> live = new LinkedHashMap<>();
    private final Map<String, SongStats> songs = new LinkedHashMap<>();
    private final TreeMap<LocalDate, DailyAggregate> days = new TreeMap<>();
    private final BoundedHistory<SessionRecord> history;
    private String currentSongId;

    public ListeningAnalytics(EngagementProps props, Clock clock) {
        this.clock = clock;
        this.topSongs = props.topSongs();
        this.reportDays = props.reportDays();
        this.retentionDays = props.dailyRetentionDays();
        this.history = new BoundedHistory<>(props.sessionHistoryCapacity());
    }

    /**
     * @return false when the connection is already live, in which case nothing changes
     */
    public boolean onConnect(String connectionId, String displayName) {
        requireId(connectionId, "connectionId");
        return locked(() -> {
            if (live.containsKey(connectionId)) {
                log.debug("Connection already live: connectionId={}", connectionId);
                return false;
            }
            Instant now = clock.instant();
            LocalDate today = LocalDate.now(clock);
            live.put(connectionId, new ListenerSession(connectionId, displayNameOrAnonymous(displayName), now));
            today(today).addListener(connectionId);
            pruneDays(today);
            return true;
        });
    }

    public boolean onIdentify(String connectionId, String displayName) {
        requireId(connectionId, "connectionId");
        return locked(() -> {
            ListenerSession session = live.get(connectionId);
            if (session == null) {
                return false;
            }
            session.rename(displayNameOrAnonymous(displayName));
            return true;
        });
    }

    /**
     * Closes the live session, keeps its record in the bounded history and adds its time to today's rollup.
     */
    public Optional<SessionRecord> onDisconnect(String connectionId) {
        requireId(connectionId, "connectionId");
        return locked(() -> {
            ListenerSession session = live.remove(connectionId);
            if (session == null) {
                log.debug("Disconnect for unknown connection: connectionId={}", connectionId);
                return Optional.empty();
            }
            Instant now = clock.instant();
            LocalDate today = LocalDate.now(clock);
            Duration sessionTime = session.close(now);
            SessionRecord record = new SessionRecord(
                    UUID.randomUUID().toString(),
                    session.connectionId(),
                    session.displayName(),
                    session.connectedAt(),
                    now,
                    session.accumulatedListeningTime(),
                    List.copyOf(session.songsListened()),
                    today
            );
            history.append(record);
            today(today).addListeningTime(sessionTime);
            return Optional.of(record);
        });
    }

    /**
     * Counts a play of {@code songId} and marks every live connection as listening to it.
     */
    public void onSongStart(String songId, String title) {
        requireId(songId, "songId");
        locked(() -> {
            SongStats stats = songs.computeIfAbsent(songId, id -> new SongStats(id, title == null ? id : title));
            stats.played(title);
            today(LocalDate.now(clock)).addSong(songId);
            for (ListenerSession session : live.values()) {
                stats.addListener(session.connectionId());
                session.markListening(songId);
            }
            currentSongId = songId;
            return null;
        });
    }

    public AnalyticsReport snapshot() {
        return locked(() -> {
            Instant now = clock.instant();
            return new AnalyticsReport(
                    now,
                    live.size(),
                    rankedSongs(topSongs),
                    activeListeners(now),
                    dailyReports(reportDays),
                    generalStats()
            );
        });
    }

    public int simultaneousListeners() {
        return locked(live::size);
    }

    public List<AnalyticsReport.ActiveListener> listeners() {
        return locked(() -> activeListeners(clock.instant()));
    }

    public List<AnalyticsReport.SongPlayStats> songs() {
        return locked(() -> rankedSongs(Integer.MAX_VALUE));
    }

    /**
     * One row per day for the last {@code period} days, oldest first, today included.
     */
    public List<DailyReport> reports(int period) {
        if (period <= 0 || period > MAX_REPORT_DAYS) {
            throw new IllegalArgumentException("period must be within 1.." + MAX_REPORT_DAYS);
        }
        return locked(() -> dailyReports(period));
    }

    public List<SessionRecord> sessionHistory() {
        return locked(history::snapshot);
    }

    static long minutes(Duration duration) {
        return Math.round(duration.toMillis() / 60_000d);
    }

    private List<AnalyticsReport.SongPlayStats> rankedSongs(int limit) {
        List<SongStats> ordered = new ArrayList<>(songs.values());
        ordered.sort(Comparator.comparingLong(SongStats::playCount).reversed());
        List<AnalyticsReport.SongPlayStats> out = new ArrayList<>();
        for (int i = 0; i < ordered.size() && i < limit; i++) {
            out.add(ordered.get(i).report());
        }
        return List.copyOf(out);
    }

    private List<AnalyticsReport.ActiveListener> activeListeners(Instant now) {
        List<AnalyticsReport.ActiveListener> out = new ArrayList<>(live.size());
        for (ListenerSession session : live.values()) {
            out.add(new AnalyticsReport.ActiveListener(
                    session.connectionId(),
                    session.displayName(),
                    session.connectedAt(),
                    minutes(session.listeningTime(now)),
                    session.songsListened().size()
            ));
        }
        return List.copyOf(out);
    }

    private List<DailyReport> dailyReports(int period) {
        LocalDate today = LocalDate.now(clock);
        List<DailyReport> out = new ArrayList<>(period);
        for (int i = period - 1; i >= 0; i--) {
            LocalDate date = today.minusDays(i);
            DailyAggregate aggregate = days.get(date);
            out.add(aggregate == null ? DailyAggregate.empty(date) : aggregate.report());
        }
        return List.copyOf(out);
    }

    private AnalyticsReport.GeneralStats generalStats() {
        List<SessionRecord> sessions = history.snapshot();
        long avgSessionMinutes = 0;
        if (!sessions.isEmpty()) {
            long totalMillis = 0;
            for (SessionRecord session : sessions) {
                totalMillis += session.totalListeningTime().toMillis();
            }
            avgSessionMinutes = Math.round(totalMillis / (double) sessions.size() / 60_000d);
        }

        AnalyticsReport.CurrentSong currentSong = null;
        if (currentSongId != null) {
            AnalyticsReport.SongPlayStats stats = songs.get(currentSongId).report();
            currentSong = new AnalyticsReport.CurrentSong(stats.songId(), stats.title(), live.size(), stats.playCount());
        }
        return new AnalyticsReport.GeneralStats(sessions.size(), avgSessionMinutes, currentSong);
    }

    private DailyAggregate today(LocalDate today) {
        return days.computeIfAbsent(today, DailyAggregate::new);
    }

    private void pruneDays(LocalDate today) {
        LocalDate cutoff = today.minusDays(retentionDays);
        days.headMap(cutoff).clear();
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static String displayNameOrAnonymous(String displayName) {
        return displayName == null || displayName.isBlank() ? ANONYMOUS : displayName.trim();
    }

    private static void requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}

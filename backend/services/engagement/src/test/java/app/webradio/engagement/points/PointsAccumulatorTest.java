package app.webradio.engagement.points;

import app.webradio.engagement.activity.ActivityRecord;
import app.webradio.engagement.badge.BadgeEarned;
import app.webradio.engagement.leaderboard.UserRank;
import app.webradio.engagement.store.AwardedBadge;
import app.webradio.engagement.store.PointsSnapshot;
import app.webradio.engagement.support.EngagementFixture;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PointsAccumulatorTest {

    EngagementFixture fx;

    @BeforeEach
    void setup() {
        fx = new EngagementFixture();
        fx.users.register("u1", "Ana");
    }

    @Test
    void tenChatMessages_awardChatRookieAndRankAllTime() {
        CreditResult last = null;
        for (int i = 0; i < 10; i++) {
            last = fx.points.creditActivity("u1", "chat_message", null);
        }

        assertThat(last.credited()).isTrue();
        assertThat(last.pointsAwarded()).isEqualTo(2);
        assertThat(last.badgesAwarded()).extracting(AwardedBadge::badgeId).containsExactly("chat_rookie");
        assertThat(last.totals().totalPoints()).isEqualTo(40);
        assertThat(last.totals().dailyPoints()).isEqualTo(40);
        assertThat(last.totals().weeklyPoints()).isEqualTo(40);

        UserRank rank = fx.leaderboard.rankOf("u1").orElseThrow();
        assertThat(rank.allTime().rank()).isEqualTo(1);
        assertThat(rank.allTime().points()).isEqualTo(40);
    }

    @Test
    void creditActivity_publishesPointsEarnedAfterBadge() {
        for (int i = 0; i < 10; i++) {
            fx.points.creditActivity("u1", "chat_message", null);
        }

        List<PointsEarned> earned = fx.eventsOf(PointsEarned.class);
        assertThat(earned).hasSize(10);
        assertThat(earned.get(0).message()).isEqualTo("+2 points for sending a chat message");
        assertThat(earned.get(9).totalPoints()).isEqualTo(40);
        assertThat(fx.eventsOf(BadgeEarned.class)).singleElement()
                .satisfies(e -> assertThat(e.badge().id()).isEqualTo("chat_rookie"));
    }

    @Test
    void unknownKind_awardsNothingButIsRecorded() {
        CreditResult result = fx.points.creditActivity("u1", "dance_party", JsonNodeFactory.instance.objectNode());

        assertThat(result.credited()).isTrue();
        assertThat(result.pointsAwarded()).isZero();
        assertThat(result.totals().totalPoints()).isZero();
        PointsOverview overview = fx.points.overview("u1").orElseThrow();
        assertThat(overview.recentActivities()).singleElement()
                .satisfies(r -> assertThat(r.kind()).isEqualTo("dance_party"));
    }

    @Test
    void unknownUser_returnsNotFoundWithoutState() {
        CreditResult result = fx.points.creditActivity("ghost", "chat_message", null);

        assertThat(result.outcome()).isEqualTo(CreditResult.Outcome.USER_NOT_FOUND);
        assertThat(fx.store.readUser("ghost", e -> e)).isEmpty();
        assertThat(fx.points.overview("ghost")).isEmpty();
        assertThat(fx.events).isEmpty();
    }

    @Test
    void details_areCopiedOnAppend() {
        ObjectNode details = JsonNodeFactory.instance.objectNode().put("text", "hello");

        fx.points.creditActivity("u1", "chat_message", details);
        details.put("text", "TAMPERED");

        ActivityRecord stored = fx.points.overview("u1").orElseThrow().recentActivities().get(0);
        assertThat(stored.details().path("text").asText()).isEqualTo("hello");
    }

    @Test
    void blankKind_isRejected() {
        assertThatThrownBy(() -> fx.points.creditActivity("u1", " ", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void ledger_staysWithinCapacity() {
        for (int i = 0; i < 130; i++) {
            fx.points.creditActivity("u1", "comment_like", null);
        }

        int ledgerSize = fx.store.readUser("u1", e -> e.ledger().recent(Integer.MAX_VALUE).size()).orElseThrow();
        assertThat(ledgerSize).isEqualTo(100);
        assertThat(fx.points.overview("u1").orElseThrow().recentActivities()).hasSize(20);
    }

    @Test
    void dailyPoints_rollOverOnNextDay() {
        fx.points.creditActivity("u1", "music_request", null);
        fx.clock.advance(Duration.ofDays(1));

        PointsSnapshot before = fx.points.overview("u1").orElseThrow().points();
        assertThat(before.dailyPoints()).isZero();
        assertThat(before.totalPoints()).isEqualTo(3);

        CreditResult result = fx.points.creditActivity("u1", "music_request", null);
        assertThat(result.totals().dailyPoints()).isEqualTo(3);
        assertThat(result.totals().weeklyPoints()).isEqualTo(6);
        assertThat(result.totals().totalPoints()).isEqualTo(6);
    }

    @Test
    void concurrentCredits_loseNoPointsAndAwardBadgesOnce() throws Exception {
        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        fx.points.creditActivity("u1", "chat_message", null);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        PointsOverview overview = fx.points.overview("u1").orElseThrow();
        // 2000 chats * 2 + chat_rookie 20 + chat_veteran 50
        assertThat(overview.points().totalPoints()).isEqualTo(4070);
        assertThat(overview.badges()).extracting(AwardedBadge::badgeId)
                .containsExactlyInAnyOrder("chat_rookie", "chat_veteran");
        assertThat(fx.eventsOf(BadgeEarned.class)).hasSize(2);
    }
}

package app.webradio.engagement.activity;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class ActivityPointsTableTest {

    private final ActivityPointsTable table = new ActivityPointsTable();

    @Test
    void pointsFor_knownAndUnknownCodes() {
        assertThat(table.pointsFor("chat_message")).isEqualTo(2);
        assertThat(table.pointsFor(" DAILY_LOGIN ")).isEqualTo(10);
        assertThat(table.pointsFor(ActivityKind.EVENT_PARTICIPATION.code())).isEqualTo(20);
        assertThat(table.pointsFor("dance_party")).isZero();
        assertThat(table.pointsFor(null)).isZero();
    }

    @Test
    void pointsFor_isIndependentOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(table.pointsFor("LISTENING_TIME_HOUR")).isEqualTo(15);
            assertThat(ActivityKind.fromCode("SONG_LISTEN_COMPLETE")).contains(ActivityKind.SONG_LISTEN_COMPLETE);
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void asTable_listsEveryKindInOrder() {
        assertThat(table.asTable()).hasSize(ActivityKind.values().length);
        assertThat(table.asTable().keySet()).first().isEqualTo("chat_message");
        assertThat(table.describe("dance_party")).isEqualTo("dance_party");
    }
}

package app.webradio.engagement.support;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundedHistoryTest {

    @Test
    void append_evictsOldestWhenFull() {
        BoundedHistory<Integer> history = new BoundedHistory<>(3);

        List.of(1, 2, 3).forEach(history::append);
        assertThat(history.snapshot()).containsExactly(1, 2, 3);

        history.append(4);

        assertThat(history.snapshot()).containsExactly(2, 3, 4);
    }

    @Test
    void latest_returnsNewestOldestFirst() {
        BoundedHistory<String> history = new BoundedHistory<>(10);
        List.of("a", "b", "c", "d").forEach(history::append);

        assertThat(history.latest(2)).containsExactly("c", "d");
        assertThat(history.latest(10)).containsExactly("a", "b", "c", "d");
        assertThat(history.latest(0)).isEmpty();
    }

    @Test
    void snapshot_isDetachedFromLaterAppends() {
        BoundedHistory<String> history = new BoundedHistory<>(2);
        history.append("a");
        List<String> before = history.snapshot();

        history.append("b");
        history.append("c");

        assertThat(before).containsExactly("a");
        assertThat(history.snapshot()).containsExactly("b", "c");
    }

    @Test
    void rejectsInvalidCapacityAndNullEntries() {
        assertThatThrownBy(() -> new BoundedHistory<>(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BoundedHistory<String>(1).append(null)).isInstanceOf(IllegalArgumentException.class);
    }
}

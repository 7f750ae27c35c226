package com.strata.history;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BoundedHistory Tests")
class BoundedHistoryTest {

    @Test
    @DisplayName("The oldest entries are evicted once capacity is reached")
    void shouldEvictOldest() {
        BoundedHistory<Integer> history = new BoundedHistory<>(3);

        for (int i = 1; i <= 5; i++) {
            history.append(i);
        }

        assertThat(history.snapshot()).containsExactly(3, 4, 5);
        assertThat(history.latest()).isEqualTo(5);
        assertThat(history.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Snapshots are detached from later appends")
    void snapshotShouldBeDetached() {
        BoundedHistory<String> history = new BoundedHistory<>(2);
        history.append("a");
        List<String> snapshot = history.snapshot();

        history.append("b");

        assertThat(snapshot).containsExactly("a");
    }

    @Test
    @DisplayName("An empty history has no latest entry")
    void emptyHistory() {
        BoundedHistory<String> history = new BoundedHistory<>(1);

        assertThat(history.latest()).isNull();
        assertThat(history.snapshot()).isEmpty();
    }

    @Test
    void capacityMustBePositive() {
        assertThatThrownBy(() -> new BoundedHistory<>(0)).isInstanceOf(IllegalArgumentException.class);
    }
}

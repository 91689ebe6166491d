package org.pxboard.board.activity;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ActivityCacheTest {

    @Test
    void countsDistinctUsersWithinWindow() {
        final ActivityCache cache = new ActivityCache(100);
        cache.insert(10, "a");
        cache.insert(20, "b");
        cache.insert(30, "a");

        assertThat(cache.count(50)).isEqualTo(2);
    }

    @Test
    void usersDropOutAfterIdleTimeout() {
        final ActivityCache cache = new ActivityCache(100);
        cache.insert(10, "a");
        cache.insert(20, "b");
        cache.insert(30, "a");

        assertThat(cache.count(115)).isEqualTo(2);
        assertThat(cache.count(125)).isEqualTo(1);
        assertThat(cache.count(131)).isZero();
    }

    @Test
    void removeTakesBackOnePlacement() {
        final ActivityCache cache = new ActivityCache(100);
        cache.insert(10, "a");
        cache.insert(20, "b");
        cache.insert(20, "b");

        assertThat(cache.remove(20, "b")).isTrue();
        assertThat(cache.count(50)).isEqualTo(2);
        assertThat(cache.remove(20, "b")).isTrue();
        assertThat(cache.count(50)).isEqualTo(1);
        assertThat(cache.remove(20, "b")).isFalse();
    }

    @Test
    void rejectsTimestampsGoingBackwards() {
        final ActivityCache cache = new ActivityCache(100);
        cache.insert(10, "a");

        assertThatThrownBy(() -> cache.insert(9, "b")).isInstanceOf(IllegalArgumentException.class);
        assertThat(cache.lastTimestamp()).isEqualTo(10);
    }

    @Test
    void lateInsertIsClampedButStillRemovableByItsOwnTimestamp() {
        final ActivityCache cache = new ActivityCache(100);
        cache.insert(10, "a");
        cache.insertLate(8, "b");

        assertThat(cache.lastTimestamp()).isEqualTo(10);
        assertThat(cache.count(50)).isEqualTo(2);
        assertThat(cache.remove(10, "b")).isFalse();
        assertThat(cache.remove(8, "b")).isTrue();
        assertThat(cache.count(50)).isEqualTo(1);
    }
}

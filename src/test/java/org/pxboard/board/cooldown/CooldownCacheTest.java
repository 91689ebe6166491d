package org.pxboard.board.cooldown;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CooldownCacheTest {

    private static final Instant T = Instant.parse("2024-01-01T00:00:00Z");

    private final List<Instant> stored = new ArrayList<>();
    private final AtomicInteger loads = new AtomicInteger();

    private CooldownCache cache(final int limit) {
        return new CooldownCache((userId, max) -> {
            loads.incrementAndGet();
            return new ArrayList<>(stored.subList(Math.max(0, stored.size() - max), stored.size()));
        }, limit);
    }

    @Test
    void historyIsLoadedOnceAndThenMaintained() throws Exception {
        stored.add(T);
        final CooldownCache cache = cache(3);
        final CooldownCache.UserHistory history = cache.user("alice");

        assertThat(history.placements()).containsExactly(T);
        history.add(T.plusSeconds(5));

        assertThat(history.placements()).containsExactly(T, T.plusSeconds(5));
        assertThat(loads.get()).isEqualTo(1);
        assertThat(cache.user("alice")).isSameAs(history);
    }

    @Test
    void keepsOnlyTheMostRecentPlacements() throws Exception {
        final CooldownCache.UserHistory history = cache(2).user("alice");
        history.placements();

        history.add(T);
        history.add(T.plusSeconds(1));
        history.add(T.plusSeconds(2));

        assertThat(history.placements()).containsExactly(T.plusSeconds(1), T.plusSeconds(2));
    }

    @Test
    void addBeforeFirstLoadIsLeftToTheLoad() throws Exception {
        final CooldownCache.UserHistory history = cache(3).user("alice");
        history.add(T);
        stored.add(T);

        assertThat(history.placements()).containsExactly(T);
    }

    @Test
    void invalidateAndResizeForceReload() throws Exception {
        final CooldownCache cache = cache(3);
        cache.user("alice").placements();
        stored.add(T);

        cache.user("alice").invalidate();
        assertThat(cache.user("alice").placements()).containsExactly(T);

        cache.resize(1);
        assertThat(cache.limit()).isEqualTo(1);
        assertThat(cache.user("alice").placements()).containsExactly(T);
        assertThat(loads.get()).isEqualTo(3);
    }
}

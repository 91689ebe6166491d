package org.pxboard.board.socket;

import org.pxboard.board.model.BoardInfo;
import org.pxboard.board.model.BufferKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates board changes into a single {@link ServerPacket.BoardUpdate}.
 * <p>
 * Later changes win where they overlap earlier ones. The built update holds, per buffer,
 * non-overlapping runs sorted by position with touching runs joined.
 */
public class BoardUpdateBuilder {

    private BoardInfo info;
    private final Map<BufferKind, List<Change>> changes = new EnumMap<>(BufferKind.class);

    public BoardUpdateBuilder info(final BoardInfo newInfo) {
        this.info = newInfo;
        return this;
    }

    public BoardUpdateBuilder change(final BufferKind kind, final Change change) {
        changes.computeIfAbsent(kind, k -> new ArrayList<>()).add(change);
        return this;
    }

    /**
     * Adds everything an already built update contains.
     */
    public BoardUpdateBuilder merge(final ServerPacket.BoardUpdate update) {
        if (update.info() != null) {
            info(update.info());
        }
        final ServerPacket.BoardData data = update.data();
        if (data != null) {
            addAll(BufferKind.COLORS, data.colors());
            addAll(BufferKind.TIMESTAMPS, data.timestamps());
            addAll(BufferKind.INITIAL, data.initial());
            addAll(BufferKind.MASK, data.mask());
        }
        return this;
    }

    private void addAll(final BufferKind kind, final List<Change> list) {
        if (list != null) {
            list.forEach(change -> change(kind, change));
        }
    }

    public boolean isEmpty() {
        return info == null && changes.isEmpty();
    }

    public ServerPacket.BoardUpdate build() {
        final ServerPacket.BoardData data = changes.isEmpty() ? null : new ServerPacket.BoardData(
            minified(BufferKind.COLORS),
            minified(BufferKind.TIMESTAMPS),
            minified(BufferKind.INITIAL),
            minified(BufferKind.MASK));
        return new ServerPacket.BoardUpdate(info, data);
    }

    private List<Change> minified(final BufferKind kind) {
        final List<Change> list = changes.get(kind);
        return list == null ? null : minify(list);
    }

    /**
     * Collapses changes given oldest first into the equivalent set of disjoint runs.
     */
    public static List<Change> minify(final List<Change> ordered) {
        List<Change> runs = new ArrayList<>();
        for (final Change change : ordered) {
            if (change.values().length == 0) {
                continue;
            }
            final List<Change> next = new ArrayList<>(runs.size() + 2);
            for (final Change run : runs) {
                if (run.end() <= change.position() || run.position() >= change.end()) {
                    next.add(run);
                    continue;
                }
                if (run.position() < change.position()) {
                    next.add(slice(run, run.position(), change.position()));
                }
                if (run.end() > change.end()) {
                    next.add(slice(run, change.end(), run.end()));
                }
            }
            next.add(change);
            runs = next;
        }

        runs.sort(Comparator.comparingLong(Change::position));
        final List<Change> joined = new ArrayList<>(runs.size());
        for (final Change run : runs) {
            final int last = joined.size() - 1;
            if (last >= 0 && joined.get(last).end() == run.position()) {
                joined.set(last, concat(joined.get(last), run));
            } else {
                joined.add(run);
            }
        }
        return joined;
    }

    private static Change slice(final Change run, final long from, final long to) {
        final long[] values = run.values();
        final long[] part = new long[(int) (to - from)];
        System.arraycopy(values, (int) (from - run.position()), part, 0, part.length);
        return new Change(from, part);
    }

    private static Change concat(final Change first, final Change second) {
        final long[] a = first.values();
        final long[] b = second.values();
        final long[] all = new long[a.length + b.length];
        System.arraycopy(a, 0, all, 0, a.length);
        System.arraycopy(b, 0, all, a.length, b.length);
        return new Change(first.position(), all);
    }
}

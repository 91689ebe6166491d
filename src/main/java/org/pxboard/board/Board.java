package org.pxboard.board;

import org.pxboard.access.Identity;
import org.pxboard.board.activity.ActivityCache;
import org.pxboard.board.cooldown.CooldownCache;
import org.pxboard.board.cooldown.CooldownCalculator;
import org.pxboard.board.cooldown.CooldownCurve;
import org.pxboard.board.cooldown.CooldownInfo;
import org.pxboard.board.exceptions.BoardException;
import org.pxboard.board.exceptions.ConflictException;
import org.pxboard.board.exceptions.InvalidColorException;
import org.pxboard.board.exceptions.OutOfBoundsException;
import org.pxboard.board.exceptions.RateLimitedException;
import org.pxboard.board.exceptions.StorageFailureException;
import org.pxboard.board.exceptions.UnplaceableException;
import org.pxboard.board.model.BoardInfo;
import org.pxboard.board.model.BufferKind;
import org.pxboard.board.model.MaskValue;
import org.pxboard.board.model.PaletteColor;
import org.pxboard.board.model.Placement;
import org.pxboard.board.model.PlacementPage;
import org.pxboard.board.sector.SectorAccessor;
import org.pxboard.board.socket.Capability;
import org.pxboard.board.socket.Change;
import org.pxboard.board.socket.CloseReason;
import org.pxboard.board.socket.Connection;
import org.pxboard.board.socket.ServerPacket;
import org.pxboard.store.PlacementFilter;
import org.pxboard.store.StoreConflictException;
import org.pxboard.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A live board: its buffers, cooldown bookkeeping, activity window and subscribers.
 * <p>
 * A placement runs validation, the cooldown gate and the buffer writes while holding the
 * exclusive lock of the pixel's color sector and the placing user's history, so concurrent
 * placements on the same pixel or by the same user are serialized. Every sector a placement
 * needs is loaded before the placement is recorded, and the change is queued for fan-out
 * before the color lock is released, so subscribers see changes of a pixel in commit order.
 * <p>
 * Sector locks are always taken in the order colors, mask or initial, timestamps.
 */
public class Board {

    private static final Logger LOGGER = LoggerFactory.getLogger(Board.class);

    private final BoardContext context;
    private final SectorAccessor accessor;
    private final ActivityCache activity;
    private final CooldownCache cooldowns;
    private final CooldownCalculator calculator;

    private volatile BoardInfo info;

    Board(final BoardInfo info, final BoardContext context) {
        this.info = info;
        this.context = context;
        this.accessor = new SectorAccessor(info.id(), info.shape(), context.sectors());
        this.activity = new ActivityCache(context.config().idleTimeout().toSeconds());
        this.calculator = new CooldownCalculator(new CooldownCurve(context.config().cooldownStep()));
        this.cooldowns = new CooldownCache(this::loadHistory, cooldownLimit(info));
    }

    /**
     * Creates a board and seeds its activity window from recent placements.
     */
    static Board load(final BoardInfo info, final BoardContext context) throws StorageFailureException {
        final Board board = new Board(info, context);
        final long since = board.currentTimestamp() - board.activity.idleTimeoutSeconds();
        try {
            for (final Placement placement : context.store().loadPlacementsSince(info.id(), (int) Math.max(0, since))) {
                board.activity.insert(placement.timestamp(), placement.userId());
            }
        } catch (final StoreException e) {
            throw new StorageFailureException("Failed to load recent activity of board " + info.id(), e);
        }
        return board;
    }

    public int id() {
        return info.id();
    }

    public BoardInfo info() {
        return info;
    }

    /**
     * Places a pixel for a user.
     *
     * @return The recorded placement and the user's availability afterwards.
     * @throws OutOfBoundsException    if the position is outside the board.
     * @throws InvalidColorException   if the color is not in the palette.
     * @throws UnplaceableException    if the mask forbids the position.
     * @throws ConflictException       if the pixel already has the color or the store rejected the placement.
     * @throws RateLimitedException    if the user has no pixels available.
     * @throws StorageFailureException if data could not be loaded or stored.
     */
    public PlacementResult place(final Identity user, final long position, final int color) throws BoardException {
        final BoardInfo current = info;
        if (current.shape().toLocal(position).isEmpty()) {
            throw new OutOfBoundsException("Position " + position + " is outside the board");
        }
        if (!current.hasColor(color)) {
            throw new InvalidColorException(color);
        }

        final CooldownCache.UserHistory history = cooldowns.user(user.userId());
        final Placement placement;
        final CooldownInfo after;
        synchronized (history) {
            final Instant now = context.clock().instant();
            final CooldownInfo before = calculator.compute(history.placements(), cooldowns.limit(), now);

            try (SectorAccessor.PixelLock pixel = accessor.lock(BufferKind.COLORS, position)) {
                if (MaskValue.fromValue((int) accessor.readValue(BufferKind.MASK, position)) != MaskValue.PLACE) {
                    throw new UnplaceableException(position);
                }
                if (pixel.get() == color) {
                    throw new ConflictException("Pixel " + position + " already has color " + color);
                }
                if (before.pixelsAvailable() == 0) {
                    throw new RateLimitedException(before);
                }

                final int timestamp = current.timestampOf(now);
                try (SectorAccessor.PixelLock stamp = accessor.lock(BufferKind.TIMESTAMPS, position)) {
                    placement = record(position, color, timestamp, user.userId());
                    pixel.set(color);
                    stamp.set(timestamp);
                }
                history.add(current.instantOf(placement.timestamp()));
                after = calculator.compute(history.placements(), cooldowns.limit(), now);
                activity.insertLate(placement.timestamp(), user.userId());
                publishPixel(position, color, placement.timestamp());
            }
        }

        context.notifier().update(id(), user.userId(), after);
        LOGGER.debug("User '{}' placed color {} at {} on board {}", user.userId(), color, position, id());
        return new PlacementResult(placement, after);
    }

    private Placement record(final long position, final int color, final int timestamp, final String userId)
        throws ConflictException, StorageFailureException {
        try {
            return context.store().recordPlacement(id(), position, color, timestamp, userId);
        } catch (final StoreConflictException e) {
            throw new ConflictException("Placement at " + position + " was rejected", e);
        } catch (final StoreException e) {
            throw new StorageFailureException("Failed to record placement at " + position, e);
        }
    }

    /**
     * Reverts the user's own latest placement at a position if it is still within the undo
     * deadline. The pixel gets back its previous color and timestamp, or its initial color if
     * there was no earlier placement, and the pixel is refunded.
     *
     * @return The undone placement and the user's availability afterwards.
     * @throws ConflictException if there is nothing the user may undo at the position.
     */
    public PlacementResult undo(final Identity user, final long position) throws BoardException {
        final CooldownCache.UserHistory history = cooldowns.user(user.userId());
        final Placement undone;
        final long restoredColor;
        final long restoredTimestamp;
        final CooldownInfo after;
        synchronized (history) {
            final Instant now = context.clock().instant();
            try (SectorAccessor.PixelLock pixel = accessor.lock(BufferKind.COLORS, position)) {
                undone = latestPlacement(position)
                    .filter(p -> p.userId().equals(user.userId()))
                    .orElseThrow(() -> new ConflictException("No placement of yours to undo at " + position));
                if (now.isAfter(undoDeadline(undone))) {
                    throw new ConflictException("Undo deadline for placement at " + position + " has passed");
                }
                final long initialColor = accessor.readValue(BufferKind.INITIAL, position);

                try (SectorAccessor.PixelLock stamp = accessor.lock(BufferKind.TIMESTAMPS, position)) {
                    final Optional<Placement> previous;
                    try {
                        previous = context.store().previousPlacement(id(), position, undone.id());
                        if (!context.store().deletePlacement(id(), undone.id())) {
                            throw new ConflictException("Placement at " + position + " was already undone");
                        }
                    } catch (final StoreException e) {
                        throw new StorageFailureException("Failed to undo placement at " + position, e);
                    }

                    if (previous.isPresent()) {
                        restoredColor = previous.get().color();
                        restoredTimestamp = previous.get().timestamp();
                    } else {
                        restoredColor = initialColor;
                        restoredTimestamp = 0;
                    }
                    pixel.set(restoredColor);
                    stamp.set(restoredTimestamp);
                }
                history.invalidate();
                activity.remove(undone.timestamp(), user.userId());
                publishPixel(position, restoredColor, restoredTimestamp);
            }
            after = calculator.compute(history.placements(), cooldowns.limit(), now);
        }

        context.notifier().update(id(), user.userId(), after);
        LOGGER.debug("User '{}' undid placement {} at {} on board {}", user.userId(), undone.id(), position, id());
        return new PlacementResult(undone, after);
    }

    /**
     * Last instant at which a placement may be undone.
     */
    public Instant undoDeadline(final Placement placement) {
        return info.instantOf(placement.timestamp()).plus(context.config().undoDeadline());
    }

    private void publishPixel(final long position, final long color, final long timestamp) {
        context.dispatcher().publish(id(), ServerPacket.BoardUpdate.ofData(new ServerPacket.BoardData(
            List.of(Change.single(position, color)),
            List.of(Change.single(position, timestamp)),
            null,
            null)));
    }

    /**
     * Reads a byte range of a buffer; the end is clamped to the buffer.
     */
    public byte[] read(final BufferKind kind, final long start, final long end)
        throws OutOfBoundsException, StorageFailureException {
        return accessor.read(kind, start, end);
    }

    /**
     * Size of a buffer in bytes.
     */
    public long length(final BufferKind kind) {
        return accessor.length(kind);
    }

    /**
     * Overwrites part of the mask or initial buffer and notifies subscribers.
     *
     * @throws IllegalArgumentException if the buffer is not patchable.
     */
    public void patch(final BufferKind kind, final long position, final byte[] data)
        throws OutOfBoundsException, StorageFailureException {
        if (kind != BufferKind.MASK && kind != BufferKind.INITIAL) {
            throw new IllegalArgumentException("Buffer '" + kind.pathName() + "' cannot be patched directly");
        }
        final long[] values = new long[data.length];
        for (int i = 0; i < data.length; i++) {
            values[i] = data[i] & 0xFF;
        }
        final List<Change> changes = List.of(new Change(position, values));
        accessor.patch(kind, position, data, () -> context.dispatcher().publish(id(),
            ServerPacket.BoardUpdate.ofData(new ServerPacket.BoardData(
                null, null,
                kind == BufferKind.INITIAL ? changes : null,
                kind == BufferKind.MASK ? changes : null))));
        LOGGER.debug("Patched {} {} bytes of {} at {}", id(), data.length, kind.pathName(), position);
    }

    /**
     * Changes board metadata. {@code null} arguments keep the current value.
     *
     * @return The updated metadata.
     */
    public synchronized BoardInfo updateInfo(final String name, final Map<Integer, PaletteColor> palette,
                                             final Integer maxPixelsAvailable, final Integer maxStacked)
        throws StorageFailureException, ConflictException {
        BoardInfo updated = info;
        if (name != null) {
            updated = updated.withName(name);
        }
        if (palette != null) {
            updated = updated.withPalette(palette);
        }
        if (maxPixelsAvailable != null || maxStacked != null) {
            updated = updated.withLimits(
                maxPixelsAvailable != null ? maxPixelsAvailable : updated.maxPixelsAvailable(),
                maxStacked != null ? maxStacked : updated.maxStacked());
        }

        try {
            context.store().updateBoardMetadata(updated);
        } catch (final StoreConflictException e) {
            throw new ConflictException("Board " + id() + " no longer exists", e);
        } catch (final StoreException e) {
            throw new StorageFailureException("Failed to update board " + id(), e);
        }

        final int limit = cooldownLimit(updated);
        if (limit != cooldowns.limit()) {
            cooldowns.resize(limit);
        }
        info = updated;
        context.dispatcher().publish(id(), ServerPacket.BoardUpdate.ofInfo(updated));
        LOGGER.info("Updated metadata of board {} ('{}')", id(), updated.name());
        return updated;
    }

    /**
     * Distinct users who placed within the idle window.
     */
    public int activeUsers() {
        return activity.count(currentTimestamp());
    }

    public long idleTimeoutSeconds() {
        return activity.idleTimeoutSeconds();
    }

    /**
     * The user's current availability.
     */
    public CooldownInfo cooldown(final Identity user) throws StorageFailureException {
        final CooldownCache.UserHistory history = cooldowns.user(user.userId());
        return calculator.compute(history.placements(), cooldowns.limit(), context.clock().instant());
    }

    /**
     * Latest placement at a position.
     */
    public Optional<Placement> lookup(final long position) throws OutOfBoundsException, StorageFailureException {
        if (info.shape().toLocal(position).isEmpty()) {
            throw new OutOfBoundsException("Position " + position + " is outside the board");
        }
        return latestPlacement(position);
    }

    /**
     * Lists placements after a cursor, oldest first.
     *
     * @param after  Cursor returned with the previous page, or {@link PlacementPage.Cursor#START}.
     * @param limit  Maximum number of placements on the page, at least 1.
     * @param filter Restricts which placements are listed.
     */
    public PlacementPage listPlacements(final PlacementPage.Cursor after, final int limit, final PlacementFilter filter)
        throws StorageFailureException {
        final List<Placement> found;
        try {
            found = context.store().listPlacements(id(), after.timestamp(), after.id(), limit + 1, filter);
        } catch (final StoreException e) {
            throw new StorageFailureException("Failed to list placements of board " + id(), e);
        }
        if (found.size() <= limit) {
            return new PlacementPage(found, null);
        }
        final List<Placement> items = found.subList(0, limit);
        return new PlacementPage(List.copyOf(items), PlacementPage.Cursor.after(items.get(limit - 1)));
    }

    private Optional<Placement> latestPlacement(final long position) throws StorageFailureException {
        try {
            return context.store().latestPlacement(id(), position);
        } catch (final StoreException e) {
            throw new StorageFailureException("Failed to look up placement at " + position, e);
        }
    }

    /**
     * Subscribes an admitted connection, greets it and, for an authenticated user, starts
     * pushing their availability.
     *
     * @return Whether the connection was subscribed.
     */
    public boolean subscribe(final Connection connection) throws StorageFailureException {
        connection.send(new ServerPacket.Ready());
        if (!context.connections().subscribe(connection)) {
            return false;
        }
        final Optional<Identity> identity = connection.identity();
        if (identity.isPresent() && connection.has(Capability.AUTHENTICATION)) {
            context.notifier().update(id(), identity.get().userId(), cooldown(identity.get()));
        }
        LOGGER.debug("{} subscribed with {}", connection, connection.capabilities());
        return true;
    }

    /**
     * Re-sends the availability of an already subscribed user, e.g. after re-authentication.
     */
    public void refreshCooldown(final Identity user) throws StorageFailureException {
        context.notifier().update(id(), user.userId(), cooldown(user));
    }

    /**
     * Removes a connection and stops availability pushes once the user has no connection left.
     */
    public void unsubscribe(final Connection connection) {
        context.connections().remove(connection);
        connection.identity().ifPresent(identity -> {
            if (context.connections().userConnections(id(), identity.userId()).isEmpty()) {
                context.notifier().cancel(id(), identity.userId());
            }
        });
    }

    /**
     * Disconnects every socket of the board and stops its availability pushes. Called when
     * the board is deleted.
     */
    void close() {
        for (final Connection connection : context.connections().boardConnections(id())) {
            connection.close(CloseReason.SERVER_CLOSING);
            context.connections().remove(connection);
        }
        context.notifier().cancelBoard(id());
    }

    private List<Instant> loadHistory(final String userId, final int limit) throws StorageFailureException {
        try {
            final List<Instant> instants = new ArrayList<>();
            for (final Placement placement : context.store().loadPlacementHistory(id(), userId, limit)) {
                instants.add(info.instantOf(placement.timestamp()));
            }
            return instants;
        } catch (final StoreException e) {
            throw new StorageFailureException("Failed to load placement history of '" + userId + "'", e);
        }
    }

    private long currentTimestamp() {
        return info.timestampOf(context.clock().instant());
    }

    private static int cooldownLimit(final BoardInfo info) {
        return Math.min(info.maxStacked(), info.maxPixelsAvailable());
    }
}

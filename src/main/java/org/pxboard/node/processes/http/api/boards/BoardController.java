package org.pxboard.node.processes.http.api.boards;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.pxboard.access.Identity;
import org.pxboard.access.Permission;
import org.pxboard.board.Board;
import org.pxboard.board.PlacementResult;
import org.pxboard.board.cooldown.CooldownInfo;
import org.pxboard.board.exceptions.BoardException;
import org.pxboard.board.exceptions.ConflictException;
import org.pxboard.board.exceptions.OutOfBoundsException;
import org.pxboard.board.model.BoardInfo;
import org.pxboard.board.model.BufferKind;
import org.pxboard.board.model.Placement;
import org.pxboard.board.model.PlacementPage;
import org.pxboard.node.processes.http.api.boards.dto.ActiveUsersDto;
import org.pxboard.node.processes.http.api.boards.dto.CooldownDto;
import org.pxboard.node.processes.http.api.boards.dto.CreateBoardRequest;
import org.pxboard.node.processes.http.api.boards.dto.PatchBoardRequest;
import org.pxboard.node.processes.http.api.boards.dto.PlacePixelRequest;
import org.pxboard.node.processes.http.api.boards.dto.PlacementPageDto;
import org.pxboard.node.spi.ServiceRegistry;
import org.pxboard.store.PlacementFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * REST endpoints for boards, their buffers and pixels.
 * <p>
 * Routes, relative to the mount point:
 * <ul>
 *   <li>{@code GET|POST /boards}</li>
 *   <li>{@code GET /boards/default[/...]}, a 303 redirect to the same path on the lowest-id board</li>
 *   <li>{@code GET|PATCH|DELETE /boards/{id}}</li>
 *   <li>{@code GET /boards/{id}/data/{buffer}}, honoring single {@code Range: bytes=} requests</li>
 *   <li>{@code PATCH /boards/{id}/data/{mask|initial}?offset=n}</li>
 *   <li>{@code GET /boards/{id}/pixels?page=&limit=&position=&color=&timestamp=&user=}</li>
 *   <li>{@code GET|POST|DELETE /boards/{id}/pixels/{position}}</li>
 *   <li>{@code GET /boards/{id}/cooldown}</li>
 *   <li>{@code GET /boards/{id}/users}</li>
 * </ul>
 */
public class BoardController extends BoardBaseController {

    private static final Logger LOGGER = LoggerFactory.getLogger(BoardController.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final int DEFAULT_PAGE_LIMIT = 10;
    static final int MAX_PAGE_LIMIT = 100;

    private String boardsPath;

    public BoardController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        final String boards = path(basePath, "/boards");
        final String board = boards + "/{id}";
        boardsPath = boards;
        LOGGER.debug("Registering board endpoints under {}", boards);

        app.get(boards, this::listBoards);
        app.post(boards, this::createBoard);
        app.get(boards + "/default", this::redirectToDefault);
        app.get(boards + "/default/<tail>", this::redirectToDefault);
        app.get(board, this::getBoard);
        app.patch(board, this::patchBoard);
        app.delete(board, this::deleteBoard);
        app.get(board + "/data/{buffer}", this::getData);
        app.patch(board + "/data/{buffer}", this::patchData);
        app.get(board + "/pixels", this::listPixels);
        app.get(board + "/pixels/{position}", this::getPixel);
        app.post(board + "/pixels/{position}", this::placePixel);
        app.delete(board + "/pixels/{position}", this::undoPixel);
        app.get(board + "/cooldown", this::getCooldown);
        app.get(board + "/users", this::getUsers);

        setupExceptionHandlers(app);
    }

    void listBoards(final Context ctx) {
        authorize(ctx, Permission.BOARDS_LIST);
        final List<BoardInfo> infos = runtime.boards().list().stream().map(Board::info).collect(Collectors.toList());
        ctx.status(HttpStatus.OK).json(infos);
    }

    void createBoard(final Context ctx) throws BoardException {
        authorize(ctx, Permission.BOARDS_POST);
        final CreateBoardRequest request = body(ctx, CreateBoardRequest.class);
        if (request.name() == null || request.shape() == null || request.palette() == null
            || request.maxPixelsAvailable() == null) {
            throw new IllegalArgumentException("name, shape, palette and maxPixelsAvailable are required");
        }
        final int maxStacked = request.maxStacked() != null ? request.maxStacked() : request.maxPixelsAvailable();
        final Board created = runtime.boards().create(
            request.name(), request.shape(), request.palette(), request.maxPixelsAvailable(), maxStacked);
        ctx.header("Location", ctx.path() + "/" + created.id());
        ctx.status(HttpStatus.CREATED).json(created.info());
    }

    void getBoard(final Context ctx) throws BoardException {
        authorize(ctx, Permission.BOARDS_GET);
        ctx.status(HttpStatus.OK).json(board(ctx).info());
    }

    void patchBoard(final Context ctx) throws BoardException {
        authorize(ctx, Permission.BOARDS_PATCH);
        final Board board = board(ctx);
        final PatchBoardRequest request = body(ctx, PatchBoardRequest.class);
        if (request.shape() != null && !request.shape().equals(board.info().shape())) {
            throw new ConflictException("The shape of an existing board cannot be changed");
        }
        final BoardInfo updated = board.updateInfo(
            request.name(), request.palette(), request.maxPixelsAvailable(), request.maxStacked());
        ctx.status(HttpStatus.OK).json(updated);
    }

    void deleteBoard(final Context ctx) throws BoardException {
        authorize(ctx, Permission.BOARDS_DELETE);
        runtime.boards().delete(intParam(ctx, "id"));
        ctx.status(HttpStatus.NO_CONTENT);
    }

    void redirectToDefault(final Context ctx) throws BoardException {
        final String tail = ctx.pathParamMap().getOrDefault("tail", "");
        final StringBuilder location = new StringBuilder(boardsPath).append('/').append(runtime.boards().first().id());
        if (!tail.isEmpty()) {
            location.append('/').append(tail);
        }
        if (ctx.queryString() != null) {
            location.append('?').append(ctx.queryString());
        }
        ctx.header("Location", location.toString());
        ctx.status(HttpStatus.SEE_OTHER);
    }

    void getData(final Context ctx) throws BoardException {
        authorize(ctx, Permission.BOARDS_DATA_GET);
        final Board board = board(ctx);
        final BufferKind kind = buffer(ctx);
        final long length = board.length(kind);

        ctx.header("Accept-Ranges", "bytes");
        ctx.contentType("application/octet-stream");
        final String range = ctx.header("Range");
        if (range == null) {
            ctx.status(HttpStatus.OK).result(board.read(kind, 0, length));
            return;
        }

        final Optional<long[]> requested = parseRange(range, length);
        if (requested.isPresent()) {
            final long start = requested.get()[0];
            final long end = requested.get()[1];
            try {
                final byte[] data = board.read(kind, start, end);
                if (data.length > 0) {
                    ctx.header("Content-Range", "bytes " + start + "-" + (start + data.length - 1) + "/" + length);
                    ctx.status(206).result(data);
                    return;
                }
            } catch (final OutOfBoundsException e) {
                LOGGER.debug("Unsatisfiable range '{}' for {}: {}", range, ctx.path(), e.getMessage());
            }
        }
        ctx.header("Content-Range", "bytes */" + length);
        respond(ctx.status(416), ctx.status(), "Range '" + range + "' cannot be served");
    }

    /**
     * Parses a single byte range. The end of the result is exclusive.
     *
     * @return The range, or empty if the header is malformed or asks for several ranges.
     */
    static Optional<long[]> parseRange(final String header, final long length) {
        final String value = header.trim();
        if (!value.startsWith("bytes=") || value.indexOf(',') >= 0) {
            return Optional.empty();
        }
        final String range = value.substring("bytes=".length()).trim();
        final int dash = range.indexOf('-');
        if (dash < 0) {
            return Optional.empty();
        }
        try {
            final String first = range.substring(0, dash).trim();
            final String last = range.substring(dash + 1).trim();
            if (first.isEmpty()) {
                final long suffix = Long.parseLong(last);
                return suffix <= 0 ? Optional.empty() : Optional.of(new long[] {Math.max(0, length - suffix), length});
            }
            final long start = Long.parseLong(first);
            final long end = last.isEmpty() ? length : Long.parseLong(last) + 1;
            return start < 0 || end <= start ? Optional.empty() : Optional.of(new long[] {start, end});
        } catch (final NumberFormatException e) {
            return Optional.empty();
        }
    }

    void patchData(final Context ctx) throws BoardException {
        authorize(ctx, Permission.BOARDS_DATA_PATCH);
        final Board board = board(ctx);
        final BufferKind kind = buffer(ctx);
        final String offset = ctx.queryParam("offset");
        final long position;
        try {
            position = offset == null ? 0 : Long.parseLong(offset);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Query parameter 'offset' must be an integer");
        }
        board.patch(kind, position, ctx.bodyAsBytes());
        ctx.status(HttpStatus.NO_CONTENT);
    }

    void listPixels(final Context ctx) throws BoardException {
        authorize(ctx, Permission.BOARDS_PIXELS_LIST);
        final Board board = board(ctx);
        final String page = ctx.queryParam("page");
        final PlacementPage.Cursor cursor = page == null ? PlacementPage.Cursor.START : PlacementPage.Cursor.parse(page);
        final int limit = pageLimit(ctx.queryParam("limit"));
        final PlacementFilter filter = new PlacementFilter(
            rangeParam(ctx, "position"), rangeParam(ctx, "color"), rangeParam(ctx, "timestamp"), ctx.queryParam("user"));

        final PlacementPage result = board.listPlacements(cursor, limit, filter);
        final String next = result.next() == null ? null : pageUri(ctx.path(), result.next(), limit, filter);
        ctx.status(HttpStatus.OK).json(new PlacementPageDto(result.items(), next, null));
    }

    static int pageLimit(final String value) {
        if (value == null) {
            return DEFAULT_PAGE_LIMIT;
        }
        try {
            return Math.max(1, Math.min(MAX_PAGE_LIMIT, Integer.parseInt(value)));
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Query parameter 'limit' must be an integer");
        }
    }

    private static PlacementFilter.Range rangeParam(final Context ctx, final String name) {
        final String value = ctx.queryParam(name);
        return value == null ? PlacementFilter.Range.OPEN : PlacementFilter.Range.parse(value);
    }

    /**
     * Link to the page after {@code cursor}, repeating the limit and every filter in use.
     */
    static String pageUri(final String path, final PlacementPage.Cursor cursor, final int limit,
                          final PlacementFilter filter) {
        final StringBuilder uri = new StringBuilder(path).append("?page=").append(cursor).append("&limit=").append(limit);
        appendFilter(uri, "position", filter.position());
        appendFilter(uri, "color", filter.color());
        appendFilter(uri, "timestamp", filter.timestamp());
        if (filter.userId() != null) {
            uri.append("&user=").append(URLEncoder.encode(filter.userId(), StandardCharsets.UTF_8));
        }
        return uri.toString();
    }

    private static void appendFilter(final StringBuilder uri, final String name, final PlacementFilter.Range range) {
        if (!range.isOpen()) {
            uri.append('&').append(name).append('=').append(range);
        }
    }

    void getPixel(final Context ctx) throws BoardException {
        authorize(ctx, Permission.BOARDS_PIXELS_GET);
        final long position = longParam(ctx, "position");
        final Placement placement = board(ctx).lookup(position)
            .orElseThrow(() -> new OutOfBoundsException("No placement at " + position));
        ctx.status(HttpStatus.OK).json(placement);
    }

    void placePixel(final Context ctx) throws BoardException {
        final Identity user = authorizeUser(ctx, Permission.BOARDS_PIXELS_POST);
        final Board board = board(ctx);
        final PlacePixelRequest request = body(ctx, PlacePixelRequest.class);
        if (request.color() == null) {
            throw new IllegalArgumentException("color is required");
        }
        final PlacementResult result = board.place(user, longParam(ctx, "position"), request.color());
        cooldownHeaders(ctx, result.cooldown());
        ctx.header(UNDO_DEADLINE_HEADER, String.valueOf(board.undoDeadline(result.placement()).getEpochSecond()));
        ctx.status(HttpStatus.CREATED).json(result.placement());
    }

    void undoPixel(final Context ctx) throws BoardException {
        final Identity user = authorizeUser(ctx, Permission.BOARDS_PIXELS_UNDO);
        final PlacementResult result = board(ctx).undo(user, longParam(ctx, "position"));
        cooldownHeaders(ctx, result.cooldown());
        ctx.status(HttpStatus.NO_CONTENT);
    }

    void getCooldown(final Context ctx) throws BoardException {
        final Identity user = authorizeUser(ctx, Permission.BOARDS_COOLDOWN_GET);
        final CooldownInfo cooldown = board(ctx).cooldown(user);
        cooldownHeaders(ctx, cooldown);
        ctx.status(HttpStatus.OK).json(CooldownDto.from(cooldown));
    }

    void getUsers(final Context ctx) throws BoardException {
        authorize(ctx, Permission.BOARDS_USERS_GET);
        final Board board = board(ctx);
        ctx.status(HttpStatus.OK).json(new ActiveUsersDto(board.activeUsers(), board.idleTimeoutSeconds()));
    }

    private static BufferKind buffer(final Context ctx) throws OutOfBoundsException {
        final String name = ctx.pathParam("buffer");
        return BufferKind.fromPathName(name).orElseThrow(() -> new OutOfBoundsException("Unknown buffer '" + name + "'"));
    }

    private static <T> T body(final Context ctx, final Class<T> type) {
        try {
            return MAPPER.readValue(ctx.body(), type);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed request body: " + e.getOriginalMessage());
        }
    }
}

package org.pxboard.node.processes.http.api.boards;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.pxboard.access.Identity;
import org.pxboard.access.Permission;
import org.pxboard.board.Board;
import org.pxboard.board.BoardRuntime;
import org.pxboard.board.cooldown.CooldownInfo;
import org.pxboard.board.exceptions.BoardNotFoundException;
import org.pxboard.board.exceptions.ConflictException;
import org.pxboard.board.exceptions.InvalidColorException;
import org.pxboard.board.exceptions.OutOfBoundsException;
import org.pxboard.board.exceptions.RateLimitedException;
import org.pxboard.board.exceptions.StorageFailureException;
import org.pxboard.board.exceptions.UnplaceableException;
import org.pxboard.node.processes.http.AbstractController;
import org.pxboard.node.processes.http.api.boards.dto.ErrorResponseDto;
import org.pxboard.node.spi.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Shared plumbing of the board endpoints: caller identification, permission checks,
 * cooldown headers and the mapping of board failures to HTTP answers.
 * <p>
 * Status mapping:
 * <ul>
 *   <li>{@link BoardNotFoundException}, {@link OutOfBoundsException} → 404</li>
 *   <li>{@link UnplaceableException} → 403</li>
 *   <li>{@link ConflictException} → 409</li>
 *   <li>{@link InvalidColorException} → 422</li>
 *   <li>{@link RateLimitedException} → 429 with cooldown headers</li>
 *   <li>{@link StorageFailureException} and anything unexpected → 500 with a generic message</li>
 * </ul>
 */
public abstract class BoardBaseController extends AbstractController {

    private static final Logger LOGGER = LoggerFactory.getLogger(BoardBaseController.class);

    static final String PIXELS_AVAILABLE_HEADER = "pxls-pixels-available";
    static final String NEXT_AVAILABLE_HEADER = "pxls-next-available";
    static final String UNDO_DEADLINE_HEADER = "pxls-undo-deadline";

    protected final BoardRuntime runtime;

    protected BoardBaseController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.runtime = registry.get(BoardRuntime.class);
    }

    protected void setupExceptionHandlers(final Javalin app) {
        app.exception(BoardNotFoundException.class, (e, ctx) -> respond(ctx, HttpStatus.NOT_FOUND, e.getMessage()));
        app.exception(OutOfBoundsException.class, (e, ctx) -> respond(ctx, HttpStatus.NOT_FOUND, e.getMessage()));
        app.exception(UnplaceableException.class, (e, ctx) -> respond(ctx, HttpStatus.FORBIDDEN, e.getMessage()));
        app.exception(ConflictException.class, (e, ctx) -> respond(ctx, HttpStatus.CONFLICT, e.getMessage()));
        app.exception(InvalidColorException.class, (e, ctx) -> respond(ctx.status(422), ctx.status(), e.getMessage()));
        app.exception(RateLimitedException.class, (e, ctx) -> {
            cooldownHeaders(ctx, e.getCooldown());
            respond(ctx, HttpStatus.TOO_MANY_REQUESTS, e.getMessage());
        });
        app.exception(AccessDeniedException.class, (e, ctx) -> respond(ctx,
            e.isAuthenticated() ? HttpStatus.FORBIDDEN : HttpStatus.UNAUTHORIZED, e.getMessage()));
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            LOGGER.debug("Bad request for {}: {}", ctx.path(), e.getMessage());
            respond(ctx, HttpStatus.BAD_REQUEST, e.getMessage());
        });
        app.exception(StorageFailureException.class, (e, ctx) -> {
            LOGGER.error("Storage failure for request {}", ctx.path(), e);
            respond(ctx, HttpStatus.INTERNAL_SERVER_ERROR, "Storage is unavailable");
        });
        app.exception(Exception.class, (e, ctx) -> {
            LOGGER.error("Unhandled exception for request {}", ctx.path(), e);
            respond(ctx, HttpStatus.INTERNAL_SERVER_ERROR, "An internal server error occurred");
        });
    }

    protected static void respond(final Context ctx, final HttpStatus status, final String message) {
        ctx.status(status).json(ErrorResponseDto.of(status, message));
    }

    /**
     * Resolves the caller from an {@code Authorization: Bearer} header.
     *
     * @return The caller, or empty for anonymous requests.
     * @throws AccessDeniedException if a header is present but not a valid bearer token.
     */
    protected Optional<Identity> identify(final Context ctx) {
        final String header = ctx.header("Authorization");
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }
        if (!header.regionMatches(true, 0, "Bearer ", 0, 7)) {
            throw new AccessDeniedException("Unsupported authorization scheme", false);
        }
        final Optional<Identity> identity = runtime.authenticator().authenticate(header.substring(7).trim());
        if (identity.isEmpty()) {
            throw new AccessDeniedException("Invalid token", false);
        }
        return identity;
    }

    /**
     * Checks that the caller holds a permission.
     *
     * @return The caller, or empty if the permission is granted to anonymous callers.
     */
    protected Optional<Identity> authorize(final Context ctx, final Permission permission) {
        final Optional<Identity> identity = identify(ctx);
        if (!runtime.permissions().hasPermission(identity.orElse(null), permission)) {
            throw new AccessDeniedException("Missing permission " + permission.key(), identity.isPresent());
        }
        return identity;
    }

    /**
     * Like {@link #authorize(Context, Permission)} but also requires an authenticated caller.
     */
    protected Identity authorizeUser(final Context ctx, final Permission permission) {
        return authorize(ctx, permission)
            .orElseThrow(() -> new AccessDeniedException("Authentication required", false));
    }

    protected Board board(final Context ctx) throws BoardNotFoundException {
        return runtime.boards().get(intParam(ctx, "id"));
    }

    protected static int intParam(final Context ctx, final String name) {
        try {
            return Integer.parseInt(ctx.pathParam(name));
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Path parameter '" + name + "' must be an integer");
        }
    }

    protected static long longParam(final Context ctx, final String name) {
        try {
            return Long.parseLong(ctx.pathParam(name));
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Path parameter '" + name + "' must be an integer");
        }
    }

    protected static void cooldownHeaders(final Context ctx, final CooldownInfo cooldown) {
        ctx.header(PIXELS_AVAILABLE_HEADER, String.valueOf(cooldown.pixelsAvailable()));
        cooldown.nextAvailable().ifPresent(next -> ctx.header(NEXT_AVAILABLE_HEADER, String.valueOf(next.getEpochSecond())));
    }
}

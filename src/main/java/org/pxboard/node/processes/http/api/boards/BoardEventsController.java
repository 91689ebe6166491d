package org.pxboard.node.processes.http.api.boards;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.websocket.WsContext;
import org.pxboard.board.socket.BoardSocketHandler;
import org.pxboard.board.socket.CloseReason;
import org.pxboard.board.socket.Connection;
import org.pxboard.board.socket.ConnectionSink;
import org.pxboard.node.spi.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live board events over a websocket at {@code {id}/events} below the mount point, which is
 * normally the {@code boards} path of the API.
 * <p>
 * Capabilities are requested with repeated or comma-separated {@code extensions} query
 * parameters, e.g. {@code ?extensions=core,authentication}. The protocol itself is handled by
 * {@link BoardSocketHandler}; this controller only adapts Javalin sessions to it.
 */
public class BoardEventsController extends BoardBaseController {

    private static final Logger LOGGER = LoggerFactory.getLogger(BoardEventsController.class);

    private final Map<String, UUID> sessions = new ConcurrentHashMap<>();

    public BoardEventsController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        final String events = path(basePath, "/{id}/events");
        LOGGER.debug("Registering board event socket at {}", events);

        final BoardSocketHandler sockets = runtime.sockets();
        app.ws(events, ws -> {
            ws.onConnect(ctx -> {
                final int boardId;
                try {
                    boardId = Integer.parseInt(ctx.pathParam("id"));
                } catch (final NumberFormatException e) {
                    ctx.closeSession(CloseReason.INVALID_PACKET.code(), CloseReason.INVALID_PACKET.reason());
                    return;
                }
                final Optional<Connection> connection = sockets.onConnect(boardId, extensions(ctx), new WsSink(ctx));
                connection.ifPresent(c -> sessions.put(ctx.sessionId(), c.id()));
            });
            ws.onMessage(ctx -> {
                final UUID id = sessions.get(ctx.sessionId());
                if (id != null) {
                    sockets.onMessage(id, ctx.message());
                }
            });
            ws.onClose(ctx -> {
                final UUID id = sessions.remove(ctx.sessionId());
                if (id != null) {
                    sockets.onClose(id);
                }
            });
            ws.onError(ctx -> LOGGER.debug("Socket error on session {}: {}", ctx.sessionId(),
                ctx.error() != null ? ctx.error().getMessage() : "unknown"));
        });
    }

    private static List<String> extensions(final WsContext ctx) {
        final List<String> keys = new ArrayList<>();
        for (final String value : ctx.queryParams("extensions")) {
            for (final String key : value.split(",")) {
                if (!key.isBlank()) {
                    keys.add(key.trim());
                }
            }
        }
        return keys;
    }

    /**
     * Frames go straight to the Jetty session; the connection's queue keeps them ordered.
     */
    private static final class WsSink implements ConnectionSink {

        private final WsContext ctx;

        WsSink(final WsContext ctx) {
            this.ctx = ctx;
        }

        @Override
        public void send(final String frame) throws IOException {
            try {
                ctx.send(frame);
            } catch (final RuntimeException e) {
                throw new IOException("Send to session " + ctx.sessionId() + " failed", e);
            }
        }

        @Override
        public void close(final int code, final String reason) {
            ctx.closeSession(code, reason);
        }
    }
}

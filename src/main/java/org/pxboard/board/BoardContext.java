package org.pxboard.board;

import org.pxboard.board.sector.SectorCache;
import org.pxboard.board.socket.ConnectionRegistry;
import org.pxboard.board.socket.CooldownNotifier;
import org.pxboard.board.socket.UpdateDispatcher;
import org.pxboard.store.IBoardStore;

import java.time.Clock;

/**
 * Services shared by all boards of a runtime.
 */
public record BoardContext(IBoardStore store, SectorCache sectors, ConnectionRegistry connections,
                           UpdateDispatcher dispatcher, CooldownNotifier notifier, Clock clock,
                           BoardRuntimeConfig config) {
}

package ai.chess.player;

import ai.chess.game.Board;
import ai.chess.game.PieceColor;

/**
 * Represents a player capable of providing the next command for the game loop.
 */
public interface Player {

    /**
     * Provide the next command for the game loop (e.g., "e2e4", "e7e8n", "moves e2", "pass", "quit").
     *
     * @param board    current position; players must not modify it.
     * @param side     the side this player is moving for.
     * @param feedback feedback from the previous command (illegal move reasons, move listings);
     *                 empty when there is nothing to report.
     * @return raw command string, or null to signal the game should exit.
     */
    String nextCommand(Board board, PieceColor side, String feedback);
}

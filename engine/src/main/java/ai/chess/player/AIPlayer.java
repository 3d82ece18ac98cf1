package ai.chess.player;

import ai.chess.game.Board;
import ai.chess.game.Move;
import ai.chess.game.Piece;
import ai.chess.game.PieceColor;

/**
 * Base class for AI players: turns a chosen {@link Move} into a game-loop command and provides
 * helpers for move evaluation.
 */
public abstract class AIPlayer implements Player {

    /** Command sent when the side has no move to play. */
    public static final String PASS = "pass";

    /**
     * Choose a move for {@code side} on {@code board}.
     *
     * @return the chosen move, or null if the side has no move
     */
    public abstract Move chooseMove(Board board, PieceColor side);

    @Override
    public String nextCommand(Board board, PieceColor side, String feedback) {
        Move move = chooseMove(board, side);
        return move == null ? PASS : move.toCommandString();
    }

    /**
     * Returns the material value of the piece standing on the move's destination, or 0 if it is empty.
     * Must be read before the move is applied.
     */
    protected int capturedValue(Board board, Move move) {
        Piece captured = board.get(move.to());
        return captured == null ? 0 : captured.getValue();
    }
}

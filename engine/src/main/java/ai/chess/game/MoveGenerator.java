package ai.chess.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Computes pseudo-legal moves for one side of a {@link Board}.
 *
 * <p>Moves obey piece movement and occupancy rules but are never filtered for king safety: a
 * generated move may leave the mover's own king capturable. There is no castling and no en
 * passant.
 *
 * <p>Output order is deterministic. Squares are scanned rank by rank from rank 0, file by file
 * from file 0; for each piece the kind-specific offsets are tried in the order of the direction
 * tables below. The board is never modified.
 */
public final class MoveGenerator {

    private static final int[][] KNIGHT_OFFSETS = {
        {-2, -1}, {-2, 1}, {2, -1}, {2, 1},
        {-1, -2}, {-1, 2}, {1, -2}, {1, 2}
    };

    private static final int[][] DIAGONALS = {
        {-1, -1}, {-1, 1}, {1, -1}, {1, 1}
    };

    private static final int[][] ORTHOGONALS = {
        {-1, 0}, {1, 0}, {0, -1}, {0, 1}
    };

    private static final int[][] ALL_DIRECTIONS = {
        {-1, -1}, {-1, 1}, {1, -1}, {1, 1},
        {-1, 0}, {1, 0}, {0, -1}, {0, 1}
    };

    private MoveGenerator() {
    }

    /**
     * Returns every pseudo-legal move for {@code color}, in scan order.
     */
    public static List<Move> generateMoves(Board board, PieceColor color) {
        if (board == null || color == null) {
            return Collections.emptyList();
        }
        List<Move> moves = new ArrayList<>();
        for (int rank = 0; rank < Square.SIZE; rank++) {
            for (int file = 0; file < Square.SIZE; file++) {
                addPieceMoves(board, color, Square.of(rank, file), moves);
            }
        }
        return moves;
    }

    /**
     * Returns the pseudo-legal moves of the piece on {@code origin}.
     * <p>
     * Empty when the square is empty, off the board, or holds a piece of the other side.
     */
    public static List<Move> generateMovesFrom(Board board, PieceColor color, Square origin) {
        if (board == null || color == null || origin == null) {
            return Collections.emptyList();
        }
        List<Move> moves = new ArrayList<>();
        addPieceMoves(board, color, origin, moves);
        return moves;
    }

    private static void addPieceMoves(Board board, PieceColor color, Square from, List<Move> out) {
        Piece piece = board.get(from);
        if (piece == null || piece.getColor() != color) {
            return;
        }
        switch (piece.getKind()) {
            case PAWN -> addPawnMoves(board, color, from, out);
            case KNIGHT -> addStepMoves(board, color, from, KNIGHT_OFFSETS, out);
            case BISHOP -> addSlidingMoves(board, color, from, DIAGONALS, out);
            case ROOK -> addSlidingMoves(board, color, from, ORTHOGONALS, out);
            case QUEEN -> addSlidingMoves(board, color, from, ALL_DIRECTIONS, out);
            case KING -> addKingMoves(board, color, from, out);
        }
    }

    private static void addPawnMoves(Board board, PieceColor color, Square from, List<Move> out) {
        int forward = color.getForward();

        // Single step, then double step from the start rank through an empty square.
        Square oneStep = from.offset(forward, 0);
        if (oneStep.isOnBoard() && board.isEmpty(oneStep)) {
            out.add(new Move(from, oneStep));
            Square twoStep = oneStep.offset(forward, 0);
            if (from.rank() == color.getPawnStartRank() && twoStep.isOnBoard() && board.isEmpty(twoStep)) {
                out.add(new Move(from, twoStep));
            }
        }

        // Diagonal captures only onto enemy pieces; no en passant.
        for (int fileDelta : new int[] {-1, 1}) {
            Square target = from.offset(forward, fileDelta);
            if (isEnemy(board.get(target), color)) {
                out.add(new Move(from, target));
            }
        }
    }

    private static void addStepMoves(Board board, PieceColor color, Square from, int[][] offsets, List<Move> out) {
        for (int[] offset : offsets) {
            Square target = from.offset(offset[0], offset[1]);
            if (!target.isOnBoard()) {
                continue;
            }
            Piece occupant = board.get(target);
            if (occupant == null || isEnemy(occupant, color)) {
                out.add(new Move(from, target));
            }
        }
    }

    private static void addSlidingMoves(Board board, PieceColor color, Square from, int[][] directions, List<Move> out) {
        for (int[] direction : directions) {
            Square target = from.offset(direction[0], direction[1]);
            while (target.isOnBoard()) {
                Piece occupant = board.get(target);
                if (occupant == null) {
                    out.add(new Move(from, target));
                } else {
                    if (isEnemy(occupant, color)) {
                        out.add(new Move(from, target));
                    }
                    break;
                }
                target = target.offset(direction[0], direction[1]);
            }
        }
    }

    private static void addKingMoves(Board board, PieceColor color, Square from, List<Move> out) {
        for (int rankDelta = -1; rankDelta <= 1; rankDelta++) {
            for (int fileDelta = -1; fileDelta <= 1; fileDelta++) {
                if (rankDelta == 0 && fileDelta == 0) {
                    continue;
                }
                Square target = from.offset(rankDelta, fileDelta);
                if (!target.isOnBoard()) {
                    continue;
                }
                Piece occupant = board.get(target);
                if (occupant == null || isEnemy(occupant, color)) {
                    out.add(new Move(from, target));
                }
            }
        }
        // No castling.
    }

    private static boolean isEnemy(Piece piece, PieceColor color) {
        return piece != null && piece.isEnemyOf(color);
    }
}

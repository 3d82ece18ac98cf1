package ai.chess.game;

import java.util.Arrays;

/**
 * Mutable 8x8 chess board: every square is either empty or holds exactly one {@link Piece}.
 *
 * <p>The board carries no castling rights, en-passant target or move counters; those rules are
 * not part of this engine. Rank 0 is Black's back rank and rank 7 is White's.
 *
 * <p>Queries and mutations never throw for off-board squares: reads return {@code null} and
 * writes are ignored.
 */
public class Board {
    private static final PieceKind[] BACK_RANK = {
        PieceKind.ROOK, PieceKind.KNIGHT, PieceKind.BISHOP, PieceKind.QUEEN,
        PieceKind.KING, PieceKind.BISHOP, PieceKind.KNIGHT, PieceKind.ROOK
    };

    // grid[rank][file]; null means empty.
    private final Piece[][] grid = new Piece[Square.SIZE][Square.SIZE];

    /**
     * Creates a board in the standard starting position.
     */
    public Board() {
        reset();
    }

    /**
     * Creates a board with no pieces on it.
     */
    public static Board empty() {
        Board board = new Board();
        board.clear();
        return board;
    }

    /**
     * Restores the standard starting position: Black pieces on ranks 0–1, White mirrored on
     * ranks 6–7, and empty middle ranks.
     */
    public final void reset() {
        clear();
        for (int file = 0; file < Square.SIZE; file++) {
            grid[0][file] = new Piece(PieceColor.BLACK, BACK_RANK[file]);
            grid[1][file] = new Piece(PieceColor.BLACK, PieceKind.PAWN);
            grid[6][file] = new Piece(PieceColor.WHITE, PieceKind.PAWN);
            grid[7][file] = new Piece(PieceColor.WHITE, BACK_RANK[file]);
        }
    }

    /**
     * Removes every piece from the board.
     */
    public void clear() {
        for (Piece[] rank : grid) {
            Arrays.fill(rank, null);
        }
    }

    /**
     * Returns the piece on the given square, or {@code null} if the square is empty or off the board.
     */
    public Piece get(Square square) {
        if (square == null) {
            return null;
        }
        return get(square.rank(), square.file());
    }

    public Piece get(int rank, int file) {
        if (!inBounds(rank, file)) {
            return null;
        }
        return grid[rank][file];
    }

    /**
     * Places a piece on a square, or clears it when {@code piece} is null. Off-board squares are ignored.
     */
    public void set(Square square, Piece piece) {
        if (square == null) {
            return;
        }
        set(square.rank(), square.file(), piece);
    }

    public void set(int rank, int file, Piece piece) {
        if (inBounds(rank, file)) {
            grid[rank][file] = piece;
        }
    }

    public boolean isEmpty(Square square) {
        return get(square) == null;
    }

    /**
     * Moves the piece on {@code move.from()} to {@code move.to()}, replacing whatever stands there.
     * <p>
     * No legality check is made. A pawn that lands on its promotion rank becomes the move's
     * promotion kind, or a queen if none was given; the kind itself is not validated. Moving from
     * an empty or off-board square does nothing.
     *
     * @param move the move to apply; must not be null
     */
    public void applyMove(Move move) {
        Piece moving = get(move.from());
        if (moving == null) {
            return;
        }
        Piece placed = moving;
        if (moving.getKind() == PieceKind.PAWN
                && move.to().rank() == moving.getColor().getPromotionRank()) {
            PieceKind promoted = move.promotion() != null ? move.promotion() : PieceKind.QUEEN;
            placed = new Piece(moving.getColor(), promoted);
        }
        set(move.to(), placed);
        set(move.from(), null);
    }

    /**
     * Returns a fully independent copy of this board for speculative lookahead.
     */
    public Board copy() {
        Board clone = new Board();
        for (int rank = 0; rank < Square.SIZE; rank++) {
            // Pieces are immutable, so copying the references is enough.
            System.arraycopy(grid[rank], 0, clone.grid[rank], 0, Square.SIZE);
        }
        return clone;
    }

    /**
     * Returns the material balance from {@code color}'s point of view: the values of its own
     * pieces minus the values of the opponent's.
     */
    public int materialScore(PieceColor color) {
        int score = 0;
        for (int rank = 0; rank < Square.SIZE; rank++) {
            for (int file = 0; file < Square.SIZE; file++) {
                Piece piece = grid[rank][file];
                if (piece == null) {
                    continue;
                }
                score += piece.getColor() == color ? piece.getValue() : -piece.getValue();
            }
        }
        return score;
    }

    /**
     * Returns the square of the first king of {@code color} in scan order, or {@code null} if it has been captured.
     */
    public Square findKing(PieceColor color) {
        for (int rank = 0; rank < Square.SIZE; rank++) {
            for (int file = 0; file < Square.SIZE; file++) {
                Piece piece = grid[rank][file];
                if (piece != null && piece.getColor() == color && piece.getKind() == PieceKind.KING) {
                    return Square.of(rank, file);
                }
            }
        }
        return null;
    }

    public boolean inBounds(int rank, int file) {
        return rank >= 0 && rank < Square.SIZE && file >= 0 && file < Square.SIZE;
    }

    @Override
    public String toString() {
        return new BoardFormatter(this).format();
    }
}

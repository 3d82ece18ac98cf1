package ai.chess.game;

import java.util.Locale;

/**
 * A board coordinate identified by rank and file indices.
 *
 * <p>Rank 0 is Black's back rank (algebraic rank 8) and rank 7 is White's back rank (algebraic
 * rank 1); file 0 is the a-file. Squares off the board can be represented so that move
 * generation can step along offsets freely; {@link #isOnBoard()} tells them apart.
 */
public record Square(int rank, int file) {

    /** Number of ranks and files on the board. */
    public static final int SIZE = 8;

    public static Square of(int rank, int file) {
        return new Square(rank, file);
    }

    public boolean isOnBoard() {
        return rank >= 0 && rank < SIZE && file >= 0 && file < SIZE;
    }

    /**
     * Returns the square displaced by the given rank and file deltas.
     */
    public Square offset(int rankDelta, int fileDelta) {
        return new Square(rank + rankDelta, file + fileDelta);
    }

    /**
     * Parses algebraic notation such as {@code e2} into a square.
     *
     * @throws IllegalArgumentException if the text is not a square on the board
     */
    public static Square parse(String text) {
        Square square = tryParse(text);
        if (square == null) {
            throw new IllegalArgumentException("Invalid square: " + text);
        }
        return square;
    }

    /**
     * Lenient variant of {@link #parse(String)} that returns {@code null} for bad input.
     */
    public static Square tryParse(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim().toLowerCase(Locale.ROOT);
        if (trimmed.length() != 2) {
            return null;
        }
        int file = trimmed.charAt(0) - 'a';
        int algebraicRank = trimmed.charAt(1) - '0';
        if (file < 0 || file >= SIZE || algebraicRank < 1 || algebraicRank > SIZE) {
            return null;
        }
        return new Square(SIZE - algebraicRank, file);
    }

    /**
     * Returns algebraic notation ({@code e2}), or the raw indices for off-board squares.
     */
    public String toAlgebraic() {
        if (!isOnBoard()) {
            return "(" + rank + "," + file + ")";
        }
        return "" + (char) ('a' + file) + (SIZE - rank);
    }

    @Override
    public String toString() {
        return toAlgebraic();
    }
}

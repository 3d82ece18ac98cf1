package ai.chess.game;

import java.util.Locale;
import java.util.Objects;

/**
 * A move from one square to another, with an optional promotion kind.
 *
 * <p>Captures are not flagged: whether a move captures is decided by looking at the destination
 * square before the move is applied. The promotion kind only matters when a pawn reaches its
 * last rank; {@link Board#applyMove(Move)} promotes to a queen when it is {@code null}.
 *
 * <p><b>Notation:</b> moves render in coordinate form, e.g. {@code e2e4} or {@code e7e8n}.
 */
public final class Move {

    private final Square from;
    private final Square to;
    private final PieceKind promotion;

    public Move(Square from, Square to) {
        this(from, to, null);
    }

    public Move(Square from, Square to, PieceKind promotion) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.promotion = promotion;
    }

    public Square from() {
        return from;
    }

    public Square to() {
        return to;
    }

    /**
     * Returns the requested promotion kind, or {@code null} when none was given.
     */
    public PieceKind promotion() {
        return promotion;
    }

    /**
     * Returns a copy of this move with the given promotion kind.
     */
    public Move withPromotion(PieceKind kind) {
        return new Move(from, to, kind);
    }

    /**
     * Returns true if both moves connect the same squares, ignoring the promotion kind.
     */
    public boolean sameSquares(Move other) {
        return other != null && from.equals(other.from) && to.equals(other.to);
    }

    /**
     * Parses coordinate notation such as {@code e2e4} or {@code a7a8n}.
     *
     * @throws IllegalArgumentException if the text is not a well-formed move
     */
    public static Move parse(String text) {
        Move move = tryParse(text);
        if (move == null) {
            throw new IllegalArgumentException("Invalid move: " + text);
        }
        return move;
    }

    /**
     * Lenient variant of {@link #parse(String)}; returns {@code null} for null, blank or malformed text.
     */
    public static Move tryParse(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim().toLowerCase(Locale.ROOT);
        if (trimmed.length() != 4 && trimmed.length() != 5) {
            return null;
        }
        Square from = Square.tryParse(trimmed.substring(0, 2));
        Square to = Square.tryParse(trimmed.substring(2, 4));
        if (from == null || to == null) {
            return null;
        }
        PieceKind promotion = null;
        if (trimmed.length() == 5) {
            promotion = PieceKind.fromLetter(trimmed.charAt(4));
            if (promotion == null) {
                return null;
            }
        }
        return new Move(from, to, promotion);
    }

    /**
     * Returns the coordinate notation of this move.
     */
    public String toCommandString() {
        String text = from.toAlgebraic() + to.toAlgebraic();
        if (promotion != null) {
            text += Character.toLowerCase(promotion.getLetter());
        }
        return text;
    }

    @Override
    public String toString() {
        return toCommandString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Move)) {
            return false;
        }
        Move move = (Move) o;
        return from.equals(move.from) && to.equals(move.to) && promotion == move.promotion;
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, promotion);
    }
}

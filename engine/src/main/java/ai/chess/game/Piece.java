package ai.chess.game;

import java.util.Objects;

/**
 * Immutable (color, kind) pair occupying a square.
 */
public class Piece {
    private static final String WHITE_GLYPHS = "♙♘♗♖♕♔";
    private static final String BLACK_GLYPHS = "♟♞♝♜♛♚";

    private final PieceColor color;
    private final PieceKind kind;

    public Piece(PieceColor color, PieceKind kind) {
        this.color = Objects.requireNonNull(color, "color");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public PieceColor getColor() {
        return color;
    }

    public PieceKind getKind() {
        return kind;
    }

    public int getValue() {
        return kind.getValue();
    }

    public boolean isEnemyOf(PieceColor side) {
        return color != side;
    }

    /**
     * Returns the Unicode chess glyph for this piece (e.g. ♔ for a white king).
     */
    public String glyph() {
        String glyphs = color == PieceColor.WHITE ? WHITE_GLYPHS : BLACK_GLYPHS;
        return String.valueOf(glyphs.charAt(kind.ordinal()));
    }

    /**
     * Returns the FEN-style letter: upper case for White, lower case for Black.
     */
    public char letter() {
        char letter = kind.getLetter();
        return color == PieceColor.WHITE ? letter : Character.toLowerCase(letter);
    }

    @Override
    public String toString() {
        return color + " " + kind.name().toLowerCase();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Piece)) {
            return false;
        }
        Piece piece = (Piece) o;
        return color == piece.color && kind == piece.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(color, kind);
    }
}

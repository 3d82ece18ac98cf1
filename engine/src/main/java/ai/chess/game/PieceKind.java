package ai.chess.game;

/**
 * Enumeration of the six chess piece kinds.
 * <p>
 * Each kind carries its material value for evaluation and a single-letter code used by the
 * coordinate move notation (e.g. the {@code q} in {@code e7e8q}). The king is worth 0: it is
 * never traded, so it contributes nothing to a material balance.
 */
public enum PieceKind {
    /** Pawn – value 1. */
    PAWN(1, 'P'),
    /** Knight – value 3. */
    KNIGHT(3, 'N'),
    /** Bishop – value 3. */
    BISHOP(3, 'B'),
    /** Rook – value 5. */
    ROOK(5, 'R'),
    /** Queen – value 9. */
    QUEEN(9, 'Q'),
    /** King – value 0. */
    KING(0, 'K');

    /** Material value used by the evaluation. */
    private final int value;
    /** Upper-case letter code for this kind. */
    private final char letter;

    PieceKind(int value, char letter) {
        this.value = value;
        this.letter = letter;
    }

    /**
     * Returns the material value of this kind (Pawn 1, Knight 3, Bishop 3, Rook 5, Queen 9, King 0).
     */
    public int getValue() {
        return value;
    }

    public char getLetter() {
        return letter;
    }

    /**
     * Resolves a kind from its letter code, ignoring case.
     *
     * @param letter a letter such as {@code 'q'} or {@code 'N'}
     * @return the matching kind, or {@code null} if the letter is not a piece code
     */
    public static PieceKind fromLetter(char letter) {
        char upper = Character.toUpperCase(letter);
        for (PieceKind kind : values()) {
            if (kind.letter == upper) {
                return kind;
            }
        }
        return null;
    }
}

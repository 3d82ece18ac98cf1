package ai.chess.game;

/**
 * The two sides of a chess game.
 * <p>
 * Ranks are indexed from Black's side of the board: rank 0 is Black's back rank and rank 7 is
 * White's. White pawns therefore advance towards rank 0 and Black pawns towards rank 7.
 */
public enum PieceColor {
    /** White moves up the board (decreasing rank index). */
    WHITE(-1, 6, 0, "White"),
    /** Black moves down the board (increasing rank index). */
    BLACK(1, 1, 7, "Black");

    /** Rank delta of a single pawn step for this side. */
    private final int forward;
    /** Rank on which this side's pawns start and may double-step. */
    private final int pawnStartRank;
    /** Farthest rank for this side's pawns, where they promote. */
    private final int promotionRank;
    /** Human-readable name used in console output. */
    private final String displayName;

    PieceColor(int forward, int pawnStartRank, int promotionRank, String displayName) {
        this.forward = forward;
        this.pawnStartRank = pawnStartRank;
        this.promotionRank = promotionRank;
        this.displayName = displayName;
    }

    /**
     * Returns the rank delta of a single pawn step: -1 for White, +1 for Black.
     */
    public int getForward() {
        return forward;
    }

    public int getPawnStartRank() {
        return pawnStartRank;
    }

    public int getPromotionRank() {
        return promotionRank;
    }

    /**
     * Returns the opposing side.
     */
    public PieceColor opposite() {
        return this == WHITE ? BLACK : WHITE;
    }

    @Override
    public String toString() {
        return displayName;
    }
}

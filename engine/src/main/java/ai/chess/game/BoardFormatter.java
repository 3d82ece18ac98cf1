package ai.chess.game;

import java.util.Collection;
import java.util.List;

/**
 * Renders a {@link Board} for console display.
 * <p>
 * Ranks are printed top to bottom from Black's back rank (algebraic 8) to White's (algebraic 1),
 * with file letters underneath. Pieces use their Unicode glyphs; empty squares alternate between
 * {@code .} (light) and {@code :} (dark). Squares passed as highlights are bracketed, which is how
 * the console shows the legal destinations of a selected piece.
 */
public class BoardFormatter {
    private static final String FILES = "    a  b  c  d  e  f  g  h";

    private final Board board;

    public BoardFormatter(Board board) {
        this.board = board;
    }

    /**
     * Renders the board with no highlighted squares.
     */
    public String format() {
        return format(List.of());
    }

    /**
     * Renders the board, bracketing each square in {@code highlights}.
     *
     * @param highlights squares to mark (e.g. legal destinations); must not be null
     * @return a multi-line board diagram
     */
    public String format(Collection<Square> highlights) {
        StringBuilder sb = new StringBuilder();
        sb.append(FILES).append('\n');
        for (int rank = 0; rank < Square.SIZE; rank++) {
            int label = Square.SIZE - rank;
            sb.append(' ').append(label).append(' ');
            for (int file = 0; file < Square.SIZE; file++) {
                Square square = Square.of(rank, file);
                boolean marked = highlights.contains(square);
                sb.append(marked ? '[' : ' ');
                sb.append(cell(rank, file));
                sb.append(marked ? ']' : ' ');
            }
            sb.append(' ').append(label).append('\n');
        }
        sb.append(FILES);
        return sb.toString();
    }

    private String cell(int rank, int file) {
        Piece piece = board.get(rank, file);
        if (piece != null) {
            return piece.glyph();
        }
        return (rank + file) % 2 == 0 ? "." : ":";
    }
}

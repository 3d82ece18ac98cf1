package ai.chess.player;

import ai.chess.game.Board;
import ai.chess.game.PieceColor;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Scanner;
import org.springframework.stereotype.Component;

/**
 * Human player that reads commands from stdin (CLI).
 */
@Component
public class HumanPlayer implements Player {
    private final Scanner scanner;
    private final PrintStream out;

    public HumanPlayer() {
        this(System.in, System.out);
    }

    public HumanPlayer(InputStream in, PrintStream out) {
        this.scanner = new Scanner(in);
        this.out = out;
    }

    @Override
    public String nextCommand(Board board, PieceColor side, String feedback) {
        out.print(side + " to move (e2e4 | e7e8n | moves [SQUARE] | score | pass | quit): ");
        if (!scanner.hasNextLine()) {
            return null;
        }
        return scanner.nextLine();
    }
}

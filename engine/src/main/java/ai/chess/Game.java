package ai.chess;

import ai.chess.config.GameProperties;
import ai.chess.game.Board;
import ai.chess.game.BoardFormatter;
import ai.chess.game.Move;
import ai.chess.game.MoveGenerator;
import ai.chess.game.PieceColor;
import ai.chess.game.Square;
import ai.chess.player.AIPlayer;
import ai.chess.player.HumanPlayer;
import ai.chess.player.Player;
import ai.chess.player.ai.GreedySearchPlayer;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Game implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(Game.class);

    private final Player white;
    private final Player black;
    private final int maxPlies;
    private final PrintStream out;

    @Autowired
    public Game(HumanPlayer human, GreedySearchPlayer ai, GameProperties properties) {
        this(properties.isSelfPlay() || properties.getAiColor() == PieceColor.WHITE ? ai : human,
                properties.isSelfPlay() || properties.getAiColor() == PieceColor.BLACK ? ai : human,
                properties.getMaxPlies(),
                System.out);
    }

    public Game(Player white, Player black, int maxPlies, PrintStream out) {
        this.white = Objects.requireNonNull(white, "white");
        this.black = Objects.requireNonNull(black, "black");
        this.maxPlies = maxPlies;
        this.out = Objects.requireNonNull(out, "out");
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Game.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        // CLI entrypoint ignores the result; tests call play() directly.
        GameResult result = play();
        out.println(result);
    }

    /**
     * Core game loop used by both the CLI runner and automated tests.
     *
     * <p>Each iteration renders the board, asks the player whose turn it is for a command and
     * applies it. Informational commands ({@code moves}, {@code score}) and rejected input leave
     * the turn with the same player and are answered through the feedback string.
     *
     * <p>The loop ends when a player quits or its input closes, a king is captured, both sides
     * pass in a row, or {@code maxPlies} moves have been played.
     *
     * @return summary of how the session ended
     */
    public GameResult play() {
        Board board = new Board();
        PieceColor toMove = PieceColor.WHITE;
        String feedback = "";
        int plies = 0;
        int consecutivePasses = 0;
        long startNanos = System.nanoTime();
        PieceColor winner = null;
        EndReason reason;

        while (true) {
            if (plies >= maxPlies) {
                if (log.isDebugEnabled()) {
                    log.debug("Max plies ({}) reached, stopping game loop.", maxPlies);
                }
                reason = EndReason.PLY_LIMIT;
                break;
            }

            Player player = toMove == PieceColor.WHITE ? white : black;
            boolean aiMode = player instanceof AIPlayer;
            if (!aiMode) {
                out.println(board);
                if (!feedback.isBlank()) {
                    out.println(feedback);
                }
            } else if (log.isDebugEnabled()) {
                log.debug("Current board:\n{}", board);
            }

            String input = player.nextCommand(board, toMove, feedback);
            feedback = "";
            if (input == null) {
                if (log.isDebugEnabled()) {
                    log.debug("Input closed for {} ({})", toMove, player.getClass().getSimpleName());
                }
                reason = EndReason.INPUT_CLOSED;
                break;
            }
            input = input.trim().toLowerCase(Locale.ROOT);
            if (log.isDebugEnabled()) {
                log.debug("Received command from {}: {}", player.getClass().getSimpleName(), input);
            }

            if (input.equals("quit")) {
                reason = EndReason.QUIT;
                break;
            } else if (input.equals("score")) {
                feedback = "Material score for " + toMove + ": " + board.materialScore(toMove);
                continue;
            } else if (input.equals("moves") || input.startsWith("moves ")) {
                feedback = describeMoves(board, toMove, input.substring("moves".length()).trim());
                continue;
            } else if (input.equals(AIPlayer.PASS)) {
                if (!MoveGenerator.generateMoves(board, toMove).isEmpty()) {
                    feedback = "Illegal pass: " + toMove + " still has moves.";
                    continue;
                }
                consecutivePasses++;
                if (log.isDebugEnabled()) {
                    log.debug("{} cannot move and passes", toMove);
                }
                if (consecutivePasses >= 2) {
                    reason = EndReason.NO_MOVES;
                    break;
                }
                toMove = toMove.opposite();
                continue;
            }

            Move requested = Move.tryParse(input);
            if (requested == null) {
                feedback = "Unknown command: \"" + input + "\". Use a move like e2e4, 'moves [square]', 'score', 'pass' or 'quit'.";
                if (aiMode) {
                    log.warn("{} sent an unknown command: {}", player.getClass().getSimpleName(), input);
                }
                continue;
            }
            Move legal = findLegalMove(board, toMove, requested);
            if (legal == null) {
                feedback = "Illegal move: " + requested + " is not a legal move for " + toMove + ".";
                if (aiMode) {
                    log.warn("{} proposed an illegal move: {}", player.getClass().getSimpleName(), requested);
                }
                continue;
            }

            board.applyMove(legal.withPromotion(requested.promotion()));
            plies++;
            consecutivePasses = 0;
            if (aiMode) {
                out.println(toMove + " plays " + requested);
            }
            if (log.isDebugEnabled()) {
                log.debug("Applied move {} for {}", requested, toMove);
            }

            // Moves are pseudo-legal, so a king can actually be taken.
            if (board.findKing(toMove.opposite()) == null) {
                winner = toMove;
                reason = EndReason.KING_CAPTURED;
                break;
            }
            toMove = toMove.opposite();
        }

        out.println(board);
        GameResult result = new GameResult(winner, plies, reason, System.nanoTime() - startNanos);
        if (log.isDebugEnabled()) {
            log.debug("Game over: {}", result);
        }
        return result;
    }

    /**
     * Matches a typed move against the side's pseudo-legal moves, ignoring any promotion suffix.
     */
    private static Move findLegalMove(Board board, PieceColor side, Move requested) {
        for (Move candidate : MoveGenerator.generateMovesFrom(board, side, requested.from())) {
            if (candidate.sameSquares(requested)) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Builds the answer to a {@code moves} command: every legal move, or the highlighted
     * destinations of the piece on the given square.
     */
    private static String describeMoves(Board board, PieceColor side, String squareText) {
        if (squareText.isEmpty()) {
            List<Move> moves = MoveGenerator.generateMoves(board, side);
            if (moves.isEmpty()) {
                return side + " has no legal moves.";
            }
            return "Legal moves for " + side + ": "
                    + moves.stream().map(Move::toCommandString).collect(Collectors.joining(" "));
        }
        Square origin = Square.tryParse(squareText);
        if (origin == null) {
            return "Invalid square: " + squareText;
        }
        List<Move> moves = MoveGenerator.generateMovesFrom(board, side, origin);
        if (moves.isEmpty()) {
            return "No legal moves from " + origin + ".";
        }
        List<Square> destinations = new ArrayList<>();
        for (Move move : moves) {
            destinations.add(move.to());
        }
        return new BoardFormatter(board).format(destinations) + "\nLegal destinations from " + origin + ": "
                + destinations.stream().map(Square::toAlgebraic).collect(Collectors.joining(" "));
    }

    /**
     * Why a session stopped.
     */
    public enum EndReason {
        KING_CAPTURED,
        NO_MOVES,
        PLY_LIMIT,
        QUIT,
        INPUT_CLOSED
    }

    public static final class GameResult {
        private final PieceColor winner;
        private final int plies;
        private final EndReason reason;
        private final long durationNanos;

        public GameResult(PieceColor winner, int plies, EndReason reason, long durationNanos) {
            this.winner = winner;
            this.plies = plies;
            this.reason = reason;
            this.durationNanos = durationNanos;
        }

        /**
         * Returns the side that captured the opposing king, or null if no king was taken.
         */
        public PieceColor getWinner() {
            return winner;
        }

        public int getPlies() {
            return plies;
        }

        public EndReason getReason() {
            return reason;
        }

        public long getDurationNanos() {
            return durationNanos;
        }

        @Override
        public String toString() {
            String outcome = winner == null ? "no winner" : winner + " wins";
            return "Game over after " + plies + " plies: " + outcome + " (" + reason + ")";
        }
    }
}

package ai.chess.player.ai;

import ai.chess.config.GameProperties;
import ai.chess.game.Board;
import ai.chess.game.Move;
import ai.chess.game.MoveGenerator;
import ai.chess.game.Piece;
import ai.chess.game.PieceColor;
import ai.chess.player.AIPlayer;
import ai.chess.player.Player;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Greedy (1-ply) material player:
 *
 * - Enumerates ALL pseudo-legal moves for the side to move.
 * - Simulates each move on its own copy of the board and scores the resulting material balance,
 *   plus a small bonus of 0.1 x the value of the captured piece.
 * - Keeps every move that reaches the best score (exact comparison).
 * - Among those, prefers the capture of the single most valuable piece; remaining ties are
 *   broken uniformly at random.
 *
 * Notes:
 * - There is no look-ahead beyond the move itself: the reply is never considered, so the player
 *   happily walks into recaptures.
 * - The random source is injected; a seeded {@link Random} makes choices reproducible.
 */
@Component
public class GreedySearchPlayer extends AIPlayer implements Player {

    private static final Logger log = LoggerFactory.getLogger(GreedySearchPlayer.class);

    // Weight of the captured piece's value in the evaluation.
    private static final double CAPTURE_BONUS_WEIGHT = 0.1;

    private final Random random;

    @Autowired
    public GreedySearchPlayer(GameProperties properties) {
        this(properties.getAi().createRandom());
    }

    public GreedySearchPlayer(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Picks a move for {@code side} by one-ply material evaluation.
     *
     * @return one of the moves produced by {@link MoveGenerator#generateMoves}, or null if there are none
     */
    @Override
    public Move chooseMove(Board board, PieceColor side) {
        List<Move> candidates = MoveGenerator.generateMoves(board, side);
        if (candidates.isEmpty()) {
            if (log.isDebugEnabled()) {
                log.debug("{} has no moves", side);
            }
            return null;
        }

        List<Move> best = bestScoringMoves(board, side, candidates);
        List<Move> pool = mostValuableCaptures(board, best);
        if (pool.isEmpty()) {
            pool = best;
        }

        Move chosen = pool.get(random.nextInt(pool.size()));
        if (log.isDebugEnabled()) {
            log.debug("{} plays {} ({} candidates, {} tied best, {} in final pool)",
                    side, chosen, candidates.size(), best.size(), pool.size());
        }
        return chosen;
    }

    /**
     * Scores every candidate and returns all of those reaching the maximum, in generation order.
     */
    List<Move> bestScoringMoves(Board board, PieceColor side, List<Move> candidates) {
        double bestScore = Double.NEGATIVE_INFINITY;
        List<Move> best = new ArrayList<>();
        for (Move move : candidates) {
            double score = evaluate(board, side, move);
            if (log.isTraceEnabled()) {
                log.trace("Candidate {} scores {}", move, score);
            }
            // Exact equality: the only fractional term is a fixed multiple of an integer piece value.
            if (score > bestScore) {
                bestScore = score;
                best.clear();
                best.add(move);
            } else if (score == bestScore) {
                best.add(move);
            }
        }
        return best;
    }

    /**
     * Returns the material balance for {@code side} after {@code move}, plus the capture bonus.
     * The board itself is left untouched.
     */
    double evaluate(Board board, PieceColor side, Move move) {
        int captureBonus = capturedValue(board, move);
        Board simulated = board.copy();
        simulated.applyMove(move);
        return simulated.materialScore(side) + CAPTURE_BONUS_WEIGHT * captureBonus;
    }

    /**
     * Returns the moves among {@code moves} that capture the most valuable piece.
     * <p>
     * A king is worth 0, so king captures survive only when nothing more valuable is captured.
     * Empty when none of the moves is a capture.
     */
    private List<Move> mostValuableCaptures(Board board, List<Move> moves) {
        List<Move> captures = new ArrayList<>();
        int bestValue = 0;
        for (Move move : moves) {
            Piece captured = board.get(move.to());
            if (captured == null) {
                continue;
            }
            int value = captured.getValue();
            if (value > bestValue) {
                bestValue = value;
                captures.clear();
                captures.add(move);
            } else if (value == bestValue) {
                captures.add(move);
            }
        }
        return captures;
    }
}

package ai.chess.player;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.chess.game.Board;
import ai.chess.game.PieceColor;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class HumanPlayerTest {

    @Test
    void readsOneCommandPerLineAndReturnsNullAtEndOfInput() {
        ByteArrayInputStream in = new ByteArrayInputStream("e2e4\nmoves g1\n".getBytes(StandardCharsets.UTF_8));
        ByteArrayOutputStream prompts = new ByteArrayOutputStream();
        HumanPlayer human = new HumanPlayer(in, new PrintStream(prompts, true, StandardCharsets.UTF_8));
        Board board = new Board();

        assertEquals("e2e4", human.nextCommand(board, PieceColor.WHITE, ""));
        assertEquals("moves g1", human.nextCommand(board, PieceColor.BLACK, ""));
        assertNull(human.nextCommand(board, PieceColor.WHITE, ""));

        String shown = prompts.toString(StandardCharsets.UTF_8);
        assertTrue(shown.contains("White to move"));
        assertTrue(shown.contains("Black to move"));
    }
}

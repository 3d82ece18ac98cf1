package ai.chess.unit.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.chess.game.Move;
import ai.chess.game.PieceKind;
import ai.chess.game.Square;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Coordinate notation")
class MoveNotationTest {

    @Nested
    @DisplayName("Squares")
    class SquareTests {

        @Test
        void algebraicMapsRankEightToIndexZero() {
            assertEquals(Square.of(0, 0), Square.parse("a8"));
            assertEquals(Square.of(7, 7), Square.parse("h1"));
            assertEquals(Square.of(6, 4), Square.parse("E2"));
            assertEquals("e2", Square.of(6, 4).toAlgebraic());
        }

        @Test
        void tryParseRejectsBadInput() {
            assertNull(Square.tryParse(null));
            assertNull(Square.tryParse(""));
            assertNull(Square.tryParse("i1"));
            assertNull(Square.tryParse("a0"));
            assertNull(Square.tryParse("a9"));
            assertNull(Square.tryParse("e22"));
            assertThrows(IllegalArgumentException.class, () -> Square.parse("z9"));
        }

        @Test
        void offsetsMayLeaveTheBoard() {
            Square corner = Square.parse("a8");
            assertTrue(corner.isOnBoard());
            assertFalse(corner.offset(-1, 0).isOnBoard());
            assertFalse(corner.offset(0, -1).isOnBoard());
            assertEquals(Square.parse("b6"), corner.offset(2, 1));
        }
    }

    @Nested
    @DisplayName("Moves")
    class MoveTests {

        @Test
        void parsesPlainMove() {
            Move move = Move.parse("e2e4");
            assertEquals(Square.parse("e2"), move.from());
            assertEquals(Square.parse("e4"), move.to());
            assertNull(move.promotion());
            assertEquals("e2e4", move.toCommandString());
        }

        @Test
        void parsesPromotionSuffix() {
            Move move = Move.parse(" A7A8N ");
            assertEquals(PieceKind.KNIGHT, move.promotion());
            assertEquals("a7a8n", move.toString());
        }

        @Test
        void tryParseReturnsNullForMalformedText() {
            assertNull(Move.tryParse(null));
            assertNull(Move.tryParse("   "));
            assertNull(Move.tryParse("e2"));
            assertNull(Move.tryParse("e2e9"));
            assertNull(Move.tryParse("e7e8x"));
            assertNull(Move.tryParse("moves"));
            assertThrows(IllegalArgumentException.class, () -> Move.parse("quit"));
        }

        @Test
        void equalityIncludesPromotion() {
            assertEquals(Move.parse("a7a8"), new Move(Square.of(1, 0), Square.of(0, 0)));
            assertFalse(Move.parse("a7a8q").equals(Move.parse("a7a8")));
            assertTrue(Move.parse("a7a8q").sameSquares(Move.parse("a7a8")));
            assertEquals(Move.parse("a7a8q"), Move.parse("a7a8").withPromotion(PieceKind.QUEEN));
        }
    }
}

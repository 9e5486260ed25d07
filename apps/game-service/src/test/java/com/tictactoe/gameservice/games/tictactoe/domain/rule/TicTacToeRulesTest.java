package com.tictactoe.gameservice.games.tictactoe.domain.rule;

import com.tictactoe.gameservice.games.tictactoe.domain.TestStates;
import com.tictactoe.gameservice.games.tictactoe.domain.constants.GameMessages;
import com.tictactoe.gameservice.games.tictactoe.domain.exception.InvalidMoveException;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Difficulty;
import com.tictactoe.gameservice.games.tictactoe.domain.model.GameStatus;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Mark;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Position;
import com.tictactoe.gameservice.games.tictactoe.domain.model.TicTacToeState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TicTacToeRulesTest {

    @Test
    void firstMoveFlipsTurn() {
        TicTacToeState s = TicTacToeRules.applyMove(TicTacToeState.fresh(Difficulty.MEDIUM), 1, 1, Mark.X);

        assertEquals(Mark.X, s.getBoard().get(1, 1));
        assertEquals(Mark.O, s.getTurn());
        assertEquals(GameStatus.PLAYING, s.getStatus());
        assertNull(s.getWinner());
        assertNull(s.getWinningLine());
        assertEquals(Difficulty.MEDIUM, s.getDifficulty());
    }

    @Test
    void completingARowWins() {
        TicTacToeState s = TestStates.playing(Difficulty.EASY, "XX.", "OO.", "...");

        TicTacToeState after = TicTacToeRules.applyMove(s, 0, 2, Mark.X);

        assertEquals(GameStatus.WON, after.getStatus());
        assertEquals(Mark.X, after.getWinner());
        assertEquals(List.of(new Position(0, 0), new Position(0, 1), new Position(0, 2)), after.getWinningLine());
        assertEquals(Mark.O, after.getTurn());
        assertTrue(TicTacToeRules.legalMoves(after).isEmpty());
    }

    @Test
    void lastCellWithoutLineIsDraw() {
        int[][] moves = {{0, 0}, {0, 1}, {0, 2}, {1, 1}, {1, 0}, {1, 2}, {2, 1}, {2, 0}, {2, 2}};
        TicTacToeState s = TicTacToeState.fresh(Difficulty.HARD);
        for (int[] m : moves) {
            s = TicTacToeRules.applyMove(s, m[0], m[1], s.getTurn());
        }

        assertEquals(GameStatus.DRAW, s.getStatus());
        assertNull(s.getWinner());
        assertNull(s.getWinningLine());
        assertEquals(TestStates.board("XOX", "XOO", "OXX"), s.getBoard());
    }

    @Test
    void winOnLastCellIsAWinNotADraw() {
        TicTacToeState s = TestStates.playing(Difficulty.HARD, "XOX", "OXO", "OX.");

        TicTacToeState won = TicTacToeRules.applyMove(s, 2, 2, Mark.X);

        assertTrue(won.getBoard().isFull());
        assertEquals(GameStatus.WON, won.getStatus());
        assertEquals(Mark.X, won.getWinner());
        assertEquals(TicTacToeJudge.LINES.get(6), won.getWinningLine());
    }

    @Test
    void outOfBoardIsRejected() {
        TicTacToeState s = TicTacToeState.fresh(Difficulty.MEDIUM);

        InvalidMoveException e = assertThrows(InvalidMoveException.class,
                () -> TicTacToeRules.applyMove(s, 3, 0, Mark.X));
        assertEquals(GameMessages.OUT_OF_BOARD, e.getMessage());
        assertThrows(InvalidMoveException.class, () -> TicTacToeRules.applyMove(s, 0, -1, Mark.X));
    }

    @Test
    void occupiedCellIsRejected() {
        TicTacToeState s = TicTacToeRules.applyMove(TicTacToeState.fresh(Difficulty.MEDIUM), 0, 0, Mark.X);

        InvalidMoveException e = assertThrows(InvalidMoveException.class,
                () -> TicTacToeRules.applyMove(s, 0, 0, Mark.O));
        assertEquals(GameMessages.CELL_OCCUPIED, e.getMessage());
    }

    @Test
    void wrongTurnIsRejected() {
        TicTacToeState s = TicTacToeState.fresh(Difficulty.MEDIUM);

        InvalidMoveException e = assertThrows(InvalidMoveException.class,
                () -> TicTacToeRules.applyMove(s, 0, 0, Mark.O));
        assertEquals(GameMessages.formatNotYourTurn(Mark.X), e.getMessage());
    }

    @Test
    void finishedGameRejectsEveryMove() {
        TicTacToeState won = TicTacToeRules.applyMove(
                TestStates.playing(Difficulty.EASY, "XX.", "OO.", "..."), 0, 2, Mark.X);

        InvalidMoveException e = assertThrows(InvalidMoveException.class,
                () -> TicTacToeRules.applyMove(won, 2, 2, Mark.O));
        assertEquals(GameMessages.GAME_ALREADY_OVER, e.getMessage());
        // 终局优先于越界检查
        InvalidMoveException outside = assertThrows(InvalidMoveException.class,
                () -> TicTacToeRules.applyMove(won, 9, 9, Mark.O));
        assertEquals(GameMessages.GAME_ALREADY_OVER, outside.getMessage());
    }

    @Test
    void inputStateIsNotModified() {
        TicTacToeState s = TestStates.playing(Difficulty.EASY, "X..", "...", "...");
        TicTacToeState copy = TestStates.playing(Difficulty.EASY, "X..", "...", "...");

        TicTacToeRules.applyMove(s, 1, 1, Mark.O);
        assertThrows(InvalidMoveException.class, () -> TicTacToeRules.applyMove(s, 0, 0, Mark.O));

        assertEquals(copy, s);
    }

    @Test
    void legalMovesAreRowMajorEmptyCells() {
        TicTacToeState s = TestStates.playing(Difficulty.EASY, ".X.", "...", "O.X");

        assertEquals(List.of(
                new Position(0, 0), new Position(0, 2),
                new Position(1, 0), new Position(1, 1), new Position(1, 2),
                new Position(2, 1)), TicTacToeRules.legalMoves(s));
    }

    @Test
    void everyReachableStateKeepsMarkCountsBalanced() {
        for (TicTacToeState s : TestStates.reachableStates(Difficulty.EASY)) {
            int diff = s.getBoard().count(Mark.X) - s.getBoard().count(Mark.O);
            assertTrue(diff == 0 || diff == 1, () -> "unbalanced: " + s);
            assertEquals(diff == 0 ? Mark.X : Mark.O, s.getTurn(), () -> "turn: " + s);
            if (s.getStatus() == GameStatus.WON) {
                assertEquals(s.getTurn().opponent(), s.getWinner(), () -> "winner: " + s);
                assertEquals(TicTacToeJudge.findWinningLine(s.getBoard()), s.getWinningLine());
            }
        }
    }
}

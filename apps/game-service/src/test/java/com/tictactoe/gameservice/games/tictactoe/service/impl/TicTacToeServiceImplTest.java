package com.tictactoe.gameservice.games.tictactoe.service.impl;

import com.tictactoe.gameservice.games.tictactoe.config.TicTacToeProperties;
import com.tictactoe.gameservice.games.tictactoe.domain.TestStates;
import com.tictactoe.gameservice.games.tictactoe.domain.TicTacToeEngine;
import com.tictactoe.gameservice.games.tictactoe.domain.constants.GameMessages;
import com.tictactoe.gameservice.games.tictactoe.domain.dto.GameStateRecord;
import com.tictactoe.gameservice.games.tictactoe.domain.exception.InvalidMoveException;
import com.tictactoe.gameservice.games.tictactoe.domain.exception.MalformedStateException;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Difficulty;
import com.tictactoe.gameservice.games.tictactoe.domain.model.GameStatus;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Mark;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Move;
import com.tictactoe.gameservice.games.tictactoe.domain.model.TicTacToeState;
import com.tictactoe.gameservice.games.tictactoe.domain.repository.InMemoryGameStateRepository;
import com.tictactoe.gameservice.games.tictactoe.service.NoActiveGameException;
import com.tictactoe.gameservice.games.tictactoe.service.TicTacToeService.MoveResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TicTacToeServiceImplTest {

    private static final String SID = "session-1";

    private InMemoryGameStateRepository repo;
    private TicTacToeEngine engine;
    private TicTacToeProperties props;
    private TicTacToeServiceImpl service;

    @BeforeEach
    void setUp() {
        repo = new InMemoryGameStateRepository();
        engine = new TicTacToeEngine(new Random(42));
        props = new TicTacToeProperties();
        props.setSessionTtl(Duration.ofMinutes(30));
        service = new TicTacToeServiceImpl(repo, engine, props);
    }

    @Test
    void newGameIsStoredWithConfiguredTtl() {
        TicTacToeState s = service.newGame(SID, Difficulty.HARD);

        assertEquals(Difficulty.HARD, s.getDifficulty());
        assertEquals(s, service.getState(SID));
        assertEquals(Duration.ofMinutes(30), repo.getLastTtl());
    }

    @Test
    void newGameWithoutDifficultyUsesDefault() {
        props.setDefaultDifficulty("easy");

        assertEquals(Difficulty.EASY, service.newGame(SID, null).getDifficulty());
    }

    @Test
    void getStateWithoutGameFails() {
        assertThrows(NoActiveGameException.class, () -> service.getState(SID));
        assertThrows(NoActiveGameException.class, () -> service.move(SID, 0, 0));
    }

    @Test
    void moveIsAnsweredByComputer() {
        service.newGame(SID, Difficulty.HARD);

        MoveResult r = service.move(SID, 0, 0);

        assertEquals(new Move(1, 1, Mark.O), r.aiMove());
        assertEquals(Mark.X, r.state().getBoard().get(0, 0));
        assertEquals(Mark.O, r.state().getBoard().get(1, 1));
        assertEquals(Mark.X, r.state().getTurn());
        assertEquals(r.state(), service.getState(SID));
    }

    @Test
    void winningHumanMoveGetsNoReply() {
        repo.save(SID, engine.encode(TestStates.playing(Difficulty.MEDIUM, "XX.", "OO.", "...")), Duration.ofHours(1));

        MoveResult r = service.move(SID, 0, 2);

        assertNull(r.aiMove());
        assertEquals(GameStatus.WON, r.state().getStatus());
        assertEquals(Mark.X, r.state().getWinner());
        assertEquals(GameStatus.WON, service.getState(SID).getStatus());
    }

    @Test
    void computerCanFinishTheGame() {
        // X 走 (0,1) 没堵 row1，MEDIUM 的 O 在 (1,2) 三连
        repo.save(SID, engine.encode(TestStates.playing(Difficulty.MEDIUM, "X..", "OO.", "..X")), Duration.ofHours(1));

        MoveResult r = service.move(SID, 0, 1);

        assertEquals(new Move(1, 2, Mark.O), r.aiMove());
        assertEquals(GameStatus.WON, r.state().getStatus());
        assertEquals(Mark.O, r.state().getWinner());
    }

    @Test
    void rejectedMoveLeavesStoredGameUntouched() {
        service.newGame(SID, Difficulty.HARD);
        service.move(SID, 0, 0);
        GameStateRecord before = repo.get(SID).orElseThrow();

        InvalidMoveException e = assertThrows(InvalidMoveException.class, () -> service.move(SID, 1, 1));
        assertEquals(GameMessages.CELL_OCCUPIED, e.getMessage());
        assertThrows(InvalidMoveException.class, () -> service.move(SID, 3, 0));

        assertSame(before, repo.get(SID).orElseThrow());
    }

    @Test
    void corruptedGameIsClearedAndReported() {
        GameStateRecord bad = engine.encode(engine.newGame(Difficulty.EASY));
        bad.setCurrentPlayer("O");
        repo.save(SID, bad, Duration.ofHours(1));

        MalformedStateException e = assertThrows(MalformedStateException.class, () -> service.getState(SID));

        assertEquals(GameMessages.GAME_SESSION_CORRUPTED, e.getMessage());
        assertTrue(repo.get(SID).isEmpty());
        assertThrows(NoActiveGameException.class, () -> service.getState(SID));
    }

    @Test
    void resetKeepsCurrentDifficulty() {
        service.newGame(SID, Difficulty.HARD);
        service.move(SID, 0, 0);

        TicTacToeState s = service.reset(SID, null);

        assertEquals(Difficulty.HARD, s.getDifficulty());
        assertEquals(engine.newGame(Difficulty.HARD), service.getState(SID));
    }

    @Test
    void resetCanSwitchDifficulty() {
        service.newGame(SID, Difficulty.HARD);

        assertEquals(Difficulty.EASY, service.reset(SID, Difficulty.EASY).getDifficulty());
    }

    @Test
    void resetWithoutUsableGameFallsBackToDefault() {
        assertEquals(Difficulty.MEDIUM, service.reset(SID, null).getDifficulty());

        GameStateRecord bad = engine.encode(engine.newGame(Difficulty.HARD));
        bad.setGameStatus("finished");
        repo.save("other", bad, Duration.ofHours(1));
        assertEquals(Difficulty.MEDIUM, service.reset("other", null).getDifficulty());
    }

    @Test
    void quitRemovesGame() {
        service.newGame(SID, Difficulty.EASY);

        assertTrue(service.quit(SID));
        assertFalse(service.quit(SID));
        assertThrows(NoActiveGameException.class, () -> service.getState(SID));
    }

    @Test
    void sessionsAreIndependent() {
        service.newGame("a", Difficulty.EASY);
        service.newGame("b", Difficulty.HARD);
        service.move("b", 0, 0);

        assertEquals(engine.newGame(Difficulty.EASY), service.getState("a"));
        assertNotNull(service.getState("b").getBoard());
        assertEquals(Mark.X, service.getState("b").getBoard().get(0, 0));
    }
}

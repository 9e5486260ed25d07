package com.tictactoe.gameservice.games.tictactoe.service.impl;

import com.tictactoe.gameservice.games.tictactoe.config.TicTacToeProperties;
import com.tictactoe.gameservice.games.tictactoe.domain.TicTacToeEngine;
import com.tictactoe.gameservice.games.tictactoe.domain.constants.GameMessages;
import com.tictactoe.gameservice.games.tictactoe.domain.dto.GameStateRecord;
import com.tictactoe.gameservice.games.tictactoe.domain.exception.MalformedStateException;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Difficulty;
import com.tictactoe.gameservice.games.tictactoe.domain.model.GameStatus;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Mark;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Move;
import com.tictactoe.gameservice.games.tictactoe.domain.model.TicTacToeState;
import com.tictactoe.gameservice.games.tictactoe.domain.repository.GameStateRepository;
import com.tictactoe.gameservice.games.tictactoe.service.NoActiveGameException;
import com.tictactoe.gameservice.games.tictactoe.service.TicTacToeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class TicTacToeServiceImpl implements TicTacToeService {

    private final GameStateRepository gameRepo;
    private final TicTacToeEngine engine;
    private final TicTacToeProperties props;

    /**
     * 新开一盘
     */
    @Override
    public TicTacToeState newGame(String sessionId, Difficulty difficulty) {
        Difficulty d = (difficulty == null ? defaultDifficulty() : difficulty);
        TicTacToeState s = engine.newGame(d);
        store(sessionId, s);
        log.info("新开对局: session={}, difficulty={}", sessionId, d.wireValue());
        return s;
    }

    /**
     * 获取当前对局
     */
    @Override
    public TicTacToeState getState(String sessionId) {
        return load(sessionId);
    }

    /**
     * 玩家落子并自动触发电脑回手
     */
    @Override
    public MoveResult move(String sessionId, int row, int col) {
        TicTacToeState s = load(sessionId);

        // 1) 玩家先走这一步（非法落子直接抛出，存储中的状态保持不变）
        TicTacToeState afterPlayer = engine.move(s, row, col);
        log.info("玩家落子: session={}, ({}, {}) -> {}", sessionId, row, col,
                afterPlayer.getStatus().wireValue());

        // 2) 对局仍在进行，则电脑紧接着走一步
        Move aiMove = null;
        TicTacToeState result = afterPlayer;
        if (afterPlayer.getStatus() == GameStatus.PLAYING && afterPlayer.getTurn() == Mark.O) {
            aiMove = engine.chooseAiMove(afterPlayer);
            result = engine.applyAi(afterPlayer, aiMove);
            log.info("电脑落子: session={}, difficulty={}, ({}, {}) -> {}", sessionId,
                    result.getDifficulty().wireValue(), aiMove.row(), aiMove.col(), result.getStatus().wireValue());
        }

        store(sessionId, result);
        return new MoveResult(result, aiMove);
    }

    /**
     * 重开当前对局
     */
    @Override
    public TicTacToeState reset(String sessionId, Difficulty difficulty) {
        Difficulty d = difficulty;
        if (d == null) {
            d = currentDifficulty(sessionId).orElseGet(this::defaultDifficulty);
        }
        TicTacToeState s = engine.newGame(d);
        store(sessionId, s);
        log.info("重开对局: session={}, difficulty={}", sessionId, d.wireValue());
        return s;
    }

    /**
     * 退出对局
     */
    @Override
    public boolean quit(String sessionId) {
        boolean existed = gameRepo.delete(sessionId);
        log.info("退出对局: session={}, existed={}", sessionId, existed);
        return existed;
    }

    @Override
    public Difficulty defaultDifficulty() {
        return Difficulty.parse(props.getDefaultDifficulty());
    }

    // ----------- private helpers -----------

    private void store(String sessionId, TicTacToeState s) {
        gameRepo.save(sessionId, engine.encode(s), props.getSessionTtl());
    }

    /**
     * 读取并解码会话对局；数据损坏时清掉该会话的对局，让前端引导用户开新局
     */
    private TicTacToeState load(String sessionId) {
        GameStateRecord rec = gameRepo.get(sessionId).orElseThrow(NoActiveGameException::new);
        try {
            return engine.decode(rec);
        } catch (MalformedStateException e) {
            log.warn("会话对局数据损坏，已清除: session={}, reason={}", sessionId, e.getMessage());
            gameRepo.delete(sessionId);
            throw new MalformedStateException(GameMessages.GAME_SESSION_CORRUPTED);
        }
    }

    /** 当前对局的难度；没有对局或数据损坏时为空 */
    private Optional<Difficulty> currentDifficulty(String sessionId) {
        Optional<GameStateRecord> rec = gameRepo.get(sessionId);
        if (rec.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(engine.decode(rec.get()).getDifficulty());
        } catch (MalformedStateException e) {
            log.warn("重开时发现对局数据损坏，改用默认难度: session={}, reason={}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }
}

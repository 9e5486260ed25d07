package com.tictactoe.gameservice.games.tictactoe.domain;

import com.tictactoe.gameservice.games.tictactoe.domain.ai.TicTacToeAI;
import com.tictactoe.gameservice.games.tictactoe.domain.codec.TicTacToeStateCodec;
import com.tictactoe.gameservice.games.tictactoe.domain.constants.GameMessages;
import com.tictactoe.gameservice.games.tictactoe.domain.dto.GameStateRecord;
import com.tictactoe.gameservice.games.tictactoe.domain.exception.NotAiTurnException;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Difficulty;
import com.tictactoe.gameservice.games.tictactoe.domain.model.GameStatus;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Mark;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Move;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Position;
import com.tictactoe.gameservice.games.tictactoe.domain.model.TicTacToeState;
import com.tictactoe.gameservice.games.tictactoe.domain.rule.TicTacToeRules;

import java.util.Objects;
import java.util.Random;

/**
 * 井字棋核心引擎门面：对宿主层暴露 newGame / move / aiMove / encode / decode。
 * 引擎本身不保存对局：每次调用传入状态、返回新状态，状态归会话存储所有。
 * 唯一的成员是随机源（只给 EASY 档使用），构造时注入，便于测试固定种子。
 */
public class TicTacToeEngine {

    private final Random random;

    public TicTacToeEngine(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /** 新开一盘：空棋盘、玩家 X 先手 */
    public TicTacToeState newGame(Difficulty difficulty) {
        return TicTacToeState.fresh(Objects.requireNonNull(difficulty, "difficulty"));
    }

    /**
     * 玩家落子（玩家固定执 X）。
     * @throws com.tictactoe.gameservice.games.tictactoe.domain.exception.InvalidMoveException 非法落子
     */
    public TicTacToeState move(TicTacToeState state, int row, int col) {
        return TicTacToeRules.applyMove(state, row, col, Mark.X);
    }

    /**
     * 电脑落子：按 state.difficulty 选点并应用。
     * @throws NotAiTurnException 对局已结束，或当前不是 O 的回合
     */
    public TicTacToeState aiMove(TicTacToeState state) {
        return applyAi(state, chooseAiMove(state));
    }

    /**
     * 只算电脑的落点，不应用（便于宿主层把落点回传给前端）。
     * @throws NotAiTurnException 对局已结束，或当前不是 O 的回合
     */
    public Move chooseAiMove(TicTacToeState state) {
        if (state.getStatus() != GameStatus.PLAYING || state.getTurn() != Mark.O) {
            throw new NotAiTurnException(GameMessages.NOT_AI_TURN);
        }
        Position p = TicTacToeAI.chooseMove(state, random);
        return new Move(p.row(), p.col(), Mark.O);
    }

    /** 应用 {@link #chooseAiMove} 给出的落点 */
    public TicTacToeState applyAi(TicTacToeState state, Move move) {
        return TicTacToeRules.applyMove(state, move.row(), move.col(), move.mark());
    }

    public GameStateRecord encode(TicTacToeState state) {
        return TicTacToeStateCodec.encode(state);
    }

    /**
     * @throws com.tictactoe.gameservice.games.tictactoe.domain.exception.MalformedStateException 数据不合法
     */
    public TicTacToeState decode(GameStateRecord record) {
        return TicTacToeStateCodec.decode(record);
    }
}

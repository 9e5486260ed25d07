package com.tictactoe.gameservice.games.tictactoe.service;

import com.tictactoe.gameservice.games.tictactoe.domain.model.Difficulty;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Move;
import com.tictactoe.gameservice.games.tictactoe.domain.model.TicTacToeState;

/**
 * 会话级井字棋用例：状态按会话 ID 存取，规则与 AI 全部委托给 TicTacToeEngine。
 */
public interface TicTacToeService {

    /** 新开一盘（覆盖该会话原有对局）；difficulty 为 null 时取配置的默认难度 */
    TicTacToeState newGame(String sessionId, Difficulty difficulty);

    /**
     * 只读获取当前对局
     * @throws NoActiveGameException 会话没有对局
     */
    TicTacToeState getState(String sessionId);

    /**
     * 一站式落子：
     *   - 先执行玩家（X）这一步；
     *   - 若对局仍在进行，电脑（O）紧接着按难度走一步；
     *   - 返回最终状态（可能包含玩家一步 + 电脑一步）以及电脑的落点。
     */
    MoveResult move(String sessionId, int row, int col);

    /**
     * 重开：沿用当前难度（或使用传入的新难度）。
     * 会话没有对局或对局数据损坏时，按默认难度开新局。
     */
    TicTacToeState reset(String sessionId, Difficulty difficulty);

    /**
     * 退出：清除会话中的对局
     * @return 退出前是否存在对局
     */
    boolean quit(String sessionId);

    /** 以配置为准的默认难度 */
    Difficulty defaultDifficulty();

    // -------- DTO --------

    /**
     * 落子结果
     * @param state  最终状态
     * @param aiMove 电脑的落点；玩家这步已终局时为 null
     */
    record MoveResult(TicTacToeState state, Move aiMove) {}
}

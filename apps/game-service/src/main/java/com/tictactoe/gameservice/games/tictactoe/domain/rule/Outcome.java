package com.tictactoe.gameservice.games.tictactoe.domain.rule;

import com.tictactoe.gameservice.games.tictactoe.domain.model.Mark;

/** 对局结果：未结束 / X 胜 / O 胜 / 和棋 */
public enum Outcome {
    /** 对局进行中（尚未分出胜负） */
    ONGOING,
    /** 玩家（X）胜利 */
    X_WIN,
    /** 电脑（O）胜利 */
    O_WIN,
    /** 平局 */
    DRAW;

    /**
     * 根据标记判断胜方。
     *
     * @param mark X 或 O
     * @return X 返回 {@link #X_WIN}，O 返回 {@link #O_WIN}
     */
    public static Outcome winOf(Mark mark) {
        return (mark == Mark.X) ? X_WIN : O_WIN;
    }
}

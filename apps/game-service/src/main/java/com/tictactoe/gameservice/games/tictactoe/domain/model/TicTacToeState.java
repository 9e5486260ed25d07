package com.tictactoe.gameservice.games.tictactoe.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 对局状态（不可变值对象）。
 * 作用：一盘棋的"单一事实来源"（棋盘、轮到谁、状态、赢家、三连线、难度）。
 * 设计说明
 * - 本类不做规则校验，只承载数据；所有变更走 rule 包的 TicTacToeRules.applyMove，
 *   每次返回新实例，调用方持有旧实例不会被改动。
 * - winner / winningLine 只在 WON 时非空。
 * - 引擎不保存任何状态：状态由会话存储持有，每次调用传入、返回新值。
 */
@Getter
@ToString
@EqualsAndHashCode
public final class TicTacToeState {

    private final Board board;

    /** 当前轮到谁：X（玩家）或 O（电脑） */
    private final Mark turn;

    private final GameStatus status;

    /** 赢家：X 或 O；未分胜负为 null */
    private final Mark winner;

    /** 获胜三连（恰好 3 个坐标，按检测顺序）；未分胜负为 null */
    private final List<Position> winningLine;

    private final Difficulty difficulty;

    public TicTacToeState(Board board, Mark turn, GameStatus status, Mark winner,
                          List<Position> winningLine, Difficulty difficulty) {
        this.board = board;
        this.turn = turn;
        this.status = status;
        this.winner = winner;
        this.winningLine = winningLine == null ? null : List.copyOf(winningLine);
        this.difficulty = difficulty;
    }

    /** 新开一盘：空棋盘、玩家先手、进行中 */
    public static TicTacToeState fresh(Difficulty difficulty) {
        return new TicTacToeState(Board.empty(), Mark.X, GameStatus.PLAYING, null, null, difficulty);
    }

    public boolean isOver() {
        return status.isTerminal();
    }
}

package com.tictactoe.gameservice.games.tictactoe.domain.rule;

import com.tictactoe.gameservice.games.tictactoe.domain.model.Board;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Mark;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Position;

import java.util.List;

/**
 * 核心规则判断
 * 井字棋胜负判定：只包含纯判断逻辑（三连、满盘、结果），不改动棋盘。
 */
public final class TicTacToeJudge {

    /**
     * 8 条线，顺序固定：row0, row1, row2, col0, col1, col2, 主对角, 反对角。
     * 同时出现多条三连时，报告的是最先扫描到的那条。
     */
    public static final List<List<Position>> LINES = List.of(
            line(0, 0, 0, 1, 0, 2),
            line(1, 0, 1, 1, 1, 2),
            line(2, 0, 2, 1, 2, 2),
            line(0, 0, 1, 0, 2, 0),
            line(0, 1, 1, 1, 2, 1),
            line(0, 2, 1, 2, 2, 2),
            line(0, 0, 1, 1, 2, 2),
            line(0, 2, 1, 1, 2, 0)
    );

    private TicTacToeJudge() {}

    /**
     * 按固定顺序扫描，返回第一条被同一方占满的线。
     * @return 获胜线；没有则 null
     */
    public static List<Position> findWinningLine(Board b) {
        for (List<Position> line : LINES) {
            if (ownerOf(b, line) != null) return line;
        }
        return null;
    }

    /**
     * 某条线是否被同一方占满。
     * @return 占满该线的标记（X/O）；否则 null
     */
    public static Mark ownerOf(Board b, List<Position> line) {
        Mark first = b.get(line.get(0));
        if (first == Mark.EMPTY) return null;
        for (int i = 1; i < line.size(); i++) {
            if (b.get(line.get(i)) != first) return null;
        }
        return first;
    }

    /** 是否为 8 条线之一（按坐标顺序完全一致） */
    public static boolean isLine(List<Position> candidate) {
        return LINES.contains(candidate);
    }

    /** 是否有任意一方三连 */
    public static boolean hasAnyLine(Board b) {
        return findWinningLine(b) != null;
    }

    /** 棋盘是否已满（用于和棋判断） */
    public static boolean isFull(Board b) {
        return b.isFull();
    }

    /**
     * 根据当前局面给出结果：先看三连，再看满盘。
     */
    public static Outcome outcome(Board b) {
        List<Position> line = findWinningLine(b);
        if (line != null) {
            return Outcome.winOf(b.get(line.get(0)));
        }
        if (isFull(b)) {
            return Outcome.DRAW;
        }
        return Outcome.ONGOING;
    }

    /**
     * side 在 (row,col) 落子后是否立即三连（不改动 b）。
     * 要求该格为空。
     */
    public static boolean wouldWin(Board b, int row, int col, Mark side) {
        Board next = b.with(row, col, side);
        for (List<Position> line : LINES) {
            if (line.contains(new Position(row, col)) && ownerOf(next, line) == side) return true;
        }
        return false;
    }

    private static List<Position> line(int r0, int c0, int r1, int c1, int r2, int c2) {
        return List.of(new Position(r0, c0), new Position(r1, c1), new Position(r2, c2));
    }
}

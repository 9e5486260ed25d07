package com.tictactoe.gameservice.games.tictactoe.domain.ai;

import com.tictactoe.gameservice.games.tictactoe.domain.model.Board;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Mark;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Position;
import com.tictactoe.gameservice.games.tictactoe.domain.rule.Outcome;
import com.tictactoe.gameservice.games.tictactoe.domain.rule.TicTacToeJudge;

import java.util.List;

/**
 * 完整博弈树搜索（3x3 最多 9 层，直接搜到终局，不需要评估函数/深度截断）。
 * 评分站在 me（极大方）的视角：
 *   me 胜      = +10 - depth（越快赢越好）
 *   对方胜     = -10 + depth（越晚输越好）
 *   和棋       = 0
 * depth 为距搜索根的步数。着法按行优先枚举，同分取先枚举到的那步。
 *
 * α-β 剪枝版本与朴素版本选出的着法完全一致，剪枝只影响速度。
 */
public final class Minimax {

    /** 胜局基础分 */
    public static final int WIN_SCORE = 10;

    private Minimax() {}

    /**
     * α-β 剪枝搜索，返回 me 的最佳落点。
     * @param board 非终局棋盘（至少一个空格、无三连）
     * @param me    当前执子方（极大方）
     */
    public static Position bestMove(Board board, Mark me) {
        requireSearchable(board);
        Position best = null;
        int bestScore = Integer.MIN_VALUE;
        int alpha = Integer.MIN_VALUE;
        for (Position p : board.emptyPositions()) {
            Board child = board.with(p.row(), p.col(), me);
            // 根节点 beta 恒为 +∞：分数 <= alpha 的着法不可能严格超过当前最优
            int score = alphaBeta(child, 1, false, alpha, Integer.MAX_VALUE, me);
            if (score > bestScore) {
                bestScore = score;
                best = p;
            }
            if (bestScore > alpha) alpha = bestScore;
        }
        return best;
    }

    /**
     * 朴素 minimax（不剪枝），与 {@link #bestMove} 做等价校验用。
     */
    public static Position bestMovePlain(Board board, Mark me) {
        requireSearchable(board);
        Position best = null;
        int bestScore = Integer.MIN_VALUE;
        for (Position p : board.emptyPositions()) {
            int score = plain(board.with(p.row(), p.col(), me), 1, false, me);
            if (score > bestScore) {
                bestScore = score;
                best = p;
            }
        }
        return best;
    }

    /**
     * 朴素 minimax 的精确分值（站在 me 视角，me 即将落子）。
     */
    public static int score(Board board, Mark me) {
        return plain(board, 0, true, me);
    }

    /** α-β 剪枝（fail-soft）。maximizing=true 表示轮到 me */
    static int alphaBeta(Board b, int depth, boolean maximizing, int alpha, int beta, Mark me) {
        Integer terminal = terminalScore(b, depth, me);
        if (terminal != null) return terminal;

        Mark side = maximizing ? me : me.opponent();
        int best = maximizing ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        for (Position p : b.emptyPositions()) {
            int val = alphaBeta(b.with(p.row(), p.col(), side), depth + 1, !maximizing, alpha, beta, me);
            if (maximizing) {
                if (val > best) best = val;
                if (best > alpha) alpha = best;
            } else {
                if (val < best) best = val;
                if (best < beta) beta = best;
            }
            if (alpha >= beta) break; // 剪枝
        }
        return best;
    }

    static int plain(Board b, int depth, boolean maximizing, Mark me) {
        Integer terminal = terminalScore(b, depth, me);
        if (terminal != null) return terminal;

        Mark side = maximizing ? me : me.opponent();
        int best = maximizing ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        for (Position p : b.emptyPositions()) {
            int val = plain(b.with(p.row(), p.col(), side), depth + 1, !maximizing, me);
            best = maximizing ? Math.max(best, val) : Math.min(best, val);
        }
        return best;
    }

    /** 终局分；非终局返回 null */
    private static Integer terminalScore(Board b, int depth, Mark me) {
        Outcome oc = TicTacToeJudge.outcome(b);
        switch (oc) {
            case ONGOING:
                return null;
            case DRAW:
                return 0;
            default:
                return oc == Outcome.winOf(me) ? WIN_SCORE - depth : -WIN_SCORE + depth;
        }
    }

    private static void requireSearchable(Board board) {
        List<Position> empties = board.emptyPositions();
        if (empties.isEmpty() || TicTacToeJudge.hasAnyLine(board)) {
            throw new IllegalArgumentException("终局棋盘无法搜索: " + board);
        }
    }
}

package com.tictactoe.gameservice.games.tictactoe.domain.ai;

import com.tictactoe.gameservice.games.tictactoe.domain.model.Board;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Mark;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Position;
import com.tictactoe.gameservice.games.tictactoe.domain.model.TicTacToeState;
import com.tictactoe.gameservice.games.tictactoe.domain.rule.TicTacToeJudge;
import com.tictactoe.gameservice.games.tictactoe.domain.rule.TicTacToeRules;

import java.util.List;
import java.util.Random;

/**
 * TicTacToeAI：按难度分派到三个纯函数，签名统一为 (state) -> (row,col)。
 * 1) EASY   ：80% 纯随机；其余 20% 若对方下一手能三连则堵住其中一个点，否则仍随机
 * 2) MEDIUM ：赢 > 堵 > 中心 > 角（固定扫描顺序）> 其余（行优先），完全确定
 * 3) HARD   ：完整 minimax + α-β 剪枝（见 Minimax）
 * AI 的执子方取 state.turn；随机源由调用方传入，测试时可固定种子。
 */
public final class TicTacToeAI {

    /** EASY 档尝试防守的概率（其余时间纯随机） */
    public static final double EASY_BLOCK_CHANCE = 0.2;

    /** 中心 */
    public static final Position CENTER = new Position(1, 1);

    /** 四角，按扫描顺序 */
    public static final List<Position> CORNERS = List.of(
            new Position(0, 0), new Position(0, 2), new Position(2, 0), new Position(2, 2));

    private TicTacToeAI() {}

    /**
     * 为 state.turn 选一步棋。
     * @param state  进行中的对局
     * @param random 随机源（仅 EASY 使用）
     * @return legalMoves(state) 中的一个坐标
     * @throws IllegalArgumentException 对局已结束（没有合法着法）
     */
    public static Position chooseMove(TicTacToeState state, Random random) {
        if (TicTacToeRules.legalMoves(state).isEmpty()) {
            throw new IllegalArgumentException("对局已结束，没有可选着法");
        }
        switch (state.getDifficulty()) {
            case EASY:
                return easyMove(state, random);
            case MEDIUM:
                return mediumMove(state);
            case HARD:
                return hardMove(state);
            default:
                throw new IllegalArgumentException("未知难度: " + state.getDifficulty());
        }
    }

    /** EASY：大部分时间随机，偶尔堵一手（只堵一个威胁，不保证堵全） */
    static Position easyMove(TicTacToeState state, Random random) {
        List<Position> legal = TicTacToeRules.legalMoves(state);
        if (random.nextDouble() < EASY_BLOCK_CHANCE) {
            Position block = findWinningMove(state.getBoard(), state.getTurn().opponent());
            if (block != null) return block;
        }
        return legal.get(random.nextInt(legal.size()));
    }

    /** MEDIUM：固定优先级链，自上而下第一个命中即返回 */
    static Position mediumMove(TicTacToeState state) {
        Board b = state.getBoard();
        Mark me = state.getTurn();

        // 1) 我方一步即胜
        Position win = findWinningMove(b, me);
        if (win != null) return win;

        // 2) 对方一步即胜（先堵）
        Position block = findWinningMove(b, me.opponent());
        if (block != null) return block;

        // 3) 中心
        if (b.isEmpty(CENTER.row(), CENTER.col())) return CENTER;

        // 4) 角
        for (Position p : CORNERS) {
            if (b.isEmpty(p.row(), p.col())) return p;
        }

        // 5) 其余空格，行优先
        return b.emptyPositions().get(0);
    }

    /** HARD：完整搜索 */
    static Position hardMove(TicTacToeState state) {
        return Minimax.bestMove(state.getBoard(), state.getTurn());
    }

    /**
     * 行优先找 side 一步即可三连的空格。
     * @return 第一个这样的格子；没有则 null
     */
    static Position findWinningMove(Board b, Mark side) {
        for (Position p : b.emptyPositions()) {
            if (TicTacToeJudge.wouldWin(b, p.row(), p.col(), side)) {
                return p;
            }
        }
        return null;
    }
}

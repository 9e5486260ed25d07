package com.tictactoe.gameservice.games.tictactoe.domain.rule;

import com.tictactoe.gameservice.games.tictactoe.domain.constants.GameMessages;
import com.tictactoe.gameservice.games.tictactoe.domain.exception.InvalidMoveException;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Board;
import com.tictactoe.gameservice.games.tictactoe.domain.model.GameStatus;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Mark;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Position;
import com.tictactoe.gameservice.games.tictactoe.domain.model.TicTacToeState;

import java.util.List;

/**
 * 规则引擎：落子合法性 + 应用落子 + 合法着法枚举。
 * 纯函数，不持有状态：输入一个状态，输出一个新状态，输入对象保持不变。
 */
public final class TicTacToeRules {

    private TicTacToeRules() {}

    /**
     * 应用一步棋。
     * 校验顺序：对局已结束 → 坐标越界 → 格子已占 → 未轮到该方；全部校验通过后才生成新状态。
     *
     * @return 新状态：落子、切换执子方、重新计算状态/赢家/三连
     * @throws InvalidMoveException 任一校验不通过
     */
    public static TicTacToeState applyMove(TicTacToeState state, int row, int col, Mark mark) {
        if (state.getStatus() != GameStatus.PLAYING) {
            throw new InvalidMoveException(GameMessages.GAME_ALREADY_OVER);
        }
        if (!Board.inBounds(row, col)) {
            throw new InvalidMoveException(GameMessages.OUT_OF_BOARD);
        }
        if (!state.getBoard().isEmpty(row, col)) {
            throw new InvalidMoveException(GameMessages.CELL_OCCUPIED);
        }
        if (mark != state.getTurn()) {
            throw new InvalidMoveException(GameMessages.formatNotYourTurn(state.getTurn()));
        }

        Board next = state.getBoard().with(row, col, mark);
        return settle(next, mark.opponent(), state);
    }

    /**
     * 所有空格，行优先；对局已结束时返回空列表。
     */
    public static List<Position> legalMoves(TicTacToeState state) {
        if (state.getStatus() != GameStatus.PLAYING) {
            return List.of();
        }
        return state.getBoard().emptyPositions();
    }

    /** 根据棋盘重新计算状态/赢家/三连，难度沿用 prev */
    private static TicTacToeState settle(Board board, Mark nextTurn, TicTacToeState prev) {
        List<Position> line = TicTacToeJudge.findWinningLine(board);
        if (line != null) {
            return new TicTacToeState(board, nextTurn, GameStatus.WON, board.get(line.get(0)), line,
                    prev.getDifficulty());
        }
        GameStatus status = board.isFull() ? GameStatus.DRAW : GameStatus.PLAYING;
        return new TicTacToeState(board, nextTurn, status, null, null, prev.getDifficulty());
    }
}

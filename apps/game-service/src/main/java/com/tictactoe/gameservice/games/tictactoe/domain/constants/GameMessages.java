package com.tictactoe.gameservice.games.tictactoe.domain.constants;

import com.tictactoe.gameservice.games.tictactoe.domain.model.Mark;
import com.tictactoe.gameservice.games.tictactoe.domain.model.TicTacToeState;

/**
 * 井字棋相关的消息常量
 * 统一管理所有用户可见的提示消息，避免硬编码
 *
 * 使用示例：
 *   throw new InvalidMoveException(GameMessages.CELL_OCCUPIED);
 *   String msg = GameMessages.describe(state);
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 对局状态消息 ==========

    /** 轮到玩家 */
    public static final String YOUR_TURN = "轮到你了，点击空格落子";

    /** 轮到电脑 */
    public static final String COMPUTER_TURN = "电脑思考中...";

    /** 玩家获胜 */
    public static final String YOU_WON = "你赢了！恭喜！";

    /** 电脑获胜 */
    public static final String COMPUTER_WON = "电脑赢了！再来一局吧！";

    /** 平局 */
    public static final String DRAW = "平局！好棋！";

    /** 新局已开始 */
    public static final String GAME_STARTED = "新的一局开始了";

    /** 已退出对局 */
    public static final String GAME_QUIT = "对局已结束";

    /**
     * 当前局面的提示语
     * @param state 对局状态
     * @return 面向用户的提示
     */
    public static String describe(TicTacToeState state) {
        switch (state.getStatus()) {
            case WON:
                return state.getWinner() == Mark.X ? YOU_WON : COMPUTER_WON;
            case DRAW:
                return DRAW;
            default:
                return state.getTurn() == Mark.X ? YOUR_TURN : COMPUTER_TURN;
        }
    }

    // ========== 错误消息 ==========

    /** 对局已结束 */
    public static final String GAME_ALREADY_OVER = "对局已结束，请开始新的一局";

    /** 坐标越界 */
    public static final String OUT_OF_BOARD = "坐标必须在 0 到 2 之间";

    /** 格子已被占用 */
    public static final String CELL_OCCUPIED = "该位置已有棋子";

    /** 未轮到该方走棋 */
    public static final String NOT_YOUR_TURN = "未轮到该方走棋（当前应为 %s）";

    /** 未轮到电脑 */
    public static final String NOT_AI_TURN = "当前不是电脑的回合";

    /** 没有进行中的对局 */
    public static final String NO_ACTIVE_GAME = "当前没有对局，请先开始新游戏";

    /** 会话中的对局数据损坏 */
    public static final String GAME_SESSION_CORRUPTED = "对局数据已损坏，请开始新的一局";

    /** 请求参数缺失或格式不对 */
    public static final String INVALID_REQUEST = "请求参数不合法";

    /** 兜底错误 */
    public static final String UNEXPECTED_ERROR = "服务器开小差了，请稍后再试";

    /**
     * 格式化未轮到该方走棋消息
     */
    public static String formatNotYourTurn(Mark current) {
        return String.format(NOT_YOUR_TURN, current.symbol());
    }
}

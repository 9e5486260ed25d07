package com.tictactoe.gameservice.games.tictactoe.domain.dto;

import lombok.Data;

import java.util.List;

/**
 * GameStateRecord
 * -------------------------------------------------------
 * 一盘棋的传输/持久化形态（会话存储 Redis 与 HTTP 响应共用）。
 * - board 为 3 行 3 列，取值 "X" / "O" / ""；
 * - gameStatus 为 "playing" / "won" / "draw"；
 * - winningLine 形如 [[0,0],[1,1],[2,2]]，未分胜负为 null。
 * 与领域对象 TicTacToeState 的互转见 TicTacToeStateCodec。
 * -------------------------------------------------------
 */
@Data
public class GameStateRecord {
    /** 3x3 棋盘，行优先 */
    private List<List<String>> board;
    /** 当前执子："X"/"O" */
    private String currentPlayer;
    /** 对局状态："playing"/"won"/"draw" */
    private String gameStatus;
    /** 胜者："X"/"O"/null（未分胜负） */
    private String winner;
    /** 获胜三连坐标；未分胜负为 null */
    private List<List<Integer>> winningLine;
    /** AI 难度："easy"/"medium"/"hard" */
    private String difficulty;
}

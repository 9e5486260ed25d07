package com.tictactoe.gameservice.games.tictactoe.domain.model;

/**
 * 棋盘坐标 (row, col)，合法范围 0..2。
 * 不在构造时校验范围：越界坐标由规则层判定为非法落子。
 */
public record Position(int row, int col) {

    public boolean inBounds() {
        return row >= 0 && row < Board.SIZE && col >= 0 && col < Board.SIZE;
    }
}

package com.tictactoe.gameservice.games.tictactoe.domain.model;

/**
 * 一步棋：在 (row,col) 落下 mark（X 或 O）。
 * 只在一次调用中存在，不持久化；应用后产出新的 TicTacToeState。
 */
public record Move(int row, int col, Mark mark) {

    public Position position() {
        return new Position(row, col);
    }
}

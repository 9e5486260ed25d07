package com.tictactoe.gameservice.games.tictactoe.domain.exception;

/**
 * 非法落子：格子已占、坐标越界、未轮到该方、或对局已结束。
 * 可恢复：调用方换一步重试即可，传入的状态不会被改动。
 */
public class InvalidMoveException extends IllegalArgumentException {

    public InvalidMoveException(String message) {
        super(message);
    }
}

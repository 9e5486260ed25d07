package com.tictactoe.gameservice.games.tictactoe.domain.exception;

/**
 * 请求 AI 落子时不是 AI 的回合（或对局已结束）。属于调用方错误，状态不变。
 */
public class NotAiTurnException extends IllegalStateException {

    public NotAiTurnException(String message) {
        super(message);
    }
}

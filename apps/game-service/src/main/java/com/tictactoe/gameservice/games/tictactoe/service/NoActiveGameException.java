package com.tictactoe.gameservice.games.tictactoe.service;

import com.tictactoe.gameservice.games.tictactoe.domain.constants.GameMessages;

/**
 * 当前会话没有对局（从未开局、已退出或已过期）。
 */
public class NoActiveGameException extends RuntimeException {

    public NoActiveGameException() {
        super(GameMessages.NO_ACTIVE_GAME);
    }
}

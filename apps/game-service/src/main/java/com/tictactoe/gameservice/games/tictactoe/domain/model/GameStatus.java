package com.tictactoe.gameservice.games.tictactoe.domain.model;

/**
 * 对局状态：PLAYING -> WON / DRAW，后两者为终局，不可再落子。
 */
public enum GameStatus {
    /** 进行中 */
    PLAYING("playing"),
    /** 一方三连获胜 */
    WON("won"),
    /** 平局：棋盘下满且无三连 */
    DRAW("draw");

    private final String wireValue;

    GameStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this != PLAYING;
    }

    public static GameStatus fromWireValue(String value) {
        for (GameStatus s : values()) {
            if (s.wireValue.equals(value)) return s;
        }
        return null;
    }
}

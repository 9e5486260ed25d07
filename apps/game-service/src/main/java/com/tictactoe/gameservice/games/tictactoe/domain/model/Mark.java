package com.tictactoe.gameservice.games.tictactoe.domain.model;

/**
 * 格子上的标记。
 * 约定：X 为玩家（先手），O 为电脑（后手），EMPTY 为空格。
 * symbol 是对外传输/存储时使用的字符串形式。
 */
public enum Mark {
    /** 空格 */
    EMPTY(""),
    /** 玩家 */
    X("X"),
    /** 电脑 */
    O("O");

    private final String symbol;

    Mark(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /** 对手的标记；EMPTY 没有对手 */
    public Mark opponent() {
        switch (this) {
            case X: return O;
            case O: return X;
            default: throw new IllegalStateException("EMPTY has no opponent");
        }
    }

    /**
     * 按 symbol 解析，大小写严格（"X"/"O"/""）。
     * @return 对应标记；无法识别返回 null，由调用方决定如何报错
     */
    public static Mark fromSymbol(String symbol) {
        if (symbol == null) return null;
        for (Mark m : values()) {
            if (m.symbol.equals(symbol)) return m;
        }
        return null;
    }
}

package com.tictactoe.gameservice.games.tictactoe.domain.model;

import java.util.Locale;

/**
 * AI 难度：
 * EASY   随机为主，偶尔堵一手；
 * MEDIUM 固定优先级（赢 > 堵 > 中心 > 角 > 其余）；
 * HARD   完整 minimax + α-β 剪枝，不会输。
 */
public enum Difficulty {
    EASY("easy"),
    MEDIUM("medium"),
    HARD("hard");

    private final String wireValue;

    Difficulty(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /** 严格解析（存储层用）：必须是小写 wire 值 */
    public static Difficulty fromWireValue(String value) {
        for (Difficulty d : values()) {
            if (d.wireValue.equals(value)) return d;
        }
        return null;
    }

    /**
     * 宽松解析（接口层用）：去首尾空白、忽略大小写。
     * @throws IllegalArgumentException 无法识别的难度
     */
    public static Difficulty parse(String value) {
        if (value != null) {
            Difficulty d = fromWireValue(value.trim().toLowerCase(Locale.ROOT));
            if (d != null) return d;
        }
        throw new IllegalArgumentException("无效的难度：" + value + "，可选值为 easy / medium / hard");
    }
}

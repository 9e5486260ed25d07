package com.tictactoe.gameservice.games.tictactoe.domain.exception;

/**
 * 反序列化得到的状态不满足数据模型约束（尺寸、标记值、状态/赢家/三连组合、X/O 数量差）。
 * 相同输入重试没有意义，调用方需要提供合法状态或开新局。
 */
public class MalformedStateException extends IllegalArgumentException {

    public MalformedStateException(String message) {
        super(message);
    }
}

package com.tictactoe.gameservice.games.tictactoe.interfaces.http.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 落子请求体。坐标范围（0..2）由规则层校验。
 */
@Data
public class MoveRequest {
    @NotNull(message = "row 不能为空")
    private Integer row;
    @NotNull(message = "col 不能为空")
    private Integer col;
}

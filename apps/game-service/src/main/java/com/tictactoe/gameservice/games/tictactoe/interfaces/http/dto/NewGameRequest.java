package com.tictactoe.gameservice.games.tictactoe.interfaces.http.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 新开/重开对局请求体（可省略）
 */
@Data
public class NewGameRequest {
    /** easy / medium / hard，忽略大小写；为空时取默认/当前难度 */
    @Size(max = 16)
    private String difficulty;
}

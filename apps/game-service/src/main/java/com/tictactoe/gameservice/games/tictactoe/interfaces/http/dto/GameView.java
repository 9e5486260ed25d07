package com.tictactoe.gameservice.games.tictactoe.interfaces.http.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tictactoe.gameservice.games.tictactoe.domain.dto.GameStateRecord;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 对局视图：返回给前端的数据部分（提示语放在 ApiResponse.message）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GameView {
    /** 编码后的对局状态 */
    private GameStateRecord game;
    /** 是否已终局 */
    private boolean gameOver;
    /** 电脑本次的落点 [row, col]；本次没有电脑落子时不输出 */
    private List<Integer> aiMove;
}

package com.tictactoe.gameservice.games.tictactoe.config;

import com.tictactoe.gameservice.games.tictactoe.domain.TicTacToeEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * 井字棋引擎装配：按配置决定 EASY 档随机源是否固定种子。
 */
@Slf4j
@Configuration
public class TicTacToeEngineConfig {

    @Bean
    public TicTacToeEngine ticTacToeEngine(TicTacToeProperties props) {
        Long seed = props.getAi().getSeed();
        if (seed != null) {
            log.info("EASY 档随机源使用固定种子: {}", seed);
            return new TicTacToeEngine(new Random(seed));
        }
        return new TicTacToeEngine(new Random());
    }
}

package com.tictactoe.gameservice.games.tictactoe.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 井字棋服务相关配置。
 *
 * 支持通过 application.yml 或环境变量覆盖，例如 TICTACTOE_SESSION_TTL=30m。
 */
@Component
@ConfigurationProperties(prefix = "tictactoe")
public class TicTacToeProperties {

    /**
     * 会话对局在 Redis 中的存活时间，每次落子后重新计时
     */
    private Duration sessionTtl = Duration.ofHours(2);

    /**
     * 未指定难度时使用的默认难度（easy / medium / hard）
     */
    private String defaultDifficulty = "medium";

    private final Ai ai = new Ai();

    public Duration getSessionTtl() {
        return sessionTtl;
    }

    public void setSessionTtl(Duration sessionTtl) {
        this.sessionTtl = sessionTtl;
    }

    public String getDefaultDifficulty() {
        return defaultDifficulty;
    }

    public void setDefaultDifficulty(String defaultDifficulty) {
        this.defaultDifficulty = defaultDifficulty;
    }

    public Ai getAi() {
        return ai;
    }

    public static class Ai {

        /**
         * EASY 档随机源的种子；为空时每次启动随机
         */
        private Long seed;

        public Long getSeed() {
            return seed;
        }

        public void setSeed(Long seed) {
            this.seed = seed;
        }
    }
}

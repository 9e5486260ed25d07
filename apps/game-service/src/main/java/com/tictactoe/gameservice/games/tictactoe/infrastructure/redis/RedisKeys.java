package com.tictactoe.gameservice.games.tictactoe.infrastructure.redis;

/**
 * 统一集中管理 Redis Key 的前缀与拼接，避免字符串散落。
 */
public final class RedisKeys {

    private static final String PFX = "tictactoe:";

    private RedisKeys() {}

    // ---- 会话当前对局 ----
    public static String sessionGame(String sessionId) {
        return PFX + "session:" + sessionId + ":game";
    }
}

package com.tictactoe.gameservice.games.tictactoe.domain.repository;

import com.tictactoe.gameservice.games.tictactoe.domain.dto.GameStateRecord;

import java.time.Duration;
import java.util.Optional;

/**
 * GameStateRepository
 * ----------------------------------------
 * 会话对局状态仓储接口
 * - 一个会话最多一盘进行中的棋，键为会话 ID；
 * - 存的是编码后的 GameStateRecord，领域层不感知存储介质；
 * - 当前实现基于 Redis。
 * ----------------------------------------
 */
public interface GameStateRepository {

    /**
     * 保存对局状态（覆盖写，并刷新 TTL）
     * @param sessionId 会话ID
     * @param state     对局状态
     * @param ttl       过期时间
     */
    void save(String sessionId, GameStateRecord state, Duration ttl);

    /**
     * 获取对局状态
     * @param sessionId 会话ID
     * @return 可选的 GameStateRecord（不存在则 empty）
     */
    Optional<GameStateRecord> get(String sessionId);

    /**
     * 删除对局状态
     * @param sessionId 会话ID
     * @return 是否存在并被删除
     */
    boolean delete(String sessionId);
}

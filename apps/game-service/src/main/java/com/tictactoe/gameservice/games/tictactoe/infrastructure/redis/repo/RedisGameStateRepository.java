package com.tictactoe.gameservice.games.tictactoe.infrastructure.redis.repo;

import com.tictactoe.gameservice.games.tictactoe.domain.dto.GameStateRecord;
import com.tictactoe.gameservice.games.tictactoe.domain.repository.GameStateRepository;
import com.tictactoe.gameservice.games.tictactoe.infrastructure.redis.RedisKeys;
import com.tictactoe.gameservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Optional;

/**
 * RedisGameStateRepository
 * -------------------------------------------------------
 * 会话对局状态的 Redis 仓储实现。
 * - 存取对象：GameStateRecord（JSON）；
 * - 每次保存都会刷新 TTL，长时间不操作的会话自动过期。
 */
@Repository
@RequiredArgsConstructor
public class RedisGameStateRepository implements GameStateRepository {

    private final RedisOps ops;

    /**
     * 保存对局状态（JSON 存储，带 TTL）
     */
    @Override
    public void save(String sessionId, GameStateRecord state, Duration ttl) {
        ops.setEx(RedisKeys.sessionGame(sessionId), state, ttl);
    }

    /**
     * 获取对局状态
     */
    @Override
    public Optional<GameStateRecord> get(String sessionId) {
        return Optional.ofNullable(ops.get(RedisKeys.sessionGame(sessionId), GameStateRecord.class));
    }

    /**
     * 删除对局状态
     */
    @Override
    public boolean delete(String sessionId) {
        return ops.del(RedisKeys.sessionGame(sessionId));
    }
}

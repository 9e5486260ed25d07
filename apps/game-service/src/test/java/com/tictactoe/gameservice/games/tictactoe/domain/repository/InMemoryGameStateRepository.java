package com.tictactoe.gameservice.games.tictactoe.domain.repository;

import com.tictactoe.gameservice.games.tictactoe.domain.dto.GameStateRecord;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 测试用内存仓储，记录最近一次写入的 TTL。
 */
public class InMemoryGameStateRepository implements GameStateRepository {

    private final Map<String, GameStateRecord> store = new HashMap<>();
    private Duration lastTtl;

    @Override
    public void save(String sessionId, GameStateRecord state, Duration ttl) {
        store.put(sessionId, state);
        lastTtl = ttl;
    }

    @Override
    public Optional<GameStateRecord> get(String sessionId) {
        return Optional.ofNullable(store.get(sessionId));
    }

    @Override
    public boolean delete(String sessionId) {
        return store.remove(sessionId) != null;
    }

    public Duration getLastTtl() {
        return lastTtl;
    }
}

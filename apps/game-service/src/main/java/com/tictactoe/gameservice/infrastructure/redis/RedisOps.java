package com.tictactoe.gameservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 公用 Redis 工具类：
 * - 封装常用 String/Key/TTL 操作
 * - 仅提供"原语级"方法；业务键名放在 RedisKeys，业务语义放在 Repo 层
 */
@Component
@RequiredArgsConstructor
public class RedisOps {
    /** 通用对象模板：用于 JSON 存储与反序列化 */
    private final RedisTemplate<String, Object> redis;

    /**
     * 写入键值（带 TTL）
     */
    public boolean setEx(String key, Object val, Duration ttl) {
        redis.opsForValue().set(key, val, ttl);
        return true;
    }

    /**
     * 获取键值并转换为指定类型；类型不符（例如被别的程序写坏）时返回 null
     */
    public <T> T get(String key, Class<T> type) {
        Object v = redis.opsForValue().get(key);
        return type.isInstance(v) ? type.cast(v) : null;
    }

    /**
     * 删除 Key
     * @return 是否真的删除了
     */
    public boolean del(String key) {
        return Boolean.TRUE.equals(redis.delete(key));
    }
}

package com.tictactoe.gameservice.infrastructure.redis;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * RedisConfig
 * -------------------------------------------------------
 * 全局 Redis 连接与序列化配置类（通用基础设施层）
 * -------------------------------------------------------
 * Responsibilities:
 *  - 提供统一的 RedisTemplate Bean；
 *  - 配置序列化策略（Key: String，Value: JSON）；
 *  - 保证不同模块在操作 Redis 时行为一致。
 */
@Configuration
public class RedisConfig {

    /**
     * 通用 RedisTemplate（Key 为 String，Value 为任意对象，自动 JSON 序列化）
     * -------------------------------------------------------
     * Key 采用 StringRedisSerializer，保证键名可读；
     * Value 使用 GenericJackson2JsonRedisSerializer，
     *  可序列化任意对象并携带类型信息（反序列化时还原为原类型）。
     *
     * @param factory Spring Data Redis 提供的连接工厂（Lettuce）
     * @return RedisTemplate<String, Object> Bean
     */
    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory factory) {
        RedisTemplate<String, Object> tpl = new RedisTemplate<>();
        tpl.setConnectionFactory(factory);

        StringRedisSerializer keySer = new StringRedisSerializer();
        GenericJackson2JsonRedisSerializer valSer = new GenericJackson2JsonRedisSerializer();

        tpl.setKeySerializer(keySer);
        tpl.setValueSerializer(valSer);
        tpl.setHashKeySerializer(keySer);
        tpl.setHashValueSerializer(valSer);

        tpl.afterPropertiesSet();
        return tpl;
    }
}

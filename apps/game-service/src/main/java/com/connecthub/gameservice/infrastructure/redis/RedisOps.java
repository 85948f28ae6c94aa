package com.connecthub.gameservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 公用 Redis 原语封装：
 * - 只提供 String/Hash/ZSet/Key 的原语级方法；
 * - 业务键名由各自的 RedisKeys 组织，本类不感知业务。
 */
@Component
@RequiredArgsConstructor
public class RedisOps {
    /** 通用对象模板：JSON 存取 */
    private final RedisTemplate<String, Object> redis;

    // -------------- String --------------

    /**
     * 仅当不存在时写入（SETNX + TTL）
     * @return true 写入成功；false 键已存在
     */
    public boolean setNx(String key, Object val, Duration ttl) {
        Boolean ok = redis.opsForValue().setIfAbsent(key, val, ttl);
        return Boolean.TRUE.equals(ok);
    }

    /** 读取并按类型返回，类型不符时返回 null */
    public <T> T get(String key, Class<T> type) {
        Object v = redis.opsForValue().get(key);
        return type.isInstance(v) ? type.cast(v) : null;
    }

    // -------------- Hash --------------

    public void hSet(String key, String field, Object val) {
        redis.opsForHash().put(key, field, val);
    }

    /**
     * 仅当字段不存在时写入（HSETNX）
     * @return true 写入成功
     */
    public boolean hSetNx(String key, String field, Object val) {
        return Boolean.TRUE.equals(redis.opsForHash().putIfAbsent(key, field, val));
    }

    public <T> T hGet(String key, String field, Class<T> type) {
        Object v = redis.opsForHash().get(key, field);
        return type.isInstance(v) ? type.cast(v) : null;
    }

    /** 获取整个 Hash */
    public Map<String, Object> hGetAll(String key) {
        Map<Object, Object> raw = redis.opsForHash().entries(key);
        Map<String, Object> out = new HashMap<>();
        raw.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    /** Hash 字段整数自增，返回新值 */
    public Long hIncrBy(String key, String field, long delta) {
        return redis.opsForHash().increment(key, field, delta);
    }

    // -------------- ZSet --------------

    public Boolean zAdd(String key, String member, double score) {
        return redis.opsForZSet().add(key, member, score);
    }

    /** 按分数从高到低取 [0, limit) 的成员 */
    public Set<String> zRevRange(String key, int limit) {
        Set<Object> raw = redis.opsForZSet().reverseRange(key, 0, Math.max(0, limit - 1));
        if (raw == null || raw.isEmpty()) return Collections.emptySet();
        Set<String> out = new LinkedHashSet<>();
        raw.forEach(m -> out.add(String.valueOf(m)));
        return out;
    }
}

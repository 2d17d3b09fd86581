package com.portfoliotrader.repository.redis;

import com.portfoliotrader.config.RedisConfig;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Persisted strategy variables for warm restart, one hash field per strategy name.
 *
 * <p>Values are string-keyed maps of primitives, with nested maps for positions and targets.
 */
@Repository
@RequiredArgsConstructor
public class StrategyDataRedisRepository {

    private final RedisTemplate<String, Object> redisTemplate;

    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> findByName(String strategyName) {
        Object value = redisTemplate.opsForHash().get(RedisConfig.KEY_STRATEGY_DATA, strategyName);
        if (value instanceof Map<?, ?> data) {
            return Optional.of(new LinkedHashMap<>((Map<String, Object>) data));
        }
        return Optional.empty();
    }

    public void save(String strategyName, Map<String, Object> variables) {
        redisTemplate.opsForHash().put(RedisConfig.KEY_STRATEGY_DATA, strategyName, variables);
    }

    public void delete(String strategyName) {
        redisTemplate.opsForHash().delete(RedisConfig.KEY_STRATEGY_DATA, strategyName);
    }
}

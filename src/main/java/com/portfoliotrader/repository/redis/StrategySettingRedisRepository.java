package com.portfoliotrader.repository.redis;

import com.portfoliotrader.config.RedisConfig;
import com.portfoliotrader.domain.model.StrategySetting;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Strategy roster: one hash field per strategy name holding its {@link StrategySetting}.
 * Read once at startup to rebuild every strategy.
 */
@Repository
@RequiredArgsConstructor
public class StrategySettingRedisRepository {

    private final RedisTemplate<String, Object> redisTemplate;

    public Map<String, StrategySetting> findAll() {
        Map<Object, Object> entries = redisTemplate.opsForHash().entries(RedisConfig.KEY_STRATEGY_SETTINGS);
        Map<String, StrategySetting> settings = new LinkedHashMap<>();
        entries.forEach((name, setting) -> settings.put((String) name, (StrategySetting) setting));
        return settings;
    }

    public void save(String strategyName, StrategySetting setting) {
        redisTemplate.opsForHash().put(RedisConfig.KEY_STRATEGY_SETTINGS, strategyName, setting);
    }

    public void delete(String strategyName) {
        redisTemplate.opsForHash().delete(RedisConfig.KEY_STRATEGY_SETTINGS, strategyName);
    }
}

package com.portfoliotrader.config;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializer;

/**
 * Redis holds the strategy roster and the persisted strategy variables, each as one hash keyed
 * by strategy name:
 * <pre>
 *   pt:strategy:settings  strategy name → StrategySetting (class, instruments, parameters)
 *   pt:strategy:data      strategy name → variables map, restored on the next init
 * </pre>
 *
 * <p>Values are typed JSON so a variables map keeps its numeric and date values across restarts.
 */
@Configuration
public class RedisConfig {

    /** Namespace of this application on a shared Redis server. */
    public static final String KEY_PREFIX = "pt:";

    public static final String KEY_STRATEGY_SETTINGS = KEY_PREFIX + "strategy:settings";
    public static final String KEY_STRATEGY_DATA = KEY_PREFIX + "strategy:data";

    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory redisConnectionFactory) {
        GenericJackson2JsonRedisSerializer valueSerializer = new GenericJackson2JsonRedisSerializer()
                .configure(objectMapper -> objectMapper
                        .registerModule(new JavaTimeModule())
                        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));

        RedisTemplate<String, Object> template = new RedisTemplate<>();
        template.setConnectionFactory(redisConnectionFactory);
        template.setKeySerializer(RedisSerializer.string());
        template.setHashKeySerializer(RedisSerializer.string());
        template.setValueSerializer(valueSerializer);
        template.setHashValueSerializer(valueSerializer);
        return template;
    }
}

package com.sessiongate.backend.global.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Session markers are plain string keys and values, so the store only needs
 * a {@link StringRedisTemplate}. Redis repositories stay disabled
 * ({@code spring.data.redis.repositories.enabled=false}) so Spring Data does not
 * try to bind the JPA repositories to Redis.
 */
@Configuration(proxyBeanMethods = false)
public class RedisConfig {

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }
}

package com.nifty.bulk.client.config;

import com.nifty.bulk.client.common.constants.StoreProperties;
import com.nifty.bulk.client.core.RedisStateStore;
import com.nifty.bulk.client.core.StateStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Shared profile store in Redis; host/port picked from spring.data.redis.* properties.
 */
@Configuration
@ConditionalOnProperty(name = "client.store.type", havingValue = "redis")
public class RedisConfig {

    @Bean
    public StringRedisTemplate stateRedisTemplate(RedisConnectionFactory cf) {
        return new StringRedisTemplate(cf);
    }

    @Bean
    public StateStore stateStore(StringRedisTemplate stateRedisTemplate, StoreProperties props) {
        return new RedisStateStore(stateRedisTemplate, props.getKeyPrefix());
    }
}

package com.intelmonitor.config;

import com.intelmonitor.alert.AlertDedupStore;
import com.intelmonitor.alert.InMemoryAlertDedupStore;
import com.intelmonitor.alert.RedisAlertDedupStore;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;

/**
 * Selects the alert dedup store from {@code intelmonitor.alert-scoring.dedup-store}.
 * In-memory is the default; Redis shares the window across engine instances.
 */
@Configuration
public class AlertDedupStoreConfig {

    @Bean
    @ConditionalOnProperty(
            prefix = "intelmonitor.alert-scoring",
            name = "dedup-store",
            havingValue = "memory",
            matchIfMissing = true)
    public AlertDedupStore inMemoryAlertDedupStore() {
        return new InMemoryAlertDedupStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "intelmonitor.alert-scoring", name = "dedup-store", havingValue = "redis")
    public AlertDedupStore redisAlertDedupStore(RedisTemplate<String, Object> redisTemplate, Clock clock) {
        return new RedisAlertDedupStore(redisTemplate, clock);
    }
}

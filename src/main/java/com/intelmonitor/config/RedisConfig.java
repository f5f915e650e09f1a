package com.intelmonitor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis template used by the distributed alert dedup store.
 *
 * <p>All keys are prefixed with "intel:" since the Redis server may be shared.
 *
 * <p>Key schema:
 * <pre>
 *   intel:alert:dedup:{monitorId}:{hash}  → "1" (TTL = dedup window)
 *   intel:alert:daily:{monitorId}:{date}  → counter (TTL 2 days)
 *   intel:alert:throttle:{monitorId}      → ISO timestamp of throttle horizon
 *   intel:alert:batched:{monitorId}       → "1" (TTL = medium-tier window)
 * </pre>
 */
@Configuration
public class RedisConfig {

    public static final String KEY_PREFIX = "intel:";

    public static final String KEY_PREFIX_ALERT_DEDUP = KEY_PREFIX + "alert:dedup:";
    public static final String KEY_PREFIX_ALERT_DAILY = KEY_PREFIX + "alert:daily:";
    public static final String KEY_PREFIX_ALERT_THROTTLE = KEY_PREFIX + "alert:throttle:";
    public static final String KEY_PREFIX_ALERT_BATCHED = KEY_PREFIX + "alert:batched:";

    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory redisConnectionFactory) {
        RedisTemplate<String, Object> redisTemplate = new RedisTemplate<>();
        redisTemplate.setConnectionFactory(redisConnectionFactory);

        StringRedisSerializer stringRedisSerializer = new StringRedisSerializer();
        GenericJackson2JsonRedisSerializer jsonRedisSerializer = new GenericJackson2JsonRedisSerializer();

        redisTemplate.setKeySerializer(stringRedisSerializer);
        redisTemplate.setValueSerializer(jsonRedisSerializer);
        redisTemplate.setHashKeySerializer(stringRedisSerializer);
        redisTemplate.setHashValueSerializer(jsonRedisSerializer);

        return redisTemplate;
    }
}

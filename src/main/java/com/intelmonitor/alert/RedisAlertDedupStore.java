package com.intelmonitor.alert;

import com.intelmonitor.config.RedisConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;

/**
 * Dedup store shared by all engine instances, backed by Redis keys with TTLs.
 *
 * <p>Expiry is delegated to Redis: a dedup key lives exactly until the alert's
 * throttle horizon, the daily counter for two days.
 */
public class RedisAlertDedupStore implements AlertDedupStore {

    private static final Logger log = LoggerFactory.getLogger(RedisAlertDedupStore.class);

    private static final Duration DAILY_COUNTER_TTL = Duration.ofDays(2);
    private static final Duration MIN_TTL = Duration.ofSeconds(1);

    private final RedisTemplate<String, Object> redisTemplate;
    private final Clock clock;

    public RedisAlertDedupStore(RedisTemplate<String, Object> redisTemplate, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
    }

    @Override
    public boolean isDuplicate(String monitorId, String contentHash, LocalDateTime now) {
        Boolean exists = redisTemplate.hasKey(dedupKey(monitorId, contentHash));
        return exists != null && exists;
    }

    @Override
    public int getDailyCount(String monitorId, LocalDate day) {
        Object value = redisTemplate.opsForValue().get(dailyKey(monitorId, day));
        if (value == null) {
            return 0;
        }
        return value instanceof Number number ? number.intValue() : Integer.parseInt(value.toString());
    }

    @Override
    public boolean isBatched(String monitorId, LocalDateTime now) {
        Boolean exists = redisTemplate.hasKey(RedisConfig.KEY_PREFIX_ALERT_BATCHED + monitorId);
        return exists != null && exists;
    }

    @Override
    public void recordSent(
            String monitorId, String contentHash, LocalDateTime expiresAt, LocalDate day, LocalDateTime now) {
        Duration ttl = ttl(now, expiresAt);
        redisTemplate.opsForValue().set(dedupKey(monitorId, contentHash), "1", ttl);

        String dailyKey = dailyKey(monitorId, day);
        redisTemplate.opsForValue().increment(dailyKey);
        redisTemplate.expire(dailyKey, DAILY_COUNTER_TTL);

        LocalDateTime current = getThrottleUntil(monitorId);
        if (current == null || expiresAt.isAfter(current)) {
            redisTemplate.opsForValue().set(RedisConfig.KEY_PREFIX_ALERT_THROTTLE + monitorId, expiresAt.toString(), ttl);
        }
        log.debug("Recorded delivered alert {} for monitor {} (ttl {})", contentHash, monitorId, ttl);
    }

    @Override
    public void markBatched(String monitorId, LocalDateTime until) {
        redisTemplate
                .opsForValue()
                .set(RedisConfig.KEY_PREFIX_ALERT_BATCHED + monitorId, "1", ttl(LocalDateTime.now(clock), until));
    }

    @Override
    public LocalDateTime getThrottleUntil(String monitorId) {
        Object value = redisTemplate.opsForValue().get(RedisConfig.KEY_PREFIX_ALERT_THROTTLE + monitorId);
        return value != null ? LocalDateTime.parse(value.toString()) : null;
    }

    @Override
    public int getActiveHashCount(String monitorId, LocalDateTime now) {
        // KEYS is acceptable here: statistics only, and the pattern is scoped to one monitor.
        Set<String> keys = redisTemplate.keys(RedisConfig.KEY_PREFIX_ALERT_DEDUP + monitorId + ":*");
        return keys != null ? keys.size() : 0;
    }

    @Override
    public void clear(String monitorId) {
        Set<String> keys = redisTemplate.keys(RedisConfig.KEY_PREFIX_ALERT_DEDUP + monitorId + ":*");
        if (keys != null && !keys.isEmpty()) {
            redisTemplate.delete(keys);
        }
        redisTemplate.delete(RedisConfig.KEY_PREFIX_ALERT_THROTTLE + monitorId);
        redisTemplate.delete(RedisConfig.KEY_PREFIX_ALERT_BATCHED + monitorId);
    }

    private static String dedupKey(String monitorId, String contentHash) {
        return RedisConfig.KEY_PREFIX_ALERT_DEDUP + monitorId + ":" + contentHash;
    }

    private static String dailyKey(String monitorId, LocalDate day) {
        return RedisConfig.KEY_PREFIX_ALERT_DAILY + monitorId + ":" + day;
    }

    private static Duration ttl(LocalDateTime now, LocalDateTime until) {
        Duration ttl = Duration.between(now, until);
        return ttl.compareTo(MIN_TTL) < 0 ? MIN_TTL : ttl;
    }
}

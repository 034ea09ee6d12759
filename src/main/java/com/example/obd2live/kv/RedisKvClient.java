package com.example.obd2live.kv;

import com.example.obd2live.config.Obd2Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.ReactiveSubscription;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

@Component
public class RedisKvClient implements KvClient {

    private static final Logger logger = LoggerFactory.getLogger(RedisKvClient.class);

    private final StringRedisTemplate redis;
    private final ReactiveStringRedisTemplate reactiveRedis;
    private final Obd2Properties properties;

    public RedisKvClient(StringRedisTemplate redis, ReactiveStringRedisTemplate reactiveRedis, Obd2Properties properties) {
        this.redis = redis;
        this.reactiveRedis = reactiveRedis;
        this.properties = properties;
    }

    static String liveKey(String sessionId) {
        return "session:" + sessionId + ":live";
    }

    static String channel(String sessionId) {
        return "session:" + sessionId + ":updates";
    }

    @Override
    public void cachePoint(String sessionId, long timestampMillis, String pointJson) {
        String key = liveKey(sessionId);
        int maxPoints = properties.getLive().getMaxCachedPoints();
        redis.opsForZSet().add(key, pointJson, timestampMillis);
        // keep only the newest maxPoints entries
        redis.opsForZSet().removeRange(key, 0, -(maxPoints + 1));
        redis.expire(key, properties.getLive().getCacheTtl());
    }

    @Override
    public void publish(String sessionId, String eventJson) {
        redis.convertAndSend(channel(sessionId), eventJson);
    }

    @Override
    public List<String> rangeSince(String sessionId, long sinceMillis, int limit) {
        Set<String> values = redis.opsForZSet()
                .rangeByScore(liveKey(sessionId), sinceMillis + 1, Double.POSITIVE_INFINITY, 0, limit);
        return values == null ? List.of() : new ArrayList<>(values);
    }

    @Override
    public Flux<String> subscribe(String sessionId) {
        return reactiveRedis.listenToChannel(channel(sessionId))
                .map(ReactiveSubscription.Message::getMessage);
    }

    @Override
    public boolean health() {
        try (RedisConnection conn = Objects.requireNonNull(redis.getConnectionFactory()).getConnection()) {
            return "PONG".equalsIgnoreCase(conn.ping());
        } catch (Exception e) {
            logger.warn("Redis health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void evict(String sessionId) {
        redis.delete(liveKey(sessionId));
    }
}

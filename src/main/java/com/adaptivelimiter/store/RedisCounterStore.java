package com.adaptivelimiter.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

// counter store backed by redis; every algorithm step is a server-side lua script
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "ratelimiter.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisCounterStore implements CounterStore {

    // string template so script arguments reach lua as plain numbers
    private final StringRedisTemplate redisTemplate;
    // compiled scripts, one per algorithm step
    private final Map<CounterScript, RedisScript<List<Object>>> scripts = new EnumMap<>(CounterScript.class);

    // loads every lua script from the classpath on startup
    @PostConstruct
    public void init() throws IOException {
        for (CounterScript script : CounterScript.values()) {
            ClassPathResource resource = new ClassPathResource(script.getResourcePath());
            String scriptContent = new String(
                resource.getInputStream().readAllBytes(),
                StandardCharsets.UTF_8
            );
            @SuppressWarnings("unchecked")
            RedisScript<List<Object>> compiled = (RedisScript<List<Object>>) (RedisScript<?>)
                RedisScript.of(scriptContent, List.class);
            scripts.put(script, compiled);
        }
        log.info("Loaded {} counter scripts for Redis", scripts.size());
    }

    @Override
    public List<Long> execute(CounterScript script, List<String> keys, List<String> args) {
        List<Object> result;
        try {
            // evalsha with fallback to eval, so the script is only sent once per connection
            result = redisTemplate.execute(scripts.get(script), keys, args.toArray());
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Redis script " + script + " failed", e);
        }
        if (result == null || result.isEmpty()) {
            throw new StoreUnavailableException("Empty response from Redis script " + script);
        }
        List<Long> values = new ArrayList<>(result.size());
        for (Object item : result) {
            if (!(item instanceof Number)) {
                throw new StoreUnavailableException("Unexpected reply from Redis script " + script + ": " + item);
            }
            values.add(((Number) item).longValue());
        }
        return values;
    }

    @Override
    public Map<String, String> getHash(String key) {
        try {
            Map<String, String> fields = redisTemplate.<String, String>opsForHash().entries(key);
            return fields != null ? fields : Map.of();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to read hash " + key, e);
        }
    }

    @Override
    public void putHash(String key, Map<String, String> fields, Duration ttl) {
        if (fields.isEmpty()) {
            return;
        }
        try {
            redisTemplate.opsForHash().putAll(key, fields);
            redisTemplate.expire(key, ttl);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to write hash " + key, e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to read " + key, e);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to write " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(key);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to delete " + key, e);
        }
    }

    @Override
    public long deleteByPrefix(String prefix) {
        try {
            Set<String> keys = redisTemplate.keys(escapeGlob(prefix) + "*");
            if (keys == null || keys.isEmpty()) {
                return 0;
            }
            Long deleted = redisTemplate.delete(keys);
            return deleted != null ? deleted : 0;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to delete keys with prefix " + prefix, e);
        }
    }

    @Override
    public Duration ping() {
        long start = System.nanoTime();
        try {
            redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Redis ping failed", e);
        }
        return Duration.ofNanos(System.nanoTime() - start);
    }

    // KEYS takes a glob; paths and ids may contain its metacharacters
    static String escapeGlob(String literal) {
        StringBuilder escaped = new StringBuilder(literal.length());
        for (char c : literal.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}

package com.vimbiso.backend.state;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis-backed store. Every key is a hash with a {@code version} and a {@code payload} field;
 * writes run as Lua scripts so the version check, the write and the expiry happen atomically.
 */
public class RedisStateStore implements StateStore {

  static final String VERSION_FIELD = "version";
  static final String PAYLOAD_FIELD = "payload";

  private static final RedisScript<Long> SET_SCRIPT =
      RedisScript.of(
          """
          local version = redis.call('HINCRBY', KEYS[1], 'version', 1)
          redis.call('HSET', KEYS[1], 'payload', ARGV[1])
          redis.call('PEXPIRE', KEYS[1], ARGV[2])
          return version
          """,
          Long.class);

  @SuppressWarnings("rawtypes")
  private static final RedisScript<List> COMPARE_AND_SET_SCRIPT =
      RedisScript.of(
          """
          local current = redis.call('HGET', KEYS[1], 'version')
          if not current then
            current = '0'
          end
          if tonumber(current) ~= tonumber(ARGV[1]) then
            return {'0', tostring(current), redis.call('HGET', KEYS[1], 'payload')}
          end
          local next = tonumber(current) + 1
          redis.call('HSET', KEYS[1], 'version', tostring(next), 'payload', ARGV[2])
          redis.call('PEXPIRE', KEYS[1], ARGV[3])
          return {'1', tostring(next), ARGV[2]}
          """,
          List.class);

  private final StringRedisTemplate redisTemplate;

  public RedisStateStore(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
  }

  @Override
  public Optional<StoredState> get(String key) {
    HashOperations<String, String, String> hash = redisTemplate.opsForHash();
    List<String> values = hash.multiGet(key, List.of(VERSION_FIELD, PAYLOAD_FIELD));
    if (values == null || values.size() < 2 || values.get(0) == null || values.get(1) == null) {
      return Optional.empty();
    }
    return Optional.of(new StoredState(values.get(1), Long.parseLong(values.get(0))));
  }

  @Override
  public StoredState set(String key, String payload, Duration ttl) {
    Long version =
        redisTemplate.execute(SET_SCRIPT, List.of(key), payload, String.valueOf(ttl.toMillis()));
    if (version == null) {
      throw new IllegalStateException("Redis returned no version for key " + key);
    }
    return new StoredState(payload, version);
  }

  @Override
  @SuppressWarnings("unchecked")
  public CompareAndSetResult compareAndSet(
      String key, long expectedVersion, String payload, Duration ttl) {
    List<Object> reply =
        redisTemplate.execute(
            COMPARE_AND_SET_SCRIPT,
            List.of(key),
            String.valueOf(expectedVersion),
            payload,
            String.valueOf(ttl.toMillis()));
    if (reply == null || reply.size() < 2) {
      throw new IllegalStateException("Unexpected compare-and-set reply for key " + key);
    }
    boolean applied = "1".equals(String.valueOf(reply.get(0)));
    long version = Long.parseLong(String.valueOf(reply.get(1)));
    String current = reply.size() > 2 && reply.get(2) != null ? String.valueOf(reply.get(2)) : null;
    if (applied) {
      return CompareAndSetResult.applied(new StoredState(payload, version));
    }
    return CompareAndSetResult.rejected(current == null ? null : new StoredState(current, version));
  }
}

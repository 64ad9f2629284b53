package io.b2mash.opsdesk.store.cache;

import io.b2mash.opsdesk.exception.BackendUnavailableException;
import io.b2mash.opsdesk.store.Availability;
import io.b2mash.opsdesk.store.StoreAdapter;
import io.b2mash.opsdesk.store.StoreKind;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

/** Redis-backed counters for short-lived request data. Never part of the system of record. */
@Component
public class CacheStoreAdapter implements StoreAdapter {

  private static final Logger log = LoggerFactory.getLogger(CacheStoreAdapter.class);

  // INCR and the expiry run in one server-side step so a counter can never outlive its window.
  static final RedisScript<Long> INCREMENT_WITH_EXPIRY =
      new DefaultRedisScript<>(
          """
          local value = redis.call('INCR', KEYS[1])
          if value == 1 or redis.call('PTTL', KEYS[1]) < 0 then
            redis.call('PEXPIRE', KEYS[1], ARGV[1])
          end
          return value
          """,
          Long.class);

  private final StringRedisTemplate redisTemplate;

  public CacheStoreAdapter(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
  }

  @Override
  public StoreKind kind() {
    return StoreKind.CACHE;
  }

  @Override
  public Availability ping() {
    try {
      String reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
      return "PONG".equalsIgnoreCase(reply) ? Availability.AVAILABLE : Availability.UNAVAILABLE;
    } catch (DataAccessException e) {
      log.debug("Cache ping failed: {}", e.getMessage());
      return Availability.UNAVAILABLE;
    }
  }

  /**
   * Increments the counter at {@code key}, starting its expiry window on the first increment. A
   * counter found without an expiry gets one as well.
   *
   * @return the counter value after incrementing
   */
  public long increment(String key, Duration window) {
    try {
      Long value =
          redisTemplate.execute(
              INCREMENT_WITH_EXPIRY, List.of(key), String.valueOf(window.toMillis()));
      return value != null ? value : 0L;
    } catch (DataAccessException e) {
      throw new BackendUnavailableException(
          StoreKind.CACHE, "Cache unavailable while incrementing " + key, e);
    }
  }
}

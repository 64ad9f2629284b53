package io.b2mash.opsdesk.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.b2mash.opsdesk.exception.BackendUnavailableException;
import io.b2mash.opsdesk.health.BackendHealthMonitor;
import io.b2mash.opsdesk.store.StoreKind;
import io.b2mash.opsdesk.store.cache.CacheStoreAdapter;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Per-caller limit on mutating requests in fixed one-minute windows. Counts in Redis while the
 * cache is available so all instances share a budget, and in a local Caffeine counter otherwise.
 */
@Service
public class MutationRateLimiter {

  private static final Logger log = LoggerFactory.getLogger(MutationRateLimiter.class);

  static final Duration WINDOW = Duration.ofMinutes(1);
  private static final String KEY_PREFIX = "opsdesk:ratelimit:";

  private final CacheStoreAdapter cache;
  private final BackendHealthMonitor healthMonitor;
  private final int limit;
  private final Cache<String, AtomicInteger> localCounters;

  @Autowired
  public MutationRateLimiter(
      CacheStoreAdapter cache,
      BackendHealthMonitor healthMonitor,
      @Value("${opsdesk.ratelimit.mutations-per-minute:600}") int limit) {
    this(cache, healthMonitor, limit, Ticker.systemTicker());
  }

  MutationRateLimiter(
      CacheStoreAdapter cache, BackendHealthMonitor healthMonitor, int limit, Ticker ticker) {
    this.cache = cache;
    this.healthMonitor = healthMonitor;
    this.limit = limit;
    this.localCounters =
        Caffeine.newBuilder().expireAfterWrite(WINDOW).maximumSize(10_000).ticker(ticker).build();
  }

  /** Counts one mutation for {@code caller}. Returns false once the caller exceeded the limit. */
  public boolean tryAcquire(String caller) {
    if (healthMonitor.snapshot().cache()) {
      try {
        return cache.increment(KEY_PREFIX + caller, WINDOW) <= limit;
      } catch (BackendUnavailableException e) {
        log.warn("Rate limit counter unavailable, counting locally: {}", e.getMessage());
        healthMonitor.reportUnavailable(StoreKind.CACHE);
      }
    }
    var counter = localCounters.get(caller, k -> new AtomicInteger(0));
    int count = counter.incrementAndGet();
    if (count > limit) {
      counter.decrementAndGet();
      return false;
    }
    return true;
  }

  public int limit() {
    return limit;
  }
}

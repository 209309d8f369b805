/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.util;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Token bucket that throttles repeated warnings per key (usually a log code).
 *
 * <p>Each key may emit {@code burst} lines immediately and then one line per {@code interval}.
 * Calls that are throttled are counted so the next permitted line can report how many were
 * suppressed. Uses {@link System#nanoTime()} so wall-clock jumps do not matter.
 */
public final class WarnLimiter {
  private static final class Bucket {
    double tokens;
    long lastRefillNanos;
    long suppressed;

    Bucket(double tokens, long nowNanos) {
      this.tokens = tokens;
      this.lastRefillNanos = nowNanos;
    }
  }

  private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();
  private final double capacity;
  private final double refillPerNano;
  private final LongSupplier nanoTimeSource;

  /**
   * Creates a limiter.
   *
   * @param burst lines allowed back to back (at least {@code 1})
   * @param interval time to earn one more line
   */
  public WarnLimiter(int burst, Duration interval) {
    this(burst, interval, System::nanoTime);
  }

  WarnLimiter(int burst, Duration interval, LongSupplier nanoTimeSource) {
    Objects.requireNonNull(interval, "interval");
    this.nanoTimeSource = Objects.requireNonNull(nanoTimeSource, "nanoTimeSource");
    this.capacity = Math.max(1, burst);
    this.refillPerNano = 1.0d / Math.max(1L, interval.toNanos());
  }

  /**
   * Attempts to emit one line for {@code key}.
   *
   * @param key throttling key
   * @return {@code -1} when throttled, otherwise the number of lines suppressed since the last
   *     permitted one
   */
  public long tryAcquire(String key) {
    long nowNanos = nanoTimeSource.getAsLong();
    Bucket b = buckets.computeIfAbsent(key, k -> new Bucket(capacity, nowNanos));
    synchronized (b) {
      long delta = nowNanos - b.lastRefillNanos;
      if (delta > 0L) {
        b.tokens = Math.min(capacity, b.tokens + delta * refillPerNano);
        b.lastRefillNanos = nowNanos;
      }
      if (b.tokens >= 1.0) {
        b.tokens -= 1.0;
        long skipped = b.suppressed;
        b.suppressed = 0;
        return skipped;
      }
      b.suppressed++;
      return -1L;
    }
  }
}

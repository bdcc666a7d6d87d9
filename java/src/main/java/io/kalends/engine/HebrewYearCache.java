package io.kalends.engine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.IntToLongFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded least-recently-used cache of Hebrew new-year days, keyed by year.
 *
 * <p>The capacity is read once from the {@value #CAPACITY_PROPERTY} system property. A capacity of
 * 0 or less disables caching. Lookups and insertions hold a private lock; the value itself is
 * computed outside it, so two threads may compute the same year concurrently and store the same
 * result.
 */
final class HebrewYearCache {
  private static final Logger LOG = LoggerFactory.getLogger(HebrewYearCache.class);

  /** System property holding the cache capacity. */
  static final String CAPACITY_PROPERTY = "kalends.hebrew.cacheSize";

  /** Capacity used when the property is absent. */
  static final int DEFAULT_CAPACITY = 1024;

  /** Smallest enabled capacity; one conversion touches up to four neighbouring years. */
  static final int MIN_CAPACITY = 16;

  private final Object lock = new Object();
  private final int capacity;
  private final Map<Integer, Long> entries;

  private HebrewYearCache(int capacity) {
    this.capacity = capacity;
    this.entries =
        new LinkedHashMap<>(16, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<Integer, Long> eldest) {
            boolean evict = size() > HebrewYearCache.this.capacity;
            if (evict) {
              LOG.trace("Evicting Hebrew year {} from cache", eldest.getKey());
            }
            return evict;
          }
        };
  }

  /**
   * Creates a cache sized from the {@value #CAPACITY_PROPERTY} system property.
   *
   * @return a new cache
   */
  static HebrewYearCache fromSystemProperties() {
    return withCapacity(Integer.getInteger(CAPACITY_PROPERTY, DEFAULT_CAPACITY));
  }

  /**
   * Creates a cache with the given capacity.
   *
   * @param capacity the maximum number of years kept; 0 or less disables caching
   * @return a new cache
   */
  static HebrewYearCache withCapacity(int capacity) {
    if (capacity <= 0) {
      LOG.debug("Hebrew year cache disabled");
      return new HebrewYearCache(0);
    }
    int effective = capacity;
    if (capacity < MIN_CAPACITY) {
      LOG.warn(
          "{}={} is below the minimum, using {}", CAPACITY_PROPERTY, capacity, MIN_CAPACITY);
      effective = MIN_CAPACITY;
    }
    LOG.debug("Hebrew year cache capacity {}", effective);
    return new HebrewYearCache(effective);
  }

  /**
   * Returns the cached value for a year, computing and storing it on a miss.
   *
   * @param year the year
   * @param compute computes the value for a year
   * @return the value
   */
  long get(int year, IntToLongFunction compute) {
    if (capacity == 0) {
      return compute.applyAsLong(year);
    }
    synchronized (lock) {
      Long cached = entries.get(year);
      if (cached != null) {
        return cached;
      }
    }
    long value = compute.applyAsLong(year);
    synchronized (lock) {
      entries.put(year, value);
    }
    return value;
  }

  /**
   * Returns the number of cached years.
   *
   * @return the current size
   */
  int size() {
    synchronized (lock) {
      return entries.size();
    }
  }

  /**
   * Returns the capacity, 0 when caching is disabled.
   *
   * @return the capacity
   */
  int capacity() {
    return capacity;
  }
}

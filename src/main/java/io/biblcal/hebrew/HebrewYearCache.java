package io.biblcal.hebrew;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

/** Memoizes {@link HebrewYearInfo} by Gregorian year. Entries are pure, so eviction is harmless. */
public final class HebrewYearCache {
  private final LoadingCache<Integer, HebrewYearInfo> cache;

  /**
   * Creates a cache holding at most {@code maximumSize} years.
   *
   * @param maximumSize the maximum number of cached years
   */
  public HebrewYearCache(long maximumSize) {
    this.cache = Caffeine.newBuilder().maximumSize(maximumSize).recordStats().build(HebrewYearInfo::of);
  }

  /**
   * Returns the year summary, computing it on first use.
   *
   * @param gregorianYear the Gregorian year
   * @return the year summary
   */
  public HebrewYearInfo get(int gregorianYear) {
    return cache.get(gregorianYear == 0 ? 1 : gregorianYear);
  }

  /**
   * Returns hit and miss counters.
   *
   * @return the cache statistics
   */
  public CacheStats stats() {
    return cache.stats();
  }
}

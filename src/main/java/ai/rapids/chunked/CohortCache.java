/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import com.google.common.base.Throwables;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.ExecutionException;

/**
 * A bounded cache of cohort plans, keyed by the content of the codes and not by the identity
 * of the array, so repeated reductions over the same grouping and chunking plan only once.
 * Least recently used plans are evicted first. Safe to share between threads.
 */
public final class CohortCache {
  private static final Logger log = LoggerFactory.getLogger(CohortCache.class);

  static final long DEFAULT_SIZE =
      Long.getLong("ai.rapids.chunked.cohorts.cacheSize", 128);

  private final Cache<PlanKey, CohortPlan> cache;

  public CohortCache() {
    this(DEFAULT_SIZE);
  }

  public CohortCache(long maximumSize) {
    Preconditions.checkConfig(maximumSize >= 0,
        () -> "cache size must not be negative, got " + maximumSize);
    this.cache = CacheBuilder.newBuilder()
        .maximumSize(maximumSize)
        .recordStats()
        .build();
  }

  /**
   * The cached plan for these arguments, planning and caching it first if needed. Concurrent
   * callers with equal arguments wait for a single planning run. A failed plan is not cached
   * and its exception reaches every caller that waited on it.
   */
  public CohortPlan getOrPlan(int[] codes, int groupCount, ChunkLayout layout,
                              CohortPlanner planner) {
    PlanKey key = new PlanKey(codes, groupCount, layout, planner.getMergeThreshold(),
        planner.getMaxDensity());
    boolean[] planned = new boolean[1];
    CohortPlan plan;
    try {
      plan = cache.get(key, () -> {
        planned[0] = true;
        return planner.plan(codes, groupCount, layout);
      });
    } catch (UncheckedExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw e;
    } catch (ExecutionException e) {
      // the planner throws no checked exceptions
      throw new IllegalStateException("planning cohorts failed", e.getCause());
    }
    if (!planned[0]) {
      log.debug("Reusing cached cohort plan for {} groups over {}", groupCount, layout);
    }
    return plan;
  }

  public long size() {
    return cache.size();
  }

  public CacheStats stats() {
    return cache.stats();
  }

  public void invalidateAll() {
    cache.invalidateAll();
  }

  private static final class PlanKey {
    private final int[] codes;
    private final int groupCount;
    private final ChunkLayout layout;
    private final int mergeThreshold;
    private final double maxDensity;
    private final int hash;

    PlanKey(int[] codes, int groupCount, ChunkLayout layout, int mergeThreshold,
            double maxDensity) {
      this.codes = codes.clone();
      this.groupCount = groupCount;
      this.layout = layout;
      this.mergeThreshold = mergeThreshold;
      this.maxDensity = maxDensity;
      Hasher hasher = Hashing.murmur3_128().newHasher();
      for (int code : this.codes) {
        hasher.putInt(code);
      }
      this.hash = Objects.hash(hasher.hash().asInt(), groupCount, layout, mergeThreshold,
          maxDensity);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      } else if (o instanceof PlanKey) {
        PlanKey other = (PlanKey) o;
        return hash == other.hash && groupCount == other.groupCount
            && mergeThreshold == other.mergeThreshold
            && Double.compare(maxDensity, other.maxDensity) == 0
            && layout.equals(other.layout) && Arrays.equals(codes, other.codes);
      }
      return false;
    }

    @Override
    public int hashCode() {
      return hash;
    }
  }
}

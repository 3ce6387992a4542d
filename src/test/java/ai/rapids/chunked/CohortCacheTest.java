/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CohortCacheTest extends GroupByTestBase {
  private static final ChunkLayout LAYOUT = ChunkLayout.of(2, 3);

  @Test
  void testHitByContent() {
    CohortCache cache = new CohortCache(8);
    CohortPlanner planner = new CohortPlanner();
    CohortPlan first = cache.getOrPlan(new int[]{0, 1, 0, 1, 2}, 3, LAYOUT, planner);
    // an equal array, not the same one
    CohortPlan second = cache.getOrPlan(new int[]{0, 1, 0, 1, 2}, 3, LAYOUT, planner);
    assertSame(first, second);
    assertEquals(1, cache.stats().hitCount());
    assertEquals(1, cache.stats().missCount());
    assertEquals(1, cache.size());
  }

  @Test
  void testCallerMutationDoesNotAffectTheCache() {
    CohortCache cache = new CohortCache(8);
    CohortPlanner planner = new CohortPlanner();
    int[] codes = {0, 1, 0, 1, 2};
    CohortPlan first = cache.getOrPlan(codes, 3, LAYOUT, planner);
    codes[4] = 1;
    CohortPlan changed = cache.getOrPlan(codes, 3, LAYOUT, planner);
    assertNotSame(first, changed);
    assertSame(first, cache.getOrPlan(new int[]{0, 1, 0, 1, 2}, 3, LAYOUT, planner));
  }

  @Test
  void testEverythingIsPartOfTheKey() {
    CohortCache cache = new CohortCache(16);
    int[] codes = {0, 1, 0, 1, 2};
    CohortPlan base = cache.getOrPlan(codes, 3, LAYOUT, new CohortPlanner());
    assertNotSame(base, cache.getOrPlan(codes, 4, LAYOUT, new CohortPlanner()));
    assertNotSame(base, cache.getOrPlan(codes, 3, ChunkLayout.of(3, 2), new CohortPlanner()));
    assertNotSame(base, cache.getOrPlan(codes, 3, LAYOUT, new CohortPlanner(1)));
    assertNotSame(base, cache.getOrPlan(codes, 3, LAYOUT, new CohortPlanner(0, 0.9)));
    assertEquals(5, cache.size());
    assertEquals(0, cache.stats().hitCount());
  }

  @Test
  void testPlansOnlyOnMiss() {
    CohortCache cache = new CohortCache(4);
    CohortPlanner planner = new CohortPlanner();
    int[] codes = {0, 1, 0, 1, 2};
    for (int i = 0; i < 3; i++) {
      cache.getOrPlan(codes, 3, LAYOUT, planner);
    }
    assertEquals(1, cache.stats().missCount());
    assertEquals(2, cache.stats().hitCount());
  }

  @Test
  void testEviction() {
    CohortCache cache = new CohortCache(1);
    CohortPlanner planner = new CohortPlanner();
    CohortPlan first = cache.getOrPlan(new int[]{0, 1, 0, 1, 2}, 3, LAYOUT, planner);
    cache.getOrPlan(new int[]{0, 0, 1, 1, 2}, 3, LAYOUT, planner);
    assertEquals(1, cache.size());
    assertEquals(1, cache.stats().evictionCount());
    assertNotSame(first, cache.getOrPlan(new int[]{0, 1, 0, 1, 2}, 3, LAYOUT, planner));

    cache.invalidateAll();
    assertEquals(0, cache.size());
  }

  @Test
  void testInvalidSize() {
    assertThrows(GroupByConfigurationException.class, () -> new CohortCache(-1));
  }

  @Test
  void testConcurrentCallersPlanOnce() throws Exception {
    CohortCache cache = new CohortCache(4);
    CohortPlanner planner = new CohortPlanner();
    int threads = 8;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<Future<CohortPlan>> plans = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        plans.add(pool.submit(() -> {
          start.await();
          return cache.getOrPlan(new int[]{0, 1, 0, 1, 2}, 3, LAYOUT, planner);
        }));
      }
      start.countDown();
      CohortPlan first = plans.get(0).get();
      for (Future<CohortPlan> plan : plans) {
        assertSame(first, plan.get());
      }
    } finally {
      pool.shutdownNow();
    }
    assertEquals(1, cache.stats().loadCount());
    assertEquals(1, cache.size());
  }

  @Test
  void testPlanningErrorsPassThrough() {
    CohortCache cache = new CohortCache(4);
    // code 7 is out of range for 3 groups
    assertThrows(GroupByDataException.class,
        () -> cache.getOrPlan(new int[]{0, 1, 0, 7, 2}, 3, LAYOUT, new CohortPlanner()));
    assertEquals(0, cache.size());
    assertEquals(1, cache.stats().loadExceptionCount());
  }
}

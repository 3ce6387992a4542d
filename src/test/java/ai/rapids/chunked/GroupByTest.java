/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GroupByTest extends GroupByTestBase {
  private static final ChunkedArray DATA =
      ChunkedArray.fromDoubles(ChunkLayout.of(2, 3), 1, 2, 3, 4, 5);
  private static final KeyColumn KEYS = KeyColumn.ofInts(0, 1, 0, 1, 2);

  @Test
  void testSum() {
    GroupByResult result = GroupBy.reduce(DATA, KEYS, GroupByAggregation.sum());
    assertArrayEqualsWithinPercentage(new double[]{4, 6, 5}, result.getRow(0));
    assertEquals(3, result.getGroupCount());
    assertEquals(DType.FLOAT64, result.getType());
    assertEquals("sum", result.getAggregationName());
    assertEquals(2, result.getPlan().getCohortCount());
  }

  @Test
  void testEveryMethodAgrees() {
    for (ReductionMethod method : new ReductionMethod[]{ReductionMethod.MAP_REDUCE,
        ReductionMethod.COHORTS}) {
      ReductionOptions options = ReductionOptions.builder().withMethod(method).build();
      GroupByResult result = GroupBy.reduce(DATA, KEYS, GroupByAggregation.mean(), options);
      assertEquals(method, result.getMethod());
      assertArrayEqualsWithinPercentage(new double[]{2, 3, 5}, result.getRow(0));
    }
    GroupByResult byName = GroupBy.reduce(DATA, KEYS, GroupByAggregation.max(),
        ReductionOptions.builder().withMethod("cohorts").build());
    assertEquals(ReductionMethod.COHORTS, byName.getMethod());
    assertArrayEqualsWithinPercentage(new double[]{3, 4, 5}, byName.getRow(0));
  }

  @Test
  void testFillAndMinCount() {
    ReductionOptions options = ReductionOptions.builder()
        .withFillValue(-1)
        .withMinCount(2)
        .build();
    GroupByResult result = GroupBy.reduce(DATA, KEYS, GroupByAggregation.sum(), options);
    assertArrayEqualsWithinPercentage(new double[]{4, 6, -1}, result.getRow(0));
  }

  @Test
  void testDTypeOverride() {
    ChunkedArray data = ChunkedArray.fromDoubles(ChunkLayout.uniform(4, 3), 1.25, 2.5, 3, 4.5);
    KeyColumn keys = KeyColumn.ofInts(0, 0, 1, 1);
    ReductionOptions toInt = ReductionOptions.builder().withDType(DType.INT32).build();
    GroupByResult sum = GroupBy.reduce(data, keys, GroupByAggregation.sum(), toInt);
    assertEquals(DType.INT32, sum.getType());
    assertArrayEqualsWithinPercentage(new double[]{3, 7}, sum.getRow(0));

    // the NaN fill of mean cannot be stored as an integer
    GroupByResult mean = GroupBy.reduce(data, keys, GroupByAggregation.mean(), toInt);
    assertEquals(DType.FLOAT64, mean.getType());
  }

  @Test
  void testIntegerInput() {
    ChunkedArray data = ChunkedArray.fromInts(ChunkLayout.uniform(5, 2), 1, 2, 3, 4, 5);
    GroupByResult sum = GroupBy.reduce(data, KEYS, GroupByAggregation.sum());
    assertEquals(DType.INT64, sum.getType());
    assertArrayEqualsWithinPercentage(new double[]{4, 6, 5}, sum.getRow(0));

    GroupByResult count = GroupBy.reduce(data, KEYS, GroupByAggregation.count());
    assertEquals(DType.INT64, count.getType());
    assertArrayEqualsWithinPercentage(new double[]{2, 2, 1}, count.getRow(0));

    GroupByResult mean = GroupBy.reduce(data, KEYS, GroupByAggregation.mean());
    assertTrue(mean.getType().isFloatingPoint());
  }

  @Test
  void testMultipleKeys() {
    List<KeyColumn> keys = ImmutableList.of(
        KeyColumn.ofObjects("a", "b", "a", "b", "a"),
        KeyColumn.ofInts(1, 1, 2, 2, 1));
    GroupByResult result = GroupBy.reduce(DATA, keys, GroupByAggregation.sum().getBlueprint(),
        ReductionOptions.DEFAULT);
    assertEquals(4, result.getGroupCount());
    assertArrayEqualsWithinPercentage(new double[]{6, 3, 2, 4}, result.getRow(0));
    assertEquals("a", result.getGroupLabels(0)[0]);
    assertEquals("b", result.getGroupLabels(3)[0]);
    assertEquals(ImmutableList.of("a", "b"), result.getLabels(0));
  }

  @Test
  void testExpectedGroups() {
    ChunkedArray data = ChunkedArray.fromDoubles(ChunkLayout.uniform(3, 1), 1, 2, 3);
    KeyColumn keys = KeyColumn.ofObjects("x", "y", "x");
    ReductionOptions options = ReductionOptions.builder()
        .withExpectedGroups(ExpectedGroups.labels("z", "y", "x"))
        .build();
    assertArrayEqualsWithinPercentage(new double[]{0, 2, 4},
        GroupBy.reduce(data, keys, GroupByAggregation.sum(), options).getRow(0));
    assertArrayEqualsWithinPercentage(new double[]{Double.NaN, 2, 2},
        GroupBy.reduce(data, keys, GroupByAggregation.mean(), options).getRow(0));
    assertEquals(ImmutableList.of("z", "y", "x"),
        GroupBy.reduce(data, keys, GroupByAggregation.count(), options).getLabels(0));
  }

  @Test
  void testBins() {
    KeyColumn keys = KeyColumn.ofDoubles(0.5, 1.5, 2.5, 1.0, 9);
    ReductionOptions options = ReductionOptions.builder()
        .withExpectedGroups(ExpectedGroups.bins(0, 1, 2, 3))
        .build();
    GroupByResult result = GroupBy.reduce(DATA, keys, GroupByAggregation.sum(), options);
    assertArrayEqualsWithinPercentage(new double[]{5, 2, 3}, result.getRow(0));
  }

  @Test
  void testReduceAll() {
    List<GroupByResult> results = GroupBy.reduceAll(DATA, ImmutableList.of(KEYS),
        ImmutableList.of(GroupByAggregation.sum().getBlueprint(),
            GroupByAggregation.count().getBlueprint(),
            GroupByAggregation.mean().getBlueprint()),
        ReductionOptions.DEFAULT);
    assertEquals(3, results.size());
    assertEquals("sum", results.get(0).getAggregationName());
    assertEquals("count", results.get(1).getAggregationName());
    assertEquals("mean", results.get(2).getAggregationName());
    assertArrayEqualsWithinPercentage(new double[]{2, 2, 1}, results.get(1).getRow(0));
    assertArrayEqualsWithinPercentage(new double[]{2, 3, 5}, results.get(2).getRow(0));
  }

  @Test
  void testReduceAllValidatesFirst() {
    ExecutionEngine engine = Mockito.mock(ExecutionEngine.class);
    ReductionOptions options = ReductionOptions.builder()
        .withMethod(ReductionMethod.MAP_REDUCE)
        .withEngine(engine)
        .build();
    // the median cannot be combined, so nothing runs, not even the sum
    assertThrows(GroupByConfigurationException.class,
        () -> GroupBy.reduceAll(DATA, ImmutableList.of(KEYS),
            ImmutableList.of(GroupByAggregation.sum().getBlueprint(),
                GroupByAggregation.median().getBlueprint()),
            options));
    Mockito.verifyNoInteractions(engine);
  }

  @Test
  void testMedianAfterRechunking() {
    int[] codes = {0, 0, 0, 1, 1, 2};
    KeyColumn keys = KeyColumn.ofInts(codes);
    ChunkedArray data = ChunkedArray.fromDoubles(ChunkLayout.uniform(6, 2), 3, 1, 2, 10, 20, 7);
    assertThrows(GroupByConfigurationException.class,
        () -> GroupBy.reduce(data, keys, GroupByAggregation.median()));

    ChunkedArray rechunked = data.rechunk(Rechunker.forBlockwise(codes, data.getLayout()));
    GroupByResult result = GroupBy.reduce(rechunked, keys, GroupByAggregation.median());
    assertEquals(ReductionMethod.BLOCKWISE, result.getMethod());
    assertArrayEqualsWithinPercentage(new double[]{2, 15, 7}, result.getRow(0));
  }

  @Test
  void testBatchesWithThreadPoolAndCache() {
    ChunkedArray data = ChunkedArray.fromRows(DType.FLOAT64, 2, ChunkLayout.of(2, 3),
        1, 2, 3, 4, 5,
        -1, -2, -3, -4, -5);
    CohortCache cache = new CohortCache(4);
    try (ThreadPoolExecutionEngine engine = new ThreadPoolExecutionEngine(2)) {
      ReductionOptions options = ReductionOptions.builder()
          .withEngine(engine)
          .withCohortCache(cache)
          .withCombineFanIn(2)
          .build();
      for (int i = 0; i < 2; i++) {
        GroupByResult result = GroupBy.reduce(data, KEYS, GroupByAggregation.sum(), options);
        assertEquals(2, result.getBatchSize());
        assertArrayEqualsWithinPercentage(new double[]{4, 6, 5}, result.getRow(0));
        assertArrayEqualsWithinPercentage(new double[]{-4, -6, -5}, result.getRow(1));
        assertEquals(-6.0, result.get(1, 1));
      }
    }
    assertEquals(1, cache.stats().hitCount());
  }

  @Test
  void testErrors() {
    assertThrows(GroupByConfigurationException.class,
        () -> GroupBy.reduce(DATA, KeyColumn.ofInts(0, 1), GroupByAggregation.sum()));
    assertThrows(GroupByConfigurationException.class,
        () -> GroupBy.reduceAll(DATA, ImmutableList.of(KEYS), ImmutableList.of(),
            ReductionOptions.DEFAULT));
    assertThrows(GroupByConfigurationException.class,
        () -> GroupBy.reduce(ChunkedArray.fromBooleans(ChunkLayout.single(5), true, false,
            true, true, false), KEYS, GroupByAggregation.product()));
  }
}

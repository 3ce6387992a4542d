/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AggregationBlueprintTest extends GroupByTestBase {
  private static final ChunkedArray TWO_CHUNKS =
      ChunkedArray.fromDoubles(ChunkLayout.of(2, 2), 1.5, 2, -3, 4);

  static Stream<Arguments> builtInsAndMethods() {
    GroupByAggregation[] aggregations = {
        GroupByAggregation.count(), GroupByAggregation.count(NaNPolicy.EXCLUDE),
        GroupByAggregation.sum(), GroupByAggregation.sum(NaNPolicy.EXCLUDE),
        GroupByAggregation.product(), GroupByAggregation.product(NaNPolicy.EXCLUDE),
        GroupByAggregation.min(), GroupByAggregation.min(NaNPolicy.EXCLUDE),
        GroupByAggregation.max(), GroupByAggregation.max(NaNPolicy.EXCLUDE),
        GroupByAggregation.mean(), GroupByAggregation.mean(NaNPolicy.EXCLUDE),
        GroupByAggregation.variance(), GroupByAggregation.variance(1, NaNPolicy.EXCLUDE),
        GroupByAggregation.standardDeviation(),
        GroupByAggregation.standardDeviation(1, NaNPolicy.EXCLUDE),
        GroupByAggregation.median(), GroupByAggregation.median(NaNPolicy.EXCLUDE),
        GroupByAggregation.quantile(0.25),
        GroupByAggregation.mode(), GroupByAggregation.mode(NaNPolicy.EXCLUDE),
        GroupByAggregation.argMin(), GroupByAggregation.argMin(NaNPolicy.EXCLUDE),
        GroupByAggregation.argMax(), GroupByAggregation.argMax(NaNPolicy.EXCLUDE),
        GroupByAggregation.first(), GroupByAggregation.first(NaNPolicy.EXCLUDE),
        GroupByAggregation.last(), GroupByAggregation.last(NaNPolicy.EXCLUDE),
        GroupByAggregation.any(), GroupByAggregation.any(NaNPolicy.EXCLUDE),
        GroupByAggregation.all(), GroupByAggregation.all(NaNPolicy.EXCLUDE)};
    List<Arguments> args = new ArrayList<>();
    for (GroupByAggregation aggregation : aggregations) {
      args.add(Arguments.of(aggregation, ReductionMethod.BLOCKWISE));
      if (aggregation.getBlueprint().isParallelizable()) {
        args.add(Arguments.of(aggregation, ReductionMethod.MAP_REDUCE));
        args.add(Arguments.of(aggregation, ReductionMethod.COHORTS));
      }
    }
    return args.stream();
  }

  @ParameterizedTest
  @MethodSource("builtInsAndMethods")
  void testEmptyGroupHoldsFinalFill(GroupByAggregation aggregation, ReductionMethod method) {
    ReductionOptions options = ReductionOptions.builder()
        .withMethod(method)
        .withExpectedGroups(ExpectedGroups.range(3))
        .build();
    GroupByResult result = GroupBy.reduce(TWO_CHUNKS, KeyColumn.ofLongs(0, 0, 1, 1),
        aggregation, options);
    assertEquals(3, result.getGroupCount());
    String name = aggregation.getBlueprint().getName() + " with " + method;
    assertEqualsWithinPercentage(aggregation.getBlueprint().getFinalFillValue(),
        result.get(0, 2), PERCENTAGE, name);
    assertEquals(method, result.getMethod(), name);
  }

  @Test
  void testValidation() {
    ChunkOp sum = ChunkOp.named(KernelOp.SUM);
    ChunkOp count = ChunkOp.named(KernelOp.COUNT);
    CombineOp add = CombineOp.of(CombineOp.Binary.SUM);
    // fill values must match chunk ops
    assertThrows(GroupByConfigurationException.class,
        () -> AggregationBlueprint.builder("bad").chunkOps(sum, count).fillValues(0).build());
    // no chunk ops
    assertThrows(GroupByConfigurationException.class,
        () -> AggregationBlueprint.builder("bad").build());
    // combine ops, when given, must match chunk ops
    assertThrows(GroupByConfigurationException.class,
        () -> AggregationBlueprint.builder("bad").chunkOps(sum, count).combineOps(add)
            .fillValues(0, 0).build());
    // a custom combine op stands alone
    assertThrows(GroupByConfigurationException.class,
        () -> AggregationBlueprint.builder("bad").chunkOps(sum, count)
            .combineOps(add, CombineOp.custom("c", (l, lc, r, rc) -> l))
            .fillValues(0, 0).build());
    assertThrows(GroupByConfigurationException.class,
        () -> AggregationBlueprint.builder("bad").chunkOps(sum).fillValues(0)
            .intermediateTypes(DType.INT64, DType.INT64).build());
    assertThrows(GroupByConfigurationException.class,
        () -> AggregationBlueprint.builder("bad").chunkOps(sum).fillValues(0).minCount(-1)
            .build());
  }

  @Test
  void testWithoutCombineOnlyRunsBlockwise() {
    AggregationBlueprint bp = AggregationBlueprint.builder("local-only")
        .chunkOps(ChunkOp.named(KernelOp.SUM)).fillValues(0).build();
    assertFalse(bp.isParallelizable());
    bp.validateFor(ReductionMethod.BLOCKWISE);
    assertThrows(GroupByConfigurationException.class,
        () -> bp.validateFor(ReductionMethod.MAP_REDUCE));
    assertThrows(GroupByConfigurationException.class,
        () -> bp.validateFor(ReductionMethod.COHORTS));
  }

  @Test
  void testBuiltinsParallelizable() {
    assertTrue(GroupByAggregation.sum().getBlueprint().isParallelizable());
    assertTrue(GroupByAggregation.variance(1, NaNPolicy.EXCLUDE).getBlueprint()
        .isParallelizable());
    assertTrue(GroupByAggregation.argMin().getBlueprint().isParallelizable());
    assertFalse(GroupByAggregation.median().getBlueprint().isParallelizable());
    assertFalse(GroupByAggregation.quantile(0.3).getBlueprint().isParallelizable());
    assertFalse(GroupByAggregation.mode().getBlueprint().isParallelizable());
  }

  @Test
  void testNames() {
    assertEquals("sum", GroupByAggregation.sum().getBlueprint().getName());
    assertEquals("nansum", GroupByAggregation.sum(NaNPolicy.EXCLUDE).getBlueprint().getName());
    assertEquals("nanvar", GroupByAggregation.variance(0, NaNPolicy.EXCLUDE).getBlueprint()
        .getName());
    assertEquals("std", GroupByAggregation.standardDeviation().getBlueprint().getName());
  }

  @Test
  void testEquality() {
    assertEquals(GroupByAggregation.sum(), GroupByAggregation.sum(NaNPolicy.INCLUDE));
    assertEquals(GroupByAggregation.sum().hashCode(),
        GroupByAggregation.sum(NaNPolicy.INCLUDE).hashCode());
    assertNotEquals(GroupByAggregation.sum(), GroupByAggregation.sum(NaNPolicy.EXCLUDE));
    assertNotEquals(GroupByAggregation.variance(0, NaNPolicy.INCLUDE),
        GroupByAggregation.variance(1, NaNPolicy.INCLUDE));
    assertEquals(GroupByAggregation.quantile(0.5), GroupByAggregation.quantile(0.5));
    assertThrows(GroupByConfigurationException.class, () -> GroupByAggregation.quantile(1.5));
    assertThrows(GroupByConfigurationException.class,
        () -> GroupByAggregation.variance(-1, NaNPolicy.INCLUDE));
  }

  @Test
  void testResultTypes() {
    assertEquals(DType.INT64, GroupByAggregation.sum().getBlueprint().getResultType(DType.INT32));
    assertEquals(DType.FLOAT32,
        GroupByAggregation.sum().getBlueprint().getResultType(DType.FLOAT32));
    assertEquals(DType.INT64,
        GroupByAggregation.count().getBlueprint().getResultType(DType.FLOAT64));
    assertEquals(DType.BOOL8, GroupByAggregation.any().getBlueprint().getResultType(DType.INT32));
    assertEquals(DType.FLOAT64,
        GroupByAggregation.mean().getBlueprint().getResultType(DType.INT32));
    assertEquals(DType.FLOAT32,
        GroupByAggregation.mean().getBlueprint().getResultType(DType.FLOAT32));
    assertEquals(DType.INT64,
        GroupByAggregation.argMax().getBlueprint().getResultType(DType.FLOAT64));
    // empty groups of an integer min are NaN, which needs a floating point result
    assertEquals(DType.FLOAT64, GroupByAggregation.min().getBlueprint().getResultType(DType.INT32));
    assertEquals(DType.INT32, GroupByAggregation.min().getBlueprint().withFinalFillValue(0)
        .getResultType(DType.INT32));
  }

  @Test
  void testBooleanInput() {
    GroupByAggregation.sum().getBlueprint().validateInput(DType.BOOL8);
    assertThrows(GroupByConfigurationException.class,
        () -> GroupByAggregation.variance().getBlueprint().validateInput(DType.BOOL8));
    assertThrows(GroupByConfigurationException.class,
        () -> GroupByAggregation.product().getBlueprint().validateInput(DType.BOOL8));
  }

  @Test
  void testMeanDecomposition() {
    // the finalized combination of per chunk (sum, count) pairs equals the mean of the whole
    double[] values = {1, 2, 3, 4, 5, 6, 7};
    int[] codes = new int[values.length];
    AggregationBlueprint bp = GroupByAggregation.mean().getBlueprint();
    ChunkedArray data = ChunkedArray.fromDoubles(ChunkLayout.of(3, 4), values);
    int[] groups = {0};
    int[] local = {0};
    Partial left = ReductionExecutor.reduce(data, codes, groups, local, 0, bp);
    Partial right = ReductionExecutor.reduce(data, codes, groups, local, 1, bp);
    assertEquals(6, left.get(0, 0, 0));
    assertEquals(3, left.get(1, 0, 0));
    Partial combined = Partial.combine(left, right, bp);
    assertEquals(7, combined.getCount(0, 0));
    double[] mean = ReductionExecutor.finalizePartial(combined, bp);
    assertEqualsWithinPercentage(4.0, mean[0], PERCENTAGE);
  }

  @Test
  void testMinCountAndFill() {
    AggregationBlueprint bp = GroupByAggregation.sum(NaNPolicy.EXCLUDE).getBlueprint()
        .withMinCount(2).withFinalFillValue(-1);
    assertEquals(2, bp.getMinCount());
    assertEquals(-1, bp.getFinalFillValue());
    assertEquals(bp, bp.toBuilder().build());
  }
}

/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import org.junit.jupiter.api.Test;

import static ai.rapids.chunked.ReductionMethod.AUTO;
import static ai.rapids.chunked.ReductionMethod.BLOCKWISE;
import static ai.rapids.chunked.ReductionMethod.COHORTS;
import static ai.rapids.chunked.ReductionMethod.MAP_REDUCE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StrategySelectorTest {

  @Test
  void testAutoPicksBlockwiseForOneGroupPerChunk() {
    CohortPlan plan = new CohortPlanner().plan(new int[]{0, 1, 2}, 3, ChunkLayout.of(1, 1, 1));
    assertEquals(BLOCKWISE,
        StrategySelector.select(AUTO, plan, GroupByAggregation.sum().getBlueprint()));
    // non-parallelizable aggregations are fine too
    assertEquals(BLOCKWISE,
        StrategySelector.select(AUTO, plan, GroupByAggregation.median().getBlueprint()));
  }

  @Test
  void testAutoHeuristic() {
    // planner prefers map-reduce
    assertEquals(MAP_REDUCE, StrategySelector.select(MAP_REDUCE, AUTO, 2, 10, 4, 2, true, false));
    // a single chunk
    assertEquals(MAP_REDUCE, StrategySelector.select(COHORTS, AUTO, 1, 3, 1, 1, true, false));
    // 4 cohorts * 2 chunks = 8 <= 8 chunks * 8 groups
    assertEquals(COHORTS, StrategySelector.select(COHORTS, AUTO, 4, 8, 8, 2, true, false));
    // the cohort cost is larger than the map-reduce cost
    assertEquals(MAP_REDUCE, StrategySelector.select(COHORTS, AUTO, 10, 2, 3, 5, true, false));
    // tie
    assertEquals(COHORTS, StrategySelector.select(COHORTS, AUTO, 3, 2, 3, 2, true, false));
  }

  @Test
  void testAutoWithoutCombineNeedsBlockwise() {
    assertThrows(GroupByConfigurationException.class,
        () -> StrategySelector.select(MAP_REDUCE, AUTO, 1, 3, 2, 2, false, false));
  }

  @Test
  void testOverrides() {
    assertEquals(MAP_REDUCE, StrategySelector.select(BLOCKWISE, MAP_REDUCE, 3, 3, 3, 1, true, true));
    assertEquals(COHORTS, StrategySelector.select(MAP_REDUCE, COHORTS, 1, 3, 3, 3, true, false));
    // no benefit, but it is still honored
    assertEquals(COHORTS, StrategySelector.select(MAP_REDUCE, COHORTS, 3, 3, 3, 3, true, false));
    assertEquals(BLOCKWISE, StrategySelector.select(COHORTS, BLOCKWISE, 3, 3, 3, 1, false, true));
  }

  @Test
  void testInfeasibleOverrides() {
    assertThrows(GroupByConfigurationException.class,
        () -> StrategySelector.select(COHORTS, BLOCKWISE, 2, 3, 2, 2, true, false));
    assertThrows(GroupByConfigurationException.class,
        () -> StrategySelector.select(BLOCKWISE, MAP_REDUCE, 3, 3, 3, 1, false, true));
    assertThrows(GroupByConfigurationException.class,
        () -> StrategySelector.select(BLOCKWISE, COHORTS, 3, 3, 3, 1, false, true));
  }
}

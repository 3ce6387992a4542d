/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class PlanDebugTest extends GroupByTestBase {

  @Test
  void testPrintEverything() {
    ChunkedArray data = ChunkedArray.fromDoubles(ChunkLayout.of(2, 3), 1, 2, 3, 4, 5);
    KeyColumn keys = KeyColumn.ofObjects("a", "b", "a", "b", "c");
    GroupByResult result = GroupBy.reduce(data, keys, GroupByAggregation.mean());
    int[] codes = result.getKeys().getCodes();
    ReductionExecutor.Job job = new ReductionExecutor().plan(ReductionMethod.COHORTS, data,
        codes, result.getGroupCount(), GroupByAggregation.mean().getBlueprint(),
        result.getPlan());

    for (PlanDebug.Output output : new PlanDebug.Output[]{PlanDebug.Output.LOG,
        PlanDebug.Output.LOG_INFO, PlanDebug.Output.STDOUT}) {
      PlanDebug debug = PlanDebug.builder().withOutput(output).build();
      debug.debug("plan", result.getPlan());
      debug.debug("graph", job.graph);
      debug.debug("result", result);
    }
    assertNotNull(PlanDebug.get());
  }
}

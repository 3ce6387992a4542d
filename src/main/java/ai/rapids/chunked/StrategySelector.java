/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses how a reduction is executed, honoring an explicit method if it is feasible.
 * <p>
 * For {@link ReductionMethod#AUTO} blockwise is taken whenever possible. Otherwise the cost
 * of cohorts, {@code cohortCount * avgChunksPerCohort} chunk tasks, is compared against the
 * cost of map-reduce, {@code chunkCount * groupCount} intermediate cells, and the cheaper one
 * wins, cohorts on a tie.
 */
public final class StrategySelector {
  private static final Logger log = LoggerFactory.getLogger(StrategySelector.class);

  private StrategySelector() {
  }

  /**
   * Select the method for a planned reduction.
   * @param override the method the caller asked for, AUTO to let this choose.
   */
  public static ReductionMethod select(ReductionMethod override, CohortPlan plan,
                                       AggregationBlueprint blueprint) {
    ReductionMethod ret = select(plan.getPreferredMethod(), override, plan.getCohortCount(),
        plan.getGroupCount(), plan.getChunkCount(), plan.getAverageChunksPerCohort(),
        blueprint.isParallelizable(), plan.isBlockwiseFeasible());
    log.debug("Selected {} for {} (requested {}, preferred {})", ret, blueprint.getName(),
        override, plan.getPreferredMethod());
    return ret;
  }

  /**
   * The selection heuristic on plain numbers.
   * @param preferred the planner's preferred method.
   * @param override the requested method.
   * @param parallelizable false if the aggregation has no combine step.
   * @param blockwiseFeasible true if no group spans more than one chunk.
   */
  public static ReductionMethod select(ReductionMethod preferred, ReductionMethod override,
                                       int cohortCount, int groupCount, int chunkCount,
                                       double avgChunksPerCohort, boolean parallelizable,
                                       boolean blockwiseFeasible) {
    switch (override) {
      case BLOCKWISE:
        Preconditions.checkConfig(blockwiseFeasible,
            () -> "blockwise reduction requested but groups span more than one chunk;"
                + " rechunk so chunk boundaries fall on group boundaries");
        return ReductionMethod.BLOCKWISE;
      case MAP_REDUCE:
      case COHORTS:
        Preconditions.checkConfig(parallelizable,
            () -> override + " reduction requested but the aggregation has no combine step");
        if (override == ReductionMethod.COHORTS && cohortCount == groupCount) {
          log.warn("Requested cohorts but every one of the {} groups is its own cohort,"
              + " proceeding without any benefit over map-reduce", groupCount);
        }
        return override;
      default:
        break;
    }
    if (blockwiseFeasible) {
      return ReductionMethod.BLOCKWISE;
    }
    Preconditions.checkConfig(parallelizable,
        () -> "the aggregation has no combine step and groups span more than one chunk;"
            + " rechunk so chunk boundaries fall on group boundaries");
    if (chunkCount == 1 || preferred == ReductionMethod.MAP_REDUCE) {
      return ReductionMethod.MAP_REDUCE;
    }
    double cohortCost = cohortCount * avgChunksPerCohort;
    double mapReduceCost = (double) chunkCount * groupCount;
    return cohortCost <= mapReduceCost ? ReductionMethod.COHORTS : ReductionMethod.MAP_REDUCE;
  }
}

/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Grouped reductions over chunked data.
 * <p>
 * A reduction factorizes the keys, plans cohorts (through the options' cache if one is
 * set), selects a method for every aggregation and runs it. All validation happens before
 * any task is handed to the execution engine.
 * <p>
 * <b>Usage pattern:</b>
 * <pre>{@code
 * ChunkedArray data = ChunkedArray.fromDoubles(ChunkLayout.of(2, 3), 1, 2, 3, 4, 5);
 * GroupByResult sums = GroupBy.reduce(data, KeyColumn.ofInts(0, 1, 0, 1, 2),
 *     GroupByAggregation.sum());
 * sums.getRow(0);  // [4, 6, 5]
 * }</pre>
 */
public final class GroupBy {
  private static final Logger log = LoggerFactory.getLogger(GroupBy.class);

  private GroupBy() {
  }

  public static GroupByResult reduce(ChunkedArray data, KeyColumn key,
                                     GroupByAggregation aggregation) {
    return reduce(data, Collections.singletonList(key), aggregation.getBlueprint(),
        ReductionOptions.DEFAULT);
  }

  public static GroupByResult reduce(ChunkedArray data, KeyColumn key,
                                     GroupByAggregation aggregation, ReductionOptions options) {
    return reduce(data, Collections.singletonList(key), aggregation.getBlueprint(), options);
  }

  public static GroupByResult reduce(ChunkedArray data, List<KeyColumn> keys,
                                     AggregationBlueprint blueprint, ReductionOptions options) {
    return reduceAll(data, keys, Collections.singletonList(blueprint), options).get(0);
  }

  /**
   * Run several aggregations over the same keys, factorizing and planning only once.
   * @return one result per blueprint, in order.
   */
  public static List<GroupByResult> reduceAll(ChunkedArray data, List<KeyColumn> keys,
                                              List<AggregationBlueprint> blueprints,
                                              ReductionOptions options) {
    Preconditions.checkConfig(!blueprints.isEmpty(), () -> "no aggregation to run");
    FactorizedKeys factorized = Factorizer.factorize(keys, options.getExpectedGroups(),
        options.getSortPolicy(), data.getLength());
    int[] codes = factorized.codes();
    int groupCount = factorized.getGroupCount();
    CohortPlan plan = plan(codes, groupCount, data.getLayout(), options);

    List<AggregationBlueprint> resolved = new ArrayList<>(blueprints.size());
    List<ReductionMethod> methods = new ArrayList<>(blueprints.size());
    for (AggregationBlueprint blueprint : blueprints) {
      AggregationBlueprint bp = applyOptions(blueprint, options);
      bp.validateInput(data.getType());
      ReductionMethod method = StrategySelector.select(options.getMethod(), plan, bp);
      bp.validateFor(method);
      resolved.add(bp);
      methods.add(method);
    }

    ReductionExecutor executor = new ReductionExecutor(options.getEngine(),
        options.getCombineFanIn());
    List<GroupByResult> ret = new ArrayList<>(resolved.size());
    for (int i = 0; i < resolved.size(); i++) {
      AggregationBlueprint bp = resolved.get(i);
      double[] values = executor.execute(methods.get(i), data, codes, groupCount, bp, plan);
      DType type = bp.getResultType(data.getType());
      if (options.getDType() != null) {
        type = options.getDType().promoteForFill(bp.getFinalFillValue());
        for (int v = 0; v < values.length; v++) {
          values[v] = type.cast(values[v]);
        }
      }
      ret.add(new GroupByResult(bp.getName(), values, data.getBatchSize(), type, factorized,
          methods.get(i), plan));
    }
    return ret;
  }

  static CohortPlan plan(int[] codes, int groupCount, ChunkLayout layout,
                         ReductionOptions options) {
    CohortPlanner planner = new CohortPlanner(options.getCohortMergeThreshold());
    CohortCache cache = options.getCohortCache();
    CohortPlan plan = cache == null ? planner.plan(codes, groupCount, layout)
        : cache.getOrPlan(codes, groupCount, layout, planner);
    if (PlanDebug.isEnabled()) {
      PlanDebug.get().debug("groupby", plan);
    }
    return plan;
  }

  private static AggregationBlueprint applyOptions(AggregationBlueprint blueprint,
                                                   ReductionOptions options) {
    AggregationBlueprint ret = blueprint;
    if (options.getFillValue() != null) {
      ret = ret.withFinalFillValue(options.getFillValue());
    }
    if (options.getMinCount() != null) {
      ret = ret.withMinCount(options.getMinCount());
    }
    if (ret != blueprint) {
      log.debug("Using {} with fill {} and min count {}", ret.getName(),
          ret.getFinalFillValue(), ret.getMinCount());
    }
    return ret;
  }
}

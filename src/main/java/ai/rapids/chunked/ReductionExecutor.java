/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Map;

/**
 * Applies an {@link AggregationBlueprint} to chunked data with one of the concrete
 * reduction methods. The work is expressed as a {@link TaskGraph} of chunk reductions,
 * combines and finalizations which the configured {@link ExecutionEngine} runs.
 */
public final class ReductionExecutor {
  private static final Logger log = LoggerFactory.getLogger(ReductionExecutor.class);

  static final int DEFAULT_FAN_IN = Integer.getInteger("ai.rapids.chunked.combine.fanIn", 4);

  private final ExecutionEngine engine;
  private final int combineFanIn;

  public ReductionExecutor() {
    this(SerialExecutionEngine.INSTANCE, DEFAULT_FAN_IN);
  }

  /**
   * @param engine runs the tasks.
   * @param combineFanIn how many partial results one combine task merges, at least 2.
   */
  public ReductionExecutor(ExecutionEngine engine, int combineFanIn) {
    Preconditions.checkConfig(combineFanIn >= 2,
        () -> "combine fan-in must be at least 2, got " + combineFanIn);
    this.engine = engine;
    this.combineFanIn = combineFanIn;
  }

  public ExecutionEngine getEngine() {
    return engine;
  }

  public int getCombineFanIn() {
    return combineFanIn;
  }

  /**
   * Reduce {@code data} by group.
   * @param method BLOCKWISE, MAP_REDUCE or COHORTS, see {@link StrategySelector}.
   * @param codes the group of every reduced position, or {@link Factorizer#MISSING}.
   * @param plan the cohort plan of {@code codes} over the layout of {@code data}.
   * @return {@code batch * groupCount} values, row major, in the blueprint's result type.
   *     Groups without enough contributing elements hold the final fill value.
   * @throws GroupByConfigurationException before any task runs, for a setup that cannot work.
   * @throws GroupByDataException if a final value cannot be held by an integral result type,
   *     for example a NaN.
   * @throws ExecutionEngineException if a task failed. An integral intermediate beyond 2^53
   *     fails its task with a {@link GroupByDataException} as the cause.
   */
  public double[] execute(ReductionMethod method, ChunkedArray data, int[] codes,
                          int groupCount, AggregationBlueprint blueprint, CohortPlan plan) {
    Job job = plan(method, data, codes, groupCount, blueprint, plan);
    log.debug("Executing {} for {} with {} tasks", method, blueprint.getName(),
        job.graph.size());
    if (PlanDebug.isEnabled()) {
      PlanDebug.get().debug(method + " " + blueprint.getName(), job.graph);
    }
    Map<Integer, Object> results = job.graph.size() == 0 ? Map.of()
        : engine.execute(job.graph, job.outputs);

    int batch = data.getBatchSize();
    double[] out = new double[batch * groupCount];
    Arrays.fill(out, blueprint.getFinalFillValue());
    for (int i = 0; i < job.outputs.length; i++) {
      double[] values = (double[]) results.get(job.outputs[i]);
      int[] groups = job.universes[i];
      int u = groups.length;
      for (int row = 0; row < batch; row++) {
        for (int local = 0; local < u; local++) {
          out[row * groupCount + groups[local]] = values[row * u + local];
        }
      }
    }
    DType resultType = blueprint.getResultType(data.getType());
    for (int i = 0; i < out.length; i++) {
      out[i] = resultType.cast(out[i]);
    }
    return out;
  }

  /**
   * The tasks of a reduction, with the universe of groups each output covers.
   */
  static final class Job {
    final TaskGraph graph;
    final int[] outputs;
    final int[][] universes;

    Job(TaskGraph graph, int[] outputs, int[][] universes) {
      this.graph = graph;
      this.outputs = outputs;
      this.universes = universes;
    }
  }

  /**
   * Validate everything and build the task graph without running it.
   */
  Job plan(ReductionMethod method, ChunkedArray data, int[] codes, int groupCount,
           AggregationBlueprint blueprint, CohortPlan plan) {
    Preconditions.checkConfig(method != ReductionMethod.AUTO,
        () -> "resolve " + method + " to a concrete method before executing");
    ChunkLayout layout = data.getLayout();
    Preconditions.checkConfig(codes.length == layout.getLength(),
        () -> "got " + codes.length + " codes for data of length " + layout.getLength());
    Preconditions.checkConfig(plan.getGroupCount() == groupCount
            && plan.getChunkCount() == layout.getChunkCount(),
        () -> "the cohort plan " + plan + " was not made for " + groupCount + " groups over "
            + layout);
    blueprint.validateFor(method);
    blueprint.validateInput(data.getType());
    DType resultType = blueprint.getResultType(data.getType());
    double finalFill = blueprint.getFinalFillValue();
    Preconditions.checkConfig(!resultType.isIntegral()
            || (Math.abs(finalFill) <= DType.MAX_EXACT_INT64
                && resultType.holdsExactly((long) finalFill)),
        () -> "fill value " + finalFill + " of " + blueprint.getName() + " cannot be stored as "
            + resultType);
    if (method == ReductionMethod.BLOCKWISE) {
      Preconditions.checkConfig(plan.isBlockwiseFeasible(),
          () -> "blockwise reduction needs every group inside a single chunk");
    }

    Builder b = new Builder(data, codes, groupCount, blueprint);
    switch (method) {
      case BLOCKWISE:
        for (Cohort cohort : plan.getCohorts()) {
          int chunk = cohort.chunks()[0];
          int reduced = b.reduceChunk(cohort.groups(), b.localIndex(cohort.groups()), chunk);
          b.addFinalize(cohort.groups(), reduced, "chunk-" + chunk);
        }
        break;
      case MAP_REDUCE: {
        int[] all = new int[groupCount];
        Arrays.setAll(all, i -> i);
        b.reduceAndCombine(all, nonEmptyChunks(plan), "map-reduce");
        break;
      }
      case COHORTS: {
        BitSet spanning = new BitSet();
        int index = 0;
        for (Cohort cohort : plan.getCohorts()) {
          if (cohort.spansAllChunks()) {
            for (int g : cohort.groups()) {
              spanning.set(g);
            }
          } else {
            b.reduceAndCombine(cohort.groups(), cohort.chunks(), "cohort-" + index);
          }
          index++;
        }
        if (!spanning.isEmpty()) {
          b.reduceAndCombine(spanning.stream().toArray(), nonEmptyChunks(plan), "all-chunks");
        }
        break;
      }
      default:
        throw new IllegalStateException("Unexpected method " + method);
    }
    return b.build();
  }

  private static int[] nonEmptyChunks(CohortPlan plan) {
    List<Integer> ret = new ArrayList<>();
    for (int c = 0; c < plan.getChunkCount(); c++) {
      if (plan.getChunkMembers(c).length > 0) {
        ret.add(c);
      }
    }
    return ret.stream().mapToInt(Integer::intValue).toArray();
  }

  private final class Builder {
    private final TaskGraph graph = new TaskGraph();
    private final List<Integer> outputs = new ArrayList<>();
    private final List<int[]> universes = new ArrayList<>();
    private final ChunkedArray data;
    private final int[] codes;
    private final int groupCount;
    private final AggregationBlueprint blueprint;

    Builder(ChunkedArray data, int[] codes, int groupCount, AggregationBlueprint blueprint) {
      this.data = data;
      this.codes = codes;
      this.groupCount = groupCount;
      this.blueprint = blueprint;
    }

    int[] localIndex(int[] groups) {
      int[] ret = new int[groupCount];
      Arrays.fill(ret, -1);
      for (int i = 0; i < groups.length; i++) {
        ret[groups[i]] = i;
      }
      return ret;
    }

    void reduceAndCombine(int[] groups, int[] chunks, String label) {
      if (chunks.length == 0) {
        return;
      }
      int[] localIndex = localIndex(groups);
      List<Integer> level = new ArrayList<>(chunks.length);
      for (int chunk : chunks) {
        level.add(reduceChunk(groups, localIndex, chunk));
      }
      int depth = 0;
      while (level.size() > 1) {
        List<Integer> next = new ArrayList<>();
        for (int start = 0; start < level.size(); start += combineFanIn) {
          List<Integer> inputs = level.subList(start, Math.min(start + combineFanIn,
              level.size()));
          if (inputs.size() == 1) {
            next.add(inputs.get(0));
          } else {
            int[] deps = inputs.stream().mapToInt(Integer::intValue).toArray();
            next.add(graph.addCombine(label + "-combine-" + depth + "-" + start / combineFanIn,
                deps, parts -> checkExact(Partial.combine(parts, blueprint), blueprint,
                    data.getType())));
          }
        }
        level = next;
        depth++;
      }
      addFinalize(groups, level.get(0), label);
    }

    int reduceChunk(int[] groups, int[] localIndex, int chunk) {
      return graph.addReduceChunk("reduce-chunk-" + chunk + "-" + groups.length,
          () -> reduce(data, codes, groups, localIndex, chunk, blueprint));
    }

    void addFinalize(int[] groups, int dependency, String label) {
      outputs.add(graph.addFinalize(label + "-finalize", dependency,
          partial -> finalizePartial(partial, blueprint)));
      universes.add(groups);
    }

    Job build() {
      return new Job(graph, outputs.stream().mapToInt(Integer::intValue).toArray(),
          universes.toArray(new int[0][]));
    }
  }

  /**
   * Apply every chunk op to one chunk, restricted to {@code groups}.
   */
  static Partial reduce(ChunkedArray data, int[] codes, int[] groups, int[] localIndex,
                        int chunk, AggregationBlueprint blueprint) {
    int[] positions = data.getLayout().positions(chunk);
    int[] local = new int[positions.length];
    for (int i = 0; i < positions.length; i++) {
      int code = codes[positions[i]];
      local[i] = code < 0 ? -1 : localIndex[code];
    }
    int u = groups.length;
    int batch = data.getBatchSize();
    List<ChunkOp> ops = blueprint.getChunkOps();
    double[][] slots = new double[ops.size()][batch * u];
    long[] counts = new long[batch * u];
    NaNPolicy nanPolicy = blueprint.getNaNPolicy();
    double[] values = new double[positions.length];
    for (int row = 0; row < batch; row++) {
      data.gather(row, positions, values);
      for (int s = 0; s < ops.size(); s++) {
        ChunkOp op = ops.get(s);
        double[] result = op.getKernel().apply(local, values, u, blueprint.getFillValue(s),
            data.getType());
        Preconditions.ensure(result.length == u,
            () -> "chunk op " + op + " returned " + result.length + " values for " + u
                + " groups");
        if (op.isPositional()) {
          for (int g = 0; g < u; g++) {
            if (result[g] >= 0) {
              result[g] = positions[(int) result[g]];
            }
          }
        }
        System.arraycopy(result, 0, slots[s], row * u, u);
      }
      for (int i = 0; i < positions.length; i++) {
        if (local[i] >= 0 && nanPolicy.contributes(values[i])) {
          counts[row * u + local[i]]++;
        }
      }
    }
    return checkExact(new Partial(groups, batch, slots, counts), blueprint, data.getType());
  }

  /**
   * Fail if an integral intermediate left the range in which doubles hold integers exactly.
   * Infinite values are the fill of min and max and pass.
   */
  static Partial checkExact(Partial partial, AggregationBlueprint blueprint, DType inputType) {
    for (int s = 0; s < partial.getSlotCount(); s++) {
      DType type = blueprint.getIntermediateType(s, inputType);
      if (!type.isIntegral()) {
        continue;
      }
      final int slot = s;
      for (double v : partial.slot(s)) {
        Preconditions.checkData(!Double.isFinite(v) || Math.abs(v) <= DType.MAX_EXACT_INT64,
            () -> "intermediate " + v + " of " + blueprint.getName() + " slot " + slot
                + " is outside of the exact range of " + type);
      }
    }
    return partial;
  }

  /**
   * Apply the finalizer to every cell, and the final fill value to cells with fewer than
   * {@code max(1, minCount)} contributing elements.
   */
  static double[] finalizePartial(Partial partial, AggregationBlueprint blueprint) {
    long threshold = Math.max(1, blueprint.getMinCount());
    int slotCount = partial.getSlotCount();
    long[] counts = partial.counts();
    double[] ret = new double[counts.length];
    double[] cell = new double[slotCount];
    Finalizer finalizer = blueprint.getFinalizer();
    for (int c = 0; c < counts.length; c++) {
      if (counts[c] < threshold) {
        ret[c] = blueprint.getFinalFillValue();
        continue;
      }
      for (int s = 0; s < slotCount; s++) {
        cell[s] = partial.slot(s)[c];
      }
      ret[c] = finalizer.apply(cell);
    }
    return ret;
  }
}

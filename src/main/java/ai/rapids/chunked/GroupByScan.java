/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Grouped scans along a single reduced axis, computed chunk by chunk.
 * <p>
 * Every chunk is scanned on its own and summarized per group. The summaries are then
 * folded in axis order into the carry each chunk needs from the chunks before it, and the
 * carries are applied to the local scans. Only the carry chain is sequential. Positions
 * without a group are NaN in the output.
 */
public final class GroupByScan {
  private static final Logger log = LoggerFactory.getLogger(GroupByScan.class);

  private GroupByScan() {
  }

  public static ChunkedArray scan(ChunkedArray data, KeyColumn key,
                                  GroupByScanAggregation aggregation) {
    return scan(data, Collections.singletonList(key), aggregation, ReductionOptions.DEFAULT);
  }

  /**
   * Scan {@code data} by the groups of {@code keys}. Only the expected groups, sort policy
   * and engine of the options are used.
   * @return the scanned values, with the layout of {@code data}.
   */
  public static ChunkedArray scan(ChunkedArray data, List<KeyColumn> keys,
                                  GroupByScanAggregation aggregation, ReductionOptions options) {
    FactorizedKeys factorized = Factorizer.factorize(keys, options.getExpectedGroups(),
        options.getSortPolicy(), data.getLength());
    return scan(data, factorized.codes(), factorized.getGroupCount(), aggregation,
        options.getEngine());
  }

  static ChunkedArray scan(ChunkedArray data, int[] codes, int groupCount,
                           GroupByScanAggregation aggregation, ExecutionEngine engine) {
    ChunkLayout layout = data.getLayout();
    Preconditions.checkConfig(layout.getAxisCount() == 1,
        () -> "grouped scans need a single reduced axis, got " + layout);
    Preconditions.checkConfig(codes.length == layout.getLength(),
        () -> "got " + codes.length + " codes for data of length " + layout.getLength());
    for (int pos = 0; pos < codes.length; pos++) {
      final int code = codes[pos];
      final int at = pos;
      Preconditions.checkData(code == Factorizer.MISSING || (code >= 0 && code < groupCount),
          () -> "code " + code + " at position " + at + " is outside of [0, " + groupCount
              + ")");
    }

    int chunkCount = layout.getChunkCount();
    int[] order = new int[chunkCount];
    for (int i = 0; i < chunkCount; i++) {
      order[i] = aggregation.isReversed() ? chunkCount - 1 - i : i;
    }
    TaskGraph graph = new TaskGraph();
    int[] outputs = new int[chunkCount];
    int[] scans = new int[chunkCount];
    int carry = -1;
    for (int step = 0; step < chunkCount; step++) {
      int chunk = order[step];
      scans[step] = graph.addTask(TaskGraph.NodeKind.REDUCE_CHUNK, "scan-chunk-" + chunk,
          new int[0], inputs -> localScan(data, codes, groupCount, chunk, aggregation));
      if (step > 0) {
        int[] deps = carry < 0 ? new int[]{scans[step - 1]} : new int[]{carry, scans[step - 1]};
        carry = graph.addTask(TaskGraph.NodeKind.COMBINE, "carry-" + chunk, deps, inputs -> {
          double[] previous = inputs.size() == 1 ? identity(data, groupCount, aggregation)
              : (double[]) inputs.get(0);
          ChunkScan summary = (ChunkScan) inputs.get(inputs.size() - 1);
          return fold(previous, summary.summary, aggregation);
        });
      }
      int[] deps = step == 0 ? new int[]{scans[step]} : new int[]{scans[step], carry};
      outputs[step] = graph.addTask(TaskGraph.NodeKind.FINALIZE, "apply-" + chunk, deps,
          inputs -> {
            double[] carried = inputs.size() == 1 ? identity(data, groupCount, aggregation)
                : (double[]) inputs.get(1);
            return apply((ChunkScan) inputs.get(0), carried, groupCount, aggregation);
          });
    }
    log.debug("Scanning {} over {} chunks with {} tasks", aggregation, chunkCount,
        graph.size());
    Map<Integer, Object> results = chunkCount == 0 ? Map.of() : engine.execute(graph, outputs);

    int n = layout.getLength();
    int batch = data.getBatchSize();
    double[] out = new double[batch * n];
    for (int step = 0; step < chunkCount; step++) {
      int[] positions = layout.positions(order[step]);
      double[] values = (double[]) results.get(outputs[step]);
      for (int row = 0; row < batch; row++) {
        for (int i = 0; i < positions.length; i++) {
          out[row * n + positions[i]] = values[row * positions.length + i];
        }
      }
    }
    DType type = aggregation.getResultType(data.getType());
    if (Arrays.stream(codes).anyMatch(c -> c == Factorizer.MISSING)) {
      type = type.promoteForFill(Double.NaN);
    }
    return ChunkedArray.ofComputed(type, batch, layout, out);
  }

  /**
   * The local scan of one chunk and the per group summary of the chunk.
   */
  private static final class ChunkScan {
    final int[] positions;
    final int[] groups;
    final double[] local;
    final double[] summary;

    ChunkScan(int[] positions, int[] groups, double[] local, double[] summary) {
      this.positions = positions;
      this.groups = groups;
      this.local = local;
      this.summary = summary;
    }
  }

  private static ChunkScan localScan(ChunkedArray data, int[] codes, int groupCount, int chunk,
                                     GroupByScanAggregation aggregation) {
    int[] positions = data.getLayout().positions(chunk);
    int len = positions.length;
    int[] groups = new int[len];
    for (int i = 0; i < len; i++) {
      groups[i] = codes[positions[i]];
    }
    int batch = data.getBatchSize();
    double[] local = new double[batch * len];
    double[] summary = identity(data, groupCount, aggregation);
    boolean reversed = aggregation.isReversed();
    boolean cumsum = aggregation.getKind() == GroupByScanAggregation.Kind.CUMSUM;
    boolean skipNaN = aggregation.getNaNPolicy() == NaNPolicy.EXCLUDE;
    double[] values = new double[len];
    for (int row = 0; row < batch; row++) {
      data.gather(row, positions, values);
      int base = row * groupCount;
      for (int step = 0; step < len; step++) {
        int i = reversed ? len - 1 - step : step;
        int g = groups[i];
        if (g < 0) {
          local[row * len + i] = Double.NaN;
          continue;
        }
        double v = values[i];
        if (cumsum) {
          summary[base + g] += skipNaN && Double.isNaN(v) ? 0 : v;
        } else if (!Double.isNaN(v)) {
          summary[base + g] = v;
        }
        local[row * len + i] = summary[base + g];
      }
    }
    return new ChunkScan(positions, groups, local, summary);
  }

  private static double[] identity(ChunkedArray data, int groupCount,
                                   GroupByScanAggregation aggregation) {
    double[] ret = new double[data.getBatchSize() * groupCount];
    if (aggregation.getKind() != GroupByScanAggregation.Kind.CUMSUM) {
      Arrays.fill(ret, Double.NaN);
    }
    return ret;
  }

  private static double[] fold(double[] carry, double[] summary,
                               GroupByScanAggregation aggregation) {
    double[] ret = new double[carry.length];
    boolean cumsum = aggregation.getKind() == GroupByScanAggregation.Kind.CUMSUM;
    for (int c = 0; c < ret.length; c++) {
      if (cumsum) {
        ret[c] = carry[c] + summary[c];
      } else {
        ret[c] = Double.isNaN(summary[c]) ? carry[c] : summary[c];
      }
    }
    return ret;
  }

  private static double[] apply(ChunkScan scan, double[] carry, int groupCount,
                                GroupByScanAggregation aggregation) {
    int len = scan.positions.length;
    int batch = len == 0 ? 0 : scan.local.length / len;
    boolean cumsum = aggregation.getKind() == GroupByScanAggregation.Kind.CUMSUM;
    double[] ret = new double[scan.local.length];
    for (int row = 0; row < batch; row++) {
      for (int i = 0; i < len; i++) {
        int cell = row * len + i;
        int g = scan.groups[i];
        double v = scan.local[cell];
        if (g < 0) {
          ret[cell] = Double.NaN;
        } else if (cumsum) {
          ret[cell] = carry[row * groupCount + g] + v;
        } else {
          ret[cell] = Double.isNaN(v) ? carry[row * groupCount + g] : v;
        }
      }
    }
    return ret;
  }
}

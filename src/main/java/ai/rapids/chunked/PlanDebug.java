/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * Prints cohort plans, task graphs and results for debugging.
 */
public final class PlanDebug {

  /**
   * Specify one of
   * -Dai.rapids.chunked.debug.output=stderr       to print directly to standard error (default)
   * -Dai.rapids.chunked.debug.output=stdout       to print directly to standard output
   * -Dai.rapids.chunked.debug.output=log[_level]  to redirect to a logging subsystem that can
   * further be configured.
   * Supported log levels:
   * debug (default)
   * info
   * warn
   * error
   */
  public static final String OUTPUT_STREAM = "ai.rapids.chunked.debug.output";

  /**
   * Set -Dai.rapids.chunked.debug.plans=true to print every cohort plan {@link GroupBy}
   * makes.
   */
  public static final String PRINT_PLANS = "ai.rapids.chunked.debug.plans";

  private static final Logger log = LoggerFactory.getLogger(PlanDebug.class);

  private static final boolean ENABLED = Boolean.getBoolean(PRINT_PLANS);

  public enum Output {
    STDOUT(System.out::println),
    STDERR(System.err::println),
    LOG(log::debug),
    LOG_DEBUG(log::debug),
    LOG_INFO(log::info),
    LOG_WARN(log::warn),
    LOG_ERROR(log::error);

    private final Consumer<String> printFunc;

    Output(Consumer<String> pf) {
      this.printFunc = pf;
    }

    final void println(String s) {
      printFunc.accept(s);
    }
  }

  public static final class Builder {
    private Output outputMode = Output.STDERR;

    public Builder() {
      try {
        outputMode = Output.valueOf(
            System.getProperty(OUTPUT_STREAM, Output.STDERR.name())
                .toUpperCase(Locale.US));
      } catch (IllegalArgumentException e) {
        log.warn("Failed to parse the output mode", e);
      }
    }

    public Builder withOutput(Output outputMode) {
      this.outputMode = outputMode;
      return this;
    }

    public PlanDebug build() {
      return new PlanDebug(outputMode);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  private static final PlanDebug DEFAULT_DEBUG = builder().build();

  public static PlanDebug get() {
    return DEFAULT_DEBUG;
  }

  static boolean isEnabled() {
    return ENABLED;
  }

  private final Output output;

  private PlanDebug(Output output) {
    this.output = output;
  }

  /**
   * Print a cohort plan, one line per cohort. This is slow for plans with many cohorts.
   * @param name the name to print the plan under.
   */
  public synchronized void debug(String name, CohortPlan plan) {
    output.println("PLAN " + name + " - groups: " + plan.getGroupCount() + " chunks: "
        + plan.getChunkCount() + " density: " + plan.getDensity() + " preferred: "
        + plan.getPreferredMethod() + " blockwise: " + plan.isBlockwiseFeasible());
    int i = 0;
    for (Cohort c : plan.getCohorts()) {
      output.println(i++ + " GROUPS " + Arrays.toString(c.groups()) + " CHUNKS "
          + Arrays.toString(c.chunks()) + (c.spansAllChunks() ? " (ALL)" : ""));
    }
  }

  /**
   * Print the nodes of a task graph with their dependencies.
   */
  public synchronized void debug(String name, TaskGraph graph) {
    output.println("GRAPH " + name + " - " + graph.size() + " nodes");
    for (TaskGraph.Node node : graph.nodes()) {
      output.println(node.getKind() + " " + node);
    }
  }

  /**
   * Print every value of a result with its group labels.
   */
  public synchronized void debug(String name, GroupByResult result) {
    output.println("RESULT " + name + " - " + result);
    for (int row = 0; row < result.getBatchSize(); row++) {
      for (int g = 0; g < result.getGroupCount(); g++) {
        output.println(row + " " + Arrays.toString(result.getGroupLabels(g)) + " "
            + result.get(row, g));
      }
    }
  }
}

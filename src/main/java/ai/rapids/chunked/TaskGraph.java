/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The tasks of one reduction and their dependencies, handed to an {@link ExecutionEngine}.
 * A node only depends on nodes added before it, so node ids are a topological order.
 */
public final class TaskGraph {

  public enum NodeKind {
    /** Apply the chunk ops to one chunk. */
    REDUCE_CHUNK,
    /** Merge the partial results of its dependencies. */
    COMBINE,
    /** Turn one partial result into final values. */
    FINALIZE
  }

  public static final class Node {
    private final int id;
    private final NodeKind kind;
    private final String label;
    private final int[] dependencies;
    private final Function<List<Object>, Object> task;

    private Node(int id, NodeKind kind, String label, int[] dependencies,
                 Function<List<Object>, Object> task) {
      this.id = id;
      this.kind = kind;
      this.label = label;
      this.dependencies = dependencies;
      this.task = task;
    }

    public int getId() {
      return id;
    }

    public NodeKind getKind() {
      return kind;
    }

    public String getLabel() {
      return label;
    }

    public int[] getDependencies() {
      return dependencies.clone();
    }

    /**
     * Run the task on the results of the dependencies, in dependency order.
     */
    public Object run(List<Object> inputs) {
      Preconditions.ensure(inputs.size() == dependencies.length,
          () -> label + " needs " + dependencies.length + " inputs, got " + inputs.size());
      return task.apply(inputs);
    }

    @Override
    public String toString() {
      return id + ":" + label + (dependencies.length == 0 ? "" : " <- "
          + Arrays.toString(dependencies));
    }
  }

  private final List<Node> nodes = new ArrayList<>();

  public int addReduceChunk(String label, Supplier<Partial> task) {
    return addTask(NodeKind.REDUCE_CHUNK, label, new int[0], inputs -> task.get());
  }

  public int addCombine(String label, int[] dependencies, Function<List<Partial>, Partial> task) {
    return addTask(NodeKind.COMBINE, label, dependencies.clone(), inputs -> {
      List<Partial> parts = new ArrayList<>(inputs.size());
      for (Object o : inputs) {
        parts.add((Partial) o);
      }
      return task.apply(parts);
    });
  }

  public int addFinalize(String label, int dependency, Function<Partial, double[]> task) {
    return addTask(NodeKind.FINALIZE, label, new int[]{dependency},
        inputs -> task.apply((Partial) inputs.get(0)));
  }

  /**
   * Add a node running an untyped task on the results of its dependencies.
   */
  int addTask(NodeKind kind, String label, int[] dependencies,
              Function<List<Object>, Object> task) {
    int id = nodes.size();
    for (int dep : dependencies) {
      Preconditions.ensure(dep >= 0 && dep < id,
          () -> "node " + label + " depends on " + dep + " which is not an earlier node");
    }
    nodes.add(new Node(id, kind, label, dependencies, task));
    return id;
  }

  public List<Node> nodes() {
    return Collections.unmodifiableList(nodes);
  }

  public Node getNode(int id) {
    return nodes.get(id);
  }

  public int size() {
    return nodes.size();
  }

  /**
   * The number of nodes of one kind.
   */
  public int count(NodeKind kind) {
    int ret = 0;
    for (Node n : nodes) {
      if (n.kind == kind) {
        ret++;
      }
    }
    return ret;
  }

  /**
   * The nodes {@code outputs} transitively depend on, outputs included.
   */
  boolean[] needed(int[] outputs) {
    boolean[] ret = new boolean[nodes.size()];
    for (int out : outputs) {
      ret[out] = true;
    }
    for (int id = nodes.size() - 1; id >= 0; id--) {
      if (ret[id]) {
        for (int dep : nodes.get(id).dependencies) {
          ret[dep] = true;
        }
      }
    }
    return ret;
  }

  @Override
  public String toString() {
    return "TaskGraph" + nodes;
  }
}

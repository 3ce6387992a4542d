/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import java.util.Arrays;
import java.util.List;

/**
 * The intermediate result of one task: for every row of the batch and every group of its
 * universe, one value per blueprint slot plus the number of elements that contributed.
 * Never modified once a task returned it.
 */
public final class Partial {
  private final int[] groups;
  private final int batchSize;
  private final double[][] slots;
  private final long[] counts;

  Partial(int[] groups, int batchSize, double[][] slots, long[] counts) {
    Preconditions.ensure(counts.length == batchSize * groups.length,
        () -> "expected " + batchSize * groups.length + " counts, got " + counts.length);
    for (double[] slot : slots) {
      Preconditions.ensure(slot.length == counts.length, "slot and count sizes differ");
    }
    this.groups = groups;
    this.batchSize = batchSize;
    this.slots = slots;
    this.counts = counts;
  }

  /**
   * The global group codes this partial covers, in increasing order.
   */
  public int[] getGroups() {
    return groups.clone();
  }

  public int getUniverseSize() {
    return groups.length;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public int getSlotCount() {
    return slots.length;
  }

  /**
   * The value of a slot for a row and the group at {@code local} in the universe.
   */
  public double get(int slot, int row, int local) {
    return slots[slot][row * groups.length + local];
  }

  public long getCount(int row, int local) {
    return counts[row * groups.length + local];
  }

  int[] groups() {
    return groups;
  }

  double[] slot(int slot) {
    return slots[slot];
  }

  long[] counts() {
    return counts;
  }

  /**
   * Merge partials over the same universe into a new one, left to right.
   */
  static Partial combine(List<Partial> parts, AggregationBlueprint blueprint) {
    Preconditions.ensure(!parts.isEmpty(), "nothing to combine");
    Partial acc = parts.get(0);
    for (int i = 1; i < parts.size(); i++) {
      acc = combine(acc, parts.get(i), blueprint);
    }
    return acc;
  }

  static Partial combine(Partial left, Partial right, AggregationBlueprint blueprint) {
    Preconditions.ensure(Arrays.equals(left.groups, right.groups),
        "cannot combine partials over different groups");
    Preconditions.ensure(left.slots.length == right.slots.length, "slot counts differ");
    int cells = left.counts.length;
    int slotCount = left.slots.length;
    long[] counts = new long[cells];
    for (int c = 0; c < cells; c++) {
      counts[c] = left.counts[c] + right.counts[c];
    }
    double[][] slots = new double[slotCount][cells];
    List<CombineOp> ops = blueprint.getCombineOps();
    if (blueprint.hasCustomCombine()) {
      PartialCombiner combiner = ops.get(0).getCombiner();
      double[] l = new double[slotCount];
      double[] r = new double[slotCount];
      for (int c = 0; c < cells; c++) {
        for (int s = 0; s < slotCount; s++) {
          l[s] = left.slots[s][c];
          r[s] = right.slots[s][c];
        }
        double[] merged = combiner.combine(l.clone(), left.counts[c], r.clone(),
            right.counts[c]);
        Preconditions.ensure(merged.length == slotCount,
            () -> "combine op " + ops.get(0) + " returned " + merged.length
                + " values for " + slotCount + " slots");
        for (int s = 0; s < slotCount; s++) {
          slots[s][c] = merged[s];
        }
      }
    } else {
      Preconditions.ensure(ops.size() == slotCount,
          () -> "blueprint " + blueprint.getName() + " cannot combine partials");
      for (int s = 0; s < slotCount; s++) {
        CombineOp.Binary op = ops.get(s).getBinary();
        double[] l = left.slots[s];
        double[] r = right.slots[s];
        double[] out = slots[s];
        for (int c = 0; c < cells; c++) {
          out[c] = op.apply(l[c], r[c]);
        }
      }
    }
    return new Partial(left.groups, left.batchSize, slots, counts);
  }

  @Override
  public String toString() {
    return "Partial{groups=" + Arrays.toString(groups) + ", batch=" + batchSize
        + ", slots=" + slots.length + "}";
  }
}

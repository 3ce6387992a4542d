/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds which groups occur in which chunks and clusters groups with the same chunk
 * membership into cohorts.
 * <p>
 * With a merge threshold of 0 only groups with identical membership share a cohort. A
 * positive threshold also merges cohorts whose chunk sets differ by at most that many
 * chunks, giving fewer and larger cohorts that read a few chunks they do not need.
 */
public final class CohortPlanner {
  private static final Logger log = LoggerFactory.getLogger(CohortPlanner.class);

  private static final double DEFAULT_MAX_DENSITY =
      Double.parseDouble(System.getProperty("ai.rapids.chunked.cohorts.maxDensity", "0.4"));

  private final int mergeThreshold;
  private final double maxDensity;

  /**
   * A planner that only groups identical memberships.
   */
  public CohortPlanner() {
    this(0);
  }

  public CohortPlanner(int mergeThreshold) {
    this(mergeThreshold, DEFAULT_MAX_DENSITY);
  }

  /**
   * @param mergeThreshold the largest number of chunks two merged cohorts may disagree on.
   * @param maxDensity the highest group/chunk membership density for which cohorts are
   *                   preferred over map-reduce.
   */
  public CohortPlanner(int mergeThreshold, double maxDensity) {
    Preconditions.checkConfig(mergeThreshold >= 0,
        () -> "merge threshold must not be negative, got " + mergeThreshold);
    Preconditions.checkConfig(maxDensity >= 0 && maxDensity <= 1,
        () -> "max density must be in [0, 1], got " + maxDensity);
    this.mergeThreshold = mergeThreshold;
    this.maxDensity = maxDensity;
  }

  public int getMergeThreshold() {
    return mergeThreshold;
  }

  public double getMaxDensity() {
    return maxDensity;
  }

  /**
   * Plan the reduction of {@code codes}, one per flattened position of {@code layout}.
   * @param codes group codes in [0, groupCount) or {@link Factorizer#MISSING}.
   */
  public CohortPlan plan(int[] codes, int groupCount, ChunkLayout layout) {
    Preconditions.checkConfig(codes.length == layout.getLength(),
        () -> "got " + codes.length + " codes for a layout of length " + layout.getLength());
    Preconditions.checkConfig(groupCount >= 0,
        () -> "group count must not be negative, got " + groupCount);
    int chunkCount = layout.getChunkCount();
    BitSet[] groupSets = newBitSets(groupCount);
    BitSet[] chunkSets = newBitSets(chunkCount);
    if (layout.getAxisCount() == 1 && isMonotonic(codes, groupCount)) {
      monotonicMembership(codes, layout, groupSets, chunkSets);
    } else {
      int[] chunkIds = layout.chunkIdsByPosition();
      for (int pos = 0; pos < codes.length; pos++) {
        int code = codes[pos];
        if (code == Factorizer.MISSING) {
          continue;
        }
        checkCode(code, groupCount, pos);
        groupSets[code].set(chunkIds[pos]);
        chunkSets[chunkIds[pos]].set(code);
      }
    }

    List<Cohort> cohorts = clusterGroups(groupSets, chunkCount);
    boolean blockwise = isBlockwise(cohorts, chunkSets);
    int[][] groupChunks = toArrays(groupSets);
    int[][] chunkMembers = toArrays(chunkSets);
    CohortPlan plan = new CohortPlan(cohorts, groupCount, chunkCount, chunkMembers,
        groupChunks, blockwise, ReductionMethod.MAP_REDUCE);
    ReductionMethod preferred = preferredMethod(plan);
    plan = new CohortPlan(cohorts, groupCount, chunkCount, chunkMembers, groupChunks,
        blockwise, preferred);
    if (log.isDebugEnabled()) {
      log.debug("Planned {} cohorts for {} groups over {} chunks, density {}, preferred {}",
          cohorts.size(), groupCount, chunkCount, plan.getDensity(), preferred);
    }
    return plan;
  }

  private ReductionMethod preferredMethod(CohortPlan plan) {
    if (plan.isBlockwiseFeasible()) {
      return ReductionMethod.BLOCKWISE;
    }
    if (plan.getCohortCount() < plan.getNonEmptyGroupCount()
        && plan.getDensity() <= maxDensity) {
      return ReductionMethod.COHORTS;
    }
    return ReductionMethod.MAP_REDUCE;
  }

  private List<Cohort> clusterGroups(BitSet[] groupSets, int chunkCount) {
    // insertion order follows the smallest group of every membership set
    Map<BitSet, BitSet> byMembership = new LinkedHashMap<>();
    for (int g = 0; g < groupSets.length; g++) {
      if (groupSets[g].isEmpty()) {
        continue;
      }
      byMembership.computeIfAbsent(groupSets[g], k -> new BitSet()).set(g);
    }
    List<BitSet[]> clusters = new ArrayList<>();
    for (Map.Entry<BitSet, BitSet> e : byMembership.entrySet()) {
      clusters.add(new BitSet[]{e.getValue(), (BitSet) e.getKey().clone()});
    }
    if (mergeThreshold > 0 && clusters.size() > 1) {
      clusters = merge(clusters);
    }
    clusters.sort(Comparator.comparingInt(c -> c[0].nextSetBit(0)));
    List<Cohort> ret = new ArrayList<>(clusters.size());
    for (BitSet[] c : clusters) {
      ret.add(new Cohort(c[0].stream().toArray(), c[1].stream().toArray(),
          c[1].cardinality() == chunkCount));
    }
    return ret;
  }

  /**
   * Greedily fold every cohort, widest first, into the first merged cohort whose chunks
   * differ from its own by at most the threshold.
   */
  private List<BitSet[]> merge(List<BitSet[]> exact) {
    List<BitSet[]> sorted = new ArrayList<>(exact);
    sorted.sort(Comparator.<BitSet[]>comparingInt(c -> -c[1].cardinality())
        .thenComparingInt(c -> c[0].nextSetBit(0)));
    List<BitSet[]> merged = new ArrayList<>();
    for (BitSet[] candidate : sorted) {
      BitSet[] target = null;
      for (BitSet[] m : merged) {
        BitSet diff = (BitSet) m[1].clone();
        diff.xor(candidate[1]);
        if (diff.cardinality() <= mergeThreshold) {
          target = m;
          break;
        }
      }
      if (target == null) {
        merged.add(new BitSet[]{(BitSet) candidate[0].clone(), (BitSet) candidate[1].clone()});
      } else {
        target[0].or(candidate[0]);
        target[1].or(candidate[1]);
      }
    }
    log.debug("Merged {} exact cohorts into {} with threshold {}", exact.size(), merged.size(),
        mergeThreshold);
    return merged;
  }

  private static boolean isBlockwise(List<Cohort> cohorts, BitSet[] chunkSets) {
    int[] cohortsPerChunk = new int[chunkSets.length];
    for (Cohort c : cohorts) {
      if (c.getChunkCount() != 1) {
        return false;
      }
      cohortsPerChunk[c.chunks()[0]]++;
    }
    for (int chunk = 0; chunk < chunkSets.length; chunk++) {
      if (!chunkSets[chunk].isEmpty() && cohortsPerChunk[chunk] != 1) {
        return false;
      }
    }
    return true;
  }

  /**
   * True if the codes, ignoring missing values, never decrease.
   */
  static boolean isMonotonic(int[] codes, int groupCount) {
    int last = -1;
    for (int pos = 0; pos < codes.length; pos++) {
      int code = codes[pos];
      if (code == Factorizer.MISSING) {
        continue;
      }
      checkCode(code, groupCount, pos);
      if (code < last) {
        return false;
      }
      last = code;
    }
    return true;
  }

  /**
   * Membership of sorted 1-D codes from each group's first and last position. The chunks
   * in between belong to the group unless they only hold missing values.
   */
  private static void monotonicMembership(int[] codes, ChunkLayout layout, BitSet[] groupSets,
                                          BitSet[] chunkSets) {
    int chunkCount = layout.getChunkCount();
    boolean[] hasValues = new boolean[chunkCount];
    int pos = 0;
    while (pos < codes.length) {
      int code = codes[pos];
      if (code == Factorizer.MISSING) {
        pos++;
        continue;
      }
      int end = pos;
      while (end + 1 < codes.length
          && (codes[end + 1] == code || codes[end + 1] == Factorizer.MISSING)) {
        end++;
      }
      // trailing missing values do not belong to the group
      while (codes[end] != code) {
        end--;
      }
      int first = layout.chunkOf(pos);
      int last = layout.chunkOf(end);
      groupSets[code].set(first, last + 1);
      hasValues[first] = true;
      hasValues[last] = true;
      pos = end + 1;
    }
    for (int g = 0; g < groupSets.length; g++) {
      BitSet chunks = groupSets[g];
      if (chunks.cardinality() > 2) {
        // a middle chunk made only of missing values has no elements of the group
        for (int c = chunks.nextSetBit(0); c >= 0; c = chunks.nextSetBit(c + 1)) {
          if (!hasValues[c] && !hasAnyCode(codes, layout, c)) {
            chunks.clear(c);
          }
        }
      }
      for (int c = chunks.nextSetBit(0); c >= 0; c = chunks.nextSetBit(c + 1)) {
        chunkSets[c].set(g);
      }
    }
  }

  private static boolean hasAnyCode(int[] codes, ChunkLayout layout, int chunk) {
    for (int pos : layout.positions(chunk)) {
      if (codes[pos] != Factorizer.MISSING) {
        return true;
      }
    }
    return false;
  }

  private static void checkCode(int code, int groupCount, int pos) {
    Preconditions.checkData(code >= 0 && code < groupCount,
        () -> "code " + code + " at position " + pos + " is outside of [0, " + groupCount + ")");
  }

  private static BitSet[] newBitSets(int n) {
    BitSet[] ret = new BitSet[n];
    for (int i = 0; i < n; i++) {
      ret[i] = new BitSet();
    }
    return ret;
  }

  private static int[][] toArrays(BitSet[] sets) {
    int[][] ret = new int[sets.length][];
    for (int i = 0; i < sets.length; i++) {
      ret[i] = sets[i].stream().toArray();
    }
    return ret;
  }
}

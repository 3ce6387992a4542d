/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import java.util.Arrays;

/**
 * A set of groups together with every chunk holding at least one element of them.
 */
public final class Cohort {
  private final int[] groups;
  private final int[] chunks;
  private final boolean spansAllChunks;

  Cohort(int[] groups, int[] chunks, boolean spansAllChunks) {
    this.groups = groups;
    this.chunks = chunks;
    this.spansAllChunks = spansAllChunks;
  }

  /**
   * The group codes, in increasing order.
   */
  public int[] getGroups() {
    return groups.clone();
  }

  /**
   * The chunk ids, in increasing order.
   */
  public int[] getChunks() {
    return chunks.clone();
  }

  public int getGroupCount() {
    return groups.length;
  }

  public int getChunkCount() {
    return chunks.length;
  }

  /**
   * True if every chunk of the layout holds an element of this cohort. Such cohorts are
   * reduced with the map-reduce path.
   */
  public boolean spansAllChunks() {
    return spansAllChunks;
  }

  int[] groups() {
    return groups;
  }

  int[] chunks() {
    return chunks;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    } else if (o instanceof Cohort) {
      Cohort other = (Cohort) o;
      return spansAllChunks == other.spansAllChunks && Arrays.equals(groups, other.groups)
          && Arrays.equals(chunks, other.chunks);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(groups) + Arrays.hashCode(chunks);
  }

  @Override
  public String toString() {
    return "Cohort{groups=" + Arrays.toString(groups) + ", chunks=" + Arrays.toString(chunks)
        + (spansAllChunks ? ", all chunks" : "") + "}";
  }
}

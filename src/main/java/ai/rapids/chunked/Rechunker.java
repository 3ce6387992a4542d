/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Moves chunk boundaries so a reduction can run blockwise.
 */
public final class Rechunker {
  private static final Logger log = LoggerFactory.getLogger(Rechunker.class);

  private Rechunker() {
  }

  /**
   * A layout close to {@code layout} whose chunk boundaries all fall where a new group
   * starts, so that no group spans two chunks. Every boundary is moved to the nearest group
   * start, the earlier one on a tie, and boundaries that end up on the same position are
   * merged.
   * @param codes sorted 1-D codes, missing values allowed anywhere.
   * @throws GroupByDataException if the codes are not sorted.
   */
  public static ChunkLayout forBlockwise(int[] codes, ChunkLayout layout) {
    Preconditions.checkConfig(layout.getAxisCount() == 1,
        () -> "only layouts with a single reduced axis can be rechunked, got " + layout);
    Preconditions.checkConfig(codes.length == layout.getLength(),
        () -> "got " + codes.length + " codes for a layout of length " + layout.getLength());
    TreeSet<Integer> groupStarts = new TreeSet<>();
    int last = Factorizer.MISSING;
    for (int pos = 0; pos < codes.length; pos++) {
      int code = codes[pos];
      if (code == Factorizer.MISSING) {
        continue;
      }
      final int previous = last;
      final int at = pos;
      Preconditions.checkData(code >= previous,
          () -> "codes must be sorted to rechunk for a blockwise reduction, but " + code
              + " at position " + at + " follows " + previous);
      if (previous != Factorizer.MISSING && code != previous) {
        groupStarts.add(pos);
      }
      last = code;
    }

    TreeSet<Integer> boundaries = new TreeSet<>();
    int offset = 0;
    int[] sizes = layout.getChunkSizes(0);
    for (int i = 0; i < sizes.length - 1; i++) {
      offset += sizes[i];
      Integer below = groupStarts.floor(offset);
      Integer above = groupStarts.ceiling(offset);
      if (below == null && above == null) {
        continue;
      } else if (below == null) {
        boundaries.add(above);
      } else if (above == null || offset - below <= above - offset) {
        boundaries.add(below);
      } else {
        boundaries.add(above);
      }
    }

    List<Integer> newSizes = new ArrayList<>();
    int start = 0;
    for (int boundary : boundaries) {
      newSizes.add(boundary - start);
      start = boundary;
    }
    newSizes.add(codes.length - start);
    ChunkLayout ret = ChunkLayout.of(newSizes.stream().mapToInt(Integer::intValue).toArray());
    log.debug("Rechunked {} to {} for a blockwise reduction", layout, ret);
    return ret;
  }
}

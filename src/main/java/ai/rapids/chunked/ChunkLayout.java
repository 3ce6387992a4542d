/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import java.util.Arrays;

/**
 * The chunk sizes of every reduced axis of an array.
 * <p>
 * Positions along the reduced axes are flattened row-major (the last axis varies fastest),
 * which is also how codes are indexed. A chunk id combines the per axis chunk indices in the
 * same row-major order, so a layout with a single axis has chunk ids equal to the chunk
 * indices along that axis and every chunk is a contiguous range of positions.
 * <p>
 * Instances are immutable and compare structurally, so they can be used in cache keys.
 */
public final class ChunkLayout {
  private final int[][] chunkSizes;
  // per axis, the start of each chunk plus the axis length at the end
  private final int[][] offsets;
  private final int[] axisLengths;
  private final int chunkCount;
  private final int length;
  private final int hash;

  private ChunkLayout(int[][] chunkSizes) {
    this.chunkSizes = new int[chunkSizes.length][];
    this.offsets = new int[chunkSizes.length][];
    this.axisLengths = new int[chunkSizes.length];
    long chunks = 1;
    long total = 1;
    for (int axis = 0; axis < chunkSizes.length; axis++) {
      int[] sizes = chunkSizes[axis].clone();
      int[] starts = new int[sizes.length + 1];
      for (int i = 0; i < sizes.length; i++) {
        final int chunk = i;
        final int ax = axis;
        Preconditions.checkConfig(sizes[i] > 0,
            () -> "chunk " + chunk + " of axis " + ax + " has non-positive size " + sizes[chunk]);
        starts[i + 1] = Math.addExact(starts[i], sizes[i]);
      }
      this.chunkSizes[axis] = sizes;
      this.offsets[axis] = starts;
      this.axisLengths[axis] = starts[sizes.length];
      chunks *= sizes.length;
      total *= starts[sizes.length];
    }
    Preconditions.checkConfig(chunks <= Integer.MAX_VALUE && total <= Integer.MAX_VALUE,
        () -> "layout is too large: " + Arrays.deepToString(chunkSizes));
    this.chunkCount = (int) chunks;
    this.length = (int) total;
    this.hash = Arrays.deepHashCode(this.chunkSizes);
  }

  /**
   * A layout for a single reduced axis.
   * @param chunkSizes the size of each chunk in order, all positive.
   */
  public static ChunkLayout of(int... chunkSizes) {
    return new ChunkLayout(new int[][]{chunkSizes});
  }

  /**
   * A layout over several reduced axes, one array of chunk sizes per axis.
   */
  public static ChunkLayout ofAxes(int[]... chunkSizesPerAxis) {
    Preconditions.checkConfig(chunkSizesPerAxis.length > 0, () -> "at least one axis is required");
    return new ChunkLayout(chunkSizesPerAxis);
  }

  /**
   * Split an axis of {@code length} positions into chunks of {@code chunkSize}, the last one
   * possibly smaller.
   */
  public static ChunkLayout uniform(int length, int chunkSize) {
    Preconditions.checkConfig(chunkSize > 0, () -> "chunk size must be positive: " + chunkSize);
    int count = (length + chunkSize - 1) / chunkSize;
    int[] sizes = new int[count];
    Arrays.fill(sizes, chunkSize);
    if (count > 0 && length % chunkSize != 0) {
      sizes[count - 1] = length % chunkSize;
    }
    return of(sizes);
  }

  /**
   * One chunk holding the whole axis.
   */
  public static ChunkLayout single(int length) {
    return length == 0 ? of() : of(length);
  }

  public int getAxisCount() {
    return chunkSizes.length;
  }

  public int getChunkCount() {
    return chunkCount;
  }

  /**
   * Total number of flattened positions.
   */
  public int getLength() {
    return length;
  }

  public int getAxisLength(int axis) {
    return axisLengths[axis];
  }

  public int[] getChunkSizes(int axis) {
    return chunkSizes[axis].clone();
  }

  /**
   * The number of positions in a chunk.
   */
  public int chunkSize(int chunkId) {
    checkChunk(chunkId);
    int size = 1;
    int rest = chunkId;
    for (int axis = chunkSizes.length - 1; axis >= 0; axis--) {
      int n = chunkSizes[axis].length;
      size *= chunkSizes[axis][rest % n];
      rest /= n;
    }
    return size;
  }

  /**
   * The id of the chunk holding a flattened position.
   */
  public int chunkOf(int flatPosition) {
    Preconditions.checkConfig(flatPosition >= 0 && flatPosition < length,
        () -> "position " + flatPosition + " is outside of a layout of length " + length);
    int chunkId = 0;
    int chunkStride = 1;
    int rest = flatPosition;
    for (int axis = chunkSizes.length - 1; axis >= 0; axis--) {
      int pos = rest % axisLengths[axis];
      rest /= axisLengths[axis];
      chunkId += chunkIndex(axis, pos) * chunkStride;
      chunkStride *= chunkSizes[axis].length;
    }
    return chunkId;
  }

  /**
   * The chunk id of every position, indexed by flattened position.
   */
  public int[] chunkIdsByPosition() {
    int[] ret = new int[length];
    for (int chunk = 0; chunk < chunkCount; chunk++) {
      for (int pos : positions(chunk)) {
        ret[pos] = chunk;
      }
    }
    return ret;
  }

  /**
   * The flattened positions of a chunk in increasing order.
   */
  public int[] positions(int chunkId) {
    checkChunk(chunkId);
    int axes = chunkSizes.length;
    int[] starts = new int[axes];
    int[] sizes = new int[axes];
    int rest = chunkId;
    for (int axis = axes - 1; axis >= 0; axis--) {
      int n = chunkSizes[axis].length;
      int idx = rest % n;
      rest /= n;
      starts[axis] = offsets[axis][idx];
      sizes[axis] = chunkSizes[axis][idx];
    }
    int total = 1;
    for (int s : sizes) {
      total *= s;
    }
    int[] ret = new int[total];
    int[] counter = new int[axes];
    for (int i = 0; i < total; i++) {
      int flat = 0;
      for (int axis = 0; axis < axes; axis++) {
        flat = flat * axisLengths[axis] + starts[axis] + counter[axis];
      }
      ret[i] = flat;
      // odometer increment, last axis fastest
      for (int axis = axes - 1; axis >= 0; axis--) {
        if (++counter[axis] < sizes[axis]) {
          break;
        }
        counter[axis] = 0;
      }
    }
    return ret;
  }

  private int chunkIndex(int axis, int position) {
    int idx = Arrays.binarySearch(offsets[axis], position);
    // an exact hit is the start of that chunk, otherwise it is inside the previous one
    return idx >= 0 ? idx : -idx - 2;
  }

  private void checkChunk(int chunkId) {
    Preconditions.checkConfig(chunkId >= 0 && chunkId < chunkCount,
        () -> "chunk " + chunkId + " is outside of a layout with " + chunkCount + " chunks");
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    } else if (o instanceof ChunkLayout) {
      return Arrays.deepEquals(chunkSizes, ((ChunkLayout) o).chunkSizes);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return "ChunkLayout" + Arrays.deepToString(chunkSizes);
  }
}

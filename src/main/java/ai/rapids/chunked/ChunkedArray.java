/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

/**
 * A read-only array split into chunks along its reduced axes.
 * <p>
 * The array is viewed as {@code batch} rows of {@link ChunkLayout#getLength()} reduced
 * positions each: the reduced axes are moved to the end and flattened, and every other
 * dimension is folded into the batch. Reductions produce one value per row and group.
 * Chunks are only ever read through {@link #gather(int, int[], double[])}, one chunk of one
 * row at a time.
 */
public final class ChunkedArray {
  private final double[] data;
  private final int batchSize;
  private final ChunkLayout layout;
  private final DType type;

  private ChunkedArray(double[] data, int batchSize, ChunkLayout layout, DType type) {
    Preconditions.checkConfig(batchSize >= 0, () -> "negative batch size " + batchSize);
    Preconditions.checkConfig((long) batchSize * layout.getLength() == data.length,
        () -> "data of length " + data.length + " does not match " + batchSize + " rows of "
            + layout);
    this.data = data;
    this.batchSize = batchSize;
    this.layout = layout;
    this.type = type;
  }

  /**
   * A single row of FLOAT64 values.
   */
  public static ChunkedArray fromDoubles(ChunkLayout layout, double... values) {
    return new ChunkedArray(values.clone(), 1, layout, DType.FLOAT64);
  }

  /**
   * A single row of INT64 values, each within +/- {@link DType#MAX_EXACT_INT64}.
   * @throws GroupByConfigurationException for a value outside of that range.
   */
  public static ChunkedArray fromLongs(ChunkLayout layout, long... values) {
    double[] data = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      checkExact(DType.INT64, values[i], i);
      data[i] = values[i];
    }
    return new ChunkedArray(data, 1, layout, DType.INT64);
  }

  /**
   * A single row of INT32 values.
   */
  public static ChunkedArray fromInts(ChunkLayout layout, int... values) {
    double[] data = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      data[i] = values[i];
    }
    return new ChunkedArray(data, 1, layout, DType.INT32);
  }

  /**
   * A single row of BOOL8 values.
   */
  public static ChunkedArray fromBooleans(ChunkLayout layout, boolean... values) {
    double[] data = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      data[i] = values[i] ? 1 : 0;
    }
    return new ChunkedArray(data, 1, layout, DType.BOOL8);
  }

  /**
   * Several rows stored row-major, {@code batchSize * layout.getLength()} values in total.
   * Values are brought into {@code type} with {@link DType#cast(double)}.
   * @throws GroupByConfigurationException if {@code type} is integral and a value is NaN or
   *     cannot be held exactly.
   */
  public static ChunkedArray fromRows(DType type, int batchSize, ChunkLayout layout,
                                      double... values) {
    if (type.isIntegral()) {
      for (int i = 0; i < values.length; i++) {
        final int at = i;
        Preconditions.checkConfig(!Double.isNaN(values[i]),
            () -> "NaN at " + at + " cannot be stored as " + type);
        Preconditions.checkConfig(Math.abs(values[i]) <= DType.MAX_EXACT_INT64
                && type.holdsExactly((long) values[i]),
            () -> "value " + values[at] + " at " + at + " cannot be held exactly as " + type);
      }
    }
    return ofComputed(type, batchSize, layout, values);
  }

  /**
   * Wrap values computed by a reduction, casting them with {@link DType#cast(double)}.
   */
  static ChunkedArray ofComputed(DType type, int batchSize, ChunkLayout layout,
                                 double[] values) {
    double[] data = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      data[i] = type.cast(values[i]);
    }
    return new ChunkedArray(data, batchSize, layout, type);
  }

  private static void checkExact(DType type, long value, int at) {
    Preconditions.checkConfig(type.holdsExactly(value),
        () -> "value " + value + " at " + at + " cannot be held exactly as " + type
            + ", the limit is +/- " + DType.MAX_EXACT_INT64);
  }

  /**
   * The same values with a different chunking. Only the layout changes, nothing is copied.
   */
  public ChunkedArray rechunk(ChunkLayout newLayout) {
    Preconditions.checkConfig(newLayout.getLength() == layout.getLength(),
        () -> "cannot rechunk " + layout + " to " + newLayout + " of a different length");
    return new ChunkedArray(data, batchSize, newLayout, type);
  }

  public int getBatchSize() {
    return batchSize;
  }

  /**
   * The number of reduced positions in each row.
   */
  public int getLength() {
    return layout.getLength();
  }

  public ChunkLayout getLayout() {
    return layout;
  }

  public DType getType() {
    return type;
  }

  public double get(int row, int position) {
    return data[row * layout.getLength() + position];
  }

  /**
   * Copy the values at {@code positions} of one row into {@code out}.
   */
  void gather(int row, int[] positions, double[] out) {
    int base = row * layout.getLength();
    for (int i = 0; i < positions.length; i++) {
      out[i] = data[base + positions[i]];
    }
  }
}

/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import java.util.EnumSet;

/**
 * The type of the values held by a {@link ChunkedArray} or produced by a reduction.
 * <p>
 * Values are always carried in {@code double} storage. Integral and boolean types only ever
 * hold exact integral values, and {@link #cast(double)} is how a computed value is brought
 * into the range of a type.
 */
public final class DType {

  /* enum representing the supported types. Whenever a new type is added please make sure
  a singleton object for it is created and that fromEnum is updated. */
  public enum DTypeEnum {
    INT32(4),
    INT64(8),
    FLOAT32(4),
    FLOAT64(8),
    /**
     * 1 for true and 0 for false.
     */
    BOOL8(1);

    final int sizeInBytes;

    DTypeEnum(int sizeInBytes) {
      this.sizeInBytes = sizeInBytes;
    }

    public int getSizeInBytes() { return sizeInBytes; }
  }

  private static final EnumSet<DTypeEnum> INTEGRALS = EnumSet.of(DTypeEnum.INT32, DTypeEnum.INT64);
  private static final EnumSet<DTypeEnum> FLOATS = EnumSet.of(DTypeEnum.FLOAT32, DTypeEnum.FLOAT64);

  final DTypeEnum typeId;

  private DType(DTypeEnum id) {
    typeId = id;
  }

  public static final DType INT32 = new DType(DTypeEnum.INT32);
  public static final DType INT64 = new DType(DTypeEnum.INT64);
  public static final DType FLOAT32 = new DType(DTypeEnum.FLOAT32);
  public static final DType FLOAT64 = new DType(DTypeEnum.FLOAT64);
  public static final DType BOOL8 = new DType(DTypeEnum.BOOL8);

  /**
   * Values are held as doubles, so INT64 values are only exact within +/- 2^53.
   */
  public static final long MAX_EXACT_INT64 = 1L << 53;

  public static DType fromEnum(DTypeEnum id) {
    switch (id) {
      case INT32: return INT32;
      case INT64: return INT64;
      case FLOAT32: return FLOAT32;
      case FLOAT64: return FLOAT64;
      case BOOL8: return BOOL8;
      default:
        throw new IllegalArgumentException("Unsupported type " + id);
    }
  }

  public DTypeEnum getTypeId() {
    return typeId;
  }

  public int getSizeInBytes() {
    return typeId.sizeInBytes;
  }

  public boolean isIntegral() {
    return INTEGRALS.contains(typeId);
  }

  public boolean isFloatingPoint() {
    return FLOATS.contains(typeId);
  }

  public boolean isBoolean() {
    return typeId == DTypeEnum.BOOL8;
  }

  /**
   * An integral or boolean result type cannot hold a NaN fill value, so in that case the
   * result is widened to FLOAT64. Any other combination is returned unchanged.
   */
  public DType promoteForFill(double fillValue) {
    if (!isFloatingPoint() && Double.isNaN(fillValue)) {
      return FLOAT64;
    }
    return this;
  }

  /**
   * True if {@code value} is an integral value this type holds exactly. Only meaningful for
   * the integral types.
   */
  boolean holdsExactly(long value) {
    if (typeId == DTypeEnum.INT32) {
      return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
    }
    return value >= -MAX_EXACT_INT64 && value <= MAX_EXACT_INT64;
  }

  /**
   * Bring a computed value into this type. Integral types truncate toward zero, FLOAT32
   * rounds to float precision and BOOL8 maps any non-zero value to 1. NaN is only kept by
   * the floating point types.
   * @throws GroupByDataException if the value is NaN or out of the exact range of an
   *     integral type. Which values reach this depends on the data, so it can only be
   *     found once the reduction ran.
   */
  public double cast(double value) {
    switch (typeId) {
      case INT32:
      case INT64: {
        Preconditions.checkData(!Double.isNaN(value), () -> "NaN cannot be stored as " + this);
        long truncated = (long) value;
        Preconditions.checkData(Math.abs(value) < Long.MAX_VALUE && holdsExactly(truncated),
            () -> value + " is outside of the exact range of " + this);
        return truncated;
      }
      case FLOAT32:
        return (float) value;
      case BOOL8:
        return value != 0 ? 1 : 0;
      default:
        return value;
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    DType type = (DType) o;
    return typeId == type.typeId;
  }

  @Override
  public int hashCode() {
    return typeId.hashCode();
  }

  @Override
  public String toString() {
    return typeId.name();
  }
}

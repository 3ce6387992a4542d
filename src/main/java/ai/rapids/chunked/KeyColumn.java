/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import java.util.Comparator;

/**
 * The raw values of one group-by key, one per reduced position.
 * <p>
 * Values are handed to the {@link Factorizer} in a normalized boxed form so that equal keys
 * compare equal regardless of how they were supplied: doubles become {@link Double} with
 * {@code -0.0} folded into {@code 0.0}, integral values become {@link Long}. Missing values
 * (NaN for doubles, {@code null} or NaN for objects) never belong to a group.
 */
public abstract class KeyColumn {

  KeyColumn() {
  }

  /**
   * Keys held as doubles. NaN marks a missing key.
   */
  public static KeyColumn ofDoubles(double... values) {
    return new DoubleKeys(values.clone());
  }

  /**
   * Keys held as longs. No value is missing.
   */
  public static KeyColumn ofLongs(long... values) {
    return new LongKeys(values.clone());
  }

  /**
   * Keys held as ints, handled exactly like {@link #ofLongs(long...)}.
   */
  public static KeyColumn ofInts(int... values) {
    long[] longs = new long[values.length];
    for (int i = 0; i < values.length; i++) {
      longs[i] = values[i];
    }
    return new LongKeys(longs);
  }

  /**
   * Arbitrary objects, for example strings. {@code null} marks a missing key. Sorted
   * factorization needs the values to be mutually {@link Comparable}.
   */
  public static KeyColumn ofObjects(Object... values) {
    return new ObjectKeys(values.clone());
  }

  /**
   * Keys that are already dense integer labels in {@code [0, groupCount)}. Codes outside of
   * that range are missing. No factorization work is done for these beyond the range check.
   */
  public static KeyColumn ofCodes(int groupCount, int... codes) {
    Preconditions.checkConfig(groupCount >= 0, () -> "negative group count " + groupCount);
    return new CodeKeys(codes.clone(), groupCount);
  }

  public abstract int getLength();

  abstract boolean isMissing(int row);

  /**
   * The normalized value at {@code row}. Only valid when the row is not missing.
   */
  abstract Object get(int row);

  /**
   * Bring an expected label into the same normalized form as {@link #get(int)}, or return
   * null if no value of this column could ever be equal to it.
   */
  abstract Object normalize(Object label);

  /**
   * True if {@link #getDouble(int)} is supported, which bin based grouping needs.
   */
  boolean isNumeric() {
    return false;
  }

  double getDouble(int row) {
    throw new GroupByConfigurationException(getClass().getSimpleName()
        + " cannot be grouped into numeric bins");
  }

  Comparator<Object> ordering() {
    return (a, b) -> {
      if (!(a instanceof Comparable)) {
        throw unsortable(a, b, null);
      }
      @SuppressWarnings("unchecked")
      Comparable<Object> comparable = (Comparable<Object>) a;
      try {
        return comparable.compareTo(b);
      } catch (ClassCastException e) {
        throw unsortable(a, b, e);
      }
    };
  }

  private static GroupByConfigurationException unsortable(Object a, Object b, Throwable cause) {
    return new GroupByConfigurationException("keys of type " + a.getClass().getName()
        + " and " + b.getClass().getName() + " cannot be sorted; use SortPolicy.FIRST_SEEN",
        cause);
  }

  private static Double normalizeDouble(double value) {
    // -0.0 and 0.0 are the same group
    return value + 0.0;
  }

  static final class DoubleKeys extends KeyColumn {
    private final double[] values;

    DoubleKeys(double[] values) {
      this.values = values;
    }

    @Override
    public int getLength() {
      return values.length;
    }

    @Override
    boolean isMissing(int row) {
      return Double.isNaN(values[row]);
    }

    @Override
    Object get(int row) {
      return normalizeDouble(values[row]);
    }

    @Override
    Object normalize(Object label) {
      if (label instanceof Number) {
        double d = ((Number) label).doubleValue();
        return Double.isNaN(d) ? null : normalizeDouble(d);
      }
      return null;
    }

    @Override
    boolean isNumeric() {
      return true;
    }

    @Override
    double getDouble(int row) {
      return values[row];
    }
  }

  static final class LongKeys extends KeyColumn {
    private final long[] values;

    LongKeys(long[] values) {
      this.values = values;
    }

    @Override
    public int getLength() {
      return values.length;
    }

    @Override
    boolean isMissing(int row) {
      return false;
    }

    @Override
    Object get(int row) {
      return values[row];
    }

    @Override
    Object normalize(Object label) {
      if (label instanceof Long || label instanceof Integer || label instanceof Short
          || label instanceof Byte) {
        return ((Number) label).longValue();
      } else if (label instanceof Number) {
        double d = ((Number) label).doubleValue();
        if (d == Math.rint(d) && !Double.isInfinite(d)) {
          return (long) d;
        }
      }
      return null;
    }

    @Override
    boolean isNumeric() {
      return true;
    }

    @Override
    double getDouble(int row) {
      return values[row];
    }
  }

  static final class ObjectKeys extends KeyColumn {
    private final Object[] values;

    ObjectKeys(Object[] values) {
      this.values = values;
    }

    @Override
    public int getLength() {
      return values.length;
    }

    @Override
    boolean isMissing(int row) {
      Object v = values[row];
      return v == null
          || (v instanceof Double && ((Double) v).isNaN())
          || (v instanceof Float && ((Float) v).isNaN());
    }

    @Override
    Object get(int row) {
      return values[row];
    }

    @Override
    Object normalize(Object label) {
      return label;
    }
  }

  static final class CodeKeys extends KeyColumn {
    private final int[] codes;
    private final int groupCount;

    CodeKeys(int[] codes, int groupCount) {
      this.codes = codes;
      this.groupCount = groupCount;
    }

    int getGroupCount() {
      return groupCount;
    }

    int code(int row) {
      return isMissing(row) ? Factorizer.MISSING : codes[row];
    }

    @Override
    public int getLength() {
      return codes.length;
    }

    @Override
    boolean isMissing(int row) {
      return codes[row] < 0 || codes[row] >= groupCount;
    }

    @Override
    Object get(int row) {
      return codes[row];
    }

    @Override
    Object normalize(Object label) {
      return label instanceof Integer ? label : null;
    }
  }
}

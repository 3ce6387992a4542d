/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The groups a key is expected to have, fixed before looking at the data.
 * <p>
 * Supplying expected groups makes the output shape and order independent of the data: a code
 * is the position of the label (or bin) in this enumeration, and values that match nothing
 * are excluded from every group. It is also the only way to reduce keys that may be entirely
 * missing.
 */
public final class ExpectedGroups {
  enum Kind {
    NONE,
    LABELS,
    BINS
  }

  private static final ExpectedGroups NONE = new ExpectedGroups(Kind.NONE,
      Collections.emptyList(), null, true);

  private final Kind kind;
  private final List<Object> labels;
  private final double[] edges;
  private final boolean closedRight;

  private ExpectedGroups(Kind kind, List<Object> labels, double[] edges, boolean closedRight) {
    this.kind = kind;
    this.labels = labels;
    this.edges = edges;
    this.closedRight = closedRight;
  }

  /**
   * Let the data decide which groups exist.
   */
  public static ExpectedGroups none() {
    return NONE;
  }

  /**
   * An explicit enumeration of labels. The code of a label is its position.
   */
  public static ExpectedGroups labels(Object... labels) {
    return labels(Arrays.asList(labels));
  }

  /**
   * An explicit enumeration of labels. The code of a label is its position.
   */
  public static ExpectedGroups labels(List<?> labels) {
    for (Object label : labels) {
      Preconditions.checkConfig(label != null, () -> "expected labels cannot contain null");
    }
    return new ExpectedGroups(Kind.LABELS, Collections.unmodifiableList(new ArrayList<>(labels)),
        null, true);
  }

  /**
   * The integer labels {@code 0 .. count - 1}.
   */
  public static ExpectedGroups range(int count) {
    Preconditions.checkConfig(count >= 0, () -> "negative group count " + count);
    List<Object> labels = new ArrayList<>(count);
    for (long i = 0; i < count; i++) {
      labels.add(i);
    }
    return new ExpectedGroups(Kind.LABELS, Collections.unmodifiableList(labels), null, true);
  }

  /**
   * Right closed bins {@code (e0, e1], (e1, e2], ...}.
   */
  public static ExpectedGroups bins(double... edges) {
    return bins(true, edges);
  }

  /**
   * Bins between consecutive edges, closed on the right ({@code (a, b]}) or on the left
   * ({@code [a, b)}). Edges must be finite and strictly increasing.
   */
  public static ExpectedGroups bins(boolean closedRight, double... edges) {
    Preconditions.checkConfig(edges.length >= 2,
        () -> "at least two bin edges are needed, got " + edges.length);
    for (int i = 0; i < edges.length; i++) {
      final int idx = i;
      Preconditions.checkData(Double.isFinite(edges[i]),
          () -> "bin edge " + idx + " is not finite: " + edges[idx]);
      Preconditions.checkData(i == 0 || edges[i] > edges[i - 1],
          () -> "bin edges must be strictly increasing: " + Arrays.toString(edges));
    }
    double[] copy = edges.clone();
    List<Object> labels = new ArrayList<>(edges.length - 1);
    for (int i = 0; i + 1 < copy.length; i++) {
      labels.add(new Bin(copy[i], copy[i + 1], closedRight));
    }
    return new ExpectedGroups(Kind.BINS, Collections.unmodifiableList(labels), copy, closedRight);
  }

  Kind getKind() {
    return kind;
  }

  public boolean isNone() {
    return kind == Kind.NONE;
  }

  public boolean isBins() {
    return kind == Kind.BINS;
  }

  /**
   * The labels of the expected groups in code order. Bins are represented by {@link Bin}.
   */
  public List<Object> getLabels() {
    return labels;
  }

  public int size() {
    return labels.size();
  }

  /**
   * The bin of {@code value}, or {@link Factorizer#MISSING} if it falls outside every bin.
   */
  int binOf(double value) {
    assert kind == Kind.BINS;
    if (Double.isNaN(value)) {
      return Factorizer.MISSING;
    }
    int nbins = edges.length - 1;
    int idx = Arrays.binarySearch(edges, value);
    int bin;
    if (idx >= 0) {
      // exactly on an edge
      bin = closedRight ? idx - 1 : idx;
    } else {
      bin = -idx - 2;
    }
    return bin >= 0 && bin < nbins ? bin : Factorizer.MISSING;
  }

  /**
   * One interval of a bin based grouping.
   */
  public static final class Bin implements Comparable<Bin> {
    private final double left;
    private final double right;
    private final boolean closedRight;

    public Bin(double left, double right, boolean closedRight) {
      this.left = left;
      this.right = right;
      this.closedRight = closedRight;
    }

    public double getLeft() {
      return left;
    }

    public double getRight() {
      return right;
    }

    public boolean isClosedRight() {
      return closedRight;
    }

    @Override
    public int compareTo(Bin o) {
      return Double.compare(left, o.left);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      } else if (o instanceof Bin) {
        Bin b = (Bin) o;
        return left == b.left && right == b.right && closedRight == b.closedRight;
      }
      return false;
    }

    @Override
    public int hashCode() {
      return Objects.hash(left, right, closedRight);
    }

    @Override
    public String toString() {
      return closedRight ? "(" + left + ", " + right + "]" : "[" + left + ", " + right + ")";
    }
  }
}

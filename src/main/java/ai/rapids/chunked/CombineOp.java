/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import java.util.Objects;

/**
 * How partial results of an {@link AggregationBlueprint} are merged: either a named binary op
 * applied slot by slot, or one {@link PartialCombiner} spanning every slot.
 */
public final class CombineOp {

  /**
   * Associative and commutative binary operations on a single intermediate slot.
   */
  public enum Binary {
    SUM {
      @Override
      double apply(double a, double b) {
        return a + b;
      }
    },
    PROD {
      @Override
      double apply(double a, double b) {
        return a * b;
      }
    },
    MIN {
      @Override
      double apply(double a, double b) {
        return Math.min(a, b);
      }
    },
    MAX {
      @Override
      double apply(double a, double b) {
        return Math.max(a, b);
      }
    },
    ANY {
      @Override
      double apply(double a, double b) {
        return a != 0 || b != 0 ? 1 : 0;
      }
    },
    ALL {
      @Override
      double apply(double a, double b) {
        return a != 0 && b != 0 ? 1 : 0;
      }
    };

    abstract double apply(double a, double b);
  }

  private final String name;
  private final Binary binary;
  private final PartialCombiner combiner;

  private CombineOp(String name, Binary binary, PartialCombiner combiner) {
    this.name = name;
    this.binary = binary;
    this.combiner = combiner;
  }

  public static CombineOp of(Binary op) {
    return new CombineOp(op.name().toLowerCase(java.util.Locale.ROOT), op, null);
  }

  /**
   * A combiner that sees every slot of a cell at once.
   */
  public static CombineOp custom(String name, PartialCombiner combiner) {
    return new CombineOp(Objects.requireNonNull(name, "name"), null,
        Objects.requireNonNull(combiner, "combiner"));
  }

  public String getName() {
    return name;
  }

  public boolean isCustom() {
    return combiner != null;
  }

  /**
   * The slot-wise op, or null for a custom combiner.
   */
  public Binary getBinary() {
    return binary;
  }

  public PartialCombiner getCombiner() {
    return combiner;
  }

  @Override
  public int hashCode() {
    return binary != null ? binary.hashCode() : combiner.hashCode();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    } else if (other instanceof CombineOp) {
      CombineOp o = (CombineOp) other;
      return binary == o.binary && Objects.equals(combiner, o.combiner);
    }
    return false;
  }

  @Override
  public String toString() {
    return name;
  }
}

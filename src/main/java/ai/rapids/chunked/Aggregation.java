/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import static ai.rapids.chunked.AggregationBlueprint.ResultType.FLOATING;
import static ai.rapids.chunked.AggregationBlueprint.ResultType.SAME_AS_INPUT;
import static ai.rapids.chunked.AggregationBlueprint.ResultType.SUM_LIKE;

/**
 * Represents a built-in aggregation operation. Instances are cheap value objects; the
 * {@link AggregationBlueprint} that actually drives a reduction is created from them on
 * demand.
 */
abstract class Aggregation {

  /*
   * The built-in aggregations. Visible for testing.
   */
  enum Kind {
    SUM,
    PRODUCT,
    MIN,
    MAX,
    COUNT,
    ANY,
    ALL,
    MEAN,
    VARIANCE, // This can take a delta degrees of freedom
    STD, // This can take a delta degrees of freedom
    MEDIAN,
    QUANTILE,
    ARGMAX,
    ARGMIN,
    FIRST,
    LAST,
    MODE
  }

  /**
   * An Aggregation that only needs a kind and a NaN policy.
   */
  private static class NaNPolicyAggregation extends Aggregation {
    private final NaNPolicy nanPolicy;

    NaNPolicyAggregation(Kind kind, NaNPolicy nanPolicy) {
      super(kind);
      this.nanPolicy = nanPolicy;
    }

    @Override
    AggregationBlueprint createBlueprint() {
      boolean skip = nanPolicy == NaNPolicy.EXCLUDE;
      String name = (skip ? "nan" : "") + kind.name().toLowerCase(java.util.Locale.ROOT);
      AggregationBlueprint.Builder b = AggregationBlueprint.builder(name).nanPolicy(nanPolicy);
      switch (kind) {
        case SUM:
          return b.chunkOps(op(skip ? KernelOp.NANSUM : KernelOp.SUM))
              .combineOps(CombineOp.of(CombineOp.Binary.SUM))
              .fillValues(0)
              .finalFillValue(0)
              .resultType(SUM_LIKE)
              .build();
        case PRODUCT:
          return b.chunkOps(op(skip ? KernelOp.NANPROD : KernelOp.PROD))
              .combineOps(CombineOp.of(CombineOp.Binary.PROD))
              .fillValues(1)
              .finalFillValue(1)
              .resultType(SUM_LIKE)
              .build();
        case MIN:
          return b.chunkOps(op(skip ? KernelOp.NANMIN : KernelOp.MIN))
              .combineOps(CombineOp.of(CombineOp.Binary.MIN))
              .fillValues(Double.POSITIVE_INFINITY)
              .resultType(SAME_AS_INPUT)
              .build();
        case MAX:
          return b.chunkOps(op(skip ? KernelOp.NANMAX : KernelOp.MAX))
              .combineOps(CombineOp.of(CombineOp.Binary.MAX))
              .fillValues(Double.NEGATIVE_INFINITY)
              .resultType(SAME_AS_INPUT)
              .build();
        case COUNT:
          return b.chunkOps(op(skip ? KernelOp.NANCOUNT : KernelOp.COUNT))
              .combineOps(CombineOp.of(CombineOp.Binary.SUM))
              .fillValues(0)
              .intermediateTypes(DType.INT64)
              .finalFillValue(0)
              .resultDType(DType.INT64)
              .build();
        case ANY:
          return b.chunkOps(op(skip ? KernelOp.NANANY : KernelOp.ANY))
              .combineOps(CombineOp.of(CombineOp.Binary.ANY))
              .fillValues(0)
              .intermediateTypes(DType.BOOL8)
              .finalFillValue(0)
              .resultDType(DType.BOOL8)
              .build();
        case ALL:
          return b.chunkOps(op(skip ? KernelOp.NANALL : KernelOp.ALL))
              .combineOps(CombineOp.of(CombineOp.Binary.ALL))
              .fillValues(1)
              .intermediateTypes(DType.BOOL8)
              .finalFillValue(1)
              .resultDType(DType.BOOL8)
              .build();
        case MEAN:
          return b.chunkOps(op(skip ? KernelOp.NANSUM : KernelOp.SUM),
                  op(skip ? KernelOp.NANCOUNT : KernelOp.COUNT))
              .combineOps(CombineOp.of(CombineOp.Binary.SUM), CombineOp.of(CombineOp.Binary.SUM))
              .fillValues(0, 0)
              .intermediateTypes(DType.FLOAT64, DType.INT64)
              .finalizer(MEAN_FINALIZER)
              .resultType(FLOATING)
              .build();
        case ARGMIN:
        case ARGMAX: {
          boolean isMin = kind == Kind.ARGMIN;
          KernelOp value = isMin ? (skip ? KernelOp.NANMIN : KernelOp.MIN)
              : (skip ? KernelOp.NANMAX : KernelOp.MAX);
          KernelOp position = isMin ? (skip ? KernelOp.NANARGMIN : KernelOp.ARGMIN)
              : (skip ? KernelOp.NANARGMAX : KernelOp.ARGMAX);
          return b.chunkOps(op(value), op(position))
              .combineOps(CombineOp.custom(name, new ArgExtremeCombiner(isMin)))
              .fillValues(Double.NaN, -1)
              .finalizer(Finalizer.slot(1))
              .finalFillValue(-1)
              .resultDType(DType.INT64)
              .build();
        }
        case FIRST:
        case LAST: {
          boolean first = kind == Kind.FIRST;
          KernelOp value = first ? (skip ? KernelOp.NANFIRST : KernelOp.FIRST)
              : (skip ? KernelOp.NANLAST : KernelOp.LAST);
          KernelOp position = first ? (skip ? KernelOp.NANARGFIRST : KernelOp.ARGFIRST)
              : (skip ? KernelOp.NANARGLAST : KernelOp.ARGLAST);
          return b.chunkOps(op(value), op(position))
              .combineOps(CombineOp.custom(name, new PositionCombiner(first)))
              .fillValues(Double.NaN, -1)
              .resultType(SAME_AS_INPUT)
              .build();
        }
        case MEDIAN:
          return b.chunkOps(op(skip ? KernelOp.NANMEDIAN : KernelOp.MEDIAN))
              .fillValues(Double.NaN)
              .resultType(FLOATING)
              .build();
        case MODE:
          return b.chunkOps(op(skip ? KernelOp.NANMODE : KernelOp.MODE))
              .fillValues(Double.NaN)
              .resultType(SAME_AS_INPUT)
              .build();
        default:
          throw new IllegalStateException("Unexpected aggregation kind " + kind);
      }
    }

    @Override
    public int hashCode() {
      return 31 * kind.hashCode() + nanPolicy.hashCode();
    }

    @Override
    public boolean equals(Object other) {
      if (this == other) {
        return true;
      } else if (other instanceof NaNPolicyAggregation) {
        NaNPolicyAggregation o = (NaNPolicyAggregation) other;
        return o.kind == this.kind && o.nanPolicy == this.nanPolicy;
      }
      return false;
    }
  }

  private static class DdofAggregation extends Aggregation {
    private final int ddof;
    private final NaNPolicy nanPolicy;

    DdofAggregation(Kind kind, int ddof, NaNPolicy nanPolicy) {
      super(kind);
      this.ddof = ddof;
      this.nanPolicy = nanPolicy;
    }

    @Override
    AggregationBlueprint createBlueprint() {
      boolean skip = nanPolicy == NaNPolicy.EXCLUDE;
      boolean std = kind == Kind.STD;
      String name = (skip ? "nan" : "") + (std ? "std" : "var");
      final int dof = ddof;
      Finalizer finalizer = slots -> {
        double n = slots[0] - dof;
        if (n <= 0) {
          return Double.NaN;
        }
        double var = slots[2] / n;
        return std ? Math.sqrt(var) : var;
      };
      return AggregationBlueprint.builder(name)
          .nanPolicy(nanPolicy)
          .chunkOps(op(skip ? KernelOp.NANCOUNT : KernelOp.COUNT),
              op(skip ? KernelOp.NANMEAN : KernelOp.MEAN),
              op(skip ? KernelOp.NANM2 : KernelOp.M2))
          .combineOps(CombineOp.custom(name, VARIANCE_COMBINER))
          .fillValues(0, Double.NaN, Double.NaN)
          .intermediateTypes(DType.INT64, DType.FLOAT64, DType.FLOAT64)
          .finalizer(finalizer)
          .resultType(FLOATING)
          .build();
    }

    @Override
    public int hashCode() {
      return 31 * (31 * kind.hashCode() + ddof) + nanPolicy.hashCode();
    }

    @Override
    public boolean equals(Object other) {
      if (this == other) {
        return true;
      } else if (other instanceof DdofAggregation) {
        DdofAggregation o = (DdofAggregation) other;
        return o.kind == this.kind && o.ddof == this.ddof && o.nanPolicy == this.nanPolicy;
      }
      return false;
    }
  }

  private static final class QuantileAggregation extends Aggregation {
    private final QuantileMethod method;
    private final double quantile;
    private final NaNPolicy nanPolicy;

    QuantileAggregation(QuantileMethod method, double quantile, NaNPolicy nanPolicy) {
      super(Kind.QUANTILE);
      Preconditions.checkConfig(quantile >= 0 && quantile <= 1,
          () -> "quantile must be in [0, 1], got " + quantile);
      this.method = method;
      this.quantile = quantile;
      this.nanPolicy = nanPolicy;
    }

    @Override
    AggregationBlueprint createBlueprint() {
      String name = (nanPolicy == NaNPolicy.EXCLUDE ? "nan" : "") + "quantile";
      return AggregationBlueprint.builder(name)
          .nanPolicy(nanPolicy)
          .chunkOps(ChunkOp.custom(name + "(" + quantile + ", " + method + ")",
              GroupedKernels.quantile(quantile, method, nanPolicy)))
          .fillValues(Double.NaN)
          .resultType(FLOATING)
          .build();
    }

    @Override
    public int hashCode() {
      return 31 * (31 * method.hashCode() + Double.hashCode(quantile)) + nanPolicy.hashCode();
    }

    @Override
    public boolean equals(Object other) {
      if (this == other) {
        return true;
      } else if (other instanceof QuantileAggregation) {
        QuantileAggregation o = (QuantileAggregation) other;
        return this.method == o.method && this.quantile == o.quantile
            && this.nanPolicy == o.nanPolicy;
      }
      return false;
    }
  }

  private static final Finalizer MEAN_FINALIZER = slots -> slots[0] / slots[1];

  /**
   * Merges (count, mean, M2) triples with the parallel algorithm of Chan et al.
   */
  private static final PartialCombiner VARIANCE_COMBINER = (l, lc, r, rc) -> {
    if (l[0] == 0) {
      return r.clone();
    } else if (r[0] == 0) {
      return l.clone();
    }
    double n = l[0] + r[0];
    double delta = r[1] - l[1];
    double mean = l[1] + delta * r[0] / n;
    double m2 = l[2] + r[2] + delta * delta * l[0] * r[0] / n;
    return new double[]{n, mean, m2};
  };

  /**
   * Merges (value, flat index) pairs of argmin/argmax. NaN beats every number, and equal
   * values resolve to the lowest index so the result does not depend on combine order.
   */
  private static final class ArgExtremeCombiner implements PartialCombiner {
    private final boolean isMin;

    ArgExtremeCombiner(boolean isMin) {
      this.isMin = isMin;
    }

    @Override
    public double[] combine(double[] l, long lc, double[] r, long rc) {
      if (r[1] < 0) {
        return l.clone();
      } else if (l[1] < 0) {
        return r.clone();
      }
      boolean lNaN = Double.isNaN(l[0]);
      boolean rNaN = Double.isNaN(r[0]);
      boolean pickLeft;
      if (lNaN || rNaN) {
        pickLeft = lNaN && (!rNaN || l[1] < r[1]);
      } else if (l[0] == r[0]) {
        pickLeft = l[1] < r[1];
      } else {
        pickLeft = isMin ? l[0] < r[0] : l[0] > r[0];
      }
      return pickLeft ? l.clone() : r.clone();
    }
  }

  /**
   * Merges (value, flat index) pairs of first/last by keeping the lowest or highest index.
   */
  private static final class PositionCombiner implements PartialCombiner {
    private final boolean lowest;

    PositionCombiner(boolean lowest) {
      this.lowest = lowest;
    }

    @Override
    public double[] combine(double[] l, long lc, double[] r, long rc) {
      if (r[1] < 0) {
        return l.clone();
      } else if (l[1] < 0) {
        return r.clone();
      }
      boolean pickLeft = lowest ? l[1] < r[1] : l[1] > r[1];
      return pickLeft ? l.clone() : r.clone();
    }
  }

  private static ChunkOp op(KernelOp kernelOp) {
    return ChunkOp.named(kernelOp);
  }

  protected final Kind kind;

  protected Aggregation(Kind kind) {
    this.kind = kind;
  }

  /**
   * Build the blueprint that executes this aggregation.
   */
  abstract AggregationBlueprint createBlueprint();

  @Override
  public abstract int hashCode();

  @Override
  public abstract boolean equals(Object other);

  static Aggregation of(Kind kind, NaNPolicy nanPolicy) {
    return new NaNPolicyAggregation(kind, nanPolicy);
  }

  static Aggregation ddof(Kind kind, int ddof, NaNPolicy nanPolicy) {
    Preconditions.checkConfig(ddof >= 0, () -> "ddof must not be negative, got " + ddof);
    return new DdofAggregation(kind, ddof, nanPolicy);
  }

  static Aggregation quantile(QuantileMethod method, double quantile, NaNPolicy nanPolicy) {
    return new QuantileAggregation(method, quantile, nanPolicy);
  }
}

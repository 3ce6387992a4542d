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
 * A declarative description of a grouped reduction, split the way a chunked reduction needs
 * it: chunk-local ops producing intermediate slots, combine ops merging partial results, and a
 * finalizer producing the user visible value. Pure data, validated once at construction.
 * <p>
 * A blueprint with chunk ops but no combine ops is legal but not parallelizable: it can only
 * be run with {@link ReductionMethod#BLOCKWISE}, where every group lives in a single chunk.
 */
public final class AggregationBlueprint {

  /**
   * How the type of the final result follows the type of the input.
   */
  public enum ResultType {
    /** Same type as the input. */
    SAME_AS_INPUT,
    /** Integral and boolean inputs widen to INT64, floating point stays as is. */
    SUM_LIKE,
    /** FLOAT32 stays FLOAT32, everything else becomes FLOAT64. */
    FLOATING,
    /** A fixed type, see {@link Builder#resultDType(DType)}. */
    FIXED
  }

  private final String name;
  private final List<ChunkOp> chunkOps;
  private final List<CombineOp> combineOps;
  private final Finalizer finalizer;
  private final double[] fillValues;
  private final List<DType> intermediateTypes;
  private final double finalFillValue;
  private final ResultType resultType;
  private final DType fixedType;
  private final int minCount;
  private final NaNPolicy nanPolicy;

  private AggregationBlueprint(Builder b) {
    this.name = b.name;
    this.chunkOps = Collections.unmodifiableList(new ArrayList<>(b.chunkOps));
    this.combineOps = Collections.unmodifiableList(new ArrayList<>(b.combineOps));
    this.finalizer = b.finalizer;
    this.fillValues = b.fillValues.clone();
    this.intermediateTypes = Collections.unmodifiableList(new ArrayList<>(b.intermediateTypes));
    this.finalFillValue = b.finalFillValue;
    this.resultType = b.resultType;
    this.fixedType = b.fixedType;
    this.minCount = b.minCount;
    this.nanPolicy = b.nanPolicy;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * A builder pre-populated with every setting of this blueprint.
   */
  public Builder toBuilder() {
    Builder b = new Builder(name);
    b.chunkOps.addAll(chunkOps);
    b.combineOps.addAll(combineOps);
    b.finalizer = finalizer;
    b.fillValues = fillValues.clone();
    b.intermediateTypes.addAll(intermediateTypes);
    b.finalFillValue = finalFillValue;
    b.resultType = resultType;
    b.fixedType = fixedType;
    b.minCount = minCount;
    b.nanPolicy = nanPolicy;
    return b;
  }

  /**
   * The same blueprint with a different value for groups without enough contributions.
   */
  public AggregationBlueprint withFinalFillValue(double fillValue) {
    return toBuilder().finalFillValue(fillValue).build();
  }

  /**
   * The same blueprint requiring at least {@code minCount} contributing elements per group.
   */
  public AggregationBlueprint withMinCount(int minCount) {
    return toBuilder().minCount(minCount).build();
  }

  public String getName() {
    return name;
  }

  public List<ChunkOp> getChunkOps() {
    return chunkOps;
  }

  public List<CombineOp> getCombineOps() {
    return combineOps;
  }

  public Finalizer getFinalizer() {
    return finalizer;
  }

  /**
   * The number of intermediate values kept per group.
   */
  public int getSlotCount() {
    return chunkOps.size();
  }

  /**
   * The value a chunk op produces for a group without elements in the chunk.
   */
  public double getFillValue(int slot) {
    return fillValues[slot];
  }

  public double[] getFillValues() {
    return fillValues.clone();
  }

  /**
   * The type of an intermediate slot, which defaults to the input type.
   */
  public DType getIntermediateType(int slot, DType inputType) {
    return intermediateTypes.isEmpty() ? inputType : intermediateTypes.get(slot);
  }

  public double getFinalFillValue() {
    return finalFillValue;
  }

  public int getMinCount() {
    return minCount;
  }

  /**
   * Which elements count as contributing to a group.
   */
  public NaNPolicy getNaNPolicy() {
    return nanPolicy;
  }

  public boolean isParallelizable() {
    return !combineOps.isEmpty();
  }

  boolean hasCustomCombine() {
    return combineOps.size() == 1 && combineOps.get(0).isCustom();
  }

  /**
   * Fail if this blueprint cannot run with {@code method}.
   */
  public void validateFor(ReductionMethod method) {
    if (method.needsCombine()) {
      Preconditions.checkConfig(isParallelizable(),
          () -> "aggregation " + name + " has no combine ops and cannot run with " + method
              + "; only the blockwise method is possible");
    }
  }

  /**
   * Fail if a chunk op cannot handle input of {@code inputType}.
   */
  public void validateInput(DType inputType) {
    for (ChunkOp op : chunkOps) {
      Preconditions.checkConfig(op.supports(inputType),
          () -> "aggregation " + name + " does not support " + inputType + " input (" + op + ")");
    }
  }

  /**
   * The type of the finalized values for input of {@code inputType}, widened to FLOAT64 if
   * the final fill value is NaN and the type cannot hold it.
   */
  public DType getResultType(DType inputType) {
    DType ret;
    switch (resultType) {
      case SUM_LIKE:
        ret = inputType.isFloatingPoint() ? inputType : DType.INT64;
        break;
      case FLOATING:
        ret = inputType.equals(DType.FLOAT32) ? DType.FLOAT32 : DType.FLOAT64;
        break;
      case FIXED:
        ret = fixedType;
        break;
      default:
        ret = inputType;
    }
    return ret.promoteForFill(finalFillValue);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, chunkOps, combineOps, Arrays.hashCode(fillValues), finalFillValue,
        minCount, nanPolicy);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    } else if (other instanceof AggregationBlueprint) {
      AggregationBlueprint o = (AggregationBlueprint) other;
      return name.equals(o.name) && chunkOps.equals(o.chunkOps)
          && combineOps.equals(o.combineOps) && finalizer.equals(o.finalizer)
          && Arrays.equals(fillValues, o.fillValues)
          && intermediateTypes.equals(o.intermediateTypes)
          && Double.compare(finalFillValue, o.finalFillValue) == 0
          && resultType == o.resultType && Objects.equals(fixedType, o.fixedType)
          && minCount == o.minCount && nanPolicy == o.nanPolicy;
    }
    return false;
  }

  @Override
  public String toString() {
    return "AggregationBlueprint{" + name + ", chunk=" + chunkOps + ", combine=" + combineOps
        + ", fill=" + Arrays.toString(fillValues) + ", finalFill=" + finalFillValue + "}";
  }

  public static final class Builder {
    private final String name;
    private final List<ChunkOp> chunkOps = new ArrayList<>();
    private final List<CombineOp> combineOps = new ArrayList<>();
    private final List<DType> intermediateTypes = new ArrayList<>();
    private Finalizer finalizer = Finalizer.slot(0);
    private double[] fillValues = new double[0];
    private double finalFillValue = Double.NaN;
    private ResultType resultType = ResultType.SAME_AS_INPUT;
    private DType fixedType = null;
    private int minCount = 0;
    private NaNPolicy nanPolicy = NaNPolicy.INCLUDE;

    private Builder(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Append chunk ops, one per intermediate slot.
     */
    public Builder chunkOps(ChunkOp... ops) {
      chunkOps.addAll(Arrays.asList(ops));
      return this;
    }

    /**
     * Append combine ops: one slot-wise op per chunk op, or a single custom op.
     */
    public Builder combineOps(CombineOp... ops) {
      combineOps.addAll(Arrays.asList(ops));
      return this;
    }

    /**
     * The value of each intermediate slot for a group without elements in a chunk.
     */
    public Builder fillValues(double... fills) {
      this.fillValues = fills.clone();
      return this;
    }

    public Builder intermediateTypes(DType... types) {
      intermediateTypes.clear();
      intermediateTypes.addAll(Arrays.asList(types));
      return this;
    }

    public Builder finalizer(Finalizer finalizer) {
      this.finalizer = Objects.requireNonNull(finalizer, "finalizer");
      return this;
    }

    /**
     * The result of a group without enough contributing elements. Defaults to NaN.
     */
    public Builder finalFillValue(double fillValue) {
      this.finalFillValue = fillValue;
      return this;
    }

    public Builder resultType(ResultType resultType) {
      Preconditions.checkConfig(resultType != ResultType.FIXED,
          () -> "use resultDType to set a fixed result type");
      this.resultType = resultType;
      this.fixedType = null;
      return this;
    }

    public Builder resultDType(DType type) {
      this.resultType = ResultType.FIXED;
      this.fixedType = Objects.requireNonNull(type, "type");
      return this;
    }

    public Builder minCount(int minCount) {
      this.minCount = minCount;
      return this;
    }

    public Builder nanPolicy(NaNPolicy nanPolicy) {
      this.nanPolicy = Objects.requireNonNull(nanPolicy, "nanPolicy");
      return this;
    }

    public AggregationBlueprint build() {
      Preconditions.checkConfig(!chunkOps.isEmpty(),
          () -> "aggregation " + name + " needs at least one chunk op");
      Preconditions.checkConfig(chunkOps.size() == fillValues.length,
          () -> "aggregation " + name + " has " + chunkOps.size() + " chunk ops but "
              + fillValues.length + " fill values");
      Preconditions.checkConfig(intermediateTypes.isEmpty()
              || intermediateTypes.size() == chunkOps.size(),
          () -> "aggregation " + name + " has " + chunkOps.size() + " chunk ops but "
              + intermediateTypes.size() + " intermediate types");
      boolean anyCustom = combineOps.stream().anyMatch(CombineOp::isCustom);
      if (anyCustom) {
        Preconditions.checkConfig(combineOps.size() == 1,
            () -> "aggregation " + name + " mixes a custom combine op with other combine ops");
      } else {
        Preconditions.checkConfig(combineOps.isEmpty() || combineOps.size() == chunkOps.size(),
            () -> "aggregation " + name + " has " + chunkOps.size() + " chunk ops but "
                + combineOps.size() + " combine ops");
      }
      Preconditions.checkConfig(minCount >= 0,
          () -> "aggregation " + name + " has a negative min count " + minCount);
      return new AggregationBlueprint(this);
    }
  }
}

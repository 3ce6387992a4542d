/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import java.util.Objects;

/**
 * The chunk-local operation that produces one intermediate slot of an
 * {@link AggregationBlueprint}: either a named kernel from {@link GroupedKernels} or a custom
 * {@link GroupedKernel}.
 * <p>
 * A positional op returns positions inside the chunk instead of values; the executor turns
 * them into flat indices along the reduced axis before any combine step sees them.
 */
public final class ChunkOp {
  private final String name;
  private final KernelOp kernelOp;
  private final GroupedKernel kernel;
  private final boolean positional;

  private ChunkOp(String name, KernelOp kernelOp, GroupedKernel kernel, boolean positional) {
    this.name = Objects.requireNonNull(name, "name");
    this.kernelOp = kernelOp;
    this.kernel = Objects.requireNonNull(kernel, "kernel");
    this.positional = positional;
  }

  /**
   * A named built-in kernel.
   */
  public static ChunkOp named(KernelOp op) {
    return new ChunkOp(op.name().toLowerCase(java.util.Locale.ROOT), op, op.kernel(),
        op.isPositional());
  }

  /**
   * A user supplied kernel.
   * @param name used in task labels and error messages.
   */
  public static ChunkOp custom(String name, GroupedKernel kernel) {
    return new ChunkOp(name, null, kernel, false);
  }

  /**
   * The same op, marked as returning positions inside the chunk.
   */
  public ChunkOp asPositional() {
    return new ChunkOp(name, kernelOp, kernel, true);
  }

  public String getName() {
    return name;
  }

  public boolean isNamed() {
    return kernelOp != null;
  }

  /**
   * The built-in op, or null for a custom kernel.
   */
  public KernelOp getKernelOp() {
    return kernelOp;
  }

  public GroupedKernel getKernel() {
    return kernel;
  }

  public boolean isPositional() {
    return positional;
  }

  boolean supports(DType type) {
    return kernelOp == null || kernelOp.supports(type);
  }

  @Override
  public int hashCode() {
    return kernelOp != null ? kernelOp.hashCode() : 31 * name.hashCode() + kernel.hashCode();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    } else if (other instanceof ChunkOp) {
      ChunkOp o = (ChunkOp) other;
      if (kernelOp != null || o.kernelOp != null) {
        return kernelOp == o.kernelOp && positional == o.positional;
      }
      return name.equals(o.name) && kernel.equals(o.kernel) && positional == o.positional;
    }
    return false;
  }

  @Override
  public String toString() {
    return positional ? name + "(positional)" : name;
  }
}
